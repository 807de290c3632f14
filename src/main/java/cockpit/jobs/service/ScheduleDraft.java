package cockpit.jobs.service;

import java.util.List;
import java.util.Map;

/**
 * Editable fields of a job schedule, as submitted by a user.
 */
public record ScheduleDraft(
        String name,
        String templateId,
        String cronExpression,
        String timeZone,
        boolean enabled,
        Map<String, Object> parameterOverrides,
        List<String> targetDevices) {
}
