package cockpit.jobs.service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A trigger for the dispatcher.
 *
 * Either {@code templateId} is set, or the run is ad hoc and
 * {@code jobName}/{@code jobType} describe it. Scheduled triggers carry the
 * schedule id and the occurrence they fire for.
 */
public record DispatchRequest(
        String templateId,
        String jobName,
        String jobType,
        String triggeredBy,
        Map<String, Object> parameters,
        List<String> targetDevices,
        String scheduleId,
        Instant scheduledFor) {

    public static DispatchRequest forTemplate(String templateId, String triggeredBy,
            Map<String, Object> parameters, List<String> targetDevices) {
        return new DispatchRequest(templateId, null, null, triggeredBy, parameters, targetDevices, null, null);
    }

    public static DispatchRequest adHoc(String jobName, String jobType, String triggeredBy,
            Map<String, Object> parameters, List<String> targetDevices) {
        return new DispatchRequest(null, jobName, jobType, triggeredBy, parameters, targetDevices, null, null);
    }

    public boolean isScheduled() {
        return scheduleId != null && scheduledFor != null;
    }
}
