package cockpit.jobs.api.v1.dto;

import cockpit.jobs.service.ScheduleDraft;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for creating or replacing a job schedule.
 * POST /api/v1/schedules, PUT /api/v1/schedules/{id}
 */
public record ScheduleRequest(
        @JsonProperty("name") String name,
        @JsonProperty("templateId") String templateId,
        @JsonProperty("cronExpression") String cronExpression,
        @JsonProperty("timeZone") String timeZone,
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("parameterOverrides") Map<String, Object> parameterOverrides,
        @JsonProperty("targetDevices") List<String> targetDevices) {

    /** Missing {@code enabled} means enabled */
    public ScheduleDraft toDraft() {
        return new ScheduleDraft(
                name,
                templateId,
                cronExpression,
                timeZone,
                enabled == null || enabled,
                parameterOverrides,
                targetDevices);
    }
}
