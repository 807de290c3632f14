package cockpit.jobs.api.v1.dto;

import cockpit.jobs.model.JobSchedule;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a job schedule.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduleResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("templateId") String templateId,
        @JsonProperty("cronExpression") String cronExpression,
        @JsonProperty("timeZone") String timeZone,
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("parameterOverrides") Map<String, Object> parameterOverrides,
        @JsonProperty("targetDevices") List<String> targetDevices,
        @JsonProperty("nextRunAt") Instant nextRunAt,
        @JsonProperty("lastRunId") String lastRunId,
        @JsonProperty("createdBy") String createdBy,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    public static ScheduleResponse from(JobSchedule s) {
        return new ScheduleResponse(
                s.id(),
                s.name(),
                s.templateId(),
                s.cronExpression(),
                s.timeZone(),
                s.isEnabled(),
                s.parameterOverrides(),
                s.targetDevices(),
                s.nextRunAt(),
                s.lastRunId(),
                s.createdBy(),
                s.createdAt(),
                s.updatedAt());
    }
}
