package cockpit.jobs.api.v1.dto;

import cockpit.jobs.model.JobRun;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Response DTO for a job run.
 * GET /api/v1/job-runs/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobRunResponse(
        @JsonProperty("id") String id,
        @JsonProperty("jobScheduleId") String jobScheduleId,
        @JsonProperty("jobTemplateId") String jobTemplateId,
        @JsonProperty("externalTaskId") String externalTaskId,
        @JsonProperty("jobName") String jobName,
        @JsonProperty("jobType") String jobType,
        @JsonProperty("status") String status,
        @JsonProperty("triggeredBy") String triggeredBy,
        @JsonProperty("scheduledFor") Instant scheduledFor,
        @JsonProperty("queuedAt") Instant queuedAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("durationMs") Long durationMs,
        @JsonProperty("errorCode") String errorCode,
        @JsonProperty("errorMessage") String errorMessage,
        @JsonProperty("result") Map<String, Object> result,
        @JsonProperty("parameters") Map<String, Object> parameters,
        @JsonProperty("targetDevices") List<String> targetDevices,
        @JsonProperty("executedBy") String executedBy,
        @JsonProperty("attempts") int attempts,
        @JsonProperty("cancelRequested") boolean cancelRequested) {

    public static JobRunResponse from(JobRun run) {
        Duration duration = run.duration();
        return new JobRunResponse(
                run.id(),
                run.scheduleId(),
                run.templateId(),
                run.externalTaskId(),
                run.jobName(),
                run.jobType(),
                run.status().name().toLowerCase(Locale.ROOT),
                run.triggeredBy(),
                run.scheduledFor(),
                run.queuedAt(),
                run.startedAt(),
                run.completedAt(),
                duration != null ? duration.toMillis() : null,
                run.errorCode() != null ? run.errorCode().code() : null,
                run.errorMessage(),
                run.result(),
                run.parameters(),
                run.targetDevices(),
                run.executedBy(),
                run.attempts(),
                run.isCancelRequested());
    }
}
