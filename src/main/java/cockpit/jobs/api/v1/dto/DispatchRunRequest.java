package cockpit.jobs.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for triggering a run.
 * POST /api/v1/job-runs (template or ad hoc), POST /api/v1/schedules/{id}/run
 */
public record DispatchRunRequest(
        @JsonProperty("templateId") String templateId,
        @JsonProperty("jobName") String jobName,
        @JsonProperty("jobType") String jobType,
        @JsonProperty("parameters") Map<String, Object> parameters,
        @JsonProperty("targetDevices") List<String> targetDevices) {
}
