package cockpit.jobs.api.v1.dto;

import cockpit.jobs.model.ProgressSnapshot;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Live progress of a running job.
 * GET /api/v1/job-runs/{id}/progress
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressResponse(
        @JsonProperty("runId") String runId,
        @JsonProperty("percent") int percent,
        @JsonProperty("step") String step,
        @JsonProperty("currentStep") Integer currentStep,
        @JsonProperty("totalSteps") Integer totalSteps,
        @JsonProperty("updatedAt") Instant updatedAt) {

    public static ProgressResponse from(ProgressSnapshot s) {
        return new ProgressResponse(s.runId(), s.percent(), s.step(), s.currentStep(), s.totalSteps(),
                s.updatedAt());
    }
}
