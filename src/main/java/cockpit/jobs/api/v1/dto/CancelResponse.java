package cockpit.jobs.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * POST /api/v1/job-runs/{id}/cancel
 *
 * @param outcome cancelled, cancel_requested or already_terminal
 * @param status  run status after the request
 */
public record CancelResponse(
        @JsonProperty("runId") String runId,
        @JsonProperty("outcome") String outcome,
        @JsonProperty("status") String status) {
}
