package cockpit.jobs.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * POST /api/v1/job-runs/progress
 */
public record BatchProgressRequest(
        @JsonProperty("runIds") List<String> runIds) {

    public static final int MAX_RUN_IDS = 500;

    public void validate() {
        if (runIds == null) {
            throw new IllegalArgumentException("runIds is required");
        }
        if (runIds.size() > MAX_RUN_IDS) {
            throw new IllegalArgumentException("at most " + MAX_RUN_IDS + " runIds per request");
        }
    }
}
