package cockpit.jobs.api.v1.dto;

import cockpit.jobs.backend.BackendStats;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("schedulerRunning") Boolean schedulerRunning,
        @JsonProperty("backend") BackendStats backend,
        @JsonProperty("runs") Map<String, Integer> runs,
        @JsonProperty("trackedRuns") Integer trackedRuns) {

    public static HealthResponse healthy(String uptime, String version, boolean schedulerRunning,
            BackendStats backend, Map<String, Integer> runs, int trackedRuns) {
        return new HealthResponse("healthy", "ok", uptime, version, schedulerRunning, backend, runs, trackedRuns);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null);
    }
}
