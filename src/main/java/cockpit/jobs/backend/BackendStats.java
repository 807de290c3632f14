package cockpit.jobs.backend;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of backend capacity for the health endpoint.
 */
public record BackendStats(
        @JsonProperty("workerSlots") int workerSlots,
        @JsonProperty("activeTasks") int activeTasks,
        @JsonProperty("queuedTasks") int queuedTasks,
        @JsonProperty("completedTasks") long completedTasks,
        @JsonProperty("retainedTasks") int retainedTasks,
        @JsonProperty("evictedTasks") long evictedTasks,
        @JsonProperty("available") boolean available) {
}
