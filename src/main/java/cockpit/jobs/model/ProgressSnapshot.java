package cockpit.jobs.model;

import java.time.Instant;

/**
 * Point-in-time progress of a running job. Lives only in memory.
 *
 * @param currentStep null when the worker reports only a percentage
 * @param totalSteps  null when unknown
 */
public record ProgressSnapshot(
        String runId,
        int percent,
        String step,
        Integer currentStep,
        Integer totalSteps,
        Instant updatedAt) {
}
