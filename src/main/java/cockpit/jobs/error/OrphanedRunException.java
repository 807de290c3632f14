package cockpit.jobs.error;

import cockpit.jobs.model.RunErrorCode;

import java.time.Instant;

/**
 * Describes a run found stuck by reconciliation. Its message is what gets
 * recorded on the run.
 */
public class OrphanedRunException extends JobsException {

    public OrphanedRunException(String runId, Instant lastSeenAt) {
        super(RunErrorCode.ORPHANED_RUN.code(),
                "Run " + runId + " has no live backend task since " + lastSeenAt);
    }
}
