package cockpit.jobs.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a job run.
 */
public enum RunStatus {
    /** Run recorded, waiting for a worker */
    QUEUED,
    /** A worker accepted the run and is executing it */
    RUNNING,
    /** Worker finished without error */
    SUCCEEDED,
    /** Dispatch, execution or reconciliation failure */
    FAILED,
    /** Cancelled before or during execution */
    CANCELLED;

    private static final Set<RunStatus> ACTIVE = EnumSet.of(QUEUED, RUNNING);

    public boolean isTerminal() {
        return !ACTIVE.contains(this);
    }

    /** States a run can still leave. */
    public static Set<RunStatus> active() {
        return EnumSet.copyOf(ACTIVE);
    }
}
