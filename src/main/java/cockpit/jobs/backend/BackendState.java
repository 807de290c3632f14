package cockpit.jobs.backend;

/**
 * Task state as reported by the execution backend.
 */
public enum BackendState {
    PENDING,
    STARTED,
    RETRY,
    SUCCESS,
    FAILURE,
    REVOKED,
    /** The backend has no record of the task id */
    UNKNOWN;

    /** Check if the backend still holds a live task. */
    public boolean isLive() {
        return this == PENDING || this == STARTED || this == RETRY;
    }
}
