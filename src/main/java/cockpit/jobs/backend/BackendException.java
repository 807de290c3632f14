package cockpit.jobs.backend;

/**
 * Failure talking to the execution backend.
 * Transient failures (broker unreachable, queue full) may succeed on retry.
 */
public class BackendException extends RuntimeException {

    private final boolean transientFailure;

    public BackendException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public BackendException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
