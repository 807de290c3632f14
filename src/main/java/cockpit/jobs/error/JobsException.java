package cockpit.jobs.error;

/**
 * Base class of the orchestration error taxonomy.
 * Each subclass carries a stable error code that is recorded on runs and
 * returned to HTTP clients.
 */
public class JobsException extends RuntimeException {

    private final String errorCode;

    public JobsException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public JobsException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String errorCode() {
        return errorCode;
    }
}
