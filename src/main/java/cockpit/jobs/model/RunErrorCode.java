package cockpit.jobs.model;

/**
 * Distinguishable error codes recorded on failed or cancelled runs.
 */
public enum RunErrorCode {
    DISPATCH_ERROR("dispatch_error"),
    EXECUTION_ERROR("execution_error"),
    TRANSIENT_WORKER_ERROR("transient_worker_error"),
    ORPHANED_RUN("orphaned_run"),
    CANCELLED("cancelled");

    private final String code;

    RunErrorCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static RunErrorCode fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (RunErrorCode c : values()) {
            if (c.code.equals(code)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown error code: " + code);
    }
}
