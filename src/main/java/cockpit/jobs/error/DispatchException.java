package cockpit.jobs.error;

import cockpit.jobs.model.RunErrorCode;

/**
 * Submission to the execution backend failed after the local retry.
 * The affected run is recorded as FAILED with {@code dispatch_error}.
 */
public class DispatchException extends JobsException {

    public DispatchException(String message, Throwable cause) {
        super(RunErrorCode.DISPATCH_ERROR.code(), message, cause);
    }
}
