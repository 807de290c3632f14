package cockpit.jobs.error;

import cockpit.jobs.model.RunErrorCode;

/**
 * Worker-level failure (lost connection, crashed dependency) that the backend
 * may redeliver until the attempt limit is reached.
 */
public class TransientWorkerException extends JobsException {

    public TransientWorkerException(String message) {
        super(RunErrorCode.TRANSIENT_WORKER_ERROR.code(), message);
    }

    public TransientWorkerException(String message, Throwable cause) {
        super(RunErrorCode.TRANSIENT_WORKER_ERROR.code(), message, cause);
    }
}
