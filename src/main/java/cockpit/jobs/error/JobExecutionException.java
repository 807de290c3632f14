package cockpit.jobs.error;

import cockpit.jobs.model.RunErrorCode;

/**
 * Semantic failure reported by job logic. Recorded on the run, never retried.
 */
public class JobExecutionException extends JobsException {

    public JobExecutionException(String message) {
        super(RunErrorCode.EXECUTION_ERROR.code(), message);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(RunErrorCode.EXECUTION_ERROR.code(), message, cause);
    }
}
