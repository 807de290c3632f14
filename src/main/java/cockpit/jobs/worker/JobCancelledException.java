package cockpit.jobs.worker;

/**
 * Thrown from {@link JobContext#checkpoint()} once cancellation was requested.
 * Handlers let it propagate.
 */
public class JobCancelledException extends RuntimeException {

    public JobCancelledException(String runId) {
        super("Run " + runId + " was cancelled");
    }
}
