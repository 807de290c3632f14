package cockpit.jobs.worker;

import java.util.Map;

/**
 * Executable logic of one job type.
 *
 * Handlers report semantic failures with
 * {@link cockpit.jobs.error.JobExecutionException} and worker-level
 * problems that deserve another attempt with
 * {@link cockpit.jobs.error.TransientWorkerException}. Long-running handlers
 * call {@link JobContext#checkpoint()} between steps so cancellation is
 * observed.
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * @return job-type-specific result stored on the run
     */
    Map<String, Object> execute(JobContext context) throws InterruptedException;
}
