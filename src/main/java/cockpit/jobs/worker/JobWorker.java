package cockpit.jobs.worker;

import cockpit.jobs.backend.TaskConsumer;
import cockpit.jobs.error.JobExecutionException;
import cockpit.jobs.error.TransientWorkerException;
import cockpit.jobs.model.JobRun;
import cockpit.jobs.model.RunErrorCode;
import cockpit.jobs.model.TransitionResult;
import cockpit.jobs.service.JobRunService;
import cockpit.jobs.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Executes delivered runs, one per worker slot.
 *
 * Flow per delivery: mark the run started → look up the handler → execute →
 * record the terminal state. A run that is already terminal (cancelled while
 * queued, failed by reconciliation) is acknowledged without executing.
 */
public class JobWorker implements TaskConsumer {

    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    /** Backend routing key for job runs */
    public static final String TASK_TYPE = "cockpit.jobs.execute";

    private final JobTypeRegistry registry;
    private final JobRunService runService;
    private final String workerName;
    private final int maxAttempts;
    private final Duration heartbeatInterval;

    public JobWorker(JobTypeRegistry registry, JobRunService runService, String workerName,
            int maxAttempts, Duration heartbeatInterval) {
        this.registry = registry;
        this.runService = runService;
        this.workerName = workerName;
        this.maxAttempts = maxAttempts;
        this.heartbeatInterval = heartbeatInterval;
    }

    @Override
    public Outcome consume(String externalTaskId, String payload) throws InterruptedException {
        TaskEnvelope envelope;
        try {
            envelope = Json.read(payload, TaskEnvelope.class);
        } catch (IllegalArgumentException e) {
            log.error("Task {} has an unreadable payload, dropping it", externalTaskId, e);
            return Outcome.DONE;
        }

        String runId = envelope.runId();
        TransitionResult started = runService.markStarted(runId, workerName);
        if (started != TransitionResult.APPLIED) {
            log.info("Skipping task {} for run {}: {}", externalTaskId, runId, started);
            return Outcome.DONE;
        }

        Optional<JobRun> current = runService.findById(runId);
        int attempt = current.map(JobRun::attempts).orElse(1);
        if (current.isPresent() && current.get().isCancelRequested()) {
            runService.markCancelled(runId, null);
            return Outcome.DONE;
        }

        Optional<JobHandler> handler = registry.handler(envelope.jobType());
        if (handler.isEmpty()) {
            runService.markFailed(runId, RunErrorCode.EXECUTION_ERROR,
                    "No handler registered for job type: " + envelope.jobType(), null);
            return Outcome.DONE;
        }

        JobContext context = new JobContext(envelope, attempt, runService, heartbeatInterval);
        log.info("Executing run {} ({}) attempt {}/{}", runId, envelope.jobType(), attempt, maxAttempts);

        try {
            Map<String, Object> result = handler.get().execute(context);
            TransitionResult outcome = runService.markSucceeded(runId, result);
            if (outcome != TransitionResult.APPLIED) {
                log.info("Result of run {} not recorded, run is {}", runId, outcome);
            }
        } catch (JobCancelledException e) {
            runService.markCancelled(runId, context.partialResult());
        } catch (TransientWorkerException e) {
            if (attempt < maxAttempts) {
                log.warn("Run {} hit a transient error on attempt {}/{}: {}", runId, attempt, maxAttempts,
                        e.getMessage());
                return Outcome.REDELIVER;
            }
            runService.markFailed(runId, RunErrorCode.EXECUTION_ERROR,
                    "Retries exhausted after " + attempt + " attempts: " + e.getMessage(),
                    context.partialResult());
        } catch (JobExecutionException e) {
            runService.markFailed(runId, e, context.partialResult());
        } catch (RuntimeException e) {
            log.error("Handler for run {} threw", runId, e);
            runService.markFailed(runId, RunErrorCode.EXECUTION_ERROR, e.toString(), context.partialResult());
        }
        return Outcome.DONE;
    }
}
