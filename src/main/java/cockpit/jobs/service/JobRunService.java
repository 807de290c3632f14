package cockpit.jobs.service;

import cockpit.jobs.backend.BackendException;
import cockpit.jobs.backend.ExecutionBackend;
import cockpit.jobs.error.JobsException;
import cockpit.jobs.error.NotFoundException;
import cockpit.jobs.model.CancelResult;
import cockpit.jobs.model.JobRun;
import cockpit.jobs.model.Page;
import cockpit.jobs.model.ProgressSnapshot;
import cockpit.jobs.model.RunErrorCode;
import cockpit.jobs.model.RunQuery;
import cockpit.jobs.model.RunStatus;
import cockpit.jobs.model.TransitionResult;
import cockpit.jobs.repository.JobRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Execution state machine of job runs.
 *
 * Transitions go through conditional updates in the repository, so the
 * first terminal state written wins. The progress tracker follows the
 * transitions: tracking starts when a run starts and ends when it becomes
 * terminal.
 */
public class JobRunService {

    private static final Logger log = LoggerFactory.getLogger(JobRunService.class);

    private final JobRunRepository runRepository;
    private final ExecutionBackend backend;
    private final ProgressTracker progressTracker;
    private final Clock clock;

    public JobRunService(JobRunRepository runRepository, ExecutionBackend backend,
            ProgressTracker progressTracker, Clock clock) {
        this.runRepository = runRepository;
        this.backend = backend;
        this.progressTracker = progressTracker;
        this.clock = clock;
    }

    // ---- Queries ----

    public Optional<JobRun> findById(String runId) {
        return runRepository.findById(runId);
    }

    public JobRun get(String runId) {
        return runRepository.findById(runId)
                .orElseThrow(() -> new NotFoundException("Job run", runId));
    }

    public Page<JobRun> history(RunQuery query) {
        return runRepository.query(query);
    }

    /**
     * QUEUED or RUNNING runs with no sign of life since the cutoff.
     */
    public List<JobRun> findStale(Instant lastSeenBefore) {
        return runRepository.findStale(lastSeenBefore);
    }

    public Map<RunStatus, Integer> countsByStatus() {
        Map<RunStatus, Integer> counts = new EnumMap<>(RunStatus.class);
        for (RunStatus status : RunStatus.values()) {
            counts.put(status, runRepository.countByStatus(status));
        }
        return counts;
    }

    // ---- Transitions ----

    /**
     * QUEUED → RUNNING (or redelivery of a RUNNING run).
     */
    public TransitionResult markStarted(String runId, String executedBy) {
        TransitionResult result = runRepository.markStarted(runId, executedBy, clock.instant());
        if (result == TransitionResult.APPLIED) {
            progressTracker.begin(runId);
            log.debug("Run {} started on {}", runId, executedBy);
        } else {
            log.info("Run {} not started: {}", runId, result);
        }
        return result;
    }

    public TransitionResult markSucceeded(String runId, Map<String, Object> result) {
        TransitionResult outcome = runRepository.markSucceeded(runId, result, clock.instant());
        afterTerminal(runId, RunStatus.SUCCEEDED, outcome);
        return outcome;
    }

    public TransitionResult markFailed(String runId, RunErrorCode code, String message,
            Map<String, Object> partialResult) {
        TransitionResult outcome = runRepository.markFailed(runId, code, message, partialResult, clock.instant());
        afterTerminal(runId, RunStatus.FAILED, outcome);
        if (outcome == TransitionResult.APPLIED) {
            log.warn("Run {} failed [{}]: {}", runId, code.code(), message);
        }
        return outcome;
    }

    /**
     * Fail a run with the error code and message carried by a domain failure.
     */
    public TransitionResult markFailed(String runId, JobsException failure, Map<String, Object> partialResult) {
        return markFailed(runId, RunErrorCode.fromCode(failure.errorCode()), failure.getMessage(), partialResult);
    }

    public TransitionResult markCancelled(String runId, Map<String, Object> partialResult) {
        TransitionResult outcome = runRepository.markCancelled(runId, partialResult, clock.instant());
        afterTerminal(runId, RunStatus.CANCELLED, outcome);
        return outcome;
    }

    /**
     * Cancel a run. Queued runs are cancelled at once and their backend task
     * revoked; running runs are flagged for the worker to observe.
     */
    public CancelResult cancel(String runId) {
        Optional<JobRun> found = runRepository.findById(runId);
        if (found.isEmpty()) {
            return CancelResult.NOT_FOUND;
        }
        JobRun run = found.get();

        if (run.status() == RunStatus.QUEUED) {
            TransitionResult outcome = markCancelled(runId, null);
            if (outcome == TransitionResult.APPLIED) {
                revoke(run.externalTaskId());
                log.info("Cancelled queued run {}", runId);
                return CancelResult.CANCELLED;
            }
            if (outcome == TransitionResult.ALREADY_TERMINAL) {
                return CancelResult.ALREADY_TERMINAL;
            }
            // a worker picked it up in the meantime
        }

        if (runRepository.requestCancel(runId)) {
            log.info("Cancellation requested for running run {}", runId);
            return CancelResult.CANCEL_REQUESTED;
        }

        // not RUNNING any more, so it reached a terminal state first
        return runRepository.findById(runId).isPresent() ? CancelResult.ALREADY_TERMINAL : CancelResult.NOT_FOUND;
    }

    public boolean isCancelRequested(String runId) {
        return runRepository.isCancelRequested(runId);
    }

    public boolean heartbeat(String runId) {
        return runRepository.heartbeat(runId, clock.instant());
    }

    // ---- Progress ----

    public Optional<ProgressSnapshot> progress(String runId) {
        return progressTracker.snapshot(runId);
    }

    public Map<String, ProgressSnapshot> progress(Collection<String> runIds) {
        return progressTracker.snapshotAll(runIds);
    }

    public boolean reportProgress(String runId, String step, int percent, Integer currentStep, Integer totalSteps) {
        return progressTracker.update(runId, step, percent, currentStep, totalSteps, clock.instant());
    }

    public Clock clock() {
        return clock;
    }

    private void afterTerminal(String runId, RunStatus target, TransitionResult outcome) {
        if (outcome == TransitionResult.APPLIED) {
            progressTracker.discard(runId);
            log.info("Run {} -> {}", runId, target);
        } else {
            log.debug("Run {} not moved to {}: {}", runId, target, outcome);
        }
    }

    private void revoke(String externalTaskId) {
        if (externalTaskId == null) {
            return;
        }
        try {
            backend.cancel(externalTaskId);
        } catch (BackendException e) {
            // the run is already CANCELLED; the worker skips terminal runs on delivery
            log.warn("Failed to revoke backend task {}: {}", externalTaskId, e.getMessage());
        }
    }
}
