package cockpit.jobs.repository;

import cockpit.jobs.model.JobRun;
import cockpit.jobs.model.Page;
import cockpit.jobs.model.RunErrorCode;
import cockpit.jobs.model.RunQuery;
import cockpit.jobs.model.RunStatus;
import cockpit.jobs.model.TransitionResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repository interface for JobRun persistence.
 * All transitions are conditional updates: a run that already reached a
 * terminal state is never modified again.
 */
public interface JobRunRepository {

    /**
     * Insert a QUEUED run.
     *
     * @return false if a run for the same (schedule, scheduled_for) already exists
     */
    boolean insert(JobRun run);

    Optional<JobRun> findById(String runId);

    /**
     * Find the run created for a schedule occurrence.
     */
    Optional<JobRun> findByOccurrence(String scheduleId, Instant scheduledFor);

    /**
     * Filtered, paginated history, most recently queued first.
     */
    Page<JobRun> query(RunQuery query);

    /**
     * Record the backend handle once submission succeeded.
     *
     * @return true if recorded
     */
    boolean recordExternalTaskId(String runId, String externalTaskId);

    /**
     * QUEUED → RUNNING, or a redelivery of a RUNNING run. Increments attempts
     * and sets started_at (first time only) and heartbeat_at.
     */
    TransitionResult markStarted(String runId, String executedBy, Instant now);

    /**
     * RUNNING → SUCCEEDED.
     */
    TransitionResult markSucceeded(String runId, Map<String, Object> result, Instant now);

    /**
     * QUEUED or RUNNING → FAILED.
     *
     * @param result partial result, may be null
     */
    TransitionResult markFailed(String runId, RunErrorCode code, String message, Map<String, Object> result,
            Instant now);

    /**
     * QUEUED or RUNNING → CANCELLED.
     *
     * @param result partial result, may be null
     */
    TransitionResult markCancelled(String runId, Map<String, Object> result, Instant now);

    /**
     * Flag a RUNNING run for cooperative cancellation.
     *
     * @return true if the flag was set
     */
    boolean requestCancel(String runId);

    boolean isCancelRequested(String runId);

    /**
     * Refresh heartbeat_at of a RUNNING run.
     */
    boolean heartbeat(String runId, Instant now);

    /**
     * QUEUED or RUNNING runs whose last sign of life is before the cutoff.
     */
    List<JobRun> findStale(Instant lastSeenBefore);

    int countByStatus(RunStatus status);

    /**
     * Generate a new unique run ID.
     *
     * @return unique ID like "run-{uuid}"
     */
    String generateId();
}
