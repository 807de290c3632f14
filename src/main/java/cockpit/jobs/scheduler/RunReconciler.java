package cockpit.jobs.scheduler;

import cockpit.jobs.backend.BackendException;
import cockpit.jobs.backend.BackendState;
import cockpit.jobs.backend.ExecutionBackend;
import cockpit.jobs.error.OrphanedRunException;
import cockpit.jobs.model.JobRun;
import cockpit.jobs.model.TransitionResult;
import cockpit.jobs.service.JobRunService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Background sweep that fails runs lost by crashed workers.
 *
 * A QUEUED or RUNNING run is orphaned when its last sign of life is older
 * than the staleness threshold and the backend holds no live task for it.
 * Runs whose backend state cannot be fetched are left for the next sweep.
 */
public class RunReconciler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RunReconciler.class);

    private final JobRunService runService;
    private final ExecutionBackend backend;
    private final Duration staleThreshold;
    private final Clock clock;

    public RunReconciler(JobRunService runService, ExecutionBackend backend, Duration staleThreshold, Clock clock) {
        this.runService = runService;
        this.backend = backend;
        this.staleThreshold = staleThreshold;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            reconcile();
        } catch (Exception e) {
            log.error("Run reconciler error", e);
        }
    }

    /**
     * Find and fail orphaned runs.
     *
     * @return number of runs marked as orphaned
     */
    public int reconcile() {
        Instant cutoff = clock.instant().minus(staleThreshold);
        List<JobRun> stale = runService.findStale(cutoff);

        if (stale.isEmpty()) {
            log.debug("No stale runs found");
            return 0;
        }

        int orphaned = 0;
        int live = 0;
        int skipped = 0;

        for (JobRun run : stale) {
            try {
                if (run.externalTaskId() != null) {
                    BackendState state;
                    try {
                        state = backend.fetchStatus(run.externalTaskId());
                    } catch (BackendException e) {
                        skipped++;
                        log.warn("Cannot fetch backend state of run {} (task {}), retrying next sweep: {}",
                                run.id(), run.externalTaskId(), e.getMessage());
                        continue;
                    }
                    if (state.isLive()) {
                        live++;
                        log.debug("Run {} is stale but task {} is {}", run.id(), run.externalTaskId(), state);
                        continue;
                    }
                }

                TransitionResult result = runService.markFailed(run.id(),
                        new OrphanedRunException(run.id(), run.lastSeenAt()), null);
                if (result == TransitionResult.APPLIED) {
                    orphaned++;
                    log.warn("Run {} ({}) marked orphaned, last seen {}", run.id(), run.status(), run.lastSeenAt());
                }
            } catch (Exception e) {
                log.error("Failed to reconcile run {}", run.id(), e);
            }
        }

        log.info("Run reconciler: {} orphaned, {} still live, {} skipped, {} total stale",
                orphaned, live, skipped, stale.size());
        return orphaned;
    }
}
