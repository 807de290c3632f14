package cockpit.jobs.scheduler;

import cockpit.jobs.backend.ExecutionBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Periodically evicts backend bookkeeping of tasks finished longer ago than
 * the retention window. Runs themselves are never touched; their outcome
 * lives in the database.
 */
public class ResultJanitor implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ResultJanitor.class);

    private final ExecutionBackend backend;
    private final Duration retention;

    public ResultJanitor(ExecutionBackend backend, Duration retention) {
        this.backend = backend;
        this.retention = retention;
    }

    @Override
    public void run() {
        try {
            purge();
        } catch (Exception e) {
            log.error("Result janitor error", e);
        }
    }

    /**
     * @return number of evicted tasks
     */
    public int purge() {
        int evicted = backend.purgeFinished(retention);
        log.debug("Result janitor evicted {} task(s)", evicted);
        return evicted;
    }

    public Duration retention() {
        return retention;
    }
}
