package cockpit.jobs.scheduler;

import cockpit.jobs.config.JobsConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs the background loops:
 * - ScheduleTicker: fires due schedules every tick
 * - RunReconciler: fails orphaned runs on a slower cadence
 * - ResultJanitor: evicts finished backend tasks on the same cadence
 *
 * Uses a single-threaded executor so a tick and a sweep never overlap.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final ScheduleTicker ticker;
    private final RunReconciler reconciler;
    private final ResultJanitor janitor;
    private final JobsConfig config;

    private volatile boolean running = false;

    public Scheduler(ScheduleTicker ticker, RunReconciler reconciler, ResultJanitor janitor, JobsConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cockpit-scheduler");
            t.setDaemon(true);
            return t;
        });
        this.ticker = ticker;
        this.reconciler = reconciler;
        this.janitor = janitor;
        this.config = config;
    }

    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        // Tick right away so occurrences missed during downtime fire on startup
        long tickMs = config.tickInterval().toMillis();
        executor.scheduleWithFixedDelay(ticker, 0, tickMs, TimeUnit.MILLISECONDS);
        log.info("Schedule ticker scheduled every {}ms", tickMs);

        long reconcileMs = config.reconcileInterval().toMillis();
        executor.scheduleWithFixedDelay(reconciler, reconcileMs, reconcileMs, TimeUnit.MILLISECONDS);
        log.info("Run reconciler scheduled every {}ms (stale after {})", reconcileMs, config.staleThreshold());

        executor.scheduleWithFixedDelay(janitor, reconcileMs, reconcileMs, TimeUnit.MILLISECONDS);
        log.info("Result janitor scheduled every {}ms (retention {})", reconcileMs, janitor.retention());

        log.info("Scheduler started");
    }

    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    public ScheduleTicker ticker() {
        return ticker;
    }

    public RunReconciler reconciler() {
        return reconciler;
    }

    public ResultJanitor janitor() {
        return janitor;
    }
}
