package cockpit.jobs.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Execution backend backed by a bounded in-process worker pool.
 * One task occupies one worker slot for its whole execution. Tasks whose
 * consumer asks for redelivery are scheduled again after a short delay.
 * Finished tasks stay queryable until {@link #purgeFinished(Duration)} evicts them.
 */
public class InProcessExecutionBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(InProcessExecutionBackend.class);

    private final int workerSlots;
    private final Duration redeliveryDelay;
    private final Clock clock;
    private final ScheduledThreadPoolExecutor executor;
    private final Map<String, TaskConsumer> consumers = new ConcurrentHashMap<>();
    private final Map<String, TaskHandle> tasks = new ConcurrentHashMap<>();
    private final AtomicLong evicted = new AtomicLong();

    private volatile boolean closed = false;

    public InProcessExecutionBackend(int workerSlots) {
        this(workerSlots, Duration.ofSeconds(1));
    }

    public InProcessExecutionBackend(int workerSlots, Duration redeliveryDelay) {
        this(workerSlots, redeliveryDelay, Clock.systemUTC());
    }

    public InProcessExecutionBackend(int workerSlots, Duration redeliveryDelay, Clock clock) {
        if (workerSlots < 1) {
            throw new IllegalArgumentException("workerSlots must be >= 1");
        }
        this.workerSlots = workerSlots;
        this.redeliveryDelay = redeliveryDelay;
        this.clock = clock;
        AtomicInteger counter = new AtomicInteger();
        this.executor = new ScheduledThreadPoolExecutor(workerSlots, r -> {
            Thread t = new Thread(r, "cockpit-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.executor.setRemoveOnCancelPolicy(true);
        log.info("In-process backend started with {} worker slots", workerSlots);
    }

    /**
     * Register the consumer that executes tasks of a given type.
     */
    public InProcessExecutionBackend registerConsumer(String taskType, TaskConsumer consumer) {
        consumers.put(taskType, consumer);
        log.debug("Registered consumer for task type {}", taskType);
        return this;
    }

    @Override
    public String submit(String taskType, String payload) {
        if (closed) {
            throw new BackendException("Backend is shut down", false);
        }
        TaskConsumer consumer = consumers.get(taskType);
        if (consumer == null) {
            throw new BackendException("No consumer registered for task type: " + taskType, false);
        }

        String taskId = "task-" + UUID.randomUUID();
        TaskHandle handle = new TaskHandle(taskId, payload, consumer);
        tasks.put(taskId, handle);

        try {
            handle.future = executor.submit(() -> deliver(handle));
        } catch (RejectedExecutionException e) {
            tasks.remove(taskId);
            throw new BackendException("Worker pool rejected task", true, e);
        }

        log.debug("Submitted task {} ({})", taskId, taskType);
        return taskId;
    }

    @Override
    public BackendState fetchStatus(String externalTaskId) {
        TaskHandle handle = tasks.get(externalTaskId);
        return handle == null ? BackendState.UNKNOWN : handle.state.get();
    }

    @Override
    public void cancel(String externalTaskId) {
        TaskHandle handle = tasks.get(externalTaskId);
        if (handle == null) {
            log.debug("Cancel for unknown task {}", externalTaskId);
            return;
        }
        if (handle.state.compareAndSet(BackendState.PENDING, BackendState.REVOKED)
                || handle.state.compareAndSet(BackendState.RETRY, BackendState.REVOKED)) {
            handle.finishedAt = clock.instant();
            Future<?> future = handle.future;
            if (future != null) {
                future.cancel(false);
            }
            log.info("Revoked task {}", externalTaskId);
        }
    }

    @Override
    public BackendStats stats() {
        return new BackendStats(
                workerSlots,
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount(),
                tasks.size(),
                evicted.get(),
                !closed);
    }

    @Override
    public int purgeFinished(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        int removed = 0;
        for (TaskHandle handle : tasks.values()) {
            Instant finishedAt = handle.finishedAt;
            if (finishedAt != null && !finishedAt.isAfter(cutoff) && tasks.remove(handle.id, handle)) {
                removed++;
            }
        }
        if (removed > 0) {
            evicted.addAndGet(removed);
            log.info("Evicted {} finished task(s) older than {}", removed, retention);
        }
        return removed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Worker pool forcefully stopped");
            } else {
                log.info("Worker pool stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void deliver(TaskHandle handle) {
        if (!handle.state.compareAndSet(BackendState.PENDING, BackendState.STARTED)
                && !handle.state.compareAndSet(BackendState.RETRY, BackendState.STARTED)) {
            // revoked while waiting in the queue
            return;
        }

        int delivery = handle.deliveries.incrementAndGet();
        try {
            TaskConsumer.Outcome outcome = handle.consumer.consume(handle.id, handle.payload);
            if (outcome == TaskConsumer.Outcome.REDELIVER && !closed) {
                handle.state.set(BackendState.RETRY);
                log.info("Redelivering task {} (delivery {} done)", handle.id, delivery);
                handle.future = executor.schedule(() -> deliver(handle),
                        redeliveryDelay.toMillis(), TimeUnit.MILLISECONDS);
            } else if (outcome == TaskConsumer.Outcome.REDELIVER) {
                finish(handle, BackendState.FAILURE);
                log.warn("Task {} wanted redelivery but the backend is shutting down", handle.id);
            } else {
                finish(handle, BackendState.SUCCESS);
            }
        } catch (InterruptedException e) {
            finish(handle, BackendState.FAILURE);
            Thread.currentThread().interrupt();
            log.warn("Task {} interrupted", handle.id);
        } catch (Exception e) {
            finish(handle, BackendState.FAILURE);
            log.error("Task {} failed in consumer", handle.id, e);
        }
    }

    private void finish(TaskHandle handle, BackendState state) {
        handle.state.set(state);
        handle.finishedAt = clock.instant();
    }

    private static final class TaskHandle {
        private final String id;
        private final String payload;
        private final TaskConsumer consumer;
        private final AtomicReference<BackendState> state = new AtomicReference<>(BackendState.PENDING);
        private final AtomicInteger deliveries = new AtomicInteger();
        private volatile Future<?> future;
        private volatile Instant finishedAt;

        private TaskHandle(String id, String payload, TaskConsumer consumer) {
            this.id = id;
            this.payload = payload;
            this.consumer = consumer;
        }
    }
}
