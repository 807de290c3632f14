package cockpit.jobs.backend;

import java.time.Duration;

/**
 * Distributed execution backend the dispatcher hands work to.
 * Delivery is at-least-once; callers deduplicate on their side.
 */
public interface ExecutionBackend extends AutoCloseable {

    /**
     * Submit a unit of work.
     *
     * @param taskType routing key of the consumer that executes the task
     * @param payload  opaque payload handed to the consumer
     * @return backend task id
     * @throws BackendException if the task was not accepted
     */
    String submit(String taskType, String payload);

    /**
     * Current backend-side state of a task.
     *
     * @throws BackendException if the backend cannot be asked
     */
    BackendState fetchStatus(String externalTaskId);

    /**
     * Revoke a task. Best effort: a task already executing keeps running.
     */
    void cancel(String externalTaskId);

    BackendStats stats();

    /**
     * Drop bookkeeping of tasks that finished longer than {@code retention} ago.
     * Evicted tasks report {@link BackendState#UNKNOWN} afterwards.
     *
     * @return number of tasks evicted
     */
    default int purgeFinished(Duration retention) {
        return 0;
    }

    @Override
    void close();
}
