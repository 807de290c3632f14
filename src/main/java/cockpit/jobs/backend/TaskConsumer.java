package cockpit.jobs.backend;

/**
 * Worker-side entry point invoked by the backend for each delivery.
 */
@FunctionalInterface
public interface TaskConsumer {

    enum Outcome {
        /** Task finished, whatever the job outcome was */
        DONE,
        /** Worker-level failure, deliver the task again */
        REDELIVER
    }

    Outcome consume(String externalTaskId, String payload) throws InterruptedException;
}
