package cockpit.jobs.scheduler;

import cockpit.jobs.backend.BackendState;
import cockpit.jobs.backend.InProcessExecutionBackend;
import cockpit.jobs.backend.TaskConsumer.Outcome;
import cockpit.jobs.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ResultJanitorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    private InProcessExecutionBackend backend;

    @AfterEach
    void tearDown() {
        if (backend != null)
            backend.close();
    }

    @Test
    void purgesTasksOlderThanRetention() throws Exception {
        backend = new InProcessExecutionBackend(1, Duration.ofMillis(20), clock)
                .registerConsumer("t", (id, payload) -> Outcome.DONE);
        String taskId = backend.submit("t", "{}");
        long deadline = System.currentTimeMillis() + 5000;
        while (backend.fetchStatus(taskId) != BackendState.SUCCESS) {
            if (System.currentTimeMillis() > deadline) {
                fail("Task did not finish");
            }
            Thread.sleep(10);
        }

        ResultJanitor janitor = new ResultJanitor(backend, Duration.ofHours(24));
        assertEquals(0, janitor.purge());

        clock.advance(Duration.ofHours(25));
        janitor.run();

        assertEquals(BackendState.UNKNOWN, backend.fetchStatus(taskId));
        assertEquals(0, backend.stats().retainedTasks());
        assertEquals(1, backend.stats().evictedTasks());
    }
}
