package cockpit.jobs.backend;

import cockpit.jobs.backend.TaskConsumer.Outcome;
import cockpit.jobs.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InProcessExecutionBackendTest {

    private InProcessExecutionBackend backend;

    @AfterEach
    void tearDown() {
        if (backend != null)
            backend.close();
    }

    private void awaitState(String taskId, BackendState expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (backend.fetchStatus(taskId) != expected) {
            if (System.currentTimeMillis() > deadline) {
                fail("Task " + taskId + " stuck in " + backend.fetchStatus(taskId) + ", expected " + expected);
            }
            Thread.sleep(10);
        }
    }

    @Test
    void deliversPayloadToConsumer() throws Exception {
        List<String> seen = new CopyOnWriteArrayList<>();
        backend = new InProcessExecutionBackend(2).registerConsumer("t", (id, payload) -> {
            seen.add(id + ":" + payload);
            return Outcome.DONE;
        });

        String taskId = backend.submit("t", "hello");

        awaitState(taskId, BackendState.SUCCESS);
        assertEquals(List.of(taskId + ":hello"), seen);
        assertFalse(BackendState.SUCCESS.isLive());
    }

    @Test
    void redeliversUntilDone() throws Exception {
        AtomicInteger deliveries = new AtomicInteger();
        backend = new InProcessExecutionBackend(1, Duration.ofMillis(20)).registerConsumer("t",
                (id, payload) -> deliveries.incrementAndGet() < 3 ? Outcome.REDELIVER : Outcome.DONE);

        String taskId = backend.submit("t", "{}");

        awaitState(taskId, BackendState.SUCCESS);
        assertEquals(3, deliveries.get());
    }

    @Test
    void pendingTaskCanBeRevoked() throws Exception {
        CountDownLatch busy = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger secondRuns = new AtomicInteger();
        backend = new InProcessExecutionBackend(1)
                .registerConsumer("block", (id, payload) -> {
                    busy.countDown();
                    release.await(5, TimeUnit.SECONDS);
                    return Outcome.DONE;
                })
                .registerConsumer("count", (id, payload) -> {
                    secondRuns.incrementAndGet();
                    return Outcome.DONE;
                });

        String blocking = backend.submit("block", "{}");
        assertTrue(busy.await(5, TimeUnit.SECONDS));
        String waiting = backend.submit("count", "{}");
        assertEquals(BackendState.PENDING, backend.fetchStatus(waiting));
        assertEquals(BackendState.STARTED, backend.fetchStatus(blocking));
        assertTrue(BackendState.STARTED.isLive());

        backend.cancel(waiting);
        // a started task is left alone
        backend.cancel(blocking);
        release.countDown();

        awaitState(blocking, BackendState.SUCCESS);
        assertEquals(BackendState.REVOKED, backend.fetchStatus(waiting));
        assertEquals(0, secondRuns.get());
    }

    @Test
    void consumerExceptionMarksFailure() throws Exception {
        backend = new InProcessExecutionBackend(1).registerConsumer("t", (id, payload) -> {
            throw new IllegalStateException("boom");
        });

        String taskId = backend.submit("t", "{}");

        awaitState(taskId, BackendState.FAILURE);
    }

    @Test
    void unknownTaskTypeIsPermanentFailure() {
        backend = new InProcessExecutionBackend(1);

        BackendException e = assertThrows(BackendException.class, () -> backend.submit("nope", "{}"));
        assertFalse(e.isTransient());
        assertEquals(BackendState.UNKNOWN, backend.fetchStatus("task-unknown"));
    }

    @Test
    void closedBackendRejectsWork() {
        backend = new InProcessExecutionBackend(1).registerConsumer("t", (id, payload) -> Outcome.DONE);
        backend.close();

        assertThrows(BackendException.class, () -> backend.submit("t", "{}"));
        assertFalse(backend.stats().available());
    }

    @Test
    void statsReportSlots() {
        backend = new InProcessExecutionBackend(3);
        BackendStats stats = backend.stats();
        assertEquals(3, stats.workerSlots());
        assertTrue(stats.available());
    }

    @Test
    void finishedTasksAreEvictedAfterRetention() throws Exception {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        CountDownLatch busy = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        backend = new InProcessExecutionBackend(2, Duration.ofMillis(20), clock)
                .registerConsumer("quick", (id, payload) -> Outcome.DONE)
                .registerConsumer("block", (id, payload) -> {
                    busy.countDown();
                    release.await(5, TimeUnit.SECONDS);
                    return Outcome.DONE;
                });

        String done = backend.submit("quick", "{}");
        awaitState(done, BackendState.SUCCESS);
        String running = backend.submit("block", "{}");
        assertTrue(busy.await(5, TimeUnit.SECONDS));

        clock.advance(Duration.ofHours(1));
        assertEquals(0, backend.purgeFinished(Duration.ofHours(2)));
        assertEquals(BackendState.SUCCESS, backend.fetchStatus(done));

        clock.advance(Duration.ofHours(2));
        assertEquals(1, backend.purgeFinished(Duration.ofHours(2)));
        assertEquals(BackendState.UNKNOWN, backend.fetchStatus(done));
        assertEquals(BackendState.STARTED, backend.fetchStatus(running));

        BackendStats stats = backend.stats();
        assertEquals(1, stats.retainedTasks());
        assertEquals(1, stats.evictedTasks());

        release.countDown();
        awaitState(running, BackendState.SUCCESS);
    }
}
