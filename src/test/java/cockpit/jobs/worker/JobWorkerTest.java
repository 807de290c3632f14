package cockpit.jobs.worker;

import cockpit.jobs.backend.TaskConsumer.Outcome;
import cockpit.jobs.error.JobExecutionException;
import cockpit.jobs.error.TransientWorkerException;
import cockpit.jobs.model.CancelResult;
import cockpit.jobs.model.JobRun;
import cockpit.jobs.model.JobTypeInfo;
import cockpit.jobs.model.ProgressSnapshot;
import cockpit.jobs.model.RunErrorCode;
import cockpit.jobs.model.RunStatus;
import cockpit.jobs.service.JobRunService;
import cockpit.jobs.service.ProgressTracker;
import cockpit.jobs.store.Database;
import cockpit.jobs.store.JdbcJobRunRepository;
import cockpit.jobs.support.MutableClock;
import cockpit.jobs.support.RecordingBackend;
import cockpit.jobs.support.TestDatabases;
import cockpit.jobs.util.Json;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class JobWorkerTest {

    private static Database db;
    private static JdbcJobRunRepository runs;

    private MutableClock clock;
    private ProgressTracker tracker;
    private JobRunService runService;
    private JobTypeRegistry registry;

    @BeforeAll
    static void setup() {
        db = TestDatabases.create("test-worker");
        runs = new JdbcJobRunRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void reset() throws Exception {
        TestDatabases.clear(db);
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        tracker = new ProgressTracker();
        runService = new JobRunService(runs, new RecordingBackend(), tracker, clock);
        registry = JobTypeRegistry.withDefaults();
    }

    private JobWorker worker(int maxAttempts) {
        return new JobWorker(registry, runService, "worker-test", maxAttempts, Duration.ofSeconds(30));
    }

    private String enqueue(String runId, String jobType, List<String> devices) {
        runs.insert(JobRun.builder()
                .id(runId)
                .jobName("Job " + runId)
                .jobType(jobType)
                .queuedAt(clock.instant())
                .targetDevices(devices)
                .build());
        return Json.write(new TaskEnvelope(runId, "Job " + runId, jobType, Map.of("retention", 7), devices, "{}"));
    }

    @Test
    void progressIsVisibleWhileRunningAndGoneAfterSuccess() throws Exception {
        CountDownLatch midway = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        registry.register(new JobTypeInfo("two-step", "Two step", null), context -> {
            context.progress("step1", 10);
            context.progress("step2", 55);
            midway.countDown();
            assertTrue(proceed.await(5, TimeUnit.SECONDS));
            return Map.of("success", true, "devices", context.targetDevices());
        });
        String payload = enqueue("run-1", "two-step", List.of("dev-a", "dev-b"));

        CompletableFuture<Outcome> outcome = CompletableFuture.supplyAsync(() -> {
            try {
                return worker(3).consume("task-1", payload);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });

        assertTrue(midway.await(5, TimeUnit.SECONDS));
        ProgressSnapshot snapshot = runService.progress("run-1").orElseThrow();
        assertEquals(55, snapshot.percent());
        assertEquals("step2", snapshot.step());
        assertEquals(RunStatus.RUNNING, runService.get("run-1").status());

        proceed.countDown();
        assertEquals(Outcome.DONE, outcome.get(5, TimeUnit.SECONDS));

        JobRun run = runService.get("run-1");
        assertEquals(RunStatus.SUCCEEDED, run.status());
        assertEquals(Boolean.TRUE, run.result().get("success"));
        assertEquals(List.of("dev-a", "dev-b"), run.result().get("devices"));
        assertEquals("worker-test", run.executedBy());
        assertTrue(runService.progress("run-1").isEmpty());
    }

    @Test
    void exampleHandlerProcessesEveryDevice() throws Exception {
        String payload = enqueue("run-1", "example", List.of("dev-a", "dev-b", "dev-c"));

        assertEquals(Outcome.DONE, worker(3).consume("task-1", payload));

        JobRun run = runService.get("run-1");
        assertEquals(RunStatus.SUCCEEDED, run.status());
        assertEquals(List.of("dev-a", "dev-b", "dev-c"), run.result().get("target_devices"));
        assertEquals(Map.of("retention", 7), run.result().get("job_parameters"));
        assertEquals("Example job completed for 3 device(s)", run.result().get("message"));
    }

    @Test
    void transientErrorsAreRedeliveredUntilAttemptsRunOut() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        registry.register(new JobTypeInfo("flaky", "Flaky", null), context -> {
            calls.incrementAndGet();
            throw new TransientWorkerException("device busy");
        });
        String payload = enqueue("run-1", "flaky", List.of());
        JobWorker worker = worker(2);

        assertEquals(Outcome.REDELIVER, worker.consume("task-1", payload));
        assertEquals(RunStatus.RUNNING, runService.get("run-1").status());

        assertEquals(Outcome.DONE, worker.consume("task-1", payload));

        JobRun run = runService.get("run-1");
        assertEquals(2, calls.get());
        assertEquals(2, run.attempts());
        assertEquals(RunStatus.FAILED, run.status());
        assertEquals(RunErrorCode.EXECUTION_ERROR, run.errorCode());
        assertTrue(run.errorMessage().startsWith("Retries exhausted after 2 attempts"), run.errorMessage());
    }

    @Test
    void transientSuccessOnSecondAttempt() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        registry.register(new JobTypeInfo("flaky-once", "Flaky once", null), context -> {
            if (calls.incrementAndGet() == 1) {
                throw new TransientWorkerException("device busy");
            }
            return Map.of("attempt", context.attempt());
        });
        String payload = enqueue("run-1", "flaky-once", List.of());
        JobWorker worker = worker(3);

        assertEquals(Outcome.REDELIVER, worker.consume("task-1", payload));
        assertEquals(Outcome.DONE, worker.consume("task-1", payload));

        JobRun run = runService.get("run-1");
        assertEquals(RunStatus.SUCCEEDED, run.status());
        assertEquals(2, run.result().get("attempt"));
    }

    @Test
    void executionErrorFailsWithPartialResult() throws Exception {
        registry.register(new JobTypeInfo("half", "Half", null), context -> {
            context.putPartial("processed_devices", List.of("dev-a"));
            throw new JobExecutionException("dev-b unreachable");
        });
        String payload = enqueue("run-1", "half", List.of("dev-a", "dev-b"));

        assertEquals(Outcome.DONE, worker(3).consume("task-1", payload));

        JobRun run = runService.get("run-1");
        assertEquals(RunStatus.FAILED, run.status());
        assertEquals("dev-b unreachable", run.errorMessage());
        assertEquals(List.of("dev-a"), run.result().get("processed_devices"));
    }

    @Test
    void unexpectedExceptionFailsRun() throws Exception {
        registry.register(new JobTypeInfo("buggy", "Buggy", null), context -> {
            throw new IllegalStateException("bug");
        });
        String payload = enqueue("run-1", "buggy", List.of());

        assertEquals(Outcome.DONE, worker(3).consume("task-1", payload));

        JobRun run = runService.get("run-1");
        assertEquals(RunStatus.FAILED, run.status());
        assertTrue(run.errorMessage().contains("bug"));
    }

    @Test
    void cancellationIsObservedAtCheckpoint() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        registry.register(new JobTypeInfo("slow", "Slow", null), context -> {
            context.putPartial("processed_devices", List.of("dev-a"));
            started.countDown();
            assertTrue(proceed.await(5, TimeUnit.SECONDS));
            context.checkpoint();
            return Map.of("success", true);
        });
        String payload = enqueue("run-1", "slow", List.of("dev-a", "dev-b"));

        CompletableFuture<Outcome> outcome = CompletableFuture.supplyAsync(() -> {
            try {
                return worker(3).consume("task-1", payload);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });

        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertEquals(CancelResult.CANCEL_REQUESTED, runService.cancel("run-1"));
        proceed.countDown();
        assertEquals(Outcome.DONE, outcome.get(5, TimeUnit.SECONDS));

        JobRun run = runService.get("run-1");
        assertEquals(RunStatus.CANCELLED, run.status());
        assertEquals(List.of("dev-a"), run.result().get("processed_devices"));
    }

    @Test
    void terminalRunIsNotExecuted() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        registry.register(new JobTypeInfo("counted", "Counted", null), context -> {
            calls.incrementAndGet();
            return Map.of();
        });
        String payload = enqueue("run-1", "counted", List.of());
        runService.cancel("run-1");

        assertEquals(Outcome.DONE, worker(3).consume("task-1", payload));

        assertEquals(0, calls.get());
        assertEquals(RunStatus.CANCELLED, runService.get("run-1").status());
    }

    @Test
    void missingHandlerFailsRun() throws Exception {
        String payload = enqueue("run-1", "unregistered", List.of());

        assertEquals(Outcome.DONE, worker(3).consume("task-1", payload));

        JobRun run = runService.get("run-1");
        assertEquals(RunStatus.FAILED, run.status());
        assertEquals(RunErrorCode.EXECUTION_ERROR, run.errorCode());
    }

    @Test
    void unreadablePayloadIsDropped() throws Exception {
        assertEquals(Outcome.DONE, worker(3).consume("task-1", "not json"));
    }
}
