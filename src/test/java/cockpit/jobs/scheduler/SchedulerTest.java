package cockpit.jobs.scheduler;

import cockpit.jobs.config.JobsConfig;
import cockpit.jobs.model.JobRun;
import cockpit.jobs.model.JobTemplate;
import cockpit.jobs.model.RunErrorCode;
import cockpit.jobs.model.RunQuery;
import cockpit.jobs.model.RunStatus;
import cockpit.jobs.service.Dispatcher;
import cockpit.jobs.service.JobRunService;
import cockpit.jobs.service.JsonPayloadRenderer;
import cockpit.jobs.service.ProgressTracker;
import cockpit.jobs.service.ScheduleDraft;
import cockpit.jobs.service.ScheduleService;
import cockpit.jobs.service.TemplateDraft;
import cockpit.jobs.service.TemplateService;
import cockpit.jobs.store.Database;
import cockpit.jobs.store.JdbcJobRunRepository;
import cockpit.jobs.store.JdbcJobScheduleRepository;
import cockpit.jobs.store.JdbcJobTemplateRepository;
import cockpit.jobs.support.MutableClock;
import cockpit.jobs.support.RecordingBackend;
import cockpit.jobs.support.TestDatabases;
import cockpit.jobs.worker.JobTypeRegistry;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    private static Database db;

    @BeforeAll
    static void setup() {
        db = TestDatabases.create("test-scheduler");
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @Test
    @DisplayName("Background loops fire due schedules and orphan lost runs")
    void loopsRunInBackground() throws Exception {
        TestDatabases.clear(db);
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:30Z"));
        JdbcJobTemplateRepository templates = new JdbcJobTemplateRepository(db);
        JdbcJobScheduleRepository schedules = new JdbcJobScheduleRepository(db);
        JdbcJobRunRepository runs = new JdbcJobRunRepository(db);
        JobTypeRegistry registry = JobTypeRegistry.withDefaults();
        RecordingBackend backend = new RecordingBackend();
        JobRunService runService = new JobRunService(runs, backend, new ProgressTracker(), clock);
        Dispatcher dispatcher = new Dispatcher(templates, schedules, runs, registry, backend,
                new JsonPayloadRenderer(), clock);

        JobTemplate tpl = new TemplateService(templates, schedules, registry, clock)
                .create(new TemplateDraft("Backup", "example", null, null, List.of(), true), "admin");
        new ScheduleService(schedules, templates, clock)
                .create(new ScheduleDraft("Every minute", tpl.id(), "* * * * *", "UTC", true, null, null), "admin");
        runs.insert(JobRun.builder().id("run-lost").jobName("Lost").jobType("example")
                .queuedAt(clock.instant()).build());

        clock.advance(Duration.ofMinutes(15));

        JobsConfig config = JobsConfig.defaults()
                .withTickInterval(Duration.ofMillis(50))
                .withReconcileInterval(Duration.ofMillis(50));
        Scheduler scheduler = new Scheduler(
                new ScheduleTicker(schedules, dispatcher, clock),
                new RunReconciler(runService, backend, config.staleThreshold(), clock),
                new ResultJanitor(backend, config.resultRetention()),
                config);

        scheduler.start();
        try {
            assertTrue(scheduler.isRunning());
            long deadline = System.currentTimeMillis() + 5000;
            while (runs.query(new RunQuery(null, tpl.id(), null, null, null, 1, 25)).total() < 1
                    || runService.get("run-lost").status() != RunStatus.FAILED) {
                if (System.currentTimeMillis() > deadline) {
                    fail("Scheduler loops did not run");
                }
                Thread.sleep(20);
            }
        } finally {
            scheduler.stop();
        }

        assertFalse(scheduler.isRunning());
        assertEquals(1, runs.query(new RunQuery(null, tpl.id(), null, null, null, 1, 25)).total());
        assertEquals(RunErrorCode.ORPHANED_RUN, runService.get("run-lost").errorCode());
    }
}
