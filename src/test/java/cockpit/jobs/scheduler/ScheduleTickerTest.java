package cockpit.jobs.scheduler;

import cockpit.jobs.model.JobRun;
import cockpit.jobs.model.JobSchedule;
import cockpit.jobs.model.JobTemplate;
import cockpit.jobs.model.ParameterType;
import cockpit.jobs.model.RunQuery;
import cockpit.jobs.model.TemplateParameter;
import cockpit.jobs.service.DispatchRequest;
import cockpit.jobs.service.Dispatcher;
import cockpit.jobs.service.JsonPayloadRenderer;
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

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleTickerTest {

    private static Database db;
    private static JdbcJobTemplateRepository templates;
    private static JdbcJobScheduleRepository schedules;
    private static JdbcJobRunRepository runs;

    private MutableClock clock;
    private RecordingBackend backend;
    private Dispatcher dispatcher;
    private ScheduleService scheduleService;
    private TemplateService templateService;
    private ScheduleTicker ticker;

    @BeforeAll
    static void setup() {
        db = TestDatabases.create("test-ticker");
        templates = new JdbcJobTemplateRepository(db);
        schedules = new JdbcJobScheduleRepository(db);
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
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:30Z"));
        JobTypeRegistry registry = JobTypeRegistry.withDefaults();
        backend = new RecordingBackend();
        dispatcher = new Dispatcher(templates, schedules, runs, registry, backend, new JsonPayloadRenderer(), clock);
        scheduleService = new ScheduleService(schedules, templates, clock);
        templateService = new TemplateService(templates, schedules, registry, clock);
        ticker = new ScheduleTicker(schedules, dispatcher, clock);
    }

    private JobSchedule everyMinute(List<TemplateParameter> params, Map<String, Object> overrides) {
        JobTemplate tpl = templateService.create(
                new TemplateDraft("Template " + System.nanoTime(), "example", null, null, params, true), "admin");
        return scheduleService.create(
                new ScheduleDraft("Every minute", tpl.id(), "* * * * *", "UTC", true, overrides, List.of("dev-a")),
                "admin");
    }

    private List<JobRun> allRuns() {
        return runs.query(RunQuery.firstPage()).items();
    }

    @Test
    void nothingFiresBeforeFirstOccurrence() {
        everyMinute(List.of(), null);
        assertEquals(0, ticker.tick());
        assertTrue(allRuns().isEmpty());
    }

    @Test
    void missedOccurrencesFireOnce() {
        JobSchedule schedule = everyMinute(List.of(), null);
        assertEquals(Instant.parse("2026-03-01T10:01:00Z"), schedule.nextRunAt());

        clock.set(Instant.parse("2026-03-01T10:01:30Z"));
        assertEquals(1, ticker.tick());

        clock.set(Instant.parse("2026-03-01T10:03:30Z"));
        assertEquals(1, ticker.tick());
        assertEquals(0, ticker.tick());

        List<JobRun> fired = allRuns();
        assertEquals(2, fired.size());
        assertEquals(Instant.parse("2026-03-01T10:02:00Z"), fired.get(0).scheduledFor());
        assertEquals(Instant.parse("2026-03-01T10:01:00Z"), fired.get(1).scheduledFor());
        for (JobRun run : fired) {
            assertEquals(schedule.id(), run.scheduleId());
            assertEquals(ScheduleTicker.TRIGGERED_BY, run.triggeredBy());
            assertEquals(List.of("dev-a"), run.targetDevices());
        }

        JobSchedule advanced = scheduleService.get(schedule.id());
        assertEquals(Instant.parse("2026-03-01T10:04:00Z"), advanced.nextRunAt());
        assertEquals(fired.get(0).id(), advanced.lastRunId());
    }

    @Test
    void alreadyDispatchedOccurrenceIsNotDuplicated() {
        JobSchedule schedule = everyMinute(List.of(), null);
        JobRun manual = dispatcher.dispatch(new DispatchRequest(schedule.templateId(), null, null, "other-node",
                null, null, schedule.id(), schedule.nextRunAt()));

        clock.set(Instant.parse("2026-03-01T10:01:30Z"));
        ticker.tick();

        List<JobRun> fired = allRuns();
        assertEquals(1, fired.size());
        assertEquals(manual.id(), fired.get(0).id());
        assertEquals(1, backend.payloads.size());
    }

    @Test
    void secondTickerFindsNothingLeft() {
        everyMinute(List.of(), null);
        ScheduleTicker other = new ScheduleTicker(schedules, dispatcher, clock);

        clock.set(Instant.parse("2026-03-01T10:01:30Z"));
        assertEquals(1, ticker.tick());
        assertEquals(0, other.tick());
        assertEquals(1, allRuns().size());
    }

    @Test
    void brokenOccurrenceIsSkippedAndScheduleAdvances() {
        JobSchedule schedule = everyMinute(List.of(), null);
        // template now demands a parameter the schedule does not supply
        JobTemplate tpl = templates.findById(schedule.templateId()).orElseThrow();
        templates.update(tpl.toBuilder().parameters(List.of(
                new TemplateParameter("target", ParameterType.STRING, true, null, null))).build());

        clock.set(Instant.parse("2026-03-01T10:01:30Z"));
        assertEquals(0, ticker.tick());

        assertTrue(allRuns().isEmpty());
        assertEquals(Instant.parse("2026-03-01T10:02:00Z"), scheduleService.get(schedule.id()).nextRunAt());
    }

    @Test
    void disabledAndDetachedSchedulesDoNotFire() {
        JobSchedule disabled = everyMinute(List.of(), null);
        scheduleService.setEnabled(disabled.id(), false);
        JobSchedule detached = everyMinute(List.of(), null);
        templates.delete(detached.templateId(), true);

        clock.set(Instant.parse("2026-03-01T10:05:00Z"));
        assertEquals(0, ticker.tick());
        assertTrue(allRuns().isEmpty());
    }
}
