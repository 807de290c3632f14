package cockpit.jobs.service;

import cockpit.jobs.error.ConflictException;
import cockpit.jobs.error.NotFoundException;
import cockpit.jobs.error.ValidationException;
import cockpit.jobs.model.JobSchedule;
import cockpit.jobs.model.JobTemplate;
import cockpit.jobs.model.ParameterType;
import cockpit.jobs.model.TemplateParameter;
import cockpit.jobs.store.Database;
import cockpit.jobs.store.JdbcJobScheduleRepository;
import cockpit.jobs.store.JdbcJobTemplateRepository;
import cockpit.jobs.support.MutableClock;
import cockpit.jobs.support.TestDatabases;
import cockpit.jobs.worker.JobTypeRegistry;
import org.junit.jupiter.api.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TemplateServiceTest {

    private static Database db;
    private static JdbcJobTemplateRepository templates;
    private static JdbcJobScheduleRepository schedules;

    private TemplateService service;
    private ScheduleService scheduleService;

    @BeforeAll
    static void setup() {
        db = TestDatabases.create("test-template-service");
        templates = new JdbcJobTemplateRepository(db);
        schedules = new JdbcJobScheduleRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void reset() throws Exception {
        TestDatabases.clear(db);
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:30Z"));
        service = new TemplateService(templates, schedules, JobTypeRegistry.withDefaults(), clock);
        scheduleService = new ScheduleService(schedules, templates, clock);
    }

    private static TemplateDraft draft(String name, boolean global, List<TemplateParameter> params) {
        return new TemplateDraft(name, "example", "test template", null, params, global);
    }

    @Test
    void createGlobalTemplate() {
        JobTemplate tpl = service.create(draft("  Backup ", true, List.of()), "admin");

        assertEquals("Backup", tpl.name());
        assertTrue(tpl.isGlobal());
        assertNull(tpl.ownerId());
        assertEquals("admin", tpl.createdBy());
        assertEquals(tpl.id(), service.get(tpl.id(), null).id());
    }

    @Test
    void privateTemplateNeedsUserAndIsHiddenFromOthers() {
        assertThrows(ValidationException.class, () -> service.create(draft("Mine", false, List.of()), null));

        JobTemplate tpl = service.create(draft("Mine", false, List.of()), "alice");
        assertEquals("alice", tpl.ownerId());

        assertEquals(tpl.id(), service.get(tpl.id(), "alice").id());
        assertThrows(NotFoundException.class, () -> service.get(tpl.id(), "bob"));
        assertTrue(service.list("bob", null).isEmpty());
        assertEquals(1, service.list("alice", null).size());
    }

    @Test
    void duplicateNameInScopeConflicts() {
        service.create(draft("Backup", true, List.of()), "admin");
        assertThrows(ConflictException.class, () -> service.create(draft("Backup", true, List.of()), "admin"));

        // same name in a private scope is fine
        assertNotNull(service.create(draft("Backup", false, List.of()), "alice"));
    }

    @Test
    void rejectsInvalidDrafts() {
        assertThrows(ValidationException.class, () -> service.create(draft(" ", true, List.of()), "admin"));
        assertThrows(ValidationException.class, () -> service.create(draft("x".repeat(256), true, List.of()), "a"));
        assertThrows(ValidationException.class,
                () -> service.create(new TemplateDraft("Bad", "no-such-type", null, null, List.of(), true), "a"));
        assertThrows(ValidationException.class, () -> service.create(draft("Bad default", true, List.of(
                new TemplateParameter("retention", ParameterType.INTEGER, false, "seven", null))), "a"));
        assertThrows(ValidationException.class, () -> service.create(draft("Dup", true, List.of(
                new TemplateParameter("a", ParameterType.STRING, false, null, null),
                new TemplateParameter("a", ParameterType.STRING, false, null, null))), "a"));
    }

    @Test
    void deleteWithEnabledScheduleNeedsCascade() {
        JobTemplate tpl = service.create(draft("Backup", true, List.of()), "admin");
        JobSchedule schedule = scheduleService.create(
                new ScheduleDraft("Every minute", tpl.id(), "* * * * *", "UTC", true, null, null), "admin");

        assertThrows(ConflictException.class, () -> service.delete(tpl.id(), false, "admin"));
        assertTrue(scheduleService.get(schedule.id()).isEnabled());

        service.delete(tpl.id(), true, "admin");

        assertThrows(NotFoundException.class, () -> service.get(tpl.id(), "admin"));
        JobSchedule detached = scheduleService.get(schedule.id());
        assertFalse(detached.isEnabled());
        assertNull(detached.templateId());
        assertNull(detached.nextRunAt());
    }

    @Test
    void deleteMissingTemplate() {
        assertThrows(NotFoundException.class, () -> service.delete("tpl-missing", false, "admin"));
    }

    @Test
    void typeAndParametersAreFrozenWhileScheduled() {
        List<TemplateParameter> params = List.of(
                new TemplateParameter("retention", ParameterType.INTEGER, false, 7, null));
        JobTemplate tpl = service.create(draft("Backup", true, params), "admin");
        JobSchedule schedule = scheduleService.create(new ScheduleDraft("Nightly", tpl.id(), "0 2 * * *", "UTC",
                true, Map.of("retention", 3), null), "admin");

        List<TemplateParameter> changed = List.of(
                new TemplateParameter("retention", ParameterType.STRING, false, "7", null));
        assertThrows(ConflictException.class, () -> service.update(tpl.id(), draft("Backup", true, changed), "admin"));

        // renaming and re-describing is still allowed
        JobTemplate renamed = service.update(tpl.id(),
                new TemplateDraft("Backup v2", "example", "new text", null, params, true), "admin");
        assertEquals("Backup v2", renamed.name());
        assertEquals("new text", service.get(tpl.id(), null).description());

        scheduleService.setEnabled(schedule.id(), false);
        JobTemplate retyped = service.update(tpl.id(), draft("Backup v2", true, changed), "admin");
        assertEquals(ParameterType.STRING, retyped.parameters().get(0).type());
    }

    @Test
    void jobTypesAreListed() {
        assertTrue(service.jobTypes().stream().anyMatch(t -> t.value().equals("example")));
    }
}
