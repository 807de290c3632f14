package cockpit.jobs.service;

import cockpit.jobs.error.NotFoundException;
import cockpit.jobs.error.ValidationException;
import cockpit.jobs.model.JobSchedule;
import cockpit.jobs.model.JobTemplate;
import cockpit.jobs.repository.JobScheduleRepository;
import cockpit.jobs.repository.JobTemplateRepository;
import cockpit.jobs.scheduler.CronSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Job schedule management.
 *
 * next_run_at is derived here whenever a schedule is created, enabled or
 * given a new cron expression; the scheduler loop only moves it forward.
 * Disabling a schedule leaves runs it already triggered alone.
 */
public class ScheduleService {

    private static final Logger log = LoggerFactory.getLogger(ScheduleService.class);

    private final JobScheduleRepository scheduleRepository;
    private final JobTemplateRepository templateRepository;
    private final Clock clock;

    public ScheduleService(JobScheduleRepository scheduleRepository, JobTemplateRepository templateRepository,
            Clock clock) {
        this.scheduleRepository = scheduleRepository;
        this.templateRepository = templateRepository;
        this.clock = clock;
    }

    public JobSchedule create(ScheduleDraft draft, String userId) {
        if (draft.templateId() == null || draft.templateId().isBlank()) {
            throw new ValidationException("templateId is required");
        }
        JobTemplate template = templateRepository.findById(draft.templateId())
                .orElseThrow(() -> new ValidationException("unknown template: " + draft.templateId()));
        CronSchedule cron = validate(draft, template);

        Instant now = clock.instant();
        JobSchedule schedule = JobSchedule.builder()
                .id(scheduleRepository.generateId())
                .name(draft.name().trim())
                .templateId(template.id())
                .cronExpression(cron.expression())
                .timeZone(cron.zone().getId())
                .enabled(draft.enabled())
                .parameterOverrides(draft.parameterOverrides())
                .targetDevices(draft.targetDevices())
                .nextRunAt(draft.enabled() ? cron.nextAfter(now) : null)
                .createdBy(userId)
                .createdAt(now)
                .updatedAt(now)
                .build();

        scheduleRepository.save(schedule);
        log.info("Created schedule {} '{}' for template {} ({}), next run {}",
                schedule.id(), schedule.name(), template.id(), cron.expression(), schedule.nextRunAt());
        return schedule;
    }

    public JobSchedule update(String scheduleId, ScheduleDraft draft) {
        JobSchedule existing = get(scheduleId);
        if (draft.templateId() != null && !draft.templateId().equals(existing.templateId())) {
            throw new ValidationException("templateId of a schedule cannot change");
        }

        JobTemplate template = null;
        if (existing.templateId() != null) {
            template = templateRepository.findById(existing.templateId()).orElse(null);
        }
        if (template == null && draft.enabled()) {
            throw new ValidationException("schedule " + scheduleId + " has no template and cannot be enabled");
        }
        CronSchedule cron = validate(draft, template);

        boolean timingChanged = !cron.expression().equals(existing.cronExpression())
                || !cron.zone().getId().equals(existing.timeZone());
        Instant nextRunAt = nextRunAt(existing, draft.enabled(), timingChanged, cron);

        JobSchedule updated = existing.toBuilder()
                .name(draft.name().trim())
                .cronExpression(cron.expression())
                .timeZone(cron.zone().getId())
                .enabled(draft.enabled())
                .parameterOverrides(draft.parameterOverrides())
                .targetDevices(draft.targetDevices())
                .nextRunAt(nextRunAt)
                .updatedAt(clock.instant())
                .build();

        if (!scheduleRepository.update(updated)) {
            throw new NotFoundException("Job schedule", scheduleId);
        }
        log.info("Updated schedule {} (enabled={}, next run {})", scheduleId, updated.isEnabled(), nextRunAt);
        return updated;
    }

    public JobSchedule setEnabled(String scheduleId, boolean enabled) {
        JobSchedule existing = get(scheduleId);
        return update(scheduleId, new ScheduleDraft(existing.name(), null, existing.cronExpression(),
                existing.timeZone(), enabled, existing.parameterOverrides(), existing.targetDevices()));
    }

    public void delete(String scheduleId) {
        if (!scheduleRepository.delete(scheduleId)) {
            throw new NotFoundException("Job schedule", scheduleId);
        }
        log.info("Deleted schedule {}", scheduleId);
    }

    public JobSchedule get(String scheduleId) {
        return scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new NotFoundException("Job schedule", scheduleId));
    }

    public List<JobSchedule> list(String templateId) {
        return scheduleRepository.findAll(templateId);
    }

    private CronSchedule validate(ScheduleDraft draft, JobTemplate template) {
        if (draft.name() == null || draft.name().isBlank()) {
            throw new ValidationException("name is required");
        }
        if (draft.name().trim().length() > TemplateService.MAX_NAME_LENGTH) {
            throw new ValidationException("name must be at most " + TemplateService.MAX_NAME_LENGTH + " characters");
        }
        CronSchedule cron = CronSchedule.parse(draft.cronExpression(), draft.timeZone());
        if (template != null) {
            ParameterResolver.validateOverrides(template.parameters(), draft.parameterOverrides());
        }
        return cron;
    }

    private Instant nextRunAt(JobSchedule existing, boolean enabled, boolean timingChanged, CronSchedule cron) {
        if (!enabled) {
            return null;
        }
        if (!existing.isEnabled() || timingChanged || existing.nextRunAt() == null) {
            return cron.nextAfter(clock.instant());
        }
        return existing.nextRunAt();
    }
}
