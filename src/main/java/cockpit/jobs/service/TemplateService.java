package cockpit.jobs.service;

import cockpit.jobs.error.ConflictException;
import cockpit.jobs.error.NotFoundException;
import cockpit.jobs.error.ValidationException;
import cockpit.jobs.model.JobTemplate;
import cockpit.jobs.model.JobTypeInfo;
import cockpit.jobs.repository.JobScheduleRepository;
import cockpit.jobs.repository.JobTemplateRepository;
import cockpit.jobs.worker.JobTypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Job template management.
 *
 * Templates are global or private to their owner; names are unique per
 * scope. While an enabled schedule references a template, its job type and
 * parameter schema are frozen.
 */
public class TemplateService {

    private static final Logger log = LoggerFactory.getLogger(TemplateService.class);

    static final int MAX_NAME_LENGTH = 255;
    static final int MAX_DESCRIPTION_LENGTH = 1000;

    private final JobTemplateRepository templateRepository;
    private final JobScheduleRepository scheduleRepository;
    private final JobTypeRegistry jobTypes;
    private final Clock clock;

    public TemplateService(JobTemplateRepository templateRepository, JobScheduleRepository scheduleRepository,
            JobTypeRegistry jobTypes, Clock clock) {
        this.templateRepository = templateRepository;
        this.scheduleRepository = scheduleRepository;
        this.jobTypes = jobTypes;
        this.clock = clock;
    }

    public List<JobTypeInfo> jobTypes() {
        return jobTypes.jobTypes();
    }

    public JobTemplate create(TemplateDraft draft, String userId) {
        validate(draft);
        String ownerId = draft.global() ? null : requireUser(userId);

        if (templateRepository.existsByName(draft.name().trim(), ownerId, null)) {
            throw new ConflictException("A job template with name '" + draft.name().trim() + "' already exists");
        }

        Instant now = clock.instant();
        JobTemplate template = JobTemplate.builder()
                .id(templateRepository.generateId())
                .name(draft.name().trim())
                .jobType(draft.jobType())
                .description(draft.description())
                .inventorySource(draft.inventorySource())
                .parameters(draft.parameters())
                .global(draft.global())
                .ownerId(ownerId)
                .createdBy(userId)
                .createdAt(now)
                .updatedAt(now)
                .build();

        templateRepository.save(template);
        log.info("Created template {} '{}' ({}) by {}", template.id(), template.name(), template.jobType(), userId);
        return template;
    }

    public JobTemplate update(String templateId, TemplateDraft draft, String userId) {
        JobTemplate existing = get(templateId, userId);
        validate(draft);

        boolean breaking = !existing.jobType().equals(draft.jobType())
                || !existing.parameters().equals(draft.parameters());
        if (breaking) {
            int enabled = scheduleRepository.countEnabledByTemplate(templateId);
            if (enabled > 0) {
                throw new ConflictException("Template " + templateId + " is used by " + enabled
                        + " enabled schedule(s); its job type and parameters cannot change");
            }
        }

        String ownerId = draft.global() ? null
                : existing.ownerId() != null ? existing.ownerId() : requireUser(userId);
        if (templateRepository.existsByName(draft.name().trim(), ownerId, templateId)) {
            throw new ConflictException("A job template with name '" + draft.name().trim() + "' already exists");
        }

        JobTemplate updated = existing.toBuilder()
                .name(draft.name().trim())
                .jobType(draft.jobType())
                .description(draft.description())
                .inventorySource(draft.inventorySource())
                .parameters(draft.parameters())
                .global(draft.global())
                .ownerId(ownerId)
                .updatedAt(clock.instant())
                .build();

        if (!templateRepository.update(updated)) {
            throw new NotFoundException("Job template", templateId);
        }
        log.info("Updated template {}", templateId);
        return updated;
    }

    /**
     * Delete a template.
     *
     * @param cascade disable and detach referencing schedules instead of refusing
     * @throws ConflictException if enabled schedules reference it and cascade is false
     */
    public void delete(String templateId, boolean cascade, String userId) {
        get(templateId, userId);
        switch (templateRepository.delete(templateId, cascade)) {
            case DELETED -> log.info("Deleted template {} (cascade={})", templateId, cascade);
            case NOT_FOUND -> throw new NotFoundException("Job template", templateId);
            case REFERENCED -> throw new ConflictException("Template " + templateId
                    + " is referenced by enabled schedules; delete with cascade to disable them");
        }
    }

    /**
     * @throws NotFoundException if missing or not visible to the user
     */
    public JobTemplate get(String templateId, String userId) {
        return templateRepository.findById(templateId)
                .filter(t -> t.isVisibleTo(userId))
                .orElseThrow(() -> new NotFoundException("Job template", templateId));
    }

    public List<JobTemplate> list(String userId, String jobType) {
        return templateRepository.findVisible(userId, jobType);
    }

    private void validate(TemplateDraft draft) {
        if (draft.name() == null || draft.name().isBlank()) {
            throw new ValidationException("name is required");
        }
        if (draft.name().trim().length() > MAX_NAME_LENGTH) {
            throw new ValidationException("name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (draft.description() != null && draft.description().length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        if (draft.jobType() == null || draft.jobType().isBlank()) {
            throw new ValidationException("jobType is required");
        }
        if (!jobTypes.isRegistered(draft.jobType())) {
            throw new ValidationException("unknown job type: " + draft.jobType());
        }
        ParameterResolver.validateSchema(draft.parameters());
    }

    private static String requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("private templates need a user");
        }
        return userId;
    }
}
