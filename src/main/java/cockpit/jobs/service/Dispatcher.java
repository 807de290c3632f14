package cockpit.jobs.service;

import cockpit.jobs.backend.BackendException;
import cockpit.jobs.backend.ExecutionBackend;
import cockpit.jobs.error.DispatchException;
import cockpit.jobs.error.NotFoundException;
import cockpit.jobs.error.ValidationException;
import cockpit.jobs.model.JobRun;
import cockpit.jobs.model.JobSchedule;
import cockpit.jobs.model.JobTemplate;
import cockpit.jobs.model.RunErrorCode;
import cockpit.jobs.model.RunStatus;
import cockpit.jobs.repository.JobRunRepository;
import cockpit.jobs.repository.JobScheduleRepository;
import cockpit.jobs.repository.JobTemplateRepository;
import cockpit.jobs.util.Json;
import cockpit.jobs.worker.JobTypeRegistry;
import cockpit.jobs.worker.JobWorker;
import cockpit.jobs.worker.TaskEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns triggers into queued, backend-submitted job runs.
 *
 * The run row is written before submission, and a failed submission turns
 * it FAILED with {@code dispatch_error} before this call returns. A second
 * dispatch for the same schedule occurrence returns the existing run.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final JobTemplateRepository templateRepository;
    private final JobScheduleRepository scheduleRepository;
    private final JobRunRepository runRepository;
    private final JobTypeRegistry jobTypes;
    private final ExecutionBackend backend;
    private final PayloadRenderer renderer;
    private final Clock clock;

    public Dispatcher(JobTemplateRepository templateRepository,
            JobScheduleRepository scheduleRepository,
            JobRunRepository runRepository,
            JobTypeRegistry jobTypes,
            ExecutionBackend backend,
            PayloadRenderer renderer,
            Clock clock) {
        this.templateRepository = templateRepository;
        this.scheduleRepository = scheduleRepository;
        this.runRepository = runRepository;
        this.jobTypes = jobTypes;
        this.backend = backend;
        this.renderer = renderer;
        this.clock = clock;
    }

    /**
     * Dispatch a run.
     *
     * @return the queued run, the FAILED run if submission failed, or the
     *         already existing run of the same schedule occurrence
     * @throws ValidationException if the trigger is invalid
     * @throws NotFoundException   if the template or schedule does not exist
     */
    public JobRun dispatch(DispatchRequest request) {
        JobTemplate template = null;
        if (request.templateId() != null) {
            template = templateRepository.findById(request.templateId())
                    .orElseThrow(() -> new NotFoundException("Job template", request.templateId()));
        }

        JobSchedule schedule = null;
        if (request.scheduleId() != null) {
            schedule = scheduleRepository.findById(request.scheduleId())
                    .orElseThrow(() -> new NotFoundException("Job schedule", request.scheduleId()));
        }

        String jobType = template != null ? template.jobType() : request.jobType();
        if (jobType == null || jobType.isBlank()) {
            throw new ValidationException("jobType is required for ad hoc runs");
        }
        if (!jobTypes.isRegistered(jobType)) {
            throw new ValidationException("unknown job type: " + jobType);
        }

        String jobName = request.jobName();
        if (jobName == null || jobName.isBlank()) {
            jobName = template != null ? template.name() : jobType;
        }

        Map<String, Object> parameters;
        if (template != null) {
            parameters = ParameterResolver.resolve(template.parameters(),
                    schedule != null ? schedule.parameterOverrides() : null,
                    request.parameters());
        } else {
            parameters = request.parameters() != null ? new LinkedHashMap<>(request.parameters()) : Map.of();
        }

        List<String> targetDevices = request.targetDevices();
        if ((targetDevices == null || targetDevices.isEmpty()) && schedule != null) {
            targetDevices = schedule.targetDevices();
        }
        if (targetDevices == null) {
            targetDevices = List.of();
        }

        String rendered = renderer.render(template, jobType, parameters, targetDevices);

        JobRun run = JobRun.builder()
                .id(runRepository.generateId())
                .scheduleId(request.scheduleId())
                .templateId(template != null ? template.id() : null)
                .jobName(jobName)
                .jobType(jobType)
                .status(RunStatus.QUEUED)
                .triggeredBy(request.triggeredBy())
                .scheduledFor(request.isScheduled() ? request.scheduledFor() : null)
                .queuedAt(clock.instant())
                .parameters(parameters)
                .targetDevices(targetDevices)
                .build();

        if (!runRepository.insert(run)) {
            log.info("Schedule {} already dispatched for {}", request.scheduleId(), request.scheduledFor());
            return runRepository.findByOccurrence(request.scheduleId(), request.scheduledFor())
                    .orElseThrow(() -> new IllegalStateException(
                            "Duplicate occurrence without a stored run: " + request.scheduleId()));
        }

        String payload = Json.write(new TaskEnvelope(run.id(), jobName, jobType, parameters, targetDevices, rendered));

        try {
            String taskId = submit(run.id(), payload);
            runRepository.recordExternalTaskId(run.id(), taskId);
            log.info("Dispatched run {} ({}) as task {} by {}", run.id(), jobType, taskId, request.triggeredBy());
        } catch (DispatchException e) {
            log.error("Dispatch of run {} failed", run.id(), e);
            runRepository.markFailed(run.id(), RunErrorCode.DISPATCH_ERROR, e.getMessage(), null, clock.instant());
        }

        return runRepository.findById(run.id())
                .orElseThrow(() -> new IllegalStateException("Run vanished after dispatch: " + run.id()));
    }

    /**
     * Submit with one immediate retry on a transient backend error.
     */
    private String submit(String runId, String payload) {
        try {
            return backend.submit(JobWorker.TASK_TYPE, payload);
        } catch (BackendException e) {
            if (!e.isTransient()) {
                throw new DispatchException("Backend rejected run " + runId + ": " + e.getMessage(), e);
            }
            log.warn("Transient backend error submitting run {}, retrying once: {}", runId, e.getMessage());
        } catch (RuntimeException e) {
            throw new DispatchException("Backend submission failed for run " + runId + ": " + e, e);
        }

        try {
            return backend.submit(JobWorker.TASK_TYPE, payload);
        } catch (RuntimeException e) {
            throw new DispatchException("Backend submission failed for run " + runId + " after retry: "
                    + e.getMessage(), e);
        }
    }
}
