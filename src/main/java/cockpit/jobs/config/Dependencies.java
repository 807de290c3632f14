package cockpit.jobs.config;

import cockpit.jobs.api.AllowAllPermissionGate;
import cockpit.jobs.api.PermissionGate;
import cockpit.jobs.api.v1.HealthController;
import cockpit.jobs.api.v1.JobRunController;
import cockpit.jobs.api.v1.JobTypeController;
import cockpit.jobs.api.v1.ScheduleController;
import cockpit.jobs.api.v1.TemplateController;
import cockpit.jobs.backend.InProcessExecutionBackend;
import cockpit.jobs.repository.JobRunRepository;
import cockpit.jobs.repository.JobScheduleRepository;
import cockpit.jobs.repository.JobTemplateRepository;
import cockpit.jobs.scheduler.ResultJanitor;
import cockpit.jobs.scheduler.RunReconciler;
import cockpit.jobs.scheduler.ScheduleTicker;
import cockpit.jobs.scheduler.Scheduler;
import cockpit.jobs.server.RouterHandler;
import cockpit.jobs.service.Dispatcher;
import cockpit.jobs.service.JobRunService;
import cockpit.jobs.service.JsonPayloadRenderer;
import cockpit.jobs.service.ProgressTracker;
import cockpit.jobs.service.ScheduleService;
import cockpit.jobs.service.TemplateService;
import cockpit.jobs.store.Database;
import cockpit.jobs.store.JdbcJobRunRepository;
import cockpit.jobs.store.JdbcJobScheduleRepository;
import cockpit.jobs.store.JdbcJobTemplateRepository;
import cockpit.jobs.worker.JobTypeRegistry;
import cockpit.jobs.worker.JobWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(JobsConfig.fromEnv());
 * deps.startScheduler(); // start background loops
 * Dispatcher dispatcher = deps.dispatcher();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final JobsConfig config;
    private final Clock clock;
    private final Database database;
    private final JobTemplateRepository templateRepository;
    private final JobScheduleRepository scheduleRepository;
    private final JobRunRepository runRepository;
    private final JobTypeRegistry jobTypes;
    private final InProcessExecutionBackend backend;
    private final ProgressTracker progressTracker;
    private final JobRunService runService;
    private final Dispatcher dispatcher;
    private final TemplateService templateService;
    private final ScheduleService scheduleService;
    private final JobWorker worker;
    private final PermissionGate permissionGate;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(JobsConfig config, JobTypeRegistry jobTypes, PermissionGate permissionGate) {
        this.config = config;
        this.clock = Clock.systemUTC();
        this.jobTypes = jobTypes;
        this.permissionGate = permissionGate;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.backend = new InProcessExecutionBackend(config.workerSlots(), Duration.ofSeconds(1), clock);
        this.progressTracker = new ProgressTracker();

        // Repositories
        this.templateRepository = new JdbcJobTemplateRepository(database);
        this.scheduleRepository = new JdbcJobScheduleRepository(database);
        this.runRepository = new JdbcJobRunRepository(database);

        // Services
        this.runService = new JobRunService(runRepository, backend, progressTracker, clock);
        this.dispatcher = new Dispatcher(templateRepository, scheduleRepository, runRepository, jobTypes, backend,
                new JsonPayloadRenderer(), clock);
        this.templateService = new TemplateService(templateRepository, scheduleRepository, jobTypes, clock);
        this.scheduleService = new ScheduleService(scheduleRepository, templateRepository, clock);

        // Worker side
        this.worker = new JobWorker(jobTypes, runService, "in-process-" + ProcessHandle.current().pid(),
                config.maxAttempts(), config.heartbeatInterval());
        this.backend.registerConsumer(JobWorker.TASK_TYPE, worker);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     */
    public static Dependencies create(JobsConfig config) {
        return create(config, JobTypeRegistry.withDefaults(), new AllowAllPermissionGate());
    }

    /**
     * Create dependencies with custom job types and authorization.
     */
    public static Dependencies create(JobsConfig config, JobTypeRegistry jobTypes, PermissionGate permissionGate) {
        return new Dependencies(config, jobTypes, permissionGate);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(JobsConfig.fromEnv());
    }

    // Getters
    public JobsConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public JobTemplateRepository templateRepository() {
        return templateRepository;
    }

    public JobScheduleRepository scheduleRepository() {
        return scheduleRepository;
    }

    public JobRunRepository runRepository() {
        return runRepository;
    }

    public JobTypeRegistry jobTypes() {
        return jobTypes;
    }

    public InProcessExecutionBackend backend() {
        return backend;
    }

    public ProgressTracker progressTracker() {
        return progressTracker;
    }

    public JobRunService runService() {
        return runService;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    public TemplateService templateService() {
        return templateService;
    }

    public ScheduleService scheduleService() {
        return scheduleService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(permissionGate)
                    .registerController(new HealthController(database, backend, runService, progressTracker,
                            () -> scheduler != null && scheduler.isRunning()))
                    .registerController(new JobTypeController(templateService))
                    .registerController(new TemplateController(templateService))
                    .registerController(new ScheduleController(scheduleService, dispatcher))
                    .registerController(new JobRunController(dispatcher, runService));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(
                    new ScheduleTicker(scheduleRepository, dispatcher, clock),
                    new RunReconciler(runService, backend, config.staleThreshold(), clock),
                    new ResultJanitor(backend, config.resultRetention()),
                    config);
        }
        return scheduler;
    }

    /**
     * Start the schedule ticker and the reconciliation sweep.
     */
    public void startScheduler() {
        scheduler().start();
    }

    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first so no new runs are dispatched
        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (RuntimeException e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            backend.close();
        } catch (RuntimeException e) {
            log.warn("Error stopping worker pool: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (RuntimeException e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
