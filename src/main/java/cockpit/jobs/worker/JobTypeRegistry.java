package cockpit.jobs.worker;

import cockpit.jobs.model.JobTypeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps a job_type tag to the handler that executes it.
 * Adding a job type means registering a handler here.
 */
public class JobTypeRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobTypeRegistry.class);

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    /**
     * Registry with the built-in job types.
     */
    public static JobTypeRegistry withDefaults() {
        JobTypeRegistry registry = new JobTypeRegistry();
        registry.register(ExampleJobHandler.INFO, new ExampleJobHandler());
        return registry;
    }

    public JobTypeRegistry register(JobTypeInfo info, JobHandler handler) {
        if (info.value() == null || info.value().isBlank()) {
            throw new IllegalArgumentException("job type value is required");
        }
        Registration previous = registrations.put(info.value(), new Registration(info, handler));
        if (previous != null) {
            log.warn("Job type {} re-registered", info.value());
        } else {
            log.debug("Registered job type {}", info.value());
        }
        return this;
    }

    public boolean isRegistered(String jobType) {
        return jobType != null && registrations.containsKey(jobType);
    }

    public Optional<JobHandler> handler(String jobType) {
        Registration registration = jobType == null ? null : registrations.get(jobType);
        return registration == null ? Optional.empty() : Optional.of(registration.handler());
    }

    /**
     * Registered job types sorted by value.
     */
    public List<JobTypeInfo> jobTypes() {
        List<JobTypeInfo> types = new ArrayList<>();
        for (Registration registration : registrations.values()) {
            types.add(registration.info());
        }
        types.sort((a, b) -> a.value().compareTo(b.value()));
        return types;
    }

    private record Registration(JobTypeInfo info, JobHandler handler) {
    }
}
