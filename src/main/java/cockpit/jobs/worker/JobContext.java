package cockpit.jobs.worker;

import cockpit.jobs.service.JobRunService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a handler sees of the run it executes: its payload, a progress
 * sink and the cancellation checkpoint.
 */
public class JobContext {

    private static final Logger log = LoggerFactory.getLogger(JobContext.class);

    private final TaskEnvelope envelope;
    private final int attempt;
    private final JobRunService runService;
    private final Duration heartbeatInterval;
    private final Map<String, Object> partialResult = new LinkedHashMap<>();

    private Instant lastHeartbeat;

    public JobContext(TaskEnvelope envelope, int attempt, JobRunService runService, Duration heartbeatInterval) {
        this.envelope = envelope;
        this.attempt = attempt;
        this.runService = runService;
        this.heartbeatInterval = heartbeatInterval;
        this.lastHeartbeat = runService.clock().instant();
    }

    public String runId() {
        return envelope.runId();
    }

    public String jobName() {
        return envelope.jobName();
    }

    public String jobType() {
        return envelope.jobType();
    }

    public Map<String, Object> parameters() {
        return envelope.parameters();
    }

    public Object parameter(String name) {
        return envelope.parameters().get(name);
    }

    public List<String> targetDevices() {
        return envelope.targetDevices();
    }

    public String renderedPayload() {
        return envelope.rendered();
    }

    /** 1 for the first delivery, higher on redelivery */
    public int attempt() {
        return attempt;
    }

    public void progress(String step, int percent) {
        runService.reportProgress(runId(), step, percent, null, null);
    }

    /**
     * Report step-based progress; percent is derived from the step counts.
     */
    public void progress(String step, int currentStep, int totalSteps) {
        int percent = totalSteps > 0 ? (int) Math.round(currentStep * 100.0 / totalSteps) : 0;
        runService.reportProgress(runId(), step, percent, currentStep, totalSteps);
    }

    /**
     * Record part of the result so it survives a cancellation or failure.
     */
    public void putPartial(String key, Object value) {
        partialResult.put(key, value);
    }

    public Map<String, Object> partialResult() {
        return partialResult.isEmpty() ? null : Collections.unmodifiableMap(new LinkedHashMap<>(partialResult));
    }

    /**
     * Safe point between steps: refreshes the heartbeat and stops the job
     * if cancellation was requested.
     *
     * @throws JobCancelledException if the run should stop
     */
    public void checkpoint() {
        Instant now = runService.clock().instant();
        if (!now.isBefore(lastHeartbeat.plus(heartbeatInterval))) {
            runService.heartbeat(runId());
            lastHeartbeat = now;
        }
        if (runService.isCancelRequested(runId())) {
            log.info("Run {} observed cancellation", runId());
            throw new JobCancelledException(runId());
        }
    }
}
