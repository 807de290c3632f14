package cockpit.jobs.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of the authoritative execution record of one dispatch.
 * Runs are never deleted; they only move forward through {@link RunStatus}.
 */
public final class JobRun {
    private final String id;
    private final String scheduleId;
    private final String templateId;
    private final String externalTaskId;
    private final String jobName;
    private final String jobType;
    private final RunStatus status;
    private final String triggeredBy;
    private final Instant scheduledFor;
    private final Instant queuedAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final RunErrorCode errorCode;
    private final String errorMessage;
    private final Map<String, Object> result;
    private final Map<String, Object> parameters;
    private final List<String> targetDevices;
    private final String executedBy;
    private final int attempts;
    private final boolean cancelRequested;
    private final Instant heartbeatAt;

    private JobRun(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.jobName = Objects.requireNonNull(builder.jobName, "jobName is required");
        this.jobType = Objects.requireNonNull(builder.jobType, "jobType is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.scheduleId = builder.scheduleId;
        this.templateId = builder.templateId;
        this.externalTaskId = builder.externalTaskId;
        this.triggeredBy = builder.triggeredBy;
        this.scheduledFor = builder.scheduledFor;
        this.queuedAt = builder.queuedAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.errorCode = builder.errorCode;
        this.errorMessage = builder.errorMessage;
        this.result = copy(builder.result);
        this.parameters = builder.parameters != null ? copy(builder.parameters) : Map.of();
        this.targetDevices = builder.targetDevices != null ? List.copyOf(builder.targetDevices) : List.of();
        this.executedBy = builder.executedBy;
        this.attempts = builder.attempts;
        this.cancelRequested = builder.cancelRequested;
        this.heartbeatAt = builder.heartbeatAt;
    }

    private static Map<String, Object> copy(Map<String, Object> map) {
        return map == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    public String id() {
        return id;
    }

    public String scheduleId() {
        return scheduleId;
    }

    public String templateId() {
        return templateId;
    }

    public String externalTaskId() {
        return externalTaskId;
    }

    public String jobName() {
        return jobName;
    }

    public String jobType() {
        return jobType;
    }

    public RunStatus status() {
        return status;
    }

    public String triggeredBy() {
        return triggeredBy;
    }

    public Instant scheduledFor() {
        return scheduledFor;
    }

    public Instant queuedAt() {
        return queuedAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public RunErrorCode errorCode() {
        return errorCode;
    }

    public String errorMessage() {
        return errorMessage;
    }

    /** Job-type specific result payload, null until the run produced one */
    public Map<String, Object> result() {
        return result;
    }

    public Map<String, Object> parameters() {
        return parameters;
    }

    public List<String> targetDevices() {
        return targetDevices;
    }

    public String executedBy() {
        return executedBy;
    }

    public int attempts() {
        return attempts;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public Instant heartbeatAt() {
        return heartbeatAt;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** completed_at minus started_at, null unless both are known */
    public Duration duration() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt);
    }

    /** Latest sign of life, used by reconciliation */
    public Instant lastSeenAt() {
        if (heartbeatAt != null) {
            return heartbeatAt;
        }
        return startedAt != null ? startedAt : queuedAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .scheduleId(scheduleId)
                .templateId(templateId)
                .externalTaskId(externalTaskId)
                .jobName(jobName)
                .jobType(jobType)
                .status(status)
                .triggeredBy(triggeredBy)
                .scheduledFor(scheduledFor)
                .queuedAt(queuedAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .result(result)
                .parameters(parameters)
                .targetDevices(targetDevices)
                .executedBy(executedBy)
                .attempts(attempts)
                .cancelRequested(cancelRequested)
                .heartbeatAt(heartbeatAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String scheduleId;
        private String templateId;
        private String externalTaskId;
        private String jobName;
        private String jobType;
        private RunStatus status = RunStatus.QUEUED;
        private String triggeredBy;
        private Instant scheduledFor;
        private Instant queuedAt;
        private Instant startedAt;
        private Instant completedAt;
        private RunErrorCode errorCode;
        private String errorMessage;
        private Map<String, Object> result;
        private Map<String, Object> parameters = Map.of();
        private List<String> targetDevices = List.of();
        private String executedBy;
        private int attempts;
        private boolean cancelRequested;
        private Instant heartbeatAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder scheduleId(String scheduleId) {
            this.scheduleId = scheduleId;
            return this;
        }

        public Builder templateId(String templateId) {
            this.templateId = templateId;
            return this;
        }

        public Builder externalTaskId(String externalTaskId) {
            this.externalTaskId = externalTaskId;
            return this;
        }

        public Builder jobName(String jobName) {
            this.jobName = jobName;
            return this;
        }

        public Builder jobType(String jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        public Builder triggeredBy(String triggeredBy) {
            this.triggeredBy = triggeredBy;
            return this;
        }

        public Builder scheduledFor(Instant scheduledFor) {
            this.scheduledFor = scheduledFor;
            return this;
        }

        public Builder queuedAt(Instant queuedAt) {
            this.queuedAt = queuedAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder errorCode(RunErrorCode errorCode) {
            this.errorCode = errorCode;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder result(Map<String, Object> result) {
            this.result = result;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder targetDevices(List<String> targetDevices) {
            this.targetDevices = targetDevices;
            return this;
        }

        public Builder executedBy(String executedBy) {
            this.executedBy = executedBy;
            return this;
        }

        public Builder attempts(int attempts) {
            this.attempts = attempts;
            return this;
        }

        public Builder cancelRequested(boolean cancelRequested) {
            this.cancelRequested = cancelRequested;
            return this;
        }

        public Builder heartbeatAt(Instant heartbeatAt) {
            this.heartbeatAt = heartbeatAt;
            return this;
        }

        public JobRun build() {
            return new JobRun(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobRun jobRun))
            return false;
        return Objects.equals(id, jobRun.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "JobRun{id='" + id + "', jobType=" + jobType + ", status=" + status + "}";
    }
}
