package cockpit.jobs.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable recurrence rule binding a template to automatic triggering.
 * The schedule only references its template and its most recent run by id.
 */
public final class JobSchedule {
    private final String id;
    private final String name;
    private final String templateId; // null once detached from a deleted template
    private final String cronExpression;
    private final String timeZone;
    private final boolean enabled;
    private final Map<String, Object> parameterOverrides;
    private final List<String> targetDevices;
    private final Instant nextRunAt;
    private final String lastRunId;
    private final String createdBy;
    private final Instant createdAt;
    private final Instant updatedAt;

    private JobSchedule(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.templateId = builder.templateId;
        this.cronExpression = Objects.requireNonNull(builder.cronExpression, "cronExpression is required");
        this.timeZone = builder.timeZone != null ? builder.timeZone : "UTC";
        this.enabled = builder.enabled;
        this.parameterOverrides = builder.parameterOverrides != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.parameterOverrides))
                : Map.of();
        this.targetDevices = builder.targetDevices != null ? List.copyOf(builder.targetDevices) : List.of();
        this.nextRunAt = builder.nextRunAt;
        this.lastRunId = builder.lastRunId;
        this.createdBy = builder.createdBy;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String templateId() {
        return templateId;
    }

    public String cronExpression() {
        return cronExpression;
    }

    public String timeZone() {
        return timeZone;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Map<String, Object> parameterOverrides() {
        return parameterOverrides;
    }

    public List<String> targetDevices() {
        return targetDevices;
    }

    public Instant nextRunAt() {
        return nextRunAt;
    }

    public String lastRunId() {
        return lastRunId;
    }

    public String createdBy() {
        return createdBy;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Check if this schedule should fire at the given instant */
    public boolean isDue(Instant now) {
        return enabled && nextRunAt != null && !nextRunAt.isAfter(now);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .templateId(templateId)
                .cronExpression(cronExpression)
                .timeZone(timeZone)
                .enabled(enabled)
                .parameterOverrides(parameterOverrides)
                .targetDevices(targetDevices)
                .nextRunAt(nextRunAt)
                .lastRunId(lastRunId)
                .createdBy(createdBy)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String name;
        private String templateId;
        private String cronExpression;
        private String timeZone = "UTC";
        private boolean enabled = true;
        private Map<String, Object> parameterOverrides = Map.of();
        private List<String> targetDevices = List.of();
        private Instant nextRunAt;
        private String lastRunId;
        private String createdBy;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder templateId(String templateId) {
            this.templateId = templateId;
            return this;
        }

        public Builder cronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
            return this;
        }

        public Builder timeZone(String timeZone) {
            this.timeZone = timeZone;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder parameterOverrides(Map<String, Object> parameterOverrides) {
            this.parameterOverrides = parameterOverrides;
            return this;
        }

        public Builder targetDevices(List<String> targetDevices) {
            this.targetDevices = targetDevices;
            return this;
        }

        public Builder nextRunAt(Instant nextRunAt) {
            this.nextRunAt = nextRunAt;
            return this;
        }

        public Builder lastRunId(String lastRunId) {
            this.lastRunId = lastRunId;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public JobSchedule build() {
            return new JobSchedule(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobSchedule that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "JobSchedule{id='" + id + "', cron='" + cronExpression + "', enabled=" + enabled
                + ", nextRunAt=" + nextRunAt + "}";
    }
}
