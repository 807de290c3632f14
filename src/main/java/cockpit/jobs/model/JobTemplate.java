package cockpit.jobs.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable reusable job definition.
 * A template is either global (visible to every user) or private to its owner.
 */
public final class JobTemplate {
    private final String id;
    private final String name;
    private final String jobType;
    private final String description;
    private final InventorySource inventorySource;
    private final List<TemplateParameter> parameters;
    private final boolean global;
    private final String ownerId; // null for global templates
    private final String createdBy;
    private final Instant createdAt;
    private final Instant updatedAt;

    private JobTemplate(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.jobType = Objects.requireNonNull(builder.jobType, "jobType is required");
        this.description = builder.description;
        this.inventorySource = builder.inventorySource != null ? builder.inventorySource : InventorySource.ALL;
        this.parameters = builder.parameters != null ? List.copyOf(builder.parameters) : List.of();
        this.global = builder.global;
        this.ownerId = builder.global ? null : builder.ownerId;
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

    public String jobType() {
        return jobType;
    }

    public String description() {
        return description;
    }

    public InventorySource inventorySource() {
        return inventorySource;
    }

    public List<TemplateParameter> parameters() {
        return parameters;
    }

    public boolean isGlobal() {
        return global;
    }

    public String ownerId() {
        return ownerId;
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

    /** Check if the given user may see this template */
    public boolean isVisibleTo(String userId) {
        return global || (ownerId != null && ownerId.equals(userId));
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .jobType(jobType)
                .description(description)
                .inventorySource(inventorySource)
                .parameters(parameters)
                .global(global)
                .ownerId(ownerId)
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
        private String jobType;
        private String description;
        private InventorySource inventorySource = InventorySource.ALL;
        private List<TemplateParameter> parameters = List.of();
        private boolean global;
        private String ownerId;
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

        public Builder jobType(String jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder inventorySource(InventorySource inventorySource) {
            this.inventorySource = inventorySource;
            return this;
        }

        public Builder parameters(List<TemplateParameter> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder global(boolean global) {
            this.global = global;
            return this;
        }

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
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

        public JobTemplate build() {
            return new JobTemplate(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof JobTemplate that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "JobTemplate{id='" + id + "', name='" + name + "', jobType=" + jobType + ", global=" + global + "}";
    }
}
