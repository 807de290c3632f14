package cockpit.jobs.api.v1.dto;

import cockpit.jobs.model.JobTemplate;
import cockpit.jobs.model.TemplateParameter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a job template.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TemplateResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("jobType") String jobType,
        @JsonProperty("description") String description,
        @JsonProperty("inventorySource") String inventorySource,
        @JsonProperty("parameters") List<TemplateParameter> parameters,
        @JsonProperty("isGlobal") boolean isGlobal,
        @JsonProperty("ownerId") String ownerId,
        @JsonProperty("createdBy") String createdBy,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("updatedAt") Instant updatedAt) {

    public static TemplateResponse from(JobTemplate t) {
        return new TemplateResponse(
                t.id(),
                t.name(),
                t.jobType(),
                t.description(),
                t.inventorySource().value(),
                t.parameters(),
                t.isGlobal(),
                t.ownerId(),
                t.createdBy(),
                t.createdAt(),
                t.updatedAt());
    }
}
