package cockpit.jobs.api.v1.dto;

import cockpit.jobs.model.InventorySource;
import cockpit.jobs.model.TemplateParameter;
import cockpit.jobs.service.TemplateDraft;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request DTO for creating or replacing a job template.
 * POST /api/v1/templates, PUT /api/v1/templates/{id}
 */
public record TemplateRequest(
        @JsonProperty("name") String name,
        @JsonProperty("jobType") String jobType,
        @JsonProperty("description") String description,
        @JsonProperty("inventorySource") String inventorySource,
        @JsonProperty("parameters") List<TemplateParameter> parameters,
        @JsonProperty("isGlobal") Boolean isGlobal) {

    public TemplateDraft toDraft() {
        return new TemplateDraft(
                name,
                jobType,
                description,
                InventorySource.parse(inventorySource),
                parameters,
                Boolean.TRUE.equals(isGlobal));
    }
}
