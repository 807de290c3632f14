package cockpit.jobs.service;

import cockpit.jobs.model.InventorySource;
import cockpit.jobs.model.TemplateParameter;

import java.util.List;

/**
 * Editable fields of a job template, as submitted by a user.
 */
public record TemplateDraft(
        String name,
        String jobType,
        String description,
        InventorySource inventorySource,
        List<TemplateParameter> parameters,
        boolean global) {

    public TemplateDraft {
        inventorySource = inventorySource != null ? inventorySource : InventorySource.ALL;
        parameters = parameters != null ? parameters : List.of();
    }
}
