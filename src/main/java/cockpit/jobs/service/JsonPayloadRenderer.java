package cockpit.jobs.service;

import cockpit.jobs.model.JobTemplate;
import cockpit.jobs.util.Json;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default renderer: a JSON document with the job type, template reference,
 * inventory source, parameters and target devices.
 */
public class JsonPayloadRenderer implements PayloadRenderer {

    @Override
    public String render(JobTemplate template, String jobType, Map<String, Object> parameters,
            List<String> targetDevices) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("job_type", jobType);
        if (template != null) {
            doc.put("template_id", template.id());
            doc.put("template_name", template.name());
            doc.put("inventory_source", template.inventorySource().value());
        }
        doc.put("parameters", parameters);
        doc.put("target_devices", targetDevices);
        return Json.write(doc);
    }
}
