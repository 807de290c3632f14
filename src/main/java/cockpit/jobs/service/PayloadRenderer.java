package cockpit.jobs.service;

import cockpit.jobs.model.JobTemplate;

import java.util.List;
import java.util.Map;

/**
 * Turns a template and its effective parameters into the instruction set a
 * worker executes. The output is opaque to the orchestration core.
 */
@FunctionalInterface
public interface PayloadRenderer {

    /**
     * @param template null for ad hoc runs
     */
    String render(JobTemplate template, String jobType, Map<String, Object> parameters, List<String> targetDevices);
}
