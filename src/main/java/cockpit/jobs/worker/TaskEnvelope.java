package cockpit.jobs.worker;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Payload submitted to the execution backend for one run.
 *
 * @param rendered output of the payload renderer, opaque to the worker
 */
public record TaskEnvelope(
        @JsonProperty("runId") String runId,
        @JsonProperty("jobName") String jobName,
        @JsonProperty("jobType") String jobType,
        @JsonProperty("parameters") Map<String, Object> parameters,
        @JsonProperty("targetDevices") List<String> targetDevices,
        @JsonProperty("rendered") String rendered) {

    public TaskEnvelope {
        parameters = parameters != null ? parameters : Map.of();
        targetDevices = targetDevices != null ? targetDevices : List.of();
    }
}
