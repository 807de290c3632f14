package cockpit.jobs.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Registered job type as shown to clients.
 */
public record JobTypeInfo(
        @JsonProperty("value") String value,
        @JsonProperty("label") String label,
        @JsonProperty("description") String description) {
}
