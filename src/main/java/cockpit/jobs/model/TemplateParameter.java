package cockpit.jobs.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a template's parameter schema.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TemplateParameter(
        @JsonProperty("name") String name,
        @JsonProperty("type") ParameterType type,
        @JsonProperty("required") boolean required,
        @JsonProperty("defaultValue") Object defaultValue,
        @JsonProperty("description") String description) {
}
