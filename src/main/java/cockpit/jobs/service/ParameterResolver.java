package cockpit.jobs.service;

import cockpit.jobs.error.ValidationException;
import cockpit.jobs.model.TemplateParameter;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validation of parameter schemas and merging of parameter layers.
 */
final class ParameterResolver {

    private ParameterResolver() {
    }

    /**
     * Check a template's parameter schema.
     */
    static void validateSchema(List<TemplateParameter> schema) {
        Set<String> names = new HashSet<>();
        for (TemplateParameter p : schema) {
            if (p == null || p.name() == null || p.name().isBlank()) {
                throw new ValidationException("parameter name is required");
            }
            if (p.type() == null) {
                throw new ValidationException("parameter '" + p.name() + "' has no type");
            }
            if (!names.add(p.name())) {
                throw new ValidationException("duplicate parameter: " + p.name());
            }
            if (!p.type().accepts(p.defaultValue())) {
                throw new ValidationException("default of parameter '" + p.name() + "' is not a " + p.type());
            }
        }
    }

    /**
     * Check that overrides only name declared parameters with matching types.
     */
    static void validateOverrides(List<TemplateParameter> schema, Map<String, Object> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return;
        }
        Map<String, TemplateParameter> byName = index(schema);
        for (Map.Entry<String, Object> e : overrides.entrySet()) {
            TemplateParameter p = byName.get(e.getKey());
            if (p == null) {
                throw new ValidationException("unknown parameter: " + e.getKey());
            }
            if (!p.type().accepts(e.getValue())) {
                throw new ValidationException("parameter '" + e.getKey() + "' must be a " + p.type());
            }
        }
    }

    /**
     * Effective parameters: template defaults, then each override layer in order.
     *
     * @throws ValidationException if a required parameter ends up without a value
     */
    @SafeVarargs
    static Map<String, Object> resolve(List<TemplateParameter> schema, Map<String, Object>... layers) {
        Map<String, Object> effective = new LinkedHashMap<>();
        for (TemplateParameter p : schema) {
            if (p.defaultValue() != null) {
                effective.put(p.name(), p.defaultValue());
            }
        }
        for (Map<String, Object> layer : layers) {
            validateOverrides(schema, layer);
            if (layer != null) {
                effective.putAll(layer);
            }
        }
        for (TemplateParameter p : schema) {
            if (p.required() && effective.get(p.name()) == null) {
                throw new ValidationException("missing required parameter: " + p.name());
            }
        }
        return effective;
    }

    private static Map<String, TemplateParameter> index(List<TemplateParameter> schema) {
        Map<String, TemplateParameter> byName = new LinkedHashMap<>();
        for (TemplateParameter p : schema) {
            byName.put(p.name(), p);
        }
        return byName;
    }
}
