package cockpit.jobs.service;

import cockpit.jobs.error.ValidationException;
import cockpit.jobs.model.ParameterType;
import cockpit.jobs.model.TemplateParameter;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParameterResolverTest {

    private static final List<TemplateParameter> SCHEMA = List.of(
            new TemplateParameter("retention", ParameterType.INTEGER, false, 7, null),
            new TemplateParameter("ratio", ParameterType.NUMBER, false, 0.5, null),
            new TemplateParameter("dry_run", ParameterType.BOOLEAN, false, false, null),
            new TemplateParameter("paths", ParameterType.LIST, false, null, null),
            new TemplateParameter("target", ParameterType.STRING, true, null, null));

    @Test
    void laterLayersWin() {
        Map<String, Object> effective = ParameterResolver.resolve(SCHEMA,
                Map.of("retention", 3, "target", "/a"),
                Map.of("target", "/b"));

        assertEquals(3, effective.get("retention"));
        assertEquals("/b", effective.get("target"));
        assertEquals(0.5, effective.get("ratio"));
        assertEquals(false, effective.get("dry_run"));
        assertFalse(effective.containsKey("paths"));
    }

    @Test
    void nullOverrideClearsDefault() {
        Map<String, Object> clear = new HashMap<>();
        clear.put("retention", null);
        clear.put("target", "/a");

        Map<String, Object> effective = ParameterResolver.resolve(SCHEMA, clear);

        assertTrue(effective.containsKey("retention"));
        assertNull(effective.get("retention"));
    }

    @Test
    void requiredParameterMustEndUpSet() {
        assertThrows(ValidationException.class, () -> ParameterResolver.resolve(SCHEMA, null, Map.of()));
    }

    @Test
    void typesAreChecked() {
        assertThrows(ValidationException.class,
                () -> ParameterResolver.validateOverrides(SCHEMA, Map.of("retention", 1.5)));
        assertThrows(ValidationException.class,
                () -> ParameterResolver.validateOverrides(SCHEMA, Map.of("paths", "not-a-list")));
        assertThrows(ValidationException.class,
                () -> ParameterResolver.validateOverrides(SCHEMA, Map.of("unknown", 1)));
        assertDoesNotThrow(() -> ParameterResolver.validateOverrides(SCHEMA,
                Map.of("retention", 10L, "ratio", 2, "paths", List.of("/x"))));
    }

    @Test
    void schemaIsValidated() {
        assertDoesNotThrow(() -> ParameterResolver.validateSchema(SCHEMA));
        assertThrows(ValidationException.class, () -> ParameterResolver.validateSchema(List.of(
                new TemplateParameter("x", null, false, null, null))));
        assertThrows(ValidationException.class, () -> ParameterResolver.validateSchema(List.of(
                new TemplateParameter(" ", ParameterType.STRING, false, null, null))));
    }
}
