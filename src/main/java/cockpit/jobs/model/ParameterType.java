package cockpit.jobs.model;

import java.math.BigInteger;
import java.util.List;

/**
 * Type of a template parameter. Values come from JSON, so integers may arrive
 * as Integer, Long or BigInteger.
 */
public enum ParameterType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    LIST;

    /** Check if a decoded JSON value is acceptable for this type. Null is always accepted. */
    public boolean accepts(Object value) {
        if (value == null) {
            return true;
        }
        return switch (this) {
            case STRING -> value instanceof String;
            case INTEGER -> value instanceof Integer || value instanceof Long
                    || value instanceof Short || value instanceof BigInteger;
            case NUMBER -> value instanceof Number;
            case BOOLEAN -> value instanceof Boolean;
            case LIST -> value instanceof List<?>;
        };
    }
}
