package cockpit.jobs.error;

/**
 * Rejected template, schedule or dispatch input. Raised before anything is persisted.
 * Extends IllegalArgumentException so generic argument checks and domain
 * validation map to the same 400 response.
 */
public class ValidationException extends IllegalArgumentException {

    public static final String CODE = "validation_error";

    public ValidationException(String message) {
        super(message);
    }

    public String errorCode() {
        return CODE;
    }
}
