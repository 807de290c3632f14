package cockpit.jobs.error;

/**
 * Duplicate name, or an operation blocked by a referencing entity.
 */
public class ConflictException extends JobsException {

    public ConflictException(String message) {
        super("conflict", message);
    }
}
