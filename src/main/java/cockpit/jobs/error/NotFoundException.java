package cockpit.jobs.error;

public class NotFoundException extends JobsException {

    public NotFoundException(String what, String id) {
        super("not_found", what + " not found: " + id);
    }
}
