package cockpit.jobs.api;

/**
 * Authorization decision supplied by the host application.
 * The jobs core only asks; it does not know the permission model.
 */
@FunctionalInterface
public interface PermissionGate {

    String TEMPLATES_READ = "jobs.templates:read";
    String TEMPLATES_WRITE = "jobs.templates:write";
    String SCHEDULES_READ = "jobs.schedules:read";
    String SCHEDULES_WRITE = "jobs.schedules:write";
    String RUNS_READ = "jobs.runs:read";
    String RUNS_WRITE = "jobs.runs:write";

    /**
     * @param userId     caller identity, null for anonymous requests
     * @param capability one of the capability constants
     */
    boolean isAuthorized(String userId, String capability);
}
