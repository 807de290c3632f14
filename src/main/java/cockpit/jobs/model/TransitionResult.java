package cockpit.jobs.model;

/**
 * Outcome of a state-machine transition request.
 */
public enum TransitionResult {
    /** The run moved to the requested state */
    APPLIED,

    /** The run was already terminal; the earlier terminal state is kept */
    ALREADY_TERMINAL,

    /** Run not found */
    NOT_FOUND,

    /** The run is in a state the transition does not start from */
    INVALID_STATE
}
