package cockpit.jobs.model;

/**
 * Outcome of a cancellation request.
 */
public enum CancelResult {
    /** Queued run cancelled immediately */
    CANCELLED,
    /** Running run flagged; the worker stops at its next checkpoint */
    CANCEL_REQUESTED,
    /** Run already finished; nothing changed */
    ALREADY_TERMINAL,
    NOT_FOUND
}
