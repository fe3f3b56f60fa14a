package reportflow.engine.model;

/**
 * What started a run.
 */
public enum RunTrigger {
    /** Fired by the scheduler's calendar */
    SCHEDULED,
    /** Requested directly by a caller */
    MANUAL
}
