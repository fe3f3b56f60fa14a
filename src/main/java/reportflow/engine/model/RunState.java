package reportflow.engine.model;

/**
 * Lifecycle of a single run.
 *
 * <pre>
 * QUEUED -> RUNNING -> SUCCESS
 *                   \-> FAILED
 * </pre>
 *
 * No transition skips a state and nothing leaves a terminal state.
 */
public enum RunState {
    /** Run record created, query not started */
    QUEUED,
    /** Query execution in progress */
    RUNNING,
    /** Query and artifact write both succeeded */
    SUCCESS,
    /** Some step raised an error */
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }

    public boolean canTransitionTo(RunState target) {
        return switch (this) {
            case QUEUED -> target == RUNNING;
            case RUNNING -> target == SUCCESS || target == FAILED;
            case SUCCESS, FAILED -> false;
        };
    }

    /**
     * @throws IllegalStateException if {@code target} is not reachable from this state
     */
    public void requireTransition(RunState target) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException("illegal run transition " + this + " -> " + target);
        }
    }
}
