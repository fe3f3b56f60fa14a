package reportflow.engine.exception;

/**
 * The store could not persist a run transition. This is fatal for the run
 * and is always propagated to the caller of the execution runner.
 */
public class RunPersistenceException extends ReportFlowException {

    private final String runId;

    public RunPersistenceException(String runId, String message, Throwable cause) {
        super(message, cause);
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }
}
