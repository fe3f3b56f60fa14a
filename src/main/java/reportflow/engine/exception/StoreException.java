package reportflow.engine.exception;

/**
 * Failure of the job store (jobs, runs, notifications).
 */
public class StoreException extends ReportFlowException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(String message) {
        super(message);
    }
}
