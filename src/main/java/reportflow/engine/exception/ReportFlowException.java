package reportflow.engine.exception;

/**
 * Base class for all reporting engine failures.
 */
public class ReportFlowException extends RuntimeException {
    public ReportFlowException(String message) {
        super(message);
    }

    public ReportFlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
