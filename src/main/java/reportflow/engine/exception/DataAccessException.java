package reportflow.engine.exception;

/**
 * Failure of the query sink. The message is the driver's message, unchanged,
 * so that it can be stored on the failed run verbatim.
 */
public class DataAccessException extends ReportFlowException {
    public DataAccessException(String message) {
        super(message);
    }

    public DataAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
