package reportflow.engine.exception;

/**
 * Thrown when an artifact is requested for a run that has not succeeded.
 */
public class NotReadyException extends ReportFlowException {
    public NotReadyException(String message) {
        super(message);
    }
}
