package reportflow.engine.exception;

/**
 * Thrown when a job or run identifier does not resolve.
 */
public class NotFoundException extends ReportFlowException {
    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException job(String jobId) {
        return new NotFoundException("job not found: " + jobId);
    }

    public static NotFoundException run(String runId) {
        return new NotFoundException("run not found: " + runId);
    }
}
