package reportflow.engine.exception;

/**
 * Thrown when a run is requested for a job that already has a run in flight.
 * Callers should read this as "already running", not as a failure.
 */
public class BusyException extends ReportFlowException {

    private final String jobId;

    public BusyException(String jobId) {
        super("job " + jobId + " is already running");
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
