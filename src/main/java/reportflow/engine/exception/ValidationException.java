package reportflow.engine.exception;

/**
 * Thrown when a job definition (schedule, query text, output format or name)
 * is rejected. The field names the offending part of the definition, e.g.
 * {@code minute} for a cron field or {@code query} for the SQL text.
 */
public class ValidationException extends ReportFlowException {

    private final String field;
    private final String value;

    public ValidationException(String field, String value, String message) {
        super(message);
        this.field = field;
        this.value = value;
    }

    public ValidationException(String field, String message) {
        this(field, null, message);
    }

    public String field() {
        return field;
    }

    public String value() {
        return value;
    }
}
