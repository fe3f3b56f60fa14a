package reportflow.engine.validation;

import reportflow.engine.cron.CronExpression;
import reportflow.engine.exception.ValidationException;
import reportflow.engine.model.Job;
import reportflow.engine.model.OutputFormat;

import java.time.Clock;

/**
 * Gatekeeper for job definitions. Every check throws {@link ValidationException}
 * naming the rejected field.
 */
public final class JobValidator {

    private static final int MAX_NAME_LENGTH = 255;

    private JobValidator() {
    }

    /**
     * @param clock engine clock; its zone is the one schedules are evaluated in
     */
    public static void validate(Job job, Clock clock) {
        validateName(job.name());
        validateSchedule(job.schedule(), clock);
        validateQuery(job.query());
    }

    public static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("name", "name is required");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("name", name, "name must be at most " + MAX_NAME_LENGTH + " characters");
        }
    }

    /**
     * Parse the schedule and make sure it fires at least once in the search window,
     * so expressions like {@code 0 0 31 2 *} are refused up front. The search runs
     * from the clock's current instant in the clock's zone, as the scheduler does.
     */
    public static CronExpression validateSchedule(String schedule, Clock clock) {
        CronExpression cron = CronExpression.parse(schedule);
        try {
            cron.nextFireAfter(clock.instant(), clock.getZone());
        } catch (IllegalStateException e) {
            throw new ValidationException("schedule", schedule, "Schedule never fires: " + e.getMessage());
        }
        return cron;
    }

    public static void validateQuery(String query) {
        QueryValidator.validate(query);
    }

    public static OutputFormat parseOutputFormat(String tag) {
        if (tag == null) {
            return OutputFormat.CSV;
        }
        return OutputFormat.parse(tag)
                .orElseThrow(() -> new ValidationException("outputFormat", tag,
                        "Output format must be one of: " + OutputFormat.names()));
    }
}
