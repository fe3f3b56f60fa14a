package reportflow.engine.cron;

import reportflow.engine.exception.ValidationException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Parsed 5-field schedule expression: {@code minute hour day-of-month month day-of-week}.
 *
 * <p><b>Day matching:</b> a day field counts as unrestricted only when it is
 * exactly {@code *}. Any other token, {@code *}{@code /2} included, restricts it
 * (Vixie cron would treat a {@code *}-prefixed step as unrestricted here). When
 * both day-of-month and day-of-week are restricted a day matches if
 * <em>either</em> field matches: {@code 0 0 13 * 5} fires on every 13th
 * <em>and</em> on every Friday, not only on Friday the 13th. When just one of
 * the two is restricted, only that one is checked.</p>
 *
 * <p>Instances are immutable and thread-safe.</p>
 */
public final class CronExpression {

    /** Upper bound for the search; anything further is treated as unreachable */
    private static final int MAX_YEARS_AHEAD = 5;

    private final String expression;
    private final FieldMatcher minutes;
    private final FieldMatcher hours;
    private final FieldMatcher daysOfMonth;
    private final FieldMatcher months;
    private final FieldMatcher daysOfWeek;

    private CronExpression(String expression, FieldMatcher[] fields) {
        this.expression = expression;
        this.minutes = fields[0];
        this.hours = fields[1];
        this.daysOfMonth = fields[2];
        this.months = fields[3];
        this.daysOfWeek = fields[4];
    }

    /**
     * Parse a schedule expression.
     *
     * @throws ValidationException naming the offending field and value
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("schedule", expression, "Schedule expression must be a non-empty string");
        }

        String[] parts = expression.trim().split("\\s+");
        if (parts.length != 5) {
            throw new ValidationException("schedule", expression,
                    "Schedule expression must have exactly 5 fields "
                            + "(minute hour day-of-month month day-of-week), got " + parts.length);
        }

        CronField[] order = CronField.values();
        FieldMatcher[] fields = new FieldMatcher[5];
        for (int i = 0; i < 5; i++) {
            fields[i] = FieldMatcher.parse(order[i], parts[i]);
        }
        return new CronExpression(String.join(" ", parts), fields);
    }

    /** Check an expression without keeping the result */
    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }

    /**
     * Does the given wall-clock minute match all fields?
     * Seconds and below are ignored.
     */
    public boolean matches(LocalDateTime time) {
        return months.matches(time.getMonthValue())
                && dayMatches(time.toLocalDate())
                && hours.matches(time.getHour())
                && minutes.matches(time.getMinute());
    }

    public boolean matches(ZonedDateTime time) {
        return matches(time.toLocalDateTime());
    }

    /**
     * Next matching instant strictly after {@code after}, evaluated in {@code zone}.
     */
    public Instant nextFireAfter(Instant after, ZoneId zone) {
        return nextFireAfter(after.atZone(zone)).toInstant();
    }

    /**
     * Smallest minute-aligned time strictly after {@code after} that matches the
     * expression. Wall-clock times that fall into a DST gap are skipped.
     *
     * @throws IllegalStateException if nothing matches within {@value #MAX_YEARS_AHEAD} years
     *                               (e.g. {@code 0 0 31 2 *})
     */
    public ZonedDateTime nextFireAfter(ZonedDateTime after) {
        Objects.requireNonNull(after, "after");
        ZoneId zone = after.getZone();
        LocalDateTime t = after.toLocalDateTime().truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        int yearLimit = t.getYear() + MAX_YEARS_AHEAD;

        while (t.getYear() <= yearLimit) {
            if (!months.matches(t.getMonthValue())) {
                t = t.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay();
                continue;
            }
            if (!dayMatches(t.toLocalDate())) {
                t = t.toLocalDate().plusDays(1).atStartOfDay();
                continue;
            }
            if (!hours.matches(t.getHour())) {
                t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!minutes.matches(t.getMinute())) {
                t = t.plusMinutes(1);
                continue;
            }

            if (zone.getRules().getValidOffsets(t).isEmpty()) {
                // DST gap: this wall-clock minute does not exist
                t = t.plusMinutes(1);
                continue;
            }
            ZonedDateTime candidate = ZonedDateTime.ofLocal(t, zone, after.getOffset());
            if (candidate.isAfter(after)) {
                return candidate;
            }
            t = t.plusMinutes(1);
        }

        throw new IllegalStateException("No fire time within " + MAX_YEARS_AHEAD
                + " years for schedule '" + expression + "'");
    }

    private boolean dayMatches(LocalDate date) {
        boolean domMatch = daysOfMonth.matches(date.getDayOfMonth());
        // java.time: Monday=1 .. Sunday=7; cron: Sunday=0 .. Saturday=6
        boolean dowMatch = daysOfWeek.matches(date.getDayOfWeek().getValue() % 7);

        if (daysOfMonth.isWildcard() && daysOfWeek.isWildcard()) {
            return true;
        }
        if (daysOfMonth.isWildcard()) {
            return dowMatch;
        }
        if (daysOfWeek.isWildcard()) {
            return domMatch;
        }
        return domMatch || dowMatch;
    }

    /** Normalized expression (fields joined by single spaces) */
    public String expression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CronExpression that))
            return false;
        return expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
