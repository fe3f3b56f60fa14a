package reportflow.engine.cron;

import reportflow.engine.exception.ValidationException;

import java.util.BitSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Set of allowed values for one cron field.
 *
 * Accepted forms: {@code *}, {@code n}, {@code a-b}, {@code *}/{@code n},
 * {@code a/n}, {@code a-b/n} and comma-separated lists of the non-star forms.
 */
final class FieldMatcher {

    private static final Pattern NUMBER = Pattern.compile("\\d{1,9}");
    private static final Pattern RANGE = Pattern.compile("(\\d{1,9})-(\\d{1,9})");

    private final CronField field;
    private final BitSet values;
    private final boolean wildcard;

    private FieldMatcher(CronField field, BitSet values, boolean wildcard) {
        this.field = field;
        this.values = values;
        this.wildcard = wildcard;
    }

    static FieldMatcher parse(CronField field, String token) {
        BitSet values = new BitSet(field.max() + 1);

        if ("*".equals(token)) {
            values.set(field.min(), field.max() + 1);
            return new FieldMatcher(field, values, true);
        }

        for (String part : token.split(",", -1)) {
            if (part.isEmpty()) {
                throw invalid(field, token, "empty list element");
            }
            addPart(field, token, part, values);
        }
        return new FieldMatcher(field, values, false);
    }

    private static void addPart(CronField field, String token, String part, BitSet values) {
        int slash = part.indexOf('/');
        String base = slash >= 0 ? part.substring(0, slash) : part;
        int step = 1;

        if (slash >= 0) {
            String stepText = part.substring(slash + 1);
            if (!NUMBER.matcher(stepText).matches()) {
                throw invalid(field, token, "step '" + stepText + "' is not a number");
            }
            step = Integer.parseInt(stepText);
            if (step < 1 || step > field.max() - field.min() + 1) {
                throw invalid(field, token, "step " + step + " out of range 1-" + (field.max() - field.min() + 1));
            }
        }

        int from;
        int to;
        Matcher range = RANGE.matcher(base);
        if ("*".equals(base) && slash >= 0) {
            from = field.min();
            to = field.max();
        } else if (NUMBER.matcher(base).matches()) {
            from = checkValue(field, token, Integer.parseInt(base));
            // "a/n" runs from a to the end of the field
            to = slash >= 0 ? field.max() : from;
        } else if (range.matches()) {
            from = checkValue(field, token, Integer.parseInt(range.group(1)));
            to = checkValue(field, token, Integer.parseInt(range.group(2)));
            if (from > to) {
                throw invalid(field, token, "range start " + from + " is greater than end " + to);
            }
        } else {
            throw invalid(field, token, "unrecognized token '" + part + "'");
        }

        for (int v = from; v <= to; v += step) {
            values.set(v);
        }
    }

    private static int checkValue(CronField field, String token, int value) {
        if (!field.inRange(value)) {
            throw invalid(field, token,
                    "value " + value + " out of range " + field.min() + "-" + field.max());
        }
        return value;
    }

    private static ValidationException invalid(CronField field, String token, String reason) {
        return new ValidationException(field.label(), token,
                "Invalid " + field.label() + " field '" + token + "': " + reason);
    }

    boolean matches(int value) {
        return values.get(value);
    }

    /** True only for a literal {@code *}; step forms count as restricted */
    boolean isWildcard() {
        return wildcard;
    }

    CronField field() {
        return field;
    }
}
