package reportflow.engine.cron;

/**
 * The five positional fields of a schedule expression and their value ranges.
 */
public enum CronField {
    MINUTE("minute", 0, 59),
    HOUR("hour", 0, 23),
    DAY_OF_MONTH("day-of-month", 1, 31),
    MONTH("month", 1, 12),
    /** 0 = Sunday */
    DAY_OF_WEEK("day-of-week", 0, 6);

    private final String label;
    private final int min;
    private final int max;

    CronField(String label, int min, int max) {
        this.label = label;
        this.min = min;
        this.max = max;
    }

    public String label() {
        return label;
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    public boolean inRange(int value) {
        return value >= min && value <= max;
    }
}
