package reportflow.engine.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Artifact format a job's results are written in.
 */
public enum OutputFormat {
    /** Comma-separated values with a header row */
    CSV("csv", "text/csv"),
    /** JSON array of row objects keyed by column name */
    JSON("json", "application/json");

    private final String extension;
    private final String contentType;

    OutputFormat(String extension, String contentType) {
        this.extension = extension;
        this.contentType = contentType;
    }

    public String extension() {
        return extension;
    }

    public String contentType() {
        return contentType;
    }

    /** Case-insensitive lookup; empty for unknown tags */
    public static Optional<OutputFormat> parse(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        String upper = tag.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(f -> f.name().equals(upper)).findFirst();
    }

    public static String names() {
        return Arrays.stream(values()).map(Enum::name).collect(Collectors.joining(", "));
    }
}
