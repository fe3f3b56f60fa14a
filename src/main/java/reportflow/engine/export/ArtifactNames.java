package reportflow.engine.export;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Artifact file naming: {@code <job name>_<yyyyMMdd_HHmmss>_<run id>}.
 * The run ID keeps names unique when two runs start in the same second.
 */
public final class ArtifactNames {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private ArtifactNames() {
    }

    public static String baseName(String jobName, Instant startedAt, String runId, ZoneId zone) {
        return sanitize(jobName) + "_" + TIMESTAMP.format(startedAt.atZone(zone)) + "_" + sanitize(runId);
    }

    /**
     * Keep letters, digits, space, dash and underscore; spaces become underscores.
     */
    static String sanitize(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (char c : name.toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == ' ' || c == '-' || c == '_') {
                sb.append(c);
            }
        }
        String safe = sb.toString().strip().replace(' ', '_');
        return safe.isEmpty() ? "report" : safe;
    }
}
