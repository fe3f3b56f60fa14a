package reportflow.engine.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Output of the result writer: where the artifact landed and how many data
 * rows it holds.
 */
public record WrittenArtifact(Path path, int rowCount, long sizeBytes) {

    public WrittenArtifact {
        Objects.requireNonNull(path, "path is required");
        if (rowCount < 0) {
            throw new IllegalArgumentException("rowCount must not be negative");
        }
    }
}
