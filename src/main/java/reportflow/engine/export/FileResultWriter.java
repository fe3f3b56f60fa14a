package reportflow.engine.export;

import reportflow.engine.model.QueryResult;
import reportflow.engine.model.WrittenArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Base for writers producing one file per run in an output directory.
 *
 * Content goes to a temporary sibling first and is then moved into place, so a
 * reader never sees a half-written artifact.
 */
public abstract class FileResultWriter implements ResultWriter {

    private static final Logger log = LoggerFactory.getLogger(FileResultWriter.class);

    private final Path outputDir;

    protected FileResultWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public WrittenArtifact write(QueryResult result, String baseName) throws IOException {
        Files.createDirectories(outputDir);

        Path target = outputDir.resolve(baseName + "." + format().extension()).toAbsolutePath();
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");

        try (Writer out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            writeContent(result, out);
        } catch (IOException | RuntimeException e) {
            Files.deleteIfExists(temp);
            throw e;
        }
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        long size = Files.size(target);
        log.debug("Wrote {} rows ({} bytes) to {}", result.rowCount(), size, target);
        return new WrittenArtifact(target, result.rowCount(), size);
    }

    protected abstract void writeContent(QueryResult result, Writer out) throws IOException;

    public Path outputDir() {
        return outputDir;
    }
}
