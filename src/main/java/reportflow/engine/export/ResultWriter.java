package reportflow.engine.export;

import reportflow.engine.model.OutputFormat;
import reportflow.engine.model.QueryResult;
import reportflow.engine.model.WrittenArtifact;

import java.io.IOException;

/**
 * Serializes a query result to a durable artifact.
 */
public interface ResultWriter {

    /**
     * The format this writer produces.
     */
    OutputFormat format();

    /**
     * Write the result under the given base name (no extension).
     *
     * @return final path, data row count and size
     * @throws IOException if the artifact cannot be written
     */
    WrittenArtifact write(QueryResult result, String baseName) throws IOException;
}
