package reportflow.engine.export;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import reportflow.engine.model.OutputFormat;
import reportflow.engine.model.QueryResult;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.List;

/**
 * CSV artifact: header row of column names, then one line per result row.
 * NULLs are written as empty cells.
 */
public class CsvResultWriter extends FileResultWriter {

    private static final CsvMapper MAPPER = new CsvMapper();

    public CsvResultWriter(Path outputDir) {
        super(outputDir);
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.CSV;
    }

    @Override
    protected void writeContent(QueryResult result, Writer out) throws IOException {
        CsvSchema.Builder schema = CsvSchema.builder();
        for (String column : result.columns()) {
            schema.addColumn(column);
        }

        // header written as a plain row so an empty result still gets one
        try (SequenceWriter rows = MAPPER.writer(schema.build().withoutHeader()).writeValues(out)) {
            rows.write(result.columns().toArray(new String[0]));
            for (List<Object> row : result.rows()) {
                rows.write(toCells(row));
            }
        }
    }

    private static String[] toCells(List<Object> row) {
        String[] cells = new String[row.size()];
        for (int i = 0; i < cells.length; i++) {
            Object value = row.get(i);
            cells[i] = value == null ? "" : value.toString();
        }
        return cells;
    }
}
