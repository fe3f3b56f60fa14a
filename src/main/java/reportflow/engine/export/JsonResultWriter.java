package reportflow.engine.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import reportflow.engine.model.OutputFormat;
import reportflow.engine.model.QueryResult;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * JSON artifact: an array with one object per row, keyed by column name in
 * column order. A repeated column label gets a numeric suffix ({@code a},
 * {@code a_2}) so every key in an object is distinct.
 */
public class JsonResultWriter extends FileResultWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
            .findAndRegisterModules();

    public JsonResultWriter(Path outputDir) {
        super(outputDir);
    }

    @Override
    public OutputFormat format() {
        return OutputFormat.JSON;
    }

    @Override
    protected void writeContent(QueryResult result, Writer out) throws IOException {
        List<String> columns = uniqueKeys(result.columns());
        try (JsonGenerator gen = MAPPER.getFactory().createGenerator(out)) {
            gen.useDefaultPrettyPrinter();
            gen.writeStartArray();
            for (List<Object> row : result.rows()) {
                gen.writeStartObject();
                for (int i = 0; i < columns.size(); i++) {
                    gen.writeFieldName(columns.get(i));
                    gen.writeObject(row.get(i));
                }
                gen.writeEndObject();
            }
            gen.writeEndArray();
        }
    }

    static List<String> uniqueKeys(List<String> columns) {
        Set<String> taken = new HashSet<>(columns);
        Set<String> used = new HashSet<>();
        List<String> keys = new ArrayList<>(columns.size());
        for (String column : columns) {
            String key = column;
            if (!used.add(key)) {
                int n = 2;
                do {
                    key = column + "_" + n++;
                } while (taken.contains(key) || !used.add(key));
            }
            keys.add(key);
        }
        return keys;
    }
}
