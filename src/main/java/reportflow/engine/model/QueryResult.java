package reportflow.engine.model;

import java.util.List;
import java.util.Objects;

/**
 * Tabular result of a report query: ordered column names plus rows, each row
 * holding one value per column in the same order.
 */
public record QueryResult(List<String> columns, List<List<Object>> rows) {

    public QueryResult {
        Objects.requireNonNull(columns, "columns is required");
        Objects.requireNonNull(rows, "rows is required");
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public int rowCount() {
        return rows.size();
    }
}
