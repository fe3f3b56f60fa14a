package reportflow.engine.query;

import reportflow.engine.exception.DataAccessException;
import reportflow.engine.model.QueryResult;
import reportflow.engine.store.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs report queries over JDBC on a read-only connection.
 *
 * The connection is rolled back after every query so nothing a query might
 * have touched is ever committed. Driver errors surface as
 * {@link DataAccessException} carrying the driver's message unchanged.
 */
public class JdbcQuerySink implements QuerySink {

    private static final Logger log = LoggerFactory.getLogger(JdbcQuerySink.class);

    private final Database source;
    private final int queryTimeoutSeconds;
    private final int maxRows;

    /**
     * @param source              pool for the reporting data source
     * @param queryTimeoutSeconds statement timeout, 0 for none
     * @param maxRows             row cap, 0 for unlimited
     */
    public JdbcQuerySink(Database source, int queryTimeoutSeconds, int maxRows) {
        this.source = source;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
        this.maxRows = maxRows;
    }

    @Override
    public QueryResult execute(String queryText) {
        long start = System.currentTimeMillis();

        try (Connection conn = source.getConnection()) {
            conn.setReadOnly(true);
            try (Statement st = conn.createStatement()) {
                if (queryTimeoutSeconds > 0) {
                    st.setQueryTimeout(queryTimeoutSeconds);
                }
                if (maxRows > 0) {
                    st.setMaxRows(maxRows);
                }

                QueryResult result;
                try (ResultSet rs = st.executeQuery(stripTrailingSemicolon(queryText))) {
                    result = readAll(rs);
                }
                log.debug("Query returned {} rows in {}ms", result.rowCount(), System.currentTimeMillis() - start);
                return result;
            } finally {
                conn.rollback();
            }
        } catch (SQLException e) {
            throw new DataAccessException(e.getMessage(), e);
        }
    }

    private QueryResult readAll(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();

        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(meta.getColumnLabel(i));
        }

        List<List<Object>> rows = new ArrayList<>();
        while (rs.next()) {
            List<Object> row = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                row.add(readValue(rs, i));
            }
            rows.add(row);
        }
        return new QueryResult(columns, rows);
    }

    private Object readValue(ResultSet rs, int column) throws SQLException {
        Object value = rs.getObject(column);
        if (value instanceof Clob clob) {
            return clob.getSubString(1, (int) clob.length());
        }
        if (value instanceof Timestamp ts) {
            return ts.toLocalDateTime();
        }
        if (value instanceof Date date) {
            return date.toLocalDate();
        }
        if (value instanceof Time time) {
            return time.toLocalTime();
        }
        return value;
    }

    private static String stripTrailingSemicolon(String sql) {
        String trimmed = sql.trim();
        return trimmed.endsWith(";") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
