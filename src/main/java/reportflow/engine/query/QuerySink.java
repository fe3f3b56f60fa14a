package reportflow.engine.query;

import reportflow.engine.exception.DataAccessException;
import reportflow.engine.model.QueryResult;

/**
 * Executes a validated read-only query and returns its tabular result.
 */
public interface QuerySink {

    /**
     * @param queryText query that already passed the read-only guard
     * @return ordered column names plus rows
     * @throws DataAccessException if the data source rejects or fails the query
     */
    QueryResult execute(String queryText);
}
