package com.querycache.session;

import com.querycache.model.BulkWriteResult;
import com.querycache.model.TabularResult;

import java.sql.SQLException;

/**
 * An authenticated warehouse connection.
 *
 * A session is not thread-safe; callers that share one must serialize access.
 */
public interface WarehouseSession extends AutoCloseable {

    /**
     * Execute one SQL statement.
     *
     * @param sql statement text
     * @return cursor over the statement's result; must be closed by the caller
     * @throws SQLException on execution errors
     */
    QueryCursor execute(String sql) throws SQLException;

    /**
     * Load every row of {@code rows} into an existing table.
     *
     * Load failures are reported through the returned result, not thrown.
     *
     * @param table target table, optionally schema-qualified
     * @param rows rows to load; column names must match the table's columns
     * @return load outcome
     */
    BulkWriteResult bulkWrite(String table, TabularResult rows);

    @Override
    void close() throws SQLException;
}
