package com.querycache.session;

import com.querycache.model.TabularResult;

import java.sql.SQLException;

/**
 * Cursor over the result of one executed statement.
 */
public interface QueryCursor extends AutoCloseable {

    /**
     * Fetch all remaining rows.
     *
     * Statements that produce no result set yield an empty result with no columns.
     *
     * @return all rows
     * @throws SQLException on fetch errors
     */
    TabularResult fetchAllAsTable() throws SQLException;

    /**
     * Fetch the first column of the first row.
     *
     * @return value, or null when there is no row
     * @throws SQLException on fetch errors
     */
    Object fetchScalar() throws SQLException;

    @Override
    void close() throws SQLException;
}
