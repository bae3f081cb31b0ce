package com.querycache.session;

import com.querycache.model.BulkWriteResult;
import com.querycache.model.ColumnType;
import com.querycache.model.TabularColumn;
import com.querycache.model.TabularResult;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.StringJoiner;

/**
 * {@link WarehouseSession} backed by a single JDBC connection.
 *
 * The connection is borrowed once from a one-slot Hikari pool and held until {@link #close()}.
 */
@Slf4j
public class JdbcWarehouseSession implements WarehouseSession {

    private final HikariDataSource dataSource;
    private final Connection connection;
    private final int batchSize;

    /**
     * Borrow the pool's connection and wrap it in a session.
     *
     * @param dataSource single-connection pool; owned by the session from now on
     * @param batchSize rows per JDBC batch during bulk writes
     * @throws SQLException when the connection cannot be obtained
     */
    public JdbcWarehouseSession(HikariDataSource dataSource, int batchSize) throws SQLException {
        this(dataSource, dataSource.getConnection(), batchSize);
    }

    JdbcWarehouseSession(HikariDataSource dataSource, Connection connection, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.dataSource = dataSource;
        this.connection = connection;
        this.batchSize = batchSize;
    }

    @Override
    public QueryCursor execute(String sql) throws SQLException {
        Statement stmt = connection.createStatement();
        try {
            boolean hasResultSet = stmt.execute(sql);
            return new JdbcQueryCursor(stmt, hasResultSet);
        } catch (SQLException e) {
            stmt.close();
            throw e;
        }
    }

    @Override
    public BulkWriteResult bulkWrite(String table, TabularResult rows) {
        List<TabularColumn> columns = rows.getColumns();
        String sql = buildInsert(table, columns);
        log.debug("Bulk insert statement: {}", sql);

        long written = 0;
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            int pending = 0;
            for (List<Object> row : rows.getRows()) {
                for (int i = 0; i < columns.size(); i++) {
                    bind(ps, i + 1, columns.get(i).getType(), row.get(i));
                }
                ps.addBatch();
                pending++;
                if (pending == batchSize) {
                    written += sum(ps.executeBatch());
                    pending = 0;
                }
            }
            if (pending > 0) {
                written += sum(ps.executeBatch());
            }
        } catch (SQLException e) {
            log.error("Bulk write into {} failed after {} rows: {} (SQLState: {}, Error Code: {})",
                    table, written, e.getMessage(), e.getSQLState(), e.getErrorCode());
            BulkWriteResult failed = BulkWriteResult.failed(e.getMessage());
            failed.setRowCount(written);
            return failed;
        }
        return BulkWriteResult.written(written);
    }

    @Override
    public void close() throws SQLException {
        try {
            connection.close();
        } finally {
            if (dataSource != null) {
                dataSource.close();
            }
        }
    }

    static String buildInsert(String table, List<TabularColumn> columns) {
        StringJoiner names = new StringJoiner(", ", "(", ")");
        StringJoiner params = new StringJoiner(", ", "(", ")");
        for (TabularColumn column : columns) {
            names.add(column.getName());
            params.add("?");
        }
        return "INSERT INTO " + table + " " + names + " VALUES " + params;
    }

    private static void bind(PreparedStatement ps, int index, ColumnType type, Object value) throws SQLException {
        if (value == null) {
            ps.setNull(index, sqlType(type));
            return;
        }
        switch (type) {
            case INTEGER:
                ps.setLong(index, (Long) value);
                break;
            case FLOAT:
                ps.setDouble(index, (Double) value);
                break;
            case BOOLEAN:
                ps.setBoolean(index, (Boolean) value);
                break;
            case TIMESTAMP:
                ps.setTimestamp(index, Timestamp.valueOf((LocalDateTime) value));
                break;
            case DATE:
                ps.setDate(index, java.sql.Date.valueOf((LocalDate) value));
                break;
            case BINARY:
                ps.setBytes(index, (byte[]) value);
                break;
            default:
                ps.setString(index, value.toString());
                break;
        }
    }

    private static int sqlType(ColumnType type) {
        switch (type) {
            case INTEGER:
                return Types.BIGINT;
            case FLOAT:
                return Types.DOUBLE;
            case BOOLEAN:
                return Types.BOOLEAN;
            case TIMESTAMP:
                return Types.TIMESTAMP;
            case DATE:
                return Types.DATE;
            case BINARY:
                return Types.BINARY;
            default:
                return Types.VARCHAR;
        }
    }

    private static long sum(int[] counts) {
        long total = 0;
        for (int count : counts) {
            // SUCCESS_NO_INFO means the row was applied but the driver did not count it.
            total += count == Statement.SUCCESS_NO_INFO ? 1 : Math.max(count, 0);
        }
        return total;
    }
}
