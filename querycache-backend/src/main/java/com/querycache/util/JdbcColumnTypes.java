package com.querycache.util;

import com.querycache.model.ColumnType;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;

/**
 * Maps JDBC column metadata onto {@link ColumnType} and reads values in their canonical form.
 */
public final class JdbcColumnTypes {

    /**
     * Largest precision of a fixed-point integer column whose values always fit a {@code long}.
     */
    public static final int LONG_PRECISION = 18;

    private JdbcColumnTypes() {
    }

    /**
     * Whether a column is a fixed-point integer that may hold values beyond 64 bits
     * (Snowflake's default {@code NUMBER(38,0)}).
     *
     * Such columns are resolved as {@link ColumnType#INTEGER} but must be read with
     * {@link #readExact(ResultSet, int)}.
     *
     * @param md result set metadata
     * @param column 1-based column index
     * @return true for scale-0 {@code NUMERIC}/{@code DECIMAL} wider than {@link #LONG_PRECISION}
     * @throws SQLException on metadata errors
     */
    public static boolean isWideInteger(ResultSetMetaData md, int column) throws SQLException {
        int sqlType = md.getColumnType(column);
        return (sqlType == Types.NUMERIC || sqlType == Types.DECIMAL)
                && md.getScale(column) == 0
                && md.getPrecision(column) > LONG_PRECISION;
    }

    /**
     * Read a fixed-point value without narrowing it.
     *
     * @param rs result set positioned on a row
     * @param column 1-based column index
     * @return exact value or null
     * @throws SQLException on read errors
     */
    public static BigDecimal readExact(ResultSet rs, int column) throws SQLException {
        return rs.getBigDecimal(column);
    }

    /**
     * Whether an exact integer value fits a {@code long}.
     *
     * @param value integral value
     * @return true when representable as {@code long}
     */
    public static boolean fitsLong(BigDecimal value) {
        return value.toBigInteger().bitLength() < Long.SIZE;
    }

    /**
     * Resolve the column type of a result set column.
     *
     * Fixed-point numbers with scale 0 (Snowflake's {@code NUMBER(38,0)}) are integers; other fixed-point
     * numbers are read as floating point.
     *
     * @param md result set metadata
     * @param column 1-based column index
     * @return column type
     * @throws SQLException on metadata errors
     */
    public static ColumnType resolve(ResultSetMetaData md, int column) throws SQLException {
        int sqlType = md.getColumnType(column);
        switch (sqlType) {
            case Types.TINYINT:
            case Types.SMALLINT:
            case Types.INTEGER:
            case Types.BIGINT:
                return ColumnType.INTEGER;
            case Types.NUMERIC:
            case Types.DECIMAL:
                return md.getScale(column) == 0 ? ColumnType.INTEGER : ColumnType.FLOAT;
            case Types.REAL:
            case Types.FLOAT:
            case Types.DOUBLE:
                return ColumnType.FLOAT;
            case Types.BIT:
            case Types.BOOLEAN:
                return ColumnType.BOOLEAN;
            case Types.TIMESTAMP:
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return ColumnType.TIMESTAMP;
            case Types.DATE:
                return ColumnType.DATE;
            case Types.BINARY:
            case Types.VARBINARY:
            case Types.LONGVARBINARY:
            case Types.BLOB:
                return ColumnType.BINARY;
            default:
                return ColumnType.STRING;
        }
    }

    /**
     * Read a column value as the canonical Java type of {@code type}.
     *
     * @param rs result set positioned on a row
     * @param column 1-based column index
     * @param type resolved column type
     * @return value or null
     * @throws SQLException on read errors
     */
    public static Object read(ResultSet rs, int column, ColumnType type) throws SQLException {
        Object value;
        switch (type) {
            case INTEGER:
                value = rs.getLong(column);
                break;
            case FLOAT:
                value = rs.getDouble(column);
                break;
            case BOOLEAN:
                value = rs.getBoolean(column);
                break;
            case TIMESTAMP:
                Timestamp ts = rs.getTimestamp(column);
                value = ts != null ? ts.toLocalDateTime() : null;
                break;
            case DATE:
                java.sql.Date date = rs.getDate(column);
                value = date != null ? date.toLocalDate() : null;
                break;
            case BINARY:
                value = rs.getBytes(column);
                break;
            default:
                value = rs.getString(column);
                break;
        }
        return rs.wasNull() ? null : value;
    }
}
