package com.querycache.service;

import com.querycache.model.ColumnType;
import com.querycache.model.TabularColumn;

import java.util.List;
import java.util.StringJoiner;

/**
 * Maps column types to warehouse column types for {@code CREATE TABLE}.
 */
public final class WarehouseTypeMapper {

    /**
     * Type used for every column type without a dedicated mapping.
     */
    public static final String FALLBACK_TYPE = "STRING";

    private WarehouseTypeMapper() {
    }

    /**
     * Map one column type.
     *
     * Only integers, floats, timestamps and booleans get a dedicated type; everything else (dates and
     * binary included) is loaded as {@link #FALLBACK_TYPE} so the load succeeds.
     *
     * @param type column type
     * @return warehouse type name
     */
    public static String toWarehouseType(ColumnType type) {
        switch (type) {
            case INTEGER:
                return "NUMBER";
            case FLOAT:
                return "FLOAT";
            case TIMESTAMP:
                return "TIMESTAMP_NTZ";
            case BOOLEAN:
                return "BOOLEAN";
            default:
                return FALLBACK_TYPE;
        }
    }

    /**
     * Build the column definition list of a {@code CREATE TABLE} statement.
     *
     * @param columns columns
     * @return {@code NAME TYPE, ...}
     */
    public static String columnDefinitions(List<TabularColumn> columns) {
        StringJoiner defs = new StringJoiner(", ");
        for (TabularColumn column : columns) {
            defs.add(column.getName() + " " + toWarehouseType(column.getType()));
        }
        return defs.toString();
    }
}
