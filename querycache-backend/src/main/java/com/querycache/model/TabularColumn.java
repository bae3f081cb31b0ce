package com.querycache.model;

import lombok.Value;

/**
 * A named, typed column of a {@link TabularResult}.
 */
@Value
public class TabularColumn {
    String name;
    ColumnType type;

    /**
     * Create a column.
     *
     * @param name column name
     * @param type column type
     * @return column
     */
    public static TabularColumn of(String name, ColumnType type) {
        return new TabularColumn(name, type);
    }

    /**
     * Copy this column under a different name.
     *
     * @param newName new name
     * @return renamed column
     */
    public TabularColumn withName(String newName) {
        return new TabularColumn(newName, type);
    }
}
