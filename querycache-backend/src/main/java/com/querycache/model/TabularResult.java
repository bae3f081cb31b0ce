package com.querycache.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * An immutable, column-ordered result set.
 *
 * Rows are positional: the i-th value of a row belongs to the i-th column. Values are held in the canonical
 * representation of their column type (see {@link ColumnType#normalize(Object)}).
 */
public final class TabularResult {

    private final List<TabularColumn> columns;
    private final List<List<Object>> rows;

    private TabularResult(List<TabularColumn> columns, List<List<Object>> rows) {
        this.columns = List.copyOf(columns);
        this.rows = Collections.unmodifiableList(rows);
    }

    /**
     * Create a result from columns and rows, normalizing every value to its column type.
     *
     * @param columns columns
     * @param rows rows, each with exactly one value per column
     * @return result
     */
    public static TabularResult of(List<TabularColumn> columns, List<? extends List<?>> rows) {
        List<List<Object>> normalized = new ArrayList<>(rows.size());
        for (List<?> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException(
                        "Row has " + row.size() + " values but the result has " + columns.size() + " columns");
            }
            List<Object> values = new ArrayList<>(row.size());
            for (int i = 0; i < row.size(); i++) {
                values.add(columns.get(i).getType().normalize(row.get(i)));
            }
            values = Collections.unmodifiableList(values);
            normalized.add(values);
        }
        return new TabularResult(columns, normalized);
    }

    /**
     * Build a result from name/value records, inferring one column type per column.
     *
     * Columns appear in first-seen key order; keys missing from a record read as null.
     *
     * @param records records
     * @return result
     */
    public static TabularResult fromRecords(List<? extends Map<String, ?>> records) {
        Set<String> names = new LinkedHashSet<>();
        for (Map<String, ?> record : records) {
            names.addAll(record.keySet());
        }

        List<TabularColumn> columns = new ArrayList<>(names.size());
        for (String name : names) {
            List<Object> values = new ArrayList<>(records.size());
            for (Map<String, ?> record : records) {
                values.add(record.get(name));
            }
            columns.add(TabularColumn.of(name, ColumnType.infer(values)));
        }

        List<List<Object>> rows = new ArrayList<>(records.size());
        for (Map<String, ?> record : records) {
            List<Object> row = new ArrayList<>(columns.size());
            for (TabularColumn column : columns) {
                row.add(record.get(column.getName()));
            }
            rows.add(row);
        }
        return of(columns, rows);
    }

    /**
     * Create an empty result with the given columns.
     *
     * @param columns columns
     * @return empty result
     */
    public static TabularResult empty(List<TabularColumn> columns) {
        return new TabularResult(columns, List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<TabularColumn> getColumns() {
        return columns;
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (TabularColumn column : columns) {
            names.add(column.getName());
        }
        return names;
    }

    public int getRowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Find the position of a column by exact name.
     *
     * @param name column name
     * @return index, or -1 when absent
     */
    public int indexOf(String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Read a single value.
     *
     * @param row row index
     * @param column column name
     * @return value, may be null
     */
    public Object getValue(int row, String column) {
        int index = indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return rows.get(row).get(index);
    }

    /**
     * Drop every column whose name starts with the given prefix.
     *
     * @param prefix name prefix
     * @return result without the matching columns
     */
    public TabularResult withoutColumnsPrefixed(String prefix) {
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            if (!columns.get(i).getName().startsWith(prefix)) {
                kept.add(i);
            }
        }
        if (kept.size() == columns.size()) {
            return this;
        }

        List<TabularColumn> keptColumns = new ArrayList<>(kept.size());
        for (int i : kept) {
            keptColumns.add(columns.get(i));
        }
        List<List<Object>> keptRows = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            List<Object> values = new ArrayList<>(kept.size());
            for (int i : kept) {
                values.add(row.get(i));
            }
            keptRows.add(Collections.unmodifiableList(values));
        }
        return new TabularResult(keptColumns, keptRows);
    }

    /**
     * Rename every column.
     *
     * @param renamer name mapping
     * @return result with renamed columns and the same rows
     */
    public TabularResult renameColumns(UnaryOperator<String> renamer) {
        List<TabularColumn> renamed = new ArrayList<>(columns.size());
        for (TabularColumn column : columns) {
            renamed.add(column.withName(renamer.apply(column.getName())));
        }
        return new TabularResult(renamed, rows);
    }

    public TabularResult withLowerCaseColumns() {
        return renameColumns(name -> name.toLowerCase(Locale.ROOT));
    }

    public TabularResult withUpperCaseColumns() {
        return renameColumns(name -> name.toUpperCase(Locale.ROOT));
    }

    /**
     * Convert rows to name/value maps, preserving column order.
     *
     * @return records
     */
    public List<Map<String, Object>> toRecords() {
        List<Map<String, Object>> records = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            Map<String, Object> record = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                record.put(columns.get(i).getName(), row.get(i));
            }
            records.add(record);
        }
        return records;
    }

    @Override
    public String toString() {
        return "TabularResult{columns=" + columns + ", rows=" + rows.size() + "}";
    }

    /**
     * Incremental builder used by drivers and tests.
     */
    public static final class Builder {
        private final List<TabularColumn> columns = new ArrayList<>();
        private final List<List<Object>> rows = new ArrayList<>();

        private Builder() {
        }

        public Builder column(String name, ColumnType type) {
            columns.add(TabularColumn.of(name, type));
            return this;
        }

        public Builder columns(List<TabularColumn> newColumns) {
            columns.addAll(newColumns);
            return this;
        }

        public Builder row(Object... values) {
            rows.add(Arrays.asList(values));
            return this;
        }

        public Builder row(List<?> values) {
            rows.add(new ArrayList<>(values));
            return this;
        }

        public TabularResult build() {
            return TabularResult.of(columns, rows);
        }
    }
}
