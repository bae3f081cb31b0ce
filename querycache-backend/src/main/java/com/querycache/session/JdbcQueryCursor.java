package com.querycache.session;

import com.querycache.model.ColumnType;
import com.querycache.model.TabularColumn;
import com.querycache.model.TabularResult;
import com.querycache.util.JdbcColumnTypes;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link QueryCursor} over a JDBC statement that has already been executed.
 */
class JdbcQueryCursor implements QueryCursor {

    private final Statement statement;
    private final boolean hasResultSet;

    JdbcQueryCursor(Statement statement, boolean hasResultSet) {
        this.statement = statement;
        this.hasResultSet = hasResultSet;
    }

    @Override
    public TabularResult fetchAllAsTable() throws SQLException {
        if (!hasResultSet) {
            return TabularResult.empty(List.of());
        }
        try (ResultSet rs = statement.getResultSet()) {
            ResultSetMetaData md = rs.getMetaData();
            int columnCount = md.getColumnCount();

            List<TabularColumn> columns = new ArrayList<>(columnCount);
            boolean[] wide = new boolean[columnCount];
            for (int i = 1; i <= columnCount; i++) {
                columns.add(TabularColumn.of(md.getColumnLabel(i), JdbcColumnTypes.resolve(md, i)));
                wide[i - 1] = JdbcColumnTypes.isWideInteger(md, i);
            }

            List<List<Object>> rows = new ArrayList<>();
            boolean[] overflow = new boolean[columnCount];
            while (rs.next()) {
                List<Object> row = new ArrayList<>(columnCount);
                for (int i = 1; i <= columnCount; i++) {
                    if (wide[i - 1]) {
                        BigDecimal value = JdbcColumnTypes.readExact(rs, i);
                        if (value != null && !JdbcColumnTypes.fitsLong(value)) {
                            overflow[i - 1] = true;
                        }
                        row.add(value);
                    } else {
                        row.add(JdbcColumnTypes.read(rs, i, columns.get(i - 1).getType()));
                    }
                }
                rows.add(row);
            }

            // Integer columns holding values beyond 64 bits are kept exact as text.
            for (int i = 0; i < columnCount; i++) {
                if (overflow[i]) {
                    columns.set(i, TabularColumn.of(columns.get(i).getName(), ColumnType.STRING));
                }
            }
            return TabularResult.of(columns, rows);
        }
    }

    @Override
    public Object fetchScalar() throws SQLException {
        if (!hasResultSet) {
            return null;
        }
        try (ResultSet rs = statement.getResultSet()) {
            if (rs.next()) {
                return rs.getObject(1);
            }
            return null;
        }
    }

    @Override
    public void close() throws SQLException {
        statement.close();
    }
}
