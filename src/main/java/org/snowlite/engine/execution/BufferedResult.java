package org.snowlite.engine.execution;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * A fully materialized, immutable query result.
 */
public record BufferedResult(List<Column> columns, List<Row> rows) {

    public BufferedResult {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public static BufferedResult empty() {
        return new BufferedResult(List.of(), List.of());
    }

    public long rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public List<String> columnNames() {
        return columns.stream().map(Column::name).toList();
    }

    public Object getValue(int rowIndex, int columnIndex) {
        return rows.get(rowIndex).get(columnIndex);
    }

    public Object getValue(int rowIndex, String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equalsIgnoreCase(columnName)) {
                return rows.get(rowIndex).get(i);
            }
        }
        throw new IllegalArgumentException("Column not found: " + columnName);
    }

    /**
     * Creates a BufferedResult from a JDBC ResultSet.
     * The ResultSet is fully consumed and can be closed after this call.
     */
    public static BufferedResult fromResultSet(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();

        List<Column> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(new Column(
                    meta.getColumnLabel(i),
                    meta.getColumnTypeName(i),
                    Column.mapJdbcTypeToJava(meta.getColumnType(i))));
        }

        List<Row> rows = new ArrayList<>();
        while (rs.next()) {
            rows.add(Row.fromResultSet(rs, columnCount));
        }

        return new BufferedResult(columns, rows);
    }
}
