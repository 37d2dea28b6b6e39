package org.contextql.engine.execution;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fully materialized, immutable query result.
 *
 * All rows are loaded into memory so the result can be cached and handed to
 * several callers.
 */
public record BufferedResult(
        List<Column> columns,
        List<Row> rows) {

    public BufferedResult {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public long rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    /**
     * @return The index of the column (case-insensitive), or -1
     */
    public int columnIndex(String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equalsIgnoreCase(columnName)) {
                return i;
            }
        }
        return -1;
    }

    public Object getValue(int rowIndex, int columnIndex) {
        return rows.get(rowIndex).values().get(columnIndex);
    }

    public Object getValue(int rowIndex, String columnName) {
        int index = columnIndex(columnName);
        if (index < 0) {
            throw new IllegalArgumentException("Column not found: " + columnName);
        }
        return rows.get(rowIndex).values().get(index);
    }

    /**
     * @return Each row as a column-name to value map, in column order
     */
    public List<Map<String, Object>> toMaps() {
        List<Map<String, Object>> maps = new ArrayList<>(rows.size());
        for (Row row : rows) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                map.put(columns.get(i).name(), row.get(i));
            }
            maps.add(map);
        }
        return maps;
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
