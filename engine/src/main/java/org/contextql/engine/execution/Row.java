package org.contextql.engine.execution;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A row of values in a query result. Values may be null.
 */
public record Row(List<Object> values) {

    public Row {
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Row of(Object... values) {
        return new Row(Arrays.asList(values));
    }

    /**
     * Gets the value at the specified index.
     */
    public Object get(int index) {
        return values.get(index);
    }

    /**
     * Creates a Row from the current position of a ResultSet.
     */
    public static Row fromResultSet(ResultSet rs, int columnCount) throws SQLException {
        List<Object> values = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            values.add(unwrapValue(rs.getObject(i)));
        }
        return new Row(values);
    }

    /**
     * Converts SQL arrays to lists so rows hold no live JDBC objects.
     */
    private static Object unwrapValue(Object value) throws SQLException {
        if (value instanceof java.sql.Array sqlArray) {
            Object[] elements = (Object[]) sqlArray.getArray();
            return Collections.unmodifiableList(Arrays.asList(elements));
        }
        return value;
    }
}
