package org.snowlite.engine.execution;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A row of values in a statement result.
 */
public record Row(List<Object> values) {

    public Row {
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public Object get(int index) {
        return values.get(index);
    }

    public int size() {
        return values.size();
    }

    /**
     * Creates a Row from the current position of a ResultSet. SQL arrays are
     * copied into lists so the row outlives the result set.
     */
    public static Row fromResultSet(ResultSet rs, int columnCount) throws SQLException {
        List<Object> values = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            Object value = rs.getObject(i);
            if (value instanceof Array sqlArray) {
                value = Arrays.asList((Object[]) sqlArray.getArray());
            }
            values.add(value);
        }
        return new Row(values);
    }
}
