package com.minislaq.executor;

import com.minislaq.value.Value;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Query result set
 *
 * @author Mini-SLAQ
 */
@Getter
public final class QueryResult {

    /**
     * Output column names
     */
    private final List<String> columns;

    /**
     * Rows, each aligned with {@link #columns}
     */
    private final List<List<Value>> rows;

    public QueryResult(List<String> columns, List<List<Value>> rows) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        List<List<Value>> copy = new ArrayList<>(rows.size());
        for (List<Value> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException("Row has " + row.size() + " values for "
                        + columns.size() + " columns");
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public int getCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Values of one column, top to bottom
     */
    public List<Value> column(String column) {
        int index = columns.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        List<Value> values = new ArrayList<>(rows.size());
        for (List<Value> row : rows) {
            values.add(row.get(index));
        }
        return values;
    }

    @Override
    public String toString() {
        return "QueryResult{columns=" + columns + ", count=" + getCount() + "}";
    }
}
