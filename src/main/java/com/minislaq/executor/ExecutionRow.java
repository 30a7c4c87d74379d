package com.minislaq.executor;

import com.minislaq.evaluator.EvaluationContext;
import com.minislaq.evaluator.GroupContext;
import com.minislaq.evaluator.RecordContext;
import com.minislaq.log.LogEntry;
import com.minislaq.parser.ast.Expression;
import com.minislaq.value.Value;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Row flowing between operators
 *
 * Either a single record (ungrouped query) or a group with its key values
 * and member records. Projected values are attached by the Project operator.
 *
 * @author Mini-SLAQ
 */
@Getter
public final class ExecutionRow {

    /**
     * Source record, null for group rows
     */
    private final LogEntry record;

    /**
     * GROUP BY values, null for record rows
     */
    private final List<Value> keyValues;

    /**
     * Group members in input order, null for record rows
     */
    private final List<LogEntry> members;

    /**
     * Projected values, null before projection
     */
    private final List<Value> values;

    private ExecutionRow(LogEntry record, List<Value> keyValues, List<LogEntry> members, List<Value> values) {
        this.record = record;
        this.keyValues = keyValues;
        this.members = members;
        this.values = values;
    }

    public static ExecutionRow ofRecord(LogEntry record) {
        return new ExecutionRow(record, null, null, null);
    }

    public static ExecutionRow ofGroup(List<Value> keyValues, List<LogEntry> members) {
        return new ExecutionRow(null, Collections.unmodifiableList(keyValues),
                Collections.unmodifiableList(members), null);
    }

    /**
     * Same source with projected values attached
     */
    public ExecutionRow withValues(List<Value> projected) {
        return new ExecutionRow(record, keyValues, members, Collections.unmodifiableList(projected));
    }

    public boolean isGrouped() {
        return keyValues != null;
    }

    public boolean isProjected() {
        return values != null;
    }

    /**
     * Evaluation context of this row
     *
     * Group rows bind their projected values by output column name, so
     * HAVING and ORDER BY can refer to aliases.
     *
     * @param groupBy GROUP BY expressions of the query
     * @param columns output column names, aligned with the projected values
     */
    public EvaluationContext context(List<Expression> groupBy, List<String> columns) {
        if (!isGrouped()) {
            return new RecordContext(record);
        }
        Map<String, Value> bindings = new LinkedHashMap<>();
        if (values != null && columns != null) {
            for (int i = 0; i < columns.size() && i < values.size(); i++) {
                bindings.putIfAbsent(columns.get(i), values.get(i));
            }
        }
        return new GroupContext(members, groupBy, keyValues, bindings);
    }
}
