package com.minislaq.executor.operator;

import com.minislaq.common.EvaluationException;
import com.minislaq.common.QueryExecutionException;
import com.minislaq.evaluator.EvaluationContext;
import com.minislaq.evaluator.ExpressionEvaluator;
import com.minislaq.executor.ErrorPolicy;
import com.minislaq.executor.ExecutionRow;
import com.minislaq.executor.Operator;
import com.minislaq.log.LogEntry;
import com.minislaq.parser.ast.Expression;
import com.minislaq.value.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Group operator (GROUP BY)
 *
 * Materializes its input, then returns one row per group:
 * 1. evaluate the GROUP BY expressions against each record
 * 2. use the list of key values itself as the map key
 * 3. collect members under that key
 *
 * Groups come out in order of first appearance.
 *
 * @author Mini-SLAQ
 */
@Slf4j
public class GroupOperator implements Operator {

    private final Operator child;

    private final List<Expression> groupBy;

    private final ExpressionEvaluator evaluator;

    private final ErrorPolicy errorPolicy;

    private Iterator<ExecutionRow> iterator;

    private int groupCount = 0;

    public GroupOperator(Operator child, List<Expression> groupBy, ExpressionEvaluator evaluator,
                         ErrorPolicy errorPolicy) {
        this.child = child;
        this.groupBy = groupBy;
        this.evaluator = evaluator;
        this.errorPolicy = errorPolicy;
    }

    @Override
    public void open() throws QueryExecutionException {
        log.debug("Opening Group: {}", groupBy);
        child.open();

        Map<List<Value>, List<LogEntry>> members = new LinkedHashMap<>();
        int inputRows = 0;

        ExecutionRow row;
        while ((row = child.next()) != null) {
            inputRows++;
            members.computeIfAbsent(evaluateKey(row), k -> new ArrayList<>()).add(row.getRecord());
        }

        List<ExecutionRow> groups = new ArrayList<>(members.size());
        for (Map.Entry<List<Value>, List<LogEntry>> entry : members.entrySet()) {
            groups.add(ExecutionRow.ofGroup(entry.getKey(), entry.getValue()));
        }

        log.debug("Group collected {} rows into {} groups", inputRows, groups.size());
        iterator = groups.iterator();
        groupCount = groups.size();
    }

    private List<Value> evaluateKey(ExecutionRow row) throws QueryExecutionException {
        EvaluationContext context = row.context(groupBy, null);
        List<Value> values = new ArrayList<>(groupBy.size());
        for (Expression expression : groupBy) {
            try {
                values.add(evaluator.evaluate(expression, context));
            } catch (EvaluationException e) {
                values.add(errorPolicy.onValueFailure(expression, e));
            }
        }
        return values;
    }

    @Override
    public ExecutionRow next() {
        if (iterator == null) {
            throw new IllegalStateException("Operator not opened");
        }
        return iterator.hasNext() ? iterator.next() : null;
    }

    @Override
    public void close() {
        log.debug("Closing Group, {} groups", groupCount);
        child.close();
        iterator = null;
    }

    @Override
    public String getOperatorType() {
        return "Group(" + groupBy + ")";
    }
}
