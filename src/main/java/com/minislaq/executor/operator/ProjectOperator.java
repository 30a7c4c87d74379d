package com.minislaq.executor.operator;

import com.minislaq.common.Constants;
import com.minislaq.common.EvaluationException;
import com.minislaq.common.QueryExecutionException;
import com.minislaq.evaluator.EvaluationContext;
import com.minislaq.evaluator.ExpressionEvaluator;
import com.minislaq.evaluator.RecordContext;
import com.minislaq.executor.ErrorPolicy;
import com.minislaq.executor.ExecutionRow;
import com.minislaq.executor.Operator;
import com.minislaq.parser.ast.Expression;
import com.minislaq.parser.ast.SelectStatement;
import com.minislaq.value.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Project operator (SELECT list)
 *
 * - SELECT *: the nine record fields in record order
 * - record rows: each expression evaluated against the record
 * - group rows: each expression evaluated against the group; GROUP BY
 *   expressions come from the group key, aggregates from the members
 *
 * @author Mini-SLAQ
 */
@Slf4j
public class ProjectOperator implements Operator {

    private final Operator child;

    /**
     * Select items, empty for SELECT *
     */
    private final List<SelectStatement.SelectElement> selectElements;

    private final List<Expression> groupBy;

    private final ExpressionEvaluator evaluator;

    private final ErrorPolicy errorPolicy;

    private int processedRows = 0;

    public ProjectOperator(Operator child, List<SelectStatement.SelectElement> selectElements,
                           List<Expression> groupBy, ExpressionEvaluator evaluator,
                           ErrorPolicy errorPolicy) {
        this.child = child;
        this.selectElements = selectElements;
        this.groupBy = groupBy;
        this.evaluator = evaluator;
        this.errorPolicy = errorPolicy;
    }

    @Override
    public void open() throws QueryExecutionException {
        log.debug("Opening Project: columns={}", selectElements.isEmpty() ? "*" : selectElements);
        child.open();
        processedRows = 0;
    }

    @Override
    public ExecutionRow next() throws QueryExecutionException {
        ExecutionRow row = child.next();

        if (row == null) {
            log.debug("Project finished, processed {} rows", processedRows);
            return null;
        }

        processedRows++;

        List<Value> values = selectElements.isEmpty() ? allFields(row) : evaluateAll(row);
        log.trace("Project row {}: {}", processedRows, values);
        return row.withValues(values);
    }

    private List<Value> allFields(ExecutionRow row) throws QueryExecutionException {
        List<Value> values = new ArrayList<>(Constants.FIELD_NAMES.size());
        for (String field : Constants.FIELD_NAMES) {
            try {
                values.add(RecordContext.fieldValue(row.getRecord(), field));
            } catch (EvaluationException e) {
                throw new QueryExecutionException("Cannot read field " + field, e);
            }
        }
        return values;
    }

    private List<Value> evaluateAll(ExecutionRow row) throws QueryExecutionException {
        EvaluationContext context = row.context(groupBy, null);
        List<Value> values = new ArrayList<>(selectElements.size());
        for (SelectStatement.SelectElement element : selectElements) {
            Expression expression = element.getExpression();
            try {
                values.add(evaluator.evaluate(expression, context));
            } catch (EvaluationException e) {
                values.add(errorPolicy.onValueFailure(expression, e));
            }
        }
        return values;
    }

    @Override
    public void close() {
        log.debug("Closing Project");
        child.close();
    }

    @Override
    public String getOperatorType() {
        return "Project(" + (selectElements.isEmpty() ? "*" : selectElements.toString()) + ")";
    }

}
