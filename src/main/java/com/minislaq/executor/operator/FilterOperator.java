package com.minislaq.executor.operator;

import com.minislaq.common.EvaluationException;
import com.minislaq.common.QueryExecutionException;
import com.minislaq.evaluator.ExpressionEvaluator;
import com.minislaq.executor.ErrorPolicy;
import com.minislaq.executor.ExecutionRow;
import com.minislaq.executor.Operator;
import com.minislaq.parser.ast.Expression;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;

/**
 * Filter operator
 *
 * Used for WHERE (on records, before grouping) and for HAVING (on projected
 * group rows, with output columns bound by name). Only rows whose condition
 * is true pass.
 *
 * @author Mini-SLAQ
 */
@Slf4j
public class FilterOperator implements Operator {

    private final Operator child;

    private final Expression condition;

    private final ExpressionEvaluator evaluator;

    private final ErrorPolicy errorPolicy;

    private final List<Expression> groupBy;

    /**
     * Output column names, null for filters below the projection
     */
    private final List<String> columns;

    /**
     * Statistics
     */
    private int inputRows = 0;
    private int outputRows = 0;

    /**
     * Filter on records (WHERE)
     */
    public FilterOperator(Operator child, Expression condition, ExpressionEvaluator evaluator,
                          ErrorPolicy errorPolicy) {
        this(child, condition, evaluator, errorPolicy, Collections.<Expression>emptyList(), null);
    }

    /**
     * Filter on projected rows (HAVING)
     */
    public FilterOperator(Operator child, Expression condition, ExpressionEvaluator evaluator,
                          ErrorPolicy errorPolicy, List<Expression> groupBy, List<String> columns) {
        this.child = child;
        this.condition = condition;
        this.evaluator = evaluator;
        this.errorPolicy = errorPolicy;
        this.groupBy = groupBy;
        this.columns = columns;
    }

    @Override
    public void open() throws QueryExecutionException {
        log.debug("Opening Filter: {}", condition);
        child.open();
        inputRows = 0;
        outputRows = 0;
    }

    @Override
    public ExecutionRow next() throws QueryExecutionException {
        while (true) {
            ExecutionRow row = child.next();

            if (row == null) {
                log.debug("Filter finished: input={}, output={}", inputRows, outputRows);
                return null;
            }

            inputRows++;

            if (matches(row)) {
                outputRows++;
                log.trace("Filter passed row {}", outputRows);
                return row;
            } else {
                log.trace("Filter rejected row {}", inputRows);
            }
        }
    }

    private boolean matches(ExecutionRow row) throws QueryExecutionException {
        try {
            return evaluator.test(condition, row.context(groupBy, columns));
        } catch (EvaluationException e) {
            return errorPolicy.onPredicateFailure(condition, e);
        }
    }

    @Override
    public void close() {
        log.debug("Closing Filter: {}", condition);
        child.close();
    }

    @Override
    public String getOperatorType() {
        return "Filter(" + condition + ")";
    }
}
