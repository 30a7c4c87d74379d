package com.minislaq.evaluator;

import com.minislaq.common.EvaluationException;
import com.minislaq.parser.ast.Expression;
import com.minislaq.value.Value;

/**
 * Where field and aggregate values come from during evaluation
 *
 * Implementations:
 * - {@link RecordContext}: one log record (WHERE, ungrouped SELECT / ORDER BY)
 * - {@link GroupContext}: one group of records (grouped SELECT, HAVING, ORDER BY)
 *
 * @author Mini-SLAQ
 */
public interface EvaluationContext {

    /**
     * Value already known for a whole expression, or null
     *
     * Checked before an expression is evaluated, so a group can answer for
     * its key expressions and projected columns.
     */
    Value lookup(Expression expression);

    /**
     * Resolve a field (or alias) reference
     *
     * @throws EvaluationException if the name is unknown in this context
     */
    Value resolveField(String name) throws EvaluationException;

    /**
     * Compute an aggregate call
     *
     * @throws EvaluationException if aggregates are not available here
     */
    Value aggregate(Expression.AggregateCall call, ExpressionEvaluator evaluator) throws EvaluationException;
}
