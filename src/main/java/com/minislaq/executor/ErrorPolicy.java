package com.minislaq.executor;

import com.minislaq.common.EvaluationException;
import com.minislaq.common.QueryExecutionException;
import com.minislaq.parser.ast.Expression;
import com.minislaq.value.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * What happens when an expression fails to evaluate during execution
 *
 * LENIENT (default):
 * - WHERE / HAVING: the predicate counts as false
 * - projected value or group key: empty string
 * - sort key: compares equal to everything
 *
 * STRICT: the query is aborted with {@link QueryExecutionException}.
 *
 * @author Mini-SLAQ
 */
@Slf4j
public enum ErrorPolicy {

    LENIENT,
    STRICT;

    /**
     * @return the predicate result to use (always false)
     */
    public boolean onPredicateFailure(Expression condition, EvaluationException cause)
            throws QueryExecutionException {
        if (this == STRICT) {
            throw fail("condition " + condition, cause);
        }
        log.debug("Condition {} failed, treated as false: {}", condition, cause.getDetail());
        return false;
    }

    /**
     * @return the value to use in place of the failed one
     */
    public Value onValueFailure(Expression expression, EvaluationException cause)
            throws QueryExecutionException {
        if (this == STRICT) {
            throw fail("expression " + expression, cause);
        }
        log.debug("Expression {} failed, using empty value: {}", expression, cause.getDetail());
        return Value.EMPTY_STRING;
    }

    /**
     * @return null, meaning the row sorts after every evaluated key
     */
    public Value onSortKeyFailure(Expression expression, EvaluationException cause)
            throws QueryExecutionException {
        if (this == STRICT) {
            throw fail("sort key " + expression, cause);
        }
        log.debug("Sort key {} failed, row sorts last: {}", expression, cause.getDetail());
        return null;
    }

    private static QueryExecutionException fail(String what, EvaluationException cause) {
        return new QueryExecutionException("Failed to evaluate " + what + ": " + cause.getDetail(), cause);
    }
}
