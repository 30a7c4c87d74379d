package com.minislaq.executor;

import com.minislaq.common.QueryExecutionException;

/**
 * Execution operator, volcano (iterator) model
 *
 * Each operator pulls rows from its child and hands them upwards one at a
 * time; operators nest into a plan tree.
 *
 * Lifecycle:
 * 1. open(): prepare state, open children
 * 2. next(): next row, or null when exhausted
 * 3. close(): release state, close children
 *
 * @author Mini-SLAQ
 */
public interface Operator {

    /**
     * Prepare the operator; must be called before next()
     *
     * @throws QueryExecutionException if preparation fails
     */
    void open() throws QueryExecutionException;

    /**
     * Next row
     *
     * @return next row, or null if there are no more rows
     * @throws QueryExecutionException if the row cannot be produced
     */
    ExecutionRow next() throws QueryExecutionException;

    /**
     * Release resources and close children
     */
    void close();

    /**
     * Operator description (plan logging)
     */
    default String getOperatorType() {
        return this.getClass().getSimpleName();
    }
}
