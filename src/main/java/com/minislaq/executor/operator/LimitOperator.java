package com.minislaq.executor.operator;

import com.minislaq.common.QueryExecutionException;
import com.minislaq.executor.ExecutionRow;
import com.minislaq.executor.Operator;
import lombok.extern.slf4j.Slf4j;

/**
 * Limit operator (LIMIT n)
 *
 * Returns the first n rows and stops pulling from its child afterwards.
 *
 * @author Mini-SLAQ
 */
@Slf4j
public class LimitOperator implements Operator {

    private final Operator child;

    private final long limit;

    private long returnedRows = 0;

    public LimitOperator(Operator child, long limit) {
        this.child = child;
        this.limit = limit;
    }

    @Override
    public void open() throws QueryExecutionException {
        log.debug("Opening Limit: {}", limit);
        child.open();
        returnedRows = 0;
    }

    @Override
    public ExecutionRow next() throws QueryExecutionException {
        if (returnedRows >= limit) {
            log.debug("Limit reached: {} rows", returnedRows);
            return null;
        }

        ExecutionRow row = child.next();

        if (row != null) {
            returnedRows++;
            log.trace("Limit returned row {}/{}", returnedRows, limit);
        }

        return row;
    }

    @Override
    public void close() {
        log.debug("Closing Limit, returned {} rows", returnedRows);
        child.close();
    }

    @Override
    public String getOperatorType() {
        return "Limit(" + limit + ")";
    }

}
