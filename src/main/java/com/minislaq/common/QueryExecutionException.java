package com.minislaq.common;

/**
 * Query failed while running
 *
 * @author Mini-SLAQ
 */
public class QueryExecutionException extends SlaqException {

    public QueryExecutionException(String detail) {
        super(Phase.EXECUTION, detail, NO_POSITION);
    }

    public QueryExecutionException(String detail, Throwable cause) {
        super(Phase.EXECUTION, detail, NO_POSITION, cause);
    }
}
