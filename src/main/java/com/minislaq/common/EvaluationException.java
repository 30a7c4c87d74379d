package com.minislaq.common;

/**
 * Expression could not be evaluated against a record or group
 *
 * Type mismatches, unknown fields or functions and wrong argument counts.
 * Whether it aborts the query is decided by the
 * {@link com.minislaq.executor.ErrorPolicy}.
 *
 * @author Mini-SLAQ
 */
public class EvaluationException extends SlaqException {

    public EvaluationException(String detail) {
        super(Phase.EVALUATION, detail, NO_POSITION);
    }

    public EvaluationException(String detail, Throwable cause) {
        super(Phase.EVALUATION, detail, NO_POSITION, cause);
    }
}
