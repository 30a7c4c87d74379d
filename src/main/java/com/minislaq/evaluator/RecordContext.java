package com.minislaq.evaluator;

import com.minislaq.common.Constants;
import com.minislaq.common.EvaluationException;
import com.minislaq.log.LogEntry;
import com.minislaq.parser.ast.Expression;
import com.minislaq.value.Value;
import lombok.Getter;

/**
 * Evaluation against a single log record
 *
 * @author Mini-SLAQ
 */
@Getter
public class RecordContext implements EvaluationContext {

    private final LogEntry entry;

    public RecordContext(LogEntry entry) {
        this.entry = entry;
    }

    @Override
    public Value lookup(Expression expression) {
        return null;
    }

    @Override
    public Value resolveField(String name) throws EvaluationException {
        return fieldValue(entry, name);
    }

    @Override
    public Value aggregate(Expression.AggregateCall call, ExpressionEvaluator evaluator)
            throws EvaluationException {
        throw new EvaluationException("Aggregate function " + call + " cannot be used on a single record");
    }

    /**
     * Typed value of a record field
     *
     * status and size are INTEGER, timestamp is TIMESTAMP, the rest STRING.
     */
    public static Value fieldValue(LogEntry entry, String name) throws EvaluationException {
        switch (name) {
            case Constants.FIELD_IP:
                return Value.of(entry.getIp());
            case Constants.FIELD_TIMESTAMP:
                return Value.of(entry.getTimestamp());
            case Constants.FIELD_METHOD:
                return Value.of(entry.getMethod());
            case Constants.FIELD_URL:
                return Value.of(entry.getUrl());
            case Constants.FIELD_PROTOCOL:
                return Value.of(entry.getProtocol());
            case Constants.FIELD_STATUS:
                return Value.of((long) entry.getStatus());
            case Constants.FIELD_SIZE:
                return Value.of(entry.getSize());
            case Constants.FIELD_REFERER:
                return Value.of(entry.getReferer());
            case Constants.FIELD_USER_AGENT:
                return Value.of(entry.getUserAgent());
            default:
                throw new EvaluationException("Unknown field: " + name);
        }
    }
}
