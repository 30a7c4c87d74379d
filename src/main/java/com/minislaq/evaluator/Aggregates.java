package com.minislaq.evaluator;

import com.minislaq.common.EvaluationException;
import com.minislaq.log.LogEntry;
import com.minislaq.parser.ast.AggregateFunction;
import com.minislaq.parser.ast.Expression;
import com.minislaq.value.Value;
import com.minislaq.value.ValueComparator;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Aggregate computation over the members of a group
 *
 * The argument is evaluated once per member record. Members whose argument
 * cannot be evaluated are left out of every aggregate.
 *
 * - COUNT(): group size
 * - COUNT(x): members where x evaluates
 * - SUM(x): INTEGER if every counted value is an integer, else FLOAT
 * - AVG(x): FLOAT, 0.0 without numeric values
 * - MIN(x) / MAX(x): seeded from the first member that evaluates; values
 *   incomparable with the current best are skipped; INTEGER 0 if none
 *
 * @author Mini-SLAQ
 */
@Slf4j
public final class Aggregates {

    private Aggregates() {
    }

    public static Value compute(Expression.AggregateCall call, List<LogEntry> members,
                                ExpressionEvaluator evaluator) throws EvaluationException {
        if (!call.hasArgument() && call.getFunction() != AggregateFunction.COUNT) {
            throw new EvaluationException(call.getFunction() + " requires exactly 1 argument");
        }
        switch (call.getFunction()) {
            case COUNT:
                if (!call.hasArgument()) {
                    return Value.of((long) members.size());
                }
                long count = 0;
                for (LogEntry member : members) {
                    if (evaluateMember(call, member, evaluator) != null) {
                        count++;
                    }
                }
                return Value.of(count);

            case SUM:
                return sum(call, members, evaluator);

            case AVG:
                return average(call, members, evaluator);

            case MIN:
                return extreme(call, members, evaluator, false);

            case MAX:
                return extreme(call, members, evaluator, true);

            default:
                throw new EvaluationException("Unknown aggregate function: " + call.getFunction());
        }
    }

    private static Value sum(Expression.AggregateCall call, List<LogEntry> members,
                             ExpressionEvaluator evaluator) {
        long integerSum = 0;
        double floatSum = 0.0;
        boolean sawFloat = false;

        for (LogEntry member : members) {
            Value value = evaluateMember(call, member, evaluator);
            if (value == null || !value.isNumeric()) {
                continue;
            }
            if (value.getType() == Value.ValueType.INTEGER) {
                integerSum += value.asLong();
            } else {
                floatSum += value.asDouble();
                sawFloat = true;
            }
        }
        return sawFloat ? Value.of(floatSum + integerSum) : Value.of(integerSum);
    }

    private static Value average(Expression.AggregateCall call, List<LogEntry> members,
                                 ExpressionEvaluator evaluator) {
        double total = 0.0;
        long counted = 0;

        for (LogEntry member : members) {
            Value value = evaluateMember(call, member, evaluator);
            if (value == null || !value.isNumeric()) {
                continue;
            }
            total += value.asDouble();
            counted++;
        }
        return Value.of(counted == 0 ? 0.0 : total / counted);
    }

    private static Value extreme(Expression.AggregateCall call, List<LogEntry> members,
                                 ExpressionEvaluator evaluator, boolean max) {
        Value best = null;
        for (LogEntry member : members) {
            Value value = evaluateMember(call, member, evaluator);
            if (value == null) {
                continue;
            }
            if (best == null) {
                best = value;
                continue;
            }
            try {
                int cmp = ValueComparator.compare(value, best);
                if (max ? cmp > 0 : cmp < 0) {
                    best = value;
                }
            } catch (EvaluationException e) {
                log.trace("{} skips incomparable value {}: {}", call, value, e.getMessage());
            }
        }
        return best != null ? best : Value.of(0L);
    }

    /**
     * @return the argument value for one member, or null if it does not evaluate
     */
    private static Value evaluateMember(Expression.AggregateCall call, LogEntry member,
                                        ExpressionEvaluator evaluator) {
        try {
            return evaluator.evaluate(call.getArgument(), new RecordContext(member));
        } catch (EvaluationException e) {
            log.trace("{} skips record {}: {}", call, member.getIp(), e.getMessage());
            return null;
        }
    }
}
