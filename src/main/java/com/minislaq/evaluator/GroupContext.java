package com.minislaq.evaluator;

import com.minislaq.common.EvaluationException;
import com.minislaq.log.LogEntry;
import com.minislaq.parser.ast.Expression;
import com.minislaq.value.Value;
import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Evaluation against a group of records
 *
 * Resolution order for a name or expression:
 * 1. bound output columns (aliases and rendered SELECT expressions)
 * 2. GROUP BY expressions, by rendered text
 *
 * Aggregates are computed over the member records.
 *
 * @author Mini-SLAQ
 */
@Getter
public class GroupContext implements EvaluationContext {

    /**
     * Records of the group, in input order
     */
    private final List<LogEntry> members;

    private final List<Expression> groupBy;

    /**
     * Values of the GROUP BY expressions for this group
     * Aligned with {@link #groupBy}
     */
    private final List<Value> keyValues;

    /**
     * Output column name -> value
     */
    private final Map<String, Value> bindings;

    public GroupContext(List<LogEntry> members, List<Expression> groupBy, List<Value> keyValues,
                        Map<String, Value> bindings) {
        if (groupBy.size() != keyValues.size()) {
            throw new IllegalArgumentException("Group key has " + keyValues.size()
                    + " values for " + groupBy.size() + " expressions");
        }
        this.members = members;
        this.groupBy = groupBy;
        this.keyValues = keyValues;
        this.bindings = bindings != null ? bindings : Collections.<String, Value>emptyMap();
    }

    @Override
    public Value lookup(Expression expression) {
        return resolve(expression.toString());
    }

    @Override
    public Value resolveField(String name) throws EvaluationException {
        Value value = resolve(name);
        if (value == null) {
            throw new EvaluationException("Field " + name + " is neither grouped nor an output column");
        }
        return value;
    }

    @Override
    public Value aggregate(Expression.AggregateCall call, ExpressionEvaluator evaluator)
            throws EvaluationException {
        return Aggregates.compute(call, members, evaluator);
    }

    private Value resolve(String text) {
        Value bound = bindings.get(text);
        if (bound != null) {
            return bound;
        }
        for (int i = 0; i < groupBy.size(); i++) {
            if (groupBy.get(i).toString().equals(text)) {
                return keyValues.get(i);
            }
        }
        return null;
    }
}
