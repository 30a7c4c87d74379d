package com.minislaq.evaluator;

import com.minislaq.common.EvaluationException;
import com.minislaq.log.LogEntry;
import com.minislaq.log.LogEntryFixtures;
import com.minislaq.parser.ast.AggregateFunction;
import com.minislaq.parser.ast.Expression;
import com.minislaq.parser.ast.Operator;
import com.minislaq.value.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Aggregate computation tests
 *
 * @author Mini-SLAQ
 */
class AggregatesTest {

    private ExpressionEvaluator evaluator;
    private List<LogEntry> members;

    @BeforeEach
    void setUp() {
        evaluator = new ExpressionEvaluator();
        members = Arrays.asList(
                LogEntryFixtures.entry("10.0.0.1", "/a", 200, 100),
                LogEntryFixtures.entry("10.0.0.2", "/404", 404, 300),
                LogEntryFixtures.entry("10.0.0.3", "/c", 500, 200));
    }

    private Value compute(AggregateFunction function, Expression argument) throws EvaluationException {
        return Aggregates.compute(new Expression.AggregateCall(function, argument), members, evaluator);
    }

    private static Expression field(String name) {
        return new Expression.FieldReference(name);
    }

    @Test
    void testCount() throws EvaluationException {
        assertEquals(Value.of(3), compute(AggregateFunction.COUNT, null));
        assertEquals(Value.of(3), compute(AggregateFunction.COUNT, field("url")));
    }

    /**
     * Members whose argument fails to evaluate are left out
     */
    @Test
    void testFailingMembersSkipped() throws EvaluationException {
        Expression numericUrl = new Expression.BinaryExpression(field("url"), Operator.EQUALS,
                new Expression.Literal(Value.of("/404")));
        assertEquals(Value.of(3), compute(AggregateFunction.COUNT, numericUrl));

        Expression hourOfUrl = new Expression.FunctionCall("HOUR", Collections.singletonList(field("url")));
        assertEquals(Value.of(0), compute(AggregateFunction.COUNT, hourOfUrl));
        assertEquals(Value.of(0.0), compute(AggregateFunction.AVG, hourOfUrl));
        assertEquals(Value.of(0), compute(AggregateFunction.MAX, hourOfUrl));
    }

    @Test
    void testSumAndAverage() throws EvaluationException {
        assertEquals(Value.of(600), compute(AggregateFunction.SUM, field("size")));
        assertEquals(Value.of(200.0), compute(AggregateFunction.AVG, field("size")));
        // non-numeric values are ignored by SUM
        assertEquals(Value.of(0), compute(AggregateFunction.SUM, field("url")));
        assertEquals(Value.of(1.5), compute(AggregateFunction.SUM, new Expression.Literal(Value.of(0.5))));
    }

    @Test
    void testMinAndMax() throws EvaluationException {
        assertEquals(Value.of(100), compute(AggregateFunction.MIN, field("size")));
        assertEquals(Value.of(300), compute(AggregateFunction.MAX, field("size")));
        assertEquals(Value.of("/404"), compute(AggregateFunction.MIN, field("url")));
        assertEquals(Value.of("/c"), compute(AggregateFunction.MAX, field("url")));
    }

    @Test
    void testMissingArgument() {
        assertThrows(EvaluationException.class, () -> compute(AggregateFunction.SUM, null));
    }
}
