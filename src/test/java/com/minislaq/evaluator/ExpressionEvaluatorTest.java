package com.minislaq.evaluator;

import com.minislaq.common.EvaluationException;
import com.minislaq.common.QueryParseException;
import com.minislaq.log.LogEntry;
import com.minislaq.log.LogEntryFixtures;
import com.minislaq.parser.SLAQParser;
import com.minislaq.parser.ast.Expression;
import com.minislaq.parser.ast.SelectStatement;
import com.minislaq.value.Value;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Expression evaluation against records and groups
 *
 * @author Mini-SLAQ
 */
class ExpressionEvaluatorTest {

    private SLAQParser parser;
    private ExpressionEvaluator evaluator;
    private RecordContext record;

    @BeforeEach
    void setUp() {
        parser = new SLAQParser();
        evaluator = new ExpressionEvaluator();
        record = new RecordContext(LogEntryFixtures.entry("192.168.1.10", "2024-08-20T14:30:00",
                "POST", "/api/login", 401, 512, LogEntryFixtures.GOOGLEBOT));
    }

    private Expression condition(String where) throws QueryParseException {
        return parser.parse("SELECT * FROM logs WHERE " + where).getWhereCondition();
    }

    private boolean test(String where) throws Exception {
        return evaluator.test(condition(where), record);
    }

    @Test
    void testFieldValues() throws Exception {
        assertEquals(Value.of(401), evaluator.evaluate(condition("status"), record));
        assertEquals(Value.of(512), evaluator.evaluate(condition("size"), record));
        assertEquals(Value.of("POST"), evaluator.evaluate(condition("method"), record));
        assertEquals(Value.ValueType.TIMESTAMP, evaluator.evaluate(condition("timestamp"), record).getType());

        EvaluationException e = assertThrows(EvaluationException.class,
                () -> evaluator.evaluate(condition("bogus"), record));
        assertTrue(e.getMessage().contains("Unknown field: bogus"));
    }

    @Test
    void testConditions() throws Exception {
        assertTrue(test("status = 401 AND method = 'POST'"));
        assertTrue(test("status IS_ERROR AND user_agent IS_BOT"));
        assertTrue(test("NOT status IS_SUCCESS"));
        assertTrue(test("ip IN_RANGE '192.168.0.0/16'"));
        assertTrue(test("url LIKE '/api/*' OR size > 10000"));
        assertTrue(test("status IN (401, 403)"));
        assertTrue(test("size BETWEEN 500 AND 600"));
        assertTrue(test("HOUR(timestamp) = 14 AND WEEKDAY(timestamp) = 2"));
        assertTrue(test("timestamp > '2024-08-20' AND timestamp < '2024-08-21 00:00:00'"));
        assertTrue(test("IS_PRIVATE_IP(ip)"));
        assertTrue(test("SUBSTR(url, 1, 3) = 'api'"));
        assertFalse(test("method = 'GET'"));
    }

    /**
     * Both sides of AND are evaluated, so a failing right side fails the condition
     */
    @Test
    void testFailureIsNotShortCircuited() {
        assertThrows(EvaluationException.class, () -> test("method = 'GET' AND url = 1"));
        assertThrows(EvaluationException.class, () -> test("status = 401 OR HOUR(url) = 1"));
    }

    @Test
    void testAggregateOnRecordFails() throws Exception {
        SelectStatement statement = parser.parse("SELECT status, COUNT() FROM logs GROUP BY status");
        Expression count = statement.getSelectElements().get(1).getExpression();
        assertThrows(EvaluationException.class, () -> evaluator.evaluate(count, record));
    }

    @Test
    void testGroupContext() throws Exception {
        SelectStatement statement = parser.parse(
                "SELECT status, COUNT() AS hits, SUM(size) FROM logs GROUP BY status HAVING hits > 1");
        List<LogEntry> members = Arrays.asList(
                LogEntryFixtures.entry("1.1.1.1", "/a", 404, 100),
                LogEntryFixtures.entry("2.2.2.2", "/b", 404, 50));
        List<Value> key = Collections.singletonList(Value.of(404));

        Map<String, Value> bindings = new HashMap<>();
        bindings.put("hits", Value.of(2));
        GroupContext group = new GroupContext(members, statement.getGroupBy(), key, bindings);

        assertEquals(Value.of(404), evaluator.evaluate(statement.getSelectElements().get(0).getExpression(), group));
        assertEquals(Value.of(150), evaluator.evaluate(statement.getSelectElements().get(2).getExpression(), group));
        assertTrue(evaluator.test(statement.getHavingCondition(), group));

        EvaluationException e = assertThrows(EvaluationException.class,
                () -> group.resolveField("url"));
        assertTrue(e.getMessage().contains("neither grouped nor an output column"));
    }
}
