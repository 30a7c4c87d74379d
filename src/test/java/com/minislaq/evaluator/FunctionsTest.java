package com.minislaq.evaluator;

import com.minislaq.common.EvaluationException;
import com.minislaq.value.Value;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Scalar function tests
 *
 * @author Mini-SLAQ
 */
class FunctionsTest {

    // Tuesday
    private static final Value TIME = Value.of(OffsetDateTime.of(2024, 8, 20, 14, 30, 0, 0, ZoneOffset.UTC));

    private static Value call(String name, Value... args) throws EvaluationException {
        return Functions.call(name, Arrays.asList(args));
    }

    @Test
    void testTimeFunctions() throws EvaluationException {
        assertEquals(Value.of(14), call("HOUR", TIME));
        assertEquals(Value.of(20), call("DAY", TIME));
        assertEquals(Value.of(2), call("WEEKDAY", TIME));
        assertEquals(Value.of("2024-08-20"), call("DATE", TIME));

        Value sunday = Value.of(OffsetDateTime.of(2024, 8, 18, 0, 0, 0, 0, ZoneOffset.UTC));
        assertEquals(Value.of(0), call("WEEKDAY", sunday));
        Value saturday = Value.of(OffsetDateTime.of(2024, 8, 24, 0, 0, 0, 0, ZoneOffset.UTC));
        assertEquals(Value.of(6), call("WEEKDAY", saturday));
    }

    /**
     * Components are taken in the offset the record was logged in
     */
    @Test
    void testTimeFunctionsKeepOffset() throws EvaluationException {
        Value local = Value.of(OffsetDateTime.of(2024, 8, 20, 23, 0, 0, 0, ZoneOffset.ofHours(-5)));
        assertEquals(Value.of(23), call("HOUR", local));
        assertEquals(Value.of("2024-08-20"), call("DATE", local));
    }

    @Test
    void testStringFunctions() throws EvaluationException {
        assertEquals(Value.of("GET"), call("upper", Value.of("get")));
        assertEquals(Value.of("/api"), call("LOWER", Value.of("/API")));
        assertEquals(Value.of(4), call("LENGTH", Value.of("/api")));
    }

    @Test
    void testSubstr() throws EvaluationException {
        Value url = Value.of("/api/users");
        assertEquals(Value.of("api"), call("SUBSTR", url, Value.of(1), Value.of(3)));
        assertEquals(Value.of("users"), call("SUBSTR", url, Value.of(5)));
        assertEquals(Value.of("users"), call("SUBSTR", url, Value.of(5), Value.of(100)));
        assertEquals(Value.of("users"), call("SUBSTR", url, Value.of(5), Value.of(Long.MAX_VALUE)));
        assertEquals(Value.EMPTY_STRING, call("SUBSTR", url, Value.of(10)));
        assertEquals(Value.EMPTY_STRING, call("SUBSTR", url, Value.of(-1), Value.of(2)));
        assertEquals(Value.EMPTY_STRING, call("SUBSTR", url, Value.of(1), Value.of(-2)));
        assertEquals(Value.EMPTY_STRING, call("SUBSTR", url, Value.of(1), Value.of(0)));

        assertThrows(EvaluationException.class, () -> call("SUBSTR", url));
        assertThrows(EvaluationException.class, () -> call("SUBSTR", url, Value.of("1")));
    }

    @Test
    void testNetworkFunctions() throws EvaluationException {
        assertEquals(Value.TRUE, call("IS_PRIVATE_IP", Value.of("10.0.0.5")));
        assertEquals(Value.FALSE, call("IS_PRIVATE_IP", Value.of("8.8.8.8")));
        assertEquals(Value.FALSE, call("IS_PRIVATE_IP", Value.of("garbage")));
        assertEquals(Value.of("US/International"), call("COUNTRY", Value.of("8.8.8.8")));
        assertEquals(Value.of("Private"), call("COUNTRY", Value.of("192.168.0.9")));
    }

    @Test
    void testErrors() {
        EvaluationException unknown = assertThrows(EvaluationException.class,
                () -> Functions.call("REVERSE", Collections.singletonList(Value.of("x"))));
        assertTrue(unknown.getMessage().contains("Unknown function"));

        assertThrows(EvaluationException.class, () -> Functions.call("COUNT", Collections.<Value>emptyList()));

        List<Value> two = Arrays.asList(Value.of("a"), Value.of("b"));
        assertThrows(EvaluationException.class, () -> Functions.call("UPPER", two));
        assertThrows(EvaluationException.class, () -> call("HOUR", Value.of("2024-08-20 14:30:00")));
        assertThrows(EvaluationException.class, () -> call("LENGTH", Value.of(42)));
    }
}
