package com.minislaq.evaluator;

import com.minislaq.common.Constants;
import com.minislaq.common.EvaluationException;
import com.minislaq.common.NetworkUtils;
import com.minislaq.value.Value;
import com.minislaq.value.Value.ValueType;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Scalar function library
 *
 * Time:    HOUR, DAY, WEEKDAY (0 = Sunday), DATE
 * String:  UPPER, LOWER, LENGTH, SUBSTR
 * Network: IS_PRIVATE_IP, COUNTRY
 *
 * Names are case-insensitive. Aggregates are not handled here.
 *
 * @author Mini-SLAQ
 */
public final class Functions {

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern(Constants.DATE_DISPLAY_PATTERN, Locale.ROOT);

    private Functions() {
    }

    /**
     * Call a scalar function
     *
     * @throws EvaluationException for unknown functions, wrong arity or argument types
     */
    public static Value call(String name, List<Value> args) throws EvaluationException {
        String function = name.toUpperCase(Locale.ROOT);
        switch (function) {
            // time
            case "HOUR":
                return Value.of((long) timestampArg(function, args).getHour());
            case "DAY":
                return Value.of((long) timestampArg(function, args).getDayOfMonth());
            case "WEEKDAY":
                return Value.of((long) (timestampArg(function, args).getDayOfWeek().getValue() % 7));
            case "DATE":
                return Value.of(DATE_FORMAT.format(timestampArg(function, args)));

            // string
            case "UPPER":
                return Value.of(stringArg(function, args).toUpperCase(Locale.ROOT));
            case "LOWER":
                return Value.of(stringArg(function, args).toLowerCase(Locale.ROOT));
            case "LENGTH":
                return Value.of((long) stringArg(function, args).length());
            case "SUBSTR":
                return substr(args);

            // network
            case "IS_PRIVATE_IP": {
                byte[] address = NetworkUtils.parseAddress(stringArg(function, args));
                return Value.of(address != null && NetworkUtils.isPrivate(address));
            }
            case "COUNTRY":
                return Value.of(NetworkUtils.countryOf(stringArg(function, args)));

            default:
                if (Constants.AGGREGATE_FUNCTIONS.contains(function)) {
                    throw new EvaluationException("Aggregate function " + function + " is not a scalar function");
                }
                throw new EvaluationException("Unknown function: " + name);
        }
    }

    /**
     * SUBSTR(str, start[, length])
     *
     * start is 0-based; a start outside the string or a negative length gives
     * ''; the length is clamped at the end of the string.
     */
    private static Value substr(List<Value> args) throws EvaluationException {
        if (args.size() != 2 && args.size() != 3) {
            throw new EvaluationException("SUBSTR requires 2 or 3 arguments, got " + args.size());
        }
        String text = requireType("SUBSTR", args.get(0), ValueType.STRING).asString();
        long start = requireType("SUBSTR", args.get(1), ValueType.INTEGER).asLong();
        if (start < 0 || start >= text.length()) {
            return Value.EMPTY_STRING;
        }

        long end = text.length();
        if (args.size() == 3) {
            long length = requireType("SUBSTR", args.get(2), ValueType.INTEGER).asLong();
            if (length < 0) {
                return Value.EMPTY_STRING;
            }
            if (length < end - start) {
                end = start + length;
            }
        }
        return Value.of(text.substring((int) start, (int) end));
    }

    private static OffsetDateTime timestampArg(String function, List<Value> args) throws EvaluationException {
        return requireType(function, single(function, args), ValueType.TIMESTAMP).asTimestamp();
    }

    private static String stringArg(String function, List<Value> args) throws EvaluationException {
        return requireType(function, single(function, args), ValueType.STRING).asString();
    }

    private static Value single(String function, List<Value> args) throws EvaluationException {
        if (args.size() != 1) {
            throw new EvaluationException(function + " requires exactly 1 argument, got " + args.size());
        }
        return args.get(0);
    }

    private static Value requireType(String function, Value value, ValueType type) throws EvaluationException {
        if (value.getType() != type) {
            throw new EvaluationException(function + " expects " + type + " argument, got " + value.getType());
        }
        return value;
    }
}
