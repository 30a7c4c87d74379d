package com.minislaq.value;

import com.minislaq.common.EvaluationException;
import com.minislaq.value.Value.ValueType;

import java.util.regex.Pattern;

/**
 * Type coercion and ordering of values
 *
 * Coercion rules, applied only when operand types differ:
 * 1. string -> integer (if the other side is numeric)
 * 2. string -> float   (if the other side is numeric)
 * 3. integer -> float  (if the other side is float)
 *
 * Ordering per type after coercion:
 * - STRING: lexicographic
 * - INTEGER / FLOAT: numeric
 * - TIMESTAMP: by instant
 * - BOOLEAN: false &lt; true
 *
 * @author Mini-SLAQ
 */
public final class ValueComparator {

    private static final Pattern DECIMAL = Pattern.compile("-?[0-9]+(\\.[0-9]+)?");

    private ValueComparator() {
    }

    /**
     * Compare two values
     *
     * @return negative, zero or positive
     * @throws EvaluationException if the types cannot be made compatible
     */
    public static int compare(Value left, Value right) throws EvaluationException {
        if (left.getType() != right.getType()) {
            Value[] coerced = coerce(left, right);
            left = coerced[0];
            right = coerced[1];
            if (left.getType() != right.getType()) {
                throw new EvaluationException("Cannot compare " + left.getType() + " with " + right.getType());
            }
        }

        switch (left.getType()) {
            case STRING:
                return left.asString().compareTo(right.asString());
            case INTEGER:
                return Long.compare(left.asLong(), right.asLong());
            case FLOAT:
                return Double.compare(left.asDouble(), right.asDouble());
            case TIMESTAMP:
                return left.asTimestamp().toInstant().compareTo(right.asTimestamp().toInstant());
            case BOOLEAN:
                return Boolean.compare(left.asBoolean(), right.asBoolean());
            case LIST:
                throw new EvaluationException("Cannot compare list values");
            default:
                throw new IllegalStateException("Unhandled value type: " + left.getType());
        }
    }

    /**
     * Equality under the comparison rule
     */
    public static boolean equal(Value left, Value right) throws EvaluationException {
        return compare(left, right) == 0;
    }

    /**
     * Total order used by ORDER BY
     *
     * 1. Integers and floats compare numerically.
     * 2. Other values of the same type compare as in {@link #compare}.
     * 3. Values of different types order by type rank, so strings never
     *    coerce here and the order stays transitive.
     * 4. Lists compare equal to each other.
     */
    public static int compareForOrdering(Value left, Value right) {
        int rank = Integer.compare(typeRank(left), typeRank(right));
        if (rank != 0) {
            return rank;
        }
        if (left.getType() == ValueType.LIST) {
            return 0;
        }
        try {
            return compare(left, right);
        } catch (EvaluationException e) {
            throw new IllegalStateException("Same-rank values must compare: " + e.getDetail(), e);
        }
    }

    private static int typeRank(Value value) {
        ValueType type = value.getType() == ValueType.FLOAT ? ValueType.INTEGER : value.getType();
        return type.ordinal();
    }

    /**
     * Bring two values of different types to a common type where possible
     *
     * @return the (possibly) converted pair; types may still differ
     */
    public static Value[] coerce(Value left, Value right) {
        if (left.getType() == ValueType.STRING && right.isNumeric()) {
            left = parseNumber(left);
        }
        if (right.getType() == ValueType.STRING && left.isNumeric()) {
            right = parseNumber(right);
        }

        if (left.getType() == ValueType.INTEGER && right.getType() == ValueType.FLOAT) {
            left = Value.of((double) left.asLong());
        }
        if (right.getType() == ValueType.INTEGER && left.getType() == ValueType.FLOAT) {
            right = Value.of((double) right.asLong());
        }
        return new Value[]{left, right};
    }

    /**
     * Truthiness used by AND / OR / NOT and by WHERE / HAVING
     *
     * @throws EvaluationException for timestamps and lists
     */
    public static boolean toBoolean(Value value) throws EvaluationException {
        switch (value.getType()) {
            case BOOLEAN:
                return value.asBoolean();
            case INTEGER:
                return value.asLong() != 0;
            case FLOAT:
                return value.asDouble() != 0.0;
            case STRING:
                return !value.asString().isEmpty();
            case TIMESTAMP:
            case LIST:
                throw new EvaluationException("Cannot convert " + value.getType() + " to boolean");
            default:
                throw new IllegalStateException("Unhandled value type: " + value.getType());
        }
    }

    /**
     * Parse plain decimal text: optional '-', digits, optional fraction
     *
     * @return INTEGER if it fits a long, FLOAT otherwise; null for anything
     *         else, including NaN, Infinity, exponents and padding
     */
    public static Value parseDecimal(String text) {
        if (!DECIMAL.matcher(text).matches()) {
            return null;
        }
        if (text.indexOf('.') < 0) {
            try {
                return Value.of(Long.parseLong(text));
            } catch (NumberFormatException outOfRange) {
                return Value.of(Double.parseDouble(text));
            }
        }
        return Value.of(Double.parseDouble(text));
    }

    /**
     * Parse a string value as a decimal number
     *
     * @return the number, or the original value if it is not numeric
     */
    static Value parseNumber(Value text) {
        Value number = parseDecimal(text.asString());
        return number != null ? number : text;
    }
}
