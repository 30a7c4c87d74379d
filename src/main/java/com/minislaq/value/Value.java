package com.minislaq.value;

import com.minislaq.common.Constants;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Query value
 *
 * A closed set of variants, one per {@link ValueType}. Every switch over
 * {@link #getType()} lists all variants and fails on anything else, so a
 * new variant has to be handled everywhere before it can be used.
 *
 * Values are immutable and compare by content.
 *
 * Two renderings:
 * - toString(): SLAQ literal syntax, re-parseable ('text', 42, 1.5, 'true')
 * - asText(): display form used by result formatters (text, 42, 1.50, true)
 *
 * @author Mini-SLAQ
 */
public abstract class Value {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern(Constants.TIMESTAMP_DISPLAY_PATTERN, Locale.ROOT);

    /**
     * Value variants
     */
    public enum ValueType {
        STRING,
        INTEGER,
        FLOAT,
        BOOLEAN,
        TIMESTAMP,
        /** Only produced by IN (...) literal lists, never nested */
        LIST
    }

    public static final Value EMPTY_STRING = new StringValue("");
    public static final Value TRUE = new BooleanValue(true);
    public static final Value FALSE = new BooleanValue(false);

    /**
     * Value variant
     */
    public abstract ValueType getType();

    /**
     * Display form
     */
    public abstract String asText();

    public boolean isNumeric() {
        return getType() == ValueType.INTEGER || getType() == ValueType.FLOAT;
    }

    // ==================== Factories ====================

    public static Value of(String value) {
        return new StringValue(value);
    }

    public static Value of(long value) {
        return new IntegerValue(value);
    }

    public static Value of(double value) {
        return new FloatValue(value);
    }

    public static Value of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public static Value of(OffsetDateTime value) {
        return new TimestampValue(value);
    }

    public static Value listOf(List<Value> values) {
        return new ListValue(values);
    }

    // ==================== Typed access ====================

    public String asString() {
        return ((StringValue) require(ValueType.STRING)).getValue();
    }

    public long asLong() {
        return ((IntegerValue) require(ValueType.INTEGER)).getValue();
    }

    public double asDouble() {
        if (getType() == ValueType.INTEGER) {
            return ((IntegerValue) this).getValue();
        }
        return ((FloatValue) require(ValueType.FLOAT)).getValue();
    }

    public boolean asBoolean() {
        return ((BooleanValue) require(ValueType.BOOLEAN)).isValue();
    }

    public OffsetDateTime asTimestamp() {
        return ((TimestampValue) require(ValueType.TIMESTAMP)).getValue();
    }

    public List<Value> asList() {
        return ((ListValue) require(ValueType.LIST)).getValues();
    }

    private Value require(ValueType type) {
        if (getType() != type) {
            throw new IllegalStateException("Expected " + type + " value but was " + getType());
        }
        return this;
    }

    /**
     * Text value
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class StringValue extends Value {

        private final String value;

        private StringValue(String value) {
            if (value == null) {
                throw new IllegalArgumentException("String value must not be null");
            }
            this.value = value;
        }

        @Override
        public ValueType getType() {
            return ValueType.STRING;
        }

        @Override
        public String asText() {
            return value;
        }

        @Override
        public String toString() {
            // no escape syntax, so pick the quote that does not occur
            if (value.indexOf('\'') >= 0) {
                return "\"" + value + "\"";
            }
            return "'" + value + "'";
        }
    }

    /**
     * 64-bit signed integer
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class IntegerValue extends Value {

        private final long value;

        private IntegerValue(long value) {
            this.value = value;
        }

        @Override
        public ValueType getType() {
            return ValueType.INTEGER;
        }

        @Override
        public String asText() {
            return Long.toString(value);
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    /**
     * 64-bit float
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class FloatValue extends Value {

        private final double value;

        private FloatValue(double value) {
            this.value = value;
        }

        @Override
        public ValueType getType() {
            return ValueType.FLOAT;
        }

        @Override
        public String asText() {
            return String.format(Locale.ROOT, "%.2f", value);
        }

        @Override
        public String toString() {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return Double.toString(value);
            }
            // keep the dot so the literal reads back as a float
            String plain = BigDecimal.valueOf(value).toPlainString();
            return plain.indexOf('.') >= 0 ? plain : plain + ".0";
        }
    }

    /**
     * Boolean
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class BooleanValue extends Value {

        private final boolean value;

        private BooleanValue(boolean value) {
            this.value = value;
        }

        @Override
        public ValueType getType() {
            return ValueType.BOOLEAN;
        }

        @Override
        public String asText() {
            return Boolean.toString(value);
        }

        @Override
        public String toString() {
            // bare true/false would read back as field names
            return "'" + value + "'";
        }
    }

    /**
     * Point in time with the offset it was recorded in
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class TimestampValue extends Value {

        private final OffsetDateTime value;

        private TimestampValue(OffsetDateTime value) {
            if (value == null) {
                throw new IllegalArgumentException("Timestamp value must not be null");
            }
            this.value = value;
        }

        @Override
        public ValueType getType() {
            return ValueType.TIMESTAMP;
        }

        @Override
        public String asText() {
            return TIMESTAMP_FORMAT.format(value);
        }

        @Override
        public String toString() {
            return "'" + asText() + "'";
        }
    }

    /**
     * Flat list of scalar values
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class ListValue extends Value {

        private final List<Value> values;

        private ListValue(List<Value> values) {
            for (Value value : values) {
                if (value.getType() == ValueType.LIST) {
                    throw new IllegalArgumentException("List values cannot be nested");
                }
            }
            this.values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        @Override
        public ValueType getType() {
            return ValueType.LIST;
        }

        @Override
        public String asText() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(values.get(i).asText());
            }
            return sb.append(")").toString();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(values.get(i));
            }
            return sb.append(")").toString();
        }
    }
}
