package com.minislaq.parser.ast;

import com.minislaq.value.Value;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Expression tree node
 *
 * Used for SELECT items, WHERE / HAVING conditions, GROUP BY keys and
 * ORDER BY keys. The variant set is closed: consumers switch over
 * {@link #getExpressionType()}.
 *
 * Nodes are immutable and compare structurally. toString() renders SLAQ text
 * that parses back to an equal tree.
 *
 * @author Mini-SLAQ
 */
public abstract class Expression {

    /**
     * Expression variants
     */
    public enum ExpressionType {
        /** Record field or alias reference */
        FIELD,
        /** Constant value */
        LITERAL,
        /** Binary operation (AND, OR, =, LIKE, IN, ...) */
        BINARY,
        /** Unary operation (NOT, IS_BOT, IS_ERROR, IS_SUCCESS) */
        UNARY,
        /** Scalar function call */
        FUNCTION,
        /** Aggregate function call (COUNT, SUM, AVG, MIN, MAX) */
        AGGREGATE
    }

    /**
     * Get the expression variant
     */
    public abstract ExpressionType getExpressionType();

    /**
     * Field reference
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class FieldReference extends Expression {

        /**
         * Field name; known record fields are lower case
         */
        private final String fieldName;

        public FieldReference(String fieldName) {
            this.fieldName = fieldName;
        }

        @Override
        public ExpressionType getExpressionType() {
            return ExpressionType.FIELD;
        }

        @Override
        public String toString() {
            return fieldName;
        }
    }

    /**
     * Literal (constant)
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class Literal extends Expression {

        private final Value value;

        public Literal(Value value) {
            this.value = value;
        }

        @Override
        public ExpressionType getExpressionType() {
            return ExpressionType.LITERAL;
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    /**
     * Binary operation
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class BinaryExpression extends Expression {

        private final Expression left;

        private final Operator operator;

        private final Expression right;

        public BinaryExpression(Expression left, Operator operator, Expression right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public ExpressionType getExpressionType() {
            return ExpressionType.BINARY;
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator + " " + right + ")";
        }
    }

    /**
     * Unary operation
     *
     * NOT is written before its operand; the record predicates after it.
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class UnaryExpression extends Expression {

        private final Operator operator;

        private final Expression operand;

        public UnaryExpression(Operator operator, Expression operand) {
            this.operator = operator;
            this.operand = operand;
        }

        @Override
        public ExpressionType getExpressionType() {
            return ExpressionType.UNARY;
        }

        @Override
        public String toString() {
            if (operator.isRecordPredicate()) {
                return "(" + operand + " " + operator + ")";
            }
            return "(" + operator + " " + operand + ")";
        }
    }

    /**
     * Scalar function call
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class FunctionCall extends Expression {

        /**
         * Upper-case function name
         */
        private final String name;

        private final List<Expression> arguments;

        public FunctionCall(String name, List<Expression> arguments) {
            this.name = name.toUpperCase(Locale.ROOT);
            this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
        }

        @Override
        public ExpressionType getExpressionType() {
            return ExpressionType.FUNCTION;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder(name).append('(');
            for (int i = 0; i < arguments.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(arguments.get(i));
            }
            return sb.append(')').toString();
        }
    }

    /**
     * Aggregate function call
     */
    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static final class AggregateCall extends Expression {

        private final AggregateFunction function;

        /**
         * Aggregated expression, null for COUNT()
         */
        private final Expression argument;

        public AggregateCall(AggregateFunction function, Expression argument) {
            this.function = function;
            this.argument = argument;
        }

        public boolean hasArgument() {
            return argument != null;
        }

        @Override
        public ExpressionType getExpressionType() {
            return ExpressionType.AGGREGATE;
        }

        @Override
        public String toString() {
            return function.name() + "(" + (argument == null ? "" : argument.toString()) + ")";
        }
    }
}
