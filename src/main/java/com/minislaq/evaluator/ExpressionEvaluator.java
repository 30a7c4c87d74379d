package com.minislaq.evaluator;

import com.minislaq.common.EvaluationException;
import com.minislaq.parser.ast.Expression;
import com.minislaq.value.Value;
import com.minislaq.value.ValueComparator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree-walking expression evaluator
 *
 * Stateless; one instance can be shared by every operator of a plan and
 * across threads.
 *
 * @author Mini-SLAQ
 */
@Slf4j
public class ExpressionEvaluator {

    /**
     * Evaluate an expression
     *
     * @param expression expression tree
     * @param context    record or group the expression is evaluated against
     * @return value
     * @throws EvaluationException on type mismatch, unknown names or bad arity
     */
    public Value evaluate(Expression expression, EvaluationContext context) throws EvaluationException {
        Value known = context.lookup(expression);
        if (known != null) {
            return known;
        }

        switch (expression.getExpressionType()) {
            case FIELD:
                return context.resolveField(((Expression.FieldReference) expression).getFieldName());

            case LITERAL:
                return ((Expression.Literal) expression).getValue();

            case BINARY:
                Expression.BinaryExpression binary = (Expression.BinaryExpression) expression;
                Value left = evaluate(binary.getLeft(), context);
                Value right = evaluate(binary.getRight(), context);
                return Operators.applyBinary(binary.getOperator(), left, right);

            case UNARY:
                Expression.UnaryExpression unary = (Expression.UnaryExpression) expression;
                return Operators.applyUnary(unary.getOperator(), evaluate(unary.getOperand(), context));

            case FUNCTION:
                Expression.FunctionCall call = (Expression.FunctionCall) expression;
                List<Value> arguments = new ArrayList<>(call.getArguments().size());
                for (Expression argument : call.getArguments()) {
                    arguments.add(evaluate(argument, context));
                }
                return Functions.call(call.getName(), arguments);

            case AGGREGATE:
                return context.aggregate((Expression.AggregateCall) expression, this);

            default:
                throw new IllegalStateException("Unhandled expression type: " + expression.getExpressionType());
        }
    }

    /**
     * Evaluate a condition and convert the result to a boolean
     */
    public boolean test(Expression condition, EvaluationContext context) throws EvaluationException {
        Value value = evaluate(condition, context);
        boolean result = ValueComparator.toBoolean(value);
        log.trace("Condition {} -> {}", condition, result);
        return result;
    }
}
