package com.minislaq.parser;

import com.minislaq.common.QueryParseException;
import com.minislaq.parser.ast.Expression;
import com.minislaq.parser.ast.SelectStatement;

import java.util.List;

/**
 * Semantic checks on a parsed statement
 *
 * Rules:
 * - aggregates are not allowed in WHERE or GROUP BY
 * - aggregates need GROUP BY (no single-record aggregation)
 * - aggregates do not nest
 * - HAVING needs GROUP BY
 * - SELECT * cannot be grouped
 * - in a grouped query, a selected expression must be a GROUP BY
 *   expression or be built only from aggregates, GROUP BY expressions and
 *   literals
 *
 * @author Mini-SLAQ
 */
public class StatementValidator {

    public void validate(SelectStatement statement) throws QueryParseException {
        boolean grouped = statement.isGrouped();

        if (statement.getWhereCondition() != null && containsAggregate(statement.getWhereCondition())) {
            throw QueryParseException.validation("Aggregate functions are not allowed in WHERE");
        }
        for (Expression expression : statement.getGroupBy()) {
            if (containsAggregate(expression)) {
                throw QueryParseException.validation("Aggregate functions are not allowed in GROUP BY: " + expression);
            }
        }
        if (statement.getHavingCondition() != null && !grouped) {
            throw QueryParseException.validation("HAVING requires GROUP BY");
        }
        if (statement.isSelectAll() && grouped) {
            throw QueryParseException.validation("SELECT * cannot be combined with GROUP BY");
        }

        for (SelectStatement.SelectElement element : statement.getSelectElements()) {
            Expression expression = element.getExpression();
            checkNesting(expression, false);
            if (!grouped) {
                if (containsAggregate(expression)) {
                    throw QueryParseException.validation(
                            "Aggregate function " + expression + " requires GROUP BY");
                }
            } else if (!isGroupSafe(expression, statement.getGroupBy())) {
                throw QueryParseException.validation(
                        "Selected expression " + expression + " must appear in GROUP BY or be an aggregate");
            }
        }

        for (SelectStatement.OrderByElement element : statement.getOrderByElements()) {
            checkNesting(element.getExpression(), false);
            if (!grouped && containsAggregate(element.getExpression())) {
                throw QueryParseException.validation(
                        "Aggregate function in ORDER BY requires GROUP BY: " + element.getExpression());
            }
        }

        if (statement.getHavingCondition() != null) {
            checkNesting(statement.getHavingCondition(), false);
        }
    }

    /**
     * Whether the expression contains an aggregate call anywhere
     */
    public static boolean containsAggregate(Expression expression) {
        switch (expression.getExpressionType()) {
            case AGGREGATE:
                return true;
            case FIELD:
            case LITERAL:
                return false;
            case BINARY:
                Expression.BinaryExpression binary = (Expression.BinaryExpression) expression;
                return containsAggregate(binary.getLeft()) || containsAggregate(binary.getRight());
            case UNARY:
                return containsAggregate(((Expression.UnaryExpression) expression).getOperand());
            case FUNCTION:
                for (Expression argument : ((Expression.FunctionCall) expression).getArguments()) {
                    if (containsAggregate(argument)) {
                        return true;
                    }
                }
                return false;
            default:
                throw new IllegalStateException("Unhandled expression type: " + expression.getExpressionType());
        }
    }

    private void checkNesting(Expression expression, boolean insideAggregate) throws QueryParseException {
        switch (expression.getExpressionType()) {
            case AGGREGATE:
                if (insideAggregate) {
                    throw QueryParseException.validation("Aggregate functions cannot be nested: " + expression);
                }
                Expression.AggregateCall aggregate = (Expression.AggregateCall) expression;
                if (aggregate.hasArgument()) {
                    checkNesting(aggregate.getArgument(), true);
                }
                return;
            case FIELD:
            case LITERAL:
                return;
            case BINARY:
                Expression.BinaryExpression binary = (Expression.BinaryExpression) expression;
                checkNesting(binary.getLeft(), insideAggregate);
                checkNesting(binary.getRight(), insideAggregate);
                return;
            case UNARY:
                checkNesting(((Expression.UnaryExpression) expression).getOperand(), insideAggregate);
                return;
            case FUNCTION:
                for (Expression argument : ((Expression.FunctionCall) expression).getArguments()) {
                    checkNesting(argument, insideAggregate);
                }
                return;
            default:
                throw new IllegalStateException("Unhandled expression type: " + expression.getExpressionType());
        }
    }

    /**
     * Whether a selected expression has one value per group
     */
    private boolean isGroupSafe(Expression expression, List<Expression> groupBy) {
        if (matchesGroupExpression(expression, groupBy)) {
            return true;
        }
        switch (expression.getExpressionType()) {
            case AGGREGATE:
            case LITERAL:
                return true;
            case FIELD:
                // record fields need grouping; other names are not resolvable per group
                return false;
            case BINARY:
                Expression.BinaryExpression binary = (Expression.BinaryExpression) expression;
                return isGroupSafe(binary.getLeft(), groupBy) && isGroupSafe(binary.getRight(), groupBy);
            case UNARY:
                return isGroupSafe(((Expression.UnaryExpression) expression).getOperand(), groupBy);
            case FUNCTION:
                for (Expression argument : ((Expression.FunctionCall) expression).getArguments()) {
                    if (!isGroupSafe(argument, groupBy)) {
                        return false;
                    }
                }
                return true;
            default:
                throw new IllegalStateException("Unhandled expression type: " + expression.getExpressionType());
        }
    }

    /**
     * GROUP BY membership is by rendered text
     */
    public static boolean matchesGroupExpression(Expression expression, List<Expression> groupBy) {
        String text = expression.toString();
        for (Expression groupExpression : groupBy) {
            if (groupExpression.toString().equals(text)) {
                return true;
            }
        }
        return false;
    }
}
