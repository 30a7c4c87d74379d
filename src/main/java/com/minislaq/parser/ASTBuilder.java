package com.minislaq.parser;

import com.minislaq.common.Constants;
import com.minislaq.common.QueryParseException;
import com.minislaq.parser.ast.AggregateFunction;
import com.minislaq.parser.ast.Expression;
import com.minislaq.parser.ast.Operator;
import com.minislaq.parser.ast.SelectStatement;
import com.minislaq.value.Value;
import com.minislaq.value.ValueComparator;
import lombok.extern.slf4j.Slf4j;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * AST builder
 *
 * Visits the {@link SLAQQueryParser} parse tree and builds the statement.
 *
 * Besides copying the tree it:
 * 1. rewrites x BETWEEN low AND high into (x &gt;= low) AND (x &lt;= high)
 * 2. turns a bare function name into a name reference (ORDER BY hour)
 * 3. rejects unknown functions, wrong aggregate arity and bad literals
 * 4. resolves GROUP BY items naming a SELECT alias to the aliased expression
 *
 * Errors leave as {@link ParseCancellationException} wrapping a
 * {@link QueryParseException}, the same way the error strategy reports
 * syntax errors.
 *
 * @author Mini-SLAQ
 */
@Slf4j
public class ASTBuilder extends SLAQQueryBaseVisitor<Object> {

    @Override
    public SelectStatement visitQuery(SLAQQueryParser.QueryContext ctx) {
        log.debug("Visiting query");

        boolean selectAll = ctx.selectList().STAR() != null;
        List<SelectStatement.SelectElement> selectElements = new ArrayList<>();
        if (!selectAll) {
            for (SLAQQueryParser.SelectElementContext elementCtx : ctx.selectList().selectElement()) {
                selectElements.add(visitSelectElement(elementCtx));
            }
        }

        Expression where = null;
        List<Expression> groupBy = new ArrayList<>();
        Expression having = null;
        List<SelectStatement.OrderByElement> orderBy = new ArrayList<>();
        Long limit = null;

        for (SLAQQueryParser.ClauseContext clause : ctx.clause()) {
            if (clause instanceof SLAQQueryParser.WhereClauseContext) {
                where = expression(((SLAQQueryParser.WhereClauseContext) clause).expression());

            } else if (clause instanceof SLAQQueryParser.GroupByClauseContext) {
                groupBy = new ArrayList<>();
                for (SLAQQueryParser.ExpressionContext item
                        : ((SLAQQueryParser.GroupByClauseContext) clause).expression()) {
                    groupBy.add(expression(item));
                }

            } else if (clause instanceof SLAQQueryParser.OrderByClauseContext) {
                orderBy = new ArrayList<>();
                for (SLAQQueryParser.OrderItemContext item
                        : ((SLAQQueryParser.OrderByClauseContext) clause).orderItem()) {
                    orderBy.add(visitOrderItem(item));
                }

            } else if (clause instanceof SLAQQueryParser.HavingClauseContext) {
                having = expression(((SLAQQueryParser.HavingClauseContext) clause).expression());

            } else if (clause instanceof SLAQQueryParser.LimitClauseContext) {
                limit = limit(((SLAQQueryParser.LimitClauseContext) clause).NUMBER().getSymbol());
            }
        }

        groupBy = resolveGroupByAliases(groupBy, selectElements);
        return new SelectStatement(selectElements, selectAll, ctx.table.getText(), where, groupBy,
                having, orderBy, limit);
    }

    @Override
    public SelectStatement.SelectElement visitSelectElement(SLAQQueryParser.SelectElementContext ctx) {
        String alias = ctx.alias != null ? ctx.alias.getText() : null;
        return new SelectStatement.SelectElement(expression(ctx.expression()), alias);
    }

    @Override
    public SelectStatement.OrderByElement visitOrderItem(SLAQQueryParser.OrderItemContext ctx) {
        boolean descending = false;
        if (ctx.direction != null) {
            String direction = ctx.direction.getText().toUpperCase(Locale.ROOT);
            if ("DESC".equals(direction)) {
                descending = true;
            } else if (!"ASC".equals(direction)) {
                throw error(ctx.direction, "Unexpected token: " + ctx.direction.getText());
            }
        }
        return new SelectStatement.OrderByElement(expression(ctx.expression()), descending);
    }

    private Long limit(Token number) {
        try {
            return Long.parseLong(number.getText());
        } catch (NumberFormatException e) {
            throw error(number, "Invalid LIMIT value: " + number.getText());
        }
    }

    // ==================== Expressions ====================

    @Override
    public Expression visitExpression(SLAQQueryParser.ExpressionContext ctx) {
        List<SLAQQueryParser.AndExpressionContext> operands = ctx.andExpression();
        Expression left = expression(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
            left = new Expression.BinaryExpression(left, Operator.OR, expression(operands.get(i)));
        }
        return left;
    }

    @Override
    public Expression visitAndExpression(SLAQQueryParser.AndExpressionContext ctx) {
        List<SLAQQueryParser.ComparisonContext> operands = ctx.comparison();
        Expression left = expression(operands.get(0));
        for (int i = 1; i < operands.size(); i++) {
            left = new Expression.BinaryExpression(left, Operator.AND, expression(operands.get(i)));
        }
        return left;
    }

    @Override
    public Expression visitNotComparison(SLAQQueryParser.NotComparisonContext ctx) {
        return new Expression.UnaryExpression(Operator.NOT, expression(ctx.comparison()));
    }

    @Override
    public Expression visitOperandComparison(SLAQQueryParser.OperandComparisonContext ctx) {
        Expression left = expression(ctx.primary());
        SLAQQueryParser.ComparisonTailContext tail = ctx.comparisonTail();
        if (tail == null) {
            return left;
        }

        if (tail instanceof SLAQQueryParser.BetweenTailContext) {
            SLAQQueryParser.BetweenTailContext between = (SLAQQueryParser.BetweenTailContext) tail;
            Expression lower = new Expression.BinaryExpression(left, Operator.GREATER_THAN_OR_EQUAL,
                    expression(between.low));
            Expression upper = new Expression.BinaryExpression(left, Operator.LESS_THAN_OR_EQUAL,
                    expression(between.high));
            return new Expression.BinaryExpression(lower, Operator.AND, upper);
        }

        if (tail instanceof SLAQQueryParser.InTailContext) {
            List<Value> values = new ArrayList<>();
            for (SLAQQueryParser.LiteralContext literal : ((SLAQQueryParser.InTailContext) tail).literal()) {
                values.add(literalValue(literal));
            }
            return new Expression.BinaryExpression(left, Operator.IN,
                    new Expression.Literal(Value.listOf(values)));
        }

        if (tail instanceof SLAQQueryParser.PredicateTailContext) {
            return new Expression.UnaryExpression(operator(((SLAQQueryParser.PredicateTailContext) tail).op), left);
        }

        SLAQQueryParser.CompareTailContext compare = (SLAQQueryParser.CompareTailContext) tail;
        return new Expression.BinaryExpression(left, operator(compare.compareOp().getStart()),
                expression(compare.primary()));
    }

    @Override
    public Expression visitCallPrimary(SLAQQueryParser.CallPrimaryContext ctx) {
        Token name = ctx.name;
        if (Lexer.tokenType(name.getType()) == TokenType.FIELD) {
            throw error(name, "Unknown function: " + name.getText());
        }

        AggregateFunction aggregate = AggregateFunction.fromName(name.getText());
        List<Expression> arguments = new ArrayList<>();
        SLAQQueryParser.ArgumentsContext args = ctx.arguments();
        if (args != null && args.STAR() != null) {
            // COUNT(*) is COUNT()
            if (aggregate != AggregateFunction.COUNT) {
                throw error(args.STAR().getSymbol(), "Unexpected token in expression: *");
            }
        } else if (args != null) {
            for (SLAQQueryParser.ExpressionContext argument : args.expression()) {
                arguments.add(expression(argument));
            }
        }

        if (aggregate == null) {
            return new Expression.FunctionCall(name.getText(), arguments);
        }
        if (aggregate == AggregateFunction.COUNT) {
            if (arguments.size() > 1) {
                throw error(name, "COUNT takes at most 1 argument");
            }
        } else if (arguments.size() != 1) {
            throw error(name, aggregate.name() + " requires exactly 1 argument");
        }
        return new Expression.AggregateCall(aggregate, arguments.isEmpty() ? null : arguments.get(0));
    }

    @Override
    public Expression visitPredicateCallPrimary(SLAQQueryParser.PredicateCallPrimaryContext ctx) {
        // call form: IS_ERROR(status)
        return new Expression.UnaryExpression(operator(ctx.op), expression(ctx.expression()));
    }

    @Override
    public Expression visitNamePrimary(SLAQQueryParser.NamePrimaryContext ctx) {
        String name = ctx.name.getText();
        if (Lexer.tokenType(ctx.name.getType()) == TokenType.FUNCTION) {
            // bare function name used as an alias reference
            return new Expression.FieldReference(name);
        }
        return new Expression.FieldReference(normalizeFieldName(name));
    }

    @Override
    public Expression visitLiteralPrimary(SLAQQueryParser.LiteralPrimaryContext ctx) {
        return new Expression.Literal(literalValue(ctx.literal()));
    }

    @Override
    public Expression visitParenPrimary(SLAQQueryParser.ParenPrimaryContext ctx) {
        return expression(ctx.expression());
    }

    private Value literalValue(SLAQQueryParser.LiteralContext ctx) {
        Token token = ctx.getStart();
        String text = token.getText();
        switch (Lexer.tokenType(token.getType())) {
            case STRING:
                return Value.of(text);

            case NUMBER:
                Value number = ValueComparator.parseDecimal(text);
                if (number == null) {
                    throw error(token, "Invalid number: " + text);
                }
                return number;

            case BOOL:
                return Value.of("TRUE".equals(text.toUpperCase(Locale.ROOT)));

            case DATE:
                Optional<OffsetDateTime> timestamp = DateLiterals.parse(text);
                if (!timestamp.isPresent()) {
                    throw error(token, "Invalid date format: " + text);
                }
                return Value.of(timestamp.get());

            default:
                throw error(token, "Expected literal value");
        }
    }

    // ==================== Helpers ====================

    private Expression expression(ParserRuleContext ctx) {
        return (Expression) visit(ctx);
    }

    /**
     * GROUP BY items naming a SELECT alias stand for the aliased expression
     */
    private static List<Expression> resolveGroupByAliases(List<Expression> groupBy,
                                                          List<SelectStatement.SelectElement> selectElements) {
        List<Expression> resolved = new ArrayList<>(groupBy.size());
        for (Expression expression : groupBy) {
            resolved.add(resolveAlias(expression, selectElements));
        }
        return resolved;
    }

    private static Expression resolveAlias(Expression expression,
                                           List<SelectStatement.SelectElement> selectElements) {
        if (!(expression instanceof Expression.FieldReference)) {
            return expression;
        }
        String name = ((Expression.FieldReference) expression).getFieldName();
        if (Constants.FIELD_NAMES.contains(name)) {
            return expression;
        }
        for (SelectStatement.SelectElement element : selectElements) {
            if (name.equals(element.getAlias())) {
                return element.getExpression();
            }
        }
        return expression;
    }

    private static String normalizeFieldName(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return Constants.FIELD_NAMES.contains(lower) ? lower : name;
    }

    /**
     * Operator tokens share their names with {@link Operator}
     */
    private static Operator operator(Token token) {
        return Operator.valueOf(Lexer.tokenType(token.getType()).name());
    }

    private static ParseCancellationException error(Token token, String message) {
        return new ParseCancellationException(QueryParseException.parser(message, token.getStartIndex()));
    }
}
