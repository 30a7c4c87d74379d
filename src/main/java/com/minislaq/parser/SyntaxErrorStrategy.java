package com.minislaq.parser;

import com.minislaq.common.QueryParseException;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.InputMismatchException;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.IntervalSet;
import org.antlr.v4.runtime.misc.ParseCancellationException;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Stops at the first syntax error
 *
 * No token is inserted or deleted to recover. The error is reported as a
 * {@link QueryParseException} at the offending token, wrapped in a
 * {@link ParseCancellationException} to get out of the generated parser:
 * - exactly one token expected: "Expected FROM", "Expected number after LIMIT"
 * - end of query reached: "Unexpected end of query"
 * - otherwise: "Unexpected token: x"
 *
 * @author Mini-SLAQ
 */
public class SyntaxErrorStrategy extends DefaultErrorStrategy {

    /**
     * Keywords named in "Expected x after KEYWORD"
     */
    private static final Set<TokenType> LEADING_KEYWORDS = EnumSet.of(
            TokenType.SELECT, TokenType.FROM, TokenType.WHERE, TokenType.GROUP, TokenType.BY,
            TokenType.ORDER, TokenType.HAVING, TokenType.LIMIT, TokenType.AS, TokenType.BETWEEN,
            TokenType.IN);

    @Override
    public void recover(Parser recognizer, RecognitionException e) {
        throw fail(recognizer, e);
    }

    @Override
    public Token recoverInline(Parser recognizer) {
        throw fail(recognizer, new InputMismatchException(recognizer));
    }

    @Override
    public void sync(Parser recognizer) {
        // nothing is skipped; mismatches surface in recoverInline
    }

    private static ParseCancellationException fail(Parser recognizer, RecognitionException e) {
        Token offending = e.getOffendingToken();
        String message = describe(recognizer, offending, e.getExpectedTokens());
        return new ParseCancellationException(QueryParseException.parser(message, offending.getStartIndex()));
    }

    static String describe(Parser recognizer, Token offending, IntervalSet expected) {
        if (expected != null && expected.size() == 1 && expected.getMinElement() != Token.EOF) {
            StringBuilder message = new StringBuilder("Expected ").append(display(expected.getMinElement()));
            Token previous = previous(recognizer, offending);
            if (previous != null && LEADING_KEYWORDS.contains(Lexer.tokenType(previous.getType()))) {
                message.append(" after ").append(previous.getText().toUpperCase(Locale.ROOT));
            }
            return message.toString();
        }
        if (offending.getType() == Token.EOF) {
            return "Unexpected end of query";
        }
        return "Unexpected token: " + offending.getText();
    }

    private static Token previous(Parser recognizer, Token offending) {
        int index = offending.getTokenIndex();
        return index > 0 ? recognizer.getTokenStream().get(index - 1) : null;
    }

    private static String display(int antlrType) {
        TokenType type = Lexer.tokenType(antlrType);
        switch (type) {
            case NUMBER:
                return "number";
            case FIELD:
                return "name";
            case LEFT_PAREN:
                return "'('";
            case RIGHT_PAREN:
                return "')'";
            case COMMA:
                return "','";
            default:
                return type.name();
        }
    }
}
