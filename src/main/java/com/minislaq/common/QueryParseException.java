package com.minislaq.common;

/**
 * Query text could not be turned into a statement
 *
 * Raised by the lexer, the parser and the statement validator. Always
 * terminal for the query.
 *
 * @author Mini-SLAQ
 */
public class QueryParseException extends SlaqException {

    public QueryParseException(Phase phase, String detail, int position) {
        super(phase, detail, position);
    }

    public static QueryParseException lexer(String detail, int position) {
        return new QueryParseException(Phase.LEXER, detail, position);
    }

    public static QueryParseException parser(String detail, int position) {
        return new QueryParseException(Phase.PARSER, detail, position);
    }

    public static QueryParseException validation(String detail) {
        return new QueryParseException(Phase.VALIDATION, detail, NO_POSITION);
    }
}
