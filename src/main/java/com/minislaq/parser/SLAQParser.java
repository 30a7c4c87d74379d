package com.minislaq.parser;

import com.minislaq.common.QueryParseException;
import com.minislaq.parser.ast.SelectStatement;
import lombok.extern.slf4j.Slf4j;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * SLAQ parser entry point
 *
 * Turns a query string into a validated statement.
 *
 * Steps:
 * 1. Lexing: query text -> classified token stream ({@link Lexer})
 * 2. Bracket check: unmatched parentheses fail before parsing
 * 3. Parsing: token stream -> parse tree ({@link SLAQQueryParser})
 * 4. AST building: parse tree -> SelectStatement ({@link ASTBuilder})
 * 5. Validation: aggregate placement, GROUP BY / HAVING consistency
 *
 * Lexer, parser and validation failures all surface as
 * {@link QueryParseException} carrying the phase and, where known, the
 * position of the offending token.
 *
 * @author Mini-SLAQ
 */
@Slf4j
public class SLAQParser {

    private final StatementValidator validator = new StatementValidator();

    /**
     * Parse and validate a query
     *
     * @param query query text
     * @return statement
     * @throws QueryParseException if the query is not valid SLAQ
     */
    public SelectStatement parse(String query) throws QueryParseException {
        log.debug("Parsing query: {}", query);
        try {
            CommonTokenStream tokens = Lexer.lex(query);
            Lexer.validateTokens(Lexer.toTokens(tokens));

            SLAQQueryParser parser = new SLAQQueryParser(tokens);
            parser.removeErrorListeners();
            parser.setErrorHandler(new SyntaxErrorStrategy());

            SelectStatement statement = build(parser);
            validator.validate(statement);

            log.debug("Parse successful: {}", statement);
            return statement;

        } catch (QueryParseException e) {
            log.debug("Parse failed: {}", e.getMessage());
            throw e;
        }
    }

    private static SelectStatement build(SLAQQueryParser parser) throws QueryParseException {
        try {
            SLAQQueryParser.QueryContext parseTree = parser.query();
            return new ASTBuilder().visitQuery(parseTree);
        } catch (ParseCancellationException e) {
            if (e.getCause() instanceof QueryParseException) {
                throw (QueryParseException) e.getCause();
            }
            throw e;
        }
    }
}
