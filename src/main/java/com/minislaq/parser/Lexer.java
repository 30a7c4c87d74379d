package com.minislaq.parser;

import com.minislaq.common.Constants;
import com.minislaq.common.QueryParseException;
import com.minislaq.value.ValueComparator;
import lombok.extern.slf4j.Slf4j;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.WritableToken;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.misc.ParseCancellationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * SLAQ lexer
 *
 * Runs the generated {@link SLAQQueryLexer} and then classifies its tokens
 * in one pass over the token stream.
 *
 * Steps:
 * 1. ANTLR lexing: punctuation, comparison symbols, QUOTED text, bare
 *    NUMBER and IDENTIFIER; anything else fails at its offset
 * 2. Quoted text loses its quotes and becomes BOOL, DATE, NUMBER or STRING
 * 3. Identifiers become, in priority order: keyword, record field,
 *    function, any other name (kept as FIELD so unknown fields fail at
 *    evaluation)
 *
 * The stream always ends with exactly one EOF token. Positions are code
 * point offsets into the query text.
 *
 * @author Mini-SLAQ
 */
@Slf4j
public final class Lexer {

    private static final Map<String, TokenType> KEYWORDS;
    private static final Set<String> FIELDS;
    private static final Set<String> FUNCTIONS;

    /**
     * ANTLR token type of each {@link TokenType}; the grammar uses the same names
     */
    private static final Map<TokenType, Integer> ANTLR_TYPES;

    static {
        Map<String, TokenType> keywords = new HashMap<>();
        keywords.put("SELECT", TokenType.SELECT);
        keywords.put("FROM", TokenType.FROM);
        keywords.put("WHERE", TokenType.WHERE);
        keywords.put("GROUP", TokenType.GROUP);
        keywords.put("BY", TokenType.BY);
        keywords.put("ORDER", TokenType.ORDER);
        keywords.put("HAVING", TokenType.HAVING);
        keywords.put("LIMIT", TokenType.LIMIT);
        keywords.put("AS", TokenType.AS);
        keywords.put("AND", TokenType.AND);
        keywords.put("OR", TokenType.OR);
        keywords.put("NOT", TokenType.NOT);
        keywords.put("LIKE", TokenType.LIKE);
        keywords.put("MATCHES", TokenType.MATCHES);
        keywords.put("CONTAINS", TokenType.CONTAINS);
        keywords.put("STARTS_WITH", TokenType.STARTS_WITH);
        keywords.put("ENDS_WITH", TokenType.ENDS_WITH);
        keywords.put("IN", TokenType.IN);
        keywords.put("BETWEEN", TokenType.BETWEEN);
        keywords.put("IN_RANGE", TokenType.IN_RANGE);
        keywords.put("IS_BOT", TokenType.IS_BOT);
        keywords.put("IS_ERROR", TokenType.IS_ERROR);
        keywords.put("IS_SUCCESS", TokenType.IS_SUCCESS);
        KEYWORDS = Collections.unmodifiableMap(keywords);

        Set<String> fields = new HashSet<>();
        for (String field : Constants.FIELD_NAMES) {
            fields.add(field.toUpperCase(Locale.ROOT));
        }
        FIELDS = Collections.unmodifiableSet(fields);
        FUNCTIONS = Collections.unmodifiableSet(new HashSet<>(Constants.FUNCTION_NAMES));

        Map<TokenType, Integer> antlrTypes = new EnumMap<>(TokenType.class);
        Vocabulary vocabulary = SLAQQueryParser.VOCABULARY;
        for (int type = 1; type <= vocabulary.getMaxTokenType(); type++) {
            String name = vocabulary.getSymbolicName(type);
            for (TokenType tokenType : TokenType.values()) {
                if (tokenType.name().equals(name)) {
                    antlrTypes.put(tokenType, type);
                }
            }
        }
        antlrTypes.put(TokenType.EOF, org.antlr.v4.runtime.Token.EOF);
        ANTLR_TYPES = Collections.unmodifiableMap(antlrTypes);
    }

    private Lexer() {
    }

    /**
     * Lex a query into a classified ANTLR token stream, ready for {@link SLAQQueryParser}
     *
     * @param query query text
     * @return filled stream, the last token EOF
     * @throws QueryParseException on the first character no token starts with
     */
    public static CommonTokenStream lex(String query) throws QueryParseException {
        SLAQQueryLexer lexer = new SLAQQueryLexer(CharStreams.fromString(query == null ? "" : query));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new InvalidCharacterListener());

        CommonTokenStream stream = new CommonTokenStream(lexer);
        try {
            stream.fill();
        } catch (ParseCancellationException e) {
            throw (QueryParseException) e.getCause();
        }

        for (org.antlr.v4.runtime.Token token : stream.getTokens()) {
            classify((WritableToken) token);
        }
        return stream;
    }

    /**
     * Tokenize a complete query
     *
     * @param query query text
     * @return tokens, the last one always EOF
     * @throws QueryParseException on the first invalid character
     */
    public static List<Token> tokenize(String query) throws QueryParseException {
        List<Token> tokens = toTokens(lex(query));
        log.trace("Tokenized {} tokens: {}", tokens.size(), tokens);
        return tokens;
    }

    /**
     * View a classified ANTLR stream as {@link Token}s
     */
    static List<Token> toTokens(CommonTokenStream stream) {
        List<Token> tokens = new ArrayList<>(stream.size());
        for (org.antlr.v4.runtime.Token token : stream.getTokens()) {
            tokens.add(new Token(tokenType(token.getType()), token.getType() == org.antlr.v4.runtime.Token.EOF
                    ? "" : token.getText(), token.getStartIndex()));
        }
        return tokens;
    }

    static TokenType tokenType(int antlrType) {
        if (antlrType == org.antlr.v4.runtime.Token.EOF) {
            return TokenType.EOF;
        }
        return TokenType.valueOf(SLAQQueryParser.VOCABULARY.getSymbolicName(antlrType));
    }

    static int antlrType(TokenType type) {
        return ANTLR_TYPES.get(type);
    }

    private static void classify(WritableToken token) {
        switch (token.getType()) {
            case SLAQQueryParser.IDENTIFIER:
                token.setType(antlrType(classifyIdentifier(token.getText())));
                break;
            case SLAQQueryParser.QUOTED:
                String text = unquote(token.getText());
                token.setText(text);
                token.setType(antlrType(classifyQuoted(text)));
                break;
            default:
                break;
        }
    }

    /**
     * Strip the opening quote, and the closing one if the literal is terminated
     */
    private static String unquote(String quoted) {
        char quote = quoted.charAt(0);
        int end = quoted.length() > 1 && quoted.charAt(quoted.length() - 1) == quote
                ? quoted.length() - 1 : quoted.length();
        return quoted.substring(1, end);
    }

    /**
     * Classify an identifier: keyword, field, function, then generic field
     */
    static TokenType classifyIdentifier(String identifier) {
        String upper = identifier.toUpperCase(Locale.ROOT);

        TokenType keyword = KEYWORDS.get(upper);
        if (keyword != null) {
            return keyword;
        }
        if (FIELDS.contains(upper)) {
            return TokenType.FIELD;
        }
        if (FUNCTIONS.contains(upper)) {
            return TokenType.FUNCTION;
        }
        return TokenType.FIELD;
    }

    /**
     * Classify quoted text: boolean, timestamp, number, then string
     */
    static TokenType classifyQuoted(String text) {
        String upper = text.toUpperCase(Locale.ROOT);
        if ("TRUE".equals(upper) || "FALSE".equals(upper)) {
            return TokenType.BOOL;
        }
        if (DateLiterals.isDate(text)) {
            return TokenType.DATE;
        }
        if (ValueComparator.parseDecimal(text) != null) {
            return TokenType.NUMBER;
        }
        return TokenType.STRING;
    }

    /**
     * Check parenthesis balance across a token list
     *
     * @throws QueryParseException at the unmatched ')' or the last unclosed '('
     */
    public static void validateTokens(List<Token> tokens) throws QueryParseException {
        if (tokens.isEmpty()) {
            throw QueryParseException.parser("Empty query", 0);
        }

        List<Token> open = new ArrayList<>();
        for (Token token : tokens) {
            if (token.is(TokenType.LEFT_PAREN)) {
                open.add(token);
            } else if (token.is(TokenType.RIGHT_PAREN)) {
                if (open.isEmpty()) {
                    throw QueryParseException.parser("Unmatched closing parenthesis", token.getPosition());
                }
                open.remove(open.size() - 1);
            }
        }

        if (!open.isEmpty()) {
            throw QueryParseException.parser("Unmatched opening parenthesis",
                    open.get(open.size() - 1).getPosition());
        }
    }

    /**
     * Fails lexing at the first character no token rule accepts
     */
    private static class InvalidCharacterListener extends BaseErrorListener {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer,
                                Object offendingSymbol,
                                int line,
                                int charPositionInLine,
                                String msg,
                                RecognitionException e) {
            int start = ((LexerNoViableAltException) e).getStartIndex();
            CharStream input = (CharStream) recognizer.getInputStream();
            String character = input.getText(Interval.of(start, start));
            throw new ParseCancellationException(
                    QueryParseException.lexer("Invalid token: " + character, start));
        }
    }
}
