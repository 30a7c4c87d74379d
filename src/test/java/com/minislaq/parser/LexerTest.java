package com.minislaq.parser;

import com.minislaq.common.QueryParseException;
import com.minislaq.common.SlaqException;
import org.antlr.v4.runtime.CommonTokenStream;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer tests
 *
 * @author Mini-SLAQ
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class LexerTest {

    private static List<TokenType> types(List<Token> tokens) {
        List<TokenType> types = new ArrayList<>();
        for (Token token : tokens) {
            types.add(token.getType());
        }
        return types;
    }

    /**
     * Token kinds and character offsets of a simple query
     */
    @Test
    @Order(1)
    void testTokenizeSimpleQuery() throws QueryParseException {
        List<Token> tokens = Lexer.tokenize("SELECT ip FROM logs");

        assertEquals(List.of(TokenType.SELECT, TokenType.FIELD, TokenType.FROM, TokenType.FIELD, TokenType.EOF),
                types(tokens));
        assertEquals(0, tokens.get(0).getPosition());
        assertEquals(7, tokens.get(1).getPosition());
        assertEquals(10, tokens.get(2).getPosition());
        assertEquals(15, tokens.get(3).getPosition());
        assertEquals("logs", tokens.get(3).getText());
    }

    /**
     * Keywords are case-insensitive
     */
    @Test
    @Order(2)
    void testKeywordsIgnoreCase() throws QueryParseException {
        List<Token> tokens = Lexer.tokenize("select Status from logs where status is_error");

        assertEquals(TokenType.SELECT, tokens.get(0).getType());
        assertEquals(TokenType.FIELD, tokens.get(1).getType());
        assertEquals(TokenType.FROM, tokens.get(2).getType());
        assertEquals(TokenType.WHERE, tokens.get(4).getType());
        assertEquals(TokenType.IS_ERROR, tokens.get(6).getType());
    }

    /**
     * Comparison operators, including both spellings of not-equal
     */
    @Test
    @Order(3)
    void testOperators() throws QueryParseException {
        List<Token> tokens = Lexer.tokenize("= != <> < <= > >= * ( ) , ;");

        assertEquals(List.of(TokenType.EQUALS, TokenType.NOT_EQUALS, TokenType.NOT_EQUALS,
                TokenType.LESS_THAN, TokenType.LESS_THAN_OR_EQUAL, TokenType.GREATER_THAN,
                TokenType.GREATER_THAN_OR_EQUAL, TokenType.STAR, TokenType.LEFT_PAREN,
                TokenType.RIGHT_PAREN, TokenType.COMMA, TokenType.SEMICOLON, TokenType.EOF), types(tokens));
    }

    /**
     * Quoted text is classified as boolean, date, number or string
     */
    @Test
    @Order(4)
    void testQuotedLiteralClassification() throws QueryParseException {
        List<Token> tokens = Lexer.tokenize("'true' \"FALSE\" '2024-08-20' '2024/08/20 10:00:00' '10:30:00' '404' '1.5' 'abc'");

        assertEquals(List.of(TokenType.BOOL, TokenType.BOOL, TokenType.DATE, TokenType.DATE, TokenType.DATE,
                TokenType.NUMBER, TokenType.NUMBER, TokenType.STRING, TokenType.EOF), types(tokens));
        assertEquals("abc", tokens.get(7).getText());
    }

    /**
     * Quotes have no escapes; the other quote character is plain text
     */
    @Test
    @Order(5)
    void testQuotedTextVerbatim() throws QueryParseException {
        List<Token> tokens = Lexer.tokenize("\"it's\" '/a \"b\"'");

        assertEquals("it's", tokens.get(0).getText());
        assertEquals("/a \"b\"", tokens.get(1).getText());
    }

    /**
     * An unterminated quote runs to the end of input
     */
    @Test
    @Order(6)
    void testUnterminatedQuote() throws QueryParseException {
        List<Token> tokens = Lexer.tokenize("url = '/admin");

        assertEquals(TokenType.STRING, tokens.get(2).getType());
        assertEquals("/admin", tokens.get(2).getText());
        assertEquals(TokenType.EOF, tokens.get(3).getType());
    }

    /**
     * Identifiers: field names, then function names, then generic fields
     */
    @Test
    @Order(7)
    void testIdentifierClassification() {
        assertEquals(TokenType.FIELD, Lexer.classifyIdentifier("user_agent"));
        assertEquals(TokenType.FUNCTION, Lexer.classifyIdentifier("count"));
        assertEquals(TokenType.FUNCTION, Lexer.classifyIdentifier("IS_PRIVATE_IP"));
        assertEquals(TokenType.FIELD, Lexer.classifyIdentifier("requests"));
        assertEquals(TokenType.IN_RANGE, Lexer.classifyIdentifier("in_range"));
    }

    /**
     * Bare numbers
     */
    @Test
    @Order(8)
    void testNumbers() throws QueryParseException {
        List<Token> tokens = Lexer.tokenize("size > 1000 AND size < 2.5");

        assertEquals(TokenType.NUMBER, tokens.get(2).getType());
        assertEquals("1000", tokens.get(2).getText());
        assertEquals(TokenType.NUMBER, tokens.get(6).getType());
        assertEquals("2.5", tokens.get(6).getText());
    }

    /**
     * An unknown character fails at its offset
     */
    @Test
    @Order(9)
    void testInvalidCharacter() {
        QueryParseException e = assertThrows(QueryParseException.class,
                () -> Lexer.tokenize("SELECT # FROM logs"));

        assertEquals(SlaqException.Phase.LEXER, e.getPhase());
        assertEquals(7, e.getPosition());
        assertTrue(e.getMessage().contains("Invalid token: #"));
    }

    /**
     * A lone '!' is not an operator
     */
    @Test
    @Order(10)
    void testLoneBang() {
        QueryParseException e = assertThrows(QueryParseException.class,
                () -> Lexer.tokenize("status ! 200"));

        assertEquals(7, e.getPosition());
    }

    /**
     * Any input either lexes to a list with exactly one trailing EOF or fails with a lexer error
     */
    @Test
    @Order(11)
    void testLexingIsTotal() {
        String alphabet = "abcSELECTFROMlogs _019.'\"()=<>!,;*#@\t\n-";
        Random random = new Random(42);

        for (int i = 0; i < 500; i++) {
            StringBuilder input = new StringBuilder();
            int length = random.nextInt(40);
            for (int j = 0; j < length; j++) {
                input.append(alphabet.charAt(random.nextInt(alphabet.length())));
            }

            try {
                List<Token> tokens = Lexer.tokenize(input.toString());
                assertEquals(TokenType.EOF, tokens.get(tokens.size() - 1).getType(), input.toString());
                for (int k = 0; k < tokens.size() - 1; k++) {
                    assertNotEquals(TokenType.EOF, tokens.get(k).getType(), input.toString());
                }
            } catch (QueryParseException e) {
                assertEquals(SlaqException.Phase.LEXER, e.getPhase());
                assertTrue(e.getPosition() >= 0 && e.getPosition() < input.length());
            }
        }
    }

    /**
     * Parenthesis balance
     */
    @Test
    @Order(12)
    void testValidateTokens() throws QueryParseException {
        QueryParseException closing = assertThrows(QueryParseException.class,
                () -> Lexer.validateTokens(Lexer.tokenize("a ) b")));
        assertEquals(2, closing.getPosition());

        QueryParseException opening = assertThrows(QueryParseException.class,
                () -> Lexer.validateTokens(Lexer.tokenize("( ( a )")));
        assertEquals(0, opening.getPosition());

        Lexer.validateTokens(Lexer.tokenize("((a) (b))"));
    }

    /**
     * Only plain decimals count as numbers; NaN, exponents and padding stay text
     */
    @Test
    @Order(13)
    void testQuotedNumbersAreStrictDecimals() throws QueryParseException {
        List<Token> tokens = Lexer.tokenize("'-12' '0.25' 'NaN' 'Infinity' '1d' '1e3' ' 1' '0x1p3' '1.'");

        assertEquals(List.of(TokenType.NUMBER, TokenType.NUMBER, TokenType.STRING, TokenType.STRING,
                TokenType.STRING, TokenType.STRING, TokenType.STRING, TokenType.STRING, TokenType.STRING,
                TokenType.EOF), types(tokens));
        assertEquals("NaN", tokens.get(2).getText());
    }

    /**
     * The generated parser sees the classified token types
     */
    @Test
    @Order(14)
    void testStreamCarriesClassifiedTypes() throws QueryParseException {
        CommonTokenStream stream = Lexer.lex("select hour FROM logs WHERE url = '404'");

        assertEquals(SLAQQueryParser.SELECT, stream.get(0).getType());
        assertEquals(SLAQQueryParser.FUNCTION, stream.get(1).getType());
        assertEquals(SLAQQueryParser.FIELD, stream.get(3).getType());
        assertEquals(SLAQQueryParser.NUMBER, stream.get(7).getType());
        assertEquals("404", stream.get(7).getText());
        assertEquals(org.antlr.v4.runtime.Token.EOF, stream.get(8).getType());
        assertEquals(39, stream.get(8).getStartIndex());
    }
}
