package com.minislaq.parser;

/**
 * Token kinds produced by the {@link Lexer}
 *
 * Names match the token names of the SLAQQuery grammar.
 *
 * @author Mini-SLAQ
 */
public enum TokenType {

    // ==================== Literals ====================

    STRING,
    NUMBER,
    BOOL,
    DATE,

    // ==================== Identifiers ====================

    FIELD,
    FUNCTION,

    // ==================== Operators ====================

    EQUALS,
    NOT_EQUALS,
    LESS_THAN,
    LESS_THAN_OR_EQUAL,
    GREATER_THAN,
    GREATER_THAN_OR_EQUAL,
    LIKE,
    MATCHES,
    CONTAINS,
    STARTS_WITH,
    ENDS_WITH,
    IN,
    BETWEEN,
    IN_RANGE,
    IS_BOT,
    IS_ERROR,
    IS_SUCCESS,

    // ==================== Logical operators ====================

    AND,
    OR,
    NOT,

    // ==================== Keywords ====================

    SELECT,
    FROM,
    WHERE,
    GROUP,
    BY,
    ORDER,
    HAVING,
    LIMIT,
    AS,

    // ==================== Punctuation ====================

    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    SEMICOLON,
    /** SELECT * wildcard */
    STAR,

    // ==================== Special ====================

    EOF
}
