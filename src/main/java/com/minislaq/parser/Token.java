package com.minislaq.parser;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Lexical token
 *
 * @author Mini-SLAQ
 */
@Getter
@EqualsAndHashCode
public final class Token {

    private final TokenType type;

    /**
     * Source text (without quotes for quoted literals)
     */
    private final String text;

    /**
     * Offset of the first character in the query text
     */
    private final int position;

    public Token(TokenType type, String text, int position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
