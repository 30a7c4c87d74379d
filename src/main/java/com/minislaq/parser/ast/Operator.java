package com.minislaq.parser.ast;

/**
 * Binary and unary operators of the expression tree
 *
 * @author Mini-SLAQ
 */
public enum Operator {

    // comparison
    EQUALS("="),
    NOT_EQUALS("!="),
    LESS_THAN("<"),
    LESS_THAN_OR_EQUAL("<="),
    GREATER_THAN(">"),
    GREATER_THAN_OR_EQUAL(">="),

    // string matching
    LIKE("LIKE"),
    MATCHES("MATCHES"),
    CONTAINS("CONTAINS"),
    STARTS_WITH("STARTS_WITH"),
    ENDS_WITH("ENDS_WITH"),

    // set / range
    IN("IN"),
    IN_RANGE("IN_RANGE"),

    // logical
    AND("AND"),
    OR("OR"),
    NOT("NOT"),

    // record predicates (unary, postfix)
    IS_BOT("IS_BOT"),
    IS_ERROR("IS_ERROR"),
    IS_SUCCESS("IS_SUCCESS");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isRecordPredicate() {
        return this == IS_BOT || this == IS_ERROR || this == IS_SUCCESS;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
