package com.minislaq.parser.ast;

import java.util.Locale;

/**
 * Aggregate functions
 *
 * Only evaluated over a group of records, never against a single record.
 *
 * @author Mini-SLAQ
 */
public enum AggregateFunction {
    COUNT,
    SUM,
    AVG,
    MIN,
    MAX;

    /**
     * @return the aggregate with this name (any case), or null
     */
    public static AggregateFunction fromName(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        for (AggregateFunction function : values()) {
            if (function.name().equals(upper)) {
                return function;
            }
        }
        return null;
    }
}
