package com.minislaq.common;

import lombok.Getter;

/**
 * Base class of every query failure
 *
 * Carries the processing phase that failed and, for lexer and parser
 * failures, the character offset in the query text.
 *
 * @author Mini-SLAQ
 */
@Getter
public class SlaqException extends Exception {

    /**
     * Position is unknown or not meaningful
     */
    public static final int NO_POSITION = -1;

    /**
     * Processing phase
     */
    public enum Phase {
        LEXER,
        PARSER,
        VALIDATION,
        EVALUATION,
        EXECUTION;

        public String label() {
            return name().toLowerCase();
        }
    }

    private final Phase phase;

    /**
     * Offset of the offending token, or {@link #NO_POSITION}
     */
    private final int position;

    /**
     * Message without the phase/position prefix
     */
    private final String detail;

    public SlaqException(Phase phase, String detail, int position) {
        super(format(phase, detail, position));
        this.phase = phase;
        this.detail = detail;
        this.position = position;
    }

    public SlaqException(Phase phase, String detail, int position, Throwable cause) {
        super(format(phase, detail, position), cause);
        this.phase = phase;
        this.detail = detail;
        this.position = position;
    }

    public boolean hasPosition() {
        return position != NO_POSITION;
    }

    private static String format(Phase phase, String detail, int position) {
        if (position == NO_POSITION) {
            return phase.label() + " error: " + detail;
        }
        return phase.label() + " error at position " + position + ": " + detail;
    }
}
