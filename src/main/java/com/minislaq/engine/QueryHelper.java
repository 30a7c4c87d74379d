package com.minislaq.engine;

import com.minislaq.common.Constants;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Helpers for building and troubleshooting queries
 *
 * @author Mini-SLAQ
 */
public final class QueryHelper {

    private static final String DEFAULT_SUGGESTION = "Check the query syntax and available fields/functions";

    private static final Map<String, String> SUGGESTIONS;

    static {
        Map<String, String> suggestions = new LinkedHashMap<>();
        suggestions.put("unknown field",
                "Available fields: " + String.join(", ", Constants.FIELD_NAMES));
        suggestions.put("unknown function",
                "Available functions: " + String.join(", ", Constants.FUNCTION_NAMES));
        suggestions.put("unknown table",
                "Queries read from the logs table: SELECT ... FROM logs");
        suggestions.put("requires group by",
                "Aggregate functions (COUNT, SUM, AVG, MIN, MAX) need a GROUP BY clause");
        suggestions.put("must appear in group by",
                "Selected fields of a grouped query must be grouped or aggregated");
        suggestions.put("invalid token",
                "Check for unsupported characters; strings go in single or double quotes");
        suggestions.put("expected",
                "Check for missing quotes, parentheses, or keywords like SELECT, FROM, WHERE");
        suggestions.put("cannot compare",
                "Compare values of compatible types, e.g. status = 404 or url = '/index.html'");
        SUGGESTIONS = suggestions;
    }

    private QueryHelper() {
    }

    /**
     * Quote text as a SLAQ string literal
     *
     * Literals have no escape syntax, so the quote character that does not
     * occur in the text is used.
     *
     * @throws IllegalArgumentException if the text contains both quote characters
     */
    public static String quoteString(String text) {
        if (text.indexOf('\'') < 0) {
            return "'" + text + "'";
        }
        if (text.indexOf('"') < 0) {
            return "\"" + text + "\"";
        }
        throw new IllegalArgumentException("Text contains both quote characters: " + text);
    }

    public static boolean isValidFieldName(String field) {
        return field != null && Constants.FIELD_NAMES.contains(field.toLowerCase(Locale.ROOT));
    }

    public static boolean isValidFunctionName(String function) {
        return function != null && Constants.FUNCTION_NAMES.contains(function.toUpperCase(Locale.ROOT));
    }

    /**
     * Hint for a failed query, based on its error message
     */
    public static String suggestCorrection(Exception error) {
        String message = error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> suggestion : SUGGESTIONS.entrySet()) {
            if (message.contains(suggestion.getKey())) {
                return suggestion.getValue();
            }
        }
        return DEFAULT_SUGGESTION;
    }
}
