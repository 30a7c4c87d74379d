package com.minislaq.executor;

import java.util.Locale;

/**
 * Result output formats
 *
 * @author Mini-SLAQ
 */
public enum OutputFormat {
    TABLE,
    CSV,
    JSON;

    /**
     * Format by name, any case
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static OutputFormat fromName(String name) {
        if (name == null) {
            return TABLE;
        }
        for (OutputFormat format : values()) {
            if (format.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported format: " + name);
    }
}
