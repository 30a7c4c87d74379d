package com.minislaq.parser;

import com.minislaq.common.Constants;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalQueries;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Timestamp literal recognition
 *
 * Literals carry no zone and are read as UTC. A date alone is midnight; a
 * time alone falls on 0000-01-01.
 *
 * @author Mini-SLAQ
 */
public final class DateLiterals {

    private static final List<DateTimeFormatter> FORMATS;

    static {
        List<DateTimeFormatter> formats = new ArrayList<>();
        for (String pattern : Constants.DATE_PATTERNS) {
            formats.add(DateTimeFormatter.ofPattern(pattern, Locale.ROOT)
                    .withResolverStyle(ResolverStyle.STRICT));
        }
        FORMATS = Collections.unmodifiableList(formats);
    }

    private DateLiterals() {
    }

    /**
     * Parse text with the first matching literal pattern
     *
     * @return the timestamp, or empty if no pattern matches
     */
    public static Optional<OffsetDateTime> parse(String text) {
        for (DateTimeFormatter format : FORMATS) {
            TemporalAccessor parsed = tryParse(format, text);
            if (parsed == null) {
                continue;
            }
            LocalDate date = parsed.query(TemporalQueries.localDate());
            LocalTime time = parsed.query(TemporalQueries.localTime());
            if (date == null) {
                date = LocalDate.of(0, 1, 1);
            }
            if (time == null) {
                time = LocalTime.MIDNIGHT;
            }
            return Optional.of(OffsetDateTime.of(LocalDateTime.of(date, time), ZoneOffset.UTC));
        }
        return Optional.empty();
    }

    private static TemporalAccessor tryParse(DateTimeFormatter format, String text) {
        try {
            return format.parse(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static boolean isDate(String text) {
        return parse(text).isPresent();
    }
}
