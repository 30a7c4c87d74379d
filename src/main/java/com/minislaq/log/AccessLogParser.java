package com.minislaq.log;

import com.minislaq.common.Constants;
import com.minislaq.common.NetworkUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;

/**
 * Access log reader
 *
 * Accepts Combined Log Format lines and falls back to Common Log Format:
 * <pre>
 * 127.0.0.1 - - [10/Oct/2023:13:55:36 +0000] "GET /a HTTP/1.1" 200 512 "ref" "agent"
 * 127.0.0.1 - - [10/Oct/2023:13:55:36 +0000] "GET /a HTTP/1.1" 200 512
 * </pre>
 *
 * Files ending in .gz are decompressed on the fly. Blank lines are ignored,
 * lines in neither format are skipped with a warning.
 *
 * @author Mini-SLAQ
 */
@Slf4j
public class AccessLogParser {

    private static final Pattern COMBINED = Pattern.compile(
            "^(\\S+) \\S+ \\S+ \\[([^\\]]+)\\] \"(\\S+) (\\S+) (\\S+)\" (\\d+) (\\d+|-) \"([^\"]*)\" \"([^\"]*)\"$");

    private static final Pattern COMMON = Pattern.compile(
            "^(\\S+) \\S+ \\S+ \\[([^\\]]+)\\] \"(\\S+) (\\S+) (\\S+)\" (\\d+) (\\d+|-)$");

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern(Constants.ACCESS_LOG_TIMESTAMP_PATTERN, Locale.ENGLISH);

    /**
     * Lines skipped by the last parse call
     */
    @Getter
    private int skippedLines;

    /**
     * Read every entry of a log file
     *
     * @param file log file, plain or gzip compressed
     * @return entries in file order
     * @throws IOException if the file cannot be read
     */
    public List<LogEntry> parseFile(Path file) throws IOException {
        log.info("Reading access log: {}", file);
        try (InputStream in = open(file);
             Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            List<LogEntry> entries = parse(reader);
            log.info("Read {} entries from {} ({} lines skipped)", entries.size(), file, skippedLines);
            return entries;
        }
    }

    /**
     * Read every entry from a character stream
     */
    public List<LogEntry> parse(Reader reader) throws IOException {
        List<LogEntry> entries = new ArrayList<>();
        skippedLines = 0;

        BufferedReader lines = new BufferedReader(reader);
        String line;
        int lineNumber = 0;
        while ((line = lines.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            try {
                entries.add(parseLine(line));
            } catch (LogParseException e) {
                skippedLines++;
                log.warn("Skipping line {}: {}", lineNumber, e.getMessage());
            }
        }
        return entries;
    }

    /**
     * Parse a single log line
     *
     * How it works:
     * 1. try the Combined Log Format pattern, then the Common one
     * 2. check the client address
     * 3. read the timestamp with the access-log date pattern
     * 4. read the status; size "-" counts as 0
     *
     * @throws LogParseException if the line is in neither supported format
     */
    public LogEntry parseLine(String line) throws LogParseException {
        String trimmed = line.trim();

        Matcher matcher = COMBINED.matcher(trimmed);
        boolean combined = matcher.matches();
        if (!combined) {
            matcher = COMMON.matcher(trimmed);
            if (!matcher.matches()) {
                throw new LogParseException("Unrecognised log format: " + abbreviate(trimmed));
            }
        }

        String ip = matcher.group(1);
        if (!NetworkUtils.isValidAddress(ip)) {
            throw new LogParseException("Invalid IP address: " + ip);
        }

        OffsetDateTime timestamp;
        try {
            timestamp = OffsetDateTime.parse(matcher.group(2), TIMESTAMP_FORMAT);
        } catch (DateTimeParseException e) {
            throw new LogParseException("Invalid timestamp: " + matcher.group(2));
        }

        int status;
        try {
            status = Integer.parseInt(matcher.group(6));
        } catch (NumberFormatException e) {
            throw new LogParseException("Invalid status code: " + matcher.group(6));
        }

        return new LogEntry(
                ip,
                timestamp,
                matcher.group(3),
                matcher.group(4),
                matcher.group(5),
                status,
                parseSize(matcher.group(7)),
                combined ? matcher.group(8) : "",
                combined ? matcher.group(9) : "");
    }

    /**
     * "-" and out-of-range sizes count as 0 bytes
     */
    private static long parseSize(String text) {
        if ("-".equals(text)) {
            return 0;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            log.debug("Size out of range, using 0: {}", text);
            return 0;
        }
    }

    private static InputStream open(Path file) throws IOException {
        InputStream in = Files.newInputStream(file);
        if (file.getFileName().toString().endsWith(".gz")) {
            return new GZIPInputStream(in);
        }
        return in;
    }

    private static String abbreviate(String line) {
        return line.length() <= 80 ? line : line.substring(0, 77) + "...";
    }

    /**
     * Log line parse exception
     */
    public static class LogParseException extends Exception {
        public LogParseException(String message) {
            super(message);
        }
    }
}
