package com.minislaq.log;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Access log reader tests
 *
 * @author Mini-SLAQ
 */
class AccessLogParserTest {

    private static final String COMBINED_LINE = "192.168.1.10 - frank [10/Oct/2023:13:55:36 -0700] "
            + "\"GET /apache_pb.gif HTTP/1.0\" 200 2326 \"http://www.example.com/start.html\" "
            + "\"Mozilla/4.08 [en] (Win98; I ;Nav)\"";

    private static final String COMMON_LINE = "10.0.0.1 - - [10/Oct/2023:13:56:00 +0000] "
            + "\"POST /api/login HTTP/1.1\" 401 -";

    private AccessLogParser parser;

    @BeforeEach
    void setUp() {
        parser = new AccessLogParser();
    }

    @Test
    void testCombinedFormat() throws Exception {
        LogEntry entry = parser.parseLine(COMBINED_LINE);

        assertEquals("192.168.1.10", entry.getIp());
        assertEquals(OffsetDateTime.of(2023, 10, 10, 13, 55, 36, 0, ZoneOffset.ofHours(-7)), entry.getTimestamp());
        assertEquals("GET", entry.getMethod());
        assertEquals("/apache_pb.gif", entry.getUrl());
        assertEquals("HTTP/1.0", entry.getProtocol());
        assertEquals(200, entry.getStatus());
        assertEquals(2326, entry.getSize());
        assertEquals("http://www.example.com/start.html", entry.getReferer());
        assertEquals("Mozilla/4.08 [en] (Win98; I ;Nav)", entry.getUserAgent());
    }

    @Test
    void testCommonFormat() throws Exception {
        LogEntry entry = parser.parseLine(COMMON_LINE);

        assertEquals("10.0.0.1", entry.getIp());
        assertEquals("POST", entry.getMethod());
        assertEquals(401, entry.getStatus());
        assertEquals(0, entry.getSize());
        assertEquals("", entry.getReferer());
        assertEquals("", entry.getUserAgent());
    }

    @Test
    void testIpv6Client() throws Exception {
        LogEntry entry = parser.parseLine("2001:db8::1 - - [10/Oct/2023:13:55:36 +0000] \"GET / HTTP/2.0\" 304 0 \"-\" \"curl/8.0\"");
        assertEquals("2001:db8::1", entry.getIp());
        assertEquals(304, entry.getStatus());
    }

    @Test
    void testInvalidLines() {
        assertThrows(AccessLogParser.LogParseException.class, () -> parser.parseLine("not a log line"));
        assertThrows(AccessLogParser.LogParseException.class, () -> parser.parseLine(
                "999.1.1.1 - - [10/Oct/2023:13:55:36 +0000] \"GET / HTTP/1.1\" 200 10"));
        assertThrows(AccessLogParser.LogParseException.class, () -> parser.parseLine(
                "10.0.0.1 - - [10/Foo/2023:13:55:36 +0000] \"GET / HTTP/1.1\" 200 10"));
        assertThrows(AccessLogParser.LogParseException.class, () -> parser.parseLine(
                "10.0.0.1 - - [10/Oct/2023:13:55:36 +0000] \"GET / HTTP/1.1\" 99999999999 10"));
    }

    /**
     * Bad lines are skipped and counted, blank lines ignored
     */
    @Test
    void testSkipsBadLines() throws Exception {
        String log = COMBINED_LINE + "\n\ngarbage\n" + COMMON_LINE + "\n";
        List<LogEntry> entries = parser.parse(new StringReader(log));

        assertEquals(2, entries.size());
        assertEquals("192.168.1.10", entries.get(0).getIp());
        assertEquals("10.0.0.1", entries.get(1).getIp());
        assertEquals(1, parser.getSkippedLines());
    }

    @Test
    void testParseFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("access.log");
        Files.write(file, (COMBINED_LINE + "\n" + COMMON_LINE + "\n").getBytes(StandardCharsets.UTF_8));

        List<LogEntry> entries = parser.parseFile(file);
        assertEquals(2, entries.size());
        assertEquals(0, parser.getSkippedLines());
    }

    @Test
    void testParseGzipFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("access.log.gz");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(file))) {
            out.write((COMMON_LINE + "\n" + COMBINED_LINE + "\n").getBytes(StandardCharsets.UTF_8));
        }

        List<LogEntry> entries = parser.parseFile(file);
        assertEquals(2, entries.size());
        assertEquals("POST", entries.get(0).getMethod());
        assertEquals("GET", entries.get(1).getMethod());
    }

    @Test
    void testMissingFile(@TempDir Path dir) {
        assertThrows(IOException.class, () -> parser.parseFile(dir.resolve("missing.log")));
    }
}
