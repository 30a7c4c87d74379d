package com.minislaq.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Command line tests
 *
 * @author Mini-SLAQ
 */
class SlaqCommandTest {

    @TempDir
    Path dir;

    private Path logFile;
    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() throws IOException {
        logFile = dir.resolve("access.log");
        Files.write(logFile, Arrays.asList(
                "10.0.0.1 - - [20/Aug/2024:10:00:00 +0000] \"GET /index.html HTTP/1.1\" 200 512",
                "10.0.0.2 - - [20/Aug/2024:10:01:00 +0000] \"GET /missing HTTP/1.1\" 404 128"),
                StandardCharsets.UTF_8);

        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new SlaqCommand());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void testTableOutput() {
        int exitCode = commandLine.execute("-f", logFile.toString(), "-q", "SELECT ip, status FROM logs");

        assertEquals(SlaqCommand.EXIT_OK, exitCode);
        String output = out.toString();
        assertTrue(output.startsWith("ip       | status"), output);
        assertTrue(output.contains("10.0.0.2 | 404"), output);
        assertTrue(output.contains("Total: 2 rows"), output);
    }

    @Test
    void testCsvOutput() {
        int exitCode = commandLine.execute("--file", logFile.toString(), "--format", "csv",
                "--query", "SELECT url FROM logs WHERE status IS_ERROR");

        assertEquals(SlaqCommand.EXIT_OK, exitCode);
        assertTrue(out.toString().startsWith("url\n/missing\n"), out.toString());
    }

    @Test
    void testQueryErrorExitsWithFailure() {
        int exitCode = commandLine.execute("-f", logFile.toString(), "-q", "SELECT * FROM logs WHERE (status = 1");

        assertEquals(SlaqCommand.EXIT_FAILURE, exitCode);
        assertTrue(err.toString().contains("Unmatched opening parenthesis"), err.toString());
        assertEquals("", out.toString());
    }

    @Test
    void testMissingLogFile() {
        int exitCode = commandLine.execute("-f", dir.resolve("nope.log").toString(), "-q", "SELECT * FROM logs");

        assertEquals(SlaqCommand.EXIT_FAILURE, exitCode);
        assertTrue(err.toString().startsWith("Cannot read log file"), err.toString());
    }

    /**
     * Usage errors report through picocli with exit code 2
     */
    @Test
    void testUsageErrors() {
        assertEquals(CommandLine.ExitCode.USAGE, commandLine.execute("-q", "SELECT * FROM logs"));
        assertEquals(CommandLine.ExitCode.USAGE,
                commandLine.execute("-f", logFile.toString(), "-q", "SELECT * FROM logs", "--format", "xml"));
        assertTrue(err.toString().contains("Unsupported format: xml"), err.toString());
    }
}
