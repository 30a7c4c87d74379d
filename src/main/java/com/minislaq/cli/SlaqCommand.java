package com.minislaq.cli;

import com.minislaq.common.SlaqException;
import com.minislaq.engine.QueryEngine;
import com.minislaq.executor.ErrorPolicy;
import com.minislaq.executor.OutputFormat;
import com.minislaq.ipc.IpcRequestHandler;
import com.minislaq.log.AccessLogParser;
import com.minislaq.log.LogEntry;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command line entry point
 *
 * <pre>
 * slaq --file access.log --query "SELECT status, COUNT() FROM logs GROUP BY status" [--format csv] [--strict]
 * slaq --stdio
 * </pre>
 *
 * Exit codes: 0 success, 1 query or I/O failure, 2 usage error.
 *
 * @author Mini-SLAQ
 */
@Slf4j
@Command(
        name = "slaq",
        mixinStandardHelpOptions = true,
        version = "slaq 1.0.0",
        description = {
                "Runs SLAQ queries against web server access logs (Combined or Common Log Format).",
                "",
                "Example: slaq -f access.log -q \"SELECT ip, COUNT() AS hits FROM logs GROUP BY ip ORDER BY hits DESC LIMIT 10\""
        })
public class SlaqCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    @Spec
    CommandSpec spec;

    @Option(names = {"-f", "--file"}, paramLabel = "FILE", description = "Access log file, optionally gzip compressed")
    Path file;

    @Option(names = {"-q", "--query"}, paramLabel = "QUERY", description = "SLAQ query to run")
    String query;

    @Option(names = "--format", paramLabel = "FORMAT", defaultValue = "table",
            description = "Output format: table, csv or json (default: ${DEFAULT-VALUE})")
    String format;

    @Option(names = "--strict", description = "Abort the query on the first evaluation error")
    boolean strict;

    @Option(names = "--stdio", description = "Serve newline-delimited JSON requests on stdin/stdout")
    boolean stdio;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SlaqCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws IOException {
        ErrorPolicy errorPolicy = strict ? ErrorPolicy.STRICT : ErrorPolicy.LENIENT;
        if (stdio) {
            return serveStdio(errorPolicy);
        }

        if (file == null || query == null) {
            throw new ParameterException(spec.commandLine(),
                    "--file and --query are required unless --stdio is given");
        }
        OutputFormat outputFormat;
        try {
            outputFormat = OutputFormat.fromName(format);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage());
        }

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        List<LogEntry> records;
        try {
            records = new AccessLogParser().parseFile(file);
        } catch (IOException e) {
            err.println("Cannot read log file " + file + ": " + e.getMessage());
            err.flush();
            return EXIT_FAILURE;
        }

        try {
            String output = new QueryEngine(records, errorPolicy).query(query, outputFormat);
            out.println(output);
            out.flush();
            return EXIT_OK;
        } catch (SlaqException e) {
            log.debug("Query failed", e);
            err.println(e.getMessage());
            err.flush();
            return EXIT_FAILURE;
        }
    }

    /**
     * One JSON request per input line, one JSON response per output line
     */
    private int serveStdio(ErrorPolicy errorPolicy) throws IOException {
        IpcRequestHandler handler = new IpcRequestHandler(errorPolicy);
        PrintWriter out = spec.commandLine().getOut();

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        String line;
        while ((line = in.readLine()) != null) {
            if (line.trim().isEmpty()) {
                continue;
            }
            out.println(handler.handle(line));
            out.flush();
        }
        return EXIT_OK;
    }
}
