package com.minislaq.ipc;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.minislaq.common.SlaqException;
import com.minislaq.engine.QueryEngine;
import com.minislaq.executor.ErrorPolicy;
import com.minislaq.executor.QueryResult;
import com.minislaq.executor.ResultFormatter;
import com.minislaq.log.AccessLogParser;
import com.minislaq.log.LogEntry;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.List;

/**
 * Handles IPC requests
 *
 * Actions:
 * - query: parse logFile, run query, return {"queryResults": {count, columns, rows}}
 * - getStatus: return {"status": "..."}
 *
 * Every failure becomes a response with success=false; handle() never throws.
 *
 * @author Mini-SLAQ
 */
@Slf4j
public class IpcRequestHandler {

    public static final String ERR_INVALID_ACTION = "invalid action";
    public static final String ERR_INVALID_REQUEST = "invalid request";
    public static final String ERR_MISSING_LOG_FILE = "missing log file";
    public static final String ERR_MISSING_QUERY = "missing query";
    public static final String ERR_QUERY_FAILED = "query execution failed";

    private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    private final ResultFormatter formatter = new ResultFormatter();

    private final ErrorPolicy errorPolicy;

    private int handledRequests = 0;

    public IpcRequestHandler() {
        this(ErrorPolicy.LENIENT);
    }

    public IpcRequestHandler(ErrorPolicy errorPolicy) {
        this.errorPolicy = errorPolicy;
    }

    /**
     * Handle one request
     *
     * @param requestJson request as JSON
     * @return response as single-line JSON
     */
    public String handle(String requestJson) {
        IpcRequest request;
        try {
            request = gson.fromJson(requestJson, IpcRequest.class);
        } catch (JsonParseException e) {
            log.warn("Malformed IPC request: {}", e.getMessage());
            return gson.toJson(IpcResponse.failure(null, ERR_INVALID_REQUEST + ": " + e.getMessage()));
        }
        if (request == null) {
            return gson.toJson(IpcResponse.failure(null, ERR_INVALID_REQUEST + ": empty request"));
        }
        return gson.toJson(process(request));
    }

    public IpcResponse process(IpcRequest request) {
        handledRequests++;
        log.info("Processing request: {} (action: {})", request.getId(), request.getAction());

        String action = request.getAction();
        if (IpcRequest.ACTION_QUERY.equals(action)) {
            return handleQuery(request);
        }
        if (IpcRequest.ACTION_GET_STATUS.equals(action)) {
            return handleGetStatus(request);
        }
        return IpcResponse.failure(request.getId(), ERR_INVALID_ACTION + ": " + action);
    }

    /**
     * Query action
     *
     * 1. check that logFile and query are present
     * 2. read the log file (an unusable path is a failed query, not a crash)
     * 3. run the query and wrap the result as queryResults
     */
    private IpcResponse handleQuery(IpcRequest request) {
        if (isBlank(request.getLogFile())) {
            return IpcResponse.failure(request.getId(), ERR_MISSING_LOG_FILE);
        }
        if (isBlank(request.getQuery())) {
            return IpcResponse.failure(request.getId(), ERR_MISSING_QUERY);
        }

        try {
            List<LogEntry> records = new AccessLogParser().parseFile(Paths.get(request.getLogFile()));
            QueryResult result = new QueryEngine(records, errorPolicy).executeQuery(request.getQuery());

            JsonObject data = new JsonObject();
            data.add("queryResults", formatter.toJson(result));
            return IpcResponse.ok(request.getId(), data);

        } catch (InvalidPathException e) {
            log.warn("Invalid log file path: {}", e.getReason());
            return IpcResponse.failure(request.getId(),
                    ERR_QUERY_FAILED + ": invalid log file path: " + e.getReason());
        } catch (IOException e) {
            log.warn("Cannot read log file {}: {}", request.getLogFile(), e.toString());
            return IpcResponse.failure(request.getId(),
                    ERR_QUERY_FAILED + ": cannot read log file " + request.getLogFile());
        } catch (SlaqException e) {
            log.debug("Query failed: {}", e.getMessage());
            return IpcResponse.failure(request.getId(), ERR_QUERY_FAILED + ": " + e.getMessage());
        }
    }

    private IpcResponse handleGetStatus(IpcRequest request) {
        JsonObject data = new JsonObject();
        data.addProperty("status", "SLAQ IPC handler - running, " + handledRequests + " requests handled");
        return IpcResponse.ok(request.getId(), data);
    }

    private static boolean isBlank(String text) {
        return text == null || text.trim().isEmpty();
    }
}
