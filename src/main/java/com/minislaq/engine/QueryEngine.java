package com.minislaq.engine;

import com.minislaq.common.Constants;
import com.minislaq.common.QueryExecutionException;
import com.minislaq.common.QueryParseException;
import com.minislaq.executor.ErrorPolicy;
import com.minislaq.executor.OutputFormat;
import com.minislaq.executor.QueryExecutor;
import com.minislaq.executor.QueryResult;
import com.minislaq.executor.ResultFormatter;
import com.minislaq.log.LogEntry;
import com.minislaq.parser.SLAQParser;
import com.minislaq.parser.ast.SelectStatement;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Query engine facade
 *
 * Parses, executes and formats SLAQ queries against one list of records.
 *
 * Query flow:
 * 1. parse and validate the text into a SelectStatement
 * 2. run the operator tree over the records held by the engine
 * 3. format the result as table, CSV or JSON on request
 *
 * @author Mini-SLAQ
 */
@Slf4j
public class QueryEngine {

    private static final List<String> OPERATORS = Collections.unmodifiableList(Arrays.asList(
            // comparison
            "=", "!=", "<>", "<", "<=", ">", ">=",
            // string
            "LIKE", "MATCHES", "CONTAINS", "STARTS_WITH", "ENDS_WITH",
            // special
            "IN", "BETWEEN", "IN_RANGE", "IS_BOT", "IS_ERROR", "IS_SUCCESS",
            // logical
            "AND", "OR", "NOT"));

    private static final Map<String, String> SAMPLE_QUERIES;

    static {
        Map<String, String> samples = new LinkedHashMap<>();
        samples.put("Basic filtering",
                "SELECT * FROM logs WHERE status = 404");
        samples.put("Error analysis",
                "SELECT url, COUNT() AS error_count FROM logs WHERE IS_ERROR(status) "
                        + "GROUP BY url ORDER BY error_count DESC LIMIT 10");
        samples.put("Bot traffic",
                "SELECT ip, COUNT() AS requests FROM logs WHERE IS_BOT(user_agent) "
                        + "GROUP BY ip ORDER BY requests DESC");
        samples.put("Time-based analysis",
                "SELECT HOUR(timestamp) AS hour, COUNT() AS requests FROM logs "
                        + "GROUP BY hour ORDER BY hour");
        samples.put("Security analysis",
                "SELECT ip, COUNT() AS attempts FROM logs WHERE status = 401 AND url LIKE '/admin*' "
                        + "GROUP BY ip HAVING attempts > 5 ORDER BY attempts DESC");
        samples.put("Large requests",
                "SELECT url, AVG(size) AS avg_size, COUNT() AS count FROM logs WHERE size > 100000 "
                        + "GROUP BY url ORDER BY avg_size DESC");
        samples.put("Geographic analysis",
                "SELECT COUNTRY(ip) AS country, COUNT() AS requests FROM logs WHERE NOT IS_PRIVATE_IP(ip) "
                        + "GROUP BY country ORDER BY requests DESC LIMIT 20");
        samples.put("Complex filtering",
                "SELECT method, status, COUNT() AS count FROM logs "
                        + "WHERE timestamp BETWEEN '2024-08-20 00:00:00' AND '2024-08-20 23:59:59' "
                        + "AND (status >= 400 OR size > 1000000) "
                        + "GROUP BY method, status ORDER BY count DESC");
        SAMPLE_QUERIES = Collections.unmodifiableMap(samples);
    }

    private final List<LogEntry> records;

    private final SLAQParser parser = new SLAQParser();

    private final QueryExecutor executor;

    private final ResultFormatter formatter = new ResultFormatter();

    public QueryEngine(List<LogEntry> records) {
        this(records, ErrorPolicy.LENIENT);
    }

    public QueryEngine(List<LogEntry> records, ErrorPolicy errorPolicy) {
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.executor = new QueryExecutor(errorPolicy);
    }

    /**
     * Execute a query and format the result
     */
    public String query(String query, OutputFormat format) throws QueryParseException, QueryExecutionException {
        return formatter.format(executeQuery(query), format);
    }

    /**
     * Execute a query
     *
     * @throws QueryParseException     if the query does not lex, parse or validate
     * @throws QueryExecutionException if execution fails
     */
    public QueryResult executeQuery(String query) throws QueryParseException, QueryExecutionException {
        SelectStatement statement = parser.parse(query);
        long start = System.currentTimeMillis();
        QueryResult result = executor.execute(statement, records);
        log.info("Query returned {} rows in {} ms", result.getCount(), System.currentTimeMillis() - start);
        return result;
    }

    /**
     * Check a query without executing it
     *
     * @return the parsed statement
     */
    public SelectStatement validateQuery(String query) throws QueryParseException {
        return parser.parse(query);
    }

    public List<String> getAvailableFields() {
        return Constants.FIELD_NAMES;
    }

    public List<String> getAvailableFunctions() {
        return Constants.FUNCTION_NAMES;
    }

    public List<String> getAvailableOperators() {
        return OPERATORS;
    }

    /**
     * Example queries by title, in display order
     */
    public Map<String, String> getSampleQueries() {
        return SAMPLE_QUERIES;
    }

    public int getRecordCount() {
        return records.size();
    }
}
