package com.minislaq.engine;

import com.minislaq.common.QueryExecutionException;
import com.minislaq.common.QueryParseException;
import com.minislaq.executor.OutputFormat;
import com.minislaq.executor.QueryResult;
import com.minislaq.log.LogEntry;
import com.minislaq.log.LogEntryFixtures;
import com.minislaq.value.Value;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Query engine, builder and helper tests
 *
 * @author Mini-SLAQ
 */
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class QueryEngineTest {

    private QueryEngine engine;

    @BeforeEach
    void setUp() {
        List<LogEntry> records = new ArrayList<>();
        records.add(LogEntryFixtures.entry("66.249.66.1", "2024-08-20T08:00:00", "GET", "/robots.txt", 200, 68,
                LogEntryFixtures.GOOGLEBOT));
        records.add(LogEntryFixtures.entry("203.0.113.7", "2024-08-20T08:10:00", "POST", "/admin/login", 401, 120,
                LogEntryFixtures.BROWSER));
        records.add(LogEntryFixtures.entry("203.0.113.7", "2024-08-20T08:11:00", "POST", "/admin/login", 401, 120,
                LogEntryFixtures.BROWSER));
        records.add(LogEntryFixtures.entry("10.0.0.4", "2024-08-20T09:00:00", "GET", "/index.html", 200, 2048,
                LogEntryFixtures.BROWSER));
        engine = new QueryEngine(records);
    }

    @Test
    @Order(1)
    void testExecuteQuery() throws Exception {
        QueryResult result = engine.executeQuery("SELECT ip, COUNT() AS n FROM logs WHERE status IS_ERROR GROUP BY ip");
        assertEquals(1, result.getCount());
        assertEquals(Arrays.asList(Value.of("203.0.113.7"), Value.of(2)), result.getRows().get(0));
        assertEquals(4, engine.getRecordCount());
    }

    @Test
    @Order(2)
    void testFormattedQuery() throws Exception {
        String csv = engine.query("SELECT method, COUNT() AS n FROM logs GROUP BY method", OutputFormat.CSV);
        assertEquals("method,n\nGET,2\nPOST,2\n", csv);

        assertEquals("No results found.", engine.query("SELECT * FROM logs WHERE status = 500", OutputFormat.TABLE));
    }

    /**
     * Every sample query must at least parse and validate
     */
    @Test
    @Order(3)
    void testSampleQueriesValidate() throws Exception {
        Map<String, String> samples = engine.getSampleQueries();
        assertEquals(8, samples.size());
        for (Map.Entry<String, String> sample : samples.entrySet()) {
            assertNotNull(engine.validateQuery(sample.getValue()), sample.getKey());
            engine.executeQuery(sample.getValue());
        }
    }

    @Test
    @Order(4)
    void testSampleQueryResults() throws Exception {
        QueryResult bots = engine.executeQuery(engine.getSampleQueries().get("Bot traffic"));
        assertEquals(1, bots.getCount());
        assertEquals(Value.of("66.249.66.1"), bots.getRows().get(0).get(0));

        QueryResult geo = engine.executeQuery(engine.getSampleQueries().get("Geographic analysis"));
        assertEquals(Arrays.asList(Value.of("International"), Value.of("US/International")), geo.column("country"));
        assertEquals(Arrays.asList(Value.of(2), Value.of(1)), geo.column("requests"));
    }

    @Test
    @Order(5)
    void testPrebuiltQueriesParse() throws Exception {
        List<QueryBuilder> builders = Arrays.asList(
                PrebuiltQueries.errorAnalysis(),
                PrebuiltQueries.topIps(),
                PrebuiltQueries.botTraffic(),
                PrebuiltQueries.hourlyTraffic(),
                PrebuiltQueries.largeRequests(1000),
                PrebuiltQueries.securityThreats(),
                PrebuiltQueries.statusCodeDistribution(),
                PrebuiltQueries.geographicAnalysis(),
                PrebuiltQueries.methodAnalysis(),
                PrebuiltQueries.timeRangeAnalysis("2024-08-20 08:00:00", "2024-08-20 08:59:59"));
        for (QueryBuilder builder : builders) {
            engine.executeQuery(builder.build());
        }

        QueryResult hourly = engine.executeQuery(PrebuiltQueries.hourlyTraffic().build());
        assertEquals(Arrays.asList(Value.of(8), Value.of(9)), hourly.column("hour"));

        QueryResult window = engine.executeQuery(
                PrebuiltQueries.timeRangeAnalysis("2024-08-20 08:00:00", "2024-08-20 08:59:59").build());
        assertEquals(Arrays.asList(Value.of(3)), window.column("requests"));
    }

    @Test
    @Order(6)
    void testQueryBuilder() {
        String query = new QueryBuilder()
                .select("status", "COUNT() AS count")
                .where("method = 'GET'")
                .where("size > 100")
                .whereOr("status = 500")
                .groupBy("status")
                .having("count > 1")
                .orderBy("count DESC")
                .limit(5)
                .build();
        assertEquals("SELECT status, COUNT() AS count FROM logs WHERE method = 'GET' AND size > 100 OR status = 500 "
                + "GROUP BY status HAVING count > 1 ORDER BY count DESC LIMIT 5", query);

        assertEquals("SELECT * FROM logs", new QueryBuilder().build());
        assertThrows(IllegalArgumentException.class, () -> new QueryBuilder().limit(-1));
    }

    @Test
    @Order(7)
    void testQueryHelper() {
        assertEquals("'/index.html'", QueryHelper.quoteString("/index.html"));
        assertEquals("\"it's\"", QueryHelper.quoteString("it's"));
        assertThrows(IllegalArgumentException.class, () -> QueryHelper.quoteString("'\""));

        assertTrue(QueryHelper.isValidFieldName("USER_AGENT"));
        assertFalse(QueryHelper.isValidFieldName("agent"));
        assertTrue(QueryHelper.isValidFunctionName("weekday"));
        assertFalse(QueryHelper.isValidFunctionName("REVERSE"));
        assertFalse(QueryHelper.isValidFieldName(null));
    }

    @Test
    @Order(8)
    void testSuggestCorrection() {
        QueryParseException unknownFunction = assertThrows(QueryParseException.class,
                () -> engine.executeQuery("SELECT foo(ip) FROM logs"));
        assertTrue(QueryHelper.suggestCorrection(unknownFunction).startsWith("Available functions"));

        QueryParseException ungrouped = assertThrows(QueryParseException.class,
                () -> engine.executeQuery("SELECT COUNT() FROM logs"));
        assertTrue(QueryHelper.suggestCorrection(ungrouped).contains("GROUP BY"));

        QueryExecutionException unknownTable = assertThrows(QueryExecutionException.class,
                () -> engine.executeQuery("SELECT * FROM access"));
        assertTrue(QueryHelper.suggestCorrection(unknownTable).contains("FROM logs"));

        assertEquals("Check the query syntax and available fields/functions",
                QueryHelper.suggestCorrection(new IllegalStateException("boom")));
    }

    @Test
    @Order(9)
    void testCatalog() {
        assertTrue(engine.getAvailableFields().contains("user_agent"));
        assertTrue(engine.getAvailableFunctions().contains("IS_PRIVATE_IP"));
        assertTrue(engine.getAvailableOperators().contains("IN_RANGE"));
    }
}
