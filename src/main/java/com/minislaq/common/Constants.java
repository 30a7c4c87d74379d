package com.minislaq.common;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * System constants
 *
 * @author Mini-SLAQ
 */
public class Constants {

    // ==================== Table ====================

    /**
     * The only logical table a query can read from
     */
    public static final String LOGS_TABLE = "logs";

    // ==================== Record fields ====================

    public static final String FIELD_IP = "ip";
    public static final String FIELD_TIMESTAMP = "timestamp";
    public static final String FIELD_METHOD = "method";
    public static final String FIELD_URL = "url";
    public static final String FIELD_PROTOCOL = "protocol";
    public static final String FIELD_STATUS = "status";
    public static final String FIELD_SIZE = "size";
    public static final String FIELD_REFERER = "referer";
    public static final String FIELD_USER_AGENT = "user_agent";

    /**
     * Queryable record fields, in record order
     */
    public static final List<String> FIELD_NAMES = Collections.unmodifiableList(Arrays.asList(
            FIELD_IP, FIELD_TIMESTAMP, FIELD_METHOD, FIELD_URL, FIELD_PROTOCOL,
            FIELD_STATUS, FIELD_SIZE, FIELD_REFERER, FIELD_USER_AGENT));

    /**
     * Column headers produced by SELECT *
     * Aligned with {@link #FIELD_NAMES}
     */
    public static final List<String> STAR_COLUMNS = Collections.unmodifiableList(Arrays.asList(
            "IP", "Timestamp", "Method", "URL", "Protocol",
            "Status", "Size", "Referer", "UserAgent"));

    // ==================== Functions ====================

    /**
     * Aggregate functions (only legal in grouped queries)
     */
    public static final List<String> AGGREGATE_FUNCTIONS = Collections.unmodifiableList(Arrays.asList(
            "COUNT", "SUM", "AVG", "MIN", "MAX"));

    /**
     * Every function name the lexer recognises
     */
    public static final List<String> FUNCTION_NAMES = Collections.unmodifiableList(Arrays.asList(
            // aggregate
            "COUNT", "SUM", "AVG", "MIN", "MAX",
            // time
            "HOUR", "DAY", "WEEKDAY", "DATE",
            // string
            "UPPER", "LOWER", "LENGTH", "SUBSTR",
            // network
            "IS_PRIVATE_IP", "COUNTRY"));

    // ==================== Literals ====================

    /**
     * Timestamp patterns accepted inside quoted literals, tried in order
     */
    public static final List<String> DATE_PATTERNS = Collections.unmodifiableList(Arrays.asList(
            "uuuu-MM-dd HH:mm:ss",
            "uuuu-MM-dd",
            "HH:mm:ss",
            "uuuu/MM/dd HH:mm:ss",
            "uuuu/MM/dd"));

    /**
     * Display pattern for timestamps
     */
    public static final String TIMESTAMP_DISPLAY_PATTERN = "uuuu-MM-dd HH:mm:ss";

    /**
     * Pattern of the DATE() function result
     */
    public static final String DATE_DISPLAY_PATTERN = "uuuu-MM-dd";

    // ==================== Record predicates ====================

    /**
     * User-agent fragments that mark a request as automated (lower case)
     */
    public static final List<String> BOT_PATTERNS = Collections.unmodifiableList(Arrays.asList(
            "bot", "crawler", "spider", "scraper", "crawl",
            "googlebot", "bingbot", "slurp", "facebookexternalhit",
            "twitterbot", "whatsapp", "telegram", "curl", "wget",
            "postman", "httpie", "python-requests", "monitoring"));

    public static final int ERROR_STATUS_MIN = 400;
    public static final int ERROR_STATUS_MAX = 599;
    public static final int SUCCESS_STATUS_MIN = 200;
    public static final int SUCCESS_STATUS_MAX = 299;

    // ==================== Network ====================

    /**
     * Private, loopback and link-local ranges
     */
    public static final List<String> PRIVATE_RANGES = Collections.unmodifiableList(Arrays.asList(
            "10.0.0.0/8",
            "172.16.0.0/12",
            "192.168.0.0/16",
            "127.0.0.0/8",
            "169.254.0.0/16",
            "::1/128",
            "fc00::/7",
            "fe80::/10"));

    // ==================== Execution ====================

    /**
     * Request timestamp format of Common/Combined Log Format
     */
    public static final String ACCESS_LOG_TIMESTAMP_PATTERN = "dd/MMM/yyyy:HH:mm:ss Z";

    private Constants() {
        // utility class
    }
}
