package com.minislaq.log;

import lombok.Data;

import java.time.OffsetDateTime;

/**
 * One parsed access-log line
 *
 * The query engine only reads entries; it never changes them.
 *
 * @author Mini-SLAQ
 */
@Data
public final class LogEntry {

    /**
     * Client address
     */
    private final String ip;

    /**
     * Request time, with the offset written in the log
     */
    private final OffsetDateTime timestamp;

    /**
     * HTTP method (GET, POST, ...)
     */
    private final String method;

    /**
     * Request target
     */
    private final String url;

    /**
     * Protocol (HTTP/1.1, ...)
     */
    private final String protocol;

    /**
     * Response status code
     */
    private final int status;

    /**
     * Response size in bytes
     */
    private final long size;

    /**
     * Referer header, empty for Common Log Format
     */
    private final String referer;

    /**
     * User-Agent header, empty for Common Log Format
     */
    private final String userAgent;
}
