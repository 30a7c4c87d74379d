package com.minislaq.engine;

/**
 * Ready-made analyses as query builders
 *
 * Callers may refine the returned builder before building it.
 *
 * @author Mini-SLAQ
 */
public final class PrebuiltQueries {

    private PrebuiltQueries() {
    }

    public static QueryBuilder errorAnalysis() {
        return new QueryBuilder()
                .select("url", "status", "COUNT() AS error_count")
                .where("status IS_ERROR")
                .groupBy("url", "status")
                .orderBy("error_count DESC")
                .limit(20);
    }

    public static QueryBuilder topIps() {
        return new QueryBuilder()
                .select("ip", "COUNT() AS requests")
                .groupBy("ip")
                .orderBy("requests DESC")
                .limit(20);
    }

    public static QueryBuilder botTraffic() {
        return new QueryBuilder()
                .select("ip", "user_agent", "COUNT() AS requests")
                .where("user_agent IS_BOT")
                .groupBy("ip", "user_agent")
                .orderBy("requests DESC")
                .limit(10);
    }

    public static QueryBuilder hourlyTraffic() {
        return new QueryBuilder()
                .select("HOUR(timestamp) AS hour", "COUNT() AS requests")
                .groupBy("hour")
                .orderBy("hour");
    }

    public static QueryBuilder largeRequests(long minSize) {
        return new QueryBuilder()
                .select("url", "method", "AVG(size) AS avg_size", "COUNT() AS count")
                .where("size > " + minSize)
                .groupBy("url", "method")
                .orderBy("avg_size DESC")
                .limit(10);
    }

    public static QueryBuilder securityThreats() {
        return new QueryBuilder()
                .select("ip", "url", "COUNT() AS attempts")
                .where("(status = 401 OR status = 403) AND (url LIKE '/admin*' OR url LIKE '/login*')")
                .groupBy("ip", "url")
                .having("attempts > 3")
                .orderBy("attempts DESC");
    }

    public static QueryBuilder statusCodeDistribution() {
        return new QueryBuilder()
                .select("status", "COUNT() AS count")
                .groupBy("status")
                .orderBy("count DESC");
    }

    public static QueryBuilder geographicAnalysis() {
        return new QueryBuilder()
                .select("COUNTRY(ip) AS country", "COUNT() AS requests")
                .where("NOT IS_PRIVATE_IP(ip)")
                .groupBy("country")
                .orderBy("requests DESC")
                .limit(20);
    }

    public static QueryBuilder methodAnalysis() {
        return new QueryBuilder()
                .select("method", "COUNT() AS count", "AVG(size) AS avg_size")
                .groupBy("method")
                .orderBy("count DESC");
    }

    /**
     * Hourly traffic between two timestamps (yyyy-MM-dd HH:mm:ss), inclusive
     */
    public static QueryBuilder timeRangeAnalysis(String startTime, String endTime) {
        return new QueryBuilder()
                .select("HOUR(timestamp) AS hour", "COUNT() AS requests", "AVG(size) AS avg_size")
                .where("timestamp BETWEEN " + QueryHelper.quoteString(startTime)
                        + " AND " + QueryHelper.quoteString(endTime))
                .groupBy("hour")
                .orderBy("hour");
    }
}
