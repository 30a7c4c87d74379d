package com.minislaq.engine;

import com.minislaq.common.Constants;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fluent builder for SLAQ query text
 *
 * <pre>
 * String query = new QueryBuilder()
 *         .select("status", "COUNT() AS count")
 *         .groupBy("status")
 *         .orderBy("count DESC")
 *         .build();
 * </pre>
 *
 * Fragments are inserted as written; use {@link QueryHelper#quoteString}
 * for user-supplied text.
 *
 * @author Mini-SLAQ
 */
public class QueryBuilder {

    private final List<String> selectFields = new ArrayList<>();
    private String fromTable = Constants.LOGS_TABLE;
    private String whereClause;
    private final List<String> groupByFields = new ArrayList<>();
    private final List<String> orderByFields = new ArrayList<>();
    private String havingClause;
    private Long limitValue;

    /**
     * Selected fields; none means SELECT *
     */
    public QueryBuilder select(String... fields) {
        selectFields.clear();
        selectFields.addAll(Arrays.asList(fields));
        return this;
    }

    public QueryBuilder from(String table) {
        this.fromTable = table;
        return this;
    }

    /**
     * Add a condition joined with AND
     */
    public QueryBuilder where(String condition) {
        whereClause = whereClause == null ? condition : whereClause + " AND " + condition;
        return this;
    }

    /**
     * Add a condition joined with OR
     */
    public QueryBuilder whereOr(String condition) {
        whereClause = whereClause == null ? condition : whereClause + " OR " + condition;
        return this;
    }

    public QueryBuilder groupBy(String... fields) {
        groupByFields.clear();
        groupByFields.addAll(Arrays.asList(fields));
        return this;
    }

    /**
     * Sort keys, each optionally followed by ASC or DESC
     */
    public QueryBuilder orderBy(String... fields) {
        orderByFields.clear();
        orderByFields.addAll(Arrays.asList(fields));
        return this;
    }

    public QueryBuilder having(String condition) {
        this.havingClause = condition;
        return this;
    }

    public QueryBuilder limit(long limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("LIMIT must not be negative: " + limit);
        }
        this.limitValue = limit;
        return this;
    }

    public String build() {
        StringBuilder query = new StringBuilder("SELECT ");
        query.append(selectFields.isEmpty() ? "*" : String.join(", ", selectFields));
        query.append(" FROM ").append(fromTable);

        if (whereClause != null) {
            query.append(" WHERE ").append(whereClause);
        }
        if (!groupByFields.isEmpty()) {
            query.append(" GROUP BY ").append(String.join(", ", groupByFields));
        }
        if (havingClause != null) {
            query.append(" HAVING ").append(havingClause);
        }
        if (!orderByFields.isEmpty()) {
            query.append(" ORDER BY ").append(String.join(", ", orderByFields));
        }
        if (limitValue != null) {
            query.append(" LIMIT ").append(limitValue);
        }
        return query.toString();
    }

    @Override
    public String toString() {
        return build();
    }
}
