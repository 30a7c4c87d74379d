package com.minislaq.parser.ast;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SELECT statement AST node
 *
 * Syntax: SELECT fields FROM logs [WHERE cond] [GROUP BY exprs] [HAVING cond]
 *         [ORDER BY expr [ASC|DESC], ...] [LIMIT n]
 *
 * Built once by the parser and never modified afterwards.
 *
 * @author Mini-SLAQ
 */
@Getter
@EqualsAndHashCode
public final class SelectStatement {

    /**
     * Projected fields (empty for SELECT *)
     */
    private final List<SelectElement> selectElements;

    /**
     * Whether this is SELECT *
     */
    private final boolean selectAll;

    /**
     * Source table name
     */
    private final String tableName;

    /**
     * WHERE condition, or null
     */
    private final Expression whereCondition;

    /**
     * GROUP BY expressions (empty when not grouped)
     */
    private final List<Expression> groupBy;

    /**
     * HAVING condition, or null
     */
    private final Expression havingCondition;

    /**
     * ORDER BY keys
     */
    private final List<OrderByElement> orderByElements;

    /**
     * LIMIT row count, or null
     */
    private final Long limit;

    public SelectStatement(List<SelectElement> selectElements, boolean selectAll, String tableName,
                           Expression whereCondition, List<Expression> groupBy,
                           Expression havingCondition, List<OrderByElement> orderByElements,
                           Long limit) {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("LIMIT must not be negative: " + limit);
        }
        this.selectElements = Collections.unmodifiableList(new ArrayList<>(selectElements));
        this.selectAll = selectAll;
        this.tableName = tableName;
        this.whereCondition = whereCondition;
        this.groupBy = Collections.unmodifiableList(new ArrayList<>(groupBy));
        this.havingCondition = havingCondition;
        this.orderByElements = Collections.unmodifiableList(new ArrayList<>(orderByElements));
        this.limit = limit;
    }

    public boolean isGrouped() {
        return !groupBy.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SELECT ");
        if (selectAll) {
            sb.append("*");
        } else {
            for (int i = 0; i < selectElements.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(selectElements.get(i));
            }
        }
        sb.append(" FROM ").append(tableName);

        if (whereCondition != null) {
            sb.append(" WHERE ").append(whereCondition);
        }

        if (!groupBy.isEmpty()) {
            sb.append(" GROUP BY ");
            for (int i = 0; i < groupBy.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(groupBy.get(i));
            }
        }

        if (havingCondition != null) {
            sb.append(" HAVING ").append(havingCondition);
        }

        if (!orderByElements.isEmpty()) {
            sb.append(" ORDER BY ");
            for (int i = 0; i < orderByElements.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(orderByElements.get(i));
            }
        }

        if (limit != null) {
            sb.append(" LIMIT ").append(limit);
        }

        return sb.toString();
    }

    /**
     * SELECT item
     */
    @Getter
    @EqualsAndHashCode
    public static final class SelectElement {

        private final Expression expression;

        /**
         * Alias, or null
         */
        private final String alias;

        public SelectElement(Expression expression, String alias) {
            this.expression = expression;
            this.alias = alias;
        }

        /**
         * Result column name: the alias, else the rendered expression
         */
        public String getColumnName() {
            return alias != null ? alias : expression.toString();
        }

        @Override
        public String toString() {
            if (alias != null) {
                return expression + " AS " + alias;
            }
            return expression.toString();
        }
    }

    /**
     * ORDER BY key
     */
    @Getter
    @EqualsAndHashCode
    public static final class OrderByElement {

        private final Expression expression;

        /**
         * true = DESC, false = ASC
         */
        private final boolean descending;

        public OrderByElement(Expression expression, boolean descending) {
            this.expression = expression;
            this.descending = descending;
        }

        @Override
        public String toString() {
            return expression + (descending ? " DESC" : " ASC");
        }
    }
}
