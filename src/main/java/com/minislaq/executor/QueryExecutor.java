package com.minislaq.executor;

import com.minislaq.common.Constants;
import com.minislaq.common.QueryExecutionException;
import com.minislaq.evaluator.ExpressionEvaluator;
import com.minislaq.executor.operator.FilterOperator;
import com.minislaq.executor.operator.GroupOperator;
import com.minislaq.executor.operator.LimitOperator;
import com.minislaq.executor.operator.ProjectOperator;
import com.minislaq.executor.operator.RecordScanOperator;
import com.minislaq.executor.operator.SortOperator;
import com.minislaq.log.LogEntry;
import com.minislaq.parser.ast.SelectStatement;
import com.minislaq.value.Value;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Query executor
 *
 * Builds an operator tree for a statement and drains it into a result.
 *
 * Execution:
 * 1. build the operator tree
 * 2. open()
 * 3. next() until null
 * 4. close()
 *
 * @author Mini-SLAQ
 */
@Slf4j
public class QueryExecutor {

    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();

    @Getter
    private final ErrorPolicy errorPolicy;

    public QueryExecutor() {
        this(ErrorPolicy.LENIENT);
    }

    public QueryExecutor(ErrorPolicy errorPolicy) {
        this.errorPolicy = errorPolicy;
    }

    /**
     * Execute a SELECT statement
     *
     * @param statement validated statement
     * @param records   log records, in input order
     * @return result set
     * @throws QueryExecutionException for unknown tables, or any evaluation failure in STRICT mode
     */
    public QueryResult execute(SelectStatement statement, List<LogEntry> records)
            throws QueryExecutionException {
        log.info("Executing query on {} ({} records)", statement.getTableName(), records.size());

        List<String> columns = columnNames(statement);
        Operator plan = buildExecutionPlan(statement, records, columns);

        List<List<Value>> rows = new ArrayList<>();
        try {
            plan.open();

            ExecutionRow row;
            while ((row = plan.next()) != null) {
                rows.add(row.getValues());
            }

            log.info("Query finished, returned {} rows", rows.size());

        } finally {
            plan.close();
        }

        return new QueryResult(columns, rows);
    }

    /**
     * Output column names: alias, else rendered expression; SELECT * has fixed names
     */
    public static List<String> columnNames(SelectStatement statement) {
        if (statement.isSelectAll()) {
            return Constants.STAR_COLUMNS;
        }
        List<String> columns = new ArrayList<>(statement.getSelectElements().size());
        for (SelectStatement.SelectElement element : statement.getSelectElements()) {
            columns.add(element.getColumnName());
        }
        return columns;
    }

    /**
     * Build the operator tree, bottom to top:
     * RecordScan -> Filter(WHERE) -> Group -> Project -> Filter(HAVING) -> Sort -> Limit
     */
    Operator buildExecutionPlan(SelectStatement statement, List<LogEntry> records, List<String> columns)
            throws QueryExecutionException {
        String tableName = statement.getTableName();
        if (!Constants.LOGS_TABLE.equalsIgnoreCase(tableName)) {
            throw new QueryExecutionException("Unknown table: " + tableName);
        }

        Operator plan = new RecordScanOperator(tableName, records);
        log.debug("Added operator: {}", plan.getOperatorType());

        if (statement.getWhereCondition() != null) {
            plan = new FilterOperator(plan, statement.getWhereCondition(), evaluator, errorPolicy);
            log.debug("Added operator: {}", plan.getOperatorType());
        }

        if (statement.isGrouped()) {
            plan = new GroupOperator(plan, statement.getGroupBy(), evaluator, errorPolicy);
            log.debug("Added operator: {}", plan.getOperatorType());
        }

        plan = new ProjectOperator(plan, statement.getSelectElements(), statement.getGroupBy(),
                evaluator, errorPolicy);
        log.debug("Added operator: {}", plan.getOperatorType());

        if (statement.getHavingCondition() != null) {
            plan = new FilterOperator(plan, statement.getHavingCondition(), evaluator, errorPolicy,
                    statement.getGroupBy(), columns);
            log.debug("Added operator: {}", plan.getOperatorType());
        }

        if (!statement.getOrderByElements().isEmpty()) {
            plan = new SortOperator(plan, statement.getOrderByElements(), columns,
                    statement.getGroupBy(), evaluator, errorPolicy);
            log.debug("Added operator: {}", plan.getOperatorType());
        }

        if (statement.getLimit() != null) {
            plan = new LimitOperator(plan, statement.getLimit());
            log.debug("Added operator: {}", plan.getOperatorType());
        }

        return plan;
    }
}
