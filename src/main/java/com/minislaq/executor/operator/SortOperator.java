package com.minislaq.executor.operator;

import com.minislaq.common.EvaluationException;
import com.minislaq.common.QueryExecutionException;
import com.minislaq.evaluator.EvaluationContext;
import com.minislaq.evaluator.ExpressionEvaluator;
import com.minislaq.executor.ErrorPolicy;
import com.minislaq.executor.ExecutionRow;
import com.minislaq.executor.Operator;
import com.minislaq.parser.ast.Expression;
import com.minislaq.parser.ast.SelectStatement;
import com.minislaq.value.Value;
import com.minislaq.value.ValueComparator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
 * Sort operator (ORDER BY)
 *
 * Materializes its input, computes the sort keys once per row, then sorts
 * in memory. A key naming an output column (alias or rendered expression)
 * takes that column's value; any other key is evaluated against the row.
 *
 * The sort is stable and its order is total:
 * 1. keys that failed to evaluate sort last in both directions;
 * 2. keys of different types order by type rank;
 * 3. equal keys fall through to the next key;
 * 4. group rows finally fall back to their GROUP BY values ascending.
 *
 * @author Mini-SLAQ
 */
@Slf4j
public class SortOperator implements Operator {

    private final Operator child;

    private final List<SelectStatement.OrderByElement> orderByElements;

    /**
     * Output column names of the projected rows
     */
    private final List<String> columns;

    private final List<Expression> groupBy;

    private final ExpressionEvaluator evaluator;

    private final ErrorPolicy errorPolicy;

    private List<SortEntry> sortedData;

    private Iterator<SortEntry> iterator;

    private int sortedRows = 0;

    public SortOperator(Operator child, List<SelectStatement.OrderByElement> orderByElements,
                        List<String> columns, List<Expression> groupBy, ExpressionEvaluator evaluator,
                        ErrorPolicy errorPolicy) {
        this.child = child;
        this.orderByElements = orderByElements;
        this.columns = columns;
        this.groupBy = groupBy;
        this.evaluator = evaluator;
        this.errorPolicy = errorPolicy;
    }

    @Override
    public void open() throws QueryExecutionException {
        log.debug("Opening Sort: {}", orderByElements);
        child.open();

        sortedData = new ArrayList<>();
        ExecutionRow row;
        while ((row = child.next()) != null) {
            sortedData.add(new SortEntry(row, sortKeys(row)));
        }

        log.debug("Sort collected {} rows, starting sort...", sortedData.size());

        long startTime = System.currentTimeMillis();
        sortedData.sort(createComparator());
        long sortTime = System.currentTimeMillis() - startTime;

        log.debug("Sort finished in {} ms", sortTime);

        iterator = sortedData.iterator();
        sortedRows = 0;
    }

    @Override
    public ExecutionRow next() {
        if (iterator == null) {
            throw new IllegalStateException("Operator not opened");
        }

        if (iterator.hasNext()) {
            sortedRows++;
            return iterator.next().row;
        }

        return null;
    }

    @Override
    public void close() {
        log.debug("Closing Sort, returned {} rows", sortedRows);
        child.close();
        sortedData = null;
        iterator = null;
    }

    @Override
    public String getOperatorType() {
        return "Sort(" + orderByElements + ")";
    }

    /**
     * One value per ORDER BY key; null marks a key that failed to evaluate
     */
    private List<Value> sortKeys(ExecutionRow row) throws QueryExecutionException {
        EvaluationContext context = null;
        List<Value> keys = new ArrayList<>(orderByElements.size());

        for (SelectStatement.OrderByElement element : orderByElements) {
            Expression expression = element.getExpression();
            int column = columns.indexOf(expression.toString());
            if (column >= 0 && row.isProjected()) {
                keys.add(row.getValues().get(column));
                continue;
            }

            if (context == null) {
                context = row.context(groupBy, columns);
            }
            try {
                keys.add(evaluator.evaluate(expression, context));
            } catch (EvaluationException e) {
                keys.add(errorPolicy.onSortKeyFailure(expression, e));
            }
        }
        return keys;
    }

    private Comparator<SortEntry> createComparator() {
        return (entry1, entry2) -> {
            for (int i = 0; i < orderByElements.size(); i++) {
                Value key1 = entry1.keys.get(i);
                Value key2 = entry2.keys.get(i);
                if (key1 == null || key2 == null) {
                    int missing = Boolean.compare(key1 == null, key2 == null);
                    if (missing != 0) {
                        return missing;
                    }
                    continue;
                }
                int cmp = ValueComparator.compareForOrdering(key1, key2);
                if (cmp != 0) {
                    return orderByElements.get(i).isDescending() ? -cmp : cmp;
                }
            }
            if (entry1.row.isGrouped() && entry2.row.isGrouped()) {
                List<Value> group1 = entry1.row.getKeyValues();
                List<Value> group2 = entry2.row.getKeyValues();
                for (int i = 0; i < group1.size() && i < group2.size(); i++) {
                    int cmp = ValueComparator.compareForOrdering(group1.get(i), group2.get(i));
                    if (cmp != 0) {
                        return cmp;
                    }
                }
            }
            return 0;
        };
    }

    /**
     * Row with its precomputed sort keys
     */
    private static final class SortEntry {
        private final ExecutionRow row;
        private final List<Value> keys;

        private SortEntry(ExecutionRow row, List<Value> keys) {
            this.row = row;
            this.keys = keys;
        }
    }
}
