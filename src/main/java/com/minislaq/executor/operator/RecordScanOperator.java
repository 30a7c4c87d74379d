package com.minislaq.executor.operator;

import com.minislaq.executor.ExecutionRow;
import com.minislaq.executor.Operator;
import com.minislaq.log.LogEntry;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.List;

/**
 * Record scan operator
 *
 * Leaf of every plan: returns the log records in input order.
 *
 * @author Mini-SLAQ
 */
@Slf4j
public class RecordScanOperator implements Operator {

    /**
     * Logical table name (always logs)
     */
    private final String tableName;

    private final List<LogEntry> records;

    private Iterator<LogEntry> iterator;

    /**
     * Records returned so far
     */
    private int scannedRows;

    public RecordScanOperator(String tableName, List<LogEntry> records) {
        this.tableName = tableName;
        this.records = records;
        this.scannedRows = 0;
    }

    @Override
    public void open() {
        log.debug("Opening RecordScan on {}: {} records", tableName, records.size());
        iterator = records.iterator();
        scannedRows = 0;
    }

    @Override
    public ExecutionRow next() {
        if (iterator == null) {
            throw new IllegalStateException("Operator not opened");
        }

        if (iterator.hasNext()) {
            scannedRows++;
            LogEntry entry = iterator.next();
            log.trace("RecordScan returned row {}: {}", scannedRows, entry);
            return ExecutionRow.ofRecord(entry);
        }

        log.debug("RecordScan finished, scanned {} rows", scannedRows);
        return null;
    }

    @Override
    public void close() {
        log.debug("Closing RecordScan on {}, total rows scanned: {}", tableName, scannedRows);
        iterator = null;
    }

    @Override
    public String getOperatorType() {
        return "RecordScan(" + tableName + ")";
    }
}
