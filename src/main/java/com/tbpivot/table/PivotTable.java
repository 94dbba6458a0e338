package com.tbpivot.table;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Wide table: one row per (snapped) timestamp, one column per entity x metric.
 */
public class PivotTable {

    public static final String TIMESTAMP_COLUMN = "Timestamp";

    private final List<PivotColumn> columns;
    private final List<PivotRow> rows;

    public PivotTable(List<PivotColumn> columns, List<PivotRow> rows) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public static PivotTable empty() {
        return new PivotTable(new ArrayList<>(), new ArrayList<>());
    }

    public List<PivotColumn> getColumns() {
        return columns;
    }

    /**
     * Data column names in table order, without the timestamp column
     */
    public List<String> getDataColumnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (PivotColumn column : columns) {
            names.add(column.getName());
        }
        return names;
    }

    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>();
        names.add(TIMESTAMP_COLUMN);
        names.addAll(getDataColumnNames());
        return names;
    }

    public List<PivotRow> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public LocalDateTime getMinTimestamp() {
        LocalDateTime min = null;
        for (PivotRow row : rows) {
            if (min == null || row.getTimestamp().isBefore(min)) {
                min = row.getTimestamp();
            }
        }
        return min;
    }

    public LocalDateTime getMaxTimestamp() {
        LocalDateTime max = null;
        for (PivotRow row : rows) {
            if (max == null || row.getTimestamp().isAfter(max)) {
                max = row.getTimestamp();
            }
        }
        return max;
    }
}
