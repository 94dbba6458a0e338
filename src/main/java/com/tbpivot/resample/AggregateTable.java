package com.tbpivot.resample;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Aggregated values per fully covered calendar period, keyed by period start.
 */
public class AggregateTable {

    public static final String DATE_COLUMN = "Date";

    private final Granularity granularity;
    private final List<String> dataColumns;
    private final List<AggregateRow> rows;

    public AggregateTable(Granularity granularity, List<String> dataColumns, List<AggregateRow> rows) {
        this.granularity = granularity;
        this.dataColumns = Collections.unmodifiableList(new ArrayList<>(dataColumns));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public Granularity getGranularity() {
        return granularity;
    }

    public List<String> getDataColumnNames() {
        return dataColumns;
    }

    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>();
        names.add(DATE_COLUMN);
        names.addAll(dataColumns);
        return names;
    }

    public List<AggregateRow> getRows() {
        return rows;
    }

    public List<LocalDate> getPeriodStarts() {
        List<LocalDate> dates = new ArrayList<>(rows.size());
        for (AggregateRow row : rows) {
            dates.add(row.getPeriodStart());
        }
        return dates;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
