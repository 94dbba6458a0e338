package com.tbpivot.resample;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class AggregateRow {

    private final LocalDate periodStart;
    private final Map<String, Double> values;

    public AggregateRow(LocalDate periodStart, Map<String, Double> values) {
        this.periodStart = periodStart;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public LocalDate getPeriodStart() {
        return periodStart;
    }

    public Double getValue(String columnName) {
        return values.get(columnName);
    }

    public Map<String, Double> getValues() {
        return values;
    }
}
