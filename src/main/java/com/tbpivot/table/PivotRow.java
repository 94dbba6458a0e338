package com.tbpivot.table;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class PivotRow {

    private final LocalDateTime timestamp;
    private final Map<String, Double> values;

    public PivotRow(LocalDateTime timestamp, Map<String, Double> values) {
        this.timestamp = timestamp;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    /**
     * Cell value by column name; null when the entity reported nothing usable
     */
    public Double getValue(String columnName) {
        return values.get(columnName);
    }

    public Map<String, Double> getValues() {
        return values;
    }
}
