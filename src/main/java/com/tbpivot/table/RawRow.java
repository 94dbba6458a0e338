package com.tbpivot.table;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Row of the raw table: original API timestamp, shown as wall-clock time.
 */
public class RawRow {

    private final long epochMillis;
    private final LocalDateTime timestamp;
    private final String entityLabel;
    private final Map<String, Double> values;

    public RawRow(long epochMillis, LocalDateTime timestamp, String entityLabel, Map<String, Double> values) {
        this.epochMillis = epochMillis;
        this.timestamp = timestamp;
        this.entityLabel = entityLabel;
        this.values = values;
    }

    public long getEpochMillis() { return epochMillis; }
    public LocalDateTime getTimestamp() { return timestamp; }
    public String getEntityLabel() { return entityLabel; }
    public Map<String, Double> getValues() { return values; }

    public Double getValue(String key) {
        return values.get(key);
    }
}
