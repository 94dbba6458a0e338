package com.tbpivot.table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * All values an entity reported at one timestamp, one entry per metric key.
 */
public class UnifiedRow {

    private final long timestamp;
    private final String entityLabel;
    private final Map<String, Double> values = new LinkedHashMap<>();

    public UnifiedRow(long timestamp, String entityLabel) {
        this.timestamp = timestamp;
        this.entityLabel = entityLabel;
    }

    void setValue(String key, Double value) {
        values.put(key, value);
    }

    /**
     * Epoch milliseconds exactly as returned by the API
     */
    public long getTimestamp() {
        return timestamp;
    }

    public String getEntityLabel() {
        return entityLabel;
    }

    /**
     * Metric key to value; a key may map to null when the API returned an empty value
     */
    public Map<String, Double> getValues() {
        return Collections.unmodifiableMap(values);
    }

    public boolean hasKey(String key) {
        return values.containsKey(key);
    }

    public Double getValue(String key) {
        return values.get(key);
    }

    @Override
    public String toString() {
        return "UnifiedRow{ts=" + timestamp + ", entity=" + entityLabel + ", values=" + values + "}";
    }
}
