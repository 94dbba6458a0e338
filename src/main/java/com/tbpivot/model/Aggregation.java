package com.tbpivot.model;

import java.util.Locale;

/**
 * Server-side aggregation modes of the ThingsBoard timeseries endpoint.
 */
public enum Aggregation {
    NONE,
    AVG,
    MIN,
    MAX,
    SUM,
    COUNT;

    public static Aggregation fromString(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        try {
            return Aggregation.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported aggregation: " + value, e);
        }
    }

    public boolean isActive() {
        return this != NONE;
    }
}
