package com.tbpivot.config;

import java.time.ZoneId;

/**
 * Backend safety caps applied to every payload regardless of user input.
 */
public class ExportLimits {

    public static final int MAX_ENTITIES = 500;
    public static final int MAX_KEYS = 100;
    public static final int MAX_POINTS_PER_KEY = 10000;

    // Conservative ThingsBoard server cap on aggregation intervals per request
    public static final int MAX_INTERVALS_PER_REQUEST = 700;

    public static final String DEFAULT_TIMEZONE = "Asia/Bangkok";

    private final int maxEntities;
    private final int maxKeys;
    private final int maxPointsPerKey;
    private final int maxIntervalsPerRequest;
    private final ZoneId defaultTimezone;

    public ExportLimits(int maxEntities, int maxKeys, int maxPointsPerKey,
                        int maxIntervalsPerRequest, ZoneId defaultTimezone) {
        if (maxEntities <= 0 || maxKeys <= 0 || maxPointsPerKey <= 0 || maxIntervalsPerRequest <= 0) {
            throw new IllegalArgumentException("Export limits must be positive");
        }
        this.maxEntities = maxEntities;
        this.maxKeys = maxKeys;
        this.maxPointsPerKey = maxPointsPerKey;
        this.maxIntervalsPerRequest = maxIntervalsPerRequest;
        this.defaultTimezone = defaultTimezone;
    }

    public static ExportLimits defaults() {
        return new ExportLimits(MAX_ENTITIES, MAX_KEYS, MAX_POINTS_PER_KEY,
                MAX_INTERVALS_PER_REQUEST, ZoneId.of(DEFAULT_TIMEZONE));
    }

    public int getMaxEntities() { return maxEntities; }
    public int getMaxKeys() { return maxKeys; }
    public int getMaxPointsPerKey() { return maxPointsPerKey; }
    public int getMaxIntervalsPerRequest() { return maxIntervalsPerRequest; }
    public ZoneId getDefaultTimezone() { return defaultTimezone; }
}
