package com.tbpivot.util;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tbpivot.model.Point;

/**
 * Conversions shared by the telemetry client, the table builders and the exporter
 */
public class TelemetryUtils {

    private static final Logger logger = LoggerFactory.getLogger(TelemetryUtils.class);

    // Plain machine-readable output, no grouping separators
    private static final DecimalFormat DECIMAL_FORMAT =
            new DecimalFormat("0.##########", DecimalFormatSymbols.getInstance(Locale.ROOT));

    /**
     * Convert ThingsBoard {"ts": ..., "value": ...} objects to points.
     * Numeric strings are accepted; other values become null.
     */
    public static List<Point> extractPoints(String key, List<?> rawPoints) {
        List<Point> points = new ArrayList<>();
        if (rawPoints == null) {
            return points;
        }

        for (Object raw : rawPoints) {
            if (!(raw instanceof Map)) {
                logger.debug("Skipping malformed point for key {}: {}", key, raw);
                continue;
            }
            Map<?, ?> dataPoint = (Map<?, ?>) raw;
            points.add(new Point(toLong(dataPoint.get("ts")), toDouble(dataPoint.get("value"))));
        }
        return points;
    }

    public static Double toDouble(Object valueObj) {
        if (valueObj == null) {
            return null;
        }
        if (valueObj instanceof Number) {
            return ((Number) valueObj).doubleValue();
        }
        if (valueObj instanceof String) {
            String text = ((String) valueObj).trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                logger.debug("Non-numeric telemetry value '{}' treated as empty", text);
                return null;
            }
        }
        logger.debug("Unsupported telemetry value type {} treated as empty", valueObj.getClass().getSimpleName());
        return null;
    }

    public static Long toLong(Object valueObj) {
        if (valueObj instanceof Number) {
            return ((Number) valueObj).longValue();
        }
        if (valueObj instanceof String) {
            try {
                return Long.parseLong(((String) valueObj).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Epoch milliseconds as tz-naive wall-clock time in the given zone
     */
    public static LocalDateTime toLocalDateTime(long epochMillis, ZoneId zone) {
        return LocalDateTime.ofInstant(Instant.ofEpochMilli(epochMillis), zone);
    }

    /**
     * Start of the aggregation bucket a server-labelled midpoint belongs to
     */
    public static long snapToIntervalStart(long epochMillis, long intervalMs) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("Interval must be positive: " + intervalMs);
        }
        return epochMillis - Math.floorMod(epochMillis, intervalMs);
    }

    /**
     * Format a value for export; null becomes an empty string
     */
    public static String formatValue(Double value) {
        if (value == null || value.isNaN()) {
            return "";
        }
        synchronized (DECIMAL_FORMAT) {
            return DECIMAL_FORMAT.format(value);
        }
    }
}
