package com.tbpivot.config;

import java.time.DayOfWeek;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Behaviour of the aggregated (daily/weekly/monthly/yearly) tables.
 */
public class SheetSettings {

    public static final String WEEK_START = "week_start";
    public static final String PARTIAL_PERIOD = "partial_period";

    private final DayOfWeek weekStart;
    private final boolean partialPeriod;

    public SheetSettings(DayOfWeek weekStart, boolean partialPeriod) {
        if (weekStart != DayOfWeek.SUNDAY && weekStart != DayOfWeek.MONDAY) {
            throw new InvalidPayloadException("Week start must be Sunday or Monday, got " + weekStart);
        }
        this.weekStart = weekStart;
        this.partialPeriod = partialPeriod;
    }

    public static SheetSettings defaults() {
        return new SheetSettings(DayOfWeek.SUNDAY, false);
    }

    /**
     * Build from a report-config "sheets" section. Missing entries fall back to
     * Sunday / no partial periods.
     */
    public static SheetSettings fromMap(Map<String, Object> section) {
        DayOfWeek weekStart = DayOfWeek.SUNDAY;
        boolean partialPeriod = false;

        if (section != null) {
            Object ws = section.get(WEEK_START);
            if (ws != null) {
                weekStart = parseWeekStart(ws.toString());
            }
            Object pp = section.get(PARTIAL_PERIOD);
            if (pp instanceof Boolean) {
                partialPeriod = (Boolean) pp;
            } else if (pp != null) {
                partialPeriod = Boolean.parseBoolean(pp.toString());
            }
        }
        return new SheetSettings(weekStart, partialPeriod);
    }

    static DayOfWeek parseWeekStart(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("sunday".equals(normalized)) {
            return DayOfWeek.SUNDAY;
        }
        if ("monday".equals(normalized)) {
            return DayOfWeek.MONDAY;
        }
        throw new InvalidPayloadException("Unsupported week_start '" + value + "' (expected Sunday or Monday)");
    }

    public DayOfWeek getWeekStart() {
        return weekStart;
    }

    /**
     * Carried for completeness of the report config. Aggregated tables always
     * exclude partial periods regardless of this flag.
     */
    public boolean isPartialPeriod() {
        return partialPeriod;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        String day = weekStart.name().toLowerCase(Locale.ROOT);
        map.put(WEEK_START, Character.toUpperCase(day.charAt(0)) + day.substring(1));
        map.put(PARTIAL_PERIOD, partialPeriod);
        return map;
    }
}
