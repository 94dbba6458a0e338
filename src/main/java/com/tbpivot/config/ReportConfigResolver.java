package com.tbpivot.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tbpivot.resample.AggregationFunction;

/**
 * Applies a payload's reportConfig on top of the defaults, section by section:
 * <ul>
 *   <li>section absent or null: defaults are kept</li>
 *   <li>section is an empty object: the section is emptied</li>
 *   <li>formatting, agg_map, sheets: merged over the defaults</li>
 *   <li>column_map: replaced entirely, since its order is significant</li>
 *   <li>filename, filename_timestamp: replaced when present</li>
 * </ul>
 */
public class ReportConfigResolver {

    private static final Logger logger = LoggerFactory.getLogger(ReportConfigResolver.class);

    public static final String FILENAME = "filename";
    public static final String FILENAME_TIMESTAMP = "filename_timestamp";
    public static final String FORMATTING = "formatting";
    public static final String COLUMN_MAP = "column_map";
    public static final String AGG_MAP = "agg_map";
    public static final String SHEETS = "sheets";

    public ReportConfig resolve(ReportConfig defaults, Object overrides) {
        if (!(overrides instanceof Map)) {
            if (overrides != null) {
                logger.warn("Ignoring reportConfig of type {}, expected an object",
                        overrides.getClass().getSimpleName());
            }
            return defaults;
        }

        Map<?, ?> rc = (Map<?, ?>) overrides;
        ReportConfig.Builder builder = defaults.toBuilder();

        if (rc.containsKey(FILENAME)) {
            Object filename = rc.get(FILENAME);
            builder.filename(filename == null ? null : filename.toString());
        }
        if (rc.containsKey(FILENAME_TIMESTAMP)) {
            builder.filenameTimestamp(toBoolean(rc.get(FILENAME_TIMESTAMP)));
        }

        Map<String, Object> formatting = asSection(rc.get(FORMATTING), FORMATTING);
        if (formatting != null) {
            builder.formatting(formatting.isEmpty() ? formatting : merge(defaults.getFormatting(), formatting));
        }

        if (rc.containsKey(COLUMN_MAP)) {
            Map<String, Object> columnMap = asSection(rc.get(COLUMN_MAP), COLUMN_MAP);
            builder.columnMap(parseColumnMap(columnMap));
        }

        Map<String, Object> aggMap = asSection(rc.get(AGG_MAP), AGG_MAP);
        if (aggMap != null) {
            Map<String, AggregationFunction> merged = aggMap.isEmpty()
                    ? new LinkedHashMap<>()
                    : new LinkedHashMap<>(defaults.getAggMap());
            merged.putAll(parseAggMap(aggMap));
            builder.aggMap(merged);
        }

        Map<String, Object> sheets = asSection(rc.get(SHEETS), SHEETS);
        if (sheets != null) {
            Map<String, Object> merged = sheets.isEmpty() ? sheets : merge(defaults.getSheets().toMap(), sheets);
            SheetSettings settings = SheetSettings.fromMap(merged);
            if (settings.isPartialPeriod()) {
                logger.debug("partial_period=true requested; aggregated tables still contain complete periods only");
            }
            builder.sheets(settings);
        }

        return builder.build();
    }

    private Map<String, Object> merge(Map<String, Object> base, Map<String, Object> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>(base);
        merged.putAll(overrides);
        return merged;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> asSection(Object value, String name) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new InvalidPayloadException("reportConfig." + name + " must be an object");
        }
        return new LinkedHashMap<>((Map<String, Object>) value);
    }

    private Map<String, List<String>> parseColumnMap(Map<String, Object> section) {
        Map<String, List<String>> columnMap = new LinkedHashMap<>();
        if (section == null) {
            return columnMap;
        }
        for (Map.Entry<String, Object> entry : section.entrySet()) {
            List<String> labels = new ArrayList<>();
            Object value = entry.getValue();
            if (value instanceof List) {
                for (Object label : (List<?>) value) {
                    labels.add(label == null ? "" : label.toString());
                }
            } else if (value != null) {
                labels.add(value.toString());
            }
            columnMap.put(entry.getKey(), labels);
        }
        return columnMap;
    }

    private Map<String, AggregationFunction> parseAggMap(Map<String, Object> section) {
        Map<String, AggregationFunction> aggMap = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : section.entrySet()) {
            Object name = entry.getValue();
            if (name == null || name.toString().isBlank()) {
                continue;
            }
            try {
                aggMap.put(entry.getKey(), AggregationFunction.fromName(name.toString()));
            } catch (IllegalArgumentException e) {
                throw new InvalidPayloadException("reportConfig.agg_map." + entry.getKey() + ": " + e.getMessage(), e);
            }
        }
        return aggMap;
    }

    private boolean toBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }
}
