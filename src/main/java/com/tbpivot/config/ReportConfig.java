package com.tbpivot.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.tbpivot.resample.AggregationFunction;

/**
 * Effective report configuration of one export run: the built-in defaults with
 * the payload's reportConfig applied on top. Immutable; use {@link Builder} to
 * derive a modified copy.
 */
public class ReportConfig {

    public static final String DEFAULT_AGG_KEY = "default";

    // Formatting option names read by the exporter
    public static final String SHEET_RAW = "sheet_raw";
    public static final String SHEET_PIVOT = "sheet_pivot";
    public static final String SHEET_DAILY = "sheet_daily";
    public static final String SHEET_WEEKLY = "sheet_weekly";
    public static final String SHEET_MONTHLY = "sheet_monthly";
    public static final String SHEET_YEARLY = "sheet_yearly";
    public static final String DATETIME_FORMAT = "datetime_format";
    public static final String DATE_FORMAT = "date_format";

    private final String filename;
    private final boolean filenameTimestamp;
    private final Map<String, List<String>> columnMap;
    private final Map<String, AggregationFunction> aggMap;
    private final SheetSettings sheets;
    private final Map<String, Object> formatting;

    private ReportConfig(Builder builder) {
        this.filename = builder.filename;
        this.filenameTimestamp = builder.filenameTimestamp;

        Map<String, List<String>> columns = new LinkedHashMap<>();
        builder.columnMap.forEach((column, labels) ->
                columns.put(column, Collections.unmodifiableList(new ArrayList<>(labels))));
        this.columnMap = Collections.unmodifiableMap(columns);

        this.aggMap = Collections.unmodifiableMap(new LinkedHashMap<>(builder.aggMap));
        this.sheets = builder.sheets;
        this.formatting = Collections.unmodifiableMap(new LinkedHashMap<>(builder.formatting));
    }

    /**
     * Built-in defaults applied when the payload carries no reportConfig.
     */
    public static ReportConfig defaults() {
        Map<String, Object> formatting = new LinkedHashMap<>();
        formatting.put(SHEET_RAW, "Raw Data");
        formatting.put(SHEET_PIVOT, "Pivot");
        formatting.put(SHEET_DAILY, "Daily");
        formatting.put(SHEET_WEEKLY, "Weekly");
        formatting.put(SHEET_MONTHLY, "Monthly");
        formatting.put(SHEET_YEARLY, "Yearly");
        formatting.put("number_format", "#,##0.00");
        formatting.put(DATETIME_FORMAT, "yyyy-MM-dd HH:mm:ss");
        formatting.put(DATE_FORMAT, "yyyy-MM-dd");

        Map<String, AggregationFunction> aggMap = new LinkedHashMap<>();
        aggMap.put(DEFAULT_AGG_KEY, AggregationFunction.MEAN);

        return builder()
                .filename("tb_pivot_export.xlsx")
                .filenameTimestamp(true)
                .columnMap(Collections.emptyMap())
                .aggMap(aggMap)
                .sheets(SheetSettings.defaults())
                .formatting(formatting)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .filename(filename)
                .filenameTimestamp(filenameTimestamp)
                .columnMap(columnMap)
                .aggMap(aggMap)
                .sheets(sheets)
                .formatting(formatting);
    }

    public String getFilename() { return filename; }
    public boolean isFilenameTimestamp() { return filenameTimestamp; }

    /**
     * Pivot column name to header labels (top to bottom), in declared order
     */
    public Map<String, List<String>> getColumnMap() { return columnMap; }

    public Map<String, AggregationFunction> getAggMap() { return aggMap; }
    public SheetSettings getSheets() { return sheets; }
    public Map<String, Object> getFormatting() { return formatting; }

    public String getFormattingString(String name, String fallback) {
        Object value = formatting.get(name);
        return value == null ? fallback : value.toString();
    }

    /**
     * Aggregation function for a pivot column: an entry for the full column name
     * wins, then one for the metric key, then "default", then mean.
     */
    public AggregationFunction aggregationFor(String columnName, String metricKey) {
        AggregationFunction function = aggMap.get(columnName);
        if (function == null && metricKey != null) {
            function = aggMap.get(metricKey);
        }
        if (function == null) {
            function = aggMap.get(DEFAULT_AGG_KEY);
        }
        return function == null ? AggregationFunction.MEAN : function;
    }

    /**
     * Plain map view, shaped like the reportConfig payload section
     */
    public Map<String, Object> toMap() {
        Map<String, Object> aggNames = new LinkedHashMap<>();
        aggMap.forEach((key, function) -> aggNames.put(key, function.getName()));

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("filename", filename);
        map.put("filename_timestamp", filenameTimestamp);
        map.put("column_map", columnMap);
        map.put("agg_map", aggNames);
        map.put("sheets", sheets.toMap());
        map.put("formatting", formatting);
        return map;
    }

    public static class Builder {
        private String filename;
        private boolean filenameTimestamp;
        private Map<String, List<String>> columnMap = new LinkedHashMap<>();
        private Map<String, AggregationFunction> aggMap = new LinkedHashMap<>();
        private SheetSettings sheets = SheetSettings.defaults();
        private Map<String, Object> formatting = new LinkedHashMap<>();

        public Builder filename(String filename) {
            this.filename = filename;
            return this;
        }

        public Builder filenameTimestamp(boolean filenameTimestamp) {
            this.filenameTimestamp = filenameTimestamp;
            return this;
        }

        public Builder columnMap(Map<String, List<String>> columnMap) {
            this.columnMap = new LinkedHashMap<>(columnMap);
            return this;
        }

        public Builder aggMap(Map<String, AggregationFunction> aggMap) {
            this.aggMap = new LinkedHashMap<>(aggMap);
            return this;
        }

        public Builder sheets(SheetSettings sheets) {
            this.sheets = sheets;
            return this;
        }

        public Builder formatting(Map<String, Object> formatting) {
            this.formatting = new LinkedHashMap<>(formatting);
            return this;
        }

        public ReportConfig build() {
            if (filename == null || filename.isBlank()) {
                throw new InvalidPayloadException("Report filename must not be empty");
            }
            return new ReportConfig(this);
        }
    }
}
