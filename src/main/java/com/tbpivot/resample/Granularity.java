package com.tbpivot.resample;

import com.tbpivot.config.ReportConfig;

/**
 * Calendar periods aggregated tables are built for, in output order.
 */
public enum Granularity {
    DAY("daily", ReportConfig.SHEET_DAILY, "Daily"),
    WEEK("weekly", ReportConfig.SHEET_WEEKLY, "Weekly"),
    MONTH("monthly", ReportConfig.SHEET_MONTHLY, "Monthly"),
    YEAR("yearly", ReportConfig.SHEET_YEARLY, "Yearly");

    private final String key;
    private final String sheetOption;
    private final String defaultSheetName;

    Granularity(String key, String sheetOption, String defaultSheetName) {
        this.key = key;
        this.sheetOption = sheetOption;
        this.defaultSheetName = defaultSheetName;
    }

    public String getKey() {
        return key;
    }

    /**
     * Formatting option holding the sheet (file suffix) name of this granularity
     */
    public String getSheetOption() {
        return sheetOption;
    }

    public String getDefaultSheetName() {
        return defaultSheetName;
    }
}
