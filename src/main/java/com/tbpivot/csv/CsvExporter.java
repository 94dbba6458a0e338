package com.tbpivot.csv;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tbpivot.config.ReportConfig;
import com.tbpivot.export.ExportTables;
import com.tbpivot.resample.AggregateRow;
import com.tbpivot.resample.AggregateTable;
import com.tbpivot.resample.Granularity;
import com.tbpivot.table.PivotRow;
import com.tbpivot.table.PivotTable;
import com.tbpivot.table.RawRow;
import com.tbpivot.table.RawTable;
import com.tbpivot.util.TelemetryUtils;

/**
 * Exports the tables of one run to CSV, one file per table
 */
public class CsvExporter {

    private static final Logger logger = LoggerFactory.getLogger(CsvExporter.class);

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final String DEFAULT_DATETIME_FORMAT = "yyyy-MM-dd HH:mm:ss";
    private static final String DEFAULT_DATE_FORMAT = "yyyy-MM-dd";

    private final Clock clock;

    public CsvExporter() {
        this(Clock.systemDefaultZone());
    }

    public CsvExporter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Write raw, pivot and every present aggregate table into the output directory
     *
     * @return the files written, in table order
     */
    public List<File> exportAll(ExportTables tables, File outputDir) throws IOException {
        Files.createDirectories(outputDir.toPath());
        ReportConfig config = tables.getConfig();
        String baseName = baseFileName(config);

        List<File> written = new ArrayList<>();
        written.add(exportRaw(tables.getRaw(), config,
                new File(outputDir, tableFileName(baseName, config, ReportConfig.SHEET_RAW, "Raw Data"))));
        written.add(exportPivot(tables.getPivot(), config,
                new File(outputDir, tableFileName(baseName, config, ReportConfig.SHEET_PIVOT, "Pivot"))));

        for (Map.Entry<Granularity, AggregateTable> entry : tables.getAggregates().entrySet()) {
            Granularity granularity = entry.getKey();
            String fileName = tableFileName(baseName, config, granularity.getSheetOption(),
                    granularity.getDefaultSheetName());
            written.add(exportAggregate(entry.getValue(), config, new File(outputDir, fileName)));
        }
        return written;
    }

    public File exportRaw(RawTable table, ReportConfig config, File file) throws IOException {
        DateTimeFormatter formatter = formatter(config, ReportConfig.DATETIME_FORMAT, DEFAULT_DATETIME_FORMAT);

        try (Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
            writeRow(writer, table.getColumnNames());
            for (RawRow row : table.getRows()) {
                List<String> cells = new ArrayList<>();
                cells.add(formatter.format(row.getTimestamp()));
                cells.add(row.getEntityLabel());
                for (String key : table.getKeyColumns()) {
                    cells.add(TelemetryUtils.formatValue(row.getValue(key)));
                }
                writeRow(writer, cells);
            }
        }
        logger.info("Raw data ({} rows) exported to {}", table.size(), file);
        return file;
    }

    public File exportPivot(PivotTable table, ReportConfig config, File file) throws IOException {
        DateTimeFormatter formatter = formatter(config, ReportConfig.DATETIME_FORMAT, DEFAULT_DATETIME_FORMAT);
        List<String> dataColumns = table.getDataColumnNames();

        try (Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
            for (List<String> headerRow : resolveHeaders(table.getColumnNames(), config.getColumnMap())) {
                writeRow(writer, headerRow);
            }
            for (PivotRow row : table.getRows()) {
                List<String> cells = new ArrayList<>();
                cells.add(formatter.format(row.getTimestamp()));
                for (String column : dataColumns) {
                    cells.add(TelemetryUtils.formatValue(row.getValue(column)));
                }
                writeRow(writer, cells);
            }
        }
        logger.info("Pivot ({} rows, {} columns) exported to {}", table.size(), dataColumns.size(), file);
        return file;
    }

    public File exportAggregate(AggregateTable table, ReportConfig config, File file) throws IOException {
        DateTimeFormatter formatter = formatter(config, ReportConfig.DATE_FORMAT, DEFAULT_DATE_FORMAT);
        List<String> dataColumns = table.getDataColumnNames();

        try (Writer writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
            for (List<String> headerRow : resolveHeaders(table.getColumnNames(), config.getColumnMap())) {
                writeRow(writer, headerRow);
            }
            for (AggregateRow row : table.getRows()) {
                List<String> cells = new ArrayList<>();
                cells.add(formatter.format(row.getPeriodStart()));
                for (String column : dataColumns) {
                    cells.add(TelemetryUtils.formatValue(row.getValue(column)));
                }
                writeRow(writer, cells);
            }
        }
        logger.info("{} aggregates ({} periods) exported to {}",
                table.getGranularity().getDefaultSheetName(), table.size(), file);
        return file;
    }

    /**
     * Header rows for the given columns, top row first. Mapped columns use their
     * label list; other data columns split into entity and metric rows. Every
     * column is padded with blanks to the deepest header.
     */
    public static List<List<String>> resolveHeaders(List<String> columns, Map<String, List<String>> columnMap) {
        Map<String, List<String>> resolved = new LinkedHashMap<>();
        int depth = 1;
        for (String column : columns) {
            List<String> labels;
            if (PivotTable.TIMESTAMP_COLUMN.equals(column) || AggregateTable.DATE_COLUMN.equals(column)) {
                labels = Collections.singletonList(column);
            } else if (columnMap.containsKey(column) && !columnMap.get(column).isEmpty()) {
                labels = columnMap.get(column);
            } else {
                int split = column.indexOf(' ');
                labels = split < 0
                        ? Collections.singletonList(column)
                        : List.of(column.substring(0, split), column.substring(split + 1));
            }
            resolved.put(column, labels);
            depth = Math.max(depth, labels.size());
        }

        List<List<String>> rows = new ArrayList<>();
        for (int level = 0; level < depth; level++) {
            List<String> row = new ArrayList<>(columns.size());
            for (List<String> labels : resolved.values()) {
                row.add(level < labels.size() ? labels.get(level) : "");
            }
            rows.add(row);
        }
        return rows;
    }

    String baseFileName(ReportConfig config) {
        String name = config.getFilename();
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        if (config.isFilenameTimestamp()) {
            name = name + "_" + FILE_TIMESTAMP.format(LocalDateTime.now(clock));
        }
        return name;
    }

    private static String tableFileName(String baseName, ReportConfig config, String sheetOption, String fallback) {
        String sheetName = config.getFormattingString(sheetOption, fallback);
        return baseName + "_" + sheetName.replaceAll("[^\\w-]+", "_") + ".csv";
    }

    private static DateTimeFormatter formatter(ReportConfig config, String option, String fallback) {
        String pattern = config.getFormattingString(option, fallback);
        if (isSpreadsheetPattern(pattern)) {
            logger.warn("{} pattern '{}' uses spreadsheet tokens, using {}", option, pattern, fallback);
            return DateTimeFormatter.ofPattern(fallback);
        }
        try {
            return DateTimeFormatter.ofPattern(pattern);
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid {} pattern '{}', using {}", option, pattern, fallback);
            return DateTimeFormatter.ofPattern(fallback);
        }
    }

    /**
     * True for patterns written with spreadsheet month tokens ("yyyy-mm-dd"): a date
     * field with lowercase mm and no uppercase M.
     */
    static boolean isSpreadsheetPattern(String pattern) {
        boolean hasDateField = pattern.indexOf('y') >= 0 || pattern.indexOf('d') >= 0;
        return hasDateField && pattern.contains("mm") && pattern.indexOf('M') < 0;
    }

    private static void writeRow(Writer writer, List<String> cells) throws IOException {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                line.append(',');
            }
            line.append(escape(cells.get(i)));
        }
        writer.write(line.toString());
        writer.write("\n");
    }

    static String escape(String cell) {
        if (cell == null) {
            return "";
        }
        if (cell.indexOf(',') >= 0 || cell.indexOf('"') >= 0 || cell.indexOf('\n') >= 0 || cell.indexOf('\r') >= 0) {
            return "\"" + cell.replace("\"", "\"\"") + "\"";
        }
        return cell;
    }
}
