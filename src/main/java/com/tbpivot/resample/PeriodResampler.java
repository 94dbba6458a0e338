package com.tbpivot.resample;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tbpivot.config.ReportConfig;
import com.tbpivot.table.PivotColumn;
import com.tbpivot.table.PivotRow;
import com.tbpivot.table.PivotTable;

/**
 * Resamples the pivot table into daily, weekly, monthly and yearly tables.
 * Only periods the data fully covers produce a row; partial boundary periods
 * are always dropped.
 */
public class PeriodResampler {

    private static final Logger logger = LoggerFactory.getLogger(PeriodResampler.class);

    private final ReportConfig config;

    public PeriodResampler(ReportConfig config) {
        this.config = config;
    }

    /**
     * All granularities with at least one complete period, in DAY..YEAR order
     */
    public Map<Granularity, AggregateTable> resampleAll(PivotTable pivot) {
        Map<Granularity, AggregateTable> result = new EnumMap<>(Granularity.class);
        for (Granularity granularity : Granularity.values()) {
            AggregateTable table = resample(pivot, granularity);
            if (table.isEmpty()) {
                logger.info("No complete {} period in data range, omitting {} table",
                        granularity.getKey(), granularity.getKey());
            } else {
                result.put(granularity, table);
            }
        }
        return result;
    }

    public AggregateTable resample(PivotTable pivot, Granularity granularity) {
        List<String> columnNames = pivot.getDataColumnNames();
        if (pivot.isEmpty()) {
            return new AggregateTable(granularity, columnNames, new ArrayList<>());
        }

        // first/last need chronological order whatever the pivot sort
        List<PivotRow> rows = new ArrayList<>(pivot.getRows());
        rows.sort(Comparator.comparing(PivotRow::getTimestamp));
        LocalDateTime dataMin = rows.get(0).getTimestamp();
        LocalDateTime dataMax = rows.get(rows.size() - 1).getTimestamp();

        Map<String, AggregationFunction> functions = new LinkedHashMap<>();
        for (PivotColumn column : pivot.getColumns()) {
            functions.put(column.getName(), config.aggregationFor(column.getName(), column.getMetric()));
        }

        PeriodBoundaryCalculator calculator =
                new PeriodBoundaryCalculator(granularity, config.getSheets().getWeekStart());
        Period last = calculator.periodContaining(dataMax);

        List<AggregateRow> result = new ArrayList<>();
        int index = 0;
        Period period = calculator.periodContaining(dataMin);
        while (!period.getStart().isAfter(last.getStart())) {
            List<PivotRow> members = new ArrayList<>();
            while (index < rows.size() && period.contains(rows.get(index).getTimestamp())) {
                members.add(rows.get(index));
                index++;
            }

            if (isComplete(period, dataMin, dataMax)) {
                result.add(new AggregateRow(period.getStartDate(), aggregate(members, functions)));
            } else {
                logger.debug("Dropping incomplete period {}", period);
            }
            period = calculator.next(period);
        }

        logger.debug("{} table: {} rows from data between {} and {}",
                granularity.getKey(), result.size(), dataMin, dataMax);
        return new AggregateTable(granularity, columnNames, result);
    }

    /**
     * A period counts when it starts no earlier than the first data day, the data
     * reaches its completion mark, and it does not start on a day whose data
     * begins after midnight.
     */
    static boolean isComplete(Period period, LocalDateTime dataMin, LocalDateTime dataMax) {
        LocalDateTime firstDay = dataMin.toLocalDate().atStartOfDay();
        if (period.getStart().isBefore(firstDay)) {
            return false;
        }
        if (period.getCompletionMark().isAfter(dataMax)) {
            return false;
        }
        boolean startsOnFirstDataDay = period.getStartDate().equals(dataMin.toLocalDate());
        return !(startsOnFirstDataDay && !dataMin.equals(firstDay));
    }

    private Map<String, Double> aggregate(List<PivotRow> members, Map<String, AggregationFunction> functions) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (Map.Entry<String, AggregationFunction> entry : functions.entrySet()) {
            List<Double> cells = new ArrayList<>(members.size());
            for (PivotRow row : members) {
                cells.add(row.getValue(entry.getKey()));
            }
            values.put(entry.getKey(), entry.getValue().apply(cells));
        }
        return values;
    }
}
