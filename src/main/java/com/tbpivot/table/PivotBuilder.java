package com.tbpivot.table;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tbpivot.model.SortOrder;
import com.tbpivot.util.TelemetryUtils;

/**
 * Reshapes unified rows of all entities into the wide pivot table.
 *
 * <p>Aggregated ThingsBoard data is labelled with the midpoint of each interval;
 * when a snap interval is given, every timestamp is moved back to the start of
 * its interval before grouping. When several rows land on the same timestamp the
 * first non-null value per column wins.
 */
public class PivotBuilder {

    private static final Logger logger = LoggerFactory.getLogger(PivotBuilder.class);

    private final ZoneId zone;
    private final Long snapIntervalMs;
    private final SortOrder order;
    private final List<String> preferredColumnOrder;

    /**
     * @param snapIntervalMs interval to snap timestamps to, or null to keep them as returned
     * @param preferredColumnOrder column names placed first, in this order, when present
     */
    public PivotBuilder(ZoneId zone, Long snapIntervalMs, SortOrder order, Collection<String> preferredColumnOrder) {
        if (snapIntervalMs != null && snapIntervalMs <= 0) {
            throw new IllegalArgumentException("Snap interval must be positive: " + snapIntervalMs);
        }
        this.zone = zone;
        this.snapIntervalMs = snapIntervalMs;
        this.order = order;
        this.preferredColumnOrder = new ArrayList<>(preferredColumnOrder);
    }

    public PivotTable build(List<UnifiedRow> unifiedRows) {
        Map<LocalDateTime, Map<String, Double>> cellsByTime = new LinkedHashMap<>();
        Map<String, PivotColumn> columnsByName = new LinkedHashMap<>();
        int collisions = 0;

        for (UnifiedRow row : unifiedRows) {
            long pivotTs = snapIntervalMs == null
                    ? row.getTimestamp()
                    : TelemetryUtils.snapToIntervalStart(row.getTimestamp(), snapIntervalMs);
            LocalDateTime timestamp = TelemetryUtils.toLocalDateTime(pivotTs, zone);

            for (Map.Entry<String, Double> entry : row.getValues().entrySet()) {
                Double value = entry.getValue();
                if (value == null || value.isNaN()) {
                    continue;
                }
                PivotColumn column = new PivotColumn(row.getEntityLabel(), entry.getKey());
                columnsByName.putIfAbsent(column.getName(), column);

                Map<String, Double> cells = cellsByTime.computeIfAbsent(timestamp, t -> new LinkedHashMap<>());
                if (cells.putIfAbsent(column.getName(), value) != null) {
                    collisions++;
                }
            }
        }

        if (collisions > 0) {
            logger.debug("{} values collided on an existing pivot cell and were ignored", collisions);
        }

        List<PivotColumn> columns = orderColumns(columnsByName);

        List<LocalDateTime> timestamps = new ArrayList<>(cellsByTime.keySet());
        Comparator<LocalDateTime> byTime = Comparator.naturalOrder();
        timestamps.sort(order == SortOrder.DESC ? byTime.reversed() : byTime);

        List<PivotRow> rows = new ArrayList<>(timestamps.size());
        for (LocalDateTime timestamp : timestamps) {
            rows.add(new PivotRow(timestamp, cellsByTime.get(timestamp)));
        }

        logger.debug("Pivot built: {} rows x {} columns", rows.size(), columns.size());
        return new PivotTable(columns, rows);
    }

    private List<PivotColumn> orderColumns(Map<String, PivotColumn> columnsByName) {
        List<PivotColumn> ordered = new ArrayList<>();
        Set<String> placed = new LinkedHashSet<>();

        for (String name : preferredColumnOrder) {
            PivotColumn column = columnsByName.get(name);
            if (column != null && placed.add(name)) {
                ordered.add(column);
            }
        }

        List<PivotColumn> remaining = new ArrayList<>();
        for (PivotColumn column : columnsByName.values()) {
            if (!placed.contains(column.getName())) {
                remaining.add(column);
            }
        }
        remaining.sort(PivotColumn.BY_ENTITY_THEN_METRIC);
        ordered.addAll(remaining);
        return ordered;
    }
}
