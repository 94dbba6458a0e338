package com.tbpivot.table;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.tbpivot.model.SortOrder;
import com.tbpivot.util.TelemetryUtils;

/**
 * Long-format table of every unified row across all entities, with the original
 * (never snapped) API timestamps.
 */
public class RawTable {

    public static final String TIMESTAMP_COLUMN = "Timestamp";
    public static final String ENTITY_COLUMN = "Asset Name";

    private final List<String> keyColumns;
    private final List<RawRow> rows;

    private RawTable(List<String> keyColumns, List<RawRow> rows) {
        this.keyColumns = Collections.unmodifiableList(keyColumns);
        this.rows = Collections.unmodifiableList(rows);
    }

    public static RawTable empty() {
        return new RawTable(new ArrayList<>(), new ArrayList<>());
    }

    /**
     * Key columns are the requested keys that occur in at least one row, in request
     * order. Rows are stably sorted by timestamp in the requested direction.
     */
    public static RawTable fromUnifiedRows(List<UnifiedRow> unifiedRows, List<String> requestedKeys,
                                           ZoneId zone, SortOrder order) {
        Set<String> observed = new LinkedHashSet<>();
        List<RawRow> rows = new ArrayList<>(unifiedRows.size());

        for (UnifiedRow row : unifiedRows) {
            observed.addAll(row.getValues().keySet());
            rows.add(new RawRow(row.getTimestamp(),
                    TelemetryUtils.toLocalDateTime(row.getTimestamp(), zone),
                    row.getEntityLabel(),
                    row.getValues()));
        }

        List<String> keyColumns = new ArrayList<>();
        for (String key : requestedKeys) {
            if (observed.contains(key)) {
                keyColumns.add(key);
            }
        }

        Comparator<RawRow> byTime = Comparator.comparing(RawRow::getTimestamp);
        rows.sort(order == SortOrder.DESC ? byTime.reversed() : byTime);

        return new RawTable(keyColumns, rows);
    }

    public List<String> getColumnNames() {
        List<String> columns = new ArrayList<>();
        columns.add(TIMESTAMP_COLUMN);
        columns.add(ENTITY_COLUMN);
        columns.addAll(keyColumns);
        return columns;
    }

    public List<String> getKeyColumns() {
        return keyColumns;
    }

    public List<RawRow> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
