package com.tbpivot.table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tbpivot.model.KeyedSeries;
import com.tbpivot.model.Point;

/**
 * Turns one entity's per-key point lists into rows keyed by timestamp.
 */
public class RowUnifier {

    private static final Logger logger = LoggerFactory.getLogger(RowUnifier.class);

    /**
     * Rows come out in the order their timestamps were first seen. A later value
     * for the same key and timestamp overwrites the earlier one; other keys of the
     * row are untouched.
     */
    public List<UnifiedRow> unify(String entityLabel, KeyedSeries series) {
        Map<Long, UnifiedRow> rows = new LinkedHashMap<>();
        int dropped = 0;

        for (String key : series.getKeys()) {
            for (Point point : series.getPoints(key)) {
                Long ts = point.getTimestamp();
                if (ts == null) {
                    dropped++;
                    continue;
                }
                rows.computeIfAbsent(ts, t -> new UnifiedRow(t, entityLabel))
                    .setValue(key, point.getValue());
            }
        }

        if (dropped > 0) {
            logger.debug("Dropped {} points without timestamp for {}", dropped, entityLabel);
        }
        return new ArrayList<>(rows.values());
    }
}
