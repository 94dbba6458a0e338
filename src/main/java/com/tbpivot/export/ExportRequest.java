package com.tbpivot.export;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.tbpivot.config.ReportConfig;
import com.tbpivot.model.Aggregation;
import com.tbpivot.model.EntityRef;
import com.tbpivot.model.SortOrder;

/**
 * A validated, normalized export request with the safety caps already applied.
 */
public class ExportRequest {

    private final ZoneId timezone;
    private final long startTs;
    private final long endTs;
    private final List<EntityRef> entities;
    private final List<String> keys;
    private final Aggregation aggregation;
    private final Long intervalMs;
    private final int limit;
    private final SortOrder order;
    private final ReportConfig reportConfig;

    public ExportRequest(ZoneId timezone, long startTs, long endTs, List<EntityRef> entities, List<String> keys,
                         Aggregation aggregation, Long intervalMs, int limit, SortOrder order,
                         ReportConfig reportConfig) {
        this.timezone = timezone;
        this.startTs = startTs;
        this.endTs = endTs;
        this.entities = Collections.unmodifiableList(new ArrayList<>(entities));
        this.keys = Collections.unmodifiableList(new ArrayList<>(keys));
        this.aggregation = aggregation;
        this.intervalMs = intervalMs;
        this.limit = limit;
        this.order = order;
        this.reportConfig = reportConfig;
    }

    public ZoneId getTimezone() { return timezone; }
    public long getStartTs() { return startTs; }
    public long getEndTs() { return endTs; }
    public List<EntityRef> getEntities() { return entities; }
    public List<String> getKeys() { return keys; }
    public Aggregation getAggregation() { return aggregation; }

    /**
     * Aggregation interval in milliseconds, null when none was requested
     */
    public Long getIntervalMs() { return intervalMs; }

    public int getLimit() { return limit; }
    public SortOrder getOrder() { return order; }
    public ReportConfig getReportConfig() { return reportConfig; }

    /**
     * Interval pivot timestamps are snapped to, or null when the server returns raw samples
     */
    public Long getSnapIntervalMs() {
        return aggregation.isActive() ? intervalMs : null;
    }

    @Override
    public String toString() {
        return "ExportRequest[" + entities.size() + " entities, " + keys.size() + " keys, "
                + startTs + ".." + endTs + ", agg=" + aggregation
                + (intervalMs == null ? "" : ", interval=" + intervalMs) + ", " + timezone + "]";
    }
}
