package com.tbpivot.export;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.tbpivot.config.ReportConfig;
import com.tbpivot.resample.AggregateTable;
import com.tbpivot.resample.Granularity;
import com.tbpivot.table.PivotTable;
import com.tbpivot.table.RawTable;

/**
 * Everything one export run produces, held in memory until written.
 */
public class ExportTables {

    private final ExportRequest request;
    private final RawTable raw;
    private final PivotTable pivot;
    private final Map<Granularity, AggregateTable> aggregates;

    public ExportTables(ExportRequest request, RawTable raw, PivotTable pivot,
                        Map<Granularity, AggregateTable> aggregates) {
        this.request = request;
        this.raw = raw;
        this.pivot = pivot;
        Map<Granularity, AggregateTable> copy = new EnumMap<>(Granularity.class);
        copy.putAll(aggregates);
        this.aggregates = Collections.unmodifiableMap(copy);
    }

    public ExportRequest getRequest() { return request; }
    public ReportConfig getConfig() { return request.getReportConfig(); }
    public RawTable getRaw() { return raw; }
    public PivotTable getPivot() { return pivot; }

    /**
     * Aggregate tables by granularity; granularities without a complete period are absent
     */
    public Map<Granularity, AggregateTable> getAggregates() { return aggregates; }

    public AggregateTable getAggregate(Granularity granularity) {
        return aggregates.get(granularity);
    }

    public boolean isEmpty() {
        return raw.isEmpty();
    }
}
