package com.tbpivot.export;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tbpivot.config.ExportLimits;
import com.tbpivot.fetch.ChunkedFetcher;
import com.tbpivot.fetch.TelemetrySource;
import com.tbpivot.model.EntityRef;
import com.tbpivot.model.KeyedSeries;
import com.tbpivot.resample.AggregateTable;
import com.tbpivot.resample.Granularity;
import com.tbpivot.resample.PeriodResampler;
import com.tbpivot.table.PivotBuilder;
import com.tbpivot.table.PivotTable;
import com.tbpivot.table.RawTable;
import com.tbpivot.table.RowUnifier;
import com.tbpivot.table.UnifiedRow;

/**
 * Runs one export: fetch every entity, unify rows, build the raw and pivot
 * tables and resample the pivot into calendar periods. Any transport failure
 * aborts the whole run.
 */
public class PivotExportService {

    private static final Logger logger = LoggerFactory.getLogger(PivotExportService.class);

    private final ChunkedFetcher fetcher;
    private final PayloadParser payloadParser;
    private final RowUnifier rowUnifier = new RowUnifier();

    public PivotExportService(TelemetrySource source, ExportLimits limits) {
        this(source, limits, new PayloadParser(limits));
    }

    public PivotExportService(TelemetrySource source, ExportLimits limits, PayloadParser payloadParser) {
        this.fetcher = new ChunkedFetcher(source, limits.getMaxIntervalsPerRequest());
        this.payloadParser = payloadParser;
    }

    public ExportTables buildTables(Map<String, Object> payload) {
        return buildTables(payloadParser.parse(payload));
    }

    public ExportTables buildTables(ExportRequest request) {
        long startTime = System.currentTimeMillis();
        logger.info("Exporting {} keys for {} entities", request.getKeys().size(), request.getEntities().size());

        List<UnifiedRow> unifiedRows = new ArrayList<>();
        for (EntityRef entity : request.getEntities()) {
            KeyedSeries series = fetcher.fetch(entity, request.getKeys(), request.getStartTs(), request.getEndTs(),
                    request.getLimit(), request.getAggregation(), request.getIntervalMs());
            List<UnifiedRow> entityRows = rowUnifier.unify(entity.getName(), series);
            logger.debug("{}: {} points in {} rows", entity.getName(), series.countPoints(), entityRows.size());
            unifiedRows.addAll(entityRows);
        }

        if (unifiedRows.isEmpty()) {
            logger.warn("No telemetry returned for the requested entities and keys");
            return new ExportTables(request, RawTable.empty(), PivotTable.empty(),
                    new EnumMap<Granularity, AggregateTable>(Granularity.class));
        }

        RawTable raw = RawTable.fromUnifiedRows(unifiedRows, request.getKeys(),
                request.getTimezone(), request.getOrder());

        PivotBuilder pivotBuilder = new PivotBuilder(request.getTimezone(), request.getSnapIntervalMs(),
                request.getOrder(), request.getReportConfig().getColumnMap().keySet());
        PivotTable pivot = pivotBuilder.build(unifiedRows);

        Map<Granularity, AggregateTable> aggregates =
                new PeriodResampler(request.getReportConfig()).resampleAll(pivot);

        logger.info("Built {} raw rows, {} pivot rows x {} columns, aggregates {} in {} ms",
                raw.size(), pivot.size(), pivot.getColumns().size(), aggregates.keySet(),
                System.currentTimeMillis() - startTime);
        return new ExportTables(request, raw, pivot, aggregates);
    }
}
