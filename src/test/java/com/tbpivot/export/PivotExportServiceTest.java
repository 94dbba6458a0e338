package com.tbpivot.export;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tbpivot.config.ExportLimits;
import com.tbpivot.fetch.TelemetrySource;
import com.tbpivot.model.Aggregation;
import com.tbpivot.model.EntityRef;
import com.tbpivot.model.KeyedSeries;
import com.tbpivot.model.Point;
import com.tbpivot.resample.AggregateTable;
import com.tbpivot.resample.Granularity;

public class PivotExportServiceTest {

    private static final long HOUR = 3_600_000L;
    // 2026-01-01T00:00:00Z
    private static final long BASE = 1767225600000L;

    private HourlyMidpointSource source;
    private PivotExportService service;

    @BeforeEach
    public void setUp() {
        source = new HourlyMidpointSource();
        service = new PivotExportService(source, new ExportLimits(500, 100, 10000, 24, ZoneId.of("UTC")));
    }

    @Test
    public void testAggregatedExport() {
        ExportTables tables = service.buildTables(payload("AVG", 3 * 24 * HOUR));

        // 72 hourly intervals in chunks of 24, for two entities
        assertEquals(6, source.requestCount);

        assertEquals(144, tables.getRaw().size());
        assertEquals(LocalDateTime.of(2026, 1, 1, 0, 30), tables.getRaw().getRows().get(0).getTimestamp());
        assertEquals(Arrays.asList("Timestamp", "Asset Name", "kwh"), tables.getRaw().getColumnNames());

        assertEquals(72, tables.getPivot().size());
        assertEquals(LocalDateTime.of(2026, 1, 1, 0, 0), tables.getPivot().getRows().get(0).getTimestamp());
        assertEquals(Arrays.asList("Timestamp", "Meter2 kwh", "Meter1 kwh"), tables.getPivot().getColumnNames());

        assertEquals(Collections.singleton(Granularity.DAY), tables.getAggregates().keySet());
        AggregateTable daily = tables.getAggregate(Granularity.DAY);
        assertEquals(Arrays.asList(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 2)), daily.getPeriodStarts());
        assertEquals(24.0, daily.getRows().get(0).getValue("Meter1 kwh"));
        assertEquals(48.0, daily.getRows().get(0).getValue("Meter2 kwh"));
    }

    @Test
    public void testRawSamplesAreNotSnapped() {
        ExportTables tables = service.buildTables(payload("NONE", 3 * 24 * HOUR));

        assertEquals(2, source.requestCount);
        assertEquals(LocalDateTime.of(2026, 1, 1, 0, 30), tables.getPivot().getRows().get(0).getTimestamp());
    }

    @Test
    public void testNoDataGivesEmptyTables() {
        source.empty = true;
        ExportTables tables = service.buildTables(payload("AVG", 3 * 24 * HOUR));

        assertTrue(tables.isEmpty());
        assertTrue(tables.getPivot().isEmpty());
        assertTrue(tables.getAggregates().isEmpty());
        assertEquals("tb_pivot_export.xlsx", tables.getConfig().getFilename());
    }

    @Test
    public void testTransportFailureAbortsRun() {
        source.failOnRequest = 2;
        assertThrows(IllegalStateException.class, () -> service.buildTables(payload("AVG", 3 * 24 * HOUR)));
    }

    private static Map<String, Object> payload(String agg, long rangeMs) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timezone", "UTC");

        Map<String, Object> timeEpoch = new HashMap<>();
        timeEpoch.put("startTs_ms", BASE);
        timeEpoch.put("endTs_ms", BASE + rangeMs);
        payload.put("timeEpoch", timeEpoch);

        List<Object> entities = new ArrayList<>();
        entities.add(entity("m-1", "Meter1"));
        entities.add(entity("m-2", "Meter2"));
        payload.put("entities", entities);
        payload.put("keys", Arrays.asList("kwh"));

        Map<String, Object> query = new HashMap<>();
        query.put("agg", agg);
        query.put("interval", HOUR);
        payload.put("query", query);

        Map<String, Object> reportConfig = new HashMap<>();
        reportConfig.put("agg_map", Collections.singletonMap("default", "sum"));
        reportConfig.put("column_map", Collections.singletonMap("Meter2 kwh", Arrays.asList("Building B", "Energy")));
        payload.put("reportConfig", reportConfig);
        return payload;
    }

    private static Map<String, Object> entity(String id, String name) {
        Map<String, Object> entity = new HashMap<>();
        entity.put("id", id);
        entity.put("name", name);
        return entity;
    }

    /**
     * One "kwh" value per hour labelled at the interval midpoint; Meter1 reports 1, Meter2 reports 2
     */
    private static class HourlyMidpointSource implements TelemetrySource {
        private int requestCount;
        private int failOnRequest = -1;
        private boolean empty;

        @Override
        public KeyedSeries fetch(EntityRef entity, List<String> keys, long startTs, long endTs,
                                 int limit, Aggregation aggregation, Long intervalMs) {
            requestCount++;
            if (requestCount == failOnRequest) {
                throw new IllegalStateException("connection reset");
            }
            KeyedSeries series = new KeyedSeries();
            if (empty) {
                return series;
            }
            double value = "Meter1".equals(entity.getName()) ? 1.0 : 2.0;
            for (long ts = startTs - Math.floorMod(startTs, HOUR) + HOUR / 2; ts <= endTs; ts += HOUR) {
                if (ts >= startTs) {
                    series.add("kwh", new Point(ts, value));
                }
            }
            return series;
        }
    }
}
