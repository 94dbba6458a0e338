package com.tbpivot.export;

import static org.junit.jupiter.api.Assertions.*;

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
import com.tbpivot.config.InvalidPayloadException;
import com.tbpivot.model.Aggregation;
import com.tbpivot.model.EntityRef;
import com.tbpivot.model.SortOrder;
import com.tbpivot.resample.AggregationFunction;

public class PayloadParserTest {

    private PayloadParser parser;

    @BeforeEach
    public void setUp() {
        parser = new PayloadParser(new ExportLimits(3, 2, 1000, 700, ZoneId.of("Asia/Bangkok")));
    }

    @Test
    public void testMinimalPayloadDefaults() {
        ExportRequest request = parser.parse(payload());

        assertEquals(ZoneId.of("Asia/Bangkok"), request.getTimezone());
        assertEquals(1767225600000L, request.getStartTs());
        assertEquals(1767830400000L, request.getEndTs());
        assertEquals(Aggregation.NONE, request.getAggregation());
        assertNull(request.getIntervalMs());
        assertNull(request.getSnapIntervalMs());
        assertEquals(1000, request.getLimit());
        assertEquals(SortOrder.ASC, request.getOrder());
        assertEquals("tb_pivot_export.xlsx", request.getReportConfig().getFilename());

        EntityRef entity = request.getEntities().get(0);
        assertEquals("ASSET", entity.getType());
        assertEquals("id-1", entity.getId());
        assertEquals("Meter1", entity.getName());
    }

    @Test
    public void testQueryOptions() {
        Map<String, Object> payload = payload();
        Map<String, Object> query = new HashMap<>();
        query.put("agg", "avg");
        query.put("interval", 3600000);
        query.put("limit", 50000);
        query.put("order", "desc");
        payload.put("query", query);
        payload.put("timezone", "UTC");

        ExportRequest request = parser.parse(payload);

        assertEquals(Aggregation.AVG, request.getAggregation());
        assertEquals(3600000L, request.getIntervalMs());
        assertEquals(3600000L, request.getSnapIntervalMs());
        assertEquals(1000, request.getLimit());
        assertEquals(SortOrder.DESC, request.getOrder());
        assertEquals(ZoneId.of("UTC"), request.getTimezone());
    }

    @Test
    public void testEntitiesNormalizedAndCapped() {
        Map<String, Object> payload = payload();
        List<Object> entities = new ArrayList<>();
        entities.add(entity("device", "d-1", null));
        entities.add(entity(null, null, "No id"));
        entities.add(entity(null, "a-2", "Meter2"));
        entities.add(entity(null, "a-3", "Meter3"));
        payload.put("entities", entities);

        List<EntityRef> parsed = parser.parse(payload).getEntities();

        // capped to 3 before entries without id are dropped
        assertEquals(2, parsed.size());
        assertEquals("DEVICE", parsed.get(0).getType());
        assertEquals("d-1", parsed.get(0).getName());
        assertEquals("Meter2", parsed.get(1).getName());
    }

    @Test
    public void testKeysNormalizedAndCapped() {
        Map<String, Object> payload = payload();
        payload.put("keys", Arrays.asList(null, 42, "kwh"));
        // the cap applies before blank keys are dropped
        assertEquals(Arrays.asList("42"), parser.parse(payload).getKeys());

        payload.put("keys", Arrays.asList(" ", null, "kwh"));
        assertThrows(InvalidPayloadException.class, () -> parser.parse(payload));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testMissingTimeRange() {
        Map<String, Object> payload = payload();
        payload.remove("timeEpoch");
        assertThrows(InvalidPayloadException.class, () -> parser.parse(payload));

        Map<String, Object> partial = payload();
        ((Map<String, Object>) partial.get("timeEpoch")).remove("endTs_ms");
        InvalidPayloadException e = assertThrows(InvalidPayloadException.class, () -> parser.parse(partial));
        assertTrue(e.getMessage().contains("endTs_ms"));

        assertThrows(InvalidPayloadException.class, () -> parser.parse(null));
    }

    @Test
    public void testInvalidValuesRejected() {
        Map<String, Object> reversed = payload();
        Map<String, Object> timeEpoch = new HashMap<>();
        timeEpoch.put("startTs_ms", 2000L);
        timeEpoch.put("endTs_ms", 1000L);
        reversed.put("timeEpoch", timeEpoch);
        assertThrows(InvalidPayloadException.class, () -> parser.parse(reversed));

        Map<String, Object> noEntities = payload();
        noEntities.put("entities", new ArrayList<>());
        assertThrows(InvalidPayloadException.class, () -> parser.parse(noEntities));

        Map<String, Object> noKeys = payload();
        noKeys.put("keys", Arrays.asList("", "  "));
        assertThrows(InvalidPayloadException.class, () -> parser.parse(noKeys));

        Map<String, Object> badAgg = payload();
        badAgg.put("query", Collections.singletonMap("agg", "MEDIAN"));
        assertThrows(InvalidPayloadException.class, () -> parser.parse(badAgg));

        Map<String, Object> badZone = payload();
        badZone.put("timezone", "Mars/Olympus");
        assertThrows(InvalidPayloadException.class, () -> parser.parse(badZone));
    }

    @Test
    public void testReportConfigResolved() {
        Map<String, Object> payload = payload();
        Map<String, Object> reportConfig = new HashMap<>();
        reportConfig.put("agg_map", Collections.singletonMap("kwh", "sum"));
        payload.put("reportConfig", reportConfig);

        ExportRequest request = parser.parse(payload);

        assertEquals(AggregationFunction.SUM, request.getReportConfig().getAggMap().get("kwh"));
        assertEquals(AggregationFunction.MEAN, request.getReportConfig().getAggMap().get("default"));
    }

    static Map<String, Object> payload() {
        Map<String, Object> timeEpoch = new HashMap<>();
        timeEpoch.put("startTs_ms", 1767225600000L);
        timeEpoch.put("endTs_ms", "1767830400000");

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timeEpoch", timeEpoch);
        payload.put("entities", new ArrayList<Object>(Arrays.asList(entity(null, "id-1", "Meter1"))));
        payload.put("keys", new ArrayList<Object>(Arrays.asList("kwh")));
        return payload;
    }

    private static Map<String, Object> entity(String type, String id, String name) {
        Map<String, Object> entity = new HashMap<>();
        entity.put("type", type);
        entity.put("id", id);
        entity.put("name", name);
        return entity;
    }
}
