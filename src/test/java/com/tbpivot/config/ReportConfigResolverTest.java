package com.tbpivot.config;

import static org.junit.jupiter.api.Assertions.*;

import java.time.DayOfWeek;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.tbpivot.resample.AggregationFunction;

public class ReportConfigResolverTest {

    private final ReportConfigResolver resolver = new ReportConfigResolver();
    private final ReportConfig defaults = ReportConfig.defaults();

    @Test
    public void testMissingOverridesKeepDefaults() {
        assertSame(defaults, resolver.resolve(defaults, null));
        assertSame(defaults, resolver.resolve(defaults, "not an object"));

        ReportConfig resolved = resolver.resolve(defaults, new HashMap<String, Object>());
        assertEquals(defaults.toMap(), resolved.toMap());
    }

    @Test
    public void testScalarsReplaced() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("filename", "energy.xlsx");
        overrides.put("filename_timestamp", false);

        ReportConfig resolved = resolver.resolve(defaults, overrides);

        assertEquals("energy.xlsx", resolved.getFilename());
        assertFalse(resolved.isFilenameTimestamp());
    }

    @Test
    public void testAggMapMergedOverDefaults() {
        Map<String, Object> aggMap = new HashMap<>();
        aggMap.put("kwh", "sum");
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("agg_map", aggMap);

        ReportConfig resolved = resolver.resolve(defaults, overrides);

        assertEquals(AggregationFunction.SUM, resolved.getAggMap().get("kwh"));
        assertEquals(AggregationFunction.MEAN, resolved.getAggMap().get("default"));
    }

    @Test
    public void testEmptySectionEmptiesIt() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("agg_map", new HashMap<String, Object>());
        overrides.put("formatting", new HashMap<String, Object>());

        ReportConfig resolved = resolver.resolve(defaults, overrides);

        assertTrue(resolved.getAggMap().isEmpty());
        assertTrue(resolved.getFormatting().isEmpty());
        // with nothing configured the lookup still ends at mean
        assertEquals(AggregationFunction.MEAN, resolved.aggregationFor("A kwh", "kwh"));
    }

    @Test
    public void testNullSectionKeepsDefaults() {
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("formatting", null);
        overrides.put("agg_map", null);
        overrides.put("sheets", null);

        ReportConfig resolved = resolver.resolve(defaults, overrides);

        assertEquals(defaults.getFormatting(), resolved.getFormatting());
        assertEquals(defaults.getAggMap(), resolved.getAggMap());
        assertEquals(DayOfWeek.SUNDAY, resolved.getSheets().getWeekStart());
    }

    @Test
    public void testFormattingMerged() {
        Map<String, Object> formatting = new HashMap<>();
        formatting.put("sheet_daily", "Per Day");
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("formatting", formatting);

        ReportConfig resolved = resolver.resolve(defaults, overrides);

        assertEquals("Per Day", resolved.getFormattingString(ReportConfig.SHEET_DAILY, null));
        assertEquals("Pivot", resolved.getFormattingString(ReportConfig.SHEET_PIVOT, null));
    }

    @Test
    public void testColumnMapReplacedInOrder() {
        Map<String, Object> columnMap = new LinkedHashMap<>();
        columnMap.put("Meter2 kwh", Arrays.asList("Building B", "Energy", "kWh"));
        columnMap.put("Meter1 kwh", "Energy A");
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("column_map", columnMap);

        ReportConfig resolved = resolver.resolve(defaults, overrides);

        assertEquals(Arrays.asList("Meter2 kwh", "Meter1 kwh"),
                Arrays.asList(resolved.getColumnMap().keySet().toArray()));
        assertEquals(Arrays.asList("Building B", "Energy", "kWh"), resolved.getColumnMap().get("Meter2 kwh"));
        assertEquals(Collections.singletonList("Energy A"), resolved.getColumnMap().get("Meter1 kwh"));

        Map<String, Object> cleared = new HashMap<>();
        cleared.put("column_map", null);
        assertTrue(resolver.resolve(resolved, cleared).getColumnMap().isEmpty());
    }

    @Test
    public void testSheetsMerged() {
        Map<String, Object> sheets = new HashMap<>();
        sheets.put("week_start", "Monday");
        sheets.put("partial_period", true);
        Map<String, Object> overrides = new HashMap<>();
        overrides.put("sheets", sheets);

        ReportConfig resolved = resolver.resolve(defaults, overrides);

        assertEquals(DayOfWeek.MONDAY, resolved.getSheets().getWeekStart());
        assertTrue(resolved.getSheets().isPartialPeriod());
    }

    @Test
    public void testInvalidValuesRejected() {
        Map<String, Object> badAgg = new HashMap<>();
        badAgg.put("agg_map", Collections.singletonMap("kwh", "median"));
        assertThrows(InvalidPayloadException.class, () -> resolver.resolve(defaults, badAgg));

        Map<String, Object> badWeek = new HashMap<>();
        badWeek.put("sheets", Collections.singletonMap("week_start", "Friday"));
        assertThrows(InvalidPayloadException.class, () -> resolver.resolve(defaults, badWeek));

        Map<String, Object> badSection = new HashMap<>();
        badSection.put("formatting", "bold");
        assertThrows(InvalidPayloadException.class, () -> resolver.resolve(defaults, badSection));

        Map<String, Object> blankName = new HashMap<>();
        blankName.put("filename", " ");
        assertThrows(InvalidPayloadException.class, () -> resolver.resolve(defaults, blankName));
    }

    @Test
    public void testAggregationLookupOrder() {
        Map<String, AggregationFunction> aggMap = new LinkedHashMap<>();
        aggMap.put("Meter1 kwh", AggregationFunction.MAX);
        aggMap.put("kwh", AggregationFunction.SUM);
        aggMap.put("default", AggregationFunction.LAST);
        ReportConfig config = defaults.toBuilder().aggMap(aggMap).build();

        assertEquals(AggregationFunction.MAX, config.aggregationFor("Meter1 kwh", "kwh"));
        assertEquals(AggregationFunction.SUM, config.aggregationFor("Meter2 kwh", "kwh"));
        assertEquals(AggregationFunction.LAST, config.aggregationFor("Meter2 temp", "temp"));
    }

    @Test
    public void testDefaultsAreImmutable() {
        List<String> labels = Arrays.asList("A", "B");
        ReportConfig config = defaults.toBuilder()
                .columnMap(Collections.singletonMap("Meter1 kwh", labels))
                .build();
        assertThrows(UnsupportedOperationException.class, () -> config.getColumnMap().get("Meter1 kwh").add("C"));
        assertThrows(UnsupportedOperationException.class, () -> config.getAggMap().clear());
    }
}
