package com.tbpivot.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tbpivot.config.PivotExportConfig;
import com.tbpivot.fetch.TelemetrySource;
import com.tbpivot.model.Aggregation;
import com.tbpivot.model.EntityRef;
import com.tbpivot.model.KeyedSeries;
import com.tbpivot.model.Point;

public class PivotExportCliTest {

    private static final long HOUR = 3_600_000L;
    private static final long BASE = 1767225600000L;

    @TempDir
    Path dir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private List<PivotExportConfig> configsSeen;

    @BeforeEach
    public void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        configsSeen = new ArrayList<>();
    }

    @Test
    public void testExportWritesFiles() throws IOException {
        File payload = writePayload("{\"timezone\":\"UTC\","
                + "\"timeEpoch\":{\"startTs_ms\":" + BASE + ",\"endTs_ms\":" + (BASE + 48 * HOUR) + "},"
                + "\"entities\":[{\"id\":\"m-1\",\"name\":\"Meter1\"}],"
                + "\"keys\":[\"kwh\"],"
                + "\"reportConfig\":{\"filename\":\"plant.xlsx\",\"filename_timestamp\":false}}");
        File outputDir = dir.resolve("exports").toFile();

        int exitCode = PivotExportCli.run(cli(), new String[] {
                "--tbUrl", "http://cli.local", "-o", outputDir.getPath(), payload.getPath()});

        assertEquals(0, exitCode, err.toString());
        assertEquals("http://cli.local", configsSeen.get(0).getTbUrl());
        assertTrue(new File(outputDir, "plant_Raw_Data.csv").exists());
        assertTrue(new File(outputDir, "plant_Pivot.csv").exists());
        assertTrue(new File(outputDir, "plant_Daily.csv").exists());
        assertFalse(new File(outputDir, "plant_Weekly.csv").exists());

        String printed = out.toString(StandardCharsets.UTF_8.name());
        assertTrue(printed.contains("\"filename\" : \"plant.xlsx\""));
        assertTrue(printed.contains("plant_Daily.csv"));
    }

    @Test
    public void testInvalidPayloadFailsBeforeFetching() throws IOException {
        File payload = writePayload("{\"timeEpoch\":{\"startTs_ms\":1},\"entities\":[],\"keys\":[]}");

        int exitCode = PivotExportCli.run(cli(), new String[] {payload.getPath()});

        assertEquals(1, exitCode);
        assertTrue(configsSeen.isEmpty());
        assertTrue(err.toString(StandardCharsets.UTF_8.name()).contains("invalid payload"));
    }

    @Test
    public void testUnreadablePayload() throws IOException {
        File payload = writePayload("not json");

        assertEquals(1, PivotExportCli.run(cli(), new String[] {payload.getPath()}));
        assertEquals(1, PivotExportCli.run(cli(), new String[] {dir.resolve("missing.json").toString()}));
    }

    @Test
    public void testMissingPayloadArgument() {
        assertEquals(1, PivotExportCli.run(cli(), new String[0]));
    }

    private PivotExportCli cli() {
        return new PivotExportCli(config -> {
            configsSeen.add(config);
            return new HourlySource();
        }, new PrintStream(out, true), new PrintStream(err, true));
    }

    private File writePayload(String json) throws IOException {
        Path file = dir.resolve("payload.json");
        Files.write(file, json.getBytes(StandardCharsets.UTF_8));
        return file.toFile();
    }

    private static class HourlySource implements TelemetrySource {
        @Override
        public KeyedSeries fetch(EntityRef entity, List<String> keys, long startTs, long endTs,
                                 int limit, Aggregation aggregation, Long intervalMs) {
            KeyedSeries series = new KeyedSeries();
            for (long ts = startTs; ts <= endTs; ts += HOUR) {
                series.add("kwh", new Point(ts, 1.0));
            }
            return series;
        }
    }
}
