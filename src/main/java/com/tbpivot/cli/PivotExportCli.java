package com.tbpivot.cli;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tbpivot.clients.ThingsboardApiBase.ThingsboardApiException;
import com.tbpivot.clients.ThingsboardApiClient;
import com.tbpivot.config.InvalidPayloadException;
import com.tbpivot.config.PivotExportConfig;
import com.tbpivot.csv.CsvExporter;
import com.tbpivot.export.ExportRequest;
import com.tbpivot.export.ExportTables;
import com.tbpivot.export.PayloadParser;
import com.tbpivot.export.PivotExportService;
import com.tbpivot.fetch.TelemetrySource;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point: reads a widget payload JSON file, fetches the
 * telemetry from ThingsBoard and writes raw, pivot and aggregate CSV files.
 *
 * Usage:
 *   tb-pivot payload.json
 *   tb-pivot -c tb-pivot.properties -o exports --debug payload.json
 */
@Command(
    name = "tb-pivot",
    description = "Exports ThingsBoard telemetry as raw, pivot and calendar aggregate tables",
    mixinStandardHelpOptions = true,
    version = "tb-pivot 1.0.0"
)
public class PivotExportCli implements Callable<Integer> {

    @Option(names = {"-c", "--config"},
            description = "Properties file (defaults to tb-pivot.properties on the classpath)")
    private File configFile;

    @Option(names = {"--tbUrl"},
            description = "ThingsBoard base URL (overrides config)")
    private String tbUrl;

    @Option(names = {"--username"},
            description = "ThingsBoard username (overrides config)")
    private String username;

    @Option(names = {"--password"},
            description = "ThingsBoard password (overrides config)")
    private String password;

    @Option(names = {"-o", "--outputDir"},
            description = "Directory the CSV files are written to (overrides config)")
    private File outputDir;

    @Option(names = {"--debug"},
            description = "Enable debug logging (shows API calls and chunking)")
    private boolean debug;

    @Parameters(index = "0", paramLabel = "<payload.json>",
            description = "Widget payload JSON file")
    private File payloadFile;

    private final Function<PivotExportConfig, TelemetrySource> sourceFactory;
    private final PrintStream out;
    private final PrintStream err;

    public PivotExportCli() {
        this(null, System.out, System.err);
    }

    PivotExportCli(Function<PivotExportConfig, TelemetrySource> sourceFactory, PrintStream out, PrintStream err) {
        this.sourceFactory = sourceFactory;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(run(new PivotExportCli(), args));
    }

    static int run(PivotExportCli cli, String[] args) {
        CommandLine cmd = new CommandLine(cli);
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            cli.err.println("Error: " + ex.getMessage());
            return 1;
        });
        // usage errors also count as failures
        cmd.setParameterExceptionHandler((ex, args1) -> {
            cli.err.println("Error: " + ex.getMessage());
            ex.getCommandLine().usage(cli.err);
            return 1;
        });
        return cmd.execute(args);
    }

    private static void setLogLevel(String loggerName, String levelStr) {
        Logger logger = (Logger) LoggerFactory.getLogger(loggerName);
        Level level = Level.toLevel(levelStr, Level.INFO);
        logger.setLevel(level);
    }

    @Override
    public Integer call() throws Exception {
        setLogLevel("com.tbpivot", debug ? "DEBUG" : "INFO");

        PivotExportConfig config = loadConfig();
        ObjectMapper mapper = new ObjectMapper();

        Map<String, Object> payload;
        try {
            payload = mapper.readValue(payloadFile, new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            err.println("Error: cannot read payload " + payloadFile + ": " + e.getMessage());
            return 1;
        }

        ExportRequest request;
        try {
            request = new PayloadParser(config.toLimits()).parse(payload);
        } catch (InvalidPayloadException e) {
            err.println("Error: invalid payload: " + e.getMessage());
            return 1;
        }

        out.println("Effective report config:");
        out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(request.getReportConfig().toMap()));

        ExportTables tables;
        try {
            TelemetrySource source = sourceFactory != null ? sourceFactory.apply(config) : createClient(config);
            tables = new PivotExportService(source, config.toLimits()).buildTables(request);
        } catch (ThingsboardApiException | IllegalStateException e) {
            err.println("Error: export failed: " + e.getMessage());
            return 1;
        }

        File targetDir = outputDir != null ? outputDir : new File(config.getOutputDir());
        List<File> written = new CsvExporter().exportAll(tables, targetDir);

        out.println("Rows: raw=" + tables.getRaw().size() + ", pivot=" + tables.getPivot().size()
                + ", aggregates=" + tables.getAggregates().keySet());
        for (File file : written) {
            out.println("Wrote " + file.getPath());
        }
        return 0;
    }

    private PivotExportConfig loadConfig() throws IOException {
        PivotExportConfig base = configFile != null
                ? PivotExportConfig.fromFile(configFile)
                : PivotExportConfig.getInstance();

        Map<String, String> overrides = new LinkedHashMap<>();
        overrides.put(PivotExportConfig.TB_URL, tbUrl);
        overrides.put(PivotExportConfig.TB_USERNAME, username);
        overrides.put(PivotExportConfig.TB_PASSWORD, password);
        return base.withOverrides(overrides);
    }

    private TelemetrySource createClient(PivotExportConfig config) {
        ThingsboardApiClient client = ThingsboardApiClient.fromConfig(config);
        if (debug) {
            client.setDebugLevel(2);
        }
        return client.telemetry();
    }
}
