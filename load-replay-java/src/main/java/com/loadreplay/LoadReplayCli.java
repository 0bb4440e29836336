package com.loadreplay;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.loadreplay.source.JsonlRequestSource;
import com.loadreplay.source.SlowLogRequestSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Main entry point: load test a service by replaying a captured request log.
 *
 * Usage:
 * java -jar load-replay.jar --log_file slowlog.log --host es-qa --port 9200
 * --speed_multiplier 100 --run_time_minutes 10
 */
public class LoadReplayCli {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .create();

    public static class PositiveDouble implements IParameterValidator {
        @Override
        public void validate(String name, String value) throws ParameterException {
            double parsed;
            try {
                parsed = Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new ParameterException("Parameter " + name + " should be a number (found " + value + ")");
            }
            if (!(parsed > 0) || Double.isInfinite(parsed)) {
                throw new ParameterException("Parameter " + name + " should be > 0 (found " + value + ")");
            }
        }
    }

    public static class LogFormat implements IParameterValidator {
        @Override
        public void validate(String name, String value) throws ParameterException {
            if (!"slowlog".equals(value) && !"jsonl".equals(value)) {
                throw new ParameterException("Parameter " + name + " should be slowlog or jsonl (found " + value + ")");
            }
        }
    }

    @Parameter(names = { "--log_file" }, description = "The captured request log to replay", required = true)
    private String logFile;

    @Parameter(names = { "--host" }, description = "The host to load test", required = true)
    private String host;

    @Parameter(names = { "--port" }, description = "The port", required = true)
    private int port;

    @Parameter(names = { "--speed_multiplier" }, validateWith = PositiveDouble.class,
            description = "1 is real time, 2 is twice as fast, 0.5 is half speed")
    private double speedMultiplier = 1.0;

    @Parameter(names = { "--run_time_minutes" }, validateWith = PositiveDouble.class, required = true,
            description = "Wall-clock time to keep the load test running")
    private double runTimeMinutes;

    @Parameter(names = { "--format" }, validateWith = LogFormat.class,
            description = "Log format: slowlog (Elasticsearch search slow log) or jsonl")
    private String format = "slowlog";

    @Parameter(names = { "--max_outstanding" }, description = "Cap on in-flight requests (0 = unbounded)")
    private int maxOutstanding = 0;

    @Parameter(names = { "--connect_timeout_seconds" }, description = "TCP connect timeout")
    private int connectTimeoutSeconds = 30;

    @Parameter(names = { "--output" }, description = "Output path for per-response CSV results")
    private String output = "";

    @Parameter(names = { "--dry-run" }, description = "Don't actually send requests")
    private boolean dryRun = false;

    @Parameter(names = { "-v", "--verbose" }, description = "Print progress")
    private boolean verbose = false;

    @Parameter(names = { "--help", "-h" }, help = true, description = "Show help")
    private boolean help = false;

    public static void main(String[] args) {
        LoadReplayCli app = new LoadReplayCli();
        JCommander jc = JCommander.newBuilder()
                .addObject(app)
                .programName("load-replay")
                .build();

        try {
            jc.parse(args);
        } catch (ParameterException e) {
            System.err.println("Error: " + e.getMessage());
            jc.usage();
            System.exit(2);
            return;
        }

        if (app.help) {
            jc.usage();
            return;
        }

        try {
            Map<String, Object> result = app.run();
            System.out.println(GSON.toJson(result));
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    ReplayConfig toConfig() {
        return ReplayConfig.builder()
                .host(host)
                .port(port)
                .speedMultiplier(speedMultiplier)
                .runTimeMinutes(runTimeMinutes)
                .maxOutstanding(maxOutstanding)
                .connectTimeoutSeconds(connectTimeoutSeconds)
                .verbose(verbose)
                .dryRun(dryRun)
                .build();
    }

    RequestSource openSource() throws IOException {
        Path path = Paths.get(logFile);
        if (!Files.isReadable(path)) {
            throw new IOException("Cannot read log file: " + logFile);
        }
        return "jsonl".equals(format) ? new JsonlRequestSource(path) : new SlowLogRequestSource(path);
    }

    /**
     * Runs the replay and returns the report printed on completion.
     */
    public Map<String, Object> run() throws IOException {
        ReplayConfig config = toConfig();
        RequestSource source = openSource();
        ElasticsearchResponseAccumulator accumulator = new ElasticsearchResponseAccumulator();
        RecordingResponseSink recorder = output.isEmpty() ? null : new RecordingResponseSink(accumulator);
        ResponseSink sink = recorder != null ? recorder : accumulator;

        RunStats stats;
        try (ReplayTransport transport = config.isDryRun()
                ? new DryRunTransport(verbose)
                : new OkHttpReplayTransport(config)) {
            stats = new TimedReplayExecutor(source, transport, sink, config).run();
        }

        if (recorder != null) {
            String filepath = CsvResultWriter.saveResults(recorder.getResponses(), output);
            if (verbose) {
                System.out.println("[Replay] Results saved to: " + filepath);
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("run_information", stats.toMap());
        result.put("accumulator_information", sink.summary());
        return result;
    }
}
