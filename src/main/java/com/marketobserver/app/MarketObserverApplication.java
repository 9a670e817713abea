package com.marketobserver.app;

import com.marketobserver.config.Config;
import com.marketobserver.core.RunTelemetry;
import com.marketobserver.input.NewsInputReader;
import com.marketobserver.model.NewsItem;
import com.marketobserver.runner.ObservationJson;
import com.marketobserver.runner.ObservationResult;
import com.marketobserver.runner.ObservationRunner;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class MarketObserverApplication {
    private static final Logger LOG = LogManager.getLogger(MarketObserverApplication.class);
    private static final List<String> REPORTED_KEYS = List.of("app.zone", "history.path", "keywords.path");
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    private final Path workingDir;
    private final Clock clock;
    private final PrintStream out;

    public MarketObserverApplication() {
        this(Path.of(".").toAbsolutePath().normalize(), null, System.out);
    }

    MarketObserverApplication(Path workingDir, Clock clock, PrintStream out) {
        this.workingDir = workingDir;
        this.clock = clock;
        this.out = out;
    }

    public static void main(String[] args) {
        MarketObserverApplication app = new MarketObserverApplication();
        int exit = app.run(args, true);
        System.exit(exit);
    }

    public int run(String[] args) {
        return run(args, false);
    }

    int run(String[] args, boolean routeLogs) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            new HelpFormatter().printHelp("market-observer", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("market-observer", options);
            return 0;
        }
        if (!cmd.hasOption("input")) {
            new HelpFormatter().printHelp("market-observer", options);
            System.err.println("ERROR: --input is required.");
            return 2;
        }

        try {
            Config config = Config.load(workingDir);
            if (cmd.hasOption("history")) {
                config.with("history.path", cmd.getOptionValue("history"));
            }
            if (cmd.hasOption("keywords")) {
                config.with("keywords.path", cmd.getOptionValue("keywords"));
            }
            if (routeLogs) {
                installLogRoutingIfNeeded(config);
            }
            for (String line : effectiveConfigLines(config)) {
                LOG.info("config {}", line);
            }

            Path inputPath = workingDir.resolve(cmd.getOptionValue("input")).normalize();
            List<NewsItem> items = new NewsInputReader().read(inputPath);
            if (items.isEmpty()) {
                System.err.println("WARN: no items in input, evaluating an empty batch. path=" + inputPath);
            }

            ObservationRunner runner = ObservationRunner.create(config, clock);
            RunTelemetry telemetry = new RunTelemetry("cli", Instant.now());
            ObservationResult result = runner.run(items, telemetry);

            out.println(new ObservationJson().toJson(result).toString(2));
            return 0;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    /**
     * One line per setting that decides where state is read and written, with the layer it came from.
     */
    static List<String> effectiveConfigLines(Config config) {
        List<String> out = new ArrayList<>();
        for (String key : REPORTED_KEYS) {
            Config.ResolvedValue value = config.resolve(key);
            out.add(value.key + "=" + value.value + " source=" + value.source);
        }
        return out;
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (MarketObserverApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("observer.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(MarketObserverApplication.class);
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("i")
                .longOpt("input")
                .hasArg()
                .argName("file")
                .desc("JSON array of news items ({text, source, ...})")
                .build());
        options.addOption(Option.builder()
                .longOpt("history")
                .hasArg()
                .argName("file")
                .desc("history log path (overrides history.path)")
                .build());
        options.addOption(Option.builder()
                .longOpt("keywords")
                .hasArg()
                .argName("file")
                .desc("keyword table override JSON (overrides keywords.path)")
                .build());
        options.addOption(Option.builder("h")
                .longOpt("help")
                .desc("show help")
                .build());
        return options;
    }
}
