package com.stockpulse.app;

import com.stockpulse.config.Config;
import com.stockpulse.core.error.ConfigurationException;
import com.stockpulse.correlate.CorrelationEngine;
import com.stockpulse.correlate.CorrelationSettings;
import com.stockpulse.data.RssNewsSource;
import com.stockpulse.data.StooqPriceSource;
import com.stockpulse.extract.ExtractionAdapter;
import com.stockpulse.extract.ExtractionSettings;
import com.stockpulse.extract.LangChainSentimentAnalyzer;
import com.stockpulse.output.MarkdownReportRenderer;
import com.stockpulse.output.RunStateJson;
import com.stockpulse.pattern.PatternDetector;
import com.stockpulse.pattern.PatternSettings;
import com.stockpulse.report.ReportGenerator;
import com.stockpulse.workflow.RunState;
import com.stockpulse.workflow.WorkflowOrchestrator;
import com.stockpulse.workflow.WorkflowSettings;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Command-line entry point. Exit code 0 on success, 1 on a failed run, 2 on bad arguments or configuration.
 */
public final class StockPulseApplication {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    public static void main(String[] args) {
        int exit = new StockPulseApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("stockpulse", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("stockpulse", options);
            return EXIT_OK;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        Config config = Config.load(workingDir);
        installLogRoutingIfNeeded(config);
        Logger log = LogManager.getLogger(StockPulseApplication.class);

        String ticker = cmd.getOptionValue("ticker", "").trim().toUpperCase(Locale.ROOT);
        if (ticker.isEmpty()) {
            new HelpFormatter().printHelp("stockpulse", options);
            System.err.println("ERROR: --ticker is required.");
            return EXIT_USAGE;
        }

        RunState state;
        try {
            LocalDate end = parseDate(cmd.getOptionValue("end"), LocalDate.now(), "end");
            LocalDate start = parseDate(cmd.getOptionValue("start"), end.minusDays(30), "start");
            WorkflowOrchestrator orchestrator = buildOrchestrator(config);
            state = orchestrator.run(ticker, start, end);
        } catch (ConfigurationException e) {
            System.err.println("ERROR: invalid configuration " + e.key() + ": " + e.getMessage());
            return EXIT_USAGE;
        }

        try {
            if (cmd.hasOption("dump-state")) {
                Path dump = workingDir.resolve(cmd.getOptionValue("dump-state")).normalize();
                RunStateJson.write(state, dump);
                System.out.println("Run state written to " + dump);
            }
            if (state.isFailed()) {
                System.err.println("ERROR: run " + state.failure());
                return EXIT_FAILED;
            }
            Path output = resolveOutput(cmd, config, state);
            Files.createDirectories(output.toAbsolutePath().getParent());
            Files.writeString(output, new MarkdownReportRenderer().render(state.report()), StandardCharsets.UTF_8);
            System.out.println("Report written to " + output
                    + (state.isDegraded() ? " (degraded, " + state.warnings().size() + " warnings)" : ""));
            return EXIT_OK;
        } catch (IOException e) {
            log.error("failed to write run output", e);
            System.err.println("ERROR: failed to write output: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    static WorkflowOrchestrator buildOrchestrator(Config config) {
        ExtractionSettings extractionSettings = ExtractionSettings.fromConfig(config);
        return new WorkflowOrchestrator(
                new RssNewsSource(config),
                new StooqPriceSource(config),
                new ExtractionAdapter(new LangChainSentimentAnalyzer(config), extractionSettings),
                new PatternDetector(PatternSettings.fromConfig(config)),
                new CorrelationEngine(CorrelationSettings.fromConfig(config)),
                new ReportGenerator(),
                WorkflowSettings.fromConfig(config)
        );
    }

    static LocalDate parseDate(String raw, LocalDate fallback, String key) {
        if (raw == null || raw.trim().isEmpty()) {
            return fallback;
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(key, "expected yyyy-MM-dd, got '" + raw + "'");
        }
    }

    private static Path resolveOutput(CommandLine cmd, Config config, RunState state) {
        String explicit = cmd.getOptionValue("output");
        if (explicit != null && !explicit.trim().isEmpty()) {
            return config.workingDir().resolve(explicit.trim()).normalize();
        }
        String name = String.format(
                Locale.ROOT,
                "%s_%s_%s.md",
                state.ticker().toLowerCase(Locale.ROOT),
                state.range().start(),
                state.range().end()
        );
        return config.getPath("report.dir").resolve(name);
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (StockPulseApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("stockpulse.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(StockPulseApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
            } catch (IOException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("t").longOpt("ticker").hasArg().argName("symbol").desc("ticker to analyze, e.g. AAPL").build());
        options.addOption(Option.builder().longOpt("start").hasArg().argName("yyyy-MM-dd").desc("first day of the range (default: 30 days before end)").build());
        options.addOption(Option.builder().longOpt("end").hasArg().argName("yyyy-MM-dd").desc("last day of the range (default: today)").build());
        options.addOption(Option.builder("o").longOpt("output").hasArg().argName("path").desc("markdown report path (default: report.dir/<ticker>_<start>_<end>.md)").build());
        options.addOption(Option.builder().longOpt("dump-state").hasArg().argName("path").desc("also write the run state as JSON").build());
        options.addOption(Option.builder("h").longOpt("help").desc("show help").build());
        return options;
    }
}
