package com.nightscan.app;

import com.nightscan.config.Config;
import com.nightscan.core.progress.JsonFileProgressStore;
import com.nightscan.core.progress.ProgressSnapshot;
import com.nightscan.core.progress.ProgressStatusReader;
import com.nightscan.runner.OvernightRunner;
import com.nightscan.runner.PipelineComponents;
import com.nightscan.runner.RunOutcome;
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
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Command-line entry point: run the overnight pipeline or inspect its progress.
 */
public final class NightScanApplication {
    private static final Logger LOG = LogManager.getLogger(NightScanApplication.class);
    private static volatile boolean logRouteInstalled = false;
    static final int DEFAULT_HISTORY = 10;

    private final PrintStream console;

    public NightScanApplication() {
        this(System.out);
    }

    NightScanApplication(PrintStream console) {
        this.console = console;
    }

    public static void main(String[] args) {
        int exit = new NightScanApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("nightscan", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }
        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("nightscan", options);
            return 0;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        Config config = Config.load(workingDir);
        try {
            if (cmd.hasOption("status")) {
                return printStatus(config);
            }
            if (cmd.hasOption("watch")) {
                return watch(config, parsePositiveInt(cmd.getOptionValue("watch"), "watch"));
            }
            if (cmd.hasOption("history")) {
                String raw = cmd.getOptionValue("history");
                return printHistory(config, raw == null ? DEFAULT_HISTORY : parsePositiveInt(raw, "history"));
            }
            LocalDate asOf = resolveDate(cmd.getOptionValue("date"), config);
            installLogRoutingIfNeeded(config);
            return runPipeline(config, asOf);
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("Interrupted.");
            return 130;
        } catch (RuntimeException e) {
            LOG.fatal("FATAL: {}", e.getMessage(), e);
            return 1;
        }
    }

    private int runPipeline(Config config, LocalDate asOf) {
        LOG.info("Overnight run for {} (config {})", asOf, config.workingDir());
        OvernightRunner runner = new OvernightRunner(PipelineComponents.fromConfig(config));
        RunOutcome outcome = runner.run(asOf);
        if (outcome.succeeded()) {
            LOG.info("Run complete: scored={} top={} report={}",
                    outcome.scored.size(), outcome.topOpportunities.size(), outcome.reportPath);
            return 0;
        }
        LOG.error("Run failed: {}", outcome.error);
        return 1;
    }

    private int printStatus(Config config) {
        Optional<ProgressSnapshot> snapshot = reader(config).read();
        if (snapshot.isEmpty()) {
            console.println("No progress document found.");
            return 1;
        }
        console.println(snapshot.get().render());
        snapshot.get().lastCompletedStage()
                .ifPresent(stage -> console.println("Last completed stage: " + stage.wireName()));
        return 0;
    }

    private int watch(Config config, int intervalSec) throws InterruptedException {
        ProgressStatusReader reader = reader(config);
        while (true) {
            Optional<ProgressSnapshot> snapshot = reader.read();
            if (snapshot.isEmpty()) {
                console.println("Waiting for a progress document...");
            } else {
                console.println(snapshot.get().render());
                console.println();
                if (snapshot.get().overallStatus.isTerminal()) {
                    return 0;
                }
            }
            Thread.sleep(intervalSec * 1000L);
        }
    }

    private int printHistory(Config config, int limit) {
        List<ProgressSnapshot> runs = reader(config).history(limit);
        if (runs.isEmpty()) {
            console.println("No archived runs.");
            return 0;
        }
        for (ProgressSnapshot run : runs) {
            console.printf("%s  %-8s %6.1f%%  elapsed=%s  errors=%d  warnings=%d%n",
                    run.startTime, run.overallStatus.wireName(), run.overallProgress,
                    run.executionTime, run.errors.size(), run.warnings.size());
        }
        return 0;
    }

    private static ProgressStatusReader reader(Config config) {
        return new ProgressStatusReader(new JsonFileProgressStore(config));
    }

    static LocalDate resolveDate(String raw, Config config) {
        if (raw == null || raw.isBlank()) {
            return LocalDate.now(ZoneId.of(config.getString("app.zone", "UTC")));
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("--date must be yyyy-MM-dd, got " + raw);
        }
    }

    static int parsePositiveInt(String raw, String option) {
        try {
            int value = Integer.parseInt(raw.trim());
            if (value <= 0) {
                throw new IllegalArgumentException("--" + option + " must be positive");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + option + " expects a number, got " + raw);
        }
    }

    private static void installLogRoutingIfNeeded(Config config) {
        if (logRouteInstalled) {
            return;
        }
        synchronized (NightScanApplication.class) {
            if (logRouteInstalled) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("nightscan.log.dir", logDir.toAbsolutePath().toString());

                // Log4j context must exist before stdout/stderr are swapped so the console appender keeps the originals.
                LogManager.getLogger(NightScanApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                logRouteInstalled = true;
                LOG.info("Log4j routing enabled. dir={}", logDir.toAbsolutePath());
            } catch (IOException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("run").desc("run the overnight pipeline (default)").build());
        options.addOption(Option.builder().longOpt("date").hasArg().argName("yyyy-MM-dd").desc("run date, defaults to today in app.zone").build());
        options.addOption(Option.builder().longOpt("status").desc("print the current progress document and exit").build());
        options.addOption(Option.builder().longOpt("watch").hasArg().argName("sec").desc("re-print progress every <sec> seconds until the run finishes").build());
        options.addOption(Option.builder().longOpt("history").optionalArg(true).hasArg().argName("n").desc("list the last n archived runs (default 10)").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
