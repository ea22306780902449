package com.trialmatch.app;

import com.trialmatch.cache.CacheStore;
import com.trialmatch.cache.FileCacheStore;
import com.trialmatch.cache.InMemoryCacheStore;
import com.trialmatch.config.Config;
import com.trialmatch.data.http.HttpClientEx;
import com.trialmatch.error.TrialMatchException;
import com.trialmatch.error.ValidationFailureException;
import com.trialmatch.matching.CriteriaFormatter;
import com.trialmatch.matching.MatchOrchestrator;
import com.trialmatch.matching.MatchResponseParser;
import com.trialmatch.matching.ReasoningProviders;
import com.trialmatch.model.MatchReport;
import com.trialmatch.model.MatchResult;
import com.trialmatch.model.PatientJson;
import com.trialmatch.model.PatientRecord;
import com.trialmatch.model.Trial;
import com.trialmatch.model.TrialFailure;
import com.trialmatch.registry.ClinicalTrialsGovClient;
import com.trialmatch.registry.TrialRegistryClient;
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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

public final class TrialMatchApplication {
    private static final Logger LOG = LogManager.getLogger(TrialMatchApplication.class);
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    private final PrintStream out;
    private final boolean routeLogs;

    public TrialMatchApplication() {
        this(System.out, true);
    }

    TrialMatchApplication(PrintStream out, boolean routeLogs) {
        this.out = out;
        this.routeLogs = routeLogs;
    }

    public static void main(String[] args) {
        int exit = new TrialMatchApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("trialmatch", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help") || args == null || args.length == 0) {
            new HelpFormatter().printHelp("trialmatch", options);
            return 0;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        Config config = Config.load(workingDir);
        if (routeLogs) {
            installLogRoutingIfNeeded(config);
        }
        return run(cmd, config, null);
    }

    /**
     * Executes a parsed command line. {@code registryOverride} replaces the ClinicalTrials.gov client when non-null.
     */
    int run(CommandLine cmd, Config config, TrialRegistryClient registryOverride) {
        Duration ttl = Duration.ofHours(Math.max(1, config.getInt("cache.ttl_hours", 24)));
        boolean cacheEnabled = config.getBoolean("cache.enabled", true);
        HttpClientEx http = new HttpClientEx(config.getString("registry.user_agent", "TrialMatch/1.0"));

        try (CacheStore searchCache = cacheEnabled
                ? new FileCacheStore(config.getPath("cache.dir"), ttl, Clock.systemUTC())
                : new InMemoryCacheStore(Duration.ZERO, Clock.systemUTC());
             CacheStore trialCache = new InMemoryCacheStore(cacheEnabled ? ttl : Duration.ZERO, Clock.systemUTC())) {

            if (cmd.hasOption("purge-cache")) {
                int removed = searchCache.invalidateExpired();
                out.println("Removed " + removed + " expired cache entries.");
                if (!cmd.hasOption("search") && !cmd.hasOption("match") && !cmd.hasOption("trial")) {
                    return 0;
                }
            }

            TrialRegistryClient registry = registryOverride != null
                    ? registryOverride
                    : new ClinicalTrialsGovClient(config, http, searchCache, trialCache);
            int limit = parseInt(cmd.getOptionValue("limit"), config.getInt("match.max_trials", 10), "limit");

            if (cmd.hasOption("search")) {
                printTrials(registry.search(cmd.getOptionValue("search"), limit));
                return 0;
            }
            if (cmd.hasOption("match") || cmd.hasOption("trial")) {
                PatientRecord patient = readPatient(config, cmd.getOptionValue("patient"));
                double minScore = parseDouble(cmd.getOptionValue("min-score"), config.getDouble("match.min_score", 0.0), "min-score");
                try (MatchOrchestrator orchestrator = new MatchOrchestrator(
                        registry,
                        new CriteriaFormatter(),
                        ReasoningProviders.fromConfig(config, http),
                        new MatchResponseParser(),
                        config.getInt("match.concurrency", 4),
                        Duration.ofSeconds(Math.max(1, config.getInt("match.deadline_sec", 300)))
                )) {
                    if (cmd.hasOption("trial")) {
                        printResult(1, orchestrator.matchOne(patient, cmd.getOptionValue("trial")));
                        return 0;
                    }
                    String condition = cmd.getOptionValue("condition");
                    if (condition == null || condition.isBlank()) {
                        throw new ValidationFailureException("condition", "--condition is required with --match");
                    }
                    printReport(orchestrator.match(patient, condition, limit, minScore));
                    return 0;
                }
            }
            System.err.println("ERROR: one of --search, --match, --trial or --purge-cache is required.");
            return 2;
        } catch (ValidationFailureException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        } catch (TrialMatchException e) {
            LOG.error("command failed: {}", e.getMessage(), e);
            System.err.println("ERROR: " + e.getMessage());
            return 1;
        }
    }

    private PatientRecord readPatient(Config config, String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            throw new ValidationFailureException("patient", "--patient <file> is required");
        }
        Path path = config.workingDir().resolve(rawPath.trim()).normalize();
        try {
            return PatientJson.parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ValidationFailureException("patient", "cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    private void printTrials(List<Trial> trials) {
        out.println("Found " + trials.size() + " trials");
        for (Trial trial : trials) {
            out.println(trial.id + "  " + (trial.phase == null ? "-" : trial.phase) + "  " + trial.title);
            if (!trial.locations.isEmpty()) {
                out.println("    " + String.join("; ", trial.locations));
            }
        }
    }

    private void printReport(MatchReport report) {
        out.println(report.summary());
        int rank = 1;
        for (MatchResult result : report.results()) {
            printResult(rank++, result);
        }
        for (TrialFailure failure : report.failures()) {
            out.println("  not evaluated " + failure.trialId() + " [" + failure.kind() + "] " + failure.message());
        }
    }

    private void printResult(int rank, MatchResult result) {
        out.println(String.format(Locale.ROOT, "%d. %s score=%.2f eligible=%s  %s",
                rank, result.trialId(), result.score(), result.eligible() ? "yes" : "no", result.trial().title));
        out.println("    " + result.explanation());
        for (String violation : result.exclusionViolations()) {
            out.println("    exclusion violated: " + violation);
        }
        for (String mismatch : result.inclusionMismatches()) {
            out.println("    inclusion not met: " + mismatch);
        }
    }

    private static int parseInt(String raw, int fallback, String field) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ValidationFailureException(field, "'" + raw + "' is not an integer", e);
        }
    }

    private static double parseDouble(String raw, double fallback, String field) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new ValidationFailureException(field, "'" + raw + "' is not a number", e);
        }
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (TrialMatchApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("trialmatch.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j first so the console appender keeps the original stderr stream.
                LogManager.getLogger(TrialMatchApplication.class);
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                LOG.info("Log4j routing enabled. dir={}", logDir.toAbsolutePath());
            } catch (IOException e) {
                LOG.warn("failed to initialize log4j routing: {}", e.getMessage());
            }
        }
    }

    static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("search").hasArg().argName("condition").desc("list recruiting trials for a condition").build());
        options.addOption(Option.builder().longOpt("match").desc("rank trials for --condition against --patient").build());
        options.addOption(Option.builder().longOpt("trial").hasArg().argName("nct_id").desc("match --patient against a single trial").build());
        options.addOption(Option.builder().longOpt("patient").hasArg().argName("file").desc("patient record JSON file").build());
        options.addOption(Option.builder().longOpt("condition").hasArg().argName("text").desc("condition to search trials for").build());
        options.addOption(Option.builder().longOpt("limit").hasArg().argName("n").desc("maximum number of trials (default match.max_trials)").build());
        options.addOption(Option.builder().longOpt("min-score").hasArg().argName("score").desc("drop matches below this score, 0.0 to 1.0").build());
        options.addOption(Option.builder().longOpt("purge-cache").desc("delete expired trial cache entries").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
