package org.carball.dbbench.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.dbbench.analyzer.Advisor;
import org.carball.dbbench.analyzer.PerformanceScore;
import org.carball.dbbench.baseline.BaselineResult;
import org.carball.dbbench.baseline.BaselineStorage;
import org.carball.dbbench.baseline.ComparisonResult;
import org.carball.dbbench.baseline.GitInfo;
import org.carball.dbbench.baseline.RegressionDetector;
import org.carball.dbbench.collector.QueryCollector;
import org.carball.dbbench.config.BenchmarkConfig;
import org.carball.dbbench.config.ConfigurationLoader;
import org.carball.dbbench.model.advisor.AdvisorReport;
import org.carball.dbbench.output.AdvisorReportRenderer;
import org.carball.dbbench.output.ComparisonReportRenderer;
import org.carball.dbbench.output.Formats;
import org.carball.dbbench.output.JsonMappers;
import org.carball.dbbench.output.ReportExporter;
import org.carball.dbbench.parser.QueryLogFileConnector;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
public class DbBenchCLI {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_NO_BASELINE = 2;

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║        dbbench - Query Advisor & Regression Detector v%s     ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    // Options followed by a value
    private static final Set<String> VALUE_OPTIONS = Set.of(
            "--execution-time", "--format", "-f", "--output", "-o", "--config", "--export",
            "--iterations", "--warmup", "--baseline-path", "--advisor.enabled"
    );

    private final PrintStream out;
    private final PrintStream err;
    private final ConfigurationLoader configurationLoader;

    public DbBenchCLI(PrintStream out, PrintStream err, ConfigurationLoader configurationLoader) {
        this.out = out;
        this.err = err;
        this.configurationLoader = configurationLoader;
    }

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);
        int exitCode = new DbBenchCLI(System.out, System.err, new ConfigurationLoader()).run(args);
        System.exit(exitCode);
    }

    public int run(String[] args) {
        List<String> positionals = positionals(args);

        if (positionals.isEmpty() || isHelpRequested(args)) {
            printUsage();
            return positionals.isEmpty() && !isHelpRequested(args) ? EXIT_FAILURE : EXIT_OK;
        }

        try {
            BenchmarkConfig config = configurationLoader.loadConfiguration(args);
            String command = positionals.get(0);

            switch (command) {
                case "analyze":
                    return analyze(positionals, args, config);
                case "baseline":
                    return saveBaseline(positionals, args, config);
                case "compare":
                    return compare(positionals, args, config);
                case "baselines":
                    return listBaselines(config);
                default:
                    throw new IllegalArgumentException("Unknown command: " + command);
            }
        } catch (IllegalArgumentException e) {
            err.println("\n❌ Configuration error: " + e.getMessage());
            err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return EXIT_FAILURE;
        } catch (IOException e) {
            err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return EXIT_FAILURE;
        } catch (Exception e) {
            err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            return EXIT_FAILURE;
        }
    }

    private int analyze(List<String> positionals, String[] args, BenchmarkConfig config) throws IOException {
        requirePositionals(positionals, 2, "analyze <query-log.json>");
        Path logFile = Paths.get(positionals.get(1));
        String format = Optional.ofNullable(optionValue(args, "--format", "-f")).orElse("text").toLowerCase(Locale.ROOT);
        if (!format.equals("text") && !format.equals("json")) {
            throw new IllegalArgumentException("Invalid format: " + format + ". Use text or json");
        }

        LogAnalysis analysis = analyzeLog(logFile, args, config);
        if (analysis.report() == null) {
            out.println("\nAdvisor disabled, nothing to analyze.");
            return EXIT_OK;
        }

        ReportExporter exporter = new ReportExporter();
        String output = optionValue(args, "--output", "-o");

        if (format.equals("json")) {
            if (output != null) {
                exporter.export(analysis.report(), Paths.get(output));
                out.println("\n✅ Report written to " + output);
            } else {
                out.println(exporter.toJson(analysis.report()));
            }
        } else {
            String text = new AdvisorReportRenderer(config.getAdvisor().getDisplay())
                    .render(analysis.report(), analysis.executionTime(), analysis.score());
            if (output != null) {
                Files.writeString(Paths.get(output), text);
                out.println("\n✅ Report written to " + output);
            } else {
                out.print(text);
            }
        }
        return EXIT_OK;
    }

    private int saveBaseline(List<String> positionals, String[] args, BenchmarkConfig config) throws IOException {
        if (positionals.size() < 2 || !positionals.get(1).equals("save")) {
            throw new IllegalArgumentException("Usage: baseline save <name> <query-log.json> [--execution-time <s>]");
        }
        requirePositionals(positionals, 4, "baseline save <name> <query-log.json>");
        String name = positionals.get(2);
        Path logFile = Paths.get(positionals.get(3));

        BaselineResult baseline = baselineFromLog(name, logFile, args, config);
        Path saved = new BaselineStorage(Paths.get(config.getBaselinePath())).save(baseline);

        out.println("\n✅ Baseline saved: " + saved);
        out.println("   Queries: " + baseline.totalQueries()
                + " | DB time: " + Formats.time(baseline.totalDbTime())
                + " | Score: " + baseline.performanceScore() + "/100");
        return EXIT_OK;
    }

    private int compare(List<String> positionals, String[] args, BenchmarkConfig config) throws IOException {
        requirePositionals(positionals, 3, "compare <baseline> <current.json>");
        BaselineStorage storage = new BaselineStorage(Paths.get(config.getBaselinePath()));

        Optional<BaselineResult> baseline = resolveBaseline(storage, positionals.get(1));
        if (baseline.isEmpty()) {
            err.println("\n❌ No baseline found for " + positionals.get(1));
            err.println("   Save one first with: baseline save <name> <query-log.json>");
            return EXIT_NO_BASELINE;
        }

        Path currentFile = Paths.get(positionals.get(2));
        BaselineResult current = readCurrent(storage, currentFile, baseline.get().benchmarkName(), args, config);

        ComparisonResult comparison = new RegressionDetector(config.getRegression()).compare(baseline.get(), current);
        out.print(new ComparisonReportRenderer().render(comparison));

        String export = optionValue(args, "--export");
        if (export != null) {
            new ReportExporter().export(comparison, Paths.get(export));
            out.println("\nResults exported to: " + export);
        }

        if (hasFlag(args, "--fail-on-regression") && comparison.shouldFailCI()) {
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    private int listBaselines(BenchmarkConfig config) throws IOException {
        BaselineStorage storage = new BaselineStorage(Paths.get(config.getBaselinePath()));
        List<BaselineResult> baselines = storage.list();

        if (baselines.isEmpty()) {
            out.println("\nNo baselines found in " + storage.getStoragePath());
            return EXIT_OK;
        }

        out.println("\nBaselines in " + storage.getStoragePath() + ":");
        out.printf(Locale.ROOT, "  %-30s %12s %10s %8s  %-25s %s%n",
                "Benchmark", "Time", "Queries", "Score", "Created", "Git");
        for (BaselineResult baseline : baselines) {
            out.printf(Locale.ROOT, "  %-30s %12s %,10d %8s  %-25s %s%n",
                    baseline.benchmarkName(),
                    Formats.seconds(baseline.executionTime()),
                    baseline.totalQueries(),
                    baseline.performanceScore() + "/100",
                    baseline.createdAt() == null ? "-" : baseline.createdAt().toString(),
                    baseline.gitBranch() == null ? "-" : baseline.gitBranch() + "@" + baseline.gitCommit());
        }
        return EXIT_OK;
    }

    private LogAnalysis analyzeLog(Path logFile, String[] args, BenchmarkConfig config) throws IOException {
        QueryLogFileConnector connector = new QueryLogFileConnector(logFile);
        double executionTime = executionTime(args, connector);

        QueryCollector collector = new QueryCollector();
        Advisor advisor = new Advisor(collector, config.getAdvisor());
        if (!advisor.isEnabled()) {
            return new LogAnalysis(connector.getBenchmarkName(), executionTime, null, null, 0, 0);
        }

        int replayed = connector.replayInto(collector);
        log.info("Analyzing {} queries from {}", replayed, logFile);

        AdvisorReport report = advisor.analyze();
        PerformanceScore score = new PerformanceScore(report, executionTime, config.getAdvisor().nPlusOneSavingsRatio());
        return new LogAnalysis(connector.getBenchmarkName(), executionTime, report, score,
                report.getTotalQueries(), report.getTotalDbTime());
    }

    private BaselineResult baselineFromLog(String name, Path logFile, String[] args, BenchmarkConfig config)
            throws IOException {
        LogAnalysis analysis = analyzeLog(logFile, args, config);
        return BaselineResult.fromSingleRun(
                name,
                QueryLogFileConnector.class.getSimpleName(),
                analysis.executionTime(),
                0,
                0,
                analysis.totalQueries(),
                analysis.totalDbTime(),
                analysis.score() == null ? 0 : analysis.score().getScore(),
                Map.of("source", logFile.toString()),
                GitInfo.detect());
    }

    private Optional<BaselineResult> resolveBaseline(BaselineStorage storage, String reference) throws IOException {
        Path path = Paths.get(reference);
        if (Files.isRegularFile(path)) {
            return Optional.of(storage.read(path));
        }
        return storage.load(reference);
    }

    /**
     * The current side of a comparison is either a saved baseline file or a query log.
     */
    private BaselineResult readCurrent(BaselineStorage storage, Path file, String benchmarkName,
                                       String[] args, BenchmarkConfig config) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("File not found: " + file);
        }
        ObjectMapper objectMapper = JsonMappers.create();
        JsonNode root = objectMapper.readTree(file.toFile());
        if (root != null && root.has("queries")) {
            return baselineFromLog(benchmarkName, file, args, config);
        }
        return storage.read(file);
    }

    private static double executionTime(String[] args, QueryLogFileConnector connector) {
        String value = optionValue(args, "--execution-time");
        if (value != null) {
            try {
                double seconds = Double.parseDouble(value);
                if (seconds < 0) {
                    throw new IllegalArgumentException("Execution time must not be negative: " + value);
                }
                return seconds;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid execution time: " + value, e);
            }
        }
        // Unknown duration disables the DB-time share penalty
        return connector.getExecutionTime().orElse(0);
    }

    static List<String> positionals(String[] args) {
        List<String> positionals = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("-")) {
                if (VALUE_OPTIONS.contains(arg) || isRuleOption(arg)) {
                    i++;
                }
                continue;
            }
            positionals.add(arg);
        }
        return positionals;
    }

    private static boolean isRuleOption(String arg) {
        return arg.startsWith("--advisor.") && arg.indexOf('.', "--advisor.".length()) > 0;
    }

    private static String optionValue(String[] args, String... names) {
        List<String> accepted = Arrays.asList(names);
        for (int i = 0; i < args.length - 1; i++) {
            if (accepted.contains(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    private static boolean hasFlag(String[] args, String flag) {
        return Arrays.asList(args).contains(flag);
    }

    private static void requirePositionals(List<String> positionals, int count, String usage) {
        if (positionals.size() < count) {
            throw new IllegalArgumentException("Missing arguments. Usage: " + usage);
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                (args.length > 0 && args[0].equals("help"));
    }

    private void printUsage() {
        out.println("\nUsage: java -jar dbbench.jar <command> [arguments] [options]");
        out.println();
        out.println("Commands:");
        out.println("  analyze <query-log.json>               Analyze recorded queries and print the advisor report");
        out.println("  baseline save <name> <query-log.json>  Save a baseline from recorded queries");
        out.println("  compare <baseline> <current.json>      Compare a run (query log or baseline file) against");
        out.println("                                         a baseline (file or saved name)");
        out.println("  baselines list                         List saved baselines");
        out.println("  help                                   Show this help message");
        out.println();
        out.println("Options:");
        out.println("  --execution-time <s>   Wall-clock duration of the recorded workload in seconds");
        out.println("  --format, -f           Output format for analyze: text|json (default: text)");
        out.println("  --output, -o <file>    Write the analyze report to a file");
        out.println("  --export <file>        Export the comparison as JSON");
        out.println("  --fail-on-regression   Exit with 1 when a critical regression is found");
        out.println("  --help, -h             Show this help message");
        out.println();
        out.println(ConfigurationLoader.getConfigurationHelp());
        out.println("Exit codes: 0 success, 1 failure or critical regression, 2 baseline not found");
    }

    private record LogAnalysis(String benchmarkName,
                               double executionTime,
                               AdvisorReport report,
                               PerformanceScore score,
                               int totalQueries,
                               double totalDbTime) {
    }
}
