package org.carball.placement.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.carball.placement.analyzer.EmptyBatchException;
import org.carball.placement.analyzer.PlacementAnalyzer;
import org.carball.placement.config.BlockingProfile;
import org.carball.placement.config.ConfigurationLoader;
import org.carball.placement.config.OutputFormat;
import org.carball.placement.config.PlacementAnalyzerConfig;
import org.carball.placement.model.analysis.AnalysisResult;
import org.carball.placement.model.analysis.BlockingVerdict;
import org.carball.placement.output.BlockingReport;
import org.carball.placement.parser.PlacementCsvLoader;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@Slf4j
public class PlacementAnalyzerCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║          Ad Network Placement Blocking Analyzer v%s         ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    static final String BLOCKED_PLACEMENTS_FILE = "blocked-placements.csv";
    static final String TEXT_REPORT_FILE = "analysis-report.txt";
    static final String JSON_REPORT_FILE = "analysis-report.json";

    private static final String DEFAULT_OUTPUT_DIRECTORY = "output";
    private static final String UTF8_BOM = "\uFEFF";

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (hasFlag(args, "--help-profiles")) {
            System.out.println(BlockingProfile.getProfileHelp());
            System.exit(0);
        }
        if (hasFlag(args, "--help-thresholds")) {
            System.out.println(ConfigurationLoader.getThresholdHelp());
            System.exit(0);
        }
        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length < 1 ? 1 : 0);
        }

        try {
            PlacementAnalyzerConfig config = parseArgs(args);
            if (config.isVerbose()) {
                enableDebugLogging();
            }
            validateConfig(config);

            System.out.println("\n🔍 Starting analysis...");
            System.out.println("   Placement export: " + config.getInputFile());
            System.out.println("   Output directory: " + config.getOutputDirectory());
            System.out.println("   Thresholds: " + config.getThresholds().getConfigurationSummary());
            System.out.println();

            PlacementAnalyzer analyzer = new PlacementAnalyzer(
                    config.getThresholds(), new PlacementCsvLoader(config.getPreambleLines()));

            // Step 1: Load and analyze placements
            System.out.print("📊 Analyzing placements... ");
            AnalysisResult result = analyzer.analyze(config.getInputFile());
            System.out.println("✓");

            // Step 2: Output results
            System.out.print("📝 Writing results... ");
            List<Path> written = outputResults(result, config);
            System.out.println("✓");

            printSummary(result);

            System.out.println("\n✅ Analysis complete!");
            System.out.println("   Output files:");
            written.forEach(path -> System.out.println("     - " + path));

            if (result.verdicts().isEmpty()) {
                System.out.println("\n💡 No placements to block were found.");
            }

        } catch (EmptyBatchException e) {
            System.err.println("\n❌ No placements found in the export: " + e.getMessage());
            log.debug("Empty input details", e);
            System.exit(1);
        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            System.exit(1);
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            System.exit(1);
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return hasFlag(args, "--help") || hasFlag(args, "-h") || hasFlag(args, "help");
    }

    private static boolean hasFlag(String[] args, String flag) {
        return Arrays.asList(args).contains(flag);
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar placement-analyzer.jar <placements.csv> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  placements.csv          Placement statistics export (semicolon separated)");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output-dir, -o        Output directory (default: output)");
        System.out.println("  --format, -f            Report format: text|json|both (default: text)");
        System.out.println("  --profile               Threshold profile: " + BlockingProfile.getAvailableProfiles());
        System.out.println("  --thresholds            YAML file with custom blocking thresholds (optional)");
        System.out.println("  --thresholds.<key>      Override a single threshold, e.g. --thresholds.fraud-ctr 40");
        System.out.println("  --preamble-lines        Lines before the column header (default: "
                + PlacementCsvLoader.DEFAULT_PREAMBLE_LINES + ")");
        System.out.println("  --verbose, -v           Enable verbose output");
        System.out.println("  --help, -h              Show this help message");
        System.out.println("  --help-profiles         Describe the threshold profiles");
        System.out.println("  --help-thresholds       List every threshold with its CLI option and env variable");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  # Basic analysis");
        System.out.println("  java -jar placement-analyzer.jar placements.csv");
        System.out.println();
        System.out.println("  # Stricter blocking, both report formats");
        System.out.println("  java -jar placement-analyzer.jar placements.csv --profile strict --format both");
        System.out.println();
        System.out.println("  # Custom thresholds with a single override");
        System.out.println("  java -jar placement-analyzer.jar placements.csv --thresholds my-thresholds.yml "
                + "--thresholds.cpa-multiplier 3");
    }

    static PlacementAnalyzerConfig parseArgs(String[] args) {
        return parseArgs(args, new ConfigurationLoader());
    }

    static PlacementAnalyzerConfig parseArgs(String[] args, ConfigurationLoader configurationLoader) {
        if (args.length < 1 || args[0].startsWith("-")) {
            throw new IllegalArgumentException("Placement export file not specified");
        }

        PlacementAnalyzerConfig config = new PlacementAnalyzerConfig();
        config.setInputFile(Paths.get(args[0]));

        // Set defaults
        config.setOutputDirectory(Paths.get(DEFAULT_OUTPUT_DIRECTORY));
        config.setOutputFormat(OutputFormat.TEXT);
        config.setPreambleLines(PlacementCsvLoader.DEFAULT_PREAMBLE_LINES);
        config.setVerbose(false);

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--thresholds.")) {
                // Value is picked up by the configuration loader
                requireValue(args, i, "Value for " + arg + " not specified");
                i++;
                continue;
            }

            switch (arg) {
                case "--output-dir":
                case "-o":
                    config.setOutputDirectory(Paths.get(requireValue(args, i++, "Output directory not specified")));
                    break;

                case "--format":
                case "-f":
                    String format = requireValue(args, i++, "Output format not specified");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(format.toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: text, json, or both");
                    }
                    break;

                case "--profile":
                    config.setProfileName(requireValue(args, i++, "Profile name not specified"));
                    break;

                case "--thresholds":
                    config.setThresholdsFile(Paths.get(requireValue(args, i++, "Threshold config file not specified")));
                    break;

                case "--preamble-lines":
                    String lines = requireValue(args, i++, "Preamble line count not specified");
                    try {
                        config.setPreambleLines(Integer.parseInt(lines));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid preamble line count: " + lines);
                    }
                    if (config.getPreambleLines() < 0) {
                        throw new IllegalArgumentException("Preamble line count must not be negative");
                    }
                    break;

                case "--verbose":
                case "-v":
                    config.setVerbose(true);
                    break;

                default:
                    throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        config.setThresholds(configurationLoader.loadConfiguration(
                config.getProfileName(), config.getThresholdsFile(), args));

        return config;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index + 1];
    }

    static void validateConfig(PlacementAnalyzerConfig config) {
        if (!Files.exists(config.getInputFile())) {
            throw new IllegalArgumentException("Placement export file not found: " + config.getInputFile());
        }

        if (Files.isDirectory(config.getInputFile())) {
            throw new IllegalArgumentException("Placement export must be a file, not a directory");
        }

        if (Files.exists(config.getOutputDirectory()) && !Files.isDirectory(config.getOutputDirectory())) {
            throw new IllegalArgumentException("Output path is not a directory: " + config.getOutputDirectory());
        }
    }

    static List<Path> outputResults(AnalysisResult result, PlacementAnalyzerConfig config) throws IOException {
        BlockingReport report = new BlockingReport(result);
        Path outputDirectory = config.getOutputDirectory();
        Files.createDirectories(outputDirectory);

        List<Path> written = new ArrayList<>();

        if (!result.verdicts().isEmpty()) {
            // BOM so spreadsheet applications detect UTF-8
            Path csvFile = outputDirectory.resolve(BLOCKED_PLACEMENTS_FILE);
            Files.writeString(csvFile, UTF8_BOM + report.toCsv(), StandardCharsets.UTF_8);
            written.add(csvFile);
        }

        if (config.getOutputFormat() == OutputFormat.TEXT || config.getOutputFormat() == OutputFormat.BOTH) {
            Path textFile = outputDirectory.resolve(TEXT_REPORT_FILE);
            Files.writeString(textFile, report.toText(), StandardCharsets.UTF_8);
            written.add(textFile);
        }

        if (config.getOutputFormat() == OutputFormat.JSON || config.getOutputFormat() == OutputFormat.BOTH) {
            Path jsonFile = outputDirectory.resolve(JSON_REPORT_FILE);
            Files.writeString(jsonFile, report.toJson(), StandardCharsets.UTF_8);
            written.add(jsonFile);
        }

        log.info("Wrote {} output files to {}", written.size(), outputDirectory);
        return written;
    }

    private static void printSummary(AnalysisResult result) {
        BlockingReport report = new BlockingReport(result);
        int total = result.records().size();
        int blocked = result.verdicts().size();
        double totalSpend = result.statistics().totalSpend();
        double blockedSpend = result.blockedSpend();

        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 ANALYSIS SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nPlacements analyzed: " + total);
        System.out.printf(Locale.ROOT, "Placements to block: %d (%.1f%%)%n",
                blocked, total == 0 ? 0 : blocked * 100.0 / total);
        System.out.printf(Locale.ROOT, "Potential savings: %.2f (%.1f%% of %.2f)%n",
                blockedSpend, totalSpend == 0 ? 0 : blockedSpend * 100.0 / totalSpend, totalSpend);

        if (blocked == 0) {
            return;
        }

        System.out.println("\n🎯 Top Blocking Criteria:");
        System.out.println("-".repeat(60));
        report.summarizeByCriterion().stream()
                .sorted((a, b) -> Integer.compare(b.count(), a.count()))
                .limit(3)
                .forEach(summary -> System.out.printf(Locale.ROOT, "  %-10s %5d placements  %10.2f%n",
                        summary.key(), summary.count(), summary.spend()));

        System.out.println("\n💸 Most Expensive Placements to Block:");
        System.out.println("-".repeat(60));
        for (BlockingVerdict verdict : BlockingReport.topBySpend(result.verdicts(), 3)) {
            System.out.printf(Locale.ROOT, "  %-35s %10.2f%n", verdict.placement(), verdict.spend());
            System.out.printf("  └─ %s (%s)%n", verdict.reason(), verdict.criterionId());
        }
    }

    private static void enableDebugLogging() {
        Logger logger = (Logger) LoggerFactory.getLogger("org.carball.placement");
        logger.setLevel(Level.DEBUG);
    }
}
