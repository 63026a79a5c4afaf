package io.cscan;

import io.cscan.config.CheckerConfig;
import io.cscan.detectors.DetectorRegistry;
import io.cscan.engine.CAnalyzer;
import io.cscan.engine.SourceScanner;
import io.cscan.model.ScanReport;
import io.cscan.model.Severity;
import io.cscan.report.ConsoleReporter;
import io.cscan.report.JsonReporter;
import io.cscan.report.Reporter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for the c-scan tool.
 */
@Command(
        name = "c-scan",
        mixinStandardHelpOptions = true,
        version = "c-scan 1.0.0",
        description = "Scans C source files for common mistakes: memory errors, uninitialized variables, "
                + "standard library misuse, narrowing overflow and infinite loops.",
        footer = {
                "",
                "Examples:",
                "  c-scan hello.c",
                "  c-scan src/ --output-format json --output-file report.json",
                "  c-scan src/ --severity-threshold warning --fail-on warning",
                "  c-scan main.c --detectors memory-safety,uninitialized-variable"
        }
)
public class CScanCli implements Callable<Integer> {

    @Parameters(
            arity = "1..*",
            description = "C source files or directories to scan (directories are searched for .c and .h files)"
    )
    private List<Path> paths;

    @Option(
            names = {"-o", "--output-format"},
            description = "Output format: console (default), json",
            defaultValue = "console"
    )
    private OutputFormat outputFormat;

    @Option(
            names = {"-f", "--output-file"},
            description = "Output file path (defaults to stdout)"
    )
    private Path outputFile;

    @Option(
            names = {"-c", "--config"},
            description = "Path to configuration YAML file"
    )
    private Path configFile;

    @Option(
            names = {"-s", "--severity-threshold"},
            description = "Minimum severity to report: error, warning, info",
            defaultValue = "info"
    )
    private String severityThreshold;

    @Option(
            names = {"--fail-on"},
            description = "Exit with code 2 if findings at this severity or higher: error, warning, info",
            defaultValue = "error"
    )
    private String failOnLevel;

    @Option(
            names = {"--detectors"},
            description = "Comma-separated detector ids to run (default: all). "
                    + "Ids: memory-safety, uninitialized-variable, standard-library, numeric-control-flow",
            split = ","
    )
    private List<String> detectorIds;

    @Option(
            names = {"--no-color"},
            description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose output"
    )
    private boolean verbose;

    public enum OutputFormat {
        console,
        json
    }

    @Override
    public Integer call() {
        try {
            Severity minSeverity = parseSeverity(severityThreshold, "severity-threshold");
            if (minSeverity == null) return 1;

            Severity failLevel = parseSeverity(failOnLevel, "fail-on");
            if (failLevel == null) return 1;

            if (outputFormat != OutputFormat.json) {
                printBanner();
            }

            CheckerConfig config = loadConfig();

            DetectorRegistry registry = DetectorRegistry.createDefault();
            if (detectorIds != null && !detectorIds.isEmpty()) {
                registry = registry.select(detectorIds.stream().map(String::trim).toList());
            }
            CAnalyzer analyzer = new CAnalyzer(config, registry);
            log("Detectors: " + String.join(", ", analyzer.detectors().stream().map(d -> d.id()).toList()));

            log("Scanning " + paths.size() + " path(s)...");
            ScanReport report = new SourceScanner(analyzer).scan(paths, minSeverity);
            log("  Analyzed " + report.filesScanned() + " files, " + report.linesScanned() + " lines");

            ScanReport filtered = report.filteredTo(minSeverity);
            log("  Found " + filtered.totalFindings() + " findings (of " + report.totalFindings()
                    + " total, filtered to " + minSeverity.label() + "+)");

            writeReport(filtered, createReporter());

            if (filtered.hasFindingsAtLeast(failLevel)) {
                if (outputFormat == OutputFormat.console) {
                    System.err.println();
                    System.err.println("Failing due to findings at " + failLevel.label() + " level or higher.");
                }
                return 2;
            }

            return 0;

        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    private CheckerConfig loadConfig() throws IOException {
        CheckerConfig defaultConfig = CheckerConfig.loadDefault();

        if (configFile != null) {
            if (!Files.exists(configFile)) {
                throw new IOException("Config file does not exist: " + configFile);
            }
            log("Loading configuration from: " + configFile);
            return defaultConfig.merge(CheckerConfig.loadFromFile(configFile));
        }

        // Check for c-scan.yaml in the working directory
        Path localConfig = Path.of("c-scan.yaml");
        if (Files.exists(localConfig)) {
            log("Loading configuration from: " + localConfig.toAbsolutePath());
            return defaultConfig.merge(CheckerConfig.loadFromFile(localConfig));
        }

        return defaultConfig;
    }

    private Reporter createReporter() {
        return switch (outputFormat) {
            case console -> new ConsoleReporter(!noColor);
            case json -> new JsonReporter(true);
        };
    }

    private void writeReport(ScanReport report, Reporter reporter) throws IOException {
        if (outputFile != null) {
            reporter.write(report, outputFile);
            if (outputFormat == OutputFormat.console) {
                System.out.println("Report written to: " + outputFile);
            }
        } else {
            reporter.write(report, new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
        }
    }

    private void log(String message) {
        if (verbose && outputFormat != OutputFormat.json) {
            System.out.println(message);
        }
    }

    private Severity parseSeverity(String value, String optionName) {
        try {
            return Severity.parse(value);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: Invalid value for --" + optionName + ": " + value);
            System.err.println("Valid values: error, warning, info");
            return null;
        }
    }

    private void printBanner() {
        System.out.println("""
                ╔═══════════════════════════════════════════════════════════════╗
                ║                            C-SCAN                             ║
                ║        Static Checks for Common C Programming Mistakes        ║
                ╚═══════════════════════════════════════════════════════════════╝
                """);
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CScanCli()).execute(args);
        System.exit(exitCode);
    }
}
