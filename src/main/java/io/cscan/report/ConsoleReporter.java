package io.cscan.report;

import io.cscan.model.Finding;
import io.cscan.model.ScanReport;
import io.cscan.model.ScanReport.FileReport;
import io.cscan.model.Severity;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.Map;

/**
 * Formats scan results for console output with ANSI colors.
 * <p>
 * Layout:
 * - Summary header with compact stats
 * - Breakdown by error type
 * - Findings per file, in line order, with snippet and suggestion
 */
public class ConsoleReporter implements Reporter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";

    private static final int WIDTH = 70;

    private final boolean useColors;

    public ConsoleReporter() {
        this(true);
    }

    public ConsoleReporter(boolean useColors) {
        this.useColors = useColors;
    }

    @Override
    public String format() {
        return "console";
    }

    @Override
    public void write(ScanReport report, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);

        printHeader(out, report);
        printSummary(out, report);
        printTypeBreakdown(out, report);
        for (FileReport file : report.files()) {
            if (!file.findings().isEmpty()) {
                printFile(out, file);
            }
        }
        printFooter(out, report);
        out.flush();
    }

    private void printHeader(PrintWriter out, ScanReport report) {
        out.println();
        out.println(line('=', WIDTH));
        out.println(center("C-SCAN REPORT", WIDTH));
        out.println(line('=', WIDTH));
        out.println();
        out.println("Scan Date: " + report.scanDate());
        out.println();
    }

    private void printSummary(PrintWriter out, ScanReport report) {
        out.println(bold("SUMMARY"));
        out.println(line('-', WIDTH));

        out.println(String.format("Scanned: %,d files | %,d lines | %.1fs",
                report.filesScanned(),
                report.linesScanned(),
                report.scanDurationMs() / 1000.0));

        long errors = report.errorCount();
        long warnings = report.warningCount();

        StringBuilder findings = new StringBuilder("Findings: ");
        if (errors > 0) {
            findings.append(color(RED, errors + " errors")).append(" | ");
        } else {
            findings.append("0 errors | ");
        }
        if (warnings > 0) {
            findings.append(color(YELLOW, warnings + " warnings")).append(" | ");
        } else {
            findings.append("0 warnings | ");
        }
        findings.append(report.infoCount()).append(" info");
        out.println(findings);
        out.println();
    }

    private void printTypeBreakdown(PrintWriter out, ScanReport report) {
        Map<String, Long> counts = report.countsByErrorType();
        if (counts.isEmpty()) {
            return;
        }
        out.println(bold("BY ERROR TYPE"));
        out.println(line('-', 40));
        counts.forEach((type, count) -> out.printf("  %s: %d%n", type, count));
        out.println();
    }

    private void printFile(PrintWriter out, FileReport file) {
        out.println(bold(file.path().toString()) + " (" + file.findings().size() + ")");
        out.println(line('-', WIDTH));
        for (Finding finding : file.findings()) {
            printFinding(out, finding);
        }
        out.println();
    }

    private void printFinding(PrintWriter out, Finding finding) {
        out.println(severityIndicator(finding.severity()) + " line " + finding.lineNumber() + ": "
                + bold(finding.errorTypeLabel()) + " [" + finding.moduleName() + "]");
        out.println("    " + finding.message());
        if (!finding.codeSnippet().isEmpty()) {
            out.println("    Code: " + finding.codeSnippet());
        }
        if (!finding.suggestion().isEmpty()) {
            out.println("    " + color(GREEN, "Suggestion: " + finding.suggestion()));
        }
    }

    private void printFooter(PrintWriter out, ScanReport report) {
        out.println(line('=', WIDTH));

        long errors = report.errorCount();
        long warnings = report.warningCount();

        if (errors > 0) {
            out.println(color(RED, bold("ACTION REQUIRED: " + errors + " error(s) found.")));
        } else if (warnings > 0) {
            out.println(color(YELLOW, "ATTENTION: " + warnings + " warning(s) should be reviewed."));
        } else {
            out.println(color(GREEN, "No problems found."));
        }
        out.println();
    }

    private String severityIndicator(Severity severity) {
        return switch (severity) {
            case ERROR -> color(RED, "[ERROR]");
            case WARNING -> color(YELLOW, "[WARN]");
            case INFO -> color(CYAN, "[INFO]");
        };
    }

    // Formatting helpers

    private String color(String color, String text) {
        if (!useColors) return text;
        return color + text + RESET;
    }

    private String bold(String text) {
        if (!useColors) return text;
        return BOLD + text + RESET;
    }

    private String line(char c, int length) {
        return String.valueOf(c).repeat(length);
    }

    private String center(String text, int width) {
        if (text.length() >= width) return text;
        int padding = (width - text.length()) / 2;
        return " ".repeat(padding) + text;
    }
}
