package io.cscan.report;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleReporterTest {

    private ConsoleReporter reporter;

    @BeforeEach
    void setUp() {
        reporter = new ConsoleReporter(false);
    }

    @Test
    void write_printsSummaryAndBreakdown() {
        String output = reporter.toString(ReportFixtures.sampleReport());

        assertThat(output)
                .contains("C-SCAN REPORT")
                .contains("Scanned: 3 files | 25 lines | ")
                .contains("Findings: 1 errors | 1 warnings | 0 info")
                .contains("BY ERROR TYPE")
                .contains("  Memory-Leak: 1")
                .contains("  Null-Pointer-Dereference: 1");
    }

    @Test
    void write_printsFindingsGroupedByFile() {
        String output = reporter.toString(ReportFixtures.sampleReport());

        assertThat(output)
                .contains("[ERROR] line 3: Null-Pointer-Dereference [Memory-Safety]")
                .contains("    Code: *p = 5;")
                .contains("    Suggestion: Assign 'p' a valid address")
                .contains("[WARN] line 2: Memory-Leak [Memory-Safety]")
                .doesNotContain("clean.c");
        assertThat(output.indexOf("main.c")).isLessThan(output.indexOf("util.c"));
    }

    @Test
    void write_footerAsksForActionOnErrors() {
        assertThat(reporter.toString(ReportFixtures.sampleReport()))
                .contains("ACTION REQUIRED: 1 error(s) found.");
    }

    @Test
    void write_cleanReport() {
        String output = reporter.toString(ReportFixtures.emptyReport());

        assertThat(output)
                .contains("Findings: 0 errors | 0 warnings | 0 info")
                .contains("No problems found.")
                .doesNotContain("BY ERROR TYPE");
    }

    @Test
    void write_withoutColorsHasNoEscapeCodes() {
        assertThat(reporter.toString(ReportFixtures.sampleReport())).doesNotContain("\u001B[");
    }

    @Test
    void write_withColorsHighlightsSeverity() {
        String output = new ConsoleReporter(true).toString(ReportFixtures.sampleReport());

        assertThat(output).contains("\u001B[31m[ERROR]\u001B[0m");
    }
}
