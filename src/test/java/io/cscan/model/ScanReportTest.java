package io.cscan.model;

import io.cscan.model.ScanReport.FileReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ScanReportTest {

    private ScanReport report;

    private static Finding finding(int line, ErrorType type) {
        return Finding.builder().lineNumber(line).errorType(type).message(type.label() + " found").build();
    }

    private static Finding info(int line, ErrorType type) {
        return Finding.builder().lineNumber(line).errorType(type).severity(Severity.INFO)
                .message(type.label() + " noted").build();
    }

    @BeforeEach
    void setUp() {
        report = ScanReport.builder()
                .scanStartTime(Instant.now())
                .scanDuration(Duration.ofMillis(250))
                .addFile(new FileReport(Path.of("a.c"), 10, List.of(
                        finding(2, ErrorType.MISSING_HEADER),
                        finding(5, ErrorType.UNINITIALIZED_VARIABLE),
                        finding(7, ErrorType.UNINITIALIZED_VARIABLE))))
                .addFile(new FileReport(Path.of("b.c"), 4, List.of(
                        info(1, ErrorType.TYPE_OVERFLOW))))
                .build();
    }

    @Test
    void totals_countAcrossFiles() {
        assertThat(report.filesScanned()).isEqualTo(2);
        assertThat(report.linesScanned()).isEqualTo(14);
        assertThat(report.totalFindings()).isEqualTo(4);
        assertThat(report.errorCount()).isEqualTo(1);
        assertThat(report.warningCount()).isEqualTo(2);
        assertThat(report.infoCount()).isEqualTo(1);
        assertThat(report.scanDurationMs()).isEqualTo(250);
    }

    @Test
    void findings_keepFileThenLineOrder() {
        assertThat(report.findings())
                .extracting(Finding::lineNumber)
                .containsExactly(2, 5, 7, 1);
    }

    @Test
    void countsByErrorType_mostFrequentFirst() {
        assertThat(report.countsByErrorType().keySet())
                .containsExactly("Uninitialized-Variable", "Missing-Header", "Type-Overflow");
        assertThat(report.countsByErrorType()).containsEntry("Uninitialized-Variable", 2L);
    }

    @Test
    void filteredTo_dropsFindingsBelowThreshold() {
        ScanReport warnings = report.filteredTo(Severity.WARNING);

        assertThat(warnings.totalFindings()).isEqualTo(3);
        assertThat(warnings.filesScanned()).isEqualTo(2);
        assertThat(warnings.linesScanned()).isEqualTo(14);
        assertThat(report.filteredTo(Severity.ERROR).findings())
                .extracting(Finding::errorType)
                .containsExactly(ErrorType.MISSING_HEADER);
    }

    @Test
    void hasFindingsAtLeast_respectsSeverityOrder() {
        assertThat(report.hasFindingsAtLeast(Severity.ERROR)).isTrue();
        assertThat(report.filteredTo(Severity.INFO).hasFindingsAtLeast(Severity.ERROR)).isTrue();

        ScanReport infoOnly = ScanReport.builder()
                .addFile(new FileReport(Path.of("c.c"), 1, List.of(
                        info(1, ErrorType.TYPE_OVERFLOW))))
                .build();
        assertThat(infoOnly.hasFindingsAtLeast(Severity.WARNING)).isFalse();
        assertThat(infoOnly.hasFindingsAtLeast(Severity.INFO)).isTrue();
    }

    @Test
    void findingsBySeverity_groupsFindings() {
        assertThat(report.findingsBySeverity().get(Severity.WARNING)).hasSize(2);
        assertThat(report.findingsBySeverity().get(Severity.INFO))
                .extracting(Finding::errorType)
                .containsExactly(ErrorType.TYPE_OVERFLOW);
    }
}
