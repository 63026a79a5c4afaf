package io.cscan.model;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Complete scan report: one entry per analyzed file plus run metadata.
 *
 * @param scanStartTime When the scan started
 * @param scanDuration  How long the scan took
 * @param files         Per-file results, in the order the files were analyzed
 * @param configuration Configuration used for the scan
 */
public record ScanReport(
        Instant scanStartTime,
        Duration scanDuration,
        List<FileReport> files,
        ScanConfiguration configuration
) {
    /**
     * Findings for one source file, in discovery order.
     *
     * @param path      the analyzed file
     * @param lineCount number of lines in the file
     * @param findings  findings for the file
     */
    public record FileReport(Path path, int lineCount, List<Finding> findings) {
        public FileReport {
            if (path == null) {
                throw new IllegalArgumentException("path cannot be null");
            }
            findings = findings == null ? List.of() : List.copyOf(findings);
        }
    }

    /**
     * Configuration snapshot used for the scan.
     */
    public record ScanConfiguration(
            Severity minimumSeverity,
            List<String> enabledDetectors
    ) {}

    /**
     * Compact constructor with validation.
     */
    public ScanReport {
        files = files == null ? List.of() : List.copyOf(files);
    }

    /**
     * Returns every finding across all files, file by file.
     */
    public List<Finding> findings() {
        List<Finding> all = new ArrayList<>();
        for (FileReport file : files) {
            all.addAll(file.findings());
        }
        return all;
    }

    /**
     * Returns a copy of this report keeping only findings at or above the given severity.
     */
    public ScanReport filteredTo(Severity minimumSeverity) {
        List<FileReport> filtered = files.stream()
                .map(f -> new FileReport(f.path(), f.lineCount(), f.findings().stream()
                        .filter(finding -> finding.severity().isAtLeast(minimumSeverity))
                        .toList()))
                .toList();
        return new ScanReport(scanStartTime, scanDuration, filtered, configuration);
    }

    /**
     * Returns findings grouped by severity.
     */
    public Map<Severity, List<Finding>> findingsBySeverity() {
        return findings().stream()
                .collect(Collectors.groupingBy(Finding::severity));
    }

    /**
     * Returns finding counts keyed by error type label, most frequent first.
     */
    public Map<String, Long> countsByErrorType() {
        Map<String, Long> counts = findings().stream()
                .collect(Collectors.groupingBy(Finding::errorTypeLabel, Collectors.counting()));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue,
                        (a, b) -> a, LinkedHashMap::new));
    }

    /**
     * Returns true if there are any findings at or above the given severity.
     */
    public boolean hasFindingsAtLeast(Severity minimumSeverity) {
        return findings().stream()
                .anyMatch(f -> f.severity().isAtLeast(minimumSeverity));
    }

    public int totalFindings() {
        return files.stream().mapToInt(f -> f.findings().size()).sum();
    }

    public int filesScanned() {
        return files.size();
    }

    public int linesScanned() {
        return files.stream().mapToInt(FileReport::lineCount).sum();
    }

    public long errorCount() {
        return countBySeverity(Severity.ERROR);
    }

    public long warningCount() {
        return countBySeverity(Severity.WARNING);
    }

    public long infoCount() {
        return countBySeverity(Severity.INFO);
    }

    private long countBySeverity(Severity severity) {
        return findings().stream()
                .filter(f -> f.severity() == severity)
                .count();
    }

    /**
     * Returns the scan date as LocalDateTime.
     */
    public LocalDateTime scanDate() {
        return scanStartTime != null
                ? LocalDateTime.ofInstant(scanStartTime, ZoneId.systemDefault())
                : LocalDateTime.now();
    }

    /**
     * Returns the scan duration in milliseconds.
     */
    public long scanDurationMs() {
        return scanDuration != null ? scanDuration.toMillis() : 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Instant scanStartTime;
        private Duration scanDuration;
        private final List<FileReport> files = new ArrayList<>();
        private ScanConfiguration configuration;

        public Builder scanStartTime(Instant scanStartTime) {
            this.scanStartTime = scanStartTime;
            return this;
        }

        public Builder scanDuration(Duration scanDuration) {
            this.scanDuration = scanDuration;
            return this;
        }

        public Builder addFile(FileReport file) {
            this.files.add(file);
            return this;
        }

        public Builder configuration(ScanConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public ScanReport build() {
            return new ScanReport(scanStartTime, scanDuration, files, configuration);
        }
    }
}
