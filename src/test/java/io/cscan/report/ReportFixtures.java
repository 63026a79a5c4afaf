package io.cscan.report;

import io.cscan.model.ErrorType;
import io.cscan.model.Finding;
import io.cscan.model.ScanReport;
import io.cscan.model.ScanReport.FileReport;
import io.cscan.model.ScanReport.ScanConfiguration;
import io.cscan.model.Severity;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

final class ReportFixtures {

    private ReportFixtures() {
    }

    static ScanReport sampleReport() {
        Finding nullDeref = Finding.builder()
                .lineNumber(3)
                .errorType(ErrorType.NULL_POINTER_DEREFERENCE)
                .message("Null pointer dereference: 'p' is NULL here")
                .suggestion("Assign 'p' a valid address")
                .codeSnippet("    *p = 5;")
                .build();
        Finding leak = Finding.builder()
                .lineNumber(2)
                .errorType(ErrorType.MEMORY_LEAK)
                .message("Memory leak: memory allocated to 'q' is never freed")
                .build();
        return ScanReport.builder()
                .scanStartTime(Instant.parse("2024-05-01T10:15:30Z"))
                .scanDuration(Duration.ofMillis(1500))
                .addFile(new FileReport(Path.of("src", "main.c"), 12, List.of(nullDeref)))
                .addFile(new FileReport(Path.of("src", "util.c"), 8, List.of(leak)))
                .addFile(new FileReport(Path.of("src", "clean.c"), 5, List.of()))
                .configuration(new ScanConfiguration(Severity.INFO,
                        List.of("memory-safety", "uninitialized-variable")))
                .build();
    }

    static ScanReport emptyReport() {
        return ScanReport.builder()
                .scanStartTime(Instant.parse("2024-05-01T10:15:30Z"))
                .scanDuration(Duration.ofMillis(20))
                .addFile(new FileReport(Path.of("ok.c"), 3, List.of()))
                .configuration(new ScanConfiguration(Severity.WARNING, List.of("memory-safety")))
                .build();
    }
}
