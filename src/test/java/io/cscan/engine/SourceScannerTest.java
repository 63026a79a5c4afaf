package io.cscan.engine;

import io.cscan.model.ErrorType;
import io.cscan.model.ScanReport;
import io.cscan.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceScannerTest {

    @TempDir
    Path tempDir;

    private SourceScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new SourceScanner(new CAnalyzer());
    }

    @Test
    void collectFiles_findsCSourcesRecursivelyInSortedOrder() throws IOException {
        Path nested = Files.createDirectories(tempDir.resolve("lib"));
        Files.writeString(tempDir.resolve("main.c"), "int main(void) { return 0; }\n");
        Files.writeString(nested.resolve("util.h"), "int util(void);\n");
        Files.writeString(nested.resolve("util.c"), "int util(void) { return 1; }\n");
        Files.writeString(tempDir.resolve("README.md"), "# notes\n");

        List<Path> files = SourceScanner.collectFiles(List.of(tempDir));

        assertThat(files).containsExactly(
                nested.resolve("util.c"), nested.resolve("util.h"), tempDir.resolve("main.c"));
    }

    @Test
    void collectFiles_acceptsExplicitFileWithAnyExtension() throws IOException {
        Path file = Files.writeString(tempDir.resolve("snippet.txt"), "int x;\n");

        assertThat(SourceScanner.collectFiles(List.of(file))).containsExactly(file);
    }

    @Test
    void collectFiles_rejectsMissingPath() {
        Path missing = tempDir.resolve("missing.c");

        assertThatThrownBy(() -> SourceScanner.collectFiles(List.of(missing)))
                .isInstanceOf(IOException.class)
                .hasMessageStartingWith("Path does not exist:");
    }

    @Test
    void isCSource_matchesSourceAndHeaderFiles() {
        assertThat(SourceScanner.isCSource(Path.of("a.c"))).isTrue();
        assertThat(SourceScanner.isCSource(Path.of("include/a.h"))).isTrue();
        assertThat(SourceScanner.isCSource(Path.of("a.cpp"))).isFalse();
        assertThat(SourceScanner.isCSource(Path.of("Makefile"))).isFalse();
    }

    @Test
    void readSource_rejectsNonUtf8Bytes() throws IOException {
        Path binary = Files.write(tempDir.resolve("blob.c"), new byte[]{(byte) 0xC3, (byte) 0x28, 0x0A});

        assertThatThrownBy(() -> SourceScanner.readSource(binary))
                .isInstanceOf(IOException.class)
                .hasMessageStartingWith("Not a UTF-8 text file:");
    }

    @Test
    void scan_buildsReportPerFile() throws IOException {
        Files.writeString(tempDir.resolve("bad.c"), """
                int main(void) {
                    int x;
                    return x;
                }
                """);
        Files.writeString(tempDir.resolve("good.c"), """
                int main(void) {
                    return 0;
                }
                """);

        ScanReport report = scanner.scan(List.of(tempDir), Severity.INFO);

        assertThat(report.filesScanned()).isEqualTo(2);
        assertThat(report.linesScanned()).isEqualTo(7);
        assertThat(report.totalFindings()).isEqualTo(1);
        assertThat(report.findings().get(0).errorType()).isEqualTo(ErrorType.UNINITIALIZED_VARIABLE);
        assertThat(report.configuration().minimumSeverity()).isEqualTo(Severity.INFO);
        assertThat(report.configuration().enabledDetectors()).hasSize(4);
    }
}
