package io.cscan.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cscan.model.ErrorType;
import io.cscan.model.Finding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReporterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonReporter reporter;

    @BeforeEach
    void setUp() {
        reporter = new JsonReporter();
    }

    @Test
    void format_isJson() {
        assertThat(reporter.format()).isEqualTo("json");
    }

    @Test
    void write_includesMetadataAndSummary() throws IOException {
        JsonNode root = mapper.readTree(reporter.toString(ReportFixtures.sampleReport()));

        JsonNode metadata = root.get("metadata");
        assertThat(metadata.get("files_scanned").asInt()).isEqualTo(3);
        assertThat(metadata.get("lines_scanned").asInt()).isEqualTo(25);
        assertThat(metadata.get("scan_duration_ms").asLong()).isEqualTo(1500);
        assertThat(metadata.get("minimum_severity").asText()).isEqualTo("Info");
        assertThat(metadata.get("scan_date").isTextual()).isTrue();

        JsonNode summary = root.get("summary");
        assertThat(summary.get("errors").asLong()).isEqualTo(1);
        assertThat(summary.get("warnings").asLong()).isEqualTo(1);
        assertThat(summary.get("total").asInt()).isEqualTo(2);
        assertThat(summary.get("by_error_type").get("Memory-Leak").asLong()).isEqualTo(1);
    }

    @Test
    void write_serializesFindingsWithSnakeCaseFields() throws IOException {
        JsonNode root = mapper.readTree(reporter.toString(ReportFixtures.sampleReport()));

        JsonNode file = root.get("files").get(0);
        assertThat(file.get("path").asText()).endsWith("main.c");
        assertThat(file.get("line_count").asInt()).isEqualTo(12);

        JsonNode finding = file.get("findings").get(0);
        assertThat(finding.get("line_number").asInt()).isEqualTo(3);
        assertThat(finding.get("error_type").asText()).isEqualTo("Null-Pointer-Dereference");
        assertThat(finding.get("severity").asText()).isEqualTo("Error");
        assertThat(finding.get("code_snippet").asText()).isEqualTo("*p = 5;");
        assertThat(finding.get("module_name").asText()).isEqualTo("Memory-Safety");
    }

    @Test
    void write_keepsFilesWithoutFindings() throws IOException {
        JsonNode root = mapper.readTree(reporter.toString(ReportFixtures.sampleReport()));

        assertThat(root.get("files")).hasSize(3);
        assertThat(root.get("files").get(2).get("findings")).isEmpty();
    }

    @Test
    void writeFindings_producesBareArray() throws IOException {
        Finding finding = Finding.builder()
                .lineNumber(7)
                .errorType(ErrorType.INFINITE_LOOP)
                .message("Infinite loop: 'i' never changes")
                .build();
        StringWriter writer = new StringWriter();

        reporter.writeFindings(List.of(finding), writer);

        JsonNode root = mapper.readTree(writer.toString());
        assertThat(root.isArray()).isTrue();
        assertThat(root.get(0).get("error_type").asText()).isEqualTo("Infinite-Loop");
        assertThat(root.get(0).get("severity").asText()).isEqualTo("Warning");
        assertThat(root.get(0).get("module_name").asText()).isEqualTo("Numeric-&-Control-Flow");
        assertThat(root.get(0).get("suggestion").asText()).isEmpty();
    }

    @Test
    void write_toFile(@TempDir Path tempDir) throws IOException {
        Path out = tempDir.resolve("report.json");

        reporter.write(ReportFixtures.sampleReport(), out);

        assertThat(mapper.readTree(Files.readString(out)).get("summary").get("total").asInt()).isEqualTo(2);
    }
}
