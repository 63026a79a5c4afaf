package io.cscan.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.cscan.model.Finding;
import io.cscan.model.ScanReport;

import java.io.IOException;
import java.io.Writer;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Formats scan results as JSON for machine processing.
 * <p>
 * Property names are snake_case, so each finding serializes as
 * {@code {line_number, error_type, severity, message, suggestion, code_snippet, module_name}}.
 */
public class JsonReporter implements Reporter {

    private final ObjectMapper mapper;
    private final boolean prettyPrint;

    public JsonReporter() {
        this(true);
    }

    public JsonReporter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        this.mapper = createMapper();
    }

    private ObjectMapper createMapper() {
        ObjectMapper m = new ObjectMapper();
        m.registerModule(new JavaTimeModule());
        m.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // the caller owns the writer, which may be stdout
        m.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void write(ScanReport report, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonReport(report));
        writer.flush();
    }

    /**
     * Writes a bare finding array, the shape returned by a single {@code analyze} call.
     */
    public void writeFindings(List<Finding> findings, Writer writer) throws IOException {
        mapper.writeValue(writer, findings.stream().map(JsonReporter::toJsonFinding).toList());
        writer.flush();
    }

    private JsonReport toJsonReport(ScanReport report) {
        return new JsonReport(
                new JsonReport.Metadata(
                        report.scanDate(),
                        report.filesScanned(),
                        report.linesScanned(),
                        report.scanDurationMs(),
                        report.configuration() != null ? report.configuration().minimumSeverity().label() : null,
                        report.configuration() != null ? report.configuration().enabledDetectors() : null
                ),
                new JsonReport.Summary(
                        report.errorCount(),
                        report.warningCount(),
                        report.infoCount(),
                        report.totalFindings(),
                        report.countsByErrorType()
                ),
                report.files().stream()
                        .map(file -> new JsonReport.File(
                                file.path().toString(),
                                file.lineCount(),
                                file.findings().stream().map(JsonReporter::toJsonFinding).toList()))
                        .toList()
        );
    }

    private static JsonReport.Finding toJsonFinding(Finding finding) {
        return new JsonReport.Finding(
                finding.lineNumber(),
                finding.errorTypeLabel(),
                finding.severity().label(),
                finding.message(),
                finding.suggestion(),
                finding.codeSnippet(),
                finding.moduleName()
        );
    }

    /**
     * JSON structure for the report.
     */
    public record JsonReport(
            Metadata metadata,
            Summary summary,
            List<File> files
    ) {
        public record Metadata(
                LocalDateTime scanDate,
                int filesScanned,
                int linesScanned,
                long scanDurationMs,
                String minimumSeverity,
                List<String> enabledDetectors
        ) {}

        public record Summary(
                long errors,
                long warnings,
                long infos,
                int total,
                Map<String, Long> byErrorType
        ) {}

        public record File(
                String path,
                int lineCount,
                List<Finding> findings
        ) {}

        public record Finding(
                int lineNumber,
                String errorType,
                String severity,
                String message,
                String suggestion,
                String codeSnippet,
                String moduleName
        ) {}
    }
}
