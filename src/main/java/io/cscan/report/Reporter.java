package io.cscan.report;

import io.cscan.model.ScanReport;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Interface for report output formatters.
 */
public interface Reporter {

    /**
     * Returns the format name ("console" or "json").
     */
    String format();

    /**
     * Writes the report to the given writer.
     */
    void write(ScanReport report, Writer writer) throws IOException;

    /**
     * Writes the report to the given file path as UTF-8.
     */
    default void write(ScanReport report, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(report, writer);
        }
    }

    /**
     * Returns the report as a string.
     */
    default String toString(ScanReport report) {
        try {
            StringWriter writer = new StringWriter();
            write(report, writer);
            return writer.toString();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to generate report", e);
        }
    }
}
