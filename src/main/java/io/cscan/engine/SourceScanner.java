package io.cscan.engine;

import io.cscan.detectors.Detector;
import io.cscan.model.Finding;
import io.cscan.model.ScanReport;
import io.cscan.model.ScanReport.FileReport;
import io.cscan.model.Severity;
import io.cscan.source.SourceText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads C files from disk and runs the analyzer over each of them.
 * <p>
 * Directories are walked recursively for {@code .c} and {@code .h} files, in sorted order so
 * reports are stable. Files must be UTF-8; anything else is rejected as unreadable.
 */
public class SourceScanner {

    private static final Logger log = LoggerFactory.getLogger(SourceScanner.class);

    private final CAnalyzer analyzer;

    public SourceScanner(CAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    /**
     * Analyzes every C file under the given paths.
     *
     * @param paths           files or directories
     * @param minimumSeverity recorded in the report's configuration snapshot
     * @return the scan report
     * @throws IOException if a path does not exist or a file cannot be read as UTF-8 text
     */
    public ScanReport scan(List<Path> paths, Severity minimumSeverity) throws IOException {
        Instant start = Instant.now();
        ScanReport.Builder report = ScanReport.builder()
                .scanStartTime(start)
                .configuration(new ScanReport.ScanConfiguration(minimumSeverity,
                        analyzer.detectors().stream().map(Detector::id).toList()));

        for (Path file : collectFiles(paths)) {
            String text = readSource(file);
            List<Finding> findings = analyzer.analyze(text);
            log.debug("{}: {} findings", file, findings.size());
            report.addFile(new FileReport(file, SourceText.lines(text).size(), findings));
        }

        return report.scanDuration(Duration.between(start, Instant.now())).build();
    }

    /**
     * Expands directories into the C files they contain.
     *
     * @throws IOException if a path does not exist
     */
    public static List<Path> collectFiles(List<Path> paths) throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                List<Path> found = new ArrayList<>();
                Files.walkFileTree(path, new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (isCSource(file)) {
                            found.add(file);
                        }
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) {
                        log.warn("Cannot read {}: {}", file, exc.getMessage());
                        return FileVisitResult.CONTINUE;
                    }
                });
                found.sort(null);
                files.addAll(found);
            } else if (Files.isRegularFile(path)) {
                files.add(path);
            } else {
                throw new IOException("Path does not exist: " + path);
            }
        }
        return files;
    }

    static boolean isCSource(Path file) {
        String name = file.getFileName().toString();
        return name.endsWith(".c") || name.endsWith(".h");
    }

    /**
     * Reads a file as strict UTF-8.
     *
     * @throws IOException if the file cannot be read or is not valid UTF-8
     */
    public static String readSource(Path file) throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IOException("Not a UTF-8 text file: " + file, e);
        }
    }
}
