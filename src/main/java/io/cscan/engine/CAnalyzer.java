package io.cscan.engine;

import io.cscan.config.CheckerConfig;
import io.cscan.detectors.Detector;
import io.cscan.detectors.DetectorRegistry;
import io.cscan.model.Finding;
import io.cscan.source.Clause;
import io.cscan.source.ClauseExtractor;
import io.cscan.source.CommentStripper;
import io.cscan.source.SourceText;
import io.cscan.state.AnalysisContext;
import io.cscan.state.VariableStateUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Single-pass analyzer for one C source file.
 * <p>
 * Each line is comment-stripped and split into clauses. Every clause is shown to the enabled
 * detectors first and then applied to the variable store, so detectors always see the state
 * as it was just before the clause ran. After the last line the detectors get a final look
 * (leak detection), and the findings are returned in the order they were discovered.
 * <p>
 * All per-file state lives in a fresh {@link AnalysisContext}, so one instance can analyze
 * many files, from several threads at once.
 */
public class CAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CAnalyzer.class);

    private final CheckerConfig config;
    private final List<Detector> detectors;
    private final VariableStateUpdater updater = new VariableStateUpdater();

    public CAnalyzer() {
        this(CheckerConfig.loadDefault(), DetectorRegistry.createDefault());
    }

    public CAnalyzer(CheckerConfig config, DetectorRegistry registry) {
        this.config = config;
        this.detectors = registry.enabledDetectors(config);
    }

    /**
     * Analyzes one file's text. Never throws for text input; a line that cannot be processed
     * is logged and skipped.
     *
     * @param sourceText the file contents
     * @return findings in discovery order, possibly empty
     */
    public List<Finding> analyze(String sourceText) {
        List<String> lines = SourceText.lines(sourceText);
        if (lines.isEmpty()) {
            return List.of();
        }
        AnalysisContext ctx = new AnalysisContext(config, lines, CommentStripper.strip(lines));
        List<String> stripped = ctx.strippedLines();

        for (int n = 1; n <= lines.size(); n++) {
            ctx.beginLine(n);
            try {
                for (Clause clause : ClauseExtractor.extract(stripped.get(n - 1), n)) {
                    Clause tracked = ctx.track(clause);
                    if (tracked == null) {
                        continue;
                    }
                    for (Detector detector : detectors) {
                        detector.inspect(ctx, tracked);
                    }
                    updater.apply(ctx, tracked);
                }
            } catch (RuntimeException e) {
                log.warn("Skipping line {}: {}", n, e.toString());
                log.debug("Line {} failed", n, e);
            } finally {
                ctx.endLine();
            }
        }

        for (Detector detector : detectors) {
            try {
                detector.finish(ctx);
            } catch (RuntimeException e) {
                log.warn("Detector {} failed at end of file: {}", detector.id(), e.toString());
            }
        }
        log.debug("Analyzed {} lines, {} findings", lines.size(), ctx.findings().size());
        return List.copyOf(ctx.findings());
    }

    public List<Detector> detectors() {
        return detectors;
    }

    public CheckerConfig config() {
        return config;
    }
}
