package io.cscan.detectors;

import io.cscan.model.ErrorType;
import io.cscan.source.Clause;
import io.cscan.state.AnalysisContext;

/**
 * Base interface for all detectors.
 * Each detector looks at every clause of a file, in order, and reports findings into the context.
 */
public interface Detector {

    /**
     * Returns a unique identifier for this detector.
     */
    String id();

    /**
     * Returns the module this detector reports as.
     */
    ErrorType.Module module();

    /**
     * Returns a human-readable description of what this detector finds.
     */
    String description();

    /**
     * Inspects one clause. Runs before the clause's effects are applied to the variable store,
     * so the store reflects everything up to, but not including, this clause.
     *
     * @param ctx    per-file analysis state
     * @param clause the clause being analyzed
     */
    void inspect(AnalysisContext ctx, Clause clause);

    /**
     * Called once after the last line of the file.
     */
    default void finish(AnalysisContext ctx) {
    }

    /**
     * Returns true if this detector is enabled by default.
     */
    default boolean enabledByDefault() {
        return true;
    }
}
