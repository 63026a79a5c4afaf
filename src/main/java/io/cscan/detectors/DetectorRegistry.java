package io.cscan.detectors;

import io.cscan.config.CheckerConfig;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Registry of all available detectors, in the order they inspect each clause.
 */
public class DetectorRegistry {

    private final List<Detector> detectors;

    private DetectorRegistry(List<Detector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    /**
     * Creates a registry with all default detectors.
     */
    public static DetectorRegistry createDefault() {
        return new DetectorRegistry(List.of(
                new MemorySafetyDetector(),
                new UninitializedVariableDetector(),
                new StandardLibraryDetector(),
                new NumericControlFlowDetector()
        ));
    }

    /**
     * Creates a registry with specific detectors.
     */
    public static DetectorRegistry of(Detector... detectors) {
        return new DetectorRegistry(Arrays.asList(detectors));
    }

    /**
     * Returns the detectors that should run: enabled by default and not disabled in the configuration.
     */
    public List<Detector> enabledDetectors(CheckerConfig config) {
        return detectors.stream()
                .filter(Detector::enabledByDefault)
                .filter(d -> config.isDetectorEnabled(d.id()))
                .toList();
    }

    /**
     * Returns a registry restricted to the given detector ids.
     *
     * @throws IllegalArgumentException if an id names no registered detector
     */
    public DetectorRegistry select(Collection<String> detectorIds) {
        for (String id : detectorIds) {
            if (getById(id).isEmpty()) {
                throw new IllegalArgumentException("Unknown detector: " + id);
            }
        }
        return new DetectorRegistry(detectors.stream()
                .filter(d -> detectorIds.contains(d.id()))
                .toList());
    }

    /**
     * Returns all registered detectors.
     */
    public List<Detector> allDetectors() {
        return detectors;
    }

    /**
     * Returns a detector by ID, if present.
     */
    public Optional<Detector> getById(String id) {
        return detectors.stream()
                .filter(d -> d.id().equals(id))
                .findFirst();
    }
}
