package io.cscan.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Tables and limits consulted by the detectors.
 * Loaded from YAML configuration files.
 */
public class CheckerConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckerConfig.class);

    private static final String DEFAULT_CONFIG = "/c-scan-defaults.yaml";

    static final int DEFAULT_ITERATION_CEILING = 100_000;
    static final int DEFAULT_LOOKAHEAD_LINES = 20;

    // header -> functions, in file order
    private final Map<String, Set<String>> functionHeaders;
    // function -> header
    private final Map<String, String> headerByFunction;
    // correct header -> misspellings
    private final Map<String, Set<String>> headerMisspellings;
    private final int iterationCeiling;
    private final int lookaheadLines;
    private final Set<String> disabledDetectors;

    private CheckerConfig(Map<String, Object> config) {
        this.functionHeaders = getStringSetMap(config, "functionHeaders");
        this.headerMisspellings = getStringSetMap(config, "headerMisspellings");
        Map<String, Object> loop = getMap(config, "loopAnalysis");
        this.iterationCeiling = getPositiveInt(loop, "iterationCeiling", DEFAULT_ITERATION_CEILING);
        this.lookaheadLines = getPositiveInt(loop, "lookaheadLines", DEFAULT_LOOKAHEAD_LINES);
        this.disabledDetectors = getStringSet(config, "disabledDetectors");

        Map<String, String> byFunction = new LinkedHashMap<>();
        functionHeaders.forEach((header, functions) -> functions.forEach(fn -> byFunction.putIfAbsent(fn, header)));
        this.headerByFunction = Map.copyOf(byFunction);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> config, String key) {
        Object value = config.get(key);
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    private static Set<String> getStringSet(Map<String, Object> config, String key) {
        return toStringSet(config.get(key));
    }

    private static Set<String> toStringSet(Object value) {
        if (value instanceof List<?> list) {
            Set<String> result = new LinkedHashSet<>();
            for (Object item : list) {
                if (item instanceof String s) {
                    result.add(s.trim());
                }
            }
            return result;
        }
        return Set.of();
    }

    private static Map<String, Set<String>> getStringSetMap(Map<String, Object> config, String key) {
        Map<String, Set<String>> result = new LinkedHashMap<>();
        getMap(config, key).forEach((k, v) -> {
            Set<String> values = toStringSet(v);
            if (values.isEmpty() && v != null) {
                log.warn("Ignoring '{}.{}': expected a list of names", key, k);
                return;
            }
            result.put(String.valueOf(k), values);
        });
        return result;
    }

    private static int getPositiveInt(Map<String, Object> config, String key, int defaultValue) {
        Object value = config.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number n && n.intValue() > 0) {
            return n.intValue();
        }
        log.warn("Ignoring invalid value for '{}': {} (using {})", key, value, defaultValue);
        return defaultValue;
    }

    /**
     * Loads the default configuration from the classpath.
     */
    public static CheckerConfig loadDefault() {
        try (InputStream is = CheckerConfig.class.getResourceAsStream(DEFAULT_CONFIG)) {
            if (is == null) {
                throw new IllegalStateException("Default configuration not found: " + DEFAULT_CONFIG);
            }
            return load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load default configuration", e);
        }
    }

    /**
     * Loads configuration from a file path.
     */
    public static CheckerConfig loadFromFile(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public static CheckerConfig load(InputStream is) {
        Yaml yaml = new Yaml();
        Object loaded = yaml.load(is);
        if (loaded != null && !(loaded instanceof Map)) {
            throw new IllegalArgumentException("Configuration root must be a mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) loaded;
        return new CheckerConfig(config != null ? config : Map.of());
    }

    /**
     * Merges this configuration with another, with the other taking precedence.
     * Tables are unioned; the other's limits replace this one's when it sets them.
     */
    public CheckerConfig merge(CheckerConfig other) {
        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put("functionHeaders", mergeTables(this.functionHeaders, other.functionHeaders));
        merged.put("headerMisspellings", mergeTables(this.headerMisspellings, other.headerMisspellings));
        merged.put("loopAnalysis", Map.of(
                "iterationCeiling", other.iterationCeiling != DEFAULT_ITERATION_CEILING
                        ? other.iterationCeiling : this.iterationCeiling,
                "lookaheadLines", other.lookaheadLines != DEFAULT_LOOKAHEAD_LINES
                        ? other.lookaheadLines : this.lookaheadLines));
        merged.put("disabledDetectors", mergeSet(this.disabledDetectors, other.disabledDetectors));
        return new CheckerConfig(merged);
    }

    private static Map<String, Object> mergeTables(Map<String, Set<String>> a, Map<String, Set<String>> b) {
        Map<String, Object> merged = new LinkedHashMap<>();
        a.forEach((k, v) -> merged.put(k, new ArrayList<>(v)));
        b.forEach((k, v) -> merged.merge(k, new ArrayList<>(v), (old, add) -> mergeSet(toStringSet(old), v)));
        return merged;
    }

    private static List<String> mergeSet(Set<String> a, Set<String> b) {
        Set<String> merged = new LinkedHashSet<>(a);
        merged.addAll(b);
        return new ArrayList<>(merged);
    }

    // --- queries ---

    /**
     * Returns the header that declares the given standard library function.
     */
    public Optional<String> requiredHeader(String function) {
        return Optional.ofNullable(headerByFunction.get(function));
    }

    public boolean isLibraryFunction(String function) {
        return headerByFunction.containsKey(function);
    }

    /**
     * Returns the header a known misspelling was meant to be.
     */
    public Optional<String> correctHeaderFor(String header) {
        for (Map.Entry<String, Set<String>> entry : headerMisspellings.entrySet()) {
            if (entry.getValue().contains(header)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public int iterationCeiling() {
        return iterationCeiling;
    }

    public int lookaheadLines() {
        return lookaheadLines;
    }

    public boolean isDetectorEnabled(String detectorId) {
        return !disabledDetectors.contains(detectorId);
    }

    public Set<String> disabledDetectors() {
        return Set.copyOf(disabledDetectors);
    }

    public Set<String> knownHeaders() {
        return Set.copyOf(functionHeaders.keySet());
    }
}
