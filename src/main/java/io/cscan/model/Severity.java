package io.cscan.model;

/**
 * Severity of a finding.
 */
public enum Severity {
    /**
     * Definite fault: the program is very likely to crash or misbehave.
     * Examples: null dereference, double free, missing header.
     */
    ERROR(1, "Error"),

    /**
     * Probable fault that depends on runtime values.
     * Examples: memory leak, uninitialized read, narrowing overflow.
     */
    WARNING(2, "Warning"),

    /**
     * Informational note.
     */
    INFO(3, "Info");

    private final int rank;
    private final String label;

    Severity(int rank, String label) {
        this.rank = rank;
        this.label = label;
    }

    public int rank() {
        return rank;
    }

    public String label() {
        return label;
    }

    /**
     * Returns true if this severity is at least as severe as the given threshold.
     */
    public boolean isAtLeast(Severity threshold) {
        return this.rank <= threshold.rank;
    }

    /**
     * Parses a severity name case-insensitively ("error", "Warning", "INFO").
     *
     * @throws IllegalArgumentException if the value names no severity
     */
    public static Severity parse(String value) {
        if (value != null) {
            for (Severity severity : values()) {
                if (severity.name().equalsIgnoreCase(value.trim())) {
                    return severity;
                }
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
