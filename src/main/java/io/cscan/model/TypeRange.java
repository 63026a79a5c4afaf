package io.cscan.model;

/**
 * Inclusive value range of a narrow C integer type.
 *
 * @param typeName the C type as written, e.g. "unsigned char"
 * @param min      smallest representable value
 * @param max      largest representable value
 */
public record TypeRange(String typeName, long min, long max) {

    public TypeRange {
        if (min > max) {
            throw new IllegalArgumentException("min > max for " + typeName);
        }
    }

    public boolean contains(long value) {
        return value >= min && value <= max;
    }
}
