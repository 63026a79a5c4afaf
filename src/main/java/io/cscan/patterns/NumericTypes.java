package io.cscan.patterns;

import io.cscan.model.TypeRange;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Value ranges of the narrow integer types checked for overflow.
 * Types of int width and above are never checked.
 */
public final class NumericTypes {

    private static final TypeRange SIGNED_CHAR = new TypeRange("char", -128, 127);
    private static final TypeRange UNSIGNED_CHAR = new TypeRange("unsigned char", 0, 255);
    private static final TypeRange SHORT = new TypeRange("short", -32768, 32767);
    private static final TypeRange UNSIGNED_SHORT = new TypeRange("unsigned short", 0, 65535);

    private static final Map<String, TypeRange> RANGES = Map.ofEntries(
            Map.entry("char", SIGNED_CHAR),
            Map.entry("signed char", new TypeRange("signed char", -128, 127)),
            Map.entry("unsigned char", UNSIGNED_CHAR),
            Map.entry("short", SHORT),
            Map.entry("signed short", new TypeRange("signed short", -32768, 32767)),
            Map.entry("unsigned short", UNSIGNED_SHORT),
            Map.entry("int8_t", new TypeRange("int8_t", -128, 127)),
            Map.entry("uint8_t", new TypeRange("uint8_t", 0, 255)),
            Map.entry("int16_t", new TypeRange("int16_t", -32768, 32767)),
            Map.entry("uint16_t", new TypeRange("uint16_t", 0, 65535))
    );

    private NumericTypes() {
    }

    /**
     * Returns the range of a narrow integer type, e.g. "unsigned char" or "short int".
     */
    public static Optional<TypeRange> rangeOf(String baseType) {
        return Optional.ofNullable(RANGES.get(normalize(baseType)));
    }

    public static boolean isFloating(String baseType) {
        String normalized = normalize(baseType);
        return normalized.equals("float") || normalized.equals("double") || normalized.equals("long double");
    }

    /**
     * Canonical spelling: qualifiers dropped, "short int" becomes "short".
     */
    static String normalize(String baseType) {
        if (baseType == null) {
            return "";
        }
        List<String> words = new ArrayList<>(Arrays.asList(baseType.trim().split("\\s+")));
        words.removeIf(w -> w.equals("const") || w.equals("volatile") || w.equals("static")
                || w.equals("register") || w.equals("extern") || w.equals("auto"));
        if (words.size() > 1 && (words.contains("short") || words.contains("long"))) {
            words.remove("int");
        }
        return String.join(" ", words);
    }
}
