package io.cscan.patterns;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversion specifications of printf- and scanf-style format strings.
 */
public final class FormatString {

    private static final Pattern PRINTF_SPEC = Pattern.compile(
            "%([-+ #0']*)(\\*|\\d+)?(?:\\.(\\*|\\d*))?(hh|h|ll|l|j|z|t|L)?([diouxXeEfFgGaAcspn%])");

    private static final Pattern SCANF_SPEC = Pattern.compile(
            "%(\\*)?(\\d+)?(hh|h|ll|l|j|z|t|L)?([diouxXeEfFgGaAcspn%]|\\[\\^?\\]?[^\\]]*\\])");

    private static final Pattern STRING_LITERAL = Pattern.compile("\"((?:[^\"\\\\]|\\\\.)*)\"");

    /**
     * One conversion.
     *
     * @param conversion the conversion character, or "[" for a scanset
     * @param arguments  how many arguments it consumes (0 for %% and suppressed scanf conversions)
     */
    public record Conversion(String conversion, int arguments) {}

    private FormatString() {
    }

    public static List<Conversion> printfConversions(String format) {
        List<Conversion> result = new ArrayList<>();
        Matcher m = PRINTF_SPEC.matcher(format);
        while (m.find()) {
            String conv = m.group(5);
            if (conv.equals("%")) {
                continue;
            }
            int args = 1;
            if ("*".equals(m.group(2))) {
                args++;
            }
            if ("*".equals(m.group(3))) {
                args++;
            }
            result.add(new Conversion(conv, args));
        }
        return result;
    }

    public static List<Conversion> scanfConversions(String format) {
        List<Conversion> result = new ArrayList<>();
        Matcher m = SCANF_SPEC.matcher(format);
        while (m.find()) {
            String conv = m.group(4);
            if (conv.equals("%")) {
                continue;
            }
            String name = conv.startsWith("[") ? "[" : conv;
            result.add(new Conversion(name, m.group(1) != null ? 0 : 1));
        }
        return result;
    }

    public static int argumentCount(List<Conversion> conversions) {
        return conversions.stream().mapToInt(Conversion::arguments).sum();
    }

    /**
     * Returns the contents of a format argument made only of string literals
     * ({@code "a" "b"} is concatenated), or null for any other expression.
     */
    public static String literalContents(String argument) {
        String trimmed = argument.trim();
        if (!trimmed.startsWith("\"")) {
            return null;
        }
        StringBuilder contents = new StringBuilder();
        Matcher m = STRING_LITERAL.matcher(trimmed);
        int end = 0;
        while (m.find()) {
            if (!trimmed.substring(end, m.start()).isBlank()) {
                return null;
            }
            contents.append(m.group(1));
            end = m.end();
        }
        return trimmed.substring(end).isBlank() && end > 0 ? contents.toString() : null;
    }
}
