package io.cscan.source;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Character-level helpers shared by the recognizers.
 * Positions in masked text line up one-to-one with the unmasked text.
 */
public final class SourceText {

    private SourceText() {
    }

    /**
     * Splits source text into lines. A trailing newline does not start an extra line.
     */
    public static List<String> lines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String[] parts = text.split("\r\n|\r|\n", -1);
        int count = parts.length;
        if (count > 1 && parts[count - 1].isEmpty()) {
            count--;
        }
        return Arrays.asList(Arrays.copyOf(parts, count));
    }

    /**
     * Blanks the contents of string and character literals, keeping the quotes.
     * An unterminated literal is blanked to the end of the text.
     */
    public static String maskLiterals(String text) {
        StringBuilder out = new StringBuilder(text);
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote == 0) {
                if (c == '"' || c == '\'') {
                    quote = c;
                }
                continue;
            }
            if (c == '\\') {
                out.setCharAt(i, ' ');
                if (i + 1 < text.length()) {
                    out.setCharAt(++i, ' ');
                }
            } else if (c == quote) {
                quote = 0;
            } else {
                out.setCharAt(i, ' ');
            }
        }
        return out.toString();
    }

    /**
     * Blanks the operand of every {@code sizeof}, which is never evaluated.
     * Expects masked text.
     */
    public static String maskSizeof(String masked) {
        StringBuilder out = new StringBuilder(masked);
        int from = 0;
        while (true) {
            int at = masked.indexOf("sizeof", from);
            if (at < 0) {
                return out.toString();
            }
            from = at + 6;
            if ((at > 0 && isIdentifierChar(masked.charAt(at - 1)))
                    || (from < masked.length() && isIdentifierChar(masked.charAt(from)))) {
                continue;
            }
            int open = skipSpaces(masked, from);
            if (open < masked.length() && masked.charAt(open) == '(') {
                int close = matchingParen(masked, open);
                int end = close < 0 ? masked.length() : close;
                for (int i = open + 1; i < end; i++) {
                    out.setCharAt(i, ' ');
                }
                from = end;
            } else {
                // sizeof x
                int i = open;
                while (i < masked.length() && (isIdentifierChar(masked.charAt(i)) || masked.charAt(i) == '*')) {
                    out.setCharAt(i++, ' ');
                }
                from = i;
            }
        }
    }

    /**
     * Returns the index of the parenthesis closing the one at {@code open}, or -1.
     * Expects masked text.
     */
    public static int matchingParen(String masked, int open) {
        int depth = 0;
        for (int i = open; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Splits on {@code separator} outside parentheses, brackets, braces and literals.
     * The parts keep their original (unmasked) text.
     */
    public static List<String> splitTopLevel(String text, char separator) {
        String masked = maskLiterals(text);
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                depth = Math.max(0, depth - 1);
            } else if (c == separator && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    public static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    public static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    public static int skipSpaces(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Returns the last non-whitespace character before {@code index}, or 0.
     */
    public static char previousNonSpace(String text, int index) {
        for (int i = index - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (!Character.isWhitespace(c)) {
                return c;
            }
        }
        return 0;
    }

    /**
     * Returns the first non-whitespace character at or after {@code index}, or 0.
     */
    public static char nextNonSpace(String text, int index) {
        int i = skipSpaces(text, index);
        return i < text.length() ? text.charAt(i) : 0;
    }
}
