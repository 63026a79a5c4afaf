package io.cscan.source;

import io.cscan.source.Clause.Kind;
import io.cscan.source.Clause.LoopKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a comment-stripped line into clauses.
 * <p>
 * The line is first cut into segments at top-level {@code ;}, {@code {} and {@code }}
 * (initializer braces after {@code =} are kept inside their segment). Each segment then
 * loses its leading {@code else}, {@code case X:} and {@code default:} labels, and control
 * headers are expanded: {@code for (a; b; c) s} yields a LOOP clause followed by
 * {@code a}, {@code b} as a CONDITION, {@code c}, and then whatever follows the header.
 */
public final class ClauseExtractor {

    private enum Terminator { SEMICOLON, OPEN_BRACE, CLOSE_BRACE, END_OF_LINE }

    private ClauseExtractor() {
    }

    public static List<Clause> extract(String line, int lineNumber) {
        List<Clause> clauses = new ArrayList<>();
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return clauses;
        }
        if (trimmed.startsWith("#")) {
            clauses.add(Clause.of(Kind.DIRECTIVE, trimmed, lineNumber, line.indexOf('#')));
            return clauses;
        }

        String masked = SourceText.maskLiterals(line);
        int parenDepth = 0;
        int initializerDepth = 0;
        int start = 0;
        for (int i = 0; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (initializerDepth > 0) {
                if (c == '{') {
                    initializerDepth++;
                } else if (c == '}') {
                    initializerDepth--;
                }
                continue;
            }
            switch (c) {
                case '(' -> parenDepth++;
                case ')' -> parenDepth = Math.max(0, parenDepth - 1);
                case '{' -> {
                    if (parenDepth == 0) {
                        if (SourceText.previousNonSpace(masked, i) == '=') {
                            initializerDepth = 1;
                        } else {
                            classify(line, masked, start, i, Terminator.OPEN_BRACE, lineNumber, clauses);
                            start = i + 1;
                        }
                    }
                }
                case '}' -> {
                    if (parenDepth == 0) {
                        classify(line, masked, start, i, Terminator.CLOSE_BRACE, lineNumber, clauses);
                        start = i + 1;
                    }
                }
                case ';' -> {
                    if (parenDepth == 0) {
                        classify(line, masked, start, i, Terminator.SEMICOLON, lineNumber, clauses);
                        start = i + 1;
                    }
                }
                default -> {
                }
            }
        }
        classify(line, masked, start, masked.length(), Terminator.END_OF_LINE, lineNumber, clauses);
        return clauses;
    }

    private static void classify(String line, String masked, int from, int to, Terminator terminator,
                                 int lineNumber, List<Clause> out) {
        int s = SourceText.skipSpaces(masked, from);
        while (s < to) {
            String word = wordAt(masked, s, to);
            if (word.equals("else")) {
                s = SourceText.skipSpaces(masked, s + word.length());
            } else if (word.equals("do") && !isCallLike(masked, s + 2, to)) {
                int after = SourceText.skipSpaces(masked, s + 2);
                boolean bare = after >= to;
                out.add(Clause.of(Kind.DO, "do", lineNumber, s)
                        .withBlockInfo(bare && terminator == Terminator.OPEN_BRACE, false));
                s = after;
            } else if (word.equals("case") || (word.equals("default")
                    && SourceText.nextNonSpace(masked, s + word.length()) == ':')) {
                int colon = masked.indexOf(':', s);
                if (colon < 0 || colon >= to) {
                    return;
                }
                s = SourceText.skipSpaces(masked, colon + 1);
            } else {
                break;
            }
        }
        if (s >= to) {
            return;
        }

        String word = wordAt(masked, s, to);
        boolean control = switch (word) {
            case "for", "while", "if", "switch" -> true;
            default -> false;
        };
        int open = SourceText.skipSpaces(masked, s + word.length());
        if (control && open < to && masked.charAt(open) == '(') {
            int close = SourceText.matchingParen(masked, open);
            if (close < 0 || close >= to) {
                emitOpenHeader(line, word, s, open, to, lineNumber, out);
                return;
            }
            String header = line.substring(open + 1, close);
            int remainder = SourceText.skipSpaces(masked, close + 1);
            boolean bodyFollows = remainder < to;
            boolean opens = !bodyFollows && terminator == Terminator.OPEN_BRACE;
            boolean terminated = !bodyFollows && terminator == Terminator.SEMICOLON;

            if (word.equals("for")) {
                out.add(new Clause(Kind.LOOP, line.substring(s, close + 1), lineNumber, s,
                        LoopKind.FOR, header, close + 1, opens, terminated));
                emitForParts(line, header, open + 1, lineNumber, out);
            } else if (word.equals("while")) {
                out.add(new Clause(Kind.LOOP, line.substring(s, close + 1), lineNumber, s,
                        LoopKind.WHILE, header, close + 1, opens, terminated));
                addTrimmed(Kind.CONDITION, line, open + 1, close, lineNumber, out);
            } else {
                addTrimmed(Kind.CONDITION, line, open + 1, close, lineNumber, out);
            }
            if (bodyFollows) {
                classify(line, masked, remainder, to, terminator, lineNumber, out);
            }
            return;
        }

        Kind kind = word.equals("return") ? Kind.RETURN : Kind.STATEMENT;
        String text = line.substring(s, to).trim();
        if (!text.isEmpty()) {
            out.add(Clause.of(kind, text, lineNumber, s).withBlockInfo(
                    terminator == Terminator.OPEN_BRACE, terminator == Terminator.SEMICOLON));
        }
    }

    private static void emitForParts(String line, String header, int headerStart, int lineNumber, List<Clause> out) {
        List<String> parts = SourceText.splitTopLevel(header, ';');
        if (parts.size() != 3) {
            return;
        }
        int offset = headerStart;
        Kind[] kinds = {Kind.STATEMENT, Kind.CONDITION, Kind.STATEMENT};
        for (int i = 0; i < 3; i++) {
            String part = parts.get(i);
            addTrimmed(kinds[i], line, offset, offset + part.length(), lineNumber, out);
            offset += part.length() + 1;
        }
    }

    /**
     * Header whose closing parenthesis is on a later line: the loop is recorded without a header.
     */
    private static void emitOpenHeader(String line, String word, int s, int open, int to,
                                       int lineNumber, List<Clause> out) {
        if (word.equals("for") || word.equals("while")) {
            LoopKind kind = word.equals("for") ? LoopKind.FOR : LoopKind.WHILE;
            out.add(new Clause(Kind.LOOP, line.substring(s, to).trim(), lineNumber, s,
                    kind, null, -1, false, false));
        }
        if (!word.equals("for")) {
            addTrimmed(Kind.CONDITION, line, open + 1, to, lineNumber, out);
        }
    }

    private static void addTrimmed(Kind kind, String line, int from, int to, int lineNumber, List<Clause> out) {
        String raw = line.substring(from, to);
        String text = raw.trim();
        if (text.isEmpty()) {
            return;
        }
        int column = from + raw.indexOf(text.charAt(0));
        out.add(Clause.of(kind, text, lineNumber, column));
    }

    private static String wordAt(String masked, int index, int limit) {
        int end = index;
        while (end < limit && SourceText.isIdentifierChar(masked.charAt(end))) {
            end++;
        }
        return masked.substring(index, end);
    }

    // "do(" or "do_x" is an identifier use, not the keyword
    private static boolean isCallLike(String masked, int afterWord, int limit) {
        if (afterWord < limit && SourceText.isIdentifierChar(masked.charAt(afterWord))) {
            return true;
        }
        return SourceText.nextNonSpace(masked, afterWord) == '(';
    }
}
