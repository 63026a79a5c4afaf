package io.cscan.detectors;

import io.cscan.source.Clause;
import io.cscan.source.Clause.LoopKind;
import io.cscan.source.SourceText;
import io.cscan.state.AnalysisContext;
import io.cscan.state.AnalysisContext.PendingDo;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Literal-masked text of a loop body, found by scanning forward from the loop header.
 * <p>
 * The body is a braced block, a single statement or an empty {@code ;}. Scanning stops at
 * the lookahead limit; a body cut short there is not {@link #closed()}.
 */
final class LoopBody {

    private static final Pattern EXIT = Pattern.compile(
            "\\b(?:break|return|goto)\\b|\\b(?:exit|abort|_Exit|quick_exit|longjmp)\\s*\\(");

    private static final Pattern ASSIGN_OPERATOR = Pattern.compile("\\s*(<<|>>|[-+*/%&|^])?=(?!=)");

    private static final Pattern POSTFIX = Pattern.compile("\\s*(\\+\\+|--)");

    /**
     * One write to a variable.
     *
     * @param operator {@code ++}, {@code --}, a compound operator such as {@code +=}, {@code =},
     *                 or {@code &} for an address-of use
     * @param operand  right-hand side for assignments, otherwise empty
     */
    record Modification(String operator, String operand) {}

    private final String text;
    private final boolean closed;

    LoopBody(String text, boolean closed) {
        this.text = text;
        this.closed = closed;
    }

    /**
     * Finds the body of the given loop clause. Empty when the header does not close on its line.
     */
    static Optional<LoopBody> of(AnalysisContext ctx, Clause loop) {
        if (loop.loopKind() == LoopKind.DO_WHILE) {
            return ctx.closedDo().map(pending -> doBody(ctx, pending, loop));
        }
        if (loop.header() == null || loop.headerEnd() < 0) {
            return Optional.empty();
        }
        return Optional.of(scan(ctx.strippedLines(), loop.lineNumber() - 1, loop.headerEnd(),
                ctx.config().lookaheadLines()));
    }

    private static LoopBody doBody(AnalysisContext ctx, PendingDo pending, Clause loop) {
        List<String> lines = ctx.strippedLines();
        StringBuilder sb = new StringBuilder();
        for (int i = pending.lineNumber() - 1; i < loop.lineNumber(); i++) {
            String masked = SourceText.maskLiterals(lines.get(i));
            int from = i == pending.lineNumber() - 1 ? Math.min(masked.length(), pending.column() + 2) : 0;
            int to = i == loop.lineNumber() - 1 ? Math.min(masked.length(), loop.column()) : masked.length();
            if (from < to) {
                sb.append(masked, from, to);
            }
            sb.append('\n');
        }
        return new LoopBody(sb.toString(), true);
    }

    /**
     * Scans stripped lines from a position just past a loop header.
     */
    static LoopBody scan(List<String> lines, int lineIndex, int column, int lookahead) {
        StringBuilder sb = new StringBuilder();
        boolean started = false;
        boolean braced = false;
        int braces = 0;
        int parens = 0;
        int last = Math.min(lines.size(), lineIndex + 1 + lookahead);

        for (int i = lineIndex; i < last; i++) {
            String masked = SourceText.maskLiterals(lines.get(i));
            for (int j = i == lineIndex ? column : 0; j < masked.length(); j++) {
                char c = masked.charAt(j);
                if (!started) {
                    if (Character.isWhitespace(c)) {
                        continue;
                    }
                    started = true;
                    if (c == '{') {
                        braced = true;
                        braces = 1;
                        continue;
                    }
                    if (c == ';') {
                        return new LoopBody("", true);
                    }
                }
                switch (c) {
                    case '{' -> braces++;
                    case '}' -> braces--;
                    case '(' -> parens++;
                    case ')' -> parens--;
                    default -> {
                    }
                }
                if (braced && braces == 0) {
                    return new LoopBody(sb.toString(), true);
                }
                sb.append(c);
                if (!braced && braces == 0 && parens <= 0 && (c == ';' || c == '}')) {
                    return new LoopBody(sb.toString(), true);
                }
            }
            sb.append('\n');
        }
        return new LoopBody(sb.toString(), false);
    }

    String text() {
        return text;
    }

    boolean closed() {
        return closed;
    }

    /**
     * Returns true if the body contains break, return, goto or a call that ends the program.
     */
    boolean hasExit() {
        return EXIT.matcher(text).find();
    }

    List<Modification> modificationsOf(String variable) {
        return modificationsOf(variable, text);
    }

    /**
     * Finds the writes to {@code variable} in masked text, in order.
     */
    static List<Modification> modificationsOf(String variable, String masked) {
        List<Modification> result = new ArrayList<>();
        Pattern use = Pattern.compile("(?<![\\w.])" + Pattern.quote(variable) + "\\b");
        Matcher m = use.matcher(masked);
        while (m.find()) {
            int start = m.start();
            int end = m.end();
            String before = masked.substring(0, start).stripTrailing();
            if (before.endsWith("->")) {
                continue;
            }
            if (before.endsWith("++") || before.endsWith("--")) {
                result.add(new Modification(before.substring(before.length() - 2), ""));
                continue;
            }
            if (before.endsWith("&") && !before.endsWith("&&")) {
                char prior = SourceText.previousNonSpace(before, before.length() - 1);
                if (!SourceText.isIdentifierChar(prior) && prior != ')' && prior != ']') {
                    result.add(new Modification("&", ""));
                    continue;
                }
            }
            Matcher postfix = POSTFIX.matcher(masked).region(end, masked.length());
            if (postfix.lookingAt()) {
                result.add(new Modification(postfix.group(1), ""));
                continue;
            }
            Matcher assign = ASSIGN_OPERATOR.matcher(masked).region(end, masked.length());
            if (assign.lookingAt()) {
                String operator = assign.group(1) == null ? "=" : assign.group(1) + "=";
                result.add(new Modification(operator, operandAt(masked, assign.end())));
            }
        }
        return result;
    }

    /**
     * Right-hand side starting at {@code from}, up to the first top-level ';', ',' or unmatched ')'.
     */
    private static String operandAt(String masked, int from) {
        int depth = 0;
        for (int i = from; i < masked.length(); i++) {
            char c = masked.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
            } else if (c == ')' || c == ']') {
                if (depth == 0) {
                    return masked.substring(from, i).trim();
                }
                depth--;
            } else if ((c == ';' || c == ',' || c == '\n') && depth == 0) {
                return masked.substring(from, i).trim();
            }
        }
        return masked.substring(from).trim();
    }
}
