package io.cscan.source;

/**
 * One analyzable piece of a source line.
 *
 * @param kind       what the piece is
 * @param text       the piece's source text, trimmed, with literals intact
 * @param lineNumber 1-based line number
 * @param column     index of the first character of {@code text} within the stripped line
 * @param loopKind   loop flavor for {@link Kind#LOOP} clauses, otherwise null
 * @param header     text between the parentheses of a loop header, or null when the header
 *                   does not close on this line
 * @param headerEnd  column just past the header's closing parenthesis, or -1
 * @param opensBlock true when the piece is immediately followed by an opening brace
 * @param terminated true when the piece ends with a semicolon
 */
public record Clause(
        Kind kind,
        String text,
        int lineNumber,
        int column,
        LoopKind loopKind,
        String header,
        int headerEnd,
        boolean opensBlock,
        boolean terminated
) {

    public enum Kind {
        /** Preprocessor line such as {@code #include <stdio.h>}. */
        DIRECTIVE,
        /** The {@code do} keyword opening a do-while body. */
        DO,
        /** A loop header; its parts follow as separate clauses. */
        LOOP,
        /** Controlling expression of if/while/for/switch. */
        CONDITION,
        /** Declaration or expression statement. */
        STATEMENT,
        /** Return statement including the keyword. */
        RETURN
    }

    public enum LoopKind {
        FOR,
        WHILE,
        DO_WHILE
    }

    public static Clause of(Kind kind, String text, int lineNumber, int column) {
        return new Clause(kind, text, lineNumber, column, null, null, -1, false, false);
    }

    public Clause withBlockInfo(boolean opensBlock, boolean terminated) {
        return new Clause(kind, text, lineNumber, column, loopKind, header, headerEnd, opensBlock, terminated);
    }

    public Clause withLoopKind(LoopKind newLoopKind) {
        return new Clause(kind, text, lineNumber, column, newLoopKind, header, headerEnd, opensBlock, terminated);
    }

    /**
     * Returns true for clauses holding an evaluated expression.
     */
    public boolean isExpression() {
        return kind == Kind.STATEMENT || kind == Kind.CONDITION || kind == Kind.RETURN;
    }
}
