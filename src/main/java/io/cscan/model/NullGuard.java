package io.cscan.model;

/**
 * The branch of a non-null test such as {@code if (p)} or {@code while (p != NULL)}.
 * <p>
 * A braced branch covers code nested deeper than the test until its block closes. An
 * unbraced branch covers the one line holding its statement.
 */
public final class NullGuard {

    private final int depth;
    private final int statementLine;
    private final int openBy;
    private boolean entered;

    private NullGuard(int depth, int statementLine, int openBy) {
        this.depth = depth;
        this.statementLine = statementLine;
        this.openBy = openBy;
    }

    /**
     * @param depth  scope depth of the test
     * @param openBy last line on which the branch's opening brace may appear
     */
    public static NullGuard braced(int depth, int openBy) {
        return new NullGuard(depth, 0, openBy);
    }

    public static NullGuard unbraced(int depth, int statementLine) {
        return new NullGuard(depth, statementLine, 0);
    }

    public boolean covers(int line, int depthAtUse) {
        if (statementLine > 0) {
            return line == statementLine;
        }
        return depthAtUse > depth;
    }

    /**
     * Updates the guard at the end of a line.
     *
     * @return false once the guarded branch is over
     */
    public boolean endLine(int line, int minDepth, int endDepth) {
        if (statementLine > 0) {
            return line < statementLine;
        }
        if (entered) {
            return minDepth > depth;
        }
        if (endDepth > depth) {
            entered = true;
            return true;
        }
        return line < openBy;
    }
}
