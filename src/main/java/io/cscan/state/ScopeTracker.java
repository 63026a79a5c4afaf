package io.cscan.state;

import io.cscan.source.SourceText;

/**
 * Brace-nesting depth, one line at a time.
 * <p>
 * Braces inside string and character literals are ignored. Depth never drops below zero,
 * so a stray closing brace cannot push later code into negative scopes.
 */
public class ScopeTracker {

    private int depth;

    // depth before each column of the current line, plus one entry for end of line
    private int[] columnDepths = {0};
    private int startDepth;
    private int minDepth;
    private int endDepth;

    /**
     * Computes the depth profile of a comment-stripped line without committing it.
     */
    public void beginLine(String strippedLine) {
        String masked = SourceText.maskLiterals(strippedLine);
        columnDepths = new int[masked.length() + 1];
        startDepth = depth;
        int current = depth;
        int min = depth;
        for (int i = 0; i < masked.length(); i++) {
            columnDepths[i] = current;
            char c = masked.charAt(i);
            if (c == '{') {
                current++;
            } else if (c == '}') {
                current = Math.max(0, current - 1);
                min = Math.min(min, current);
            }
        }
        columnDepths[masked.length()] = current;
        minDepth = min;
        endDepth = current;
    }

    /**
     * Commits the current line and returns true if the depth decreased anywhere on it.
     */
    public boolean endLine() {
        depth = endDepth;
        return minDepth < startDepth;
    }

    /**
     * Depth in effect just before the given column of the current line.
     */
    public int depthAt(int column) {
        if (column < 0) {
            return startDepth;
        }
        return columnDepths[Math.min(column, columnDepths.length - 1)];
    }

    public int depth() {
        return depth;
    }

    public int startDepth() {
        return startDepth;
    }

    public int minDepth() {
        return minDepth;
    }

    public int endDepth() {
        return endDepth;
    }
}
