package com.mathsolver.parser;

import java.util.Objects;

/**
 * Location of a token or node in the source text.
 *
 * start is inclusive, end exclusive (character offsets); line and column are 1-based
 * and point at the token that gave the node its meaning (the operator for binary nodes).
 */
public final class SourcePosition {
    public static final SourcePosition NONE = new SourcePosition(0, 0, 0, 0);

    public final int start;
    public final int end;
    public final int line;
    public final int column;

    public SourcePosition(int start, int end, int line, int column) {
        this.start = start;
        this.end = end;
        this.line = line;
        this.column = column;
    }

    /** Span from left.start to right.end, reported at the anchor's line/column. */
    public static SourcePosition span(SourcePosition left, SourcePosition right, SourcePosition anchor) {
        return new SourcePosition(left.start, right.end, anchor.line, anchor.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourcePosition)) return false;
        SourcePosition other = (SourcePosition) o;
        return start == other.start && end == other.end && line == other.line && column == other.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, line, column);
    }

    @Override
    public String toString() {
        return "line " + line + ", column " + column;
    }
}
