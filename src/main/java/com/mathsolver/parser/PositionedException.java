package com.mathsolver.parser;

/** Base for errors that can point at the offending part of the input. */
public abstract class PositionedException extends RuntimeException {
    private final String detail;
    private final SourcePosition position;

    protected PositionedException(String detail, SourcePosition position) {
        this(detail, position, null);
    }

    protected PositionedException(String detail, SourcePosition position, Throwable cause) {
        super(detail + " at " + (position == null ? SourcePosition.NONE : position), cause);
        this.detail = detail;
        this.position = position == null ? SourcePosition.NONE : position;
    }

    /** The message without the position suffix. */
    public String getDetail() {
        return detail;
    }

    public SourcePosition getPosition() {
        return position;
    }
}
