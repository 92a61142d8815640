package com.mathsolver.parser;

/** Malformed input: unexpected or missing token, unknown LaTeX command, unbalanced grouping. */
public class ParseException extends PositionedException {
    public ParseException(String detail, SourcePosition position) {
        super(detail, position);
    }
}
