package com.mathsolver.parser;

/** Output flavour for {@link ExpressionPrinter}. */
public enum Notation {
    PLAIN,
    LATEX
}
