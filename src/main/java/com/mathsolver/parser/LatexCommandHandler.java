package com.mathsolver.parser;

/**
 * Parses the arguments of one LaTeX command.
 *
 * Called after the command token has been consumed; the handler reads whatever
 * braces, brackets or sub/superscripts the command takes through the parser's
 * public helpers and returns the node that replaces the command.
 */
@FunctionalInterface
public interface LatexCommandHandler {
    Expr.Node parse(Parser parser, Token command);
}
