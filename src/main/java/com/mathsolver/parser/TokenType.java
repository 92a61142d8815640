package com.mathsolver.parser;

public enum TokenType {
    NUMBER,
    VARIABLE,
    CONSTANT,
    FUNCTION,

    PLUS,
    MINUS,
    STAR,
    SLASH,
    CARET,
    BANG,
    COMMA,
    EQUAL,
    UNDERSCORE,

    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACE,
    RIGHT_BRACE,
    LEFT_BRACKET,
    RIGHT_BRACKET,

    LATEX_COMMAND,

    // unrecognised input; the parser reports it with the position attached
    NONE,
    EOF
}
