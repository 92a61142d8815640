package com.mathsolver.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    public final SourcePosition position;

    Token(TokenType type, String lexeme, SourcePosition position) {
        this.type = type;
        this.lexeme = lexeme;
        this.position = position;
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' at " + position;
    }
}
