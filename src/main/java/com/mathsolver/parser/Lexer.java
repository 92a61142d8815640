package com.mathsolver.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.mathsolver.debug.Debug;

public class Lexer {
    private static final String TAG = "mathsolver.lexer";

    /** Functions every solver knows about; registries may add more. */
    public static final Set<String> STANDARD_FUNCTIONS;
    static {
        Set<String> set = new HashSet<>();
        set.add("sin");
        set.add("cos");
        set.add("tan");
        set.add("log");
        set.add("ln");
        set.add("sqrt");
        STANDARD_FUNCTIONS = Collections.unmodifiableSet(set);
    }

    private static final Set<String> CONSTANTS = Set.of("pi", "phi");

    private final String source;
    private final Set<String> functionNames;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;

    public Lexer(String source) {
        this(source, STANDARD_FUNCTIONS);
    }

    public Lexer(String source, Set<String> functionNames) {
        this.source = source == null ? "" : source;
        this.functionNames = functionNames;
    }

    /** Reads the whole input; the last token is always EOF. */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type != TokenType.EOF);
        return tokens;
    }

    /** Returns the next token; once the input is exhausted every call returns EOF. */
    public Token nextToken() {
        skipWhitespace();
        start = current;
        if (isAtEnd()) {
            return emit(TokenType.EOF, "");
        }
        Token token = scanToken();
        Debug.get().t(TAG, token.toString());
        return token;
    }

    private Token scanToken() {
        char c = advance();
        switch (c) {
            case '+': return emit(TokenType.PLUS);
            case '-': return emit(TokenType.MINUS);
            case '*': return emit(TokenType.STAR);
            case '/': return emit(TokenType.SLASH);
            case '^': return emit(TokenType.CARET);
            case '!': return emit(TokenType.BANG);
            case ',': return emit(TokenType.COMMA);
            case '=': return emit(TokenType.EQUAL);
            case '_': return emit(TokenType.UNDERSCORE);
            case '(': return emit(TokenType.LEFT_PAREN);
            case ')': return emit(TokenType.RIGHT_PAREN);
            case '{': return emit(TokenType.LEFT_BRACE);
            case '}': return emit(TokenType.RIGHT_BRACE);
            case '[': return emit(TokenType.LEFT_BRACKET);
            case ']': return emit(TokenType.RIGHT_BRACKET);
            case '\\': return latexCommand();
            default:
                if (isDigit(c) || c == '.') return number();
                if (isLetter(c)) return identifier();
                return emit(TokenType.NONE);
        }
    }

    private Token number() {
        boolean seenPoint = source.charAt(start) == '.';
        while (isDigit(peek()) || (peek() == '.' && !seenPoint)) {
            if (advance() == '.') seenPoint = true;
        }
        String text = source.substring(start, current);
        if (text.equals(".")) return emit(TokenType.NONE);
        return emit(TokenType.NUMBER, text);
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current).toLowerCase(Locale.ROOT);
        TokenType type;
        if (CONSTANTS.contains(text)) type = TokenType.CONSTANT;
        else if (functionNames.contains(text)) type = TokenType.FUNCTION;
        else type = TokenType.VARIABLE;
        return emit(type, text);
    }

    private Token latexCommand() {
        // command names are letters only: "\sum_" ends before the underscore
        while (isLetter(peek())) advance();
        if (current - start == 1) return emit(TokenType.NONE);
        return emit(TokenType.LATEX_COMMAND, source.substring(start + 1, current));
    }

    private void skipWhitespace() {
        while (!isAtEnd() && Character.isWhitespace(peek())) {
            if (advance() == '\n') {
                line++;
                lineStart = current;
            }
        }
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }
    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isLetter(char c) { return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'); }
    private boolean isAlphaNumeric(char c) { return isLetter(c) || isDigit(c) || c == '_'; }

    private Token emit(TokenType type) { return emit(type, source.substring(start, current)); }
    private Token emit(TokenType type, String lexeme) {
        SourcePosition position = new SourcePosition(start, current, line, start - lineStart + 1);
        return new Token(type, lexeme, position);
    }
}
