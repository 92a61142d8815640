import com.mathsolver.parser.Lexer;
import com.mathsolver.parser.Token;
import com.mathsolver.parser.TokenType;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<TokenType> types(String src) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Lexer(src).tokenize()) out.add(t.type);
        return out;
    }

    @Test
    void arithmetic_tokensEndWithEof() {
        List<Token> tokens = new Lexer("2 + 3.5*x").tokenize();

        assertEquals(List.of(TokenType.NUMBER, TokenType.PLUS, TokenType.NUMBER, TokenType.STAR,
                TokenType.VARIABLE, TokenType.EOF), types("2 + 3.5*x"));
        assertEquals("3.5", tokens.get(2).lexeme);
        assertEquals("x", tokens.get(4).lexeme);
    }

    @Test
    void identifiers_areCaseFoldedAndClassified() {
        List<Token> tokens = new Lexer("SIN(Pi) + Phi + Alpha_2").tokenize();

        assertEquals(TokenType.FUNCTION, tokens.get(0).type);
        assertEquals("sin", tokens.get(0).lexeme);
        assertEquals(TokenType.CONSTANT, tokens.get(2).type);
        assertEquals("pi", tokens.get(2).lexeme);
        assertEquals(TokenType.CONSTANT, tokens.get(5).type);
        assertEquals(TokenType.VARIABLE, tokens.get(7).type);
        assertEquals("alpha_2", tokens.get(7).lexeme);
    }

    @Test
    void extraFunctionNames_areRecognized() {
        List<Token> tokens = new Lexer("hyp(3, 4)", Set.of("hyp")).tokenize();

        assertEquals(TokenType.FUNCTION, tokens.get(0).type);
        assertEquals(TokenType.COMMA, tokens.get(3).type);
        // standard names are not implied by a custom set
        assertEquals(TokenType.VARIABLE, new Lexer("sin", Set.of("hyp")).tokenize().get(0).type);
    }

    @Test
    void latexCommand_lexemeExcludesBackslash() {
        List<Token> tokens = new Lexer("\\sum_{i=1}^{5}{i}").tokenize();

        assertEquals(TokenType.LATEX_COMMAND, tokens.get(0).type);
        assertEquals("sum", tokens.get(0).lexeme);
        assertEquals(TokenType.UNDERSCORE, tokens.get(1).type);
        assertEquals(TokenType.LEFT_BRACE, tokens.get(2).type);
        assertEquals(TokenType.EQUAL, tokens.get(4).type);
        assertEquals(TokenType.CARET, tokens.get(7).type);
    }

    @Test
    void numbers_takeAtMostOnePoint() {
        List<Token> tokens = new Lexer("1.2.3").tokenize();

        assertEquals("1.2", tokens.get(0).lexeme);
        assertEquals(".3", tokens.get(1).lexeme);
        assertEquals(TokenType.NUMBER, tokens.get(1).type);
    }

    @Test
    void unknownCharacters_becomeNoneTokens() {
        assertEquals(List.of(TokenType.NUMBER, TokenType.NONE, TokenType.NUMBER, TokenType.EOF), types("1 @ 2"));
        assertEquals(TokenType.NONE, types("\\ 1").get(0));
        assertEquals(TokenType.NONE, types(".").get(0));
    }

    @Test
    void positions_trackLinesAndColumns() {
        List<Token> tokens = new Lexer("1 +\n 22").tokenize();
        Token plus = tokens.get(1);
        Token number = tokens.get(2);

        assertEquals(1, plus.position.line);
        assertEquals(3, plus.position.column);
        assertEquals(2, number.position.line);
        assertEquals(2, number.position.column);
        assertEquals(5, number.position.start);
        assertEquals(7, number.position.end);
    }

    @Test
    void exhaustedLexer_keepsReturningEof() {
        Lexer lexer = new Lexer("  ");

        assertEquals(TokenType.EOF, lexer.nextToken().type);
        assertEquals(TokenType.EOF, lexer.nextToken().type);
        assertEquals(List.of(TokenType.EOF), types(null));
    }
}
