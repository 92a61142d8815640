package com.mathsolver.parser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.mathsolver.debug.Debug;
import com.mathsolver.parser.Expr.Binary;
import com.mathsolver.parser.Expr.BinaryOperator;
import com.mathsolver.parser.Expr.Factorial;
import com.mathsolver.parser.Expr.FunctionCall;
import com.mathsolver.parser.Expr.Iteration;
import com.mathsolver.parser.Expr.IterationKind;
import com.mathsolver.parser.Expr.Node;
import com.mathsolver.parser.Expr.NumberLiteral;
import com.mathsolver.parser.Expr.Parenthesis;
import com.mathsolver.parser.Expr.Variable;
import com.mathsolver.plugins.MathConstants;

/**
 * Recursive-descent parser, lowest precedence first:
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := factor (('*' | '/' | \cdot | \times | \div) factor)*
 * factor     := postfix ('^' factor)?
 * postfix    := primary '!'*
 * primary    := number | constant | variable | function '(' args ')'
 *             | '(' expression ')' | '{' expression '}' | '-' factor | latex-command
 * </pre>
 */
public class Parser {
    private static final String TAG = "mathsolver.parser";

    private final List<Token> tokens;
    private final Map<String, LatexCommandHandler> commands = new HashMap<>();
    private final Map<String, BinaryOperator> operatorCommands = new HashMap<>();
    private int current = 0;

    public Parser(List<Token> tokens) {
        this(tokens, Map.of());
    }

    /** Extra handlers are applied after the built-in ones and may replace them. */
    public Parser(List<Token> tokens, Map<String, LatexCommandHandler> extraCommands) {
        this.tokens = tokens;
        registerBuiltinCommands();
        for (Map.Entry<String, LatexCommandHandler> e : extraCommands.entrySet()) {
            registerCommand(e.getKey(), e.getValue());
        }
    }

    public void registerCommand(String name, LatexCommandHandler handler) {
        if (handler == null) throw new IllegalArgumentException("handler must not be null");
        commands.put(name.toLowerCase(Locale.ROOT), handler);
    }

    public Node parse() {
        Node root = expression();
        if (!isAtEnd()) {
            throw error(peek(), describeUnexpected(peek()));
        }
        Debug.get().d(TAG, "parsed expression spanning " + root.position().start + ".." + root.position().end);
        return root;
    }

    private void registerBuiltinCommands() {
        registerCommand("frac", (p, cmd) -> p.fraction(cmd));
        registerCommand("sqrt", (p, cmd) -> p.root(cmd));
        registerCommand("sum", (p, cmd) -> p.iteration(IterationKind.SUMMATION, cmd));
        registerCommand("prod", (p, cmd) -> p.iteration(IterationKind.PRODUCT, cmd));
        for (String fn : new String[] {"sin", "cos", "tan", "log", "ln"}) {
            registerCommand(fn, (p, cmd) -> p.simpleFunction(fn, cmd));
        }
        registerCommand("pi", (p, cmd) -> new Variable("pi", cmd.position));
        registerCommand("phi", (p, cmd) -> new Variable("phi", cmd.position));

        operatorCommands.put("cdot", BinaryOperator.MULTIPLY);
        operatorCommands.put("times", BinaryOperator.MULTIPLY);
        operatorCommands.put("div", BinaryOperator.DIVIDE);
    }

    // ===================== GRAMMAR =====================

    public Node expression() {
        Node expr = term();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Node right = term();
            BinaryOperator operator = op.type == TokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUBTRACT;
            expr = binary(operator, expr, right, op);
        }
        return expr;
    }

    private Node term() {
        Node expr = factor();
        while (true) {
            BinaryOperator operator;
            if (check(TokenType.STAR)) operator = BinaryOperator.MULTIPLY;
            else if (check(TokenType.SLASH)) operator = BinaryOperator.DIVIDE;
            else if (check(TokenType.LATEX_COMMAND) && operatorCommands.containsKey(commandName(peek()))) {
                operator = operatorCommands.get(commandName(peek()));
            } else {
                break;
            }
            Token op = advance();
            Node right = factor();
            expr = binary(operator, expr, right, op);
        }
        return expr;
    }

    private Node factor() {
        Node base = postfix();
        if (match(TokenType.CARET)) {
            Token op = previous();
            Node exponent = factor(); // right-associative
            return binary(BinaryOperator.EXPONENT, base, exponent, op);
        }
        return base;
    }

    private Node postfix() {
        Node expr = primary();
        while (match(TokenType.BANG)) {
            Token bang = previous();
            expr = new Factorial(expr, SourcePosition.span(expr.position(), bang.position, bang.position));
        }
        return expr;
    }

    public Node primary() {
        if (match(TokenType.NUMBER)) {
            Token number = previous();
            return new NumberLiteral(new BigDecimal(number.lexeme), number.position);
        }
        if (match(TokenType.VARIABLE, TokenType.CONSTANT)) {
            return new Variable(previous().lexeme, previous().position);
        }
        if (match(TokenType.FUNCTION)) return functionCall(previous());

        if (match(TokenType.LEFT_PAREN)) {
            Token open = previous();
            Node inner = expression();
            Token close = consume(TokenType.RIGHT_PAREN, "Expected closing parenthesis");
            return new Parenthesis(inner, SourcePosition.span(open.position, close.position, open.position));
        }

        // LaTeX grouping braces produce no node of their own
        if (check(TokenType.LEFT_BRACE)) return braced("Expected '{'");

        if (match(TokenType.MINUS)) {
            Token minus = previous();
            Node operand = factor();
            Node zero = new NumberLiteral(BigDecimal.ZERO, minus.position);
            return binary(BinaryOperator.SUBTRACT, zero, operand, minus);
        }

        if (match(TokenType.LATEX_COMMAND)) return latexCommand(previous());

        throw error(peek(), describeUnexpected(peek()));
    }

    private Node functionCall(Token name) {
        consume(TokenType.LEFT_PAREN, "Expected '(' after function " + name.lexeme);
        List<Node> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        Token close = consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments of " + name.lexeme);
        return new FunctionCall(name.lexeme, arguments, SourcePosition.span(name.position, close.position, name.position));
    }

    private Node latexCommand(Token command) {
        String name = commandName(command);
        LatexCommandHandler handler = commands.get(name);
        if (handler != null) return handler.parse(this, command);
        if (operatorCommands.containsKey(name)) {
            throw error(command, "Missing left operand for \\" + command.lexeme);
        }
        throw error(command, "Unsupported LaTeX command: \\" + command.lexeme);
    }

    // ===================== BUILT-IN COMMANDS =====================

    private Node fraction(Token command) {
        Node numerator = braced("Expected '{' after \\frac");
        Node denominator = braced("Expected '{' for denominator in \\frac");
        return new Binary(BinaryOperator.DIVIDE, numerator, denominator, spanToPrevious(command));
    }

    private Node root(Token command) {
        Node order = null;
        if (match(TokenType.LEFT_BRACKET)) {
            order = expression();
            consume(TokenType.RIGHT_BRACKET, "Expected ']' after root order in \\sqrt");
        }
        Node radicand = bracedOrPrimary();
        SourcePosition position = spanToPrevious(command);
        if (order == null) {
            return new FunctionCall("sqrt", List.of(radicand), position);
        }
        Node one = new NumberLiteral(BigDecimal.ONE, command.position);
        Node reciprocal = new Binary(BinaryOperator.DIVIDE, one, order, order.position());
        return new Binary(BinaryOperator.EXPONENT, radicand, reciprocal, position);
    }

    private Node simpleFunction(String name, Token command) {
        Node argument = bracedOrPrimary();
        return new FunctionCall(name, List.of(argument), spanToPrevious(command));
    }

    private Node iteration(IterationKind kind, Token command) {
        String label = "\\" + kind.command;
        consume(TokenType.UNDERSCORE, "Expected '_' after " + label);

        Token variable;
        Node start;
        if (match(TokenType.LEFT_BRACE)) {
            variable = consume(TokenType.VARIABLE, "Expected variable name in iteration range");
            consume(TokenType.EQUAL, "Expected '=' after variable in iteration range");
            start = expression();
            consume(TokenType.RIGHT_BRACE, "Expected '}' after iteration range");
        } else {
            variable = consume(TokenType.VARIABLE, "Expected variable name in iteration range");
            consume(TokenType.EQUAL, "Expected '=' after variable in iteration range");
            start = primary();
        }

        if (MathConstants.isConstant(variable.lexeme)) {
            throw error(variable, "Constant " + variable.lexeme + " cannot be an iteration variable");
        }

        consume(TokenType.CARET, "Expected '^' after lower bound in " + label);
        Node end = bracedOrPrimary();
        Node body = bracedOrPrimary();
        return new Iteration(kind, variable.lexeme, start, end, body, spanToPrevious(command));
    }

    // ===================== HANDLER HELPERS =====================

    /** Parses '{' expression '}'. */
    public Node braced(String missingOpenMessage) {
        consume(TokenType.LEFT_BRACE, missingOpenMessage);
        Node inner = expression();
        consume(TokenType.RIGHT_BRACE, "Expected '}'");
        return inner;
    }

    public Node bracedOrPrimary() {
        if (check(TokenType.LEFT_BRACE)) return braced("Expected '{'");
        return primary();
    }

    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    public Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    public boolean check(TokenType type) {
        return peek().type == type;
    }

    public Token peek() { return tokens.get(current); }

    public Token previous() { return tokens.get(current - 1); }

    public ParseException error(Token token, String message) {
        Debug.get().d(TAG, message + " at " + token.position);
        return new ParseException(message, token.position);
    }

    // ===================== INTERNALS =====================

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }

    private Node binary(BinaryOperator operator, Node left, Node right, Token op) {
        return new Binary(operator, left, right, SourcePosition.span(left.position(), right.position(), op.position));
    }

    private SourcePosition spanToPrevious(Token command) {
        return SourcePosition.span(command.position, previous().position, command.position);
    }

    private static String commandName(Token command) {
        return command.lexeme.toLowerCase(Locale.ROOT);
    }

    private static String describeUnexpected(Token token) {
        switch (token.type) {
            case EOF: return "Unexpected end of expression";
            case NONE: return "Unexpected character: " + token.lexeme;
            default: return "Unexpected token: " + token.lexeme;
        }
    }
}
