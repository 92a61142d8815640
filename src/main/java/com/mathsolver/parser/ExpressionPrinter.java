package com.mathsolver.parser;

import java.util.Set;
import java.util.StringJoiner;

import com.mathsolver.parser.Expr.Binary;
import com.mathsolver.parser.Expr.BinaryOperator;
import com.mathsolver.parser.Expr.ExprVisitor;
import com.mathsolver.parser.Expr.Factorial;
import com.mathsolver.parser.Expr.FunctionCall;
import com.mathsolver.parser.Expr.Iteration;
import com.mathsolver.parser.Expr.Node;
import com.mathsolver.parser.Expr.NumberLiteral;
import com.mathsolver.parser.Expr.Parenthesis;
import com.mathsolver.parser.Expr.Variable;

/**
 * Renders a tree as infix or LaTeX text that the {@link Parser} reads back.
 *
 * Parentheses are added only where a child binds looser than its parent
 * (additive &lt; multiplicative &lt; exponent &lt; atom), on the right of the
 * non-associative '-' and '/', and around an exponent base that is itself a power.
 */
public class ExpressionPrinter implements ExprVisitor<String> {

    private static final int ADDITIVE = 1;
    private static final int MULTIPLICATIVE = 2;
    private static final int EXPONENT = 3;
    private static final int ATOM = 4;

    private static final Set<String> LATEX_FUNCTIONS = Set.of("sin", "cos", "tan", "log", "ln", "sqrt");
    private static final Set<String> LATEX_CONSTANTS = Set.of("pi", "phi");

    private final Notation notation;

    public ExpressionPrinter() {
        this(Notation.PLAIN);
    }

    public ExpressionPrinter(Notation notation) {
        this.notation = notation == null ? Notation.PLAIN : notation;
    }

    public String print(Node node) {
        return node.accept(this);
    }

    @Override
    public String visitNumber(NumberLiteral expr) {
        return expr.value.toPlainString();
    }

    @Override
    public String visitVariable(Variable expr) {
        if (notation == Notation.LATEX && LATEX_CONSTANTS.contains(expr.name)) return "\\" + expr.name;
        return expr.name;
    }

    @Override
    public String visitBinary(Binary expr) {
        switch (expr.operator) {
            case ADD: {
                String left = print(expr.left);
                if (expr.right instanceof NumberLiteral && ((NumberLiteral) expr.right).value.signum() < 0) {
                    return left + " - " + ((NumberLiteral) expr.right).value.negate().toPlainString();
                }
                return left + " + " + print(expr.right);
            }
            case SUBTRACT:
                return print(expr.left) + " - " + wrap(expr.right, precedence(expr.right) <= ADDITIVE);
            case MULTIPLY: {
                String left = wrap(expr.left, precedence(expr.left) < MULTIPLICATIVE);
                String right = wrap(expr.right, precedence(expr.right) < MULTIPLICATIVE);
                return left + (notation == Notation.LATEX ? " \\cdot " : " * ") + right;
            }
            case DIVIDE:
                if (notation == Notation.LATEX) {
                    return "\\frac{" + print(expr.left) + "}{" + print(expr.right) + "}";
                }
                return wrap(expr.left, precedence(expr.left) < MULTIPLICATIVE)
                        + " / " + wrap(expr.right, precedence(expr.right) <= MULTIPLICATIVE);
            case EXPONENT: {
                String base = wrap(expr.left, precedence(expr.left) <= EXPONENT);
                if (notation == Notation.LATEX) return base + "^{" + print(expr.right) + "}";
                return base + "^" + wrap(expr.right, precedence(expr.right) < EXPONENT);
            }
            default:
                throw new IllegalStateException("Unknown operator " + expr.operator);
        }
    }

    @Override
    public String visitParenthesis(Parenthesis expr) {
        return "(" + print(expr.inner) + ")";
    }

    @Override
    public String visitFunction(FunctionCall expr) {
        if (notation == Notation.LATEX && LATEX_FUNCTIONS.contains(expr.name) && expr.arguments.size() == 1) {
            return "\\" + expr.name + "{" + print(expr.arguments.get(0)) + "}";
        }
        StringJoiner args = new StringJoiner(", ", expr.name + "(", ")");
        for (Node argument : expr.arguments) {
            args.add(print(argument));
        }
        return args.toString();
    }

    @Override
    public String visitFactorial(Factorial expr) {
        Node operand = expr.operand;
        boolean bare = (operand instanceof NumberLiteral && ((NumberLiteral) operand).value.signum() >= 0)
                || operand instanceof Variable
                || operand instanceof Parenthesis
                || operand instanceof FunctionCall
                || operand instanceof Factorial;
        return wrap(operand, !bare) + "!";
    }

    @Override
    public String visitIteration(Iteration expr) {
        return "\\" + expr.kind.command
                + "_{" + expr.variable + "=" + print(expr.start) + "}"
                + "^{" + print(expr.end) + "}"
                + "{" + print(expr.body) + "}";
    }

    private String wrap(Node node, boolean needsParentheses) {
        String text = print(node);
        return needsParentheses ? "(" + text + ")" : text;
    }

    private static int precedence(Node node) {
        if (node instanceof Binary) {
            BinaryOperator operator = ((Binary) node).operator;
            switch (operator) {
                case ADD:
                case SUBTRACT:
                    return ADDITIVE;
                case MULTIPLY:
                case DIVIDE:
                    return MULTIPLICATIVE;
                default:
                    return EXPONENT;
            }
        }
        // a negative literal reads like "0 - x" wherever it lands
        if (node instanceof NumberLiteral && ((NumberLiteral) node).value.signum() < 0) return ADDITIVE;
        return ATOM;
    }
}
