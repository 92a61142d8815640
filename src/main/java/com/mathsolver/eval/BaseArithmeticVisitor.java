package com.mathsolver.eval;

import java.math.BigDecimal;
import java.util.Map;

import com.mathsolver.arithmetic.ArithmeticFormat;
import com.mathsolver.arithmetic.Numbers;
import com.mathsolver.parser.Expr;
import com.mathsolver.parser.Expr.BinaryOperator;
import com.mathsolver.parser.Expr.ExprVisitor;
import com.mathsolver.parser.Expr.Iteration;
import com.mathsolver.parser.SourcePosition;
import com.mathsolver.plugins.FunctionRegistry;
import com.mathsolver.plugins.MathConstants;

/**
 * Arithmetic shared by {@link Evaluator} and {@link StepEvaluator}.
 *
 * The variable table is used by reference: iteration nodes write their bound
 * variable into it and restore it afterwards.
 */
abstract class BaseArithmeticVisitor<R> implements ExprVisitor<R> {

    private static final BigDecimal MAX_EXPONENT = BigDecimal.valueOf(999_999_999L);
    private static final BigDecimal INT_MIN = BigDecimal.valueOf(Integer.MIN_VALUE);
    private static final BigDecimal INT_MAX = BigDecimal.valueOf(Integer.MAX_VALUE);

    protected final Map<String, BigDecimal> variables;
    protected final ArithmeticFormat format;
    protected final FunctionRegistry functions;

    protected BaseArithmeticVisitor(Map<String, BigDecimal> variables, ArithmeticFormat format, FunctionRegistry functions) {
        if (variables == null) throw new IllegalArgumentException("variables must not be null");
        this.variables = variables;
        this.format = format == null ? ArithmeticFormat.NONE : format;
        this.functions = functions == null ? FunctionRegistry.standard() : functions;
    }

    protected BigDecimal format(BigDecimal value) {
        return format.apply(value);
    }

    /** Constants first, then the variable table. Constants pass through the formatter. */
    protected BigDecimal lookup(Expr.Variable node) {
        BigDecimal constant = MathConstants.lookup(node.name);
        if (constant != null) return format(constant);
        BigDecimal value = variables.get(node.name);
        if (value == null) {
            throw new EvaluationException("Variable '" + node.name + "' is not defined", node.position());
        }
        return value;
    }

    /** One formatted arithmetic primitive. */
    protected BigDecimal apply(BinaryOperator operator, BigDecimal left, BigDecimal right, SourcePosition position) {
        BigDecimal raw;
        try {
            switch (operator) {
                case ADD: raw = left.add(right, Numbers.CONTEXT); break;
                case SUBTRACT: raw = left.subtract(right, Numbers.CONTEXT); break;
                case MULTIPLY: raw = left.multiply(right, Numbers.CONTEXT); break;
                case DIVIDE:
                    if (Numbers.isZero(right)) throw new EvaluationException("Division by zero", position);
                    raw = left.divide(right, Numbers.CONTEXT);
                    break;
                case EXPONENT: raw = power(left, right, position); break;
                default: throw new IllegalStateException("Unknown operator " + operator);
            }
            Numbers.checkRange(raw);
        } catch (ArithmeticException e) {
            throw new EvaluationException(e.getMessage(), position, e);
        }
        return format(raw);
    }

    private BigDecimal power(BigDecimal base, BigDecimal exponent, SourcePosition position) {
        if (Numbers.isZero(exponent)) return BigDecimal.ONE;
        if (Numbers.isZero(base)) return BigDecimal.ZERO;
        if (Numbers.isEffectivelyInteger(exponent)) {
            BigDecimal n = Numbers.nearestInteger(exponent);
            if (n.abs().compareTo(MAX_EXPONENT) > 0) {
                throw new EvaluationException("Exponent too large: " + Numbers.toText(n), position);
            }
            return base.pow(n.intValueExact(), Numbers.CONTEXT);
        }
        return Numbers.fromDouble(Math.pow(base.doubleValue(), exponent.doubleValue()));
    }

    /** @return n when value is within epsilon of the non-negative integer n */
    protected int factorialOperand(BigDecimal value, SourcePosition position) {
        BigDecimal n = Numbers.nearestInteger(value);
        if (n.signum() < 0 || !Numbers.isEffectivelyInteger(value)) {
            throw new EvaluationException("Factorial is only defined for non-negative integers", position);
        }
        if (n.compareTo(INT_MAX) > 0) {
            throw new EvaluationException("Factorial argument too large: " + Numbers.toText(n), position);
        }
        return n.intValueExact();
    }

    /** Exact while the product fits the working precision; fails once it leaves the allowed range. */
    protected BigDecimal factorial(int n, SourcePosition position) {
        BigDecimal result = BigDecimal.ONE;
        try {
            for (int i = 2; i <= n; i++) {
                result = Numbers.checkRange(result.multiply(BigDecimal.valueOf(i), Numbers.CONTEXT));
            }
        } catch (ArithmeticException e) {
            throw new EvaluationException("Factorial result out of range: " + n + "!", position, e);
        }
        return format(result);
    }

    protected int iterationBound(Iteration node, BigDecimal value) {
        if (!Numbers.isEffectivelyInteger(value)) {
            throw new EvaluationException(iterationName(node) + " bounds must be integers", node.position());
        }
        BigDecimal n = Numbers.nearestInteger(value);
        if (n.compareTo(INT_MIN) < 0 || n.compareTo(INT_MAX) > 0) {
            throw new EvaluationException(iterationName(node) + " bound out of range: " + Numbers.toText(n), node.position());
        }
        return n.intValueExact();
    }

    protected static BigDecimal identity(Iteration node) {
        return node.kind == Expr.IterationKind.SUMMATION ? BigDecimal.ZERO : BigDecimal.ONE;
    }

    protected BigDecimal accumulate(Iteration node, BigDecimal acc, BigDecimal term) {
        BinaryOperator operator = node.kind == Expr.IterationKind.SUMMATION ? BinaryOperator.ADD : BinaryOperator.MULTIPLY;
        return apply(operator, acc, term, node.position());
    }

    protected static String iterationName(Iteration node) {
        return node.kind == Expr.IterationKind.SUMMATION ? "Summation" : "Product";
    }
}
