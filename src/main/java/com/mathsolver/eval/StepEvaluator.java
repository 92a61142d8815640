package com.mathsolver.eval;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.mathsolver.arithmetic.ArithmeticFormat;
import com.mathsolver.arithmetic.Numbers;
import com.mathsolver.debug.Debug;
import com.mathsolver.parser.Expr.Binary;
import com.mathsolver.parser.Expr.Factorial;
import com.mathsolver.parser.Expr.FunctionCall;
import com.mathsolver.parser.Expr.IterationKind;
import com.mathsolver.parser.Expr.Iteration;
import com.mathsolver.parser.Expr.Node;
import com.mathsolver.parser.Expr.NumberLiteral;
import com.mathsolver.parser.Expr.Parenthesis;
import com.mathsolver.parser.Expr.Variable;
import com.mathsolver.parser.ExpressionPrinter;
import com.mathsolver.plugins.FunctionRegistry;
import com.mathsolver.plugins.MathConstants;

/**
 * Evaluates a tree the same way as {@link Evaluator} while recording a
 * human-readable trace: children's steps first, then one step for the
 * operation the node itself performs.
 *
 * Steps go into one list for the whole run; visit methods return only the value.
 */
public class StepEvaluator extends BaseArithmeticVisitor<BigDecimal> {
    private static final String TAG = "mathsolver.steps";

    private final ExpressionPrinter printer = new ExpressionPrinter();
    private List<CalculationStep> steps = new ArrayList<>();

    public StepEvaluator(Map<String, BigDecimal> variables, ArithmeticFormat format) {
        this(variables, format, FunctionRegistry.standard());
    }

    public StepEvaluator(Map<String, BigDecimal> variables, ArithmeticFormat format, FunctionRegistry functions) {
        super(variables, format, functions);
    }

    public StepResult evaluate(Node root) {
        steps = new ArrayList<>();
        BigDecimal value = root.accept(this);
        return new StepResult(value, steps);
    }

    @Override
    public BigDecimal visitNumber(NumberLiteral expr) {
        return expr.value;
    }

    @Override
    public BigDecimal visitVariable(Variable expr) {
        BigDecimal value = lookup(expr);
        String operation = MathConstants.isConstant(expr.name)
                ? "Substitute constant " + expr.name + ", " + format.describe()
                : "Substitute variable " + expr.name;
        record(expr.name, operation, text(value));
        return value;
    }

    @Override
    public BigDecimal visitBinary(Binary expr) {
        BigDecimal left = expr.left.accept(this);
        BigDecimal right = expr.right.accept(this);

        BigDecimal result = apply(expr.operator, left, right, expr.position());
        record(printer.print(expr), describe(expr, left, right) + ", " + format.describe(), text(result));
        return result;
    }

    @Override
    public BigDecimal visitParenthesis(Parenthesis expr) {
        int before = steps.size();
        BigDecimal value = expr.inner.accept(this);
        if (steps.size() > before) {
            record(printer.print(expr), "Evaluate parentheses", text(value));
        }
        return value;
    }

    @Override
    public BigDecimal visitFunction(FunctionCall expr) {
        List<BigDecimal> args = new ArrayList<>(expr.arguments.size());
        List<String> argTexts = new ArrayList<>(expr.arguments.size());
        for (Node argument : expr.arguments) {
            BigDecimal arg = argument.accept(this);
            args.add(arg);
            argTexts.add(text(arg));
        }

        BigDecimal result = format(functions.invoke(expr.name, args, expr.position()));
        record(printer.print(expr), functions.describe(expr.name, argTexts) + ", " + format.describe(), text(result));
        return result;
    }

    @Override
    public BigDecimal visitFactorial(Factorial expr) {
        BigDecimal operand = expr.operand.accept(this);
        int n = factorialOperand(operand, expr.position());
        BigDecimal result = factorial(n, expr.position());
        record(printer.print(expr), "Calculate factorial of " + n + ", " + format.describe(), text(result));
        return result;
    }

    @Override
    public BigDecimal visitIteration(Iteration expr) {
        int start = iterationBound(expr, expr.start.accept(this));
        int end = iterationBound(expr, expr.end.accept(this));

        boolean summation = expr.kind == IterationKind.SUMMATION;
        String noun = summation ? "summation" : "product";
        String expression = printer.print(expr);
        record(expression,
                "Setup " + noun + " with " + expr.variable + " from " + start + " to " + end,
                summation ? "Calculate each term and sum" : "Calculate each term and multiply");

        BigDecimal result = identity(expr);
        try (VariableScope scope = VariableScope.bind(variables, expr.variable)) {
            for (long i = start; i <= end; i++) {
                scope.set(BigDecimal.valueOf(i));
                Debug.get().t(TAG, "bound " + expr.variable + " = " + i);
                record(expr.variable + " = " + i, "Set iteration variable " + expr.variable + " to " + i, Long.toString(i));

                BigDecimal term = expr.body.accept(this);
                BigDecimal next = accumulate(expr, result, term);
                String operation = summation
                        ? "Add term value " + text(term) + " to current sum " + text(result)
                        : "Multiply current product " + text(result) + " by term value " + text(term);
                record((summation ? "sum + " : "product * ") + text(term),
                        operation + ", " + format.describe(),
                        text(next));
                result = next;
            }
        }

        record(expression, "Complete " + noun + " from " + start + " to " + end, text(result));
        return result;
    }

    private void record(String expression, String operation, String result) {
        steps.add(new CalculationStep(expression, operation, result));
    }

    private String describe(Binary expr, BigDecimal left, BigDecimal right) {
        switch (expr.operator) {
            case ADD: return "Add " + text(left) + " and " + text(right);
            case SUBTRACT: return "Subtract " + text(right) + " from " + text(left);
            case MULTIPLY: return "Multiply " + text(left) + " by " + text(right);
            case DIVIDE: return "Divide " + text(left) + " by " + text(right);
            case EXPONENT:
                if (Numbers.isZero(right)) return "Any number raised to power 0 is 1";
                if (Numbers.isZero(left)) return "0 raised to any non-zero power is 0";
                if (right.compareTo(BigDecimal.ONE) == 0) return "Any number raised to power 1 is the number itself";
                return "Raise " + text(left) + " to the power of " + text(right);
            default:
                throw new IllegalStateException("Unknown operator " + expr.operator);
        }
    }

    private static String text(BigDecimal value) {
        return Numbers.toText(value);
    }
}
