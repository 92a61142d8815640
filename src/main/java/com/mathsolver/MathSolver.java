package com.mathsolver;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.mathsolver.arithmetic.ArithmeticFormat;
import com.mathsolver.debug.Debug;
import com.mathsolver.eval.Evaluator;
import com.mathsolver.eval.StepEvaluator;
import com.mathsolver.eval.StepResult;
import com.mathsolver.parser.Expr;
import com.mathsolver.parser.ExpressionPrinter;
import com.mathsolver.parser.LatexCommandHandler;
import com.mathsolver.parser.Lexer;
import com.mathsolver.parser.Notation;
import com.mathsolver.parser.Parser;
import com.mathsolver.parser.PositionedException;
import com.mathsolver.parser.Token;
import com.mathsolver.plugins.FunctionRegistry;
import com.mathsolver.plugins.MathConstants;
import com.mathsolver.plugins.MathFunction;

/**
 * Entry point for callers that work with expression text.
 *
 * Holds the variable table, the arithmetic format, the function registry and any extra
 * LaTeX commands, and wires them into a fresh lexer, parser and evaluator per call.
 * Not thread-safe: iteration nodes write their bound variable into the shared table.
 */
public class MathSolver {
    private static final String TAG = "mathsolver";

    private final Map<String, BigDecimal> variables = new LinkedHashMap<>();
    private final FunctionRegistry functions = FunctionRegistry.standard();
    private final Map<String, LatexCommandHandler> latexCommands = new LinkedHashMap<>();
    private ArithmeticFormat format = ArithmeticFormat.NONE;

    public MathSolver() {}

    public MathSolver(ArithmeticFormat format) {
        setArithmeticFormat(format);
    }

    // ===================== PARSING =====================

    public Expr.Node parse(String expression) {
        if (expression == null) throw new IllegalArgumentException("expression must not be null");
        try {
            List<Token> tokens = new Lexer(expression, functions.names()).tokenize();
            return new Parser(tokens, latexCommands).parse();
        } catch (PositionedException e) {
            Debug.get().w(TAG, "parse failed for '" + expression + "': " + e.getMessage(), e);
            throw e;
        }
    }

    /** @return true when the text parses; evaluation is not attempted */
    public boolean validate(String expression) {
        return validationError(expression) == null;
    }

    /** @return the parse error message, or null when the text parses */
    public String validationError(String expression) {
        if (expression == null) return "Expression must not be null";
        try {
            new Parser(new Lexer(expression, functions.names()).tokenize(), latexCommands).parse();
            return null;
        } catch (PositionedException e) {
            return e.getMessage();
        }
    }

    // ===================== EVALUATION =====================

    public BigDecimal evaluate(String expression) {
        return evaluate(parse(expression));
    }

    public BigDecimal evaluate(Expr.Node root) {
        try {
            BigDecimal result = new Evaluator(variables, format, functions).evaluate(root);
            Debug.get().d(TAG, "evaluated to " + result.toPlainString() + " (" + format + ")");
            return result;
        } catch (PositionedException e) {
            Debug.get().w(TAG, "evaluation failed: " + e.getMessage(), e);
            throw e;
        }
    }

    public CalculationResult evaluateWithSteps(String expression) {
        Expr.Node root = parse(expression);
        StepResult result;
        try {
            result = new StepEvaluator(variables, format, functions).evaluate(root);
        } catch (PositionedException e) {
            Debug.get().w(TAG, "step evaluation failed: " + e.getMessage(), e);
            throw e;
        }
        Debug.get().d(TAG, "recorded " + result.steps().size() + " step(s) for '" + expression + "'");
        return new CalculationResult(
                expression,
                format.modeName(),
                format.precisionInfo(),
                result.value(),
                format.apply(result.value()),
                result.steps());
    }

    // ===================== PRINTING =====================

    public String formatExpression(String expression, Notation notation) {
        return formatExpression(parse(expression), notation);
    }

    public String formatExpression(Expr.Node root, Notation notation) {
        return new ExpressionPrinter(notation).print(root);
    }

    // ===================== VARIABLES =====================

    public void setVariable(String name, BigDecimal value) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("variable name must not be blank");
        if (value == null) throw new IllegalArgumentException("value of " + name + " must not be null");
        if (MathConstants.isConstant(name)) {
            throw new IllegalArgumentException("Constant " + key(name) + " cannot be assigned");
        }
        variables.put(key(name), value);
    }

    public void setVariable(String name, double value) {
        setVariable(name, new BigDecimal(Double.toString(value)));
    }

    public BigDecimal getVariable(String name) {
        BigDecimal value = name == null ? null : variables.get(key(name));
        if (value == null) throw new IllegalArgumentException("Variable '" + name + "' is not defined");
        return value;
    }

    public boolean removeVariable(String name) {
        return name != null && variables.remove(key(name)) != null;
    }

    public void clearVariables() {
        variables.clear();
    }

    /** Read-only view of the current table. */
    public Map<String, BigDecimal> variables() {
        return Collections.unmodifiableMap(variables);
    }

    // ===================== CONFIGURATION =====================

    public ArithmeticFormat getArithmeticFormat() {
        return format;
    }

    public void setArithmeticFormat(ArithmeticFormat format) {
        this.format = format == null ? ArithmeticFormat.NONE : format;
        Debug.get().d(TAG, "arithmetic format set to " + this.format);
    }

    public void registerFunction(String name, int arity, String description, MathFunction function) {
        functions.register(name, arity, description, function);
    }

    public void registerLatexCommand(String name, LatexCommandHandler handler) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("command name must not be blank");
        if (handler == null) throw new IllegalArgumentException("handler must not be null");
        latexCommands.put(name.toLowerCase(Locale.ROOT), handler);
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
