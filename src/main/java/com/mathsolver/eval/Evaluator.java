package com.mathsolver.eval;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.mathsolver.arithmetic.ArithmeticFormat;
import com.mathsolver.parser.Expr.Binary;
import com.mathsolver.parser.Expr.Factorial;
import com.mathsolver.parser.Expr.FunctionCall;
import com.mathsolver.parser.Expr.Iteration;
import com.mathsolver.parser.Expr.Node;
import com.mathsolver.parser.Expr.NumberLiteral;
import com.mathsolver.parser.Expr.Parenthesis;
import com.mathsolver.parser.Expr.Variable;
import com.mathsolver.plugins.FunctionRegistry;

/** Evaluates a tree to a single value, formatting after every arithmetic primitive. */
public class Evaluator extends BaseArithmeticVisitor<BigDecimal> {

    public Evaluator(Map<String, BigDecimal> variables, ArithmeticFormat format) {
        this(variables, format, FunctionRegistry.standard());
    }

    public Evaluator(Map<String, BigDecimal> variables, ArithmeticFormat format, FunctionRegistry functions) {
        super(variables, format, functions);
    }

    public BigDecimal evaluate(Node root) {
        return root.accept(this);
    }

    @Override
    public BigDecimal visitNumber(NumberLiteral expr) {
        return expr.value;
    }

    @Override
    public BigDecimal visitVariable(Variable expr) {
        return lookup(expr);
    }

    @Override
    public BigDecimal visitBinary(Binary expr) {
        BigDecimal left = expr.left.accept(this);
        BigDecimal right = expr.right.accept(this);
        return apply(expr.operator, left, right, expr.position());
    }

    @Override
    public BigDecimal visitParenthesis(Parenthesis expr) {
        return expr.inner.accept(this);
    }

    @Override
    public BigDecimal visitFunction(FunctionCall expr) {
        List<BigDecimal> args = new ArrayList<>(expr.arguments.size());
        for (Node argument : expr.arguments) {
            args.add(argument.accept(this));
        }
        return format(functions.invoke(expr.name, args, expr.position()));
    }

    @Override
    public BigDecimal visitFactorial(Factorial expr) {
        BigDecimal value = expr.operand.accept(this);
        return factorial(factorialOperand(value, expr.position()), expr.position());
    }

    @Override
    public BigDecimal visitIteration(Iteration expr) {
        int start = iterationBound(expr, expr.start.accept(this));
        int end = iterationBound(expr, expr.end.accept(this));

        BigDecimal result = identity(expr);
        try (VariableScope scope = VariableScope.bind(variables, expr.variable)) {
            for (long i = start; i <= end; i++) {
                scope.set(BigDecimal.valueOf(i));
                BigDecimal term = expr.body.accept(this);
                result = accumulate(expr, result, term);
            }
        }
        return result;
    }
}
