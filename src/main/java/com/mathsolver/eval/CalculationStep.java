package com.mathsolver.eval;

/** One line of a calculation trace: what was computed, how, and the formatted result. */
public final class CalculationStep {
    private final String expression;
    private final String operation;
    private final String result;

    public CalculationStep(String expression, String operation, String result) {
        this.expression = expression;
        this.operation = operation;
        this.result = result;
    }

    public String expression() { return expression; }
    public String operation() { return operation; }
    public String result() { return result; }

    @Override
    public String toString() {
        return expression + " => " + operation + " => " + result;
    }
}
