package com.mathsolver;

import java.math.BigDecimal;
import java.util.List;

import com.mathsolver.eval.CalculationStep;

/** Outcome of {@link MathSolver#evaluateWithSteps(String)} together with the settings that produced it. */
public class CalculationResult {
    private final String expression;
    private final String arithmeticMode;
    private final String precisionInfo;
    private final BigDecimal actualResult;
    private final BigDecimal formattedResult;
    private final List<CalculationStep> steps;

    public CalculationResult(
            String expression,
            String arithmeticMode,
            String precisionInfo,
            BigDecimal actualResult,
            BigDecimal formattedResult,
            List<CalculationStep> steps
    ) {
        this.expression = expression;
        this.arithmeticMode = arithmeticMode;
        this.precisionInfo = precisionInfo;
        this.actualResult = actualResult;
        this.formattedResult = formattedResult;
        this.steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public String expression() { return expression; }
    public String arithmeticMode() { return arithmeticMode; }
    public String precisionInfo() { return precisionInfo; }
    public BigDecimal actualResult() { return actualResult; }
    public BigDecimal formattedResult() { return formattedResult; }
    public List<CalculationStep> steps() { return steps; }
}
