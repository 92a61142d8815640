package com.mathsolver.eval;

import java.math.BigDecimal;
import java.util.List;

public class StepResult {
    private final BigDecimal value;
    private final List<CalculationStep> steps;

    public StepResult(BigDecimal value, List<CalculationStep> steps) {
        this.value = value;
        this.steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public BigDecimal value() { return value; }
    public List<CalculationStep> steps() { return steps; }
}
