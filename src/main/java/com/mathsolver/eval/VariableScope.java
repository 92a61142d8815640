package com.mathsolver.eval;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Temporarily rebinds one name in a variable table.
 *
 * The prior value, or its absence, is captured on creation and put back by
 * {@link #close()}, so a try-with-resources block restores the table on every
 * exit path including a thrown {@link EvaluationException}.
 */
final class VariableScope implements AutoCloseable {
    private final Map<String, BigDecimal> variables;
    private final String name;
    private final boolean hadPrior;
    private final BigDecimal prior;

    private VariableScope(Map<String, BigDecimal> variables, String name) {
        this.variables = variables;
        this.name = name;
        this.hadPrior = variables.containsKey(name);
        this.prior = variables.get(name);
    }

    static VariableScope bind(Map<String, BigDecimal> variables, String name) {
        return new VariableScope(variables, name);
    }

    void set(BigDecimal value) {
        variables.put(name, value);
    }

    @Override
    public void close() {
        if (hadPrior) variables.put(name, prior);
        else variables.remove(name);
    }
}
