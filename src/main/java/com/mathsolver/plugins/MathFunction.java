package com.mathsolver.plugins;

import java.math.BigDecimal;
import java.util.List;

/**
 * A named real function. Implementations signal a domain violation
 * (sqrt of a negative, log of zero, ...) with {@link ArithmeticException}.
 */
@FunctionalInterface
public interface MathFunction {
    BigDecimal apply(List<BigDecimal> args);
}
