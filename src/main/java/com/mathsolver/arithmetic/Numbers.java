package com.mathsolver.arithmetic;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/** Numeric helpers shared by the evaluators and the formatter. */
public final class Numbers {

    /** Working precision for division, integer powers and square roots. */
    public static final MathContext CONTEXT = MathContext.DECIMAL128;

    /** Threshold for every "effectively an integer" check. */
    public static final BigDecimal EPSILON = new BigDecimal("1e-10");

    /** Largest decimal exponent, in either direction, a result may carry. */
    public static final int MAX_MAGNITUDE = 10_000;

    private Numbers() {}

    /** Decimal exponent of the leading digit: 3 for 1234.5, -3 for 0.00123. */
    public static long magnitude(BigDecimal value) {
        return (long) value.precision() - value.scale() - 1;
    }

    /**
     * @return value unchanged
     * @throws ArithmeticException if a non-zero value lies outside 1e-MAX_MAGNITUDE .. 1e+MAX_MAGNITUDE
     */
    public static BigDecimal checkRange(BigDecimal value) {
        if (value.signum() != 0 && Math.abs(magnitude(value)) > MAX_MAGNITUDE) {
            throw new ArithmeticException("result out of range");
        }
        return value;
    }

    public static boolean isEffectivelyInteger(BigDecimal value) {
        return value.subtract(nearestInteger(value)).abs().compareTo(EPSILON) < 0;
    }

    public static BigDecimal nearestInteger(BigDecimal value) {
        return value.setScale(0, RoundingMode.HALF_UP);
    }

    public static boolean isZero(BigDecimal value) {
        return value.signum() == 0;
    }

    /**
     * Converts a double result back into a decimal.
     *
     * @throws ArithmeticException if the double is NaN or infinite
     */
    public static BigDecimal fromDouble(double value) {
        if (Double.isNaN(value)) throw new ArithmeticException("result is not a real number");
        if (Double.isInfinite(value)) throw new ArithmeticException("result overflow");
        return BigDecimal.valueOf(value);
    }

    /** Plain text without exponent notation or trailing zeros. */
    public static String toText(BigDecimal value) {
        if (value.signum() == 0) return "0";
        return value.stripTrailingZeros().toPlainString();
    }
}
