package com.mathsolver.arithmetic;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Objects;

/**
 * Precision policy applied after every arithmetic primitive, the way a calculator
 * with a fixed display would: each intermediate result is truncated or rounded
 * before it feeds the next operation.
 */
public final class ArithmeticFormat {

    public enum Mode {
        NONE,
        TRUNCATE,
        ROUND
    }

    public enum Unit {
        DECIMAL_PLACES,
        SIGNIFICANT_DIGITS
    }

    public static final ArithmeticFormat NONE = new ArithmeticFormat(Mode.NONE, 10, Unit.DECIMAL_PLACES);

    private final Mode mode;
    private final int precision;
    private final Unit unit;

    /**
     * @throws IllegalArgumentException for negative decimal places or non-positive significant digits
     */
    public ArithmeticFormat(Mode mode, int precision, Unit unit) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.unit = Objects.requireNonNull(unit, "unit");
        if (mode != Mode.NONE) {
            if (unit == Unit.DECIMAL_PLACES && precision < 0) {
                throw new IllegalArgumentException("Decimal places must be non-negative, got " + precision);
            }
            if (unit == Unit.SIGNIFICANT_DIGITS && precision <= 0) {
                throw new IllegalArgumentException("Significant digits must be positive, got " + precision);
            }
        }
        this.precision = precision;
    }

    public static ArithmeticFormat truncate(int precision, Unit unit) {
        return new ArithmeticFormat(Mode.TRUNCATE, precision, unit);
    }

    public static ArithmeticFormat round(int precision, Unit unit) {
        return new ArithmeticFormat(Mode.ROUND, precision, unit);
    }

    public Mode mode() { return mode; }
    public int precision() { return precision; }
    public Unit unit() { return unit; }

    public BigDecimal apply(BigDecimal value) {
        if (mode == Mode.NONE) return value;
        RoundingMode rounding = mode == Mode.TRUNCATE ? RoundingMode.DOWN : RoundingMode.HALF_UP;
        if (unit == Unit.DECIMAL_PLACES) {
            return value.setScale(precision, rounding);
        }
        if (value.signum() == 0) return BigDecimal.ZERO;
        return value.setScale(significantScale(value), rounding);
    }

    /**
     * Decimal places that keep {@code precision} significant digits. Negative for values
     * with more integer digits than that, so 1234.5678 at three digits becomes 1230.
     */
    private int significantScale(BigDecimal value) {
        int exponent = value.precision() - value.scale() - 1;
        if (value.abs().compareTo(BigDecimal.ONE) < 0) {
            return precision + Math.abs(exponent + 1);
        }
        return precision - exponent - 1;
    }

    /** Fragment used in step descriptions, e.g. "rounding to 2 decimal places". */
    public String describe() {
        if (mode == Mode.NONE) return "with no formatting";
        String action = mode == Mode.TRUNCATE ? "truncating" : "rounding";
        String noun = unit == Unit.SIGNIFICANT_DIGITS ? "significant digit" : "decimal place";
        return action + " to " + precision + " " + noun + (precision == 1 ? "" : "s");
    }

    /** Summary for result headers: "Maximum", "4 decimal places", "3 significant digits". */
    public String precisionInfo() {
        if (mode == Mode.NONE) return "Maximum";
        String noun = unit == Unit.SIGNIFICANT_DIGITS ? "significant digits" : "decimal places";
        return precision + " " + noun;
    }

    public String modeName() {
        String name = mode.name().toLowerCase(Locale.ROOT);
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArithmeticFormat)) return false;
        ArithmeticFormat other = (ArithmeticFormat) o;
        return mode == other.mode && precision == other.precision && unit == other.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, precision, unit);
    }

    @Override
    public String toString() {
        return modeName() + " (" + precisionInfo() + ")";
    }
}
