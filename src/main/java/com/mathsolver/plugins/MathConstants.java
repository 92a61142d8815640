package com.mathsolver.plugins;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

/** Exact literals for the named constants; never computed at runtime. */
public final class MathConstants {

    public static final BigDecimal PI = new BigDecimal("3.1415926535897932384626433832795028841971693993751058");
    public static final BigDecimal E = new BigDecimal("2.7182818284590452353602874713526624977572470936999595");
    public static final BigDecimal PHI = new BigDecimal("1.6180339887498948482045868343656381177203091798057628");

    private static final Map<String, BigDecimal> BY_NAME = Map.of(
            "pi", PI,
            "e", E,
            "phi", PHI
    );

    private MathConstants() {}

    public static boolean isConstant(String name) {
        return name != null && BY_NAME.containsKey(name.toLowerCase(Locale.ROOT));
    }

    /** @return the constant's value, or null when the name is not a constant */
    public static BigDecimal lookup(String name) {
        if (name == null) return null;
        return BY_NAME.get(name.toLowerCase(Locale.ROOT));
    }
}
