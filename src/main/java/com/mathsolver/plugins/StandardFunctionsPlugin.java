package com.mathsolver.plugins;

import java.math.BigDecimal;
import java.util.List;

import com.mathsolver.arithmetic.Numbers;

/**
 * The built-in unary functions.
 *
 * sin/cos/tan take radians; log is base 10, ln is natural. sqrt, log and ln
 * reject arguments outside their real domain.
 */
public final class StandardFunctionsPlugin {

    private StandardFunctionsPlugin() {}

    public static void register(FunctionRegistry registry) {

        registry.register("sin", 1, "Calculate sine of {0}",
                args -> Numbers.fromDouble(Math.sin(num(args, 0))));

        registry.register("cos", 1, "Calculate cosine of {0}",
                args -> Numbers.fromDouble(Math.cos(num(args, 0))));

        registry.register("tan", 1, "Calculate tangent of {0}",
                args -> Numbers.fromDouble(Math.tan(num(args, 0))));

        registry.register("sqrt", 1, "Calculate square root of {0}", args -> {
            BigDecimal x = args.get(0);
            if (x.signum() < 0) {
                throw new ArithmeticException("Cannot take square root of a negative number");
            }
            return x.sqrt(Numbers.CONTEXT);
        });

        registry.register("log", 1, "Calculate base-10 logarithm of {0}", args -> {
            requirePositive(args.get(0), "Cannot take logarithm of a non-positive number");
            return Numbers.fromDouble(Math.log10(num(args, 0)));
        });

        registry.register("ln", 1, "Calculate natural logarithm of {0}", args -> {
            requirePositive(args.get(0), "Cannot take natural logarithm of a non-positive number");
            return Numbers.fromDouble(Math.log(num(args, 0)));
        });
    }

    // ===================== HELPERS =====================

    private static void requirePositive(BigDecimal x, String message) {
        if (x.signum() <= 0) throw new ArithmeticException(message);
    }

    private static double num(List<BigDecimal> args, int idx) {
        return args.get(idx).doubleValue();
    }
}
