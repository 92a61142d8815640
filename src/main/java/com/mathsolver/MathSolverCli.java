package com.mathsolver;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.mathsolver.arithmetic.ArithmeticFormat;
import com.mathsolver.arithmetic.Numbers;
import com.mathsolver.debug.Debug;
import com.mathsolver.debug.DebugLevel;
import com.mathsolver.debug.DebugSink;
import com.mathsolver.eval.CalculationStep;
import com.mathsolver.parser.Notation;
import com.mathsolver.parser.PositionedException;
import com.mathsolver.protocol.CalculationJson;

/**
 * Command line front end.
 *
 * <pre>
 *   --expr=2+3*4            evaluate one expression (otherwise one per stdin line, "exit" stops)
 *   --mode=none|truncate|round --precision=4 --unit=places|sig
 *   --steps                 print the calculation trace
 *   --latex                 echo the expression in LaTeX notation
 *   --json                  print the result (with steps) as JSON
 *   --var=x=2.5             define a variable (repeatable)
 *   --vars=/path/vars.json  load variables from {"x": 2.5, ...}
 *   --debug                 debug log on stderr
 * </pre>
 */
public final class MathSolverCli {

    static final int EXIT_OK = 0;
    static final int EXIT_EVAL_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private final PrintStream out;
    private final PrintStream err;

    private boolean steps;
    private boolean latex;
    private boolean json;

    public MathSolverCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new MathSolverCli(System.out, System.err).run(args, System.in);
        System.exit(code);
    }

    public int run(String[] args, InputStream in) {
        Map<String, List<String>> flags = parseArgs(args);

        DebugSink previousSink = Debug.get().getSink();
        if (flags.containsKey("debug")) {
            Debug.get().setSink(Debug.streamSink(err, DebugLevel.DEBUG));
        }
        try {
            MathSolver solver;
            try {
                solver = configure(flags);
            } catch (IllegalArgumentException | UncheckedIOException e) {
                err.println("Usage error: " + e.getMessage());
                return EXIT_USAGE;
            }

            String expr = last(flags, "expr", null);
            if (expr != null) {
                return solve(solver, expr) ? EXIT_OK : EXIT_EVAL_ERROR;
            }
            return readLoop(solver, in);
        } finally {
            Debug.get().setSink(previousSink);
        }
    }

    private MathSolver configure(Map<String, List<String>> flags) {
        steps = flags.containsKey("steps");
        latex = flags.containsKey("latex");
        json = flags.containsKey("json");

        MathSolver solver = new MathSolver(parseFormat(flags));

        String varsFile = last(flags, "vars", null);
        if (varsFile != null) {
            for (Map.Entry<String, BigDecimal> e : CalculationJson.readVariables(Path.of(varsFile)).entrySet()) {
                solver.setVariable(e.getKey(), e.getValue());
            }
        }
        for (String assignment : flags.getOrDefault("var", List.of())) {
            int eq = assignment.indexOf('=');
            if (eq <= 0) throw new IllegalArgumentException("--var expects name=value, got: " + assignment);
            String name = assignment.substring(0, eq).trim();
            String value = assignment.substring(eq + 1).trim();
            try {
                solver.setVariable(name, new BigDecimal(value));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Variable '" + name + "' is not numeric: " + value, e);
            }
        }
        return solver;
    }

    static ArithmeticFormat parseFormat(Map<String, List<String>> flags) {
        String mode = last(flags, "mode", "none").toLowerCase(Locale.ROOT);
        String unitFlag = last(flags, "unit", "places").toLowerCase(Locale.ROOT);
        int precision;
        try {
            precision = Integer.parseInt(last(flags, "precision", "10"));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--precision expects an integer", e);
        }

        ArithmeticFormat.Unit unit;
        switch (unitFlag) {
            case "places": unit = ArithmeticFormat.Unit.DECIMAL_PLACES; break;
            case "sig": unit = ArithmeticFormat.Unit.SIGNIFICANT_DIGITS; break;
            default: throw new IllegalArgumentException("Unknown unit: " + unitFlag);
        }

        switch (mode) {
            case "none": return ArithmeticFormat.NONE;
            case "truncate": return ArithmeticFormat.truncate(precision, unit);
            case "round": return ArithmeticFormat.round(precision, unit);
            default: throw new IllegalArgumentException("Unknown mode: " + mode);
        }
    }

    private int readLoop(MathSolver solver, InputStream in) {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) continue;
                if (line.equalsIgnoreCase("exit")) break;
                solve(solver, line);
            }
            return EXIT_OK;
        } catch (IOException e) {
            err.println("Failed to read input: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    /** @return false when the expression could not be parsed or evaluated */
    private boolean solve(MathSolver solver, String expr) {
        try {
            if (latex && !json) {
                out.println("LaTeX: " + solver.formatExpression(expr, Notation.LATEX));
            }
            if (json) {
                out.println(CalculationJson.toJson(solver.evaluateWithSteps(expr), true));
            } else if (steps) {
                CalculationResult result = solver.evaluateWithSteps(expr);
                int n = 1;
                for (CalculationStep step : result.steps()) {
                    out.println(n++ + ". " + step);
                }
                out.println("Result: " + Numbers.toText(result.formattedResult()));
            } else {
                out.println(Numbers.toText(solver.evaluate(expr)));
            }
            return true;
        } catch (PositionedException e) {
            err.println("Error: " + e.getMessage());
            return false;
        }
    }

    /**
     * Minimal arg parser:
     *   --expr=1+2 --mode=round --precision=3
     *   --var=x=1 --var=y=2   (repeatable, kept in order)
     *   --steps --json        (bare flags map to "true")
     */
    static Map<String, List<String>> parseArgs(String[] args) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (String a : args) {
            if (a.startsWith("--") && a.contains("=")) {
                int i = a.indexOf('=');
                out.computeIfAbsent(a.substring(2, i), k -> new ArrayList<>()).add(a.substring(i + 1));
            } else if (a.startsWith("--")) {
                out.computeIfAbsent(a.substring(2), k -> new ArrayList<>()).add("true");
            }
        }
        return out;
    }

    private static String last(Map<String, List<String>> flags, String name, String fallback) {
        List<String> values = flags.get(name);
        return values == null || values.isEmpty() ? fallback : values.get(values.size() - 1);
    }
}
