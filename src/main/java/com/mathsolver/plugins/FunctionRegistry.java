package com.mathsolver.plugins;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.mathsolver.eval.EvaluationException;
import com.mathsolver.parser.SourcePosition;

/**
 * Case-insensitive table of named functions, each with a fixed arity and a
 * description template ({0}, {1}, ... one slot per argument) used for step text.
 */
public final class FunctionRegistry {

    public static final class Entry {
        public final String name;
        public final int arity;
        public final String description;
        final MathFunction function;

        Entry(String name, int arity, String description, MathFunction function) {
            this.name = name;
            this.arity = arity;
            this.description = description;
            this.function = function;
        }
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /** Registry holding sin, cos, tan, log, ln and sqrt. */
    public static FunctionRegistry standard() {
        FunctionRegistry registry = new FunctionRegistry();
        StandardFunctionsPlugin.register(registry);
        return registry;
    }

    public void register(String name, int arity, String description, MathFunction function) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("function name must not be blank");
        if (arity < 0) throw new IllegalArgumentException("arity must be non-negative, got " + arity);
        if (function == null) throw new IllegalArgumentException("function must not be null");
        String key = name.toLowerCase(Locale.ROOT);
        entries.put(key, new Entry(key, arity, description, function));
    }

    public boolean contains(String name) {
        return name != null && entries.containsKey(name.toLowerCase(Locale.ROOT));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    /**
     * Runs a function on already-evaluated arguments.
     *
     * @throws EvaluationException for an unknown name, a wrong argument count or a domain violation
     */
    public BigDecimal invoke(String name, List<BigDecimal> args, SourcePosition position) {
        Entry entry = require(name, args.size(), position);
        try {
            return entry.function.apply(args);
        } catch (ArithmeticException e) {
            throw new EvaluationException(e.getMessage(), position, e);
        }
    }

    /** Fills the function's description template with the argument texts; other text is kept verbatim. */
    public String describe(String name, List<String> argTexts) {
        Entry entry = entries.get(name.toLowerCase(Locale.ROOT));
        if (entry == null || entry.description == null) return "Calculate " + name + " function";
        String text = entry.description;
        for (int i = 0; i < argTexts.size(); i++) {
            text = text.replace("{" + i + "}", argTexts.get(i));
        }
        return text;
    }

    private Entry require(String name, int argCount, SourcePosition position) {
        Entry entry = entries.get(name.toLowerCase(Locale.ROOT));
        if (entry == null) {
            throw new EvaluationException("Unsupported function: " + name, position);
        }
        if (entry.arity != argCount) {
            throw new EvaluationException(
                    "Function " + entry.name + " expects " + entry.arity + " argument(s), got " + argCount, position);
        }
        return entry;
    }
}
