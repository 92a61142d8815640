package com.mathsolver.protocol;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mathsolver.CalculationResult;
import com.mathsolver.arithmetic.Numbers;
import com.mathsolver.eval.CalculationStep;

/**
 * JSON view of calculation results and variable files.
 *
 * Numbers are written as plain decimal strings so no precision is lost on the way out:
 * <pre>
 * {"expression":"2+3","arithmeticMode":"None","precision":"Maximum",
 *  "result":"5","formattedResult":"5",
 *  "steps":[{"expression":"2 + 3","operation":"Add 2 and 3, with no formatting","result":"5"}]}
 * </pre>
 */
public final class CalculationJson {

    private static final ObjectMapper om = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private CalculationJson() {}

    public static ObjectNode toNode(CalculationResult result) {
        ObjectNode root = om.createObjectNode();
        root.put("expression", result.expression());
        root.put("arithmeticMode", result.arithmeticMode());
        root.put("precision", result.precisionInfo());
        root.put("result", Numbers.toText(result.actualResult()));
        root.put("formattedResult", Numbers.toText(result.formattedResult()));

        ArrayNode steps = root.putArray("steps");
        for (CalculationStep step : result.steps()) {
            ObjectNode s = steps.addObject();
            s.put("expression", step.expression());
            s.put("operation", step.operation());
            s.put("result", step.result());
        }
        return root;
    }

    public static String toJson(CalculationResult result, boolean pretty) {
        try {
            ObjectNode node = toNode(result);
            return pretty
                    ? om.writerWithDefaultPrettyPrinter().writeValueAsString(node)
                    : om.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode calculation result", e);
        }
    }

    /**
     * Decodes {@code {"x": 1.5, "n": 3}} into a name to value map. Numeric strings are accepted.
     *
     * @throws IllegalArgumentException when the text is not an object or a value is not numeric
     */
    public static Map<String, BigDecimal> readVariables(String json) {
        JsonNode root;
        try {
            root = om.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid variables JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Variables JSON must be an object");
        }

        Map<String, BigDecimal> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            out.put(field.getKey(), toNumber(field.getKey(), field.getValue()));
        }
        return out;
    }

    public static Map<String, BigDecimal> readVariables(Path file) {
        try {
            return readVariables(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read variables file: " + file, e);
        }
    }

    private static BigDecimal toNumber(String name, JsonNode value) {
        if (value.isNumber()) return value.decimalValue();
        if (value.isTextual()) {
            try {
                return new BigDecimal(value.textValue().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Variable '" + name + "' is not numeric: " + value.textValue(), e);
            }
        }
        throw new IllegalArgumentException("Variable '" + name + "' is not numeric: " + value);
    }
}
