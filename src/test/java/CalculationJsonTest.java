import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mathsolver.CalculationResult;
import com.mathsolver.MathSolver;
import com.mathsolver.arithmetic.ArithmeticFormat;
import com.mathsolver.protocol.CalculationJson;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CalculationJsonTest {

    private static final ObjectMapper om = new ObjectMapper();

    @Test
    void result_isEncodedWithSteps() {
        CalculationResult result = new MathSolver().evaluateWithSteps("2+3");
        ObjectNode node = CalculationJson.toNode(result);

        assertEquals("2+3", node.get("expression").asText());
        assertEquals("None", node.get("arithmeticMode").asText());
        assertEquals("Maximum", node.get("precision").asText());
        assertEquals("5", node.get("result").asText());
        assertEquals("5", node.get("formattedResult").asText());
        assertEquals(1, node.get("steps").size());

        JsonNode step = node.get("steps").get(0);
        assertEquals("2 + 3", step.get("expression").asText());
        assertEquals("Add 2 and 3, with no formatting", step.get("operation").asText());
        assertEquals("5", step.get("result").asText());
    }

    @Test
    void toJson_isValidJsonInBothLayouts() throws Exception {
        MathSolver solver = new MathSolver(ArithmeticFormat.truncate(3, ArithmeticFormat.Unit.SIGNIFICANT_DIGITS));
        CalculationResult result = solver.evaluateWithSteps("1234.5678 * 1");

        JsonNode compact = om.readTree(CalculationJson.toJson(result, false));
        JsonNode pretty = om.readTree(CalculationJson.toJson(result, true));

        assertEquals(compact, pretty);
        assertEquals("1230", compact.get("formattedResult").asText());
        assertEquals("3 significant digits", compact.get("precision").asText());
    }

    @Test
    void readVariables_acceptsNumbersAndNumericStrings() {
        Map<String, BigDecimal> vars = CalculationJson.readVariables("{\"x\": 1.5, \"N\": 3, \"y\": \" 2.25 \"}");

        assertEquals(3, vars.size());
        assertEquals(0, new BigDecimal("1.5").compareTo(vars.get("x")));
        assertEquals(0, BigDecimal.valueOf(3).compareTo(vars.get("N")));
        assertEquals(0, new BigDecimal("2.25").compareTo(vars.get("y")));
    }

    @Test
    void readVariables_keepsDecimalPrecision() {
        Map<String, BigDecimal> vars = CalculationJson.readVariables("{\"p\": 0.1000000000000000055511151231257827}");
        assertEquals("0.1000000000000000055511151231257827", vars.get("p").toPlainString());
    }

    @Test
    void readVariables_rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> CalculationJson.readVariables("{\"x\": true}"));
        assertThrows(IllegalArgumentException.class, () -> CalculationJson.readVariables("{\"x\": \"abc\"}"));
        assertThrows(IllegalArgumentException.class, () -> CalculationJson.readVariables("[1, 2]"));
        assertThrows(IllegalArgumentException.class, () -> CalculationJson.readVariables("{not json"));
    }

    @Test
    void readVariables_fromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("vars.json");
        Files.writeString(file, "{\"radius\": 2}", StandardCharsets.UTF_8);

        Map<String, BigDecimal> vars = CalculationJson.readVariables(file);
        assertEquals(0, BigDecimal.valueOf(2).compareTo(vars.get("radius")));
    }
}
