import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mathsolver.MathSolverCli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class MathSolverCliTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @Test
    void overflow_isAnEvaluationError() {
        assertEquals(1, run("", "--expr=(10^999999999)*(10^999999999)", "--steps"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("result out of range"));
    }

    private int run(String stdin, String... args) {
        MathSolverCli cli = new MathSolverCli(
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        InputStream in = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
        return cli.run(args, in);
    }

    private List<String> outLines() {
        return out.toString(StandardCharsets.UTF_8).lines().collect(Collectors.toList());
    }

    @Test
    void singleExpression_printsResult() {
        assertEquals(0, run("", "--expr=2+3*4"));
        assertEquals(List.of("14"), outLines());
    }

    @Test
    void formattingFlags_areApplied() {
        assertEquals(0, run("", "--expr=10/3", "--mode=round", "--precision=2"));
        assertEquals(List.of("3.33"), outLines());
    }

    @Test
    void significantDigits() {
        assertEquals(0, run("", "--expr=1234.5678*1", "--mode=ROUND", "--precision=3", "--unit=sig"));
        assertEquals(List.of("1230"), outLines());
    }

    @Test
    void evaluationError_exitsWithOne() {
        assertEquals(1, run("", "--expr=1/0"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Division by zero"));
        assertTrue(outLines().isEmpty());
    }

    @Test
    void usageErrors_exitWithTwo() {
        assertEquals(2, run("", "--expr=1", "--mode=bogus"));
        assertEquals(2, run("", "--expr=1", "--mode=round", "--precision=-1"));
        assertEquals(2, run("", "--expr=1", "--precision=abc"));
        assertEquals(2, run("", "--expr=1", "--var=x"));
        assertEquals(2, run("", "--expr=1", "--var=x=abc"));
        assertEquals(2, run("", "--expr=e", "--var=e=2"));
    }

    @Test
    void repeatedVarFlags_defineVariables() {
        assertEquals(0, run("", "--var=x=2", "--var=Y=3.5", "--expr=x*y"));
        assertEquals(List.of("7"), outLines());
    }

    @Test
    void varsFile_isLoaded(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("vars.json");
        Files.writeString(file, "{\"r\": 3}", StandardCharsets.UTF_8);

        assertEquals(0, run("", "--vars=" + file, "--expr=r^2"));
        assertEquals(List.of("9"), outLines());
    }

    @Test
    void stdinLoop_stopsAtExit() {
        assertEquals(0, run("1+1\n\n2*3\n1/0\nexit\n4+4\n"));
        assertEquals(List.of("2", "6"), outLines());
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Division by zero"));
    }

    @Test
    void steps_printTraceAndResult() {
        assertEquals(0, run("", "--expr=2+3*4", "--steps"));
        assertEquals(List.of(
                "1. 3 * 4 => Multiply 3 by 4, with no formatting => 12",
                "2. 2 + 3 * 4 => Add 2 and 12, with no formatting => 14",
                "Result: 14"), outLines());
    }

    @Test
    void latex_echoesExpression() {
        assertEquals(0, run("", "--expr=1/2", "--latex"));
        assertEquals(List.of("LaTeX: \\frac{1}{2}", "0.5"), outLines());
    }

    @Test
    void json_printsDocument() throws Exception {
        assertEquals(0, run("", "--expr=6/4", "--json"));
        JsonNode doc = new ObjectMapper().readTree(out.toString(StandardCharsets.UTF_8));

        assertEquals("6/4", doc.get("expression").asText());
        assertEquals("1.5", doc.get("result").asText());
        assertEquals(1, doc.get("steps").size());
    }

    @Test
    void debugFlag_logsToStderr() {
        assertEquals(0, run("", "--expr=1+1", "--debug"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("[DEBUG] mathsolver"));
    }
}
