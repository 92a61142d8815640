import com.mathsolver.debug.Debug;
import com.mathsolver.debug.DebugLevel;
import com.mathsolver.debug.DebugSink;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class DebugTest {

    @Test
    void streamSink_dropsMessagesBelowMinimum() {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        DebugSink sink = Debug.streamSink(new PrintStream(buf, true, StandardCharsets.UTF_8), DebugLevel.INFO);

        sink.log(DebugLevel.DEBUG, "t", "hidden", null);
        sink.log(DebugLevel.WARN, "t", "shown", null);

        String text = buf.toString(StandardCharsets.UTF_8);
        assertFalse(text.contains("hidden"));
        assertTrue(text.contains("[WARN] t: shown"));
    }

    @Test
    void nullSink_restoresNoop() {
        Debug debug = Debug.get();
        DebugSink previous = debug.getSink();
        try {
            debug.setSink(null);
            assertNotNull(debug.getSink());
            assertDoesNotThrow(() -> debug.w("t", "nothing listens", new RuntimeException("x")));
        } finally {
            debug.setSink(previous);
        }
    }

    @Test
    void levels_areOrdered() {
        assertTrue(DebugLevel.ERROR.isAtLeast(DebugLevel.WARN));
        assertTrue(DebugLevel.DEBUG.isAtLeast(DebugLevel.DEBUG));
        assertFalse(DebugLevel.TRACE.isAtLeast(DebugLevel.DEBUG));
    }
}
