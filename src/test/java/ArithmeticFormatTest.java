import com.mathsolver.arithmetic.ArithmeticFormat;
import com.mathsolver.arithmetic.ArithmeticFormat.Unit;
import com.mathsolver.arithmetic.Numbers;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

public class ArithmeticFormatTest {

    private static void assertValue(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " got " + actual);
    }

    private static BigDecimal d(String s) {
        return new BigDecimal(s);
    }

    @Test
    void none_returnsValueUnchanged() {
        BigDecimal v = d("3.14159265358979");
        assertSame(v, ArithmeticFormat.NONE.apply(v));
    }

    @Test
    void decimalPlaces_truncateAndRound() {
        assertValue("3.14", ArithmeticFormat.round(2, Unit.DECIMAL_PLACES).apply(d("3.14159")));
        assertValue("2.79", ArithmeticFormat.round(2, Unit.DECIMAL_PLACES).apply(d("2.789")));
        assertValue("2.78", ArithmeticFormat.truncate(2, Unit.DECIMAL_PLACES).apply(d("2.789")));
        assertValue("-2.78", ArithmeticFormat.truncate(2, Unit.DECIMAL_PLACES).apply(d("-2.789")));
        assertValue("7", ArithmeticFormat.truncate(0, Unit.DECIMAL_PLACES).apply(d("7.99")));
    }

    @Test
    void rounding_isHalfAwayFromZero() {
        ArithmeticFormat round0 = ArithmeticFormat.round(0, Unit.DECIMAL_PLACES);
        assertValue("3", round0.apply(d("2.5")));
        assertValue("-3", round0.apply(d("-2.5")));
        assertValue("0.13", ArithmeticFormat.round(2, Unit.DECIMAL_PLACES).apply(d("0.125")));
    }

    @Test
    void significantDigits_largeAndSmallMagnitudes() {
        assertValue("1230", ArithmeticFormat.round(3, Unit.SIGNIFICANT_DIGITS).apply(d("1234.5678")));
        assertValue("1230", ArithmeticFormat.truncate(3, Unit.SIGNIFICANT_DIGITS).apply(d("1239.9")));
        assertValue("0.0012", ArithmeticFormat.truncate(2, Unit.SIGNIFICANT_DIGITS).apply(d("0.0012345")));
        assertValue("0.0013", ArithmeticFormat.round(2, Unit.SIGNIFICANT_DIGITS).apply(d("0.00125")));
        assertValue("-45.6", ArithmeticFormat.round(3, Unit.SIGNIFICANT_DIGITS).apply(d("-45.57")));
        assertValue("0", ArithmeticFormat.round(3, Unit.SIGNIFICANT_DIGITS).apply(BigDecimal.ZERO));
        assertEquals("1230", Numbers.toText(ArithmeticFormat.round(3, Unit.SIGNIFICANT_DIGITS).apply(d("1234.5678"))));
    }

    @Test
    void formatting_isIdempotent() {
        ArithmeticFormat[] formats = {
                ArithmeticFormat.round(2, Unit.DECIMAL_PLACES),
                ArithmeticFormat.truncate(3, Unit.DECIMAL_PLACES),
                ArithmeticFormat.round(4, Unit.SIGNIFICANT_DIGITS),
                ArithmeticFormat.truncate(1, Unit.SIGNIFICANT_DIGITS)
        };
        String[] values = {"3.14159", "-0.000987654", "98765.4321", "0.5", "9.999"};
        for (ArithmeticFormat f : formats) {
            for (String v : values) {
                BigDecimal once = f.apply(d(v));
                assertEquals(0, once.compareTo(f.apply(once)), f + " on " + v);
            }
        }
    }

    @Test
    void invalidConfiguration_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> ArithmeticFormat.truncate(-1, Unit.DECIMAL_PLACES));
        assertThrows(IllegalArgumentException.class, () -> ArithmeticFormat.round(0, Unit.SIGNIFICANT_DIGITS));
        assertThrows(IllegalArgumentException.class, () -> ArithmeticFormat.round(-2, Unit.SIGNIFICANT_DIGITS));
        assertThrows(NullPointerException.class, () -> new ArithmeticFormat(null, 2, Unit.DECIMAL_PLACES));
        // precision is irrelevant without formatting
        assertDoesNotThrow(() -> new ArithmeticFormat(ArithmeticFormat.Mode.NONE, -1, Unit.DECIMAL_PLACES));
    }

    @Test
    void descriptions() {
        assertEquals("with no formatting", ArithmeticFormat.NONE.describe());
        assertEquals("rounding to 2 decimal places", ArithmeticFormat.round(2, Unit.DECIMAL_PLACES).describe());
        assertEquals("truncating to 1 significant digit", ArithmeticFormat.truncate(1, Unit.SIGNIFICANT_DIGITS).describe());

        assertEquals("Maximum", ArithmeticFormat.NONE.precisionInfo());
        assertEquals("4 decimal places", ArithmeticFormat.truncate(4, Unit.DECIMAL_PLACES).precisionInfo());
        assertEquals("3 significant digits", ArithmeticFormat.round(3, Unit.SIGNIFICANT_DIGITS).precisionInfo());

        assertEquals("None", ArithmeticFormat.NONE.modeName());
        assertEquals("Truncate", ArithmeticFormat.truncate(1, Unit.DECIMAL_PLACES).modeName());
        assertEquals("Round", ArithmeticFormat.round(1, Unit.DECIMAL_PLACES).modeName());
    }

    @Test
    void equality_isByValue() {
        assertEquals(ArithmeticFormat.round(2, Unit.DECIMAL_PLACES), ArithmeticFormat.round(2, Unit.DECIMAL_PLACES));
        assertEquals(ArithmeticFormat.round(2, Unit.DECIMAL_PLACES).hashCode(),
                ArithmeticFormat.round(2, Unit.DECIMAL_PLACES).hashCode());
        assertNotEquals(ArithmeticFormat.round(2, Unit.DECIMAL_PLACES), ArithmeticFormat.truncate(2, Unit.DECIMAL_PLACES));
    }
}
