package me.christianrobert.pyunparse.generator;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class PythonLiteralsTest {

    // ========== NUMBERS ==========

    @Test
    void integersUseTheirDecimalText() {
        assertEquals("42", PythonLiterals.numberRepr(42));
        assertEquals("-7", PythonLiterals.numberRepr(-7L));
        assertEquals("123456789012345678901234567890",
                PythonLiterals.numberRepr(new BigInteger("123456789012345678901234567890")));
    }

    @Test
    void floatsAlwaysCarryAFractionOrExponent() {
        assertEquals("1.0", PythonLiterals.floatRepr(1.0));
        assertEquals("0.5", PythonLiterals.floatRepr(0.5));
        assertEquals("0.0", PythonLiterals.floatRepr(0.0));
        assertEquals("-0.0", PythonLiterals.floatRepr(-0.0));
        assertEquals("-2.5", PythonLiterals.floatRepr(-2.5));
    }

    @Test
    void floatsSwitchToScientificNotationLikePython() {
        assertEquals("0.0001", PythonLiterals.floatRepr(0.0001));
        assertEquals("1e-05", PythonLiterals.floatRepr(0.00001));
        assertEquals("1000000000000000.0", PythonLiterals.floatRepr(1e15));
        assertEquals("1e+16", PythonLiterals.floatRepr(1e16));
        assertEquals("1.5e+300", PythonLiterals.floatRepr(1.5e300));
        assertEquals("2.5e-10", PythonLiterals.floatRepr(2.5e-10));
    }

    @Test
    void infinityAndNanUseOverflowingLiterals() {
        assertEquals("1e309", PythonLiterals.floatRepr(Double.POSITIVE_INFINITY));
        assertEquals("-1e309", PythonLiterals.floatRepr(Double.NEGATIVE_INFINITY));
        assertEquals("(1e309 - 1e309)", PythonLiterals.floatRepr(Double.NaN));
    }

    @Test
    void bigDecimalAndFloatRenderAsFloats() {
        assertEquals("3.25", PythonLiterals.numberRepr(new BigDecimal("3.250")));
        assertEquals("2.0", PythonLiterals.numberRepr(new BigDecimal("2")));
        assertEquals("0.1", PythonLiterals.numberRepr(0.1f));
    }

    // ========== STRINGS ==========

    @Test
    void stringsPreferSingleQuotes() {
        assertEquals("'abc'", PythonLiterals.stringRepr("abc"));
        assertEquals("''", PythonLiterals.stringRepr(""));
    }

    @Test
    void stringsSwitchToDoubleQuotesForApostrophes() {
        assertEquals("\"it's\"", PythonLiterals.stringRepr("it's"));
        assertEquals("'say \"hi\" it\\'s'", PythonLiterals.stringRepr("say \"hi\" it's"));
    }

    @Test
    void stringsEscapeControlCharacters() {
        assertEquals("'a\\tb\\nc\\rd'", PythonLiterals.stringRepr("a\tb\nc\rd"));
        assertEquals("'\\x00\\x1f\\x7f'", PythonLiterals.stringRepr("\u0000\u001f\u007f"));
        assertEquals("'back\\\\slash'", PythonLiterals.stringRepr("back\\slash"));
    }

    @Test
    void stringsKeepPrintableNonAsciiCharacters() {
        assertEquals("'caf\u00e9 \u65e5\u672c'", PythonLiterals.stringRepr("caf\u00e9 \u65e5\u672c"));
    }

    @Test
    void stringsEscapeNonPrintableNonAsciiCharacters() {
        assertEquals("'\\xa0'", PythonLiterals.stringRepr("\u00a0"));
        assertEquals("'\\u2028'", PythonLiterals.stringRepr("\u2028"));
        assertEquals("'\\U000f0000'", PythonLiterals.stringRepr(new String(Character.toChars(0xf0000))));
    }

    @Test
    void printableFollowsPythonCategories() {
        assertTrue(PythonLiterals.isPrintable(' '));
        assertTrue(PythonLiterals.isPrintable('a'));
        assertFalse(PythonLiterals.isPrintable('\u00a0'));
        assertFalse(PythonLiterals.isPrintable('\u200b'));
    }

    // ========== BYTES ==========

    @Test
    void bytesUseHexEscapesOutsidePrintableAscii() {
        assertEquals("b'ab\\x00\\xff'", PythonLiterals.bytesRepr(new byte[]{'a', 'b', 0, (byte) 0xff}));
        assertEquals("b''", PythonLiterals.bytesRepr(new byte[0]));
        assertEquals("b\"'\"", PythonLiterals.bytesRepr(new byte[]{'\''}));
        assertEquals("b'\\n'", PythonLiterals.bytesRepr(new byte[]{'\n'}));
    }
}
