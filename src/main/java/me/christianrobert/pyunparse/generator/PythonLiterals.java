package me.christianrobert.pyunparse.generator;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Literal text for numbers, strings and bytes, following Python's {@code repr} so that the
 * text reads back as an equal value.
 */
public final class PythonLiterals {

    // 1e309 overflows to inf when read back; there is no inf/nan literal
    static final String INFINITY = "1e309";
    static final String NAN = "(1e309 - 1e309)";

    private PythonLiterals() {
    }

    /**
     * Formats a numeric value.
     *
     * @param value Integer or floating point value
     * @return Source text; negative values keep their leading minus sign
     */
    public static String numberRepr(Number value) {
        if (value instanceof Double) {
            return floatRepr((Double) value);
        }
        if (value instanceof Float) {
            Float f = (Float) value;
            if (f.isNaN() || f.isInfinite()) {
                return floatRepr(f.doubleValue());
            }
            return decimalRepr(new BigDecimal(Float.toString(f)), isNegativeZero(f.doubleValue()));
        }
        if (value instanceof BigDecimal) {
            return decimalRepr((BigDecimal) value, false);
        }
        if (value instanceof BigInteger || value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            return value.toString();
        }
        throw new IllegalArgumentException("Unsupported numeric type: " + value.getClass().getName());
    }

    /**
     * Formats a double the way Python's {@code repr(float)} does: positional notation for
     * decimal exponents in [-4, 16), scientific notation with a signed two-digit exponent
     * otherwise, and always a fractional part or exponent.
     */
    public static String floatRepr(double value) {
        if (Double.isNaN(value)) {
            return NAN;
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? INFINITY : "-" + INFINITY;
        }
        return decimalRepr(new BigDecimal(Double.toString(value)), isNegativeZero(value));
    }

    private static boolean isNegativeZero(double value) {
        return value == 0.0 && Double.doubleToRawLongBits(value) != 0L;
    }

    private static String decimalRepr(BigDecimal value, boolean negativeZero) {
        if (value.signum() == 0) {
            return negativeZero ? "-0.0" : "0.0";
        }

        String sign = value.signum() < 0 ? "-" : "";
        BigDecimal magnitude = value.abs().stripTrailingZeros();
        String digits = magnitude.unscaledValue().toString();
        int exponent = digits.length() - 1 - magnitude.scale();

        if (exponent >= -4 && exponent < 16) {
            String plain = magnitude.toPlainString();
            if (plain.indexOf('.') < 0) {
                plain = plain + ".0";
            }
            return sign + plain;
        }

        StringBuilder sb = new StringBuilder(sign);
        sb.append(digits.charAt(0));
        if (digits.length() > 1) {
            sb.append('.').append(digits, 1, digits.length());
        }
        sb.append('e').append(exponent < 0 ? '-' : '+');
        int absExponent = Math.abs(exponent);
        if (absExponent < 10) {
            sb.append('0');
        }
        sb.append(absExponent);
        return sb.toString();
    }

    /**
     * Formats a text string like Python 3 {@code repr(str)}.
     *
     * <p>Single quotes unless the text contains a single quote and no double quote. Printable
     * non-ASCII characters are kept as they are.</p>
     */
    public static String stringRepr(String value) {
        char quote = value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append(quote);
        value.codePoints().forEach(cp -> appendEscaped(sb, cp, quote));
        sb.append(quote);
        return sb.toString();
    }

    private static void appendEscaped(StringBuilder sb, int cp, char quote) {
        if (cp == quote || cp == '\\') {
            sb.append('\\').append((char) cp);
        } else if (cp == '\t') {
            sb.append("\\t");
        } else if (cp == '\n') {
            sb.append("\\n");
        } else if (cp == '\r') {
            sb.append("\\r");
        } else if (cp < 0x20 || cp == 0x7f) {
            sb.append(String.format("\\x%02x", cp));
        } else if (!isPrintable(cp)) {
            if (cp <= 0xff) {
                sb.append(String.format("\\x%02x", cp));
            } else if (cp <= 0xffff) {
                sb.append(String.format("\\u%04x", cp));
            } else {
                sb.append(String.format("\\U%08x", cp));
            }
        } else {
            sb.appendCodePoint(cp);
        }
    }

    /**
     * Python's notion of printable: everything except the Other (Cc, Cf, Cs, Co, Cn) and
     * Separator (Zl, Zp, Zs) categories, with the ASCII space allowed.
     */
    static boolean isPrintable(int cp) {
        if (cp == ' ') {
            return true;
        }
        switch (Character.getType(cp)) {
            case Character.CONTROL:
            case Character.FORMAT:
            case Character.SURROGATE:
            case Character.PRIVATE_USE:
            case Character.UNASSIGNED:
            case Character.LINE_SEPARATOR:
            case Character.PARAGRAPH_SEPARATOR:
            case Character.SPACE_SEPARATOR:
                return false;
            default:
                return true;
        }
    }

    /**
     * Formats a byte string like Python 3 {@code repr(bytes)}: {@code b'...'} with
     * {@code \xNN} for everything outside printable ASCII.
     */
    public static String bytesRepr(byte[] value) {
        boolean hasSingle = false;
        boolean hasDouble = false;
        for (byte b : value) {
            hasSingle |= b == '\'';
            hasDouble |= b == '"';
        }
        char quote = hasSingle && !hasDouble ? '"' : '\'';

        StringBuilder sb = new StringBuilder(value.length + 3);
        sb.append('b').append(quote);
        for (byte b : value) {
            int c = b & 0xff;
            if (c == quote || c == '\\') {
                sb.append('\\').append((char) c);
            } else if (c == '\t') {
                sb.append("\\t");
            } else if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\r') {
                sb.append("\\r");
            } else if (c < 0x20 || c >= 0x7f) {
                sb.append(String.format("\\x%02x", c));
            } else {
                sb.append((char) c);
            }
        }
        sb.append(quote);
        return sb.toString();
    }
}
