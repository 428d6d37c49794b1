package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Numeric literal.
 *
 * <p>Integral values ({@link Integer}, {@link Long}, {@link Short}, {@link Byte},
 * {@link BigInteger}) render as Python ints, {@link Float}, {@link Double} and
 * {@link BigDecimal} as Python floats.</p>
 */
public class Num implements Expression {

    public static final String KIND = "Num";

    private final Number value;

    public Num(Number value) {
        NodeSupport.require(value, "Num value");
        if (!isIntegral(value) && !(value instanceof Double) && !(value instanceof Float)
                && !(value instanceof BigDecimal)) {
            throw new IllegalArgumentException("Unsupported numeric type: " + value.getClass().getName());
        }
        this.value = value;
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Number getValue() {
        return value;
    }

    public boolean isIntegral() {
        return isIntegral(value);
    }

    private static boolean isIntegral(Number value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }

    @Override
    public String toString() {
        return "Num{" + value + "}";
    }
}
