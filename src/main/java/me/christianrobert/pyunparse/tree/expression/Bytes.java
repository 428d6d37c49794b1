package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;

/**
 * Bytes literal ({@code b'...'}). The array is copied in and out.
 */
public class Bytes implements Expression {

    public static final String KIND = "Bytes";

    private final byte[] value;

    public Bytes(byte[] value) {
        this.value = NodeSupport.require(value, "Bytes value").clone();
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public byte[] getValue() {
        return value.clone();
    }
}
