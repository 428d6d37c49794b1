package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;

/**
 * Text string literal.
 */
public class Str implements Expression {

    public static final String KIND = "Str";

    private final String value;

    public Str(String value) {
        this.value = NodeSupport.require(value, "Str value");
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "Str{" + value + "}";
    }
}
