package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;

/**
 * Attribute access: {@code value.attr}.
 */
public class Attribute implements Expression {

    public static final String KIND = "Attribute";

    private final Expression value;
    private final String attr;

    public Attribute(Expression value, String attr) {
        this.value = NodeSupport.require(value, "Attribute value");
        this.attr = NodeSupport.requireIdentifier(attr, "Attribute name");
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getValue() {
        return value;
    }

    public String getAttr() {
        return attr;
    }
}
