package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;

/**
 * Starred expression: {@code *value} (unpacking in calls, targets and displays).
 */
public class Starred implements Expression {

    public static final String KIND = "Starred";

    private final Expression value;

    public Starred(Expression value) {
        this.value = NodeSupport.require(value, "Starred value");
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getValue() {
        return value;
    }
}
