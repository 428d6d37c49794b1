package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;

public class YieldFrom implements Expression {

    public static final String KIND = "YieldFrom";

    private final Expression value;

    public YieldFrom(Expression value) {
        this.value = NodeSupport.require(value, "YieldFrom value");
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getValue() {
        return value;
    }
}
