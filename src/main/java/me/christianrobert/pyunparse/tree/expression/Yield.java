package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;

public class Yield implements Expression {

    public static final String KIND = "Yield";

    private final Expression value;

    /**
     * @param value Yielded value or null for a bare {@code yield}
     */
    public Yield(Expression value) {
        this.value = value;
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getValue() {
        return value;
    }
}
