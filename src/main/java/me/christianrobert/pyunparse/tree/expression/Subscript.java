package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;

/**
 * Subscription: {@code value[slice]}. The slice is an {@link Index}, {@link Slice},
 * {@link ExtSlice}, or (Python 3.9+ trees) any expression.
 */
public class Subscript implements Expression {

    public static final String KIND = "Subscript";

    private final Expression value;
    private final Expression slice;

    public Subscript(Expression value, Expression slice) {
        this.value = NodeSupport.require(value, "Subscript value");
        this.slice = NodeSupport.require(slice, "Subscript slice");
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getValue() {
        return value;
    }

    public Expression getSlice() {
        return slice;
    }
}
