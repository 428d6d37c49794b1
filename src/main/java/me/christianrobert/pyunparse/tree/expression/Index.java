package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;

/**
 * Plain subscript index wrapper: the {@code i} of {@code a[i]}.
 */
public class Index implements Expression {

    public static final String KIND = "Index";

    private final Expression value;

    public Index(Expression value) {
        this.value = NodeSupport.require(value, "Index value");
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getValue() {
        return value;
    }
}
