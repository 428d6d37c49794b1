package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;

import java.util.List;

/**
 * Multi-dimensional slice: {@code a[1:2, 3]}.
 */
public class ExtSlice implements Expression {

    public static final String KIND = "ExtSlice";

    private final List<Expression> dims;

    public ExtSlice(List<Expression> dims) {
        this.dims = NodeSupport.copyOfNonEmpty(dims, "ExtSlice dims");
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public List<Expression> getDims() {
        return dims;
    }
}
