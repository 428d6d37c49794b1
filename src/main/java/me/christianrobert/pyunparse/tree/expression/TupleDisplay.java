package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;

import java.util.List;

/**
 * Tuple literal, also used as assignment target (a, b) (kind {@code Tuple}).
 */
public class TupleDisplay implements Expression {

    public static final String KIND = "Tuple";

    private final List<Expression> elements;

    public TupleDisplay(List<Expression> elements) {
        this.elements = NodeSupport.copyOf(elements, "Tuple elements");
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public List<Expression> getElements() {
        return elements;
    }
}
