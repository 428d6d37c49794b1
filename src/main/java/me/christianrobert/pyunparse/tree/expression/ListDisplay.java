package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;

import java.util.List;

/**
 * List literal (kind {@code List}).
 */
public class ListDisplay implements Expression {

    public static final String KIND = "List";

    private final List<Expression> elements;

    public ListDisplay(List<Expression> elements) {
        this.elements = NodeSupport.copyOf(elements, "List elements");
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public List<Expression> getElements() {
        return elements;
    }
}
