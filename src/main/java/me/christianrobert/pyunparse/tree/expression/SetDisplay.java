package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;

import java.util.List;

/**
 * Set literal (kind {@code Set}).
 */
public class SetDisplay implements Expression {

    public static final String KIND = "Set";

    private final List<Expression> elements;

    public SetDisplay(List<Expression> elements) {
        this.elements = NodeSupport.copyOf(elements, "Set elements");
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public List<Expression> getElements() {
        return elements;
    }
}
