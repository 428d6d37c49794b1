package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;

/**
 * The {@code ...} literal (kind {@code Ellipsis}).
 */
public class EllipsisLiteral implements Expression {

    public static final String KIND = "Ellipsis";

    @Override
    public String getKind() {
        return KIND;
    }
}
