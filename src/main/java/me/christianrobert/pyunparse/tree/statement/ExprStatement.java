package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.Statement;

/**
 * An expression used as a statement (kind {@code Expr}), e.g. a bare call.
 */
public class ExprStatement extends Statement {

    public static final String KIND = "Expr";

    private final Expression value;

    public ExprStatement(Expression value, int lineNumber) {
        super(lineNumber);
        this.value = NodeSupport.require(value, "Expr value");
    }

    public ExprStatement(Expression value) {
        this(value, 0);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getValue() {
        return value;
    }
}
