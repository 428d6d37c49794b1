package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.Statement;

/**
 * {@code return} or {@code return value}
 */
public class Return extends Statement {

    public static final String KIND = "Return";

    private final Expression value;

    public Return(Expression value, int lineNumber) {
        super(lineNumber);
        this.value = value;
    }

    public Return(Expression value) {
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
