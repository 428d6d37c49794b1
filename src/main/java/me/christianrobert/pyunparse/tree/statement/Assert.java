package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.Statement;

/**
 * {@code assert test} or {@code assert test, msg}
 */
public class Assert extends Statement {

    public static final String KIND = "Assert";

    private final Expression test;
    private final Expression msg;

    public Assert(Expression test, Expression msg, int lineNumber) {
        super(lineNumber);
        this.test = NodeSupport.require(test, "Assert test");
        this.msg = msg;
    }

    public Assert(Expression test, Expression msg) {
        this(test, msg, 0);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getTest() {
        return test;
    }

    public Expression getMsg() {
        return msg;
    }
}
