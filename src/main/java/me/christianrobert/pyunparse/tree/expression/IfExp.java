package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;

/**
 * Conditional expression: {@code body if test else orelse}.
 */
public class IfExp implements Expression {

    public static final String KIND = "IfExp";

    private final Expression test;
    private final Expression body;
    private final Expression orelse;

    public IfExp(Expression test, Expression body, Expression orelse) {
        this.test = NodeSupport.require(test, "IfExp test");
        this.body = NodeSupport.require(body, "IfExp body");
        this.orelse = NodeSupport.require(orelse, "IfExp orelse");
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getTest() {
        return test;
    }

    public Expression getBody() {
        return body;
    }

    public Expression getOrelse() {
        return orelse;
    }
}
