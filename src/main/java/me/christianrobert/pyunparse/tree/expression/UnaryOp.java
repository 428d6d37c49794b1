package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.operator.UnaryOperator;

public class UnaryOp implements Expression {

    public static final String KIND = "UnaryOp";

    private final UnaryOperator op;
    private final Expression operand;

    public UnaryOp(UnaryOperator op, Expression operand) {
        this.op = NodeSupport.require(op, "UnaryOp operator");
        this.operand = NodeSupport.require(operand, "UnaryOp operand");
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public UnaryOperator getOp() {
        return op;
    }

    public Expression getOperand() {
        return operand;
    }
}
