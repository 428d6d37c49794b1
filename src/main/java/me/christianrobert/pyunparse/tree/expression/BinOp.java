package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.operator.BinaryOperator;

/**
 * Binary operation: {@code left op right}.
 */
public class BinOp implements Expression {

    public static final String KIND = "BinOp";

    private final Expression left;
    private final BinaryOperator op;
    private final Expression right;

    public BinOp(Expression left, BinaryOperator op, Expression right) {
        this.left = NodeSupport.require(left, "BinOp left operand");
        this.op = NodeSupport.require(op, "BinOp operator");
        this.right = NodeSupport.require(right, "BinOp right operand");
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getLeft() {
        return left;
    }

    public BinaryOperator getOp() {
        return op;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public String toString() {
        return "BinOp{" + left + " " + op.getToken() + " " + right + "}";
    }
}
