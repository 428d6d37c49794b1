package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.Statement;
import me.christianrobert.pyunparse.tree.operator.BinaryOperator;

/**
 * Augmented assignment: {@code target += value}.
 */
public class AugAssign extends Statement {

    public static final String KIND = "AugAssign";

    private final Expression target;
    private final BinaryOperator op;
    private final Expression value;

    public AugAssign(Expression target, BinaryOperator op, Expression value, int lineNumber) {
        super(lineNumber);
        this.target = NodeSupport.require(target, "AugAssign target");
        this.op = NodeSupport.require(op, "AugAssign operator");
        this.value = NodeSupport.require(value, "AugAssign value");
    }

    public AugAssign(Expression target, BinaryOperator op, Expression value) {
        this(target, op, value, 0);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getTarget() {
        return target;
    }

    public BinaryOperator getOp() {
        return op;
    }

    public Expression getValue() {
        return value;
    }
}
