package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.operator.BooleanOperator;

import java.util.List;

/**
 * Boolean operation over two or more values: {@code a and b and c}.
 */
public class BoolOp implements Expression {

    public static final String KIND = "BoolOp";

    private final BooleanOperator op;
    private final List<Expression> values;

    public BoolOp(BooleanOperator op, List<Expression> values) {
        this.op = NodeSupport.require(op, "BoolOp operator");
        this.values = NodeSupport.copyOf(values, "BoolOp values");
        if (this.values.size() < 2) {
            throw new IllegalArgumentException("BoolOp needs at least two values, got " + this.values.size());
        }
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public BooleanOperator getOp() {
        return op;
    }

    public List<Expression> getValues() {
        return values;
    }
}
