package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.operator.ComparisonOperator;

import java.util.List;

/**
 * Comparison chain: {@code left op1 c1 op2 c2 ...}. {@code ops} and {@code comparators}
 * are parallel lists.
 */
public class Compare implements Expression {

    public static final String KIND = "Compare";

    private final Expression left;
    private final List<ComparisonOperator> ops;
    private final List<Expression> comparators;

    public Compare(Expression left, List<ComparisonOperator> ops, List<Expression> comparators) {
        this.left = NodeSupport.require(left, "Compare left operand");
        this.ops = NodeSupport.copyOfNonEmpty(ops, "Compare operators");
        this.comparators = NodeSupport.copyOfNonEmpty(comparators, "Compare comparators");
        if (this.ops.size() != this.comparators.size()) {
            throw new IllegalArgumentException("Compare has " + this.ops.size() + " operators but "
                    + this.comparators.size() + " comparators");
        }
    }

    public Compare(Expression left, ComparisonOperator op, Expression right) {
        this(left, List.of(op), List.of(right));
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getLeft() {
        return left;
    }

    public List<ComparisonOperator> getOps() {
        return ops;
    }

    public List<Expression> getComparators() {
        return comparators;
    }
}
