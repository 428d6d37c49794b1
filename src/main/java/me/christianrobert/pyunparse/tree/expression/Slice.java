package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;

/**
 * Slice {@code lower:upper:step}; every part is optional.
 *
 * <p>Some producers encode "no step" as the name {@code None} instead of leaving the field
 * empty ({@code a[1:2:]}). The generator treats that as an absent step.</p>
 */
public class Slice implements Expression {

    public static final String KIND = "Slice";

    private final Expression lower;
    private final Expression upper;
    private final Expression step;

    public Slice(Expression lower, Expression upper, Expression step) {
        this.lower = lower;
        this.upper = upper;
        this.step = step;
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getLower() {
        return lower;
    }

    public Expression getUpper() {
        return upper;
    }

    public Expression getStep() {
        return step;
    }
}
