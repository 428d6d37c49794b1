package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.Statement;

import java.util.List;

/**
 * Assignment to one or more targets: {@code a = b = value}.
 */
public class Assign extends Statement {

    public static final String KIND = "Assign";

    private final List<Expression> targets;
    private final Expression value;

    public Assign(List<Expression> targets, Expression value, int lineNumber) {
        super(lineNumber);
        this.targets = NodeSupport.copyOfNonEmpty(targets, "Assign targets");
        this.value = NodeSupport.require(value, "Assign value");
    }

    public Assign(List<Expression> targets, Expression value) {
        this(targets, value, 0);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public List<Expression> getTargets() {
        return targets;
    }

    public Expression getValue() {
        return value;
    }
}
