package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.Statement;

import java.util.List;

/**
 * {@code del a, b[0]}
 */
public class Delete extends Statement {

    public static final String KIND = "Delete";

    private final List<Expression> targets;

    public Delete(List<Expression> targets, int lineNumber) {
        super(lineNumber);
        this.targets = NodeSupport.copyOfNonEmpty(targets, "Delete targets");
    }

    public Delete(List<Expression> targets) {
        this(targets, 0);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public List<Expression> getTargets() {
        return targets;
    }
}
