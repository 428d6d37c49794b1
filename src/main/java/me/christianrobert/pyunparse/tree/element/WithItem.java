package me.christianrobert.pyunparse.tree.element;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.SyntaxNode;

/**
 * Context manager of a with statement: {@code expr} or {@code expr as vars}.
 */
public class WithItem implements SyntaxNode {

    public static final String KIND = "withitem";

    private final Expression contextExpr;
    private final Expression optionalVars;

    public WithItem(Expression contextExpr, Expression optionalVars) {
        this.contextExpr = NodeSupport.require(contextExpr, "WithItem context expression");
        this.optionalVars = optionalVars;
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getContextExpr() {
        return contextExpr;
    }

    public Expression getOptionalVars() {
        return optionalVars;
    }
}
