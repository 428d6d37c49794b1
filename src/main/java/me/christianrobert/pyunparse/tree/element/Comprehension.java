package me.christianrobert.pyunparse.tree.element;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.SyntaxNode;

import java.util.List;

/**
 * One generator clause of a comprehension: {@code for target in iter if cond...}.
 */
public class Comprehension implements SyntaxNode {

    public static final String KIND = "comprehension";

    private final Expression target;
    private final Expression iter;
    private final List<Expression> ifs;

    public Comprehension(Expression target, Expression iter, List<Expression> ifs) {
        this.target = NodeSupport.require(target, "Comprehension target");
        this.iter = NodeSupport.require(iter, "Comprehension iter");
        this.ifs = NodeSupport.copyOf(ifs, "Comprehension ifs");
    }

    public Comprehension(Expression target, Expression iter) {
        this(target, iter, null);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getIter() {
        return iter;
    }

    public List<Expression> getIfs() {
        return ifs;
    }
}
