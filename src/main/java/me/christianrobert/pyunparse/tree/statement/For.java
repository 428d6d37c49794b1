package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.Statement;

import java.util.List;

/**
 * {@code for target in iter:} with an optional {@code else} block.
 */
public class For extends Statement {

    public static final String KIND = "For";

    private final Expression target;
    private final Expression iter;
    private final List<Statement> body;
    private final List<Statement> orelse;

    public For(Expression target, Expression iter, List<Statement> body, List<Statement> orelse,
               int lineNumber) {
        super(lineNumber);
        this.target = NodeSupport.require(target, "For target");
        this.iter = NodeSupport.require(iter, "For iter");
        this.body = NodeSupport.copyOfNonEmpty(body, "For body");
        this.orelse = NodeSupport.copyOf(orelse, "For orelse");
    }

    public For(Expression target, Expression iter, List<Statement> body) {
        this(target, iter, body, null, 0);
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

    public List<Statement> getBody() {
        return body;
    }

    public List<Statement> getOrelse() {
        return orelse;
    }
}
