package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.Statement;

import java.util.List;

/**
 * Conditional statement. An elif chain is an {@code If} whose {@code orelse} is exactly one
 * nested {@code If}.
 */
public class If extends Statement {

    public static final String KIND = "If";

    private final Expression test;
    private final List<Statement> body;
    private final List<Statement> orelse;

    public If(Expression test, List<Statement> body, List<Statement> orelse, int lineNumber) {
        super(lineNumber);
        this.test = NodeSupport.require(test, "If test");
        this.body = NodeSupport.copyOfNonEmpty(body, "If body");
        this.orelse = NodeSupport.copyOf(orelse, "If orelse");
    }

    public If(Expression test, List<Statement> body, List<Statement> orelse) {
        this(test, body, orelse, 0);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getTest() {
        return test;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Statement> getOrelse() {
        return orelse;
    }
}
