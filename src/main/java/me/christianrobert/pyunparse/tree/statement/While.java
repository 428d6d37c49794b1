package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.Statement;

import java.util.List;

public class While extends Statement {

    public static final String KIND = "While";

    private final Expression test;
    private final List<Statement> body;
    private final List<Statement> orelse;

    public While(Expression test, List<Statement> body, List<Statement> orelse, int lineNumber) {
        super(lineNumber);
        this.test = NodeSupport.require(test, "While test");
        this.body = NodeSupport.copyOfNonEmpty(body, "While body");
        this.orelse = NodeSupport.copyOf(orelse, "While orelse");
    }

    public While(Expression test, List<Statement> body) {
        this(test, body, null, 0);
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
