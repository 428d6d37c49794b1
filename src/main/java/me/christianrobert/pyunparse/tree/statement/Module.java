package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.Statement;
import me.christianrobert.pyunparse.tree.SyntaxNode;

import java.util.List;

/**
 * Root of a tree: a sequence of top-level statements.
 */
public class Module implements SyntaxNode {

    public static final String KIND = "Module";

    private final List<Statement> body;

    public Module(List<Statement> body) {
        this.body = NodeSupport.copyOf(body, "Module body");
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "Module{statements=" + body.size() + "}";
    }
}
