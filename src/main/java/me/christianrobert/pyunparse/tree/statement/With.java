package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.Statement;
import me.christianrobert.pyunparse.tree.element.WithItem;

import java.util.List;

/**
 * {@code with a as x, b:} in its canonical multi-item shape. Single-item legacy trees are
 * converted to this shape on ingestion.
 */
public class With extends Statement {

    public static final String KIND = "With";

    private final List<WithItem> items;
    private final List<Statement> body;

    public With(List<WithItem> items, List<Statement> body, int lineNumber) {
        super(lineNumber);
        this.items = NodeSupport.copyOfNonEmpty(items, "With items");
        this.body = NodeSupport.copyOfNonEmpty(body, "With body");
    }

    public With(List<WithItem> items, List<Statement> body) {
        this(items, body, 0);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public List<WithItem> getItems() {
        return items;
    }

    public List<Statement> getBody() {
        return body;
    }
}
