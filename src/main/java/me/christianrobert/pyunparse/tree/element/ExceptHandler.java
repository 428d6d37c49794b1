package me.christianrobert.pyunparse.tree.element;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.Located;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.Statement;
import me.christianrobert.pyunparse.tree.SyntaxNode;

import java.util.List;

/**
 * One {@code except} clause of a try statement.
 *
 * <pre>
 * except:
 * except Type:
 * except Type as name:
 * </pre>
 *
 * <p>{@code except as name:} is not valid source, so a bound name without an exception type is
 * rejected here rather than in the generator.</p>
 */
public class ExceptHandler implements SyntaxNode, Located {

    public static final String KIND = "ExceptHandler";

    private final Expression type;
    private final String name;
    private final List<Statement> body;
    private final int lineNumber;

    public ExceptHandler(Expression type, String name, List<Statement> body, int lineNumber) {
        if (type == null && name != null) {
            throw new IllegalArgumentException("ExceptHandler cannot bind name '" + name
                    + "' without an exception type");
        }
        this.type = type;
        this.name = name;
        this.body = NodeSupport.copyOfNonEmpty(body, "ExceptHandler body");
        this.lineNumber = lineNumber;
    }

    public ExceptHandler(Expression type, String name, List<Statement> body) {
        this(type, name, body, 0);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public int getLineNumber() {
        return lineNumber;
    }
}
