package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.Statement;
import me.christianrobert.pyunparse.tree.element.ExceptHandler;

import java.util.List;

/**
 * Exception handling statement in its canonical shape.
 *
 * <pre>
 * try:
 *     body
 * except ...:        (0..n handlers)
 *     ...
 * else:              (optional, requires at least one handler)
 *     ...
 * finally:           (optional)
 *     ...
 * </pre>
 *
 * <p>The legacy {@code TryExcept} and {@code TryFinally} shapes are folded into this one on
 * ingestion, so renderers only look at which parts are present.</p>
 */
public class Try extends Statement {

    public static final String KIND = "Try";

    private final List<Statement> body;
    private final List<ExceptHandler> handlers;
    private final List<Statement> orelse;
    private final List<Statement> finalbody;

    public Try(List<Statement> body, List<ExceptHandler> handlers, List<Statement> orelse,
               List<Statement> finalbody, int lineNumber) {
        super(lineNumber);
        this.body = NodeSupport.copyOfNonEmpty(body, "Try body");
        this.handlers = NodeSupport.copyOf(handlers, "Try handlers");
        this.orelse = NodeSupport.copyOf(orelse, "Try orelse");
        this.finalbody = NodeSupport.copyOf(finalbody, "Try finalbody");

        if (this.handlers.isEmpty() && this.finalbody.isEmpty()) {
            throw new IllegalArgumentException("Try needs at least one handler or a finally block");
        }
        if (this.handlers.isEmpty() && !this.orelse.isEmpty()) {
            throw new IllegalArgumentException("Try else block requires at least one handler");
        }
    }

    public Try(List<Statement> body, List<ExceptHandler> handlers, List<Statement> orelse,
               List<Statement> finalbody) {
        this(body, handlers, orelse, finalbody, 0);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<ExceptHandler> getHandlers() {
        return handlers;
    }

    public List<Statement> getOrelse() {
        return orelse;
    }

    public List<Statement> getFinalbody() {
        return finalbody;
    }
}
