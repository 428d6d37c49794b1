package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.Statement;

/**
 * {@code raise}, {@code raise exc} or {@code raise exc from cause}
 */
public class Raise extends Statement {

    public static final String KIND = "Raise";

    private final Expression exc;
    private final Expression cause;

    public Raise(Expression exc, Expression cause, int lineNumber) {
        super(lineNumber);
        if (exc == null && cause != null) {
            throw new IllegalArgumentException("Raise cannot have a cause without an exception");
        }
        this.exc = exc;
        this.cause = cause;
    }

    public Raise(Expression exc, Expression cause) {
        this(exc, cause, 0);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getExc() {
        return exc;
    }

    public Expression getCause() {
        return cause;
    }
}
