package me.christianrobert.pyunparse.tree.element;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.SyntaxNode;

/**
 * Keyword argument of a call or class definition.
 *
 * <p>A keyword without a name is a keyword-variadic unpack ({@code **value}), the form
 * Python 3.5+ trees use instead of a separate {@code kwargs} field.</p>
 */
public class Keyword implements SyntaxNode {

    public static final String KIND = "keyword";

    private final String arg;
    private final Expression value;

    /**
     * @param arg Keyword name, or null for {@code **value}
     * @param value Argument value
     */
    public Keyword(String arg, Expression value) {
        if (arg != null && arg.trim().isEmpty()) {
            throw new IllegalArgumentException("Keyword name cannot be empty");
        }
        this.arg = arg;
        this.value = NodeSupport.require(value, "Keyword value");
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public String getArg() {
        return arg;
    }

    public Expression getValue() {
        return value;
    }

    public boolean isUnpacking() {
        return arg == null;
    }
}
