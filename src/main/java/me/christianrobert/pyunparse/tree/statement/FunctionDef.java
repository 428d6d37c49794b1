package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.Statement;
import me.christianrobert.pyunparse.tree.element.Arguments;

import java.util.List;

/**
 * Function definition with decorators, parameters and optional return annotation.
 */
public class FunctionDef extends Statement {

    public static final String KIND = "FunctionDef";

    private final String name;
    private final Arguments args;
    private final List<Statement> body;
    private final List<Expression> decorators;
    private final Expression returns;

    /**
     * @param name Function name
     * @param args Parameter list (null for no parameters)
     * @param body Function body, at least one statement
     * @param decorators Decorator expressions in declaration order (may be null)
     * @param returns Return annotation or null
     * @param lineNumber Originating line number
     */
    public FunctionDef(String name, Arguments args, List<Statement> body,
                       List<Expression> decorators, Expression returns, int lineNumber) {
        super(lineNumber);
        this.name = NodeSupport.requireIdentifier(name, "FunctionDef name");
        this.args = args != null ? args : Arguments.empty();
        this.body = NodeSupport.copyOfNonEmpty(body, "FunctionDef body");
        this.decorators = NodeSupport.copyOf(decorators, "FunctionDef decorators");
        this.returns = returns;
    }

    public FunctionDef(String name, Arguments args, List<Statement> body) {
        this(name, args, body, null, null, 0);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public String getName() {
        return name;
    }

    public Arguments getArgs() {
        return args;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Expression> getDecorators() {
        return decorators;
    }

    public Expression getReturns() {
        return returns;
    }

    @Override
    public String toString() {
        return "FunctionDef{name=" + name + ", line=" + getLineNumber() + "}";
    }
}
