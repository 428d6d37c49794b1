package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.element.Arguments;

public class Lambda implements Expression {

    public static final String KIND = "Lambda";

    private final Arguments args;
    private final Expression body;

    public Lambda(Arguments args, Expression body) {
        this.args = args != null ? args : Arguments.empty();
        this.body = NodeSupport.require(body, "Lambda body");
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Arguments getArgs() {
        return args;
    }

    public Expression getBody() {
        return body;
    }
}
