package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.element.Keyword;

import java.util.List;

/**
 * Call expression.
 *
 * <pre>
 * func(args..., keyword=value..., *starargs, **kwargs)
 * </pre>
 *
 * <p>{@code starargs} and {@code kwargs} are the optional pre-3.5 unpacking fields; newer trees
 * put {@code Starred} nodes in {@code args} and unnamed keywords in {@code keywords}.</p>
 */
public class Call implements Expression {

    public static final String KIND = "Call";

    private final Expression func;
    private final List<Expression> args;
    private final List<Keyword> keywords;
    private final Expression starargs;
    private final Expression kwargs;

    public Call(Expression func, List<Expression> args, List<Keyword> keywords,
                Expression starargs, Expression kwargs) {
        this.func = NodeSupport.require(func, "Call function");
        this.args = NodeSupport.copyOf(args, "Call args");
        this.keywords = NodeSupport.copyOf(keywords, "Call keywords");
        this.starargs = starargs;
        this.kwargs = kwargs;
    }

    public Call(Expression func, List<Expression> args, List<Keyword> keywords) {
        this(func, args, keywords, null, null);
    }

    public Call(Expression func, List<Expression> args) {
        this(func, args, null, null, null);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getFunc() {
        return func;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public List<Keyword> getKeywords() {
        return keywords;
    }

    public Expression getStarargs() {
        return starargs;
    }

    public Expression getKwargs() {
        return kwargs;
    }
}
