package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.element.Keyword;
import me.christianrobert.pyunparse.tree.expression.Call;

/**
 * Static helpers for call expressions.
 *
 * <h3>Argument order:</h3>
 * <pre>
 * func(positional..., name=value..., *starargs, **kwargs)
 * </pre>
 *
 * <p>Positional and keyword arguments keep their order within their group. All groups share
 * one separator index, so {@code ", "} appears exactly between arguments.</p>
 */
public class VisitCall {

    public static void v(Call node, RenderContext ctx) {
        ctx.visit(node.getFunc()).write("(");

        int index = 0;
        for (Expression arg : node.getArgs()) {
            ListFormatter.separator(index++, ctx);
            ctx.visit(arg);
        }
        for (Keyword keyword : node.getKeywords()) {
            ListFormatter.separator(index++, ctx);
            ctx.visit(keyword);
        }
        if (node.getStarargs() != null) {
            ListFormatter.separator(index++, ctx);
            ctx.write("*").visit(node.getStarargs());
        }
        if (node.getKwargs() != null) {
            ListFormatter.separator(index, ctx);
            ctx.write("**").visit(node.getKwargs());
        }

        ctx.write(")");
    }

    /**
     * {@code name=value}, or {@code **value} for a keyword without a name.
     */
    public static void keyword(Keyword node, RenderContext ctx) {
        if (node.isUnpacking()) {
            ctx.write("**");
        } else {
            ctx.write(node.getArg() + "=");
        }
        ctx.visit(node.getValue());
    }
}
