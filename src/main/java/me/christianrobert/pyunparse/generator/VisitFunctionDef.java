package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.statement.FunctionDef;

import java.util.List;

/**
 * Static helper for function definitions.
 *
 * <h3>Output:</h3>
 * <pre>
 * (blank line)
 * &#64;decorator_one
 * &#64;decorator_two(arg)
 * def name(a, b=1, *args, key=None, **kwargs) -> annotation:
 *     body
 * </pre>
 *
 * <h3>Notes:</h3>
 * <ul>
 *   <li>A definition asks for one blank line before it, a class for two</li>
 *   <li>Decorators are written in declaration order, each on its own line</li>
 *   <li>The parameter list comes from {@link ListFormatter#signature}</li>
 * </ul>
 */
public class VisitFunctionDef {

    public static void v(FunctionDef node, RenderContext ctx) {
        decorators(node.getDecorators(), 1, ctx);
        ctx.statement(node, "def " + node.getName() + "(");
        ListFormatter.signature(node.getArgs(), ctx);
        ctx.write(")");
        ctx.visitOptional(" -> ", node.getReturns());
        ctx.write(":");
        ctx.body(node.getBody());
    }

    /**
     * Requests the blank lines that separate a definition from what precedes it, then writes
     * each decorator on its own line.
     *
     * @param extra Blank lines wanted before the definition
     */
    static void decorators(List<Expression> decorators, int extra, RenderContext ctx) {
        ctx.newline(extra);
        for (Expression decorator : decorators) {
            ctx.newline().write("@").visit(decorator);
        }
    }
}
