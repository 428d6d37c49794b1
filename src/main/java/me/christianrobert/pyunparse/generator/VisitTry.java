package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.tree.element.ExceptHandler;
import me.christianrobert.pyunparse.tree.statement.Try;

/**
 * Static helpers for exception handling.
 *
 * <h3>Output order:</h3>
 * <pre>
 * try:
 *     body
 * except ValueError as e:
 *     handler
 * except:
 *     handler
 * else:
 *     orelse
 * finally:
 *     finalbody
 * </pre>
 *
 * <p>Only the canonical {@link Try} shape reaches this class, so each clause is written based
 * on whether it is present.</p>
 */
public class VisitTry {

    public static void v(Try node, RenderContext ctx) {
        ctx.statement(node, "try:");
        ctx.body(node.getBody());

        for (ExceptHandler handler : node.getHandlers()) {
            ctx.visit(handler);
        }

        ctx.elseBody(node.getOrelse());

        if (!node.getFinalbody().isEmpty()) {
            ctx.newline().write("finally:");
            ctx.body(node.getFinalbody());
        }
    }

    public static void exceptHandler(ExceptHandler node, RenderContext ctx) {
        ctx.statement(node, "except");
        if (node.getType() != null) {
            ctx.write(" ").visit(node.getType());
            if (node.getName() != null) {
                ctx.write(" as " + node.getName());
            }
        }
        ctx.write(":");
        ctx.body(node.getBody());
    }
}
