package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.tree.statement.For;
import me.christianrobert.pyunparse.tree.statement.While;

/**
 * Static helpers for loop statements. Both loop forms support an {@code else:} block that
 * runs when the loop was not left by {@code break}.
 *
 * <pre>
 * for target in iter:
 *     body
 * else:
 *     orelse
 *
 * while test:
 *     body
 * </pre>
 */
public class VisitLoop {

    public static void forLoop(For node, RenderContext ctx) {
        ctx.statement(node, "for ")
                .visit(node.getTarget())
                .write(" in ")
                .visit(node.getIter())
                .write(":");
        ctx.body(node.getBody());
        ctx.elseBody(node.getOrelse());
    }

    public static void whileLoop(While node, RenderContext ctx) {
        ctx.statement(node, "while ").visit(node.getTest()).write(":");
        ctx.body(node.getBody());
        ctx.elseBody(node.getOrelse());
    }
}
