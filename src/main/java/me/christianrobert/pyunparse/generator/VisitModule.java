package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.tree.Statement;
import me.christianrobert.pyunparse.tree.statement.Module;

/**
 * Static helper for the tree root: renders the top-level statements at depth 0.
 */
public class VisitModule {

    public static void v(Module node, RenderContext ctx) {
        for (Statement statement : node.getBody()) {
            ctx.visit(statement);
        }
    }
}
