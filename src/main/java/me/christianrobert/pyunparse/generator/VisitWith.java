package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.tree.element.WithItem;
import me.christianrobert.pyunparse.tree.statement.With;

/**
 * Static helpers for with statements: {@code with open(p) as f, lock:}.
 */
public class VisitWith {

    public static void v(With node, RenderContext ctx) {
        ctx.statement(node, "with ");
        ListFormatter.commaList(node.getItems(), ctx);
        ctx.write(":");
        ctx.body(node.getBody());
    }

    public static void withItem(WithItem node, RenderContext ctx) {
        ctx.visit(node.getContextExpr()).visitOptional(" as ", node.getOptionalVars());
    }
}
