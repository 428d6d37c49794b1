package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.statement.Assign;
import me.christianrobert.pyunparse.tree.statement.AugAssign;

/**
 * Static helpers for assignment statements.
 *
 * <pre>
 * a = b = value
 * total += value
 * </pre>
 */
public class VisitAssignment {

    public static void assign(Assign node, RenderContext ctx) {
        ctx.statement(node);
        for (Expression target : node.getTargets()) {
            ctx.visit(target).write(" = ");
        }
        ctx.visit(node.getValue());
    }

    public static void augAssign(AugAssign node, RenderContext ctx) {
        ctx.statement(node)
                .visit(node.getTarget())
                .write(" " + node.getOp().getToken() + "= ")
                .visit(node.getValue());
    }
}
