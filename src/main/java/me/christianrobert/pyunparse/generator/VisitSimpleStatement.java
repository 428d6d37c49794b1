package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.tree.statement.Assert;
import me.christianrobert.pyunparse.tree.statement.Break;
import me.christianrobert.pyunparse.tree.statement.Continue;
import me.christianrobert.pyunparse.tree.statement.Delete;
import me.christianrobert.pyunparse.tree.statement.ExprStatement;
import me.christianrobert.pyunparse.tree.statement.Global;
import me.christianrobert.pyunparse.tree.statement.Nonlocal;
import me.christianrobert.pyunparse.tree.statement.Pass;
import me.christianrobert.pyunparse.tree.statement.Raise;
import me.christianrobert.pyunparse.tree.statement.Return;

/**
 * Static helpers for single-line statements without a block.
 */
public class VisitSimpleStatement {

    public static void expr(ExprStatement node, RenderContext ctx) {
        ctx.statement(node).visit(node.getValue());
    }

    public static void pass(Pass node, RenderContext ctx) {
        ctx.statement(node, "pass");
    }

    public static void breakStatement(Break node, RenderContext ctx) {
        ctx.statement(node, "break");
    }

    public static void continueStatement(Continue node, RenderContext ctx) {
        ctx.statement(node, "continue");
    }

    public static void delete(Delete node, RenderContext ctx) {
        ctx.statement(node, "del ");
        ListFormatter.commaList(node.getTargets(), ctx);
    }

    public static void assertStatement(Assert node, RenderContext ctx) {
        ctx.statement(node, "assert ")
                .visit(node.getTest())
                .visitOptional(", ", node.getMsg());
    }

    public static void global(Global node, RenderContext ctx) {
        ctx.statement(node, "global ");
        ListFormatter.names(node.getNames(), ctx);
    }

    public static void nonlocal(Nonlocal node, RenderContext ctx) {
        ctx.statement(node, "nonlocal ");
        ListFormatter.names(node.getNames(), ctx);
    }

    public static void returnStatement(Return node, RenderContext ctx) {
        ctx.statement(node, "return").visitOptional(" ", node.getValue());
    }

    /**
     * {@code raise}, {@code raise exc} or {@code raise exc from cause}.
     */
    public static void raise(Raise node, RenderContext ctx) {
        ctx.statement(node, "raise")
                .visitOptional(" ", node.getExc())
                .visitOptional(" from ", node.getCause());
    }
}
