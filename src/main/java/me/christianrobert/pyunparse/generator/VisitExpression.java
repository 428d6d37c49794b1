package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.expression.Attribute;
import me.christianrobert.pyunparse.tree.expression.Lambda;
import me.christianrobert.pyunparse.tree.expression.Name;
import me.christianrobert.pyunparse.tree.expression.Num;
import me.christianrobert.pyunparse.tree.expression.Starred;
import me.christianrobert.pyunparse.tree.expression.Yield;
import me.christianrobert.pyunparse.tree.expression.YieldFrom;

/**
 * Static helpers for names, attribute access, unpacking, yield and lambda.
 */
public class VisitExpression {

    public static void name(Name node, RenderContext ctx) {
        ctx.write(node.getId());
    }

    /**
     * {@code value.attr}. An integer literal receiver is wrapped, {@code 1.real} would lex as a
     * float followed by a name.
     */
    public static void attribute(Attribute node, RenderContext ctx) {
        Expression value = node.getValue();
        if (value instanceof Num && ((Num) value).isIntegral()) {
            ctx.enclose("(", ")", () -> ctx.visit(value));
        } else {
            ctx.visit(value);
        }
        ctx.write("." + node.getAttr());
    }

    public static void starred(Starred node, RenderContext ctx) {
        ctx.write("*").visit(node.getValue());
    }

    // yield is only allowed unparenthesized as a statement or a sole assignment value
    public static void yieldExpression(Yield node, RenderContext ctx) {
        ctx.enclose("(", ")", () -> ctx.write("yield").visitOptional(" ", node.getValue()));
    }

    public static void yieldFrom(YieldFrom node, RenderContext ctx) {
        ctx.enclose("(", ")", () -> ctx.write("yield from ").visit(node.getValue()));
    }

    /**
     * {@code (lambda a, b=1: body)}; wrapped like operations because a lambda body extends as
     * far right as possible.
     */
    public static void lambda(Lambda node, RenderContext ctx) {
        ctx.enclose("(", ")", () -> {
            if (node.getArgs().isEmpty()) {
                ctx.write("lambda: ");
            } else {
                ctx.write("lambda ");
                ListFormatter.signature(node.getArgs(), ctx);
                ctx.write(": ");
            }
            ctx.visit(node.getBody());
        });
    }
}
