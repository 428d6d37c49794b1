package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.expression.ExtSlice;
import me.christianrobert.pyunparse.tree.expression.Index;
import me.christianrobert.pyunparse.tree.expression.Name;
import me.christianrobert.pyunparse.tree.expression.NameConstant;
import me.christianrobert.pyunparse.tree.expression.Slice;
import me.christianrobert.pyunparse.tree.expression.Subscript;

/**
 * Static helpers for subscription and slicing.
 *
 * <pre>
 * a[i]        Subscript(a, Index(i))
 * a[1:]       Subscript(a, Slice(1, null, null))
 * a[::2]      Subscript(a, Slice(null, null, 2))
 * a[1:2, 3]   Subscript(a, ExtSlice([Slice(1, 2, null), Index(3)]))
 * </pre>
 */
public class VisitSubscript {

    public static void subscript(Subscript node, RenderContext ctx) {
        ctx.visit(node.getValue()).write("[").visit(node.getSlice()).write("]");
    }

    public static void index(Index node, RenderContext ctx) {
        ctx.visit(node.getValue());
    }

    /**
     * Bounds are written only when present. A step encoded as the name {@code None} (instead of
     * an absent field) keeps its colon but the placeholder itself is not written.
     */
    public static void slice(Slice node, RenderContext ctx) {
        if (node.getLower() != null) {
            ctx.visit(node.getLower());
        }
        ctx.write(":");
        if (node.getUpper() != null) {
            ctx.visit(node.getUpper());
        }
        Expression step = node.getStep();
        if (step != null) {
            ctx.write(":");
            if (!isNoneMarker(step)) {
                ctx.visit(step);
            }
        }
    }

    public static void extSlice(ExtSlice node, RenderContext ctx) {
        ListFormatter.commaList(node.getDims(), node.getDims().size() == 1, ctx);
    }

    private static boolean isNoneMarker(Expression step) {
        if (step instanceof Name) {
            return "None".equals(((Name) step).getId());
        }
        return step == NameConstant.NONE;
    }
}
