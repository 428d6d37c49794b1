package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.expression.DictDisplay;
import me.christianrobert.pyunparse.tree.expression.ListDisplay;
import me.christianrobert.pyunparse.tree.expression.SetDisplay;
import me.christianrobert.pyunparse.tree.expression.TupleDisplay;

import java.util.List;

/**
 * Static helpers for collection displays.
 *
 * <pre>
 * (a, b)      (a,)      ()
 * [a, b]
 * {a, b}      set()
 * {k: v, k2: v2, }      {**other, }
 * </pre>
 *
 * <p>A one-element tuple keeps its trailing comma, otherwise it would read back as a
 * parenthesized expression. An empty set is written as {@code set()} because {@code {}} is an
 * empty dict.</p>
 */
public class VisitCollection {

    public static void tuple(TupleDisplay node, RenderContext ctx) {
        List<Expression> elements = node.getElements();
        ctx.enclose("(", ")", () -> ListFormatter.commaList(elements, elements.size() == 1, ctx));
    }

    public static void list(ListDisplay node, RenderContext ctx) {
        ctx.enclose("[", "]", () -> ListFormatter.commaList(node.getElements(), ctx));
    }

    public static void set(SetDisplay node, RenderContext ctx) {
        if (node.getElements().isEmpty()) {
            ctx.write("set()");
            return;
        }
        ctx.enclose("{", "}", () -> ListFormatter.commaList(node.getElements(), ctx));
    }

    /**
     * Every entry is followed by a separator, including the last one.
     */
    public static void dict(DictDisplay node, RenderContext ctx) {
        ctx.enclose("{", "}", () -> {
            for (int i = 0; i < node.getValues().size(); i++) {
                Expression key = node.getKeys().get(i);
                if (key == null) {
                    ctx.write("**");
                } else {
                    ctx.visit(key).write(": ");
                }
                ctx.visit(node.getValues().get(i)).write(", ");
            }
        });
    }
}
