package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.tree.expression.BinOp;
import me.christianrobert.pyunparse.tree.expression.BoolOp;
import me.christianrobert.pyunparse.tree.expression.Compare;
import me.christianrobert.pyunparse.tree.expression.IfExp;
import me.christianrobert.pyunparse.tree.expression.UnaryOp;

/**
 * Static helpers for operator expressions.
 *
 * <h3>Parenthesization:</h3>
 * <p>Every operation is wrapped in parentheses, whether or not its context needs them. The tree
 * does not record where the original source had parentheses, and always wrapping guarantees that
 * the text reads back with exactly the tree's grouping.</p>
 *
 * <pre>
 * BinOp(BinOp(a + b) * c)       ((a + b) * c)
 * BoolOp(and, [a, b, c])        (a and b and c)
 * Compare(a, [&lt;, &lt;=], [b, c])  (a &lt; b &lt;= c)
 * UnaryOp(not, x)               (not x)
 * IfExp(t, a, b)                (a if t else b)
 * </pre>
 */
public class VisitOperation {

    public static void binOp(BinOp node, RenderContext ctx) {
        ctx.enclose("(", ")", () -> ctx.visit(node.getLeft())
                .write(" " + node.getOp().getToken() + " ")
                .visit(node.getRight()));
    }

    public static void boolOp(BoolOp node, RenderContext ctx) {
        String separator = " " + node.getOp().getToken() + " ";
        ctx.enclose("(", ")", () -> {
            for (int i = 0; i < node.getValues().size(); i++) {
                if (i > 0) {
                    ctx.write(separator);
                }
                ctx.visit(node.getValues().get(i));
            }
        });
    }

    public static void compare(Compare node, RenderContext ctx) {
        ctx.enclose("(", ")", () -> {
            ctx.visit(node.getLeft());
            for (int i = 0; i < node.getOps().size(); i++) {
                ctx.write(" " + node.getOps().get(i).getToken() + " ").visit(node.getComparators().get(i));
            }
        });
    }

    public static void unaryOp(UnaryOp node, RenderContext ctx) {
        ctx.enclose("(", ")", () -> ctx.write(node.getOp().getToken() + " ").visit(node.getOperand()));
    }

    public static void ifExp(IfExp node, RenderContext ctx) {
        ctx.enclose("(", ")", () -> ctx.visit(node.getBody())
                .write(" if ")
                .visit(node.getTest())
                .write(" else ")
                .visit(node.getOrelse()));
    }
}
