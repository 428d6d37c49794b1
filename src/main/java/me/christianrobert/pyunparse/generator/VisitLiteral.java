package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.tree.expression.Bytes;
import me.christianrobert.pyunparse.tree.expression.EllipsisLiteral;
import me.christianrobert.pyunparse.tree.expression.NameConstant;
import me.christianrobert.pyunparse.tree.expression.Num;
import me.christianrobert.pyunparse.tree.expression.Str;

/**
 * Static helpers for literals.
 *
 * <h3>Negative numbers:</h3>
 * <p>{@code **} binds tighter than unary minus, so {@code -2 ** 2} reads back as
 * {@code -(2 ** 2)}. A numeric literal whose text starts with a minus sign is therefore
 * wrapped: {@code (-2) ** 2}.</p>
 */
public class VisitLiteral {

    public static void num(Num node, RenderContext ctx) {
        String text = PythonLiterals.numberRepr(node.getValue());
        if (text.startsWith("-")) {
            text = "(" + text + ")";
        }
        ctx.write(text);
    }

    public static void str(Str node, RenderContext ctx) {
        ctx.write(PythonLiterals.stringRepr(node.getValue()));
    }

    public static void bytes(Bytes node, RenderContext ctx) {
        ctx.write(PythonLiterals.bytesRepr(node.getValue()));
    }

    public static void nameConstant(NameConstant node, RenderContext ctx) {
        ctx.write(node.getText());
    }

    public static void ellipsis(EllipsisLiteral node, RenderContext ctx) {
        ctx.write("...");
    }
}
