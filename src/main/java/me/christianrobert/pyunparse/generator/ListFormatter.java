package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.SyntaxNode;
import me.christianrobert.pyunparse.tree.element.Arg;
import me.christianrobert.pyunparse.tree.element.Arguments;

import java.util.List;

/**
 * Comma-separated lists and parameter signatures.
 *
 * <p>Every list in the output uses the same rule: {@code ", "} before every item except the
 * first. Renderers that interleave different item kinds (call arguments, class bases) keep one
 * running index and call {@link #separator(int, RenderContext)} per item.</p>
 */
public final class ListFormatter {

    private ListFormatter() {
    }

    /**
     * Writes the separator for the item at {@code index}.
     */
    public static void separator(int index, RenderContext ctx) {
        if (index > 0) {
            ctx.write(", ");
        }
    }

    public static void commaList(List<? extends SyntaxNode> items, RenderContext ctx) {
        commaList(items, false, ctx);
    }

    /**
     * Writes the items comma-separated.
     *
     * @param trailing Whether to write a trailing comma (one-element tuples)
     */
    public static void commaList(List<? extends SyntaxNode> items, boolean trailing, RenderContext ctx) {
        for (int i = 0; i < items.size(); i++) {
            separator(i, ctx);
            ctx.visit(items.get(i));
        }
        if (trailing) {
            ctx.write(",");
        }
    }

    /**
     * Writes plain identifiers comma-separated ({@code global a, b}).
     */
    public static void names(List<String> names, RenderContext ctx) {
        for (int i = 0; i < names.size(); i++) {
            separator(i, ctx);
            ctx.write(names.get(i));
        }
    }

    /**
     * Writes a parameter list without the surrounding parentheses.
     *
     * <pre>
     * a, b=1, *args, c, d=2, **kwargs
     * a, *, key=None
     * </pre>
     *
     * <p>Positional defaults are aligned to the trailing parameters. When keyword-only
     * parameters exist without a {@code *args} parameter, a bare {@code *} introduces them.</p>
     */
    public static void signature(Arguments arguments, RenderContext ctx) {
        int index = 0;

        List<Arg> args = arguments.getArgs();
        List<Expression> defaults = arguments.getDefaults();
        int firstDefault = args.size() - defaults.size();
        for (int i = 0; i < args.size(); i++) {
            separator(index++, ctx);
            ctx.visit(args.get(i));
            if (i >= firstDefault) {
                ctx.write("=").visit(defaults.get(i - firstDefault));
            }
        }

        List<Arg> kwonlyargs = arguments.getKwonlyargs();
        if (arguments.getVararg() != null) {
            separator(index++, ctx);
            ctx.write("*").visit(arguments.getVararg());
        } else if (!kwonlyargs.isEmpty()) {
            separator(index++, ctx);
            ctx.write("*");
        }

        List<Expression> kwDefaults = arguments.getKwDefaults();
        for (int i = 0; i < kwonlyargs.size(); i++) {
            separator(index++, ctx);
            ctx.visit(kwonlyargs.get(i));
            ctx.visitOptional("=", kwDefaults.get(i));
        }

        if (arguments.getKwarg() != null) {
            separator(index, ctx);
            ctx.write("**").visit(arguments.getKwarg());
        }
    }

    /**
     * Rule for a single parameter: {@code name} or {@code name: annotation}.
     */
    public static void arg(Arg node, RenderContext ctx) {
        ctx.write(node.getName()).visitOptional(": ", node.getAnnotation());
    }
}
