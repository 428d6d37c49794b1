package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.element.Keyword;
import me.christianrobert.pyunparse.tree.statement.ClassDef;

/**
 * Static helper for class definitions.
 *
 * <pre>
 * class Plain:
 * class Child(Base, metaclass=Meta, *mixins, **options):
 * </pre>
 *
 * <p>The parentheses are only written when there is at least one base, keyword or unpacked
 * argument.</p>
 */
public class VisitClassDef {

    public static void v(ClassDef node, RenderContext ctx) {
        VisitFunctionDef.decorators(node.getDecorators(), 2, ctx);
        ctx.statement(node, "class " + node.getName());

        if (node.hasArguments()) {
            ctx.write("(");
            int index = 0;
            for (Expression base : node.getBases()) {
                ListFormatter.separator(index++, ctx);
                ctx.visit(base);
            }
            for (Keyword keyword : node.getKeywords()) {
                ListFormatter.separator(index++, ctx);
                ctx.visit(keyword);
            }
            if (node.getStarargs() != null) {
                ListFormatter.separator(index++, ctx);
                ctx.write("*").visit(node.getStarargs());
            }
            if (node.getKwargs() != null) {
                ListFormatter.separator(index, ctx);
                ctx.write("**").visit(node.getKwargs());
            }
            ctx.write(")");
        }

        ctx.write(":");
        ctx.body(node.getBody());
    }
}
