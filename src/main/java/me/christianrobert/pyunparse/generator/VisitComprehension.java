package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.element.Comprehension;
import me.christianrobert.pyunparse.tree.expression.DictComp;
import me.christianrobert.pyunparse.tree.expression.GeneratorExp;
import me.christianrobert.pyunparse.tree.expression.ListComp;
import me.christianrobert.pyunparse.tree.expression.SetComp;

import java.util.List;

/**
 * Static helpers for comprehensions. All four forms write the element first and then each
 * generator clause in order; only the brackets differ.
 *
 * <pre>
 * [x for x in xs if x]
 * {x for row in rows for x in row}
 * (x for x in xs)
 * {k: v for (k, v) in items}
 * </pre>
 */
public class VisitComprehension {

    public static void listComp(ListComp node, RenderContext ctx) {
        generatorForm("[", "]", node.getElt(), node.getGenerators(), ctx);
    }

    public static void setComp(SetComp node, RenderContext ctx) {
        generatorForm("{", "}", node.getElt(), node.getGenerators(), ctx);
    }

    public static void generatorExp(GeneratorExp node, RenderContext ctx) {
        generatorForm("(", ")", node.getElt(), node.getGenerators(), ctx);
    }

    public static void dictComp(DictComp node, RenderContext ctx) {
        ctx.enclose("{", "}", () -> {
            ctx.visit(node.getKey()).write(": ").visit(node.getValue());
            for (Comprehension generator : node.getGenerators()) {
                ctx.visit(generator);
            }
        });
    }

    /**
     * {@code  for target in iter if cond if cond2}, with a leading space.
     */
    public static void comprehension(Comprehension node, RenderContext ctx) {
        ctx.write(" for ").visit(node.getTarget()).write(" in ").visit(node.getIter());
        for (Expression condition : node.getIfs()) {
            ctx.write(" if ").visit(condition);
        }
    }

    private static void generatorForm(String open, String close, Expression elt,
                                      List<Comprehension> generators, RenderContext ctx) {
        ctx.enclose(open, close, () -> {
            ctx.visit(elt);
            for (Comprehension generator : generators) {
                ctx.visit(generator);
            }
        });
    }
}
