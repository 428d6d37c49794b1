package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.tree.Statement;
import me.christianrobert.pyunparse.tree.statement.If;

import java.util.List;

/**
 * Static helper for if statements.
 *
 * <p>The tree has no elif node: {@code elif} is an else clause holding exactly one nested
 * {@code If}. Such chains are flattened back, at the indentation of the outer {@code if}:</p>
 *
 * <h3>Tree:</h3>
 * <pre>
 * If(a, [x], [If(b, [y], [If(c, [z], [w])])])
 * </pre>
 *
 * <h3>Output:</h3>
 * <pre>
 * if a:
 *     x
 * elif b:
 *     y
 * elif c:
 *     z
 * else:
 *     w
 * </pre>
 *
 * <p>An else clause with several statements, or with one statement that is not an
 * {@code If}, ends the chain with a literal {@code else:} block.</p>
 */
public class VisitIf {

    public static void v(If node, RenderContext ctx) {
        ctx.statement(node, "if ").visit(node.getTest()).write(":");
        ctx.body(node.getBody());

        List<Statement> orelse = node.getOrelse();
        while (orelse.size() == 1 && orelse.get(0) instanceof If) {
            If elif = (If) orelse.get(0);
            ctx.newline().write("elif ").visit(elif.getTest()).write(":");
            ctx.body(elif.getBody());
            orelse = elif.getOrelse();
        }
        ctx.elseBody(orelse);
    }
}
