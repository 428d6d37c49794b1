package me.christianrobert.pyunparse.generator;

import me.christianrobert.pyunparse.context.RenderContext;
import me.christianrobert.pyunparse.tree.SyntaxNode;

/**
 * Rendering rule for one node kind.
 *
 * @param <T> Node class the rule renders
 */
@FunctionalInterface
public interface NodeRule<T extends SyntaxNode> {

    void render(T node, RenderContext ctx);
}
