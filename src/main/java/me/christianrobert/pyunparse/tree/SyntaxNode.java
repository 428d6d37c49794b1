package me.christianrobert.pyunparse.tree;

/**
 * Base interface for all syntax tree nodes.
 *
 * <p>Nodes are immutable and built by an external tree producer (a parser, or the
 * {@link me.christianrobert.pyunparse.ingest.AstJsonReader}). The source generator only reads
 * them, top-down.</p>
 *
 * <p>The kind set is deliberately open: new node classes may be introduced without touching this
 * interface. The generator resolves its rendering rule strictly by {@link #getKind()} and fails
 * for kinds it has no rule for.</p>
 */
public interface SyntaxNode {

    /**
     * Kind name of this node, equal to the Python {@code ast} class name (e.g. {@code "BinOp"}).
     *
     * @return Kind name used for rule dispatch
     */
    String getKind();
}
