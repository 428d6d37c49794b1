package me.christianrobert.pyunparse.context;

import me.christianrobert.pyunparse.generator.SourceBuffer;
import me.christianrobert.pyunparse.generator.SourceGenerator;
import me.christianrobert.pyunparse.tree.Located;
import me.christianrobert.pyunparse.tree.SyntaxNode;

import java.util.List;

/**
 * Per-conversion state passed to every rendering rule.
 *
 * <p>Owns the {@link SourceBuffer}, the line-annotation toggle and a reference to the
 * dispatching {@link SourceGenerator}. One context is created per conversion and never shared,
 * which is what keeps concurrent conversions isolated.</p>
 *
 * <p>Write methods return the context so that a rule reads in source order:</p>
 * <pre>
 * ctx.statement(node, "while ").visit(node.getTest()).write(":");
 * </pre>
 */
public class RenderContext {

    private final SourceGenerator generator;
    private final SourceBuffer buffer;
    private final boolean addLineInformation;

    /**
     * Creates a context for one conversion.
     *
     * @param generator Dispatcher used for nested nodes
     * @param indentWith Literal text written once per indentation level
     * @param addLineInformation Whether statements are preceded by {@code # line: n} comments
     */
    public RenderContext(SourceGenerator generator, String indentWith, boolean addLineInformation) {
        if (generator == null) {
            throw new IllegalArgumentException("Generator cannot be null");
        }
        this.generator = generator;
        this.buffer = new SourceBuffer(indentWith);
        this.addLineInformation = addLineInformation;
    }

    public SourceBuffer getBuffer() {
        return buffer;
    }

    public boolean isAddLineInformation() {
        return addLineInformation;
    }

    // ========== Writing ==========

    /**
     * Writes literal text, materializing any pending line break and indentation first.
     */
    public RenderContext write(String text) {
        buffer.write(text);
        return this;
    }

    /**
     * Renders a nested node through the dispatcher.
     */
    public RenderContext visit(SyntaxNode node) {
        generator.visit(node, this);
        return this;
    }

    /**
     * Writes {@code prefix} followed by the node, or nothing when the node is absent.
     */
    public RenderContext visitOptional(String prefix, SyntaxNode node) {
        if (node != null) {
            write(prefix);
            visit(node);
        }
        return this;
    }

    /**
     * Writes {@code open}, runs the action, writes {@code close}.
     */
    public RenderContext enclose(String open, String close, Runnable action) {
        write(open);
        action.run();
        write(close);
        return this;
    }

    // ========== Line breaks ==========

    /**
     * Requests a line break before the next token.
     */
    public RenderContext newline() {
        buffer.newline(0);
        return this;
    }

    /**
     * Requests a line break plus {@code extra} blank lines. Requests collapse to their maximum.
     */
    public RenderContext newline(int extra) {
        buffer.newline(extra);
        return this;
    }

    /**
     * Requests a line break for a node. With line annotation enabled the node's line number is
     * written as its own comment line right before the node.
     */
    public RenderContext newline(Located node, int extra) {
        buffer.newline(extra);
        if (node != null && addLineInformation) {
            buffer.write("# line: " + node.getLineNumber());
            buffer.newline(0);
        }
        return this;
    }

    /**
     * Starts a statement line: break (and annotation) for the node.
     */
    public RenderContext statement(Located node) {
        return newline(node, 0);
    }

    /**
     * Starts a statement line and writes its leading text.
     */
    public RenderContext statement(Located node, String text) {
        return newline(node, 0).write(text);
    }

    // ========== Blocks ==========

    /**
     * Renders an indented block. Depth is restored on exit, also for an empty block and when a
     * nested rule fails.
     */
    public void body(List<? extends SyntaxNode> statements) {
        buffer.indent();
        try {
            for (SyntaxNode statement : statements) {
                visit(statement);
            }
        } finally {
            buffer.dedent();
        }
    }

    /**
     * Renders {@code else:} and its block, or nothing for an empty else clause.
     */
    public void elseBody(List<? extends SyntaxNode> orelse) {
        if (!orelse.isEmpty()) {
            newline().write("else:");
            body(orelse);
        }
    }

    /**
     * Joins everything written so far into the final source text.
     */
    public String finish() {
        return buffer.finish();
    }
}
