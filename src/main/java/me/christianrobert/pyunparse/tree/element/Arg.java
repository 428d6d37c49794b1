package me.christianrobert.pyunparse.tree.element;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.SyntaxNode;

/**
 * A single parameter: {@code name} or {@code name: annotation}.
 */
public class Arg implements SyntaxNode {

    public static final String KIND = "arg";

    private final String name;
    private final Expression annotation;

    public Arg(String name, Expression annotation) {
        this.name = NodeSupport.requireIdentifier(name, "Arg name");
        this.annotation = annotation;
    }

    public Arg(String name) {
        this(name, null);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public String getName() {
        return name;
    }

    public Expression getAnnotation() {
        return annotation;
    }

    @Override
    public String toString() {
        return "Arg{name=" + name + ", annotation=" + annotation + "}";
    }
}
