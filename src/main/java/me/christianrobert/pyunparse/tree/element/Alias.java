package me.christianrobert.pyunparse.tree.element;

import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.SyntaxNode;

/**
 * Imported name with optional alias: {@code name} or {@code name as asname}.
 */
public class Alias implements SyntaxNode {

    public static final String KIND = "alias";

    private final String name;
    private final String asname;

    public Alias(String name, String asname) {
        this.name = NodeSupport.requireIdentifier(name, "Alias name");
        this.asname = asname;
    }

    public Alias(String name) {
        this(name, null);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public String getName() {
        return name;
    }

    public String getAsname() {
        return asname;
    }

    @Override
    public String toString() {
        return asname == null ? "Alias{" + name + "}" : "Alias{" + name + " as " + asname + "}";
    }
}
