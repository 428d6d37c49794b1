package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;

/**
 * Identifier reference.
 */
public class Name implements Expression {

    public static final String KIND = "Name";

    private final String id;

    public Name(String id) {
        this.id = NodeSupport.requireIdentifier(id, "Name id");
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public String getId() {
        return id;
    }

    @Override
    public String toString() {
        return "Name{" + id + "}";
    }
}
