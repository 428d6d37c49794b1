package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.Statement;

import java.util.List;

/**
 * {@code nonlocal a, b}
 */
public class Nonlocal extends Statement {

    public static final String KIND = "Nonlocal";

    private final List<String> names;

    public Nonlocal(List<String> names, int lineNumber) {
        super(lineNumber);
        this.names = NodeSupport.copyOfNonEmpty(names, "Nonlocal names");
    }

    public Nonlocal(List<String> names) {
        this(names, 0);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public List<String> getNames() {
        return names;
    }
}
