package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.Statement;
import me.christianrobert.pyunparse.tree.element.Alias;

import java.util.List;

/**
 * {@code import a, b as c}
 */
public class Import extends Statement {

    public static final String KIND = "Import";

    private final List<Alias> names;

    public Import(List<Alias> names, int lineNumber) {
        super(lineNumber);
        this.names = NodeSupport.copyOfNonEmpty(names, "Import names");
    }

    public Import(List<Alias> names) {
        this(names, 0);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public List<Alias> getNames() {
        return names;
    }
}
