package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.Statement;

import java.util.List;

/**
 * {@code global a, b}
 */
public class Global extends Statement {

    public static final String KIND = "Global";

    private final List<String> names;

    public Global(List<String> names, int lineNumber) {
        super(lineNumber);
        this.names = NodeSupport.copyOfNonEmpty(names, "Global names");
    }

    public Global(List<String> names) {
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
