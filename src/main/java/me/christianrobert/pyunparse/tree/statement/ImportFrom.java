package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.Statement;
import me.christianrobert.pyunparse.tree.element.Alias;

import java.util.List;

/**
 * {@code from ..module import a, b as c}
 *
 * <p>{@code level} is the number of leading dots of a relative import (0 for absolute imports).
 * The module may be null for {@code from . import x}.</p>
 */
public class ImportFrom extends Statement {

    public static final String KIND = "ImportFrom";

    private final String module;
    private final List<Alias> names;
    private final int level;

    public ImportFrom(String module, List<Alias> names, int level, int lineNumber) {
        super(lineNumber);
        if (level < 0) {
            throw new IllegalArgumentException("ImportFrom level cannot be negative: " + level);
        }
        if (module == null && level == 0) {
            throw new IllegalArgumentException("ImportFrom without module must be relative");
        }
        this.module = module;
        this.names = NodeSupport.copyOfNonEmpty(names, "ImportFrom names");
        this.level = level;
    }

    public ImportFrom(String module, List<Alias> names, int level) {
        this(module, names, level, 0);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public String getModule() {
        return module;
    }

    public List<Alias> getNames() {
        return names;
    }

    public int getLevel() {
        return level;
    }
}
