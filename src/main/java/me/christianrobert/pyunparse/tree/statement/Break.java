package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.Statement;

public class Break extends Statement {

    public static final String KIND = "Break";

    public Break(int lineNumber) {
        super(lineNumber);
    }

    public Break() {
        this(0);
    }

    @Override
    public String getKind() {
        return KIND;
    }
}
