package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.Statement;

public class Continue extends Statement {

    public static final String KIND = "Continue";

    public Continue(int lineNumber) {
        super(lineNumber);
    }

    public Continue() {
        this(0);
    }

    @Override
    public String getKind() {
        return KIND;
    }
}
