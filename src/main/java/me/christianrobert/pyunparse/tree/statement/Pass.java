package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.Statement;

public class Pass extends Statement {

    public static final String KIND = "Pass";

    public Pass(int lineNumber) {
        super(lineNumber);
    }

    public Pass() {
        this(0);
    }

    @Override
    public String getKind() {
        return KIND;
    }
}
