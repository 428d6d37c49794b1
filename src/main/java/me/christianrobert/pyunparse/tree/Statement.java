package me.christianrobert.pyunparse.tree;

/**
 * Base class for statement nodes. Every statement carries its originating line number.
 */
public abstract class Statement implements SyntaxNode, Located {

    private final int lineNumber;

    protected Statement(int lineNumber) {
        if (lineNumber < 0) {
            throw new IllegalArgumentException("Line number cannot be negative: " + lineNumber);
        }
        this.lineNumber = lineNumber;
    }

    @Override
    public int getLineNumber() {
        return lineNumber;
    }
}
