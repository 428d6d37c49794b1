package me.christianrobert.pyunparse.generator;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates source fragments with lazy line breaks.
 *
 * <p>A break request only raises the pending-break counter; the newlines and the indentation
 * are written when the next real token arrives. Requests made at the same point collapse to
 * their maximum, so independent rules can each ask for spacing without double blank lines.</p>
 *
 * <p>Output never starts with a line break and never ends with one.</p>
 */
public class SourceBuffer {

    private final List<String> result = new ArrayList<>();
    private final String indentWith;

    private int indentation;
    private int newLines;

    /**
     * @param indentWith Literal text written once per indentation level
     */
    public SourceBuffer(String indentWith) {
        if (indentWith == null) {
            throw new IllegalArgumentException("Indentation unit cannot be null");
        }
        this.indentWith = indentWith;
    }

    /**
     * Appends text, first materializing pending line breaks and the current indentation.
     */
    public void write(String text) {
        if (newLines > 0) {
            if (!result.isEmpty()) {
                result.add("\n".repeat(newLines));
            }
            result.add(indentWith.repeat(indentation));
            newLines = 0;
        }
        result.add(text);
    }

    /**
     * Requests a line break followed by {@code extra} blank lines.
     *
     * @param extra Number of blank lines wanted in addition to the break
     */
    public void newline(int extra) {
        if (extra < 0) {
            throw new IllegalArgumentException("Extra blank lines cannot be negative: " + extra);
        }
        newLines = Math.max(newLines, 1 + extra);
    }

    public void indent() {
        indentation++;
    }

    /**
     * @throws IllegalStateException when called more often than {@link #indent()} (a rule bug)
     */
    public void dedent() {
        if (indentation == 0) {
            throw new IllegalStateException("Cannot dedent below indentation level 0");
        }
        indentation--;
    }

    public int getIndentation() {
        return indentation;
    }

    /**
     * @return Number of newlines that will be written before the next token
     */
    public int getPendingNewLines() {
        return newLines;
    }

    public String getIndentWith() {
        return indentWith;
    }

    /**
     * Concatenates all fragments into the final text.
     */
    public String finish() {
        return String.join("", result);
    }
}
