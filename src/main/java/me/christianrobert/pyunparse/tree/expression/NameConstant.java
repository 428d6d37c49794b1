package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;

/**
 * The singleton constants {@code True}, {@code False} and {@code None}.
 */
public class NameConstant implements Expression {

    public static final String KIND = "NameConstant";

    public static final NameConstant TRUE = new NameConstant("True");
    public static final NameConstant FALSE = new NameConstant("False");
    public static final NameConstant NONE = new NameConstant("None");

    private final String text;

    private NameConstant(String text) {
        this.text = text;
    }

    /**
     * Resolves a constant by its source text.
     *
     * @param text "True", "False" or "None"
     * @return The constant
     * @throws IllegalArgumentException for any other text
     */
    public static NameConstant of(String text) {
        if (TRUE.text.equals(text)) {
            return TRUE;
        }
        if (FALSE.text.equals(text)) {
            return FALSE;
        }
        if (NONE.text.equals(text)) {
            return NONE;
        }
        throw new IllegalArgumentException("Not a name constant: " + text);
    }

    public static NameConstant of(Boolean value) {
        if (value == null) {
            return NONE;
        }
        return value ? TRUE : FALSE;
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return "NameConstant{" + text + "}";
    }
}
