package me.christianrobert.pyunparse.tree.operator;

/**
 * Arithmetic and bitwise operators, mapped to their source tokens.
 *
 * <p>Also used by augmented assignment, which writes the token followed by {@code =}.</p>
 */
public enum BinaryOperator {
    ADD("Add", "+"),
    SUB("Sub", "-"),
    MULT("Mult", "*"),
    MAT_MULT("MatMult", "@"),
    DIV("Div", "/"),
    MOD("Mod", "%"),
    POW("Pow", "**"),
    LSHIFT("LShift", "<<"),
    RSHIFT("RShift", ">>"),
    BIT_OR("BitOr", "|"),
    BIT_XOR("BitXor", "^"),
    BIT_AND("BitAnd", "&"),
    FLOOR_DIV("FloorDiv", "//");

    private final String kind;
    private final String token;

    BinaryOperator(String kind, String token) {
        this.kind = kind;
        this.token = token;
    }

    /**
     * @return Python ast operator class name (e.g. "Add")
     */
    public String getKind() {
        return kind;
    }

    public String getToken() {
        return token;
    }

    /**
     * Looks up an operator by its ast class name.
     *
     * @param kind ast class name (e.g. "FloorDiv")
     * @return Matching operator or null if the name is unknown
     */
    public static BinaryOperator fromKind(String kind) {
        for (BinaryOperator op : values()) {
            if (op.kind.equals(kind)) {
                return op;
            }
        }
        return null;
    }
}
