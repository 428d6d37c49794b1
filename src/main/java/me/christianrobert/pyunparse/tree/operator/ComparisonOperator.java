package me.christianrobert.pyunparse.tree.operator;

/**
 * Comparison operators. Two of them ({@code is not}, {@code not in}) are two-word tokens.
 */
public enum ComparisonOperator {
    EQ("Eq", "=="),
    NOT_EQ("NotEq", "!="),
    LT("Lt", "<"),
    LT_E("LtE", "<="),
    GT("Gt", ">"),
    GT_E("GtE", ">="),
    IS("Is", "is"),
    IS_NOT("IsNot", "is not"),
    IN("In", "in"),
    NOT_IN("NotIn", "not in");

    private final String kind;
    private final String token;

    ComparisonOperator(String kind, String token) {
        this.kind = kind;
        this.token = token;
    }

    public String getKind() {
        return kind;
    }

    public String getToken() {
        return token;
    }

    public static ComparisonOperator fromKind(String kind) {
        for (ComparisonOperator op : values()) {
            if (op.kind.equals(kind)) {
                return op;
            }
        }
        return null;
    }
}
