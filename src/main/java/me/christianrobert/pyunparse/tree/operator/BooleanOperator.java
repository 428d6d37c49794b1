package me.christianrobert.pyunparse.tree.operator;

public enum BooleanOperator {
    AND("And", "and"),
    OR("Or", "or");

    private final String kind;
    private final String token;

    BooleanOperator(String kind, String token) {
        this.kind = kind;
        this.token = token;
    }

    public String getKind() {
        return kind;
    }

    public String getToken() {
        return token;
    }

    public static BooleanOperator fromKind(String kind) {
        for (BooleanOperator op : values()) {
            if (op.kind.equals(kind)) {
                return op;
            }
        }
        return null;
    }
}
