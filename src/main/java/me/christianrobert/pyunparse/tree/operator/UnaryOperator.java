package me.christianrobert.pyunparse.tree.operator;

public enum UnaryOperator {
    INVERT("Invert", "~"),
    NOT("Not", "not"),
    U_ADD("UAdd", "+"),
    U_SUB("USub", "-");

    private final String kind;
    private final String token;

    UnaryOperator(String kind, String token) {
        this.kind = kind;
        this.token = token;
    }

    public String getKind() {
        return kind;
    }

    public String getToken() {
        return token;
    }

    public static UnaryOperator fromKind(String kind) {
        for (UnaryOperator op : values()) {
            if (op.kind.equals(kind)) {
                return op;
            }
        }
        return null;
    }
}
