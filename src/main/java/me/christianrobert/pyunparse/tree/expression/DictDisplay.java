package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;

import java.util.List;

/**
 * Dict literal (kind {@code Dict}). Keys and values are parallel lists; a null key marks a
 * {@code **mapping} unpack entry.
 */
public class DictDisplay implements Expression {

    public static final String KIND = "Dict";

    private final List<Expression> keys;
    private final List<Expression> values;

    public DictDisplay(List<Expression> keys, List<Expression> values) {
        this.keys = NodeSupport.copyOfNullable(keys);
        this.values = NodeSupport.copyOf(values, "Dict values");
        if (this.keys.size() != this.values.size()) {
            throw new IllegalArgumentException("Dict has " + this.keys.size() + " keys but "
                    + this.values.size() + " values");
        }
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public List<Expression> getKeys() {
        return keys;
    }

    public List<Expression> getValues() {
        return values;
    }
}
