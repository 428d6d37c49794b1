package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.element.Comprehension;

import java.util.List;

public class DictComp implements Expression {

    public static final String KIND = "DictComp";

    private final Expression key;
    private final Expression value;
    private final List<Comprehension> generators;

    public DictComp(Expression key, Expression value, List<Comprehension> generators) {
        this.key = NodeSupport.require(key, "DictComp key");
        this.value = NodeSupport.require(value, "DictComp value");
        this.generators = NodeSupport.copyOfNonEmpty(generators, "DictComp generators");
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getKey() {
        return key;
    }

    public Expression getValue() {
        return value;
    }

    public List<Comprehension> getGenerators() {
        return generators;
    }
}
