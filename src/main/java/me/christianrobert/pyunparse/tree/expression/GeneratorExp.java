package me.christianrobert.pyunparse.tree.expression;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.element.Comprehension;

import java.util.List;

/**
 * A generator comprehension: element expression followed by one or more generator clauses.
 */
public class GeneratorExp implements Expression {

    public static final String KIND = "GeneratorExp";

    private final Expression elt;
    private final List<Comprehension> generators;

    public GeneratorExp(Expression elt, List<Comprehension> generators) {
        this.elt = NodeSupport.require(elt, "GeneratorExp element");
        this.generators = NodeSupport.copyOfNonEmpty(generators, "GeneratorExp generators");
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public Expression getElt() {
        return elt;
    }

    public List<Comprehension> getGenerators() {
        return generators;
    }
}
