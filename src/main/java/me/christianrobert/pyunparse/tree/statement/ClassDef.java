package me.christianrobert.pyunparse.tree.statement;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.Statement;
import me.christianrobert.pyunparse.tree.element.Keyword;

import java.util.List;

/**
 * Class definition.
 *
 * <p>{@code starargs}/{@code kwargs} are the pre-3.5 variadic base markers; newer trees express
 * the same with {@code Starred} bases and unnamed keywords. Both forms are accepted.</p>
 */
public class ClassDef extends Statement {

    public static final String KIND = "ClassDef";

    private final String name;
    private final List<Expression> bases;
    private final List<Keyword> keywords;
    private final Expression starargs;
    private final Expression kwargs;
    private final List<Statement> body;
    private final List<Expression> decorators;

    public ClassDef(String name, List<Expression> bases, List<Keyword> keywords,
                    Expression starargs, Expression kwargs, List<Statement> body,
                    List<Expression> decorators, int lineNumber) {
        super(lineNumber);
        this.name = NodeSupport.requireIdentifier(name, "ClassDef name");
        this.bases = NodeSupport.copyOf(bases, "ClassDef bases");
        this.keywords = NodeSupport.copyOf(keywords, "ClassDef keywords");
        this.starargs = starargs;
        this.kwargs = kwargs;
        this.body = NodeSupport.copyOfNonEmpty(body, "ClassDef body");
        this.decorators = NodeSupport.copyOf(decorators, "ClassDef decorators");
    }

    public ClassDef(String name, List<Expression> bases, List<Statement> body) {
        this(name, bases, null, null, null, body, null, 0);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public String getName() {
        return name;
    }

    public List<Expression> getBases() {
        return bases;
    }

    public List<Keyword> getKeywords() {
        return keywords;
    }

    public Expression getStarargs() {
        return starargs;
    }

    public Expression getKwargs() {
        return kwargs;
    }

    public List<Statement> getBody() {
        return body;
    }

    public List<Expression> getDecorators() {
        return decorators;
    }

    /**
     * @return true if the definition has anything to put between parentheses
     */
    public boolean hasArguments() {
        return !bases.isEmpty() || !keywords.isEmpty() || starargs != null || kwargs != null;
    }

    @Override
    public String toString() {
        return "ClassDef{name=" + name + ", line=" + getLineNumber() + "}";
    }
}
