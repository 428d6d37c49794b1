package me.christianrobert.pyunparse.tree.element;

import me.christianrobert.pyunparse.tree.Expression;
import me.christianrobert.pyunparse.tree.NodeSupport;
import me.christianrobert.pyunparse.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parameter list of a function definition or lambda.
 *
 * <p>Grammar (Python 3):
 * <pre>
 * arguments = (arg* args, arg? vararg, arg* kwonlyargs, expr* kw_defaults,
 *              arg? kwarg, expr* defaults)
 * </pre>
 *
 * <p>Positional defaults are right-aligned: with {@code n} args and {@code d} defaults, default
 * {@code i} belongs to arg {@code n - d + i}. Keyword-only defaults are aligned one-to-one with
 * {@code kwonlyargs}; a null entry means "no default".</p>
 *
 * <p>Rendered by {@code ListFormatter.signature}, never dispatched on its own.</p>
 */
public class Arguments implements SyntaxNode {

    public static final String KIND = "arguments";

    private final List<Arg> args;
    private final List<Expression> defaults;
    private final Arg vararg;
    private final List<Arg> kwonlyargs;
    private final List<Expression> kwDefaults;
    private final Arg kwarg;

    /**
     * Creates a parameter list.
     *
     * @param args Positional parameters (may be null for none)
     * @param defaults Defaults of the trailing positional parameters (may be null for none)
     * @param vararg {@code *name} parameter or null
     * @param kwonlyargs Keyword-only parameters (may be null for none)
     * @param kwDefaults Keyword-only defaults, one entry (possibly null) per keyword-only
     *                   parameter; null or empty means no defaults at all
     * @param kwarg {@code **name} parameter or null
     */
    public Arguments(List<Arg> args, List<Expression> defaults, Arg vararg,
                     List<Arg> kwonlyargs, List<Expression> kwDefaults, Arg kwarg) {
        this.args = NodeSupport.copyOf(args, "Arguments args");
        this.defaults = NodeSupport.copyOf(defaults, "Arguments defaults");
        this.vararg = vararg;
        this.kwonlyargs = NodeSupport.copyOf(kwonlyargs, "Arguments kwonlyargs");
        this.kwarg = kwarg;

        if (this.defaults.size() > this.args.size()) {
            throw new IllegalArgumentException("Arguments has " + this.defaults.size()
                    + " defaults but only " + this.args.size() + " positional parameters");
        }

        List<Expression> kwDefaultsCopy = NodeSupport.copyOfNullable(kwDefaults);
        if (kwDefaultsCopy.isEmpty()) {
            kwDefaultsCopy = Collections.unmodifiableList(
                    new ArrayList<>(Collections.nCopies(this.kwonlyargs.size(), (Expression) null)));
        } else if (kwDefaultsCopy.size() != this.kwonlyargs.size()) {
            throw new IllegalArgumentException("Arguments kw_defaults size " + kwDefaultsCopy.size()
                    + " does not match kwonlyargs size " + this.kwonlyargs.size());
        }
        this.kwDefaults = kwDefaultsCopy;
    }

    /**
     * Creates an empty parameter list.
     */
    public static Arguments empty() {
        return new Arguments(null, null, null, null, null, null);
    }

    /**
     * Creates a parameter list of plain positional parameters without defaults.
     */
    public static Arguments positional(List<Arg> args) {
        return new Arguments(args, null, null, null, null, null);
    }

    @Override
    public String getKind() {
        return KIND;
    }

    public List<Arg> getArgs() {
        return args;
    }

    public List<Expression> getDefaults() {
        return defaults;
    }

    public Arg getVararg() {
        return vararg;
    }

    public List<Arg> getKwonlyargs() {
        return kwonlyargs;
    }

    public List<Expression> getKwDefaults() {
        return kwDefaults;
    }

    public Arg getKwarg() {
        return kwarg;
    }

    public boolean isEmpty() {
        return args.isEmpty() && vararg == null && kwonlyargs.isEmpty() && kwarg == null;
    }
}
