package lambda;

import java.util.Objects;
import java.util.Set;
import lambda.term.Abs;
import lambda.term.App;
import lambda.term.Atom;
import lambda.term.Term;
import lambda.term.Var;

/**
 * Capture-avoiding substitution of a term for the free occurrences of an atom.
 *
 * <p>Under an abstraction the binder is first renamed to a fresh atom, so the recursive call is on
 * a swapped body rather than a literal subterm. Recursion is bounded by a fuel counter seeded with
 * the size of the input: swapping preserves size, so every call receives a term at least one node
 * smaller than its caller's and fuel never runs out before a variable is reached.
 */
public class Substitution {
    public static final Substitution DEFAULT = new Substitution();

    private final AtomSupply supply;

    public Substitution() {
        this(AtomSupplies.defaultSupply());
    }

    public Substitution(AtomSupply supply) {
        this.supply = Objects.requireNonNull(supply, "supply");
    }

    public AtomSupply getSupply() {
        return supply;
    }

    /**
     * Replace the free occurrences of x in t by u.
     *
     * @throws AtomSupplyExhaustedException if a bounded supply cannot provide a fresh binder
     */
    public Term substitute(Term t, Term u, Atom x) {
        Objects.requireNonNull(t, "t");
        Objects.requireNonNull(u, "u");
        Objects.requireNonNull(x, "x");
        return substitute(t, u, x, t.size());
    }

    private Term substitute(Term t, Term u, Atom x, int fuel) {
        if (fuel < 1) {
            throw new IllegalStateException("Substitution ran out of fuel at " + t);
        }
        if (t instanceof Var v) {
            return v.atom().equals(x) ? u : v;
        } else if (t instanceof App app) {
            return new App(substitute(app.left(), u, x, fuel - 1), substitute(app.right(), u, x, fuel - 1));
        } else if (t instanceof Abs abs) {
            if (abs.binder().equals(x)) return abs;
            Set<Atom> excluded = u.freeVars();
            excluded.addAll(abs.freeVars());
            excluded.add(x);
            Atom z = supply.fresh(excluded);
            Term renamed = abs.body().swap(abs.binder(), z);
            return new Abs(z, substitute(renamed, u, x, fuel - 1));
        }
        throw new IllegalArgumentException("Unknown term " + t);
    }
}
