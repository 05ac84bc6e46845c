package lambda;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lambda.term.Abs;
import lambda.term.App;
import lambda.term.Atom;
import lambda.term.Term;
import lambda.term.Var;

public class AlphaEquivalence {

    public static final String CANONICAL_PREFIX = "#";

    /**
     * Decide whether two terms are equal up to renaming of bound atoms.
     * Each recursive call is on terms strictly smaller than the inputs, since swap preserves size.
     */
    public static boolean alphaEquivalent(Term t1, Term t2) {
        if (t1 instanceof Var v1 && t2 instanceof Var v2) {
            return v1.atom().equals(v2.atom());
        } else if (t1 instanceof App a1 && t2 instanceof App a2) {
            return alphaEquivalent(a1.left(), a2.left()) && alphaEquivalent(a1.right(), a2.right());
        } else if (t1 instanceof Abs abs1 && t2 instanceof Abs abs2) {
            Atom x = abs1.binder();
            Atom y = abs2.binder();
            if (x.equals(y)) {
                return alphaEquivalent(abs1.body(), abs2.body());
            }
            // Rename the right binder to x; x must not be free on the right or it would be captured
            return !abs2.body().isFree(x) && alphaEquivalent(abs1.body(), abs2.body().swap(y, x));
        } else {
            return false;
        }
    }

    /**
     * Rename every binder to a canonical atom chosen by its nesting depth, avoiding the free atoms of t.
     * Alpha-equivalent terms have literally equal canonical forms.
     */
    public static Term canonicalize(Term t) {
        return canonicalize(t, 0, new CanonicalAtoms(t.freeVars()));
    }

    private static Term canonicalize(Term t, int depth, CanonicalAtoms canonical) {
        if (t instanceof Abs abs) {
            Atom c = canonical.atDepth(depth);
            return new Abs(c, canonicalize(abs.body().swap(abs.binder(), c), depth + 1, canonical));
        } else if (t instanceof App app) {
            return new App(canonicalize(app.left(), depth, canonical), canonicalize(app.right(), depth, canonical));
        }
        return t;
    }

    private static class CanonicalAtoms {
        private final AtomSupply supply = new AtomSupplies.Indexed(CANONICAL_PREFIX);
        private final Set<Atom> used;
        private final List<Atom> byDepth = new ArrayList<>();

        CanonicalAtoms(Set<Atom> freeAtoms) {
            this.used = new HashSet<>(freeAtoms);
        }

        Atom atDepth(int depth) {
            while (byDepth.size() <= depth) {
                Atom next = supply.fresh(used);
                used.add(next);
                byDepth.add(next);
            }
            return byDepth.get(depth);
        }
    }
}
