package lambda.term;

import java.util.Objects;
import java.util.Set;

public sealed interface Term permits Var, Abs, App {

    /**
     * Exchange every occurrence of x and y, binders included. Binding structure is not consulted.
     *
     * @return a new term of the same size
     */
    Term swap(Atom x, Atom y);

    /**
     * Get a set of the atoms occurring unbound in the term
     * @return a fresh mutable set of free atoms
     */
    Set<Atom> freeVars();

    /**
     * Get every atom occurring in the term, in binder or variable position.
     */
    Set<Atom> atoms();

    /**
     * Number of nodes, always at least 1.
     */
    int size();

    default boolean isFree(Atom x) {
        return freeVars().contains(x);
    }

    static Term swap(Atom x, Atom y, Term t) {
        return t.swap(x, y);
    }

    static Set<Atom> freeVariables(Term t) {
        return t.freeVars();
    }

    static int size(Term t) {
        return t.size();
    }

    static Var var(String name) {
        return new Var(Atom.of(name));
    }

    static Abs abs(String binder, Term body) {
        return new Abs(Atom.of(binder), body);
    }

    /**
     * Left-associated application spine: app(f, a, b) is ((f a) b).
     */
    static Term app(Term head, Term... args) {
        Objects.requireNonNull(head, "head");
        Term out = head;
        for (Term arg : args) {
            out = new App(out, arg);
        }
        return out;
    }
}
