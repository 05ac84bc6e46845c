package lambda.term;

import java.util.Objects;
import java.util.Set;

public record App(Term left, Term right) implements Term {
    public App {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public Term swap(Atom x, Atom y) {
        return new App(left.swap(x, y), right.swap(x, y));
    }

    @Override
    public Set<Atom> freeVars() {
        Set<Atom> out = left.freeVars();
        out.addAll(right.freeVars());
        return out;
    }

    @Override
    public Set<Atom> atoms() {
        Set<Atom> out = left.atoms();
        out.addAll(right.atoms());
        return out;
    }

    @Override
    public int size() {
        return 1 + left.size() + right.size();
    }

    @Override
    public String toString() {
        return "(" + left + " " + right + ")";
    }
}
