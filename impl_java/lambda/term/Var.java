package lambda.term;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

public record Var(Atom atom) implements Term {
    public Var {
        Objects.requireNonNull(atom, "atom");
    }

    @Override
    public Term swap(Atom x, Atom y) {
        return new Var(atom.swap(x, y));
    }

    @Override
    public Set<Atom> freeVars() {
        return new HashSet<>(Set.of(atom));
    }

    @Override
    public Set<Atom> atoms() {
        return new HashSet<>(Set.of(atom));
    }

    @Override
    public int size() {
        return 1;
    }

    @Override
    public String toString() {
        return atom.toString();
    }
}
