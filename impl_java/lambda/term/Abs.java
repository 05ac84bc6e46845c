package lambda.term;

import java.util.Objects;
import java.util.Set;

public record Abs(Atom binder, Term body) implements Term {
    public Abs {
        Objects.requireNonNull(binder, "binder");
        Objects.requireNonNull(body, "body");
    }

    @Override
    public Term swap(Atom x, Atom y) {
        return new Abs(binder.swap(x, y), body.swap(x, y));
    }

    @Override
    public Set<Atom> freeVars() {
        Set<Atom> out = body.freeVars();
        out.remove(binder);
        return out;
    }

    @Override
    public Set<Atom> atoms() {
        Set<Atom> out = body.atoms();
        out.add(binder);
        return out;
    }

    @Override
    public int size() {
        return 1 + body.size();
    }

    @Override
    public String toString() {
        return String.format("λ%s.%s", binder, body);
    }
}
