package lambda;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import lambda.term.Atom;

public class AtomSupplies {

    public static final String DEFAULT_PREFIX = "_v";

    public static AtomSupply defaultSupply() {
        return new Indexed(DEFAULT_PREFIX);
    }

    /**
     * Stateless: prefix followed by the smallest index whose atom is not excluded.
     * The same excluded set always yields the same atom.
     */
    public static class Indexed implements AtomSupply {
        private final String prefix;

        public Indexed(String prefix) {
            this.prefix = Objects.requireNonNull(prefix, "prefix");
        }

        @Override
        public Atom fresh(Set<Atom> excluded) {
            // At most excluded.size() candidates can be rejected
            for (long n = 0; ; n++) {
                Atom candidate = new Atom(prefix + n);
                if (!excluded.contains(candidate)) return candidate;
            }
        }

        @Override
        public String getName() {
            return "Indexed(" + prefix + ")";
        }
    }

    /**
     * Hands out every atom at most once across calls.
     */
    public static class Sequential implements AtomSupply {
        private final String prefix;
        private long next = 0;

        public Sequential(String prefix) {
            this.prefix = Objects.requireNonNull(prefix, "prefix");
        }

        @Override
        public Atom fresh(Set<Atom> excluded) {
            synchronized (this) {
                while (true) {
                    Atom candidate = new Atom(prefix + next);
                    ++next;
                    if (!excluded.contains(candidate)) return candidate;
                }
            }
        }

        @Override
        public String getName() {
            return "Sequential(" + prefix + ")";
        }
    }

    /**
     * A finite atom domain. Running out is a configuration error, reported as
     * {@link AtomSupplyExhaustedException}.
     */
    public static class Pool implements AtomSupply {
        private final List<Atom> atoms;

        public Pool(List<Atom> atoms) {
            if (atoms.isEmpty()) {
                throw new IllegalArgumentException("Atom pool must not be empty");
            }
            this.atoms = List.copyOf(atoms);
        }

        public static Pool of(String... names) {
            return new Pool(Arrays.stream(names).map(Atom::of).toList());
        }

        @Override
        public Atom fresh(Set<Atom> excluded) {
            for (Atom candidate : atoms) {
                if (!excluded.contains(candidate)) return candidate;
            }
            throw new AtomSupplyExhaustedException(getName(), excluded);
        }

        @Override
        public String getName() {
            return "Pool" + atoms;
        }
    }
}
