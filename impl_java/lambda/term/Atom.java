package lambda.term;

public record Atom(String name) implements Comparable<Atom> {
    public Atom {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Atom name must be non-empty");
        }
    }

    public static Atom of(String name) {
        return new Atom(name);
    }

    /**
     * Shorter names first, then lexicographic, so generated names like a9 and a10 order numerically.
     */
    @Override
    public int compareTo(Atom other) {
        int compLength = Integer.compare(name.length(), other.name.length());
        if (compLength != 0) return compLength;
        return name.compareTo(other.name);
    }

    /**
     * The permutation (x y) applied to this atom.
     */
    public Atom swap(Atom x, Atom y) {
        if (this.equals(x)) return y;
        if (this.equals(y)) return x;
        return this;
    }

    @Override
    public String toString() {
        return name;
    }
}
