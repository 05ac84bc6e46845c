package lambda;

import lambda.term.Term;

/**
 * Hash key identifying a term up to alpha-equivalence.
 */
public final class AlphaKey {
    private final Term term;
    private final Term canonical;

    public AlphaKey(Term term) {
        this.term = term;
        this.canonical = AlphaEquivalence.canonicalize(term);
    }

    public Term term() {
        return term;
    }

    public Term canonical() {
        return canonical;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (!(obj instanceof AlphaKey other)) return false;
        return canonical.equals(other.canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    @Override
    public String toString() {
        return term.toString();
    }
}
