package lambda.check;

import lambda.term.Atom;
import lambda.term.Term;

/**
 * One random instance a property is checked against. t2 and t3 are often alpha-variants of t1.
 */
public record Trial(Term t1, Term t2, Term t3, Atom x, Atom y, Atom z) {
    @Override
    public String toString() {
        return String.format("Trial[t1=%s, t2=%s, t3=%s, x=%s, y=%s, z=%s]", t1, t2, t3, x, y, z);
    }
}
