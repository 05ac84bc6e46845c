package lambda;

import java.util.Set;
import lambda.term.Atom;

public interface AtomSupply {
    /**
     * Get an atom outside the excluded set.
     *
     * @param excluded atoms the result must avoid
     * @return an atom not contained in excluded
     * @throws AtomSupplyExhaustedException if the supply draws from a finite domain that excluded covers
     */
    Atom fresh(Set<Atom> excluded);

    String getName();
}
