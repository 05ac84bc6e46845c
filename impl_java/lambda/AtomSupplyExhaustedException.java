package lambda;

import java.util.Set;
import lambda.term.Atom;

/**
 * Raised by a bounded atom supply when every atom it can produce is excluded.
 */
public class AtomSupplyExhaustedException extends RuntimeException {
    private final String supplyName;

    public AtomSupplyExhaustedException(String supplyName, Set<Atom> excluded) {
        super(String.format("Atom supply %s has no atom outside %d excluded atoms", supplyName, excluded.size()));
        this.supplyName = supplyName;
    }

    public String getSupplyName() {
        return supplyName;
    }
}
