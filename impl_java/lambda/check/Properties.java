package lambda.check;

import java.util.List;
import java.util.Set;
import lambda.AlphaEquivalence;
import lambda.Substitution;
import lambda.term.Atom;
import lambda.term.Term;

import static lambda.AlphaEquivalence.alphaEquivalent;

public class Properties {

    public static List<Property> all(Substitution substitution) {
        return List.of(
                new SwapIdentity(),
                new SwapSymmetry(),
                new SwapInvolution(),
                new SwapPreservesSize(),
                new SwapFreshness(),
                new SwapEquivariance(),
                new AlphaReflexive(),
                new AlphaSymmetric(),
                new AlphaTransitive(),
                new AlphaEquivariant(),
                new CanonicalFormAgreement(),
                new SubstitutionAvoidsCapture(substitution),
                new SubstitutionRespectsAlpha(substitution)
        );
    }

    public static class SwapIdentity implements Property {
        @Override
        public String getName() {
            return "swap(x, x, t) = t";
        }

        @Override
        public boolean check(Trial trial) {
            return trial.t1().swap(trial.x(), trial.x()).equals(trial.t1());
        }
    }

    public static class SwapSymmetry implements Property {
        @Override
        public String getName() {
            return "swap(x, y, t) = swap(y, x, t)";
        }

        @Override
        public boolean check(Trial trial) {
            return trial.t1().swap(trial.x(), trial.y()).equals(trial.t1().swap(trial.y(), trial.x()));
        }
    }

    public static class SwapInvolution implements Property {
        @Override
        public String getName() {
            return "swap(x, y, swap(x, y, t)) = t";
        }

        @Override
        public boolean check(Trial trial) {
            return trial.t1().swap(trial.x(), trial.y()).swap(trial.x(), trial.y()).equals(trial.t1());
        }
    }

    public static class SwapPreservesSize implements Property {
        @Override
        public String getName() {
            return "size(swap(x, y, t)) = size(t)";
        }

        @Override
        public boolean check(Trial trial) {
            return trial.t1().swap(trial.x(), trial.y()).size() == trial.t1().size();
        }
    }

    public static class SwapFreshness implements Property {
        @Override
        public String getName() {
            return "z not free in t => y not free in swap(y, z, t)";
        }

        @Override
        public boolean check(Trial trial) {
            if (trial.t1().isFree(trial.z())) return true;
            return !trial.t1().swap(trial.y(), trial.z()).isFree(trial.y());
        }
    }

    public static class SwapEquivariance implements Property {
        @Override
        public String getName() {
            return "swap(x, y, swap(y, z, t)) = swap((x y)y, (x y)z, swap(x, y, t))";
        }

        @Override
        public boolean check(Trial trial) {
            Atom x = trial.x();
            Atom y = trial.y();
            Atom z = trial.z();
            Term lhs = trial.t1().swap(y, z).swap(x, y);
            Term rhs = trial.t1().swap(x, y).swap(y.swap(x, y), z.swap(x, y));
            return lhs.equals(rhs);
        }
    }

    public static class AlphaReflexive implements Property {
        @Override
        public String getName() {
            return "t ~ t";
        }

        @Override
        public boolean check(Trial trial) {
            return alphaEquivalent(trial.t1(), trial.t1());
        }
    }

    public static class AlphaSymmetric implements Property {
        @Override
        public String getName() {
            return "t1 ~ t2 <=> t2 ~ t1";
        }

        @Override
        public boolean check(Trial trial) {
            return alphaEquivalent(trial.t1(), trial.t2()) == alphaEquivalent(trial.t2(), trial.t1());
        }
    }

    public static class AlphaTransitive implements Property {
        @Override
        public String getName() {
            return "t1 ~ t2 and t2 ~ t3 => t1 ~ t3";
        }

        @Override
        public boolean check(Trial trial) {
            if (!alphaEquivalent(trial.t1(), trial.t2()) || !alphaEquivalent(trial.t2(), trial.t3())) return true;
            return alphaEquivalent(trial.t1(), trial.t3());
        }
    }

    public static class AlphaEquivariant implements Property {
        @Override
        public String getName() {
            return "t1 ~ t2 => swap(x, y, t1) ~ swap(x, y, t2)";
        }

        @Override
        public boolean check(Trial trial) {
            if (!alphaEquivalent(trial.t1(), trial.t2())) return true;
            return alphaEquivalent(trial.t1().swap(trial.x(), trial.y()), trial.t2().swap(trial.x(), trial.y()));
        }
    }

    public static class CanonicalFormAgreement implements Property {
        @Override
        public String getName() {
            return "t1 ~ t2 <=> canonical(t1) = canonical(t2)";
        }

        @Override
        public boolean check(Trial trial) {
            boolean sameCanonical = AlphaEquivalence.canonicalize(trial.t1())
                    .equals(AlphaEquivalence.canonicalize(trial.t2()));
            return alphaEquivalent(trial.t1(), trial.t2()) == sameCanonical;
        }
    }

    /**
     * fv(t[x := u]) is fv(t) without x, plus fv(u) when x was free in t. A captured atom of u would be missing.
     */
    public static class SubstitutionAvoidsCapture implements Property {
        private final Substitution substitution;

        public SubstitutionAvoidsCapture(Substitution substitution) {
            this.substitution = substitution;
        }

        @Override
        public String getName() {
            return "fv(t[x := u]) = (fv(t) - x) + fv(u) if x in fv(t)";
        }

        @Override
        public boolean check(Trial trial) {
            Term t = trial.t1();
            Term u = trial.t3();
            Set<Atom> expected = t.freeVars();
            boolean occurs = expected.remove(trial.x());
            if (occurs) expected.addAll(u.freeVars());
            Term result = substitution.substitute(t, u, trial.x());
            if (!occurs && !alphaEquivalent(result, t)) return false;
            return result.freeVars().equals(expected);
        }
    }

    public static class SubstitutionRespectsAlpha implements Property {
        private final Substitution substitution;

        public SubstitutionRespectsAlpha(Substitution substitution) {
            this.substitution = substitution;
        }

        @Override
        public String getName() {
            return "t1 ~ t2 => t1[x := u] ~ t2[x := u]";
        }

        @Override
        public boolean check(Trial trial) {
            if (!alphaEquivalent(trial.t1(), trial.t2())) return true;
            return alphaEquivalent(
                    substitution.substitute(trial.t1(), trial.t3(), trial.x()),
                    substitution.substitute(trial.t2(), trial.t3(), trial.x()));
        }
    }
}
