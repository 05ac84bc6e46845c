package lambda;

import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import lambda.check.TermGenerator;
import lambda.term.Abs;
import lambda.term.App;
import lambda.term.Atom;
import lambda.term.Term;
import lambda.term.Var;

import static lambda.AlphaEquivalence.alphaEquivalent;

@RunWith(JUnit4.class)
public class TestSubstitution {
    private final Atom x = Atom.of("x");
    private final Atom y = Atom.of("y");
    private final Atom z = Atom.of("z");
    private final Substitution substitution = Substitution.DEFAULT;

    @Test
    public void replacesMatchingVariable() {
        Assert.assertEquals(new Var(y), substitution.substitute(new Var(x), new Var(y), x));
    }

    @Test
    public void leavesOtherVariable() {
        Assert.assertEquals(new Var(z), substitution.substitute(new Var(z), new Var(y), x));
    }

    @Test
    public void shadowedBinderIsUnchanged() {
        Term t = new Abs(x, new Var(x));
        Assert.assertEquals(t, substitution.substitute(t, new Var(y), x));
    }

    @Test
    public void freeAtomOfReplacementIsNotCaptured() {
        Term t = new Abs(z, new Var(x));
        Term result = substitution.substitute(t, new Var(z), x);
        Assert.assertNotEquals(new Abs(z, new Var(z)), result);
        Assert.assertTrue(alphaEquivalent(new Abs(Atom.of("w"), new Var(z)), result));
        Abs abs = (Abs) result;
        Assert.assertNotEquals(z, abs.binder());
        Assert.assertEquals(Set.of(z), result.freeVars());
    }

    @Test
    public void freshBinderIsNotTheSubstitutedAtom() {
        // The default supply would otherwise be free to pick x itself
        Substitution pool = new Substitution(AtomSupplies.Pool.of("x", "w"));
        Term t = new Abs(y, new Var(y));
        Term result = pool.substitute(t, new Var(z), x);
        Assert.assertEquals(new Abs(Atom.of("w"), new Var(Atom.of("w"))), result);
    }

    @Test
    public void substitutesUnderApplicationAndAbstraction() {
        Term t = new App(new Abs(y, new App(new Var(y), new Var(x))), new Var(x));
        Term u = new App(new Var(y), new Var(z));
        Term result = substitution.substitute(t, u, x);
        Term expected = new App(new Abs(Atom.of("w"), new App(new Var(Atom.of("w")), u)), u);
        Assert.assertTrue(result.toString(), alphaEquivalent(expected, result));
        Assert.assertEquals(Set.of(y, z), result.freeVars());
    }

    @Test
    public void untouchedWhenAtomIsNotFree() {
        Term t = new Abs(y, new App(new Var(y), new Var(z)));
        Term result = substitution.substitute(t, new Var(y), x);
        Assert.assertTrue(alphaEquivalent(t, result));
    }

    @Test
    public void inputsAreNotModified() {
        Term t = new Abs(y, new Var(x));
        Term u = new Var(y);
        Term tCopy = new Abs(y, new Var(x));
        substitution.substitute(t, u, x);
        Assert.assertEquals(tCopy, t);
        Assert.assertEquals(new Var(y), u);
    }

    @Test
    public void sequentialSupplyStillAvoidsCapture() {
        Substitution sequential = new Substitution(new AtomSupplies.Sequential("n"));
        Term t = new Abs(y, new Abs(z, new App(new Var(x), new App(new Var(y), new Var(z)))));
        Term result = sequential.substitute(t, new App(new Var(y), new Var(z)), x);
        Term expected = new Abs(Atom.of("p"), new Abs(Atom.of("q"),
                new App(new App(new Var(y), new Var(z)), new App(new Var(Atom.of("p")), new Var(Atom.of("q"))))));
        Assert.assertTrue(result.toString(), alphaEquivalent(expected, result));
    }

    @Test(expected = AtomSupplyExhaustedException.class)
    public void exhaustedSupplyFailsSubstitution() {
        Substitution pool = new Substitution(AtomSupplies.Pool.of("p"));
        pool.substitute(new Abs(y, new Var(x)), new Var(Atom.of("p")), x);
    }

    @Test
    public void freeVariablesOfResult() {
        List<Atom> pool = TermGenerator.atomPool(3);
        for (int i = 0; i < 2000; i++) {
            var generator = new TermGenerator(pool, 5, new Random(i));
            Term t = generator.term();
            Term u = generator.term();
            Atom target = generator.atom();
            Set<Atom> expected = t.freeVars();
            if (expected.remove(target)) expected.addAll(u.freeVars());
            Term result = substitution.substitute(t, u, target);
            Assert.assertEquals(t + " [" + target + " := " + u + "]", expected, result.freeVars());
        }
    }

    @Test
    public void respectsAlphaEquivalence() {
        List<Atom> pool = TermGenerator.atomPool(3);
        for (int i = 0; i < 2000; i++) {
            var generator = new TermGenerator(pool, 5, new Random(i));
            Term t = generator.term();
            Term variant = generator.alphaVariant(t);
            Term u = generator.term();
            Atom target = generator.atom();
            Assert.assertTrue(alphaEquivalent(substitution.substitute(t, u, target), substitution.substitute(variant, u, target)));
        }
    }

    @Test
    public void deepTermsTerminate() {
        Term t = new Var(x);
        for (int i = 0; i < 500; i++) {
            t = new Abs(Atom.of("b" + (i % 7)), new App(t, new Var(x)));
        }
        Term result = substitution.substitute(t, new Var(Atom.of("b0")), x);
        Assert.assertEquals(t.size(), result.size());
        Assert.assertEquals(Set.of(Atom.of("b0")), result.freeVars());
    }
}
