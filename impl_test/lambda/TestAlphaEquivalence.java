package lambda;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import lambda.check.TermGenerator;
import lambda.check.Trial;
import lambda.term.Abs;
import lambda.term.App;
import lambda.term.Atom;
import lambda.term.Term;
import lambda.term.Var;

import static lambda.AlphaEquivalence.alphaEquivalent;
import static lambda.AlphaEquivalence.canonicalize;

@RunWith(JUnit4.class)
public class TestAlphaEquivalence {
    private static final int TRIALS = 2000;

    private final Atom x = Atom.of("x");
    private final Atom y = Atom.of("y");
    private final Atom z = Atom.of("z");

    private static List<Trial> randomTrials() {
        List<Trial> trials = new ArrayList<>(TRIALS);
        List<Atom> pool = TermGenerator.atomPool(3);
        for (int i = 0; i < TRIALS; i++) {
            trials.add(new TermGenerator(pool, 5, new Random(i)).trial());
        }
        return trials;
    }

    @Test
    public void identityFunctionsWithDistinctBindersAreEquivalent() {
        Assert.assertTrue(alphaEquivalent(new Abs(x, new Var(x)), new Abs(y, new Var(y))));
    }

    @Test
    public void boundAndFreeOccurrenceAreNotEquivalent() {
        Assert.assertFalse(alphaEquivalent(new Abs(x, new Var(x)), new Abs(x, new Var(y))));
    }

    @Test
    public void renamingMustNotCaptureFreeAtom() {
        // λx.y and λy.y: renaming y to x on the right would need x free there
        Assert.assertFalse(alphaEquivalent(new Abs(x, new Var(y)), new Abs(y, new Var(y))));
        Assert.assertFalse(alphaEquivalent(new Abs(y, new Var(y)), new Abs(x, new Var(y))));
    }

    @Test
    public void nestedBindersSwapConsistently() {
        Term left = new Abs(x, new Abs(y, new App(new Var(x), new Var(y))));
        Term right = new Abs(y, new Abs(x, new App(new Var(y), new Var(x))));
        Assert.assertTrue(alphaEquivalent(left, right));
        Term flipped = new Abs(y, new Abs(x, new App(new Var(x), new Var(y))));
        Assert.assertFalse(alphaEquivalent(left, flipped));
    }

    @Test
    public void shadowingIsRespected() {
        Term left = new Abs(x, new Abs(x, new Var(x)));
        Term right = new Abs(y, new Abs(z, new Var(z)));
        Term wrong = new Abs(y, new Abs(z, new Var(y)));
        Assert.assertTrue(alphaEquivalent(left, right));
        Assert.assertFalse(alphaEquivalent(left, wrong));
    }

    @Test
    public void differentConstructorsAreNotEquivalent() {
        Assert.assertFalse(alphaEquivalent(new Var(x), new Abs(x, new Var(x))));
        Assert.assertFalse(alphaEquivalent(new App(new Var(x), new Var(x)), new Var(x)));
        Assert.assertFalse(alphaEquivalent(new Var(x), new Var(y)));
    }

    @Test
    public void reflexive() {
        for (Trial trial : randomTrials()) {
            Assert.assertTrue(trial.toString(), alphaEquivalent(trial.t1(), trial.t1()));
        }
    }

    @Test
    public void symmetric() {
        for (Trial trial : randomTrials()) {
            Assert.assertEquals(trial.toString(),
                    alphaEquivalent(trial.t1(), trial.t2()), alphaEquivalent(trial.t2(), trial.t1()));
        }
    }

    @Test
    public void transitive() {
        int chains = 0;
        for (Trial trial : randomTrials()) {
            if (!alphaEquivalent(trial.t1(), trial.t2()) || !alphaEquivalent(trial.t2(), trial.t3())) continue;
            chains++;
            Assert.assertTrue(trial.toString(), alphaEquivalent(trial.t1(), trial.t3()));
        }
        Assert.assertTrue(chains > 0);
    }

    @Test
    public void equivariant() {
        for (Trial trial : randomTrials()) {
            if (!alphaEquivalent(trial.t1(), trial.t2())) continue;
            Assert.assertTrue(trial.toString(), alphaEquivalent(
                    trial.t1().swap(trial.x(), trial.y()), trial.t2().swap(trial.x(), trial.y())));
        }
    }

    @Test
    public void alphaVariantsAreEquivalent() {
        List<Atom> pool = TermGenerator.atomPool(4);
        for (int i = 0; i < TRIALS; i++) {
            var generator = new TermGenerator(pool, 6, new Random(i));
            Term t = generator.term();
            Assert.assertTrue(t.toString(), alphaEquivalent(t, generator.alphaVariant(t)));
        }
    }

    @Test
    public void canonicalFormRenamesByDepth() {
        Term t = new Abs(x, new Abs(x, new App(new Var(x), new Var(y))));
        Term expected = new Abs(Atom.of("#0"), new Abs(Atom.of("#1"), new App(new Var(Atom.of("#1")), new Var(y))));
        Assert.assertEquals(expected, canonicalize(t));
    }

    @Test
    public void canonicalFormAvoidsFreeAtoms() {
        Term t = new Abs(x, new App(new Var(x), new Var(Atom.of("#0"))));
        Term expected = new Abs(Atom.of("#1"), new App(new Var(Atom.of("#1")), new Var(Atom.of("#0"))));
        Assert.assertEquals(expected, canonicalize(t));
    }

    @Test
    public void canonicalFormAgreesWithDecisionProcedure() {
        for (Trial trial : randomTrials()) {
            boolean sameCanonical = canonicalize(trial.t1()).equals(canonicalize(trial.t2()));
            Assert.assertEquals(trial.toString(), alphaEquivalent(trial.t1(), trial.t2()), sameCanonical);
        }
    }

    @Test
    public void alphaKeysCollapseEquivalentTerms() {
        Set<AlphaKey> keys = new HashSet<>();
        keys.add(new AlphaKey(new Abs(x, new Var(x))));
        keys.add(new AlphaKey(new Abs(y, new Var(y))));
        keys.add(new AlphaKey(new Abs(x, new Var(y))));
        Assert.assertEquals(2, keys.size());
        Assert.assertTrue(keys.contains(new AlphaKey(new Abs(z, new Var(z)))));
        Assert.assertFalse(keys.contains(new AlphaKey(new Abs(z, new Var(x)))));
    }
}
