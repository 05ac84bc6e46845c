package lambda.term;

import java.util.Set;

import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class TestTerm {
    private final Atom x = Atom.of("x");
    private final Atom y = Atom.of("y");
    private final Atom z = Atom.of("z");

    @Test
    public void swapRenamesBindersAndVariables() {
        Term t = new Abs(x, new App(new Var(x), new Var(y)));
        Term swapped = t.swap(x, y);
        Assert.assertEquals(new Abs(y, new App(new Var(y), new Var(x))), swapped);
    }

    @Test
    public void swapLeavesOtherAtomsAlone() {
        Term t = new Abs(z, new Var(z));
        Assert.assertEquals(t, t.swap(x, y));
    }

    @Test
    public void swapIsInvolutiveAndSymmetric() {
        Term t = Term.app(Term.abs("x", Term.var("y")), Term.var("x"), Term.abs("y", Term.var("z")));
        Assert.assertEquals(t, Term.swap(x, y, Term.swap(x, y, t)));
        Assert.assertEquals(Term.swap(x, y, t), Term.swap(y, x, t));
        Assert.assertEquals(t, Term.swap(x, x, t));
        Assert.assertEquals(Term.size(t), Term.size(Term.swap(x, z, t)));
    }

    @Test
    public void freeVarsRemovesBinder() {
        Term t = new App(new Abs(x, new App(new Var(x), new Var(y))), new Var(x));
        Assert.assertEquals(Set.of(x, y), Term.freeVariables(t));
        Assert.assertEquals(Set.of(y), new Abs(x, new App(new Var(x), new Var(y))).freeVars());
        Assert.assertTrue(new Abs(x, new Var(x)).freeVars().isEmpty());
    }

    @Test
    public void shadowedBinderKeepsInnerOccurrenceBound() {
        Term t = new Abs(x, new Abs(x, new Var(x)));
        Assert.assertFalse(t.isFree(x));
        Assert.assertEquals(Set.of(x), t.atoms());
    }

    @Test
    public void atomsIncludeBinders() {
        Term t = new Abs(z, new Var(y));
        Assert.assertEquals(Set.of(y, z), t.atoms());
        Assert.assertEquals(Set.of(y), t.freeVars());
    }

    @Test
    public void sizeCountsNodes() {
        Assert.assertEquals(1, new Var(x).size());
        Assert.assertEquals(2, new Abs(x, new Var(x)).size());
        Assert.assertEquals(5, new App(new Abs(x, new Var(x)), new Abs(y, new Var(x))).size());
    }

    @Test
    public void appBuilderAssociatesLeft() {
        Term t = Term.app(Term.var("f"), Term.var("a"), Term.var("b"));
        Assert.assertEquals(new App(new App(Term.var("f"), Term.var("a")), Term.var("b")), t);
        Assert.assertEquals(Term.var("f"), Term.app(Term.var("f")));
    }

    @Test
    public void toStringIsReadable() {
        Term t = new Abs(x, new App(new Var(x), new Var(y)));
        Assert.assertEquals("λx.(x y)", t.toString());
    }

    @Test(expected = NullPointerException.class)
    public void absRejectsNullBody() {
        new Abs(x, null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void atomRejectsEmptyName() {
        Atom.of("");
    }

    @Test
    public void atomsOrderByLengthThenName() {
        Assert.assertTrue(Atom.of("a9").compareTo(Atom.of("a10")) < 0);
        Assert.assertTrue(Atom.of("b").compareTo(Atom.of("a")) > 0);
        Assert.assertEquals(0, Atom.of("x").compareTo(x));
    }

    @Test
    public void atomSwap() {
        Assert.assertEquals(y, x.swap(x, y));
        Assert.assertEquals(x, y.swap(x, y));
        Assert.assertEquals(z, z.swap(x, y));
    }
}
