package lambda.check;

import java.util.HashSet;
import java.util.List;
import java.util.Random;

import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import lambda.AlphaEquivalence;
import lambda.AtomSupplies;
import lambda.Substitution;
import lambda.term.Term;

@RunWith(JUnit4.class)
public class TestPropertyChecker {

    private static class LiteralEquality implements Property {
        @Override
        public String getName() {
            return "t1 ~ t2 => t1 = t2";
        }

        @Override
        public boolean check(Trial trial) {
            return !AlphaEquivalence.alphaEquivalent(trial.t1(), trial.t2()) || trial.t1().equals(trial.t2());
        }
    }

    private static class Never implements Property {
        @Override
        public String getName() {
            return "never";
        }

        @Override
        public boolean check(Trial trial) {
            return false;
        }
    }

    @Test
    public void allPropertiesHold() {
        try (var checker = new PropertyChecker(4, TermGenerator.atomPool(4), 5)) {
            for (var report : checker.check(Properties.all(Substitution.DEFAULT), 300, 7)) {
                Assert.assertTrue(report.toString() + " " + report.counterexample(), report.passed());
                Assert.assertEquals(300, report.trials());
            }
        }
    }

    @Test
    public void allPropertiesHoldWithSequentialSupply() {
        var substitution = new Substitution(new AtomSupplies.Sequential("_s"));
        try (var checker = new PropertyChecker(3, TermGenerator.atomPool(3), 4)) {
            for (var report : checker.check(Properties.all(substitution), 200, 11)) {
                Assert.assertTrue(report.toString(), report.passed());
            }
        }
    }

    @Test
    public void failingPropertyReportsCounterexample() {
        try (var checker = new PropertyChecker(2, TermGenerator.atomPool(3), 3)) {
            var report = checker.check(new Never(), 50, 1);
            Assert.assertFalse(report.passed());
            Assert.assertEquals(50, report.failures());
            Assert.assertTrue(report.counterexample().isPresent());
        }
    }

    @Test
    public void reportsDoNotDependOnWorkerCount() {
        PropertyReport single;
        PropertyReport many;
        try (var checker = new PropertyChecker(1, TermGenerator.atomPool(4), 5)) {
            single = checker.check(new LiteralEquality(), 400, 3);
        }
        try (var checker = new PropertyChecker(5, TermGenerator.atomPool(4), 5)) {
            many = checker.check(new LiteralEquality(), 400, 3);
        }
        Assert.assertEquals(single, many);
        Assert.assertFalse(single.passed());
    }

    @Test
    public void generatorRespectsDepth() {
        var generator = new TermGenerator(TermGenerator.atomPool(2), 0, new Random(0));
        for (int i = 0; i < 20; i++) {
            Assert.assertEquals(1, generator.term().size());
        }
    }

    @Test
    public void atomPoolNamesAreDistinct() {
        Assert.assertEquals(30, new HashSet<>(TermGenerator.atomPool(30)).size());
        Assert.assertEquals(List.of("a", "b", "c"), TermGenerator.atomPool(3).stream().map(Object::toString).toList());
    }

    @Test
    public void trialTermsAreBounded() {
        var generator = new TermGenerator(TermGenerator.atomPool(3), 4, new Random(5));
        for (int i = 0; i < 100; i++) {
            Term t = generator.trial().t1();
            // A full binary tree of depth 4 has 31 nodes
            Assert.assertTrue(t.size() <= 31);
        }
    }
}
