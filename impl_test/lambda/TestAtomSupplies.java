package lambda;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.Assert;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import lambda.term.Atom;

@RunWith(JUnit4.class)
public class TestAtomSupplies {

    @Test
    public void indexedPicksSmallestUnexcludedIndex() {
        AtomSupply supply = new AtomSupplies.Indexed("_v");
        Assert.assertEquals(Atom.of("_v0"), supply.fresh(Set.of()));
        Assert.assertEquals(Atom.of("_v2"), supply.fresh(Set.of(Atom.of("_v0"), Atom.of("_v1"), Atom.of("x"))));
    }

    @Test
    public void indexedIsDeterministic() {
        AtomSupply supply = AtomSupplies.defaultSupply();
        Set<Atom> excluded = Set.of(Atom.of("_v0"));
        Assert.assertEquals(supply.fresh(excluded), supply.fresh(excluded));
    }

    @Test
    public void sequentialNeverRepeats() {
        AtomSupply supply = new AtomSupplies.Sequential("s");
        Assert.assertEquals(Atom.of("s0"), supply.fresh(Set.of()));
        Assert.assertEquals(Atom.of("s2"), supply.fresh(Set.of(Atom.of("s1"))));
        Assert.assertEquals(Atom.of("s3"), supply.fresh(Set.of()));
    }

    @Test
    public void sequentialIsSafeAcrossThreads() throws Exception {
        AtomSupply supply = new AtomSupplies.Sequential("s");
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<Atom>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(executor.submit(() -> supply.fresh(Set.of())));
            }
            Set<Atom> seen = new HashSet<>();
            for (Future<Atom> future : futures) {
                Assert.assertTrue(seen.add(future.get()));
            }
        } finally {
            executor.shutdown();
        }
    }

    @Test
    public void poolReturnsFirstAvailableAtom() {
        AtomSupply supply = AtomSupplies.Pool.of("p", "q", "r");
        Assert.assertEquals(Atom.of("q"), supply.fresh(Set.of(Atom.of("p"))));
    }

    @Test
    public void exhaustedPoolThrows() {
        AtomSupply supply = AtomSupplies.Pool.of("p", "q");
        try {
            supply.fresh(Set.of(Atom.of("p"), Atom.of("q")));
            Assert.fail("expected AtomSupplyExhaustedException");
        } catch (AtomSupplyExhaustedException e) {
            Assert.assertEquals(supply.getName(), e.getSupplyName());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyPoolIsRejected() {
        new AtomSupplies.Pool(List.of());
    }
}
