package lambda.check;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lambda.term.Atom;

/**
 * Checks properties against random trials on a fixed worker pool. Trial i of a run is always generated
 * from seed + i, so a report is reproducible regardless of the number of workers.
 */
public class PropertyChecker implements AutoCloseable {
    private final ExecutorService executor;
    private final int poolSize;
    private final List<Atom> atomPool;
    private final int maxDepth;

    public PropertyChecker(int poolSize, List<Atom> atomPool, int maxDepth) {
        this.poolSize = Math.max(1, poolSize);
        this.atomPool = List.copyOf(atomPool);
        this.maxDepth = maxDepth;
        this.executor = Executors.newFixedThreadPool(this.poolSize);
    }

    public List<PropertyReport> check(List<Property> properties, int trials, long seed) {
        List<PropertyReport> reports = new ArrayList<>(properties.size());
        for (final var property : properties) {
            reports.add(check(property, trials, seed));
        }
        return reports;
    }

    public PropertyReport check(Property property, int trials, long seed) {
        int chunkSize = Math.max(1, (trials + poolSize - 1) / poolSize);
        var futures = new ArrayList<CompletableFuture<ChunkResult>>();
        for (int start = 0; start < trials; start += chunkSize) {
            final int from = start;
            final int to = Math.min(trials, start + chunkSize);
            futures.add(CompletableFuture.supplyAsync(() -> runChunk(property, from, to, seed), executor));
        }
        int failures = 0;
        Trial counterexample = null;
        for (var future : futures) {
            try {
                var chunk = future.get();
                failures += chunk.failures();
                if (counterexample == null) {
                    counterexample = chunk.counterexample();
                }
            } catch (Exception e) {
                System.err.println("Error while checking " + property.getName());
                System.err.println(e.getMessage());
                failures++;
            }
        }
        return new PropertyReport(property.getName(), trials, failures, Optional.ofNullable(counterexample));
    }

    private ChunkResult runChunk(Property property, int from, int to, long seed) {
        int failures = 0;
        Trial counterexample = null;
        for (int i = from; i < to; i++) {
            var generator = new TermGenerator(atomPool, maxDepth, new Random(seed + i));
            var trial = generator.trial();
            if (property.check(trial)) continue;
            failures++;
            if (counterexample == null) counterexample = trial;
        }
        return new ChunkResult(failures, counterexample);
    }

    @Override
    public void close() {
        executor.shutdown();
    }

    private record ChunkResult(int failures, Trial counterexample) {}
}
