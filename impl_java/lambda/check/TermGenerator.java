package lambda.check;

import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;
import lambda.term.Abs;
import lambda.term.App;
import lambda.term.Atom;
import lambda.term.Term;
import lambda.term.Var;

/**
 * Random finite terms over a small atom pool. A small pool makes shadowing and name clashes common.
 */
public class TermGenerator {
    private final List<Atom> pool;
    private final int maxDepth;
    private final Random random;

    public TermGenerator(List<Atom> pool, int maxDepth, Random random) {
        if (pool.isEmpty()) {
            throw new IllegalArgumentException("Atom pool must not be empty");
        }
        this.pool = List.copyOf(pool);
        this.maxDepth = Math.max(0, maxDepth);
        this.random = random;
    }

    public static List<Atom> atomPool(int size) {
        return IntStream.range(0, size)
                .mapToObj(i -> Atom.of(String.valueOf((char) ('a' + i % 26)) + (i < 26 ? "" : i / 26)))
                .toList();
    }

    public Atom atom() {
        return pool.get(random.nextInt(pool.size()));
    }

    public Term term() {
        return term(maxDepth);
    }

    private Term term(int depth) {
        if (depth == 0) return new Var(atom());
        return switch (random.nextInt(3)) {
            case 0 -> new Var(atom());
            case 1 -> new Abs(atom(), term(depth - 1));
            default -> new App(term(depth - 1), term(depth - 1));
        };
    }

    /**
     * Rename binders of t at random, only where the new name is not free under the binder.
     * The result is alpha-equivalent to t.
     */
    public Term alphaVariant(Term t) {
        if (t instanceof Abs abs) {
            Atom candidate = atom();
            if (candidate.equals(abs.binder()) || abs.body().isFree(candidate)) {
                return new Abs(abs.binder(), alphaVariant(abs.body()));
            }
            return new Abs(candidate, alphaVariant(abs.body().swap(abs.binder(), candidate)));
        } else if (t instanceof App app) {
            return new App(alphaVariant(app.left()), alphaVariant(app.right()));
        }
        return t;
    }

    public Trial trial() {
        Term t1 = term();
        Term t2 = random.nextBoolean() ? alphaVariant(t1) : term();
        Term t3 = random.nextBoolean() ? alphaVariant(t2) : term();
        return new Trial(t1, t2, t3, atom(), atom(), atom());
    }
}
