import java.util.List;
import lambda.Substitution;
import lambda.check.Properties;
import lambda.check.PropertyChecker;
import lambda.check.PropertyReport;
import lambda.check.TermGenerator;

public class Main {

    public static void main(String[] args) {

        int trials = parseArg(args, 0, "number of trials", 500, 1);
        int poolSize = parseArg(args, 1, "pool size", 4, 1);
        int atoms = parseArg(args, 2, "number of atoms", 4, 1);
        int depth = parseArg(args, 3, "maximum term depth", 5, 0);
        long seed = parseArg(args, 4, "seed", 42, Integer.MIN_VALUE);

        System.out.printf("Checking %d trials per property with %d workers over %d atoms, depth %d, seed %d%n",
                trials, poolSize, atoms, depth, seed);

        final List<PropertyReport> reports;
        try (var checker = new PropertyChecker(poolSize, TermGenerator.atomPool(atoms), depth)) {
            reports = checker.check(Properties.all(Substitution.DEFAULT), trials, seed);
        }

        boolean allPassed = true;
        for (final var report : reports) {
            System.out.println(report);
            if (report.passed()) continue;
            allPassed = false;
            report.counterexample().ifPresent(trial -> System.out.println("  counterexample: " + trial));
        }
        System.out.println("---------------------------------------------------");
        System.out.println(allPassed ? "All properties hold" : "Some properties failed");
        if (!allPassed) {
            System.exit(1);
        }
    }

    private static int parseArg(String[] args, int index, String description, int defaultValue, int minimum) {
        if (args.length <= index) return defaultValue;
        try {
            int value = Integer.parseInt(args[index]);
            if (value >= minimum) return value;
            System.err.printf("Argument %d (%s) must be at least %d. Using default of %d.%n", index + 1, description, minimum, defaultValue);
        } catch (NumberFormatException e) {
            System.err.printf("Argument %d must be an integer representing the %s. Using default of %d.%n", index + 1, description, defaultValue);
        }
        return defaultValue;
    }
}
