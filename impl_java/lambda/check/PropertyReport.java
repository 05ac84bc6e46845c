package lambda.check;

import java.util.Optional;

public record PropertyReport(String name, int trials, int failures, Optional<Trial> counterexample) {
    public boolean passed() {
        return failures == 0;
    }

    @Override
    public String toString() {
        return String.format("PropertyReport[property=%s, trials=%d, failures=%d, passed=%b]",
                name, trials, failures, passed());
    }
}
