package lambda.check;

public interface Property {
    String getName();

    boolean check(Trial trial);
}
