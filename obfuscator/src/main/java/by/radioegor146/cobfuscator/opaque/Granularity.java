package by.radioegor146.cobfuscator.opaque;

/**
 * How much code an inserted predicate wraps.
 */
public enum Granularity {
    PROCEDURAL("Predicates are constructed on a whole function-level"),
    BLOCK("Predicates are constructed for random blocks of code (sequential statements)"),
    STMT("Predicates are constructed for random individual statements");

    private final String description;

    Granularity(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
