package by.radioegor146.cobfuscator.opaque;

/**
 * Where the variables fed into an opaque predicate come from.
 */
public enum OperandStyle {
    INPUT("Construct predicates from dynamic user input"),
    ENTROPY("Construct predicates from entropic variables");

    private final String description;

    OperandStyle(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
