package by.radioegor146.cobfuscator.flatten;

/**
 * How the dispatch values of flattened cases are chosen.
 */
public enum CaseIdStyle {
    SEQUENTIAL("Sequential Integers"),
    RANDOM_INT("Random Integers"),
    ENUMERATOR("Random Enum Members");

    private final String description;

    CaseIdStyle(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
