package by.radioegor146.cobfuscator.opaque;

/**
 * Shape of the construct an inserted predicate builds around the target code.
 */
public enum InsertionKind {
    CHECK("if (true predicate) { YOUR CODE }"),
    FALSE("if (false predicate) { buggy code }"),
    ELSE("if (false predicate) { buggy code } else { YOUR CODE }"),
    IF_ELSE("if (true predicate) { YOUR CODE } else { buggy code }"),
    WHILE_FALSE("while (false predicate) { buggy code }"),
    DO_WHILE("do { YOUR CODE } while (false predicate)"),
    EITHER("if (any predicate) { YOUR CODE } else { YOUR CODE }");

    private final String description;

    InsertionKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
