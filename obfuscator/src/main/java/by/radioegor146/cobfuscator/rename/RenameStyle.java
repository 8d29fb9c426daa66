package by.radioegor146.cobfuscator.rename;

/**
 * How replacement identifiers are spelled.
 */
public enum RenameStyle {
    COMPLETE_RANDOM("Complete Randomness"),
    ONLY_UNDERSCORES("Only underscores"),
    MINIMAL_LENGTH("Minimal length"),
    I_AND_L("Blocks of l's and I's");

    private final String description;

    RenameStyle(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
