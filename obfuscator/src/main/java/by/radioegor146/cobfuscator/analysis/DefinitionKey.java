package by.radioegor146.cobfuscator.analysis;

/**
 * A definition: the arena index of the defining statement and the identifier it defines.
 * Keys are only meaningful for the {@link IdentifierAnalyzer} run that produced them.
 */
public final class DefinitionKey {

    private final int stmtIndex;
    private final Identifier identifier;

    DefinitionKey(int stmtIndex, Identifier identifier) {
        this.stmtIndex = stmtIndex;
        this.identifier = identifier;
    }

    public int getStmtIndex() {
        return stmtIndex;
    }

    public Identifier getIdentifier() {
        return identifier;
    }

    DefinitionKey renamed(String newName) {
        return new DefinitionKey(stmtIndex, identifier.withName(newName));
    }

    DefinitionKey withIdentifier(Identifier newIdentifier) {
        return new DefinitionKey(stmtIndex, newIdentifier);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DefinitionKey)) {
            return false;
        }
        DefinitionKey that = (DefinitionKey) o;
        return stmtIndex == that.stmtIndex && identifier.equals(that.identifier);
    }

    @Override
    public int hashCode() {
        return 31 * stmtIndex + identifier.hashCode();
    }

    @Override
    public String toString() {
        return identifier + "@" + stmtIndex;
    }
}
