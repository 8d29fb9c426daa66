package by.radioegor146.cobfuscator.transform;

import com.google.gson.JsonObject;

/**
 * Passes the source through unchanged.
 */
public class IdentityUnit extends ObfuscationUnit {

    public static final String NAME = "Identity";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Does nothing - returns the same code entered.";
    }

    @Override
    public CSource transform(CSource source) {
        return source;
    }

    @Override
    protected void writeOptions(JsonObject json) {
    }

    static IdentityUnit fromJson(JsonObject json) {
        return new IdentityUnit();
    }

    @Override
    public String toString() {
        return "Identity()";
    }
}
