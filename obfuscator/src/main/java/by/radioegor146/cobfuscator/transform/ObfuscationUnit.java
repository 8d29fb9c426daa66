package by.radioegor146.cobfuscator.transform;

import com.google.gson.JsonObject;

/**
 * One step of an obfuscation {@link Pipeline}.
 * <p>
 * A unit is built from plain options and round-trips through a JSON record whose {@code type}
 * field is the unit's name. Returning null from {@link #transform(CSource)} stops the pipeline.
 */
public abstract class ObfuscationUnit {

    public abstract String getName();

    public abstract String getDescription();

    public abstract CSource transform(CSource source);

    /**
     * Adds the unit's options to its JSON record.
     */
    protected abstract void writeOptions(JsonObject json);

    public JsonObject toJsonObject() {
        JsonObject json = new JsonObject();
        json.addProperty("type", getName());
        writeOptions(json);
        return json;
    }

    public String toJson() {
        return toJsonObject().toString();
    }

    /**
     * Builds a unit from its JSON record.
     *
     * @throws by.radioegor146.cobfuscator.ObfuscationException when the record is malformed or names an unknown unit
     */
    public static ObfuscationUnit fromJson(String json) {
        return UnitRegistry.fromJson(json);
    }
}
