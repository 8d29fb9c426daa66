package by.radioegor146.cobfuscator.transform;

import by.radioegor146.cobfuscator.ObfuscationException;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Maps the {@code type} of a unit's JSON record to the code that rebuilds the unit.
 */
public final class UnitRegistry {

    private static final Map<String, Function<JsonObject, ObfuscationUnit>> FACTORIES = new LinkedHashMap<>();

    static {
        FACTORIES.put(IdentityUnit.NAME, IdentityUnit::fromJson);
        FACTORIES.put(IdentifierRenameUnit.NAME, IdentifierRenameUnit::fromJson);
        FACTORIES.put(FuncArgumentRandomiseUnit.NAME, FuncArgumentRandomiseUnit::fromJson);
        FACTORIES.put(ArithmeticEncodeUnit.NAME, ArithmeticEncodeUnit::fromJson);
        FACTORIES.put(InsertOpaqueUnit.NAME, InsertOpaqueUnit::fromJson);
        FACTORIES.put(AugmentOpaqueUnit.NAME, AugmentOpaqueUnit::fromJson);
        FACTORIES.put(ControlFlowFlattenUnit.NAME, ControlFlowFlattenUnit::fromJson);
    }

    private UnitRegistry() {
    }

    public static List<String> getNames() {
        return new ArrayList<>(FACTORIES.keySet());
    }

    public static ObfuscationUnit fromJson(String json) {
        JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw ObfuscationException.invalidPipeline("transformation is not valid JSON: " + e.getMessage());
        }
        if (!element.isJsonObject()) {
            throw ObfuscationException.invalidPipeline("transformation is not a JSON object: " + json);
        }
        return fromJson(element.getAsJsonObject());
    }

    public static ObfuscationUnit fromJson(JsonObject json) {
        JsonElement type = json.get("type");
        if (type == null || !type.isJsonPrimitive() || !type.getAsJsonPrimitive().isString()) {
            throw ObfuscationException.invalidPipeline("transformation has no type");
        }
        Function<JsonObject, ObfuscationUnit> factory = FACTORIES.get(type.getAsString());
        if (factory == null) {
            throw ObfuscationException.invalidPipeline("transformation type '" + type.getAsString() + "' is invalid");
        }
        return factory.apply(json);
    }
}
