package by.radioegor146.cobfuscator.transform;

import by.radioegor146.cobfuscator.ObfuscationException;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Typed access to the options of a unit's JSON record. Every accessor fails with an
 * {@link ObfuscationException} that names the unit and the offending key.
 */
final class UnitOptions {

    private final String unit;
    private final JsonObject json;

    UnitOptions(String unit, JsonObject json) {
        this.unit = unit;
        this.json = json;
    }

    boolean getBoolean(String key) {
        JsonPrimitive value = primitive(key);
        if (!value.isBoolean()) {
            throw invalid(key, "is not a Boolean");
        }
        return value.getAsBoolean();
    }

    int getInt(String key, int min) {
        long value = getLong(key);
        if (value < min || value > Integer.MAX_VALUE) {
            throw invalid(key, "must be an integer >= " + min);
        }
        return (int) value;
    }

    double getProbability(String key) {
        JsonPrimitive value = primitive(key);
        if (!value.isNumber()) {
            throw invalid(key, "is not a number");
        }
        double probability = value.getAsDouble();
        if (probability < 0 || probability > 1) {
            throw invalid(key, "must be within [0, 1]");
        }
        return probability;
    }

    <E extends Enum<E>> E getEnum(String key, Class<E> type) {
        return parseEnum(key, primitive(key), type);
    }

    <E extends Enum<E>> List<E> getEnumList(String key, Class<E> type) {
        JsonElement element = require(key);
        if (!element.isJsonArray()) {
            throw invalid(key, "is not a list");
        }
        JsonArray array = element.getAsJsonArray();
        List<E> values = new ArrayList<>(array.size());
        for (JsonElement item : array) {
            if (!item.isJsonPrimitive()) {
                throw invalid(key, "contains " + item + " which is not a string");
            }
            values.add(parseEnum(key, item.getAsJsonPrimitive(), type));
        }
        return values;
    }

    private long getLong(String key) {
        JsonPrimitive value = primitive(key);
        if (!value.isNumber()) {
            throw invalid(key, "is not a number");
        }
        return exactLong(value.getAsBigDecimal(), key);
    }

    private long exactLong(BigDecimal value, String key) {
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            throw invalid(key, "is not a valid integer");
        }
    }

    private <E extends Enum<E>> E parseEnum(String key, JsonPrimitive value, Class<E> type) {
        if (!value.isString()) {
            throw invalid(key, "value " + value + " is not a string");
        }
        for (E constant : type.getEnumConstants()) {
            if (constant.name().equals(value.getAsString())) {
                return constant;
            }
        }
        throw invalid(key, "value '" + value.getAsString() + "' is not one of " + names(type));
    }

    private JsonPrimitive primitive(String key) {
        JsonElement element = require(key);
        if (!element.isJsonPrimitive()) {
            throw invalid(key, "is not a plain value");
        }
        return element.getAsJsonPrimitive();
    }

    private JsonElement require(String key) {
        JsonElement element = json.get(key);
        if (element == null || element.isJsonNull()) {
            throw ObfuscationException.invalidPipeline("failed to load " + unit + ": no '" + key + "' provided");
        }
        return element;
    }

    private ObfuscationException invalid(String key, String problem) {
        return ObfuscationException.invalidPipeline("failed to load " + unit + ": '" + key + "' " + problem);
    }

    static <E extends Enum<E>> List<String> names(Class<E> type) {
        List<String> names = new ArrayList<>();
        for (E constant : type.getEnumConstants()) {
            names.add(constant.name());
        }
        return names;
    }

    static <E extends Enum<E>> JsonArray toArray(Collection<E> values) {
        JsonArray array = new JsonArray();
        for (E value : values) {
            array.add(value.name());
        }
        return array;
    }
}
