package by.radioegor146.cobfuscator.transform;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.ObfuscationException;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered list of units applied one after another to a translation unit, optionally under
 * a fixed random seed.
 * <p>
 * Pipelines are saved as
 * <pre>
 * {"seed": 1234, "version": "v1.0.0", "transformations": ["{\"type\": ...}", ...]}
 * </pre>
 * where each transformation is the JSON record of one unit, stored as a string. Records given
 * as plain objects are accepted when loading.
 */
public class Pipeline {

    private static final Logger logger = LoggerFactory.getLogger(Pipeline.class);

    public static final String VERSION = "v1.0.0";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    private final Long seed;
    private final List<ObfuscationUnit> units;

    public Pipeline(Long seed, List<ObfuscationUnit> units) {
        this.seed = seed;
        this.units = new ArrayList<>(units);
    }

    public Long getSeed() {
        return seed;
    }

    public List<ObfuscationUnit> getUnits() {
        return Collections.unmodifiableList(units);
    }

    public void add(ObfuscationUnit unit) {
        units.add(unit);
    }

    public void add(int index, ObfuscationUnit unit) {
        units.add(index, unit);
    }

    /**
     * Runs every unit in order. The seed, if any, is applied once before the first unit.
     *
     * @return the final source, or null when a unit gave up
     */
    public CSource process(CSource source) {
        if (source == null) {
            return null;
        }
        if (seed != null) {
            FastRandom.setSeed(seed);
        }
        logger.info("Starting obfuscation of {} with {} transformations", source.getName(), units.size());
        CSource current = source;
        for (int i = 0; i < units.size(); i++) {
            ObfuscationUnit unit = units.get(i);
            logger.info("[{}/{}] {}", i + 1, units.size(), unit);
            current = unit.transform(current);
            if (current == null) {
                logger.warn("{} failed, stopping the pipeline", unit.getName());
                return null;
            }
        }
        logger.info("Obfuscation of {} finished", source.getName());
        return current;
    }

    public String toJson() {
        JsonObject json = new JsonObject();
        json.add("seed", seed == null ? JsonNull.INSTANCE : new JsonPrimitive(seed));
        json.addProperty("version", VERSION);
        JsonArray transformations = new JsonArray();
        for (ObfuscationUnit unit : units) {
            transformations.add(unit.toJson());
        }
        json.add("transformations", transformations);
        return GSON.toJson(json);
    }

    /**
     * Loads a pipeline saved by {@link #toJson()}.
     *
     * @throws ObfuscationException when the JSON is malformed, was saved by another version or
     *                              names a unit that does not exist
     */
    public static Pipeline fromJson(String text) {
        JsonElement element;
        try {
            element = JsonParser.parseString(text);
        } catch (JsonParseException e) {
            throw ObfuscationException.invalidPipeline("supplied information is not valid JSON: " + e.getMessage());
        }
        if (!element.isJsonObject()) {
            throw ObfuscationException.invalidPipeline("supplied JSON is not an object");
        }
        JsonObject json = element.getAsJsonObject();

        JsonElement version = json.get("version");
        if (version == null || version.isJsonNull()) {
            throw ObfuscationException.invalidPipeline("supplied JSON contains no version field");
        }
        if (!version.isJsonPrimitive() || !VERSION.equals(version.getAsString())) {
            throw ObfuscationException.invalidPipeline("version mismatch, file is of version " + version
                    + ", running version " + VERSION);
        }

        Long seed = readSeed(json.get("seed"));

        List<ObfuscationUnit> units = new ArrayList<>();
        JsonElement transformations = json.get("transformations");
        if (transformations != null && !transformations.isJsonNull()) {
            if (!transformations.isJsonArray()) {
                throw ObfuscationException.invalidPipeline("supplied transformations are not a list");
            }
            for (JsonElement transformation : transformations.getAsJsonArray()) {
                if (transformation.isJsonObject()) {
                    units.add(UnitRegistry.fromJson(transformation.getAsJsonObject()));
                } else if (transformation.isJsonPrimitive() && transformation.getAsJsonPrimitive().isString()) {
                    units.add(UnitRegistry.fromJson(transformation.getAsString()));
                } else {
                    throw ObfuscationException.invalidPipeline("transformation " + transformation + " is not a unit record");
                }
            }
        }
        return new Pipeline(seed, units);
    }

    private static Long readSeed(JsonElement seed) {
        if (seed == null || seed.isJsonNull()) {
            return null;
        }
        if (!seed.isJsonPrimitive() || !seed.getAsJsonPrimitive().isNumber()) {
            throw ObfuscationException.invalidPipeline("supplied seed is not a valid integer");
        }
        try {
            return seed.getAsBigDecimal().longValueExact();
        } catch (ArithmeticException e) {
            throw ObfuscationException.invalidPipeline("supplied seed is not a valid integer");
        }
    }

    @Override
    public String toString() {
        return "Pipeline(seed=" + seed + ", units=" + units + ")";
    }
}
