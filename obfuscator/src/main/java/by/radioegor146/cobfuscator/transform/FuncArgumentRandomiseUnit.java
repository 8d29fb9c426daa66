package by.radioegor146.cobfuscator.transform;

import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.procedural.ArgumentRandomiser;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds unused parameters to functions and shuffles their parameter order, updating every
 * prototype and call. Functions called through pointers and variadic functions are kept as
 * they are.
 */
public class FuncArgumentRandomiseUnit extends ObfuscationUnit {

    private static final Logger logger = LoggerFactory.getLogger(FuncArgumentRandomiseUnit.class);

    public static final String NAME = "Function Interface Randomisation";

    private final int extraArgs;
    private final double probability;
    private final boolean randomise;

    public FuncArgumentRandomiseUnit(int extraArgs, double probability, boolean randomise) {
        if (extraArgs < 0) {
            throw new IllegalArgumentException("Number of extra arguments must not be negative");
        }
        if (probability < 0 || probability > 1) {
            throw new IllegalArgumentException("Variable probability must be within [0, 1]");
        }
        this.extraArgs = extraArgs;
        this.probability = probability;
        this.randomise = randomise;
    }

    public int getExtraArgs() {
        return extraArgs;
    }

    public double getProbability() {
        return probability;
    }

    public boolean isRandomise() {
        return randomise;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Randomise function arguments to make them less comprehensible";
    }

    @Override
    public CSource transform(CSource source) {
        IdentifierAnalyzer analyzer = new IdentifierAnalyzer();
        analyzer.process(source.getTree());
        int changed = new ArgumentRandomiser(extraArgs, probability, randomise).process(analyzer);
        logger.info("Randomised {} function interfaces in {}", changed, source.getName());
        return source.regenerate();
    }

    @Override
    protected void writeOptions(JsonObject json) {
        json.addProperty("extra_args", extraArgs);
        json.addProperty("probability", probability);
        json.addProperty("randomise", randomise);
    }

    static FuncArgumentRandomiseUnit fromJson(JsonObject json) {
        UnitOptions options = new UnitOptions(NAME, json);
        return new FuncArgumentRandomiseUnit(options.getInt("extra_args", 0),
                options.getProbability("probability"), options.getBoolean("randomise"));
    }

    @Override
    public String toString() {
        return "RandomiseFuncArgs(extra=" + extraArgs + ",p=" + probability
                + ",random_order=" + (randomise ? "ENABLED" : "DISABLED") + ")";
    }
}
