package by.radioegor146.cobfuscator.transform;

import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.opaque.OpaqueAugmenter;
import by.radioegor146.cobfuscator.opaque.OperandSourceConfig;
import by.radioegor146.cobfuscator.opaque.OperandStyle;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Adds opaque predicates to the conditions of existing {@code if}, {@code while},
 * {@code do}, {@code for} and {@code ?:} constructs without changing their value.
 */
public class AugmentOpaqueUnit extends ObfuscationUnit {

    private static final Logger logger = LoggerFactory.getLogger(AugmentOpaqueUnit.class);

    public static final String NAME = "Opaque Predicate Augmentation";

    private final List<OperandStyle> styles;
    private final double probability;
    private final int number;
    private final OperandSourceConfig config;

    public AugmentOpaqueUnit(Collection<OperandStyle> styles, double probability, int number) {
        this(styles, probability, number, OperandSourceConfig.createDefault());
    }

    public AugmentOpaqueUnit(Collection<OperandStyle> styles, double probability, int number,
                             OperandSourceConfig config) {
        if (probability < 0 || probability > 1) {
            throw new IllegalArgumentException("Augmentation probability must be within [0, 1]");
        }
        if (number < 0) {
            throw new IllegalArgumentException("Number of predicates must not be negative");
        }
        this.styles = new ArrayList<>(styles);
        this.probability = probability;
        this.number = number;
        this.config = config;
    }

    public List<OperandStyle> getStyles() {
        return Collections.unmodifiableList(styles);
    }

    public double getProbability() {
        return probability;
    }

    public int getNumber() {
        return number;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Augments existing conditionals with invariant opaque predicates.";
    }

    @Override
    public CSource transform(CSource source) {
        IdentifierAnalyzer analyzer = new IdentifierAnalyzer();
        analyzer.process(source.getTree());
        int added = new OpaqueAugmenter(styles, probability, number, config).process(analyzer);
        logger.info("Augmented conditions with {} opaque predicates in {}", added, source.getName());
        return source.regenerate();
    }

    @Override
    protected void writeOptions(JsonObject json) {
        json.add("styles", UnitOptions.toArray(styles));
        json.addProperty("probability", probability);
        json.addProperty("number", number);
    }

    static AugmentOpaqueUnit fromJson(JsonObject json) {
        UnitOptions options = new UnitOptions(NAME, json);
        return new AugmentOpaqueUnit(options.getEnumList("styles", OperandStyle.class),
                options.getProbability("probability"), options.getInt("number", 0));
    }

    @Override
    public String toString() {
        return "AugmentOpaqueUnit(styles=" + styles + ",p=" + probability + ",n=" + number + ")";
    }
}
