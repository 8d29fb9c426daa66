package by.radioegor146.cobfuscator.transform;

import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.opaque.Granularity;
import by.radioegor146.cobfuscator.opaque.InsertionKind;
import by.radioegor146.cobfuscator.opaque.OpaqueInserter;
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
 * Wraps code in new conditionals guarded by opaque predicates, with decoy copies of the code on
 * the branches that never run.
 */
public class InsertOpaqueUnit extends ObfuscationUnit {

    private static final Logger logger = LoggerFactory.getLogger(InsertOpaqueUnit.class);

    public static final String NAME = "Opaque Predicate Insertion";

    private final List<OperandStyle> styles;
    private final List<Granularity> granularities;
    private final List<InsertionKind> kinds;
    private final int number;
    private final OperandSourceConfig config;

    public InsertOpaqueUnit(Collection<OperandStyle> styles, Collection<Granularity> granularities,
                            Collection<InsertionKind> kinds, int number) {
        this(styles, granularities, kinds, number, OperandSourceConfig.createDefault());
    }

    public InsertOpaqueUnit(Collection<OperandStyle> styles, Collection<Granularity> granularities,
                            Collection<InsertionKind> kinds, int number, OperandSourceConfig config) {
        if (number < 0) {
            throw new IllegalArgumentException("Number of predicates must not be negative");
        }
        this.styles = new ArrayList<>(styles);
        this.granularities = new ArrayList<>(granularities);
        this.kinds = new ArrayList<>(kinds);
        this.number = number;
        this.config = config;
    }

    public List<OperandStyle> getStyles() {
        return Collections.unmodifiableList(styles);
    }

    public List<Granularity> getGranularities() {
        return Collections.unmodifiableList(granularities);
    }

    public List<InsertionKind> getKinds() {
        return Collections.unmodifiableList(kinds);
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
        return "Inserts new conditionals with invariant opaque predicates";
    }

    @Override
    public CSource transform(CSource source) {
        IdentifierAnalyzer analyzer = new IdentifierAnalyzer();
        analyzer.process(source.getTree());
        int inserted = new OpaqueInserter(styles, granularities, kinds, number, config).process(analyzer);
        logger.info("Inserted {} opaque predicates in {}", inserted, source.getName());
        return source.regenerate();
    }

    @Override
    protected void writeOptions(JsonObject json) {
        json.add("styles", UnitOptions.toArray(styles));
        json.add("granularities", UnitOptions.toArray(granularities));
        json.add("kinds", UnitOptions.toArray(kinds));
        json.addProperty("number", number);
    }

    static InsertOpaqueUnit fromJson(JsonObject json) {
        UnitOptions options = new UnitOptions(NAME, json);
        return new InsertOpaqueUnit(options.getEnumList("styles", OperandStyle.class),
                options.getEnumList("granularities", Granularity.class),
                options.getEnumList("kinds", InsertionKind.class),
                options.getInt("number", 0));
    }

    @Override
    public String toString() {
        return "InsertOpaqueUnit(styles=" + styles + ",granularities=" + granularities
                + ",kinds=" + kinds + ",n=" + number + ")";
    }
}
