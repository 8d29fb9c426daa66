package by.radioegor146.cobfuscator.transform;

import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.flatten.CaseIdStyle;
import by.radioegor146.cobfuscator.flatten.ControlFlowFlattener;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns every function body into a single dispatch loop over numbered blocks.
 * <p>
 * Variable length arrays are moved to the heap, so memory use of the output differs from the
 * input.
 */
public class ControlFlowFlattenUnit extends ObfuscationUnit {

    private static final Logger logger = LoggerFactory.getLogger(ControlFlowFlattenUnit.class);

    public static final String NAME = "Flatten Control Flow";

    private final boolean randomiseCases;
    private final CaseIdStyle style;

    public ControlFlowFlattenUnit(boolean randomiseCases, CaseIdStyle style) {
        if (style == null) {
            throw new IllegalArgumentException("Case id style must be given");
        }
        this.randomiseCases = randomiseCases;
        this.style = style;
    }

    public boolean isRandomiseCases() {
        return randomiseCases;
    }

    public CaseIdStyle getStyle() {
        return style;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Flatten all Control Flow in functions into a single level to help prevent code analysis";
    }

    @Override
    public CSource transform(CSource source) {
        IdentifierAnalyzer analyzer = new IdentifierAnalyzer();
        analyzer.process(source.getTree());
        int flattened = new ControlFlowFlattener(style, randomiseCases).process(analyzer);
        logger.info("Flattened {} functions in {}", flattened, source.getName());
        return source.regenerate();
    }

    @Override
    protected void writeOptions(JsonObject json) {
        json.addProperty("randomise_cases", randomiseCases);
        json.addProperty("style", style.name());
    }

    static ControlFlowFlattenUnit fromJson(JsonObject json) {
        UnitOptions options = new UnitOptions(NAME, json);
        return new ControlFlowFlattenUnit(options.getBoolean("randomise_cases"),
                options.getEnum("style", CaseIdStyle.class));
    }

    @Override
    public String toString() {
        return "FlattenControlFlow(random_order=" + (randomiseCases ? "ENABLED" : "DISABLED")
                + ",style=" + style.name() + ")";
    }
}
