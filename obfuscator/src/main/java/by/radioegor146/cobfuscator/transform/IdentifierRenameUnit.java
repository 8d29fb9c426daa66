package by.radioegor146.cobfuscator.transform;

import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.rename.IdentifierRenamer;
import by.radioegor146.cobfuscator.rename.RenameStyle;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces variable, function, type, member and label names with meaningless ones.
 */
public class IdentifierRenameUnit extends ObfuscationUnit {

    private static final Logger logger = LoggerFactory.getLogger(IdentifierRenameUnit.class);

    public static final String NAME = "Identifier Renaming";

    private final RenameStyle style;
    private final boolean minimiseIdents;

    public IdentifierRenameUnit(RenameStyle style, boolean minimiseIdents) {
        if (style == null) {
            throw new IllegalArgumentException("Rename style must be given");
        }
        this.style = style;
        this.minimiseIdents = minimiseIdents;
    }

    public RenameStyle getStyle() {
        return style;
    }

    public boolean isMinimiseIdents() {
        return minimiseIdents;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Renames variable/function names to make them incomprehensible.";
    }

    @Override
    public CSource transform(CSource source) {
        IdentifierAnalyzer analyzer = new IdentifierAnalyzer();
        analyzer.process(source.getTree());
        int renamed = new IdentifierRenamer(style, minimiseIdents).process(analyzer);
        logger.info("Renamed {} identifiers in {}", renamed, source.getName());
        return source.regenerate();
    }

    @Override
    protected void writeOptions(JsonObject json) {
        json.addProperty("style", style.name());
        json.addProperty("minimise_idents", minimiseIdents);
    }

    static IdentifierRenameUnit fromJson(JsonObject json) {
        UnitOptions options = new UnitOptions(NAME, json);
        return new IdentifierRenameUnit(options.getEnum("style", RenameStyle.class),
                options.getBoolean("minimise_idents"));
    }

    @Override
    public String toString() {
        return "RenameIdentifiers(style=" + style.name() + ",minimal=" + (minimiseIdents ? "ENABLED" : "DISABLED") + ")";
    }
}
