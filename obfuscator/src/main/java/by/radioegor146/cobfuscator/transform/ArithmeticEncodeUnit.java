package by.radioegor146.cobfuscator.transform;

import by.radioegor146.cobfuscator.encode.ArithmeticEncoder;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes integer arithmetic as equivalent combinations of bitwise and arithmetic operations.
 * Depths above 5 make the output grow quickly.
 */
public class ArithmeticEncodeUnit extends ObfuscationUnit {

    private static final Logger logger = LoggerFactory.getLogger(ArithmeticEncodeUnit.class);

    public static final String NAME = "Integer Arithmetic Encoding";

    private final int depth;

    public ArithmeticEncodeUnit(int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("Encoding depth must not be negative");
        }
        this.depth = depth;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Encode integer variable arithmetic to make code less comprehensible";
    }

    @Override
    public CSource transform(CSource source) {
        int encoded = new ArithmeticEncoder(depth).process(source.getTree());
        logger.info("Encoded {} integer expressions in {}", encoded, source.getName());
        return source.regenerate();
    }

    @Override
    protected void writeOptions(JsonObject json) {
        json.addProperty("depth", depth);
    }

    static ArithmeticEncodeUnit fromJson(JsonObject json) {
        return new ArithmeticEncodeUnit(new UnitOptions(NAME, json).getInt("depth", 0));
    }

    @Override
    public String toString() {
        return "ArithmeticEncode(depth=" + depth + ")";
    }
}
