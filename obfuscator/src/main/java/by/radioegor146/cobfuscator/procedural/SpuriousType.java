package by.radioegor146.cobfuscator.procedural;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.ast.Constant;
import by.radioegor146.cobfuscator.ast.Decl;
import by.radioegor146.cobfuscator.ast.IdentifierType;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.PtrDecl;
import by.radioegor146.cobfuscator.ast.TypeDecl;
import by.radioegor146.cobfuscator.ast.UnaryOp;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Types given to spurious parameters, each with a way to make up a matching argument.
 */
public enum SpuriousType {
    SHORT("short", false),
    INT("int", false),
    LONG("long", false),
    LONG_LONG("long long", false),
    CHAR("char", false),
    STRING("char", true),
    BOOL("_Bool", false),
    FLOAT("float", false),
    DOUBLE("double", false);

    private static final String CHARACTERS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    private final String spelling;
    private final boolean pointer;

    SpuriousType(String spelling, boolean pointer) {
        this.spelling = spelling;
        this.pointer = pointer;
    }

    public String getSpelling() {
        return spelling;
    }

    public boolean isPointer() {
        return pointer;
    }

    /**
     * Whether a parameter or variable declared like this can stand in for an argument. Qualified
     * pointees are refused, since passing them would drop the qualifier.
     */
    public boolean matches(Decl decl) {
        Node base = decl.type;
        if (pointer) {
            if (!(base instanceof PtrDecl) || !decl.quals.isEmpty()) {
                return false;
            }
            base = ((PtrDecl) base).type;
        }
        if (!(base instanceof TypeDecl) || !(((TypeDecl) base).type instanceof IdentifierType)) {
            return false;
        }
        if (pointer && !((TypeDecl) base).quals.isEmpty()) {
            return false;
        }
        return spelling.equals(String.join(" ", ((IdentifierType) ((TypeDecl) base).type).names));
    }

    public Decl declare(String name) {
        List<String> names = new ArrayList<>(Arrays.asList(spelling.split(" ")));
        Node type = new TypeDecl(name, new ArrayList<>(), new IdentifierType(names));
        if (pointer) {
            type = new PtrDecl(new ArrayList<>(), type);
        }
        return new Decl(name, type, null);
    }

    public Node randomValue() {
        switch (this) {
            case SHORT:
            case INT:
                return integer(FastRandom.nextIntInclusive(-10, 10), "int");
            case LONG:
                return integer(FastRandom.nextIntInclusive(-100, 100), "int");
            case LONG_LONG: {
                long magnitude = FastRandom.nextLong() >>> 17;
                return integer(FastRandom.nextBoolean() ? magnitude : -magnitude, "long long");
            }
            case CHAR:
                return new Constant("char", "'" + CHARACTERS.charAt(FastRandom.nextInt(CHARACTERS.length())) + "'");
            case STRING: {
                StringBuilder text = new StringBuilder();
                int length = FastRandom.nextIntInclusive(0, 50);
                for (int i = 0; i < length; i++) {
                    text.append(FastRandom.nextInt(8) == 0 ? ' ' : CHARACTERS.charAt(FastRandom.nextInt(CHARACTERS.length())));
                }
                return new Constant("string", "\"" + text + "\"");
            }
            case BOOL:
                return Constant.ofInt(FastRandom.nextInt(2));
            case FLOAT:
                return real(FastRandom.nextBoolean() ? FastRandom.nextIntInclusive(-20, 20) * 0.25 : wide());
            case DOUBLE:
                return real(FastRandom.nextBoolean() ? FastRandom.nextIntInclusive(-200, 200) * 0.125 : wide());
            default:
                throw new IllegalStateException("No values for " + this);
        }
    }

    // Stays inside the int range, so an (int) cast of the parameter is always defined.
    private static double wide() {
        return (FastRandom.nextDouble() * 2 - 1) * 1e9;
    }

    private static Node integer(long value, String type) {
        if (value < 0) {
            return new UnaryOp("-", new Constant(type, Long.toString(-value)));
        }
        return new Constant(type, Long.toString(value));
    }

    private static Node real(double value) {
        String digits = BigDecimal.valueOf(Math.abs(value)).setScale(4, RoundingMode.HALF_UP).toPlainString();
        Constant constant = new Constant("double", digits);
        return value < 0 ? new UnaryOp("-", constant) : constant;
    }
}
