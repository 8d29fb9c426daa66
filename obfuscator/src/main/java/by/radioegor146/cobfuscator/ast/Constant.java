package by.radioegor146.cobfuscator.ast;

/**
 * A literal. {@link #type} is one of {@code int}, {@code long}, {@code unsigned int},
 * {@code float}, {@code double}, {@code char} or {@code string}; {@link #value} is the source spelling.
 */
public final class Constant extends Node {

    public String type;
    public String value;

    public Constant(String type, String value) {
        this.type = type;
        this.value = value;
    }

    public static Constant ofInt(long value) {
        return new Constant("int", Long.toString(value));
    }

    /**
     * Parses a decimal, octal or hexadecimal integer spelling, ignoring any {@code u}/{@code l}
     * suffix. Returns null when the text is not such a literal or does not fit a long.
     */
    public static Long parseInteger(String text) {
        int end = text.length();
        while (end > 0 && "uUlL".indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        String digits = text.substring(0, end);
        try {
            if (digits.startsWith("0x") || digits.startsWith("0X")) {
                return Long.parseLong(digits.substring(2), 16);
            } else if (digits.length() > 1 && digits.startsWith("0")) {
                return Long.parseLong(digits.substring(1), 8);
            }
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public boolean isInteger() {
        return type != null && (type.endsWith("int") || type.endsWith("long")) && !"long double".equals(type);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONSTANT;
    }

    @Override
    protected void collectChildren(Children out) {
    }

    @Override
    public Constant copy() {
        return new Constant(type, value);
    }
}
