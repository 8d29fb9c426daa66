package by.radioegor146.cobfuscator;

/**
 * Raised when a transformation cannot proceed safely, or when input (C source, pipeline
 * description) cannot be understood.
 */
public class ObfuscationException extends RuntimeException {

    public ObfuscationException(String message) {
        super(message);
    }

    public ObfuscationException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ObfuscationException syntax(int line, int column, String msg) {
        return new ObfuscationException("Syntax error at " + line + ":" + column + ": " + msg);
    }

    public static ObfuscationException unsupported(String msg) {
        return new ObfuscationException("Unsupported: " + msg);
    }

    public static ObfuscationException invalidPipeline(String msg) {
        return new ObfuscationException("Invalid pipeline: " + msg);
    }
}
