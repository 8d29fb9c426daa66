package by.radioegor146.cobfuscator.analysis;

import by.radioegor146.cobfuscator.ast.Aggregate;

import java.util.Objects;

/**
 * The simplified type lattice used by {@link ExpressionAnalyzer}: integers, reals, pointers and
 * arrays of another type, struct or union definitions, and everything else.
 */
public final class ExprType {

    public enum Kind {
        INT,
        REAL,
        POINTER,
        ARRAY,
        AGGREGATE,
        OTHER
    }

    public static final ExprType INT = new ExprType(Kind.INT, null, null);
    public static final ExprType REAL = new ExprType(Kind.REAL, null, null);
    public static final ExprType OTHER = new ExprType(Kind.OTHER, null, null);

    private final Kind kind;
    private final ExprType element;
    private final Aggregate aggregate;

    private ExprType(Kind kind, ExprType element, Aggregate aggregate) {
        this.kind = kind;
        this.element = element;
        this.aggregate = aggregate;
    }

    public static ExprType pointerTo(ExprType element) {
        return new ExprType(Kind.POINTER, element == null ? OTHER : element, null);
    }

    public static ExprType arrayOf(ExprType element) {
        return new ExprType(Kind.ARRAY, element == null ? OTHER : element, null);
    }

    public static ExprType aggregate(Aggregate definition) {
        return new ExprType(Kind.AGGREGATE, null, Objects.requireNonNull(definition));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The pointed-to or stored type of a pointer or array, null otherwise.
     */
    public ExprType getElement() {
        return element;
    }

    /**
     * The struct or union definition of an aggregate type, null otherwise.
     */
    public Aggregate getAggregate() {
        return aggregate;
    }

    public boolean isInt() {
        return kind == Kind.INT;
    }

    public boolean isReal() {
        return kind == Kind.REAL;
    }

    public boolean isIndirect() {
        return kind == Kind.POINTER || kind == Kind.ARRAY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExprType)) {
            return false;
        }
        ExprType that = (ExprType) o;
        return kind == that.kind && aggregate == that.aggregate && Objects.equals(element, that.element);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * kind.hashCode() + Objects.hashCode(element)) + System.identityHashCode(aggregate);
    }

    @Override
    public String toString() {
        switch (kind) {
            case POINTER:
                return "Ptr(" + element + ")";
            case ARRAY:
                return "Array(" + element + ")";
            case AGGREGATE:
                return aggregate.keyword() + " " + (aggregate.name == null ? "<anonymous>" : aggregate.name);
            default:
                return kind.name();
        }
    }
}
