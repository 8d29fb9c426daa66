package by.radioegor146.cobfuscator.opaque;

import by.radioegor146.cobfuscator.ast.Cast;
import by.radioegor146.cobfuscator.ast.ID;
import by.radioegor146.cobfuscator.ast.IdentifierType;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.TypeDecl;
import by.radioegor146.cobfuscator.ast.Typename;

import java.util.ArrayList;
import java.util.Collections;

/**
 * A variable usable inside an opaque predicate. Real-typed variables are read through an
 * {@code (int)} cast so the integer identities keep holding.
 */
public final class Operand {

    private final String name;
    private final boolean real;

    public Operand(String name, boolean real) {
        this.name = name;
        this.real = real;
    }

    public String getName() {
        return name;
    }

    public boolean isReal() {
        return real;
    }

    /**
     * Builds a fresh expression reading this operand. Every use in a predicate needs its own node.
     */
    public Node toExpression() {
        if (!real) {
            return new ID(name);
        }
        Typename intType = new Typename(null, new ArrayList<>(),
                new TypeDecl(null, new ArrayList<>(), new IdentifierType(new ArrayList<>(Collections.singletonList("int")))));
        return new Cast(intType, new ID(name));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Operand)) {
            return false;
        }
        return name.equals(((Operand) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return real ? "(int) " + name : name;
    }
}
