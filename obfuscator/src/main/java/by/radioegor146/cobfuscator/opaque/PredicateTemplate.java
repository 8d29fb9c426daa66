package by.radioegor146.cobfuscator.opaque;

import by.radioegor146.cobfuscator.ast.Node;

import java.util.List;

/**
 * A boolean expression shape over a fixed number of operands.
 */
public final class PredicateTemplate {

    @FunctionalInterface
    public interface Builder {
        Node build(List<Operand> operands);
    }

    private final String description;
    private final int arity;
    private final Builder builder;

    public PredicateTemplate(String description, int arity, Builder builder) {
        this.description = description;
        this.arity = arity;
        this.builder = builder;
    }

    public String getDescription() {
        return description;
    }

    public int getArity() {
        return arity;
    }

    /**
     * Builds a new expression tree. Each operand use gets its own node, so the result can be
     * spliced into the tree without sharing.
     */
    public Node instantiate(List<Operand> operands) {
        if (operands.size() != arity) {
            throw new IllegalArgumentException("Predicate '" + description + "' takes " + arity
                    + " operands, got " + operands.size());
        }
        return builder.build(operands);
    }

    @Override
    public String toString() {
        return description;
    }
}
