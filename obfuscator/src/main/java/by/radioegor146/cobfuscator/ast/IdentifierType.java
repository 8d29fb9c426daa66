package by.radioegor146.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Builtin or typedef type specifier words, e.g. {@code [unsigned, long, int]} or {@code [size_t]}.
 */
public final class IdentifierType extends Node {

    public List<String> names;

    public IdentifierType(List<String> names) {
        this.names = names == null ? new ArrayList<>() : names;
    }

    public String lastName() {
        return names.isEmpty() ? null : names.get(names.size() - 1);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IDENTIFIER_TYPE;
    }

    @Override
    protected void collectChildren(Children out) {
    }

    @Override
    public IdentifierType copy() {
        return new IdentifierType(new ArrayList<>(names));
    }
}
