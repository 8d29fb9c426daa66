package by.radioegor146.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * An abstract declarator, as used by casts, {@code sizeof} and unnamed parameters.
 */
public final class Typename extends Node {

    public String name;
    public List<String> quals;
    public Node type;

    public Typename(String name, List<String> quals, Node type) {
        this.name = name;
        this.quals = quals == null ? new ArrayList<>() : quals;
        this.type = type;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TYPENAME;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("type", type, n -> type = n);
    }

    @Override
    public Typename copy() {
        return new Typename(name, new ArrayList<>(quals), copyOf(type));
    }
}
