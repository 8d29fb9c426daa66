package by.radioegor146.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A designated initializer. Each designator is an {@link ID} for {@code .field} or an
 * expression for {@code [index]}.
 */
public final class NamedInitializer extends Node {

    public List<Node> name;
    public Node expr;

    public NamedInitializer(List<Node> name, Node expr) {
        this.name = name == null ? new ArrayList<>() : name;
        this.expr = expr;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.NAMED_INITIALIZER;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("expr", expr, n -> expr = n);
        out.addAll("name", name);
    }

    @Override
    public NamedInitializer copy() {
        return new NamedInitializer(copyAll(name), copyOf(expr));
    }
}
