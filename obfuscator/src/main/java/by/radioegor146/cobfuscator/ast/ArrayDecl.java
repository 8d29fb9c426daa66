package by.radioegor146.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;

public final class ArrayDecl extends Node {

    public Node type;
    public Node dim;
    public List<String> dimQuals;

    public ArrayDecl(Node type, Node dim, List<String> dimQuals) {
        this.type = type;
        this.dim = dim;
        this.dimQuals = dimQuals == null ? new ArrayList<>() : dimQuals;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ARRAY_DECL;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("type", type, n -> type = n);
        out.add("dim", dim, n -> dim = n);
    }

    @Override
    public ArrayDecl copy() {
        return new ArrayDecl(copyOf(type), copyOf(dim), new ArrayList<>(dimQuals));
    }
}
