package by.radioegor146.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;

public final class PtrDecl extends Node {

    public List<String> quals;
    public Node type;

    public PtrDecl(List<String> quals, Node type) {
        this.quals = quals == null ? new ArrayList<>() : quals;
        this.type = type;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PTR_DECL;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("type", type, n -> type = n);
    }

    @Override
    public PtrDecl copy() {
        return new PtrDecl(new ArrayList<>(quals), copyOf(type));
    }
}
