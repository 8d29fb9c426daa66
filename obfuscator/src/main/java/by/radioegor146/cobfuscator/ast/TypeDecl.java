package by.radioegor146.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Innermost declarator: the declared name bound to a base type specifier.
 */
public final class TypeDecl extends Node {

    public String declname;
    public List<String> quals;
    public Node type;

    public TypeDecl(String declname, List<String> quals, Node type) {
        this.declname = declname;
        this.quals = quals == null ? new ArrayList<>() : quals;
        this.type = type;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TYPE_DECL;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("type", type, n -> type = n);
    }

    @Override
    public TypeDecl copy() {
        return new TypeDecl(declname, new ArrayList<>(quals), copyOf(type));
    }
}
