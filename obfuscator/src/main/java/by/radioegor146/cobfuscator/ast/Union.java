package by.radioegor146.cobfuscator.ast;

import java.util.List;

public final class Union extends Aggregate {

    public Union(String name, List<Decl> decls) {
        super(name, decls);
    }

    @Override
    public String keyword() {
        return "union";
    }

    @Override
    public NodeKind kind() {
        return NodeKind.UNION;
    }

    @Override
    public Union copy() {
        return new Union(name, copyAll(decls));
    }
}
