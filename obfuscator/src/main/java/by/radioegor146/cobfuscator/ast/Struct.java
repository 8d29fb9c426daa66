package by.radioegor146.cobfuscator.ast;

import java.util.List;

public final class Struct extends Aggregate {

    public Struct(String name, List<Decl> decls) {
        super(name, decls);
    }

    @Override
    public String keyword() {
        return "struct";
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STRUCT;
    }

    @Override
    public Struct copy() {
        return new Struct(name, copyAll(decls));
    }
}
