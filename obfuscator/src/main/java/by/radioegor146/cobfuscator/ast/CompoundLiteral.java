package by.radioegor146.cobfuscator.ast;

public final class CompoundLiteral extends Node {

    public Typename type;
    public InitList init;

    public CompoundLiteral(Typename type, InitList init) {
        this.type = type;
        this.init = init;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMPOUND_LITERAL;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("type", type, n -> type = (Typename) n);
        out.add("init", init, n -> init = (InitList) n);
    }

    @Override
    public CompoundLiteral copy() {
        return new CompoundLiteral(copyOf(type), copyOf(init));
    }
}
