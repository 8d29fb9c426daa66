package by.radioegor146.cobfuscator.ast;

public final class FuncDecl extends Node {

    public ParamList args;
    public Node type;

    public FuncDecl(ParamList args, Node type) {
        this.args = args;
        this.type = type;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNC_DECL;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("args", args, n -> args = (ParamList) n);
        out.add("type", type, n -> type = n);
    }

    @Override
    public FuncDecl copy() {
        return new FuncDecl(copyOf(args), copyOf(type));
    }
}
