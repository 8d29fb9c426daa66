package by.radioegor146.cobfuscator.ast;

public final class FuncCall extends Node {

    public Node name;
    public ExprList args;

    public FuncCall(Node name, ExprList args) {
        this.name = name;
        this.args = args;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNC_CALL;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("name", name, n -> name = n);
        out.add("args", args, n -> args = (ExprList) n);
    }

    @Override
    public FuncCall copy() {
        return new FuncCall(copyOf(name), copyOf(args));
    }
}
