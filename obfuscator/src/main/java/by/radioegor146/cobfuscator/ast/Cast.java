package by.radioegor146.cobfuscator.ast;

public final class Cast extends Node {

    public Typename toType;
    public Node expr;

    public Cast(Typename toType, Node expr) {
        this.toType = toType;
        this.expr = expr;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CAST;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("to_type", toType, n -> toType = (Typename) n);
        out.add("expr", expr, n -> expr = n);
    }

    @Override
    public Cast copy() {
        return new Cast(copyOf(toType), copyOf(expr));
    }
}
