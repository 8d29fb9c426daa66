package by.radioegor146.cobfuscator.ast;

public final class Return extends Node {

    public Node expr;

    public Return(Node expr) {
        this.expr = expr;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RETURN;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("expr", expr, n -> expr = n);
    }

    @Override
    public Return copy() {
        return new Return(copyOf(expr));
    }
}
