package by.radioegor146.cobfuscator.ast;

public final class TernaryOp extends Node {

    public Node cond;
    public Node iftrue;
    public Node iffalse;

    public TernaryOp(Node cond, Node iftrue, Node iffalse) {
        this.cond = cond;
        this.iftrue = iftrue;
        this.iffalse = iffalse;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TERNARY_OP;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("cond", cond, n -> cond = n);
        out.add("iftrue", iftrue, n -> iftrue = n);
        out.add("iffalse", iffalse, n -> iffalse = n);
    }

    @Override
    public TernaryOp copy() {
        return new TernaryOp(copyOf(cond), copyOf(iftrue), copyOf(iffalse));
    }
}
