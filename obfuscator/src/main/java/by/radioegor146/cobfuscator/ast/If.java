package by.radioegor146.cobfuscator.ast;

public final class If extends Node {

    public Node cond;
    public Node iftrue;
    public Node iffalse;

    public If(Node cond, Node iftrue, Node iffalse) {
        this.cond = cond;
        this.iftrue = iftrue;
        this.iffalse = iffalse;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IF;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("cond", cond, n -> cond = n);
        out.add("iftrue", iftrue, n -> iftrue = n);
        out.add("iffalse", iffalse, n -> iffalse = n);
    }

    @Override
    public If copy() {
        return new If(copyOf(cond), copyOf(iftrue), copyOf(iffalse));
    }
}
