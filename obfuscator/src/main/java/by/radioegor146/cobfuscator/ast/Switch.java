package by.radioegor146.cobfuscator.ast;

public final class Switch extends Node {

    public Node cond;
    public Node stmt;

    public Switch(Node cond, Node stmt) {
        this.cond = cond;
        this.stmt = stmt;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SWITCH;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("cond", cond, n -> cond = n);
        out.add("stmt", stmt, n -> stmt = n);
    }

    @Override
    public Switch copy() {
        return new Switch(copyOf(cond), copyOf(stmt));
    }
}
