package by.radioegor146.cobfuscator.ast;

public final class While extends Node {

    public Node cond;
    public Node stmt;

    public While(Node cond, Node stmt) {
        this.cond = cond;
        this.stmt = stmt;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WHILE;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("cond", cond, n -> cond = n);
        out.add("stmt", stmt, n -> stmt = n);
    }

    @Override
    public While copy() {
        return new While(copyOf(cond), copyOf(stmt));
    }
}
