package by.radioegor146.cobfuscator.ast;

public final class DoWhile extends Node {

    public Node cond;
    public Node stmt;

    public DoWhile(Node cond, Node stmt) {
        this.cond = cond;
        this.stmt = stmt;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DO_WHILE;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("stmt", stmt, n -> stmt = n);
        out.add("cond", cond, n -> cond = n);
    }

    @Override
    public DoWhile copy() {
        return new DoWhile(copyOf(cond), copyOf(stmt));
    }
}
