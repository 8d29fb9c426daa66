package by.radioegor146.cobfuscator.ast;

public final class Label extends Node {

    public String name;
    public Node stmt;

    public Label(String name, Node stmt) {
        this.name = name;
        this.stmt = stmt;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LABEL;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("stmt", stmt, n -> stmt = n);
    }

    @Override
    public Label copy() {
        return new Label(name, copyOf(stmt));
    }
}
