package by.radioegor146.cobfuscator.ast;

public final class Goto extends Node {

    public String name;

    public Goto(String name) {
        this.name = name;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.GOTO;
    }

    @Override
    protected void collectChildren(Children out) {
    }

    @Override
    public Goto copy() {
        return new Goto(name);
    }
}
