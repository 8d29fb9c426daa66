package by.radioegor146.cobfuscator.ast;

public final class ID extends Node {

    public String name;

    public ID(String name) {
        this.name = name;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ID;
    }

    @Override
    protected void collectChildren(Children out) {
    }

    @Override
    public ID copy() {
        return new ID(name);
    }
}
