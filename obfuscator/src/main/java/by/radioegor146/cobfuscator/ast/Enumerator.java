package by.radioegor146.cobfuscator.ast;

public final class Enumerator extends Node {

    public String name;
    public Node value;

    public Enumerator(String name, Node value) {
        this.name = name;
        this.value = value;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ENUMERATOR;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("value", value, n -> value = n);
    }

    @Override
    public Enumerator copy() {
        return new Enumerator(name, copyOf(value));
    }
}
