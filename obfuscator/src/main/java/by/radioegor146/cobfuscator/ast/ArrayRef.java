package by.radioegor146.cobfuscator.ast;

public final class ArrayRef extends Node {

    public Node name;
    public Node subscript;

    public ArrayRef(Node name, Node subscript) {
        this.name = name;
        this.subscript = subscript;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ARRAY_REF;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("name", name, n -> name = n);
        out.add("subscript", subscript, n -> subscript = n);
    }

    @Override
    public ArrayRef copy() {
        return new ArrayRef(copyOf(name), copyOf(subscript));
    }
}
