package by.radioegor146.cobfuscator.ast;

public final class EnumType extends Node {

    public String name;
    public EnumeratorList values;

    public EnumType(String name, EnumeratorList values) {
        this.name = name;
        this.values = values;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ENUM;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("values", values, n -> values = (EnumeratorList) n);
    }

    @Override
    public EnumType copy() {
        return new EnumType(name, copyOf(values));
    }
}
