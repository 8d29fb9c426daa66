package by.radioegor146.cobfuscator.ast;

/**
 * Member access; {@link #type} is {@code "."} or {@code "->"}.
 */
public final class StructRef extends Node {

    public Node name;
    public String type;
    public ID field;

    public StructRef(Node name, String type, ID field) {
        this.name = name;
        this.type = type;
        this.field = field;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STRUCT_REF;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("name", name, n -> name = n);
        out.add("field", field, n -> field = (ID) n);
    }

    @Override
    public StructRef copy() {
        return new StructRef(copyOf(name), type, copyOf(field));
    }
}
