package by.radioegor146.cobfuscator.ast;

public final class Assignment extends Node {

    public String op;
    public Node lvalue;
    public Node rvalue;

    public Assignment(String op, Node lvalue, Node rvalue) {
        this.op = op;
        this.lvalue = lvalue;
        this.rvalue = rvalue;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASSIGNMENT;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("lvalue", lvalue, n -> lvalue = n);
        out.add("rvalue", rvalue, n -> rvalue = n);
    }

    @Override
    public Assignment copy() {
        return new Assignment(op, copyOf(lvalue), copyOf(rvalue));
    }
}
