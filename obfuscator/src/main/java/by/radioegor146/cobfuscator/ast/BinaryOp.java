package by.radioegor146.cobfuscator.ast;

public final class BinaryOp extends Node {

    public String op;
    public Node left;
    public Node right;

    public BinaryOp(String op, Node left, Node right) {
        this.op = op;
        this.left = left;
        this.right = right;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BINARY_OP;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("left", left, n -> left = n);
        out.add("right", right, n -> right = n);
    }

    @Override
    public BinaryOp copy() {
        return new BinaryOp(op, copyOf(left), copyOf(right));
    }
}
