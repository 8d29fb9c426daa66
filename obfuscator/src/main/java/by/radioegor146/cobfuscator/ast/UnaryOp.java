package by.radioegor146.cobfuscator.ast;

/**
 * A unary operator. Postfix increment and decrement are spelled {@code p++} and {@code p--}.
 */
public final class UnaryOp extends Node {

    public String op;
    public Node expr;

    public UnaryOp(String op, Node expr) {
        this.op = op;
        this.expr = expr;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.UNARY_OP;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("expr", expr, n -> expr = n);
    }

    @Override
    public UnaryOp copy() {
        return new UnaryOp(op, copyOf(expr));
    }
}
