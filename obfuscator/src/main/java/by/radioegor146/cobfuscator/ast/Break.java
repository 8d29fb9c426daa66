package by.radioegor146.cobfuscator.ast;

public final class Break extends Node {

    @Override
    public NodeKind kind() {
        return NodeKind.BREAK;
    }

    @Override
    protected void collectChildren(Children out) {
    }

    @Override
    public Break copy() {
        return new Break();
    }
}
