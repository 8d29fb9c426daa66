package by.radioegor146.cobfuscator.ast;

public final class EmptyStatement extends Node {

    @Override
    public NodeKind kind() {
        return NodeKind.EMPTY_STATEMENT;
    }

    @Override
    protected void collectChildren(Children out) {
    }

    @Override
    public EmptyStatement copy() {
        return new EmptyStatement();
    }
}
