package by.radioegor146.cobfuscator.ast;

public final class Continue extends Node {

    @Override
    public NodeKind kind() {
        return NodeKind.CONTINUE;
    }

    @Override
    protected void collectChildren(Children out) {
    }

    @Override
    public Continue copy() {
        return new Continue();
    }
}
