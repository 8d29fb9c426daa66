package by.radioegor146.cobfuscator.ast;

public final class EllipsisParam extends Node {

    @Override
    public NodeKind kind() {
        return NodeKind.ELLIPSIS_PARAM;
    }

    @Override
    protected void collectChildren(Children out) {
    }

    @Override
    public EllipsisParam copy() {
        return new EllipsisParam();
    }
}
