package by.radioegor146.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;

public final class Compound extends Node {

    public List<Node> blockItems;

    public Compound(List<Node> blockItems) {
        this.blockItems = blockItems == null ? new ArrayList<>() : blockItems;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMPOUND;
    }

    @Override
    protected void collectChildren(Children out) {
        out.addAll("block_items", blockItems);
    }

    @Override
    public Compound copy() {
        return new Compound(copyAll(blockItems));
    }
}
