package by.radioegor146.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;

public final class InitList extends Node {

    public List<Node> exprs;

    public InitList(List<Node> exprs) {
        this.exprs = exprs == null ? new ArrayList<>() : exprs;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INIT_LIST;
    }

    @Override
    protected void collectChildren(Children out) {
        out.addAll("exprs", exprs);
    }

    @Override
    public InitList copy() {
        return new InitList(copyAll(exprs));
    }
}
