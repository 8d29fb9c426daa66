package by.radioegor146.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;

public final class Default extends Node {

    public List<Node> stmts;

    public Default(List<Node> stmts) {
        this.stmts = stmts == null ? new ArrayList<>() : stmts;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DEFAULT;
    }

    @Override
    protected void collectChildren(Children out) {
        out.addAll("stmts", stmts);
    }

    @Override
    public Default copy() {
        return new Default(copyAll(stmts));
    }
}
