package by.radioegor146.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A {@code case} label together with the statements that follow it up to the next label.
 */
public final class Case extends Node {

    public Node expr;
    public List<Node> stmts;

    public Case(Node expr, List<Node> stmts) {
        this.expr = expr;
        this.stmts = stmts == null ? new ArrayList<>() : stmts;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CASE;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("expr", expr, n -> expr = n);
        out.addAll("stmts", stmts);
    }

    @Override
    public Case copy() {
        return new Case(copyOf(expr), copyAll(stmts));
    }
}
