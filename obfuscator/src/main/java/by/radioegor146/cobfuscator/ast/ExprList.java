package by.radioegor146.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Comma expression, or the argument list of a call.
 */
public final class ExprList extends Node {

    public List<Node> exprs;

    public ExprList(List<Node> exprs) {
        this.exprs = exprs == null ? new ArrayList<>() : exprs;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXPR_LIST;
    }

    @Override
    protected void collectChildren(Children out) {
        out.addAll("exprs", exprs);
    }

    @Override
    public ExprList copy() {
        return new ExprList(copyAll(exprs));
    }
}
