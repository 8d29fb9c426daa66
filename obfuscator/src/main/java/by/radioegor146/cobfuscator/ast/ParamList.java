package by.radioegor146.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of a function declarator: {@link Decl}, {@link Typename} or {@link EllipsisParam}.
 */
public final class ParamList extends Node {

    public List<Node> params;

    public ParamList(List<Node> params) {
        this.params = params == null ? new ArrayList<>() : params;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PARAM_LIST;
    }

    @Override
    protected void collectChildren(Children out) {
        out.addAll("params", params);
    }

    @Override
    public ParamList copy() {
        return new ParamList(copyAll(params));
    }
}
