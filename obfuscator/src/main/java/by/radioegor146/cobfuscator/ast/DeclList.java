package by.radioegor146.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Several declarations sharing one specifier list, as found in a {@code for} initializer.
 */
public final class DeclList extends Node {

    public List<Decl> decls;

    public DeclList(List<Decl> decls) {
        this.decls = decls == null ? new ArrayList<>() : decls;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DECL_LIST;
    }

    @Override
    protected void collectChildren(Children out) {
        out.addAll("decls", decls);
    }

    @Override
    public DeclList copy() {
        return new DeclList(copyAll(decls));
    }
}
