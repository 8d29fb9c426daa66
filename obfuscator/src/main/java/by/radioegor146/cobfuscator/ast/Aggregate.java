package by.radioegor146.cobfuscator.ast;

import java.util.List;

/**
 * Common shape of {@code struct} and {@code union} specifiers. A null member list means the
 * specifier only references the tag.
 */
public abstract class Aggregate extends Node {

    public String name;
    public List<Decl> decls;

    protected Aggregate(String name, List<Decl> decls) {
        this.name = name;
        this.decls = decls;
    }

    public abstract String keyword();

    @Override
    protected void collectChildren(Children out) {
        out.addAll("decls", decls);
    }
}
