package by.radioegor146.cobfuscator.ast;

public final class FuncDef extends Node {

    public Decl decl;
    public Compound body;

    public FuncDef(Decl decl, Compound body) {
        this.decl = decl;
        this.body = body;
    }

    public String getName() {
        return decl == null ? null : decl.name;
    }

    /**
     * Returns the function declarator of this definition, or null when the declaration is malformed.
     */
    public FuncDecl getFuncDecl() {
        if (decl != null && decl.type instanceof FuncDecl) {
            return (FuncDecl) decl.type;
        }
        return null;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNC_DEF;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("decl", decl, n -> decl = (Decl) n);
        out.add("body", body, n -> body = (Compound) n);
    }

    @Override
    public FuncDef copy() {
        return new FuncDef(copyOf(decl), copyOf(body));
    }
}
