package by.radioegor146.cobfuscator.ast;

/**
 * A {@code for} loop. {@link #init} is an expression, a {@link DeclList} or null.
 */
public final class For extends Node {

    public Node init;
    public Node cond;
    public Node next;
    public Node stmt;

    public For(Node init, Node cond, Node next, Node stmt) {
        this.init = init;
        this.cond = cond;
        this.next = next;
        this.stmt = stmt;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FOR;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("init", init, n -> init = n);
        out.add("cond", cond, n -> cond = n);
        out.add("next", next, n -> next = n);
        out.add("stmt", stmt, n -> stmt = n);
    }

    @Override
    public For copy() {
        return new For(copyOf(init), copyOf(cond), copyOf(next), copyOf(stmt));
    }
}
