package by.radioegor146.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * A declaration of a single name. The declarator chain hangs off {@link #type}.
 */
public final class Decl extends Node {

    public String name;
    public List<String> quals;
    public List<String> storage;
    public List<String> funcspec;
    public Node type;
    public Node init;
    public Node bitsize;

    public Decl(String name, List<String> quals, List<String> storage, List<String> funcspec,
                Node type, Node init, Node bitsize) {
        this.name = name;
        this.quals = quals == null ? new ArrayList<>() : quals;
        this.storage = storage == null ? new ArrayList<>() : storage;
        this.funcspec = funcspec == null ? new ArrayList<>() : funcspec;
        this.type = type;
        this.init = init;
        this.bitsize = bitsize;
    }

    public Decl(String name, Node type, Node init) {
        this(name, null, null, null, type, init, null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DECL;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("type", type, n -> type = n);
        out.add("init", init, n -> init = n);
        out.add("bitsize", bitsize, n -> bitsize = n);
    }

    @Override
    public Decl copy() {
        return new Decl(name, new ArrayList<>(quals), new ArrayList<>(storage), new ArrayList<>(funcspec),
                copyOf(type), copyOf(init), copyOf(bitsize));
    }
}
