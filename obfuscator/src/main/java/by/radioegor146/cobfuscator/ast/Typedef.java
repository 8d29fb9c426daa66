package by.radioegor146.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;

public final class Typedef extends Node {

    public String name;
    public List<String> quals;
    public List<String> storage;
    public Node type;

    public Typedef(String name, List<String> quals, List<String> storage, Node type) {
        this.name = name;
        this.quals = quals == null ? new ArrayList<>() : quals;
        this.storage = storage == null ? new ArrayList<>() : storage;
        this.type = type;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TYPEDEF;
    }

    @Override
    protected void collectChildren(Children out) {
        out.add("type", type, n -> type = n);
    }

    @Override
    public Typedef copy() {
        return new Typedef(name, new ArrayList<>(quals), new ArrayList<>(storage), copyOf(type));
    }
}
