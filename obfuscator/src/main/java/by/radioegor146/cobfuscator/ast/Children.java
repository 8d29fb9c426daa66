package by.radioegor146.cobfuscator.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

public final class Children {

    private final List<Child> children = new ArrayList<>();

    Children() {
    }

    public Children add(String field, Node node, Consumer<Node> setter) {
        if (node != null) {
            children.add(new Child(field, node, setter));
        }
        return this;
    }

    @SuppressWarnings("unchecked")
    public <T extends Node> Children addAll(String field, List<T> nodes) {
        if (nodes == null) {
            return this;
        }
        for (int i = 0; i < nodes.size(); i++) {
            final int index = i;
            add(field + "[" + i + "]", nodes.get(i), n -> nodes.set(index, (T) n));
        }
        return this;
    }

    List<Child> toList() {
        return Collections.unmodifiableList(children);
    }
}
