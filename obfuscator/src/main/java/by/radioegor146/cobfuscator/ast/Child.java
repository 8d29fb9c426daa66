package by.radioegor146.cobfuscator.ast;

import java.util.function.Consumer;

/**
 * One entry of a node's ordered child view: the field it lives in and a way to replace it.
 */
public final class Child {

    private final String field;
    private final Node node;
    private final Consumer<Node> setter;

    Child(String field, Node node, Consumer<Node> setter) {
        this.field = field;
        this.node = node;
        this.setter = setter;
    }

    public String getField() {
        return field;
    }

    public Node getNode() {
        return node;
    }

    public void replace(Node replacement) {
        setter.accept(replacement);
    }
}
