package by.radioegor146.cobfuscator.analysis;

import by.radioegor146.cobfuscator.ast.Node;

import java.util.Objects;

/**
 * A name within one namespace. Member identifiers also carry the aggregate that owns them;
 * owners are compared by identity, so two distinct struct definitions never share members.
 */
public final class Identifier {

    private final String name;
    private final NameSpace namespace;
    private final Node owner;

    public Identifier(String name, NameSpace namespace, Node owner) {
        this.name = Objects.requireNonNull(name, "name");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.owner = namespace == NameSpace.MEMBER ? owner : null;
    }

    public static Identifier ordinary(String name) {
        return new Identifier(name, NameSpace.ORDINARY, null);
    }

    public static Identifier tag(String name) {
        return new Identifier(name, NameSpace.TAG, null);
    }

    public static Identifier label(String name) {
        return new Identifier(name, NameSpace.LABEL, null);
    }

    public static Identifier member(String name, Node owner) {
        return new Identifier(name, NameSpace.MEMBER, owner);
    }

    public String getName() {
        return name;
    }

    public NameSpace getNamespace() {
        return namespace;
    }

    public Node getOwner() {
        return owner;
    }

    public Identifier withName(String newName) {
        return new Identifier(newName, namespace, owner);
    }

    public Identifier withOwner(Node newOwner) {
        return new Identifier(name, NameSpace.MEMBER, newOwner);
    }

    /**
     * Whether this identifier lives in the given namespace. A null owner matches members of any aggregate.
     */
    public boolean isIn(NameSpace namespace, Node owner) {
        if (this.namespace != namespace) {
            return false;
        }
        return namespace != NameSpace.MEMBER || owner == null || this.owner == owner;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Identifier)) {
            return false;
        }
        Identifier that = (Identifier) o;
        return name.equals(that.name) && namespace == that.namespace && owner == that.owner;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * name.hashCode() + namespace.hashCode()) + System.identityHashCode(owner);
    }

    @Override
    public String toString() {
        return owner == null ? namespace + ":" + name : namespace + "(" + owner + "):" + name;
    }
}
