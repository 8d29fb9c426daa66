package by.radioegor146.cobfuscator.analysis;

import by.radioegor146.cobfuscator.ast.Aggregate;
import by.radioegor146.cobfuscator.ast.Decl;
import by.radioegor146.cobfuscator.ast.EnumType;
import by.radioegor146.cobfuscator.ast.Enumerator;
import by.radioegor146.cobfuscator.ast.Goto;
import by.radioegor146.cobfuscator.ast.ID;
import by.radioegor146.cobfuscator.ast.IdentifierType;
import by.radioegor146.cobfuscator.ast.Label;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.TypeDecl;
import by.radioegor146.cobfuscator.ast.Typedef;

/**
 * A place in the tree holding one occurrence of an identifier, rewritable in place.
 */
public final class Location {

    private final Node node;
    private final NameField field;
    private final int index;

    public Location(Node node, NameField field) {
        this(node, field, -1);
    }

    public Location(Node node, NameField field, int index) {
        this.node = node;
        this.field = field;
        this.index = index;
    }

    public Node getNode() {
        return node;
    }

    public NameField getField() {
        return field;
    }

    public int getIndex() {
        return index;
    }

    public String read() {
        switch (field) {
            case DECL_NAME:
                return ((Decl) node).name;
            case TYPE_DECLNAME:
                return ((TypeDecl) node).declname;
            case TYPEDEF_NAME:
                return ((Typedef) node).name;
            case AGGREGATE_NAME:
                return ((Aggregate) node).name;
            case ENUM_NAME:
                return ((EnumType) node).name;
            case ENUMERATOR_NAME:
                return ((Enumerator) node).name;
            case ID_NAME:
                return ((ID) node).name;
            case LABEL_NAME:
                return ((Label) node).name;
            case GOTO_NAME:
                return ((Goto) node).name;
            case TYPE_NAMES:
                return ((IdentifierType) node).names.get(index);
            default:
                throw new IllegalStateException("Unknown field " + field);
        }
    }

    public void write(String name) {
        switch (field) {
            case DECL_NAME:
                ((Decl) node).name = name;
                break;
            case TYPE_DECLNAME:
                ((TypeDecl) node).declname = name;
                break;
            case TYPEDEF_NAME:
                ((Typedef) node).name = name;
                break;
            case AGGREGATE_NAME:
                ((Aggregate) node).name = name;
                break;
            case ENUM_NAME:
                ((EnumType) node).name = name;
                break;
            case ENUMERATOR_NAME:
                ((Enumerator) node).name = name;
                break;
            case ID_NAME:
                ((ID) node).name = name;
                break;
            case LABEL_NAME:
                ((Label) node).name = name;
                break;
            case GOTO_NAME:
                ((Goto) node).name = name;
                break;
            case TYPE_NAMES:
                ((IdentifierType) node).names.set(index, name);
                break;
            default:
                throw new IllegalStateException("Unknown field " + field);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Location)) {
            return false;
        }
        Location that = (Location) o;
        return node == that.node && field == that.field && index == that.index;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * System.identityHashCode(node) + field.hashCode()) + index;
    }

    @Override
    public String toString() {
        return node + "." + field + (index >= 0 ? "[" + index + "]" : "");
    }
}
