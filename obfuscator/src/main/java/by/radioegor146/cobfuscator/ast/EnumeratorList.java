package by.radioegor146.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;

public final class EnumeratorList extends Node {

    public List<Enumerator> enumerators;

    public EnumeratorList(List<Enumerator> enumerators) {
        this.enumerators = enumerators == null ? new ArrayList<>() : enumerators;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ENUMERATOR_LIST;
    }

    @Override
    protected void collectChildren(Children out) {
        out.addAll("enumerators", enumerators);
    }

    @Override
    public EnumeratorList copy() {
        return new EnumeratorList(copyAll(enumerators));
    }
}
