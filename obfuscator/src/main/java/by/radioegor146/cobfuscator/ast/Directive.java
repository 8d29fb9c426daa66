package by.radioegor146.cobfuscator.ast;

/**
 * A preprocessor line kept verbatim, e.g. {@code #include <stdio.h>}.
 */
public final class Directive extends Node {

    public String text;

    public Directive(String text) {
        this.text = text;
    }

    public boolean isInclude(String header) {
        String stripped = text.replace(" ", "").replace("\t", "");
        return stripped.startsWith("#include<" + header + ">") || stripped.startsWith("#include\"" + header + "\"");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DIRECTIVE;
    }

    @Override
    protected void collectChildren(Children out) {
    }

    @Override
    public Directive copy() {
        return new Directive(text);
    }
}
