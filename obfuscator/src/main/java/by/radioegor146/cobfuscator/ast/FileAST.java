package by.radioegor146.cobfuscator.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Root of a translation unit. External declarations and preprocessor directives, in order.
 */
public final class FileAST extends Node {

    public List<Node> ext;

    public FileAST(List<Node> ext) {
        this.ext = ext == null ? new ArrayList<>() : ext;
    }

    /**
     * Adds {@code #include <header>} at the top unless the header is already included.
     */
    public void ensureInclude(String header) {
        Pattern pattern = Pattern.compile("^\\s*#\\s*include\\s*[<\"]" + Pattern.quote(header) + "[>\"]");
        for (Node node : ext) {
            if (node instanceof Directive && pattern.matcher(((Directive) node).text).find()) {
                return;
            }
        }
        ext.add(0, new Directive("#include <" + header + ">"));
    }

    /**
     * Index of the first external declaration after the leading run of directives.
     */
    public int firstNonDirective() {
        int index = 0;
        while (index < ext.size() && ext.get(index) instanceof Directive) {
            index++;
        }
        return index;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FILE_AST;
    }

    @Override
    protected void collectChildren(Children out) {
        out.addAll("ext", ext);
    }

    @Override
    public FileAST copy() {
        return new FileAST(copyAll(ext));
    }
}
