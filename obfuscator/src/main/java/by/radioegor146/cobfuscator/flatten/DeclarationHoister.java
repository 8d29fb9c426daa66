package by.radioegor146.cobfuscator.flatten;

import by.radioegor146.cobfuscator.ObfuscationException;
import by.radioegor146.cobfuscator.analysis.ExprType;
import by.radioegor146.cobfuscator.analysis.Identifier;
import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.analysis.NameSpace;
import by.radioegor146.cobfuscator.ast.ArrayDecl;
import by.radioegor146.cobfuscator.ast.Assignment;
import by.radioegor146.cobfuscator.ast.BinaryOp;
import by.radioegor146.cobfuscator.ast.Case;
import by.radioegor146.cobfuscator.ast.Child;
import by.radioegor146.cobfuscator.ast.Compound;
import by.radioegor146.cobfuscator.ast.Constant;
import by.radioegor146.cobfuscator.ast.Decl;
import by.radioegor146.cobfuscator.ast.DeclList;
import by.radioegor146.cobfuscator.ast.Default;
import by.radioegor146.cobfuscator.ast.Directive;
import by.radioegor146.cobfuscator.ast.DoWhile;
import by.radioegor146.cobfuscator.ast.Enumerator;
import by.radioegor146.cobfuscator.ast.ExprList;
import by.radioegor146.cobfuscator.ast.For;
import by.radioegor146.cobfuscator.ast.FuncCall;
import by.radioegor146.cobfuscator.ast.FuncDecl;
import by.radioegor146.cobfuscator.ast.FuncDef;
import by.radioegor146.cobfuscator.ast.ID;
import by.radioegor146.cobfuscator.ast.IdentifierType;
import by.radioegor146.cobfuscator.ast.If;
import by.radioegor146.cobfuscator.ast.Label;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.PtrDecl;
import by.radioegor146.cobfuscator.ast.Switch;
import by.radioegor146.cobfuscator.ast.TypeDecl;
import by.radioegor146.cobfuscator.ast.Typedef;
import by.radioegor146.cobfuscator.ast.UnaryOp;
import by.radioegor146.cobfuscator.ast.While;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Moves every declaration of a function body to the top of the function.
 * <p>
 * Declarations that would clash once they share the function's outermost scope are renamed
 * first: those shadowing an outer or earlier hoisted name, and those reusing a name the
 * function refers to from outside. The hoisted copy loses its initializer and {@code const};
 * the initializer stays in place as assignments. Variable-length arrays become heap pointers
 * allocated where they were declared.
 * <p>
 * All checks run before the tree is touched, so a function this class rejects with an
 * {@link ObfuscationException} is left exactly as it was.
 */
final class DeclarationHoister {

    private static final Pattern DEFINE = Pattern.compile("^\\s*#\\s*define\\s+([A-Za-z_]\\w*)");

    private final IdentifierAnalyzer analyzer;
    private final FuncDef function;
    private final InitializerDecomposer decomposer;

    private final List<Site> sites = new ArrayList<>();
    private final Set<String> constantNames = new HashSet<>();
    // Heap array name to the variable holding its element count.
    private final Map<String, String> heapLengths = new LinkedHashMap<>();

    DeclarationHoister(IdentifierAnalyzer analyzer, FuncDef function) {
        this.analyzer = analyzer;
        this.function = function;
        this.decomposer = new InitializerDecomposer(analyzer.getExpressionAnalyzer());
    }

    /**
     * A declaration and where it sits: in a statement list, or in the header of a {@code for}.
     */
    private static final class Site {
        final Node node;
        final List<Node> container;
        final For loop;

        Site(Node node, List<Node> container, For loop) {
            this.node = node;
            this.container = container;
            this.loop = loop;
        }
    }

    private static final class Rename {
        final Node stmt;
        final Identifier identifier;
        final String name;

        Rename(Node stmt, Identifier identifier, String name) {
            this.stmt = stmt;
            this.identifier = identifier;
            this.name = name;
        }
    }

    /**
     * What to do with one declaration once all of them have been checked.
     */
    private static final class Plan {
        final Site site;
        final List<Node> replacement;
        Node newType;
        Node headInit;
        Decl lengthDecl;
        Long inferredSize;
        boolean keepInit;

        Plan(Site site, List<Node> replacement) {
            this.site = site;
            this.replacement = replacement;
        }
    }

    /**
     * The outcome of hoisting: declarations for the function head, and the heap arrays that
     * must be released on every way out of the function.
     */
    static final class Result {
        private final List<Node> head;
        private final List<String> heapArrays;
        private final boolean needsStdlib;
        private final boolean needsString;

        Result(List<Node> head, List<String> heapArrays, boolean needsStdlib, boolean needsString) {
            this.head = head;
            this.heapArrays = heapArrays;
            this.needsStdlib = needsStdlib;
            this.needsString = needsString;
        }

        List<Node> getHead() {
            return head;
        }

        List<String> getHeapArrays() {
            return heapArrays;
        }

        boolean needsStdlib() {
            return needsStdlib;
        }

        boolean needsString() {
            return needsString;
        }

        /**
         * Fresh {@code free} calls for every heap array, in declaration order.
         */
        List<Node> releaseStatements() {
            List<Node> frees = new ArrayList<>();
            for (String name : heapArrays) {
                frees.add(call("free", new ID(name)));
            }
            return frees;
        }
    }

    Result hoist() {
        collectConstantNames();
        collectList(function.body.blockItems);
        if (sites.isEmpty()) {
            return new Result(new ArrayList<>(), new ArrayList<>(), false, false);
        }

        Map<Decl, String> finalNames = new IdentityHashMap<>();
        List<Rename> renames = chooseNames(finalNames);

        List<Plan> plans = new ArrayList<>();
        List<String> heapArrays = new ArrayList<>();
        for (Site site : sites) {
            plans.add(plan(site, finalNames, heapArrays));
        }

        for (Rename rename : renames) {
            analyzer.changeIdent(rename.stmt, rename.identifier, rename.name);
        }
        List<Node> head = new ArrayList<>();
        Map<List<Node>, Map<Node, List<Node>>> containers = new IdentityHashMap<>();
        Map<For, List<Node>> loops = new LinkedHashMap<>();
        for (Plan plan : plans) {
            head.add(apply(plan));
            if (plan.lengthDecl != null) {
                head.add(plan.lengthDecl);
            }
            if (plan.site.loop != null) {
                loops.computeIfAbsent(plan.site.loop, k -> new ArrayList<>()).addAll(plan.replacement);
            } else {
                containers.computeIfAbsent(plan.site.container, k -> new IdentityHashMap<>())
                        .put(plan.site.node, plan.replacement);
            }
        }
        for (Map.Entry<List<Node>, Map<Node, List<Node>>> entry : containers.entrySet()) {
            List<Node> rebuilt = new ArrayList<>();
            for (Node item : entry.getKey()) {
                List<Node> replacement = entry.getValue().get(item);
                if (replacement == null) {
                    rebuilt.add(item);
                } else {
                    rebuilt.addAll(replacement);
                }
            }
            entry.getKey().clear();
            entry.getKey().addAll(rebuilt);
        }
        for (Map.Entry<For, List<Node>> entry : loops.entrySet()) {
            List<Node> exprs = entry.getValue();
            entry.getKey().init = exprs.isEmpty() ? null : exprs.size() == 1 ? exprs.get(0) : new ExprList(exprs);
        }
        if (!heapLengths.isEmpty()) {
            rewriteHeapSizes(function.body);
        }
        return new Result(head, heapArrays, !heapArrays.isEmpty(), decomposer.usesMemset());
    }

    // Collection

    private void collectConstantNames() {
        for (Node ext : analyzer.getTree().ext) {
            if (ext instanceof Directive) {
                Matcher matcher = DEFINE.matcher(((Directive) ext).text);
                if (matcher.find()) {
                    constantNames.add(matcher.group(1));
                }
            }
        }
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(analyzer.getTree());
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            if (node instanceof Enumerator) {
                constantNames.add(((Enumerator) node).name);
            }
            for (Child child : node.children()) {
                pending.push(child.getNode());
            }
        }
    }

    private void collectList(List<Node> items) {
        for (Node item : items) {
            if (item instanceof Decl || item instanceof Typedef) {
                sites.add(new Site(item, items, null));
            } else {
                collect(item);
            }
        }
    }

    private void collect(Node node) {
        if (node instanceof Compound) {
            collectList(((Compound) node).blockItems);
        } else if (node instanceof If) {
            collect(((If) node).iftrue);
            collect(((If) node).iffalse);
        } else if (node instanceof While) {
            collect(((While) node).stmt);
        } else if (node instanceof DoWhile) {
            collect(((DoWhile) node).stmt);
        } else if (node instanceof For) {
            For loop = (For) node;
            if (loop.init instanceof DeclList) {
                for (Decl decl : ((DeclList) loop.init).decls) {
                    sites.add(new Site(decl, null, loop));
                }
            }
            collect(loop.stmt);
        } else if (node instanceof Switch) {
            collect(((Switch) node).stmt);
        } else if (node instanceof Case) {
            collectList(((Case) node).stmts);
        } else if (node instanceof Default) {
            collectList(((Default) node).stmts);
        } else if (node instanceof Label) {
            Node stmt = ((Label) node).stmt;
            if (stmt instanceof Decl || stmt instanceof Typedef) {
                throw ObfuscationException.unsupported("label on a declaration");
            }
            collect(stmt);
        }
    }

    // Renaming

    private List<Rename> chooseNames(Map<Decl, String> finalNames) {
        FuncDecl funcDecl = function.getFuncDecl();
        Node entry = funcDecl != null && funcDecl.args != null ? funcDecl.args : function;
        Set<Identifier> outer = new HashSet<>(analyzer.getDefinitionsAtStmt(entry));
        outer.addAll(freeIdentifiers());

        Set<String> pinned = new HashSet<>();
        for (Site site : sites) {
            if (site.node instanceof Decl && isExternal((Decl) site.node)) {
                pinned.add(((Decl) site.node).name);
            }
        }

        List<Rename> renames = new ArrayList<>();
        Set<Identifier> hoisted = new HashSet<>();
        Set<String> chosen = new HashSet<>();
        Set<Node> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Site site : sites) {
            Node stmt = analyzer.getStmt(site.node);
            if (stmt == null) {
                throw ObfuscationException.unsupported("declaration outside the analysed tree");
            }
            if (!seen.add(stmt)) {
                continue;
            }
            for (Identifier identifier : analyzer.getStmtDefinitions(stmt)) {
                NameSpace namespace = identifier.getNamespace();
                if (namespace != NameSpace.ORDINARY && namespace != NameSpace.TAG) {
                    continue;
                }
                if (namespace == NameSpace.ORDINARY && pinned.contains(identifier.getName())) {
                    hoisted.add(identifier);
                    continue;
                }
                if (!hoisted.contains(identifier) && !outer.contains(identifier)) {
                    hoisted.add(identifier);
                    continue;
                }
                String name = freshName(identifier.getName(), chosen);
                chosen.add(name);
                renames.add(new Rename(stmt, identifier, name));
                hoisted.add(identifier.withName(name));
                if (namespace == NameSpace.ORDINARY) {
                    for (Site other : sites) {
                        if (other.node instanceof Decl && analyzer.getStmt(other.node) == stmt
                                && identifier.getName().equals(((Decl) other.node).name)) {
                            finalNames.put((Decl) other.node, name);
                        }
                    }
                }
            }
        }
        return renames;
    }

    /**
     * Ordinary and tag names the function uses without any definition in sight, such as library
     * functions from headers that were not parsed.
     */
    private Set<Identifier> freeIdentifiers() {
        Set<Identifier> free = new HashSet<>();
        for (Node scope : analyzer.getCompoundsInSubtree(function.body)) {
            for (Node stmt : analyzer.getScopeStmts(scope)) {
                for (Identifier used : analyzer.getStmtUsage(stmt)) {
                    NameSpace namespace = used.getNamespace();
                    if ((namespace == NameSpace.ORDINARY || namespace == NameSpace.TAG)
                            && analyzer.getLastDefinition(stmt, used) == null) {
                        free.add(used);
                    }
                }
            }
        }
        return free;
    }

    private String freshName(String base, Set<String> chosen) {
        int suffix = 1;
        String name = base + suffix;
        while (analyzer.getIdentifiers().contains(name) || chosen.contains(name)) {
            suffix++;
            name = base + suffix;
        }
        return name;
    }

    // Planning

    private Plan plan(Site site, Map<Decl, String> finalNames, List<String> heapArrays) {
        if (site.node instanceof Typedef) {
            if (isVariablyModified(((Typedef) site.node).type)) {
                throw ObfuscationException.unsupported("variably modified typedef " + ((Typedef) site.node).name);
            }
            return new Plan(site, new ArrayList<>());
        }
        Decl decl = (Decl) site.node;
        Plan plan = new Plan(site, new ArrayList<>());
        if (decl.name == null || isExternal(decl)) {
            plan.keepInit = true;
            return plan;
        }
        if (decl.storage.contains("static")) {
            if (isVariablyModified(decl.type)) {
                throw ObfuscationException.unsupported("static variable-length array " + decl.name);
            }
            plan.keepInit = true;
            return plan;
        }
        String name = finalNames.getOrDefault(decl, decl.name);
        if (isVariablyModified(decl.type)) {
            planHeapArray(plan, decl, name);
            heapArrays.add(name);
            return plan;
        }
        if (decl.init == null) {
            return plan;
        }
        if (decl.type instanceof ArrayDecl && ((ArrayDecl) decl.type).dim == null) {
            ExprType type = analyzer.getExpressionAnalyzer().getType(decl);
            plan.inferredSize = decomposer.inferLength((ArrayDecl) decl.type, type, decl.init);
        }
        plan.replacement.addAll(decomposer.decompose(decl, name, plan.inferredSize));
        return plan;
    }

    private void planHeapArray(Plan plan, Decl decl, String name) {
        if (!(decl.type instanceof ArrayDecl)) {
            throw ObfuscationException.unsupported("pointer to variable-length array " + decl.name);
        }
        ArrayDecl outer = (ArrayDecl) decl.type;
        if (isVariablyModified(outer.type)) {
            throw ObfuscationException.unsupported("inner variable dimension in " + decl.name);
        }
        if (decl.init != null) {
            throw ObfuscationException.unsupported("initialized variable-length array " + decl.name);
        }
        String length = analyzer.getUniqueIdentifier(null);
        heapLengths.put(name, length);
        plan.lengthDecl = new Decl(length, new TypeDecl(length, null,
                new IdentifierType(new ArrayList<>(Collections.singletonList("long")))), Constant.ofInt(0));
        plan.newType = new PtrDecl(new ArrayList<>(), outer.type);
        plan.headInit = Constant.ofInt(0);
        plan.replacement.add(new Assignment("=", new ID(length), outer.dim));
        plan.replacement.add(call("free", new ID(name)));
        plan.replacement.add(new Assignment("=", new ID(name), call("malloc", heapSize(name, length))));
    }

    private static Node heapSize(String name, String length) {
        return new BinaryOp("*", new UnaryOp("sizeof", new UnaryOp("*", new ID(name))), new ID(length));
    }

    /**
     * {@code sizeof} of a heap array would measure the pointer; it becomes element size times
     * the length saved at allocation.
     */
    private void rewriteHeapSizes(Node node) {
        for (Child child : node.children()) {
            Node current = child.getNode();
            if (current instanceof UnaryOp && "sizeof".equals(((UnaryOp) current).op)
                    && ((UnaryOp) current).expr instanceof ID) {
                String name = ((ID) ((UnaryOp) current).expr).name;
                String length = heapLengths.get(name);
                if (length != null) {
                    child.replace(heapSize(name, length));
                    continue;
                }
            }
            rewriteHeapSizes(current);
        }
    }

    private Node apply(Plan plan) {
        if (!(plan.site.node instanceof Decl)) {
            return plan.site.node;
        }
        Decl decl = (Decl) plan.site.node;
        if (plan.keepInit) {
            return decl;
        }
        if (plan.inferredSize != null) {
            ((ArrayDecl) decl.type).dim = Constant.ofInt(plan.inferredSize);
        }
        if (plan.newType != null) {
            decl.type = plan.newType;
        }
        decl.init = plan.headInit;
        decl.storage.removeIf("register"::equals);
        stripConst(decl);
        return decl;
    }

    // Helpers

    private static boolean isExternal(Decl decl) {
        return decl.storage.contains("extern") || decl.type instanceof FuncDecl;
    }

    /**
     * Drops the {@code const} that applies to the declared object itself; qualifiers of what a
     * pointer points to stay.
     */
    static void stripConst(Decl decl) {
        decl.quals.removeIf("const"::equals);
        Node current = decl.type;
        while (current instanceof ArrayDecl) {
            current = ((ArrayDecl) current).type;
        }
        if (current instanceof PtrDecl) {
            ((PtrDecl) current).quals.removeIf("const"::equals);
        } else if (current instanceof TypeDecl) {
            ((TypeDecl) current).quals.removeIf("const"::equals);
        }
    }

    private boolean isVariablyModified(Node chain) {
        Node current = chain;
        while (current != null) {
            if (current instanceof ArrayDecl) {
                if (isVariable(((ArrayDecl) current).dim)) {
                    return true;
                }
                current = ((ArrayDecl) current).type;
            } else if (current instanceof PtrDecl) {
                current = ((PtrDecl) current).type;
            } else {
                return false;
            }
        }
        return false;
    }

    /**
     * Whether a dimension refers to a variable. Macro and enumerator names are constants, and
     * {@code sizeof} operands are not evaluated.
     */
    private boolean isVariable(Node dim) {
        if (dim == null) {
            return false;
        }
        if (dim instanceof ID) {
            return !constantNames.contains(((ID) dim).name);
        }
        if (dim instanceof UnaryOp && "sizeof".equals(((UnaryOp) dim).op)) {
            return false;
        }
        if (dim instanceof FuncCall) {
            return true;
        }
        for (Child child : dim.children()) {
            if (isVariable(child.getNode())) {
                return true;
            }
        }
        return false;
    }

    static FuncCall call(String name, Node argument) {
        List<Node> args = new ArrayList<>();
        args.add(argument);
        return new FuncCall(new ID(name), new ExprList(args));
    }
}
