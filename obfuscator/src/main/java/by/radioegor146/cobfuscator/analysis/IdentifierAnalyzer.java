package by.radioegor146.cobfuscator.analysis;

import by.radioegor146.cobfuscator.ast.Aggregate;
import by.radioegor146.cobfuscator.ast.ArrayDecl;
import by.radioegor146.cobfuscator.ast.Compound;
import by.radioegor146.cobfuscator.ast.CompoundLiteral;
import by.radioegor146.cobfuscator.ast.Decl;
import by.radioegor146.cobfuscator.ast.EnumType;
import by.radioegor146.cobfuscator.ast.Enumerator;
import by.radioegor146.cobfuscator.ast.FileAST;
import by.radioegor146.cobfuscator.ast.FuncDecl;
import by.radioegor146.cobfuscator.ast.FuncDef;
import by.radioegor146.cobfuscator.ast.Goto;
import by.radioegor146.cobfuscator.ast.ID;
import by.radioegor146.cobfuscator.ast.IdentifierType;
import by.radioegor146.cobfuscator.ast.InitList;
import by.radioegor146.cobfuscator.ast.Label;
import by.radioegor146.cobfuscator.ast.NamedInitializer;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.NodeVisitor;
import by.radioegor146.cobfuscator.ast.ParamList;
import by.radioegor146.cobfuscator.ast.PtrDecl;
import by.radioegor146.cobfuscator.ast.Struct;
import by.radioegor146.cobfuscator.ast.StructRef;
import by.radioegor146.cobfuscator.ast.TypeDecl;
import by.radioegor146.cobfuscator.ast.Typedef;
import by.radioegor146.cobfuscator.ast.Union;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scope and definition-use analysis of one translation unit.
 * <p>
 * A single traversal assigns every node to the statement that owns it and every statement to the
 * scope (a {@link Compound} or the {@link FileAST}) containing it, and records for each
 * statement the identifiers it defines and uses, per C namespace. Every definition keeps the
 * list of tree locations that refer to it, which is what {@link #changeIdent} rewrites.
 * <p>
 * Statements are the direct children of the translation unit and of every compound, a
 * function's parameter list (the first statement of its body) and the statement under a label.
 * <p>
 * State is per run: {@link #process(FileAST)} resets it, and instances must not be shared
 * between concurrent runs.
 */
public class IdentifierAnalyzer extends NodeVisitor {

    private static final Logger logger = LoggerFactory.getLogger(IdentifierAnalyzer.class);

    private static final String LETTERS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private static final class ScopeEdge {
        final Node scope;
        final Node stmt;

        ScopeEdge(Node scope, Node stmt) {
            this.scope = scope;
            this.stmt = stmt;
        }
    }

    private NodeArena arena;
    private ExpressionAnalyzer expressionAnalyzer;
    private FileAST tree;
    private boolean processed;

    private BitSet stmts;
    private NodeTable<Node> nodeStmt;
    private NodeTable<Node> stmtScope;
    private NodeTable<FuncDef> stmtFunction;
    private NodeTable<Node> scopeParent;
    private NodeTable<List<Node>> scopeStmts;
    private NodeTable<List<ScopeEdge>> scopeChildren;
    private NodeTable<Set<Identifier>> stmtUsage;
    private NodeTable<Set<Identifier>> stmtDefinitions;
    private NodeTable<Set<String>> aggregateMembers;
    private NodeTable<List<Label>> functionLabels;
    private NodeTable<List<Goto>> functionGotos;

    private final Map<DefinitionKey, List<Location>> definitionUses = new LinkedHashMap<>();
    private final Map<DefinitionKey, DefinitionKey> definitionAliases = new LinkedHashMap<>();
    private final Map<String, Set<Decl>> functionSpecs = new LinkedHashMap<>();
    private final Set<String> identifiers = new LinkedHashSet<>();
    private final Set<String> functions = new LinkedHashSet<>();
    private final Set<String> typedefs = new LinkedHashSet<>();

    private final List<Map<Identifier, Node>> frames = new ArrayList<>();
    private FuncDef currentFunction;
    private Node currentScope;
    private Aggregate currentAggregate;
    private Node currentStmt;
    private ParamList pendingParams;
    private boolean bodyParams;
    private boolean ignoreParams;
    private int paramListDepth;

    public IdentifierAnalyzer() {
        reset();
    }

    public void reset() {
        arena = new NodeArena();
        expressionAnalyzer = new ExpressionAnalyzer(arena);
        tree = null;
        processed = false;
        stmts = new BitSet();
        nodeStmt = new NodeTable<>(arena);
        stmtScope = new NodeTable<>(arena);
        stmtFunction = new NodeTable<>(arena);
        scopeParent = new NodeTable<>(arena);
        scopeStmts = new NodeTable<>(arena);
        scopeChildren = new NodeTable<>(arena);
        stmtUsage = new NodeTable<>(arena);
        stmtDefinitions = new NodeTable<>(arena);
        aggregateMembers = new NodeTable<>(arena);
        functionLabels = new NodeTable<>(arena);
        functionGotos = new NodeTable<>(arena);
        definitionUses.clear();
        definitionAliases.clear();
        functionSpecs.clear();
        identifiers.clear();
        functions.clear();
        typedefs.clear();
        frames.clear();
        currentFunction = null;
        currentScope = null;
        currentAggregate = null;
        currentStmt = null;
        pendingParams = null;
        bodyParams = false;
        ignoreParams = false;
        paramListDepth = 0;
    }

    /**
     * Analyses the tree from scratch. The expression analyzer runs first, since member accesses
     * are resolved through the inferred type of their base expression.
     */
    public void process(FileAST tree) {
        reset();
        this.tree = tree;
        expressionAnalyzer.process(tree);
        visit(tree);
        processed = true;
        logger.debug("Analysed {} nodes, {} definitions", arena.size(), definitionUses.size());
    }

    public boolean isProcessed() {
        return processed;
    }

    public FileAST getTree() {
        return tree;
    }

    public ExpressionAnalyzer getExpressionAnalyzer() {
        return expressionAnalyzer;
    }

    // Statement and scope structure

    public boolean isStmt(Node node) {
        int index = arena.indexOf(node);
        return index >= 0 && stmts.get(index);
    }

    /**
     * Returns the statement owning a node, or null when the node was not part of the analysed tree.
     */
    public Node getStmt(Node node) {
        return nodeStmt.get(node);
    }

    /**
     * Returns the scope directly containing a statement. Function bodies report the translation unit.
     */
    public Node getStmtCompound(Node stmt) {
        return stmtScope.get(stmt);
    }

    public FuncDef getStmtFunction(Node stmt) {
        return stmtFunction.get(stmt);
    }

    public List<Node> getScopeStmts(Node scope) {
        List<Node> list = scopeStmts.get(scope);
        return list == null ? Collections.emptyList() : Collections.unmodifiableList(list);
    }

    public Node getScopeParent(Node scope) {
        return scopeParent.get(scope);
    }

    /**
     * Every compound nested in the given scope, including itself, in breadth-first order.
     */
    public List<Node> getCompoundsInSubtree(Node scope) {
        List<Node> result = new ArrayList<>();
        Deque<Node> frontier = new ArrayDeque<>();
        frontier.add(scope);
        while (!frontier.isEmpty()) {
            Node current = frontier.poll();
            result.add(current);
            List<ScopeEdge> children = scopeChildren.get(current);
            if (children != null) {
                for (ScopeEdge edge : children) {
                    frontier.add(edge.scope);
                }
            }
        }
        return result;
    }

    public Set<Identifier> getStmtDefinitions(Node stmt) {
        Set<Identifier> set = stmtDefinitions.get(stmt);
        return set == null ? Collections.emptySet() : Collections.unmodifiableSet(set);
    }

    public Set<Identifier> getStmtUsage(Node stmt) {
        Set<Identifier> set = stmtUsage.get(stmt);
        return set == null ? Collections.emptySet() : Collections.unmodifiableSet(set);
    }

    public List<Label> getFunctionLabels(FuncDef function) {
        List<Label> labels = functionLabels.get(function);
        return labels == null ? Collections.emptyList() : Collections.unmodifiableList(labels);
    }

    public Set<String> getFunctions() {
        return Collections.unmodifiableSet(functions);
    }

    public Set<String> getTypedefs() {
        return Collections.unmodifiableSet(typedefs);
    }

    /**
     * Every name defined or used anywhere in the translation unit.
     */
    public Set<String> getIdentifiers() {
        return Collections.unmodifiableSet(identifiers);
    }

    public Map<String, Set<Decl>> getFunctionSpecs() {
        return Collections.unmodifiableMap(functionSpecs);
    }

    /**
     * All definitions in traversal order. Redeclarations of an entity already defined in the same
     * scope are folded into the first definition and not listed separately.
     */
    public List<DefinitionKey> getDefinitions() {
        return new ArrayList<>(definitionUses.keySet());
    }

    public Node getDefinitionStmt(DefinitionKey key) {
        return arena.get(key.getStmtIndex());
    }

    public List<Location> getDefinitionLocations(Node stmt, Identifier identifier) {
        DefinitionKey key = resolve(key(stmt, identifier));
        List<Location> locations = key == null ? null : definitionUses.get(key);
        return locations == null ? Collections.emptyList() : Collections.unmodifiableList(locations);
    }

    // Scope queries

    private int[] coalesceIndexes(Node scope, Node fromStmt, Node toStmt) {
        List<Node> list = scopeStmts.get(scope);
        if (list == null) {
            return new int[]{0, 0};
        }
        int from = fromStmt == null ? 0 : Math.max(0, list.indexOf(fromStmt));
        int to = toStmt == null ? list.size() : list.indexOf(toStmt) + 1;
        return new int[]{from, to};
    }

    public Set<Identifier> getScopeDefinitions(Node scope) {
        return getScopeDefinitions(scope, null, null);
    }

    /**
     * Identifiers defined directly in a scope by the statements between {@code fromStmt} and
     * {@code toStmt} (inclusive; null bounds mean the first and last statement).
     */
    public Set<Identifier> getScopeDefinitions(Node scope, Node fromStmt, Node toStmt) {
        return collectScope(stmtDefinitions, scope, fromStmt, toStmt);
    }

    public Set<Identifier> getScopeUsage(Node scope) {
        return getScopeUsage(scope, null, null);
    }

    public Set<Identifier> getScopeUsage(Node scope, Node fromStmt, Node toStmt) {
        return collectScope(stmtUsage, scope, fromStmt, toStmt);
    }

    private Set<Identifier> collectScope(NodeTable<Set<Identifier>> table, Node scope, Node fromStmt, Node toStmt) {
        Set<Identifier> result = new LinkedHashSet<>();
        List<Node> list = scopeStmts.get(scope);
        if (list == null) {
            return result;
        }
        int[] range = coalesceIndexes(scope, fromStmt, toStmt);
        for (int i = range[0]; i < range[1]; i++) {
            Set<Identifier> set = table.get(list.get(i));
            if (set != null) {
                result.addAll(set);
            }
        }
        return result;
    }

    public Set<Identifier> getNestedScopeDefinitions(Node scope, Node fromStmt, Node toStmt) {
        return collectNested(stmtDefinitions, scope, fromStmt, toStmt);
    }

    public Set<Identifier> getNestedScopeUsage(Node scope, Node fromStmt, Node toStmt) {
        return collectNested(stmtUsage, scope, fromStmt, toStmt);
    }

    private Set<Identifier> collectNested(NodeTable<Set<Identifier>> table, Node scope, Node fromStmt, Node toStmt) {
        Set<Identifier> result = collectScope(table, scope, fromStmt, toStmt);
        List<ScopeEdge> children = scopeChildren.get(scope);
        if (children == null) {
            return result;
        }
        int[] range = coalesceIndexes(scope, fromStmt, toStmt);
        List<Node> list = scopeStmts.get(scope);
        for (ScopeEdge edge : children) {
            int index = list.indexOf(edge.stmt);
            if (index < range[0] || index >= range[1]) {
                continue;
            }
            result.addAll(collectNested(table, edge.scope, null, null));
        }
        return result;
    }

    /**
     * The scopes from the translation unit down to the given scope, innermost first.
     */
    private List<Node> scopePath(Node scope) {
        List<Node> path = new ArrayList<>();
        Node current = scope;
        while (current != null) {
            path.add(current);
            current = scopeParent.get(current);
        }
        return path;
    }

    private Node stmtOfChildScope(Node parent, Node child) {
        List<ScopeEdge> edges = scopeChildren.get(parent);
        if (edges != null) {
            for (ScopeEdge edge : edges) {
                if (edge.scope == child) {
                    return edge.stmt;
                }
            }
        }
        return null;
    }

    /**
     * Identifiers defined by the end of the given statement in its scope and every enclosing scope.
     */
    public Set<Identifier> getDefinitionsAtStmt(Node stmt) {
        Node scope = getStmtCompound(stmt);
        List<Node> path = scopePath(scope);
        Set<Identifier> result = new LinkedHashSet<>();
        for (int i = path.size() - 1; i > 0; i--) {
            Node enclosingStmt = stmtOfChildScope(path.get(i), path.get(i - 1));
            result.addAll(getScopeDefinitions(path.get(i), null, enclosingStmt));
        }
        result.addAll(getScopeDefinitions(scope, null, stmt));
        return result;
    }

    /**
     * Searches backwards from a node through the enclosing scopes for the statement that last
     * defined an identifier, or null when it is not defined at that point.
     */
    public Node getLastDefinition(Node node, Identifier identifier) {
        Node stmt;
        Node scope;
        if (node instanceof Compound || node instanceof FileAST) {
            stmt = null;
            scope = node;
        } else {
            stmt = getStmt(node);
            scope = getStmtCompound(stmt);
        }
        List<Node> path = scopePath(scope);
        Node toStmt = stmt;
        for (int i = 0; i < path.size(); i++) {
            Node current = path.get(i);
            List<Node> list = scopeStmts.get(current);
            int[] range = coalesceIndexes(current, null, toStmt);
            for (int j = range[1] - 1; j >= range[0]; j--) {
                if (getStmtDefinitions(list.get(j)).contains(identifier)) {
                    return list.get(j);
                }
            }
            if (i + 1 < path.size()) {
                toStmt = stmtOfChildScope(path.get(i + 1), current);
            }
        }
        return null;
    }

    /**
     * Identifiers used by the given statement and everything after it in its scope, nested scopes included.
     */
    public Set<Identifier> getUsageFromStmt(Node stmt) {
        return getNestedScopeUsage(getStmtCompound(stmt), stmt, null);
    }

    public Set<String> getRequiredIdentifiers(Node node, NameSpace namespace) {
        return getRequiredIdentifiers(node, namespace, null, false);
    }

    /**
     * Names in one namespace that a new definition at {@code node} must avoid: those used from the
     * node's statement to the end of its scope (nested scopes included), those defined earlier in
     * the same scope (anywhere in it with {@code includeAfter}) and, when inside a function, all of
     * its labels. Member identifiers defined by the node's own statement are left out.
     *
     * @param owner for {@link NameSpace#MEMBER}, the aggregate whose members are meant; null for any
     */
    public Set<String> getRequiredIdentifiers(Node node, NameSpace namespace, Node owner, boolean includeAfter) {
        Node stmt = getStmt(node);
        if (stmt == null) {
            stmt = node;
        }
        Node scope = getStmtCompound(stmt);
        Set<Identifier> required = new LinkedHashSet<>(getUsageFromStmt(stmt));
        required.addAll(includeAfter ? getScopeDefinitions(scope) : getScopeDefinitions(scope, null, stmt));
        FuncDef function = getStmtFunction(stmt);
        if (function != null) {
            for (Label label : getFunctionLabels(function)) {
                required.add(Identifier.label(label.name));
            }
        }
        for (Identifier own : getStmtDefinitions(stmt)) {
            if (own.getNamespace() == NameSpace.MEMBER) {
                required.remove(own);
            }
        }
        Set<String> names = new LinkedHashSet<>();
        for (Identifier identifier : required) {
            if (identifier.isIn(namespace, owner)) {
                names.add(identifier.getName());
            }
        }
        return names;
    }

    /**
     * Returns a name usable for a new definition at the node. It may shadow an outer identifier.
     */
    public String getNewIdentifier(Node node, NameSpace namespace, Collection<String> exclude) {
        Set<String> disallowed = new HashSet<>(getRequiredIdentifiers(node, namespace));
        if (exclude != null) {
            disallowed.addAll(exclude);
        }
        return findNewIdentifier(disallowed);
    }

    /**
     * Returns a name used nowhere in the translation unit, in any namespace.
     */
    public String getUniqueIdentifier(Collection<String> exclude) {
        Set<String> disallowed = new HashSet<>(identifiers);
        if (exclude != null) {
            disallowed.addAll(exclude);
        }
        String name = findNewIdentifier(disallowed);
        identifiers.add(name);
        return name;
    }

    /**
     * Counts through {@code a, b, ..., Z, ab, bb, ...} until a name outside the set that is not a
     * keyword comes up.
     */
    static String findNewIdentifier(Set<String> exclude) {
        String name = "a";
        long count = 0;
        while (exclude.contains(name) || CKeywords.isKeyword(name)) {
            count++;
            StringBuilder sb = new StringBuilder();
            long current = count;
            do {
                sb.append(LETTERS.charAt((int) (current % LETTERS.length())));
                current /= LETTERS.length();
            } while (current != 0);
            name = sb.toString();
        }
        return name;
    }

    // Renaming

    /**
     * Renames one definition and every recorded location referring to it, then updates the
     * definition and usage sets of all statements involved so the analyzer stays usable. Renaming a
     * function carries its recorded forward declarations along.
     *
     * @return false when no such definition was recorded
     */
    public boolean changeIdent(Node definitionNode, Identifier identifier, String newName) {
        Node stmt = getStmt(definitionNode);
        if (stmt == null) {
            stmt = definitionNode;
        }
        DefinitionKey key = resolve(key(stmt, identifier));
        if (key == null || !definitionUses.containsKey(key)) {
            logger.debug("No definition of {} recorded at {}", identifier, stmt);
            return false;
        }
        return changeIdent(key, newName);
    }

    public boolean changeIdent(DefinitionKey definition, String newName) {
        DefinitionKey key = resolve(definition);
        List<Location> locations = key == null ? null : definitionUses.remove(key);
        if (locations == null) {
            return false;
        }
        Identifier oldIdent = key.getIdentifier();
        Identifier newIdent = oldIdent.withName(newName);
        Node defStmt = arena.get(key.getStmtIndex());

        if (oldIdent.getNamespace() == NameSpace.ORDINARY && isFileLevel(defStmt)
                && functionSpecs.containsKey(oldIdent.getName())) {
            Set<Decl> specs = functionSpecs.remove(oldIdent.getName());
            functionSpecs.computeIfAbsent(newName, k -> new LinkedHashSet<>()).addAll(specs);
        }
        if (oldIdent.getNamespace() == NameSpace.MEMBER) {
            Set<String> members = aggregateMembers.get(oldIdent.getOwner());
            if (members != null) {
                members.remove(oldIdent.getName());
                members.add(newName);
            }
        }

        for (Location location : locations) {
            location.write(newName);
        }

        Set<Node> definingStmts = new LinkedHashSet<>();
        definingStmts.add(defStmt);
        Map<DefinitionKey, DefinitionKey> renamedAliases = new LinkedHashMap<>();
        for (Map.Entry<DefinitionKey, DefinitionKey> alias : new ArrayList<>(definitionAliases.entrySet())) {
            if (alias.getValue().equals(key)) {
                definitionAliases.remove(alias.getKey());
                renamedAliases.put(alias.getKey().renamed(newName), key.renamed(newName));
                definingStmts.add(arena.get(alias.getKey().getStmtIndex()));
            }
        }
        definitionAliases.putAll(renamedAliases);

        for (Node s : definingStmts) {
            replace(stmtDefinitions.get(s), oldIdent, newIdent);
            replace(stmtUsage.get(s), oldIdent, newIdent);
        }
        for (Location location : locations) {
            replace(stmtUsage.get(getStmt(location.getNode())), oldIdent, newIdent);
        }
        definitionUses.put(key.renamed(newName), locations);
        identifiers.add(newName);
        return true;
    }

    private static void replace(Set<Identifier> set, Identifier oldIdent, Identifier newIdent) {
        if (set != null && set.remove(oldIdent)) {
            set.add(newIdent);
        }
    }

    private boolean isFileLevel(Node stmt) {
        return stmt instanceof FuncDef || getStmtCompound(stmt) == tree;
    }

    /**
     * Copies each function definition's final name and parameter list into the forward
     * declarations recorded for it. Call once after all renaming is done.
     */
    public void updateFunctionSpecs() {
        if (tree == null) {
            return;
        }
        for (Map.Entry<String, Set<Decl>> entry : functionSpecs.entrySet()) {
            FuncDef definition = null;
            for (Node ext : tree.ext) {
                if (ext instanceof FuncDef && entry.getKey().equals(((FuncDef) ext).getName())) {
                    definition = (FuncDef) ext;
                    break;
                }
            }
            if (definition == null || definition.getFuncDecl() == null) {
                continue;
            }
            for (Decl spec : entry.getValue()) {
                if (!(spec.type instanceof FuncDecl)) {
                    continue;
                }
                FuncDecl specType = (FuncDecl) spec.type;
                specType.args = Node.copyOf(definition.getFuncDecl().args);
                spec.name = entry.getKey();
                TypeDecl typeDecl = getTypeDecl(specType.type);
                if (typeDecl != null) {
                    typeDecl.declname = entry.getKey();
                }
            }
        }
    }

    /**
     * Follows pointer, array and function declarators down to the declaring {@link TypeDecl}.
     */
    public static TypeDecl getTypeDecl(Node node) {
        Node current = node;
        while (current != null) {
            if (current instanceof TypeDecl) {
                return (TypeDecl) current;
            } else if (current instanceof PtrDecl) {
                current = ((PtrDecl) current).type;
            } else if (current instanceof ArrayDecl) {
                current = ((ArrayDecl) current).type;
            } else if (current instanceof FuncDecl) {
                current = ((FuncDecl) current).type;
            } else {
                return null;
            }
        }
        return null;
    }

    // Recording

    private DefinitionKey key(Node stmt, Identifier identifier) {
        int index = arena.indexOf(stmt);
        return index < 0 ? null : new DefinitionKey(index, identifier);
    }

    private DefinitionKey resolve(DefinitionKey key) {
        if (key == null) {
            return null;
        }
        DefinitionKey canonical = definitionAliases.get(key);
        return canonical == null ? key : canonical;
    }

    private void recordStmt(Node stmt) {
        int index = arena.register(stmt);
        stmts.set(index);
        stmtUsage.put(stmt, new LinkedHashSet<>());
        stmtDefinitions.put(stmt, new LinkedHashSet<>());
        nodeStmt.put(stmt, stmt);
        stmtFunction.put(stmt, currentFunction);
    }

    private Node owningStmt(Node node) {
        Node stmt = nodeStmt.get(node);
        return stmt != null ? stmt : currentStmt;
    }

    private void addLocations(DefinitionKey key, List<Location> locations) {
        List<Location> existing = definitionUses.computeIfAbsent(key, k -> new ArrayList<>());
        for (Location location : locations) {
            if (!existing.contains(location)) {
                existing.add(location);
            }
        }
    }

    private void recordDefinition(Node node, Identifier identifier, List<Location> locations,
                                  Map<Identifier, Node> frame) {
        Node stmt = owningStmt(node);
        if (stmt == null) {
            return;
        }
        Map<Identifier, Node> target = frame != null ? frame : frames.get(frames.size() - 1);
        Set<Identifier> defined = stmtDefinitions.get(stmt);
        if (defined != null) {
            defined.add(identifier);
        }
        identifiers.add(identifier.getName());
        Node existing = target.get(identifier);
        DefinitionKey key = key(stmt, identifier);
        boolean redeclarable = target == frames.get(0) || identifier.getNamespace() == NameSpace.TAG;
        if (existing != null && existing != stmt && redeclarable) {
            // File-scope declarations and tags declared again in the same scope name the same entity.
            DefinitionKey canonical = resolve(key(existing, identifier));
            addLocations(canonical, locations);
            definitionAliases.put(key, canonical);
            return;
        }
        target.put(identifier, stmt);
        addLocations(resolve(key), locations);
    }

    private Node lookupDefinition(Identifier identifier) {
        if (identifier.getNamespace() == NameSpace.LABEL) {
            if (currentFunction == null) {
                return null;
            }
            for (Label label : functionLabels.get(currentFunction)) {
                if (identifier.getName().equals(label.name)) {
                    return owningStmt(label);
                }
            }
            return null;
        }
        for (int i = frames.size() - 1; i >= 0; i--) {
            Node stmt = frames.get(i).get(identifier);
            if (stmt != null) {
                return stmt;
            }
        }
        return null;
    }

    private void recordUsage(Node node, Identifier identifier, List<Location> locations) {
        Node stmt = owningStmt(node);
        Node definition = lookupDefinition(identifier);
        if (definition != null) {
            addLocations(resolve(key(definition, identifier)), locations);
        }
        if (stmt != null) {
            stmtUsage.get(stmt).add(identifier);
        }
        identifiers.add(identifier.getName());
    }

    private static List<Location> at(Node node, NameField field) {
        List<Location> list = new ArrayList<>(2);
        list.add(new Location(node, field));
        return list;
    }

    private void markNode(Node node) {
        if (node != null) {
            nodeStmt.put(node, currentStmt);
        }
    }

    /**
     * Wraps every traversal step: statements become the current statement for their subtree and
     * are appended to the current scope, and every node is mapped to its owning statement.
     */
    @Override
    public void visit(Node node) {
        if (node == null) {
            return;
        }
        arena.register(node);
        boolean isStmt = isStmt(node);
        Node prevStmt = currentStmt;
        if (isStmt) {
            currentStmt = node;
            stmtScope.put(node, currentScope);
            stmtFunction.put(node, currentFunction);
            if (currentScope != node) {
                scopeStmts.get(currentScope).add(node);
            }
        }
        nodeStmt.put(node, currentStmt);
        super.visit(node);
        if (isStmt) {
            currentStmt = prevStmt;
        }
    }

    @Override
    public void visitFileAST(FileAST node) {
        frames.add(new LinkedHashMap<>());
        scopeChildren.put(node, new ArrayList<>());
        scopeStmts.put(node, new ArrayList<>());
        currentScope = node;
        for (Node ext : node.ext) {
            recordStmt(ext);
        }
        genericVisit(node);
        frames.remove(frames.size() - 1);
        currentScope = null;
    }

    @Override
    public void visitCompound(Compound node) {
        frames.add(new LinkedHashMap<>());
        scopeChildren.put(node, new ArrayList<>());
        if (currentScope != null) {
            scopeChildren.get(currentScope).add(new ScopeEdge(node, currentStmt));
        }
        scopeParent.put(node, currentScope);
        stmtScope.put(node, currentScope);
        scopeStmts.put(node, new ArrayList<>());
        Node prevScope = currentScope;
        currentScope = node;

        ParamList params = pendingParams;
        pendingParams = null;
        if (params != null) {
            recordStmt(params);
            bodyParams = true;
            visit(params);
        }
        for (Node item : node.blockItems) {
            recordStmt(item);
        }
        genericVisit(node);

        frames.remove(frames.size() - 1);
        currentScope = prevScope;
    }

    @Override
    public void visitFuncDef(FuncDef node) {
        FuncDef prevFunction = currentFunction;
        currentFunction = node;
        functionLabels.put(node, new ArrayList<>());
        functionGotos.put(node, new ArrayList<>());
        visit(node.decl);
        FuncDecl funcDecl = node.getFuncDecl();
        pendingParams = funcDecl == null ? null : funcDecl.args;
        visit(node.body);
        pendingParams = null;
        // Gotos may jump forward, so they are resolved once every label is known.
        for (Goto jump : functionGotos.get(node)) {
            recordUsage(jump, Identifier.label(jump.name), at(jump, NameField.GOTO_NAME));
        }
        currentFunction = prevFunction;
    }

    @Override
    public void visitFuncDecl(FuncDecl node) {
        boolean ownSignature = currentFunction != null && currentFunction.getFuncDecl() == node;
        if (!ownSignature) {
            visit(node.args);
        }
        visit(node.type);
        TypeDecl typeDecl = getTypeDecl(node.type);
        if (typeDecl != null && typeDecl.declname != null) {
            functions.add(typeDecl.declname);
            recordUsage(typeDecl, Identifier.ordinary(typeDecl.declname), at(typeDecl, NameField.TYPE_DECLNAME));
        }
    }

    @Override
    public void visitParamList(ParamList node) {
        boolean prevIgnore = ignoreParams;
        // Only the parameters of the function being defined are definitions; prototype
        // parameter names have no scope of their own here.
        ignoreParams = !bodyParams;
        bodyParams = false;
        paramListDepth++;
        genericVisit(node);
        paramListDepth--;
        ignoreParams = prevIgnore;
    }

    @Override
    public void visitTypedef(Typedef node) {
        if (node.name == null || node.type == null) {
            genericVisit(node);
            return;
        }
        typedefs.add(node.name);
        List<Location> locations = at(node, NameField.TYPEDEF_NAME);
        TypeDecl typeDecl = getTypeDecl(node.type);
        if (typeDecl != null && typeDecl.declname != null) {
            locations.add(new Location(typeDecl, NameField.TYPE_DECLNAME));
        }
        recordDefinition(node, Identifier.ordinary(node.name), locations, null);
        genericVisit(node);
    }

    @Override
    public void visitDecl(Decl node) {
        if (node.name != null && !ignoreParams) {
            List<Location> locations = at(node, NameField.DECL_NAME);
            TypeDecl typeDecl = getTypeDecl(node.type);
            if (typeDecl != null && typeDecl.declname != null) {
                locations.add(new Location(typeDecl, NameField.TYPE_DECLNAME));
            }
            Identifier identifier = currentAggregate == null
                    ? Identifier.ordinary(node.name)
                    : Identifier.member(node.name, currentAggregate);
            recordDefinition(node, identifier, locations, null);
        }
        if (node.name != null && node.type instanceof FuncDecl && paramListDepth == 0
                && (currentFunction == null || currentFunction.decl != node)) {
            functionSpecs.computeIfAbsent(node.name, k -> new LinkedHashSet<>()).add(node);
        }
        if (node.name != null && node.init instanceof InitList) {
            ExprType type = expressionAnalyzer.getType(node);
            if (type != null && type.getKind() == ExprType.Kind.AGGREGATE) {
                visit(node.type);
                visitDesignatedMembers((InitList) node.init, type.getAggregate(), node);
                visit(node.bitsize);
                return;
            }
        }
        genericVisit(node);
    }

    @Override
    public void visitCompoundLiteral(CompoundLiteral node) {
        ExprType type = expressionAnalyzer.getType(node);
        if (type == null || type.getKind() != ExprType.Kind.AGGREGATE || node.init == null) {
            genericVisit(node);
            return;
        }
        visit(node.type);
        visitDesignatedMembers(node.init, type.getAggregate(), node);
    }

    /**
     * Records {@code .field = value} designators of a struct initializer as member usages.
     */
    private void visitDesignatedMembers(InitList init, Aggregate owner, Node user) {
        markNode(init);
        for (Node expr : init.exprs) {
            if (!(expr instanceof NamedInitializer) || ((NamedInitializer) expr).name.isEmpty()) {
                visit(expr);
                continue;
            }
            NamedInitializer named = (NamedInitializer) expr;
            markNode(named);
            Node last = named.name.get(named.name.size() - 1);
            for (Node designator : named.name) {
                if (designator != last) {
                    visit(designator);
                }
            }
            if (last instanceof ID && ((ID) last).name != null) {
                markNode(last);
                recordUsage(user, Identifier.member(((ID) last).name, owner), at(last, NameField.ID_NAME));
            } else {
                visit(last);
            }
            visit(named.expr);
        }
    }

    @Override
    public void visitEnumerator(Enumerator node) {
        if (node.name != null) {
            recordDefinition(node, Identifier.ordinary(node.name), at(node, NameField.ENUMERATOR_NAME), null);
        }
        genericVisit(node);
    }

    @Override
    public void visitStruct(Struct node) {
        visitAggregate(node);
    }

    @Override
    public void visitUnion(Union node) {
        visitAggregate(node);
    }

    private void visitTag(Node node, String name, boolean hasBody, NameField field) {
        if (name == null) {
            return;
        }
        Identifier tag = Identifier.tag(name);
        // A tag reference with nothing visible introduces the tag in the current scope.
        if (hasBody || lookupDefinition(tag) == null) {
            recordDefinition(node, tag, at(node, field), null);
        } else {
            recordUsage(node, tag, at(node, field));
        }
    }

    private void visitAggregate(Aggregate node) {
        visitTag(node, node.name, node.decls != null, NameField.AGGREGATE_NAME);
        if (node.decls == null) {
            return;
        }
        Aggregate prevAggregate = currentAggregate;
        currentAggregate = node;
        frames.add(new LinkedHashMap<>());
        genericVisit(node);
        currentAggregate = prevAggregate;
        wrapMembers(node);
        frames.remove(frames.size() - 1);
    }

    /**
     * Moves the definitions made inside an aggregate body into the enclosing frame. Field names
     * are tagged as members of the aggregate so they never clash with ordinary identifiers; tags
     * and enumerators declared inside the body keep their namespace.
     */
    private void wrapMembers(Aggregate aggregate) {
        if (frames.size() <= 1) {
            return;
        }
        Set<String> members = aggregateMembers.computeIfAbsent(aggregate, LinkedHashSet::new);
        Map<Identifier, Node> inner = frames.get(frames.size() - 1);
        Map<Identifier, Node> outer = frames.get(frames.size() - 2);
        for (Map.Entry<Identifier, Node> entry : inner.entrySet()) {
            Identifier identifier = entry.getKey();
            Node stmt = entry.getValue();
            if (identifier.getNamespace() == NameSpace.MEMBER) {
                outer.put(identifier, stmt);
                if (identifier.getOwner() == aggregate) {
                    members.add(identifier.getName());
                }
            } else if (identifier.getNamespace() == NameSpace.ORDINARY && !isEnumerator(stmt, identifier)) {
                Identifier member = Identifier.member(identifier.getName(), aggregate);
                DefinitionKey oldKey = key(stmt, identifier);
                List<Location> locations = definitionUses.remove(oldKey);
                if (locations != null) {
                    addLocations(key(stmt, member), locations);
                }
                replace(stmtDefinitions.get(stmt), identifier, member);
                outer.put(member, stmt);
                members.add(identifier.getName());
            } else {
                outer.put(identifier, stmt);
            }
        }
        inner.clear();
    }

    private boolean isEnumerator(Node stmt, Identifier identifier) {
        List<Location> locations = definitionUses.get(key(stmt, identifier));
        return locations != null && !locations.isEmpty()
                && locations.get(0).getField() == NameField.ENUMERATOR_NAME;
    }

    @Override
    public void visitEnumType(EnumType node) {
        visitTag(node, node.name, node.values != null, NameField.ENUM_NAME);
        genericVisit(node);
    }

    @Override
    public void visitLabel(Label node) {
        if (node.stmt != null) {
            recordStmt(node.stmt);
        }
        if (node.name != null && currentFunction != null && frames.size() > 1) {
            recordDefinition(node, Identifier.label(node.name), at(node, NameField.LABEL_NAME), frames.get(1));
            functionLabels.get(currentFunction).add(node);
        }
        genericVisit(node);
    }

    @Override
    public void visitGoto(Goto node) {
        if (node.name != null && currentFunction != null) {
            functionGotos.get(currentFunction).add(node);
        }
        genericVisit(node);
    }

    @Override
    public void visitID(ID node) {
        if (node.name != null) {
            recordUsage(node, Identifier.ordinary(node.name), at(node, NameField.ID_NAME));
        }
    }

    @Override
    public void visitIdentifierType(IdentifierType node) {
        String name = node.lastName();
        if (name != null && typedefs.contains(name)) {
            recordUsage(node, Identifier.ordinary(name),
                    Collections.singletonList(new Location(node, NameField.TYPE_NAMES, node.names.size() - 1)));
        }
    }

    @Override
    public void visitStructRef(StructRef node) {
        if (node.name != null && node.field != null && node.field.name != null) {
            ExprType type = expressionAnalyzer.getType(node.name);
            if (type != null && "->".equals(node.type) && type.isIndirect()) {
                type = type.getElement();
            }
            if (type != null && type.getKind() == ExprType.Kind.AGGREGATE) {
                Set<String> members = aggregateMembers.get(type.getAggregate());
                if (members != null && members.contains(node.field.name)) {
                    recordUsage(node, Identifier.member(node.field.name, type.getAggregate()),
                            at(node.field, NameField.ID_NAME));
                }
            }
        }
        visit(node.name);
        markNode(node.field);
    }
}
