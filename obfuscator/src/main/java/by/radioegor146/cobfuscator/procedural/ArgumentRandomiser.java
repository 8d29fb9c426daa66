package by.radioegor146.cobfuscator.procedural;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.analysis.DefinitionKey;
import by.radioegor146.cobfuscator.analysis.ExpressionAnalyzer;
import by.radioegor146.cobfuscator.analysis.Identifier;
import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.analysis.NameSpace;
import by.radioegor146.cobfuscator.ast.Child;
import by.radioegor146.cobfuscator.ast.Decl;
import by.radioegor146.cobfuscator.ast.Directive;
import by.radioegor146.cobfuscator.ast.EllipsisParam;
import by.radioegor146.cobfuscator.ast.ExprList;
import by.radioegor146.cobfuscator.ast.FileAST;
import by.radioegor146.cobfuscator.ast.FuncCall;
import by.radioegor146.cobfuscator.ast.FuncDecl;
import by.radioegor146.cobfuscator.ast.FuncDef;
import by.radioegor146.cobfuscator.ast.ID;
import by.radioegor146.cobfuscator.ast.IdentifierType;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.ParamList;
import by.radioegor146.cobfuscator.ast.StructRef;
import by.radioegor146.cobfuscator.ast.TypeDecl;
import by.radioegor146.cobfuscator.ast.Typename;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Randomises function interfaces: every eligible function gets spurious parameters that its body
 * never reads, and its parameter order is shuffled. Definitions, forward declarations and call
 * sites are changed together.
 * <p>
 * A function is eligible when it is defined in the unit, is not {@code main}, is not variadic,
 * has only named parameters and is referred to by direct calls alone. A function whose address
 * is taken, whose name is redeclared in an inner scope or appears in a macro, or that is called
 * with the wrong number of arguments is left as it is.
 * <p>
 * Spurious arguments are literals of the parameter's type, or, with the configured probability,
 * a variable of exactly that type that is certainly initialised at the call: a parameter of the
 * calling function or a file-scope object.
 */
public class ArgumentRandomiser {

    private static final Logger logger = LoggerFactory.getLogger(ArgumentRandomiser.class);

    private static final Pattern WORD = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final int extra;
    private final double probability;
    private final boolean randomise;

    public ArgumentRandomiser(int extra, double probability, boolean randomise) {
        if (extra < 0) {
            throw new IllegalArgumentException("Number of spurious arguments must not be negative");
        }
        if (probability < 0 || probability > 1) {
            throw new IllegalArgumentException("Variable probability must be within [0, 1]");
        }
        this.extra = extra;
        this.probability = probability;
        this.randomise = randomise;
    }

    /**
     * The new parameter order of one function: where each old parameter went and the type of each
     * spurious one.
     */
    private static final class Reshape {
        final int[] positions;
        final SpuriousType[] spurious;

        Reshape(int[] positions, SpuriousType[] spurious) {
            this.positions = positions;
            this.spurious = spurious;
        }
    }

    /**
     * Reshapes the analysed tree in place.
     *
     * @return how many functions were changed
     */
    public int process(IdentifierAnalyzer analyzer) {
        FileAST tree = analyzer.getTree();
        Set<String> macroWords = collectMacroWords(tree);
        Map<String, FuncDef> candidates = findCandidates(analyzer, macroWords);
        Map<String, List<FuncCall>> calls = new LinkedHashMap<>();
        for (String name : candidates.keySet()) {
            calls.put(name, new ArrayList<>());
        }
        Set<String> rejected = new HashSet<>();
        collectReferences(tree, calls, rejected);
        for (Map.Entry<String, List<FuncCall>> entry : calls.entrySet()) {
            int arity = parameters(candidates.get(entry.getKey())).size();
            for (FuncCall call : entry.getValue()) {
                if (arguments(call).size() != arity) {
                    logger.debug("Call to {} has the wrong number of arguments", entry.getKey());
                    rejected.add(entry.getKey());
                }
            }
        }
        for (String name : rejected) {
            logger.debug("Keeping the interface of {}", name);
            candidates.remove(name);
            calls.remove(name);
        }

        Map<String, Reshape> reshapes = new LinkedHashMap<>();
        for (FuncDef function : candidates.values()) {
            boolean keepOrder = hasOrderedArguments(analyzer.getExpressionAnalyzer(), calls.get(function.getName()));
            reshapes.put(function.getName(), reshape(analyzer, function, macroWords, keepOrder));
        }
        for (Map.Entry<String, List<FuncCall>> entry : calls.entrySet()) {
            Reshape reshape = reshapes.get(entry.getKey());
            for (FuncCall call : entry.getValue()) {
                rewriteCall(analyzer, call, reshape);
            }
        }
        analyzer.updateFunctionSpecs();
        logger.debug("Randomised the interfaces of {} functions", reshapes.size());
        return reshapes.size();
    }

    private static Set<String> collectMacroWords(FileAST tree) {
        Set<String> words = new HashSet<>();
        for (Node ext : tree.ext) {
            if (ext instanceof Directive && !((Directive) ext).text.trim().startsWith("#include")) {
                Matcher matcher = WORD.matcher(((Directive) ext).text);
                while (matcher.find()) {
                    words.add(matcher.group());
                }
            }
        }
        return words;
    }

    private static Map<String, FuncDef> findCandidates(IdentifierAnalyzer analyzer, Set<String> macroWords) {
        Map<String, Integer> definitions = new LinkedHashMap<>();
        for (DefinitionKey key : analyzer.getDefinitions()) {
            Identifier identifier = key.getIdentifier();
            if (identifier.getNamespace() == NameSpace.ORDINARY) {
                definitions.merge(identifier.getName(), 1, Integer::sum);
            }
        }
        Map<String, FuncDef> candidates = new LinkedHashMap<>();
        Set<String> duplicated = new HashSet<>();
        for (Node ext : analyzer.getTree().ext) {
            if (!(ext instanceof FuncDef)) {
                continue;
            }
            FuncDef function = (FuncDef) ext;
            String name = function.getName();
            if (name == null || function.body == null || function.getFuncDecl() == null || "main".equals(name)) {
                continue;
            }
            if (candidates.containsKey(name)) {
                duplicated.add(name);
            }
            if (macroWords.contains(name) || definitions.getOrDefault(name, 0) != 1) {
                logger.debug("{} is named by a macro or redeclared elsewhere", name);
                continue;
            }
            if (parameters(function) == null) {
                logger.debug("{} is variadic or has unnamed parameters", name);
                continue;
            }
            candidates.put(name, function);
        }
        candidates.keySet().removeAll(duplicated);
        return candidates;
    }

    /**
     * The declared parameters, empty for {@code ()} and {@code (void)}, or null when the list has
     * an ellipsis or an unnamed parameter.
     */
    private static List<Node> parameters(FuncDef function) {
        ParamList args = function.getFuncDecl().args;
        if (args == null || args.params.isEmpty() || isVoid(args)) {
            return Collections.emptyList();
        }
        for (Node param : args.params) {
            if (param instanceof EllipsisParam || !(param instanceof Decl) || ((Decl) param).name == null) {
                return null;
            }
        }
        return args.params;
    }

    private static boolean isVoid(ParamList args) {
        if (args.params.size() != 1 || !(args.params.get(0) instanceof Typename)) {
            return false;
        }
        Node type = ((Typename) args.params.get(0)).type;
        return type instanceof TypeDecl && ((TypeDecl) type).type instanceof IdentifierType
                && ((IdentifierType) ((TypeDecl) type).type).names.equals(Collections.singletonList("void"));
    }

    private static List<Node> arguments(FuncCall call) {
        return call.args == null ? Collections.<Node>emptyList() : call.args.exprs;
    }

    /**
     * Sorts every mention of a candidate into its call list; any mention that is not the callee
     * of a call rejects the candidate.
     */
    private static void collectReferences(Node node, Map<String, List<FuncCall>> calls, Set<String> rejected) {
        if (node == null) {
            return;
        }
        if (node instanceof FuncCall && ((FuncCall) node).name instanceof ID) {
            FuncCall call = (FuncCall) node;
            List<FuncCall> found = calls.get(((ID) call.name).name);
            if (found != null) {
                found.add(call);
            }
            if (call.args != null) {
                collectReferences(call.args, calls, rejected);
            }
            return;
        }
        if (node instanceof StructRef) {
            collectReferences(((StructRef) node).name, calls, rejected);
            return;
        }
        if (node instanceof ID && calls.containsKey(((ID) node).name)) {
            rejected.add(((ID) node).name);
        }
        for (Child child : node.children()) {
            collectReferences(child.getNode(), calls, rejected);
        }
    }

    /**
     * Argument evaluation order is unspecified in C, but compilers are consistent about it. When a
     * call passes more than one argument with side effects, the real parameters keep their
     * relative order and only the spurious ones are placed at random.
     */
    private static boolean hasOrderedArguments(ExpressionAnalyzer expressions, List<FuncCall> calls) {
        for (FuncCall call : calls) {
            int mutating = 0;
            for (Node argument : arguments(call)) {
                if (expressions.isMutating(argument)) {
                    mutating++;
                }
            }
            if (mutating > 1) {
                return true;
            }
        }
        return false;
    }

    private Reshape reshape(IdentifierAnalyzer analyzer, FuncDef function, Set<String> macroWords, boolean keepOrder) {
        List<Node> original = new ArrayList<>(parameters(function));
        Set<String> exclude = new HashSet<>(analyzer.getRequiredIdentifiers(function, NameSpace.ORDINARY, null, true));
        for (Identifier identifier : analyzer.getScopeDefinitions(function.body)) {
            exclude.add(identifier.getName());
        }
        exclude.addAll(analyzer.getTypedefs());
        exclude.addAll(macroWords);
        for (Node param : original) {
            exclude.add(((Decl) param).name);
        }

        Map<Node, SpuriousType> added = new LinkedHashMap<>();
        List<SpuriousType> types = Arrays.asList(SpuriousType.values());
        for (int i = 0; i < extra; i++) {
            String name = analyzer.getNewIdentifier(function, NameSpace.ORDINARY, exclude);
            exclude.add(name);
            SpuriousType type = FastRandom.choice(types);
            added.put(type.declare(name), type);
        }

        List<Node> reshaped = new ArrayList<>(original);
        reshaped.addAll(added.keySet());
        if (randomise) {
            if (keepOrder) {
                reshaped = interleave(original, new ArrayList<>(added.keySet()));
            } else {
                FastRandom.shuffle(reshaped);
            }
        }

        int[] positions = new int[original.size()];
        for (int i = 0; i < original.size(); i++) {
            positions[i] = indexOf(reshaped, original.get(i));
        }
        SpuriousType[] spurious = new SpuriousType[reshaped.size()];
        for (int i = 0; i < reshaped.size(); i++) {
            spurious[i] = added.get(reshaped.get(i));
        }
        if (reshaped.isEmpty()) {
            return new Reshape(positions, spurious);
        }
        // The list object stays, the analyzer knows it as the parameters' defining statement.
        FuncDecl funcDecl = function.getFuncDecl();
        if (funcDecl.args == null) {
            funcDecl.args = new ParamList(reshaped);
        } else {
            funcDecl.args.params = reshaped;
        }
        logger.debug("{} now takes {} parameters", function.getName(), reshaped.size());
        return new Reshape(positions, spurious);
    }

    private static List<Node> interleave(List<Node> original, List<Node> added) {
        List<Boolean> slots = new ArrayList<>();
        for (int i = 0; i < original.size(); i++) {
            slots.add(Boolean.FALSE);
        }
        for (int i = 0; i < added.size(); i++) {
            slots.add(Boolean.TRUE);
        }
        FastRandom.shuffle(slots);
        List<Node> result = new ArrayList<>();
        int nextOriginal = 0;
        int nextAdded = 0;
        for (Boolean spurious : slots) {
            result.add(spurious ? added.get(nextAdded++) : original.get(nextOriginal++));
        }
        return result;
    }

    private static int indexOf(List<Node> nodes, Node node) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == node) {
                return i;
            }
        }
        throw new IllegalStateException("Parameter lost while reshaping");
    }

    private void rewriteCall(IdentifierAnalyzer analyzer, FuncCall call, Reshape reshape) {
        List<Node> before = arguments(call);
        Node[] after = new Node[reshape.spurious.length];
        for (int i = 0; i < before.size(); i++) {
            after[reshape.positions[i]] = before.get(i);
        }
        for (int i = 0; i < after.length; i++) {
            if (after[i] == null) {
                after[i] = spuriousArgument(analyzer, call, reshape.spurious[i]);
            }
        }
        List<Node> exprs = new ArrayList<>(Arrays.asList(after));
        if (call.args == null) {
            call.args = new ExprList(exprs);
        } else {
            call.args.exprs = exprs;
        }
    }

    private Node spuriousArgument(IdentifierAnalyzer analyzer, FuncCall call, SpuriousType type) {
        if (probability > 0 && FastRandom.nextDouble() < probability) {
            List<String> variables = initialisedVariables(analyzer, call, type);
            if (!variables.isEmpty()) {
                return new ID(FastRandom.choice(variables));
            }
        }
        return type.randomValue();
    }

    private static List<String> initialisedVariables(IdentifierAnalyzer analyzer, FuncCall call, SpuriousType type) {
        Node stmt = analyzer.getStmt(call);
        if (stmt == null) {
            return Collections.emptyList();
        }
        Set<String> names = new LinkedHashSet<>();
        FuncDef caller = analyzer.getStmtFunction(stmt);
        FuncDecl callerDecl = caller == null ? null : caller.getFuncDecl();
        if (callerDecl != null && callerDecl.args != null) {
            for (Node param : callerDecl.args.params) {
                if (param instanceof Decl && ((Decl) param).name != null && type.matches((Decl) param)
                        && analyzer.getLastDefinition(call, Identifier.ordinary(((Decl) param).name)) == callerDecl.args) {
                    names.add(((Decl) param).name);
                }
            }
        }
        for (Node ext : analyzer.getTree().ext) {
            if (!(ext instanceof Decl)) {
                continue;
            }
            Decl global = (Decl) ext;
            if (global.name == null || global.storage.contains("extern") || global.storage.contains("typedef")
                    || !type.matches(global)) {
                continue;
            }
            if (analyzer.getLastDefinition(call, Identifier.ordinary(global.name)) == global) {
                names.add(global.name);
            }
        }
        return new ArrayList<>(names);
    }
}
