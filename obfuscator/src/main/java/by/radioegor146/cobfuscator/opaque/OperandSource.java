package by.radioegor146.cobfuscator.opaque;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.analysis.ExprType;
import by.radioegor146.cobfuscator.analysis.Identifier;
import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.ast.Assignment;
import by.radioegor146.cobfuscator.ast.Child;
import by.radioegor146.cobfuscator.ast.Constant;
import by.radioegor146.cobfuscator.ast.Decl;
import by.radioegor146.cobfuscator.ast.Directive;
import by.radioegor146.cobfuscator.ast.ExprList;
import by.radioegor146.cobfuscator.ast.FileAST;
import by.radioegor146.cobfuscator.ast.FuncCall;
import by.radioegor146.cobfuscator.ast.FuncDecl;
import by.radioegor146.cobfuscator.ast.FuncDef;
import by.radioegor146.cobfuscator.ast.ID;
import by.radioegor146.cobfuscator.ast.IdentifierType;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.TypeDecl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Picks the variables opaque predicates are built from.
 * <p>
 * {@link OperandStyle#INPUT} operands are scalar parameters of the enclosing function that are
 * still visible (not shadowed) where the predicate goes. {@link OperandStyle#ENTROPY} operands are
 * global {@code int}s assigned from {@code rand()} at the start of {@code main}; they are created
 * on demand and shared by later predicates. Entropic operands are never used inside {@code main}
 * itself, where a predicate could run before the variables are assigned.
 */
public class OperandSource {

    private static final Logger logger = LoggerFactory.getLogger(OperandSource.class);

    private final IdentifierAnalyzer analyzer;
    private final FileAST tree;
    private final List<OperandStyle> styles;
    private final OperandSourceConfig config;
    private final List<Operand> entropicVariables = new ArrayList<>();

    private FuncDef function;
    private List<Operand> parameters = Collections.emptyList();

    public OperandSource(IdentifierAnalyzer analyzer, Collection<OperandStyle> styles, OperandSourceConfig config) {
        this.analyzer = analyzer;
        this.tree = analyzer.getTree();
        this.styles = new ArrayList<>(styles);
        this.config = config;
    }

    public List<Operand> getEntropicVariables() {
        return Collections.unmodifiableList(entropicVariables);
    }

    public List<Operand> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    /**
     * Switches to a new enclosing function and collects its usable parameters: named, declared
     * directly (no pointer or array declarator) and of an integer or real type, typedefs included.
     */
    public void enterFunction(FuncDef function) {
        this.function = function;
        List<Operand> found = new ArrayList<>();
        FuncDecl funcDecl = function.getFuncDecl();
        if (funcDecl != null && funcDecl.args != null && function.body != null) {
            for (Node param : funcDecl.args.params) {
                if (!(param instanceof Decl)) {
                    continue;
                }
                Decl decl = (Decl) param;
                if (decl.name == null || !(decl.type instanceof TypeDecl)) {
                    continue;
                }
                if (!(((TypeDecl) decl.type).type instanceof IdentifierType)) {
                    continue;
                }
                ExprType type = analyzer.getExpressionAnalyzer().getVariableType(function.body, decl.name);
                if (type == null) {
                    continue;
                }
                if (type.isInt()) {
                    found.add(new Operand(decl.name, false));
                } else if (type.isReal()) {
                    found.add(new Operand(decl.name, true));
                }
            }
        }
        parameters = found;
        logger.debug("Function {} has {} usable parameters", function.getName(), found.size());
    }

    public void exitFunction() {
        function = null;
        parameters = Collections.emptyList();
    }

    /**
     * Chooses operands for a template at a point of the current function. For each operand a style
     * is drawn from the enabled ones, falling back to the others when it has nothing to offer.
     *
     * @param point the statement the predicate is placed in front of, or null for the start of the body
     * @return the operands, or null when the enabled styles cannot supply enough of them
     */
    public List<Operand> select(PredicateTemplate template, Node point) {
        List<Operand> chosen = new ArrayList<>();
        while (chosen.size() < template.getArity()) {
            List<OperandStyle> remaining = new ArrayList<>(styles);
            Operand operand = null;
            while (operand == null && !remaining.isEmpty()) {
                OperandStyle style = remaining.remove(FastRandom.nextInt(remaining.size()));
                switch (style) {
                    case INPUT:
                        operand = pickParameter(chosen, point);
                        break;
                    case ENTROPY:
                        operand = pickEntropic(chosen);
                        break;
                    default:
                        break;
                }
            }
            if (operand == null) {
                return null;
            }
            chosen.add(operand);
        }
        return chosen;
    }

    /**
     * Instantiates a template, or returns null when no operands are available.
     */
    public Node instantiate(PredicateTemplate template, Node point) {
        List<Operand> operands = select(template, point);
        return operands == null ? null : template.instantiate(operands);
    }

    private Operand pickParameter(List<Operand> chosen, Node point) {
        List<Operand> available = new ArrayList<>();
        for (Operand parameter : parameters) {
            if (!chosen.contains(parameter) && isVisible(parameter, point)) {
                available.add(parameter);
            }
        }
        return available.isEmpty() ? null : FastRandom.choice(available);
    }

    private boolean isVisible(Operand parameter, Node point) {
        if (point == null) {
            return true;
        }
        Node anchor = findAnalysed(point);
        if (anchor == null) {
            return false;
        }
        Node definition = analyzer.getLastDefinition(anchor, Identifier.ordinary(parameter.getName()));
        FuncDecl funcDecl = function.getFuncDecl();
        return definition == null || (funcDecl != null && definition == funcDecl.args);
    }

    /**
     * Code moved into constructs built by earlier insertions is no longer a statement the analyzer
     * knows, but the original statements inside it are, and they see the same declarations.
     */
    private Node findAnalysed(Node node) {
        if (analyzer.getStmt(node) != null) {
            return node;
        }
        for (Child child : node.children()) {
            Node found = findAnalysed(child.getNode());
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private Operand pickEntropic(List<Operand> chosen) {
        if (function != null && "main".equals(function.getName())) {
            return null;
        }
        List<Operand> available = new ArrayList<>(entropicVariables);
        available.removeAll(chosen);
        boolean createNew = available.isEmpty() || FastRandom.nextDouble() < config.getNewVariableProbability();
        if (createNew) {
            Operand created = createEntropicVariable();
            if (created != null) {
                entropicVariables.add(created);
                return created;
            }
        }
        return available.isEmpty() ? null : FastRandom.choice(available);
    }

    private Operand createEntropicVariable() {
        FuncDef main = findMain();
        if (main == null) {
            logger.debug("No main function, entropic variables are unavailable");
            return null;
        }
        List<Node> body = main.body.blockItems;
        int srandIndex = findSrandCall(body);
        if (srandIndex < 0) {
            body.add(0, callStatement("srand", new FuncCall(new ID("time"),
                    new ExprList(new ArrayList<>(Collections.singletonList(Constant.ofInt(0)))))));
            srandIndex = 0;
        }
        tree.ensureInclude("time.h");
        tree.ensureInclude("stdlib.h");

        List<String> existing = new ArrayList<>();
        for (Operand operand : entropicVariables) {
            existing.add(operand.getName());
        }
        String name = analyzer.getUniqueIdentifier(existing);
        Decl decl = new Decl(name, new TypeDecl(name, new ArrayList<>(),
                new IdentifierType(new ArrayList<>(Collections.singletonList("int")))), null);
        tree.ext.add(tree.firstNonDirective(), decl);
        body.add(srandIndex + 1, new Assignment("=", new ID(name), new FuncCall(new ID("rand"), null)));
        logger.debug("Created entropic variable {}", name);
        return new Operand(name, false);
    }

    private FuncDef findMain() {
        for (Node ext : tree.ext) {
            if (ext instanceof FuncDef && "main".equals(((FuncDef) ext).getName())
                    && ((FuncDef) ext).body != null) {
                return (FuncDef) ext;
            }
        }
        return null;
    }

    private static int findSrandCall(List<Node> body) {
        for (int i = 0; i < body.size(); i++) {
            Node stmt = body.get(i);
            if (stmt instanceof FuncCall && ((FuncCall) stmt).name instanceof ID
                    && "srand".equals(((ID) ((FuncCall) stmt).name).name)) {
                return i;
            }
        }
        return -1;
    }

    private static FuncCall callStatement(String name, Node argument) {
        return new FuncCall(new ID(name), new ExprList(new ArrayList<>(Collections.singletonList(argument))));
    }
}
