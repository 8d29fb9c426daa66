package by.radioegor146.cobfuscator.analysis;

import by.radioegor146.cobfuscator.ast.Aggregate;
import by.radioegor146.cobfuscator.ast.ArrayDecl;
import by.radioegor146.cobfuscator.ast.ArrayRef;
import by.radioegor146.cobfuscator.ast.Assignment;
import by.radioegor146.cobfuscator.ast.BinaryOp;
import by.radioegor146.cobfuscator.ast.Cast;
import by.radioegor146.cobfuscator.ast.Compound;
import by.radioegor146.cobfuscator.ast.CompoundLiteral;
import by.radioegor146.cobfuscator.ast.Constant;
import by.radioegor146.cobfuscator.ast.Decl;
import by.radioegor146.cobfuscator.ast.EnumType;
import by.radioegor146.cobfuscator.ast.Enumerator;
import by.radioegor146.cobfuscator.ast.ExprList;
import by.radioegor146.cobfuscator.ast.FileAST;
import by.radioegor146.cobfuscator.ast.FuncCall;
import by.radioegor146.cobfuscator.ast.FuncDecl;
import by.radioegor146.cobfuscator.ast.FuncDef;
import by.radioegor146.cobfuscator.ast.ID;
import by.radioegor146.cobfuscator.ast.IdentifierType;
import by.radioegor146.cobfuscator.ast.InitList;
import by.radioegor146.cobfuscator.ast.NamedInitializer;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.NodeVisitor;
import by.radioegor146.cobfuscator.ast.ParamList;
import by.radioegor146.cobfuscator.ast.PtrDecl;
import by.radioegor146.cobfuscator.ast.Struct;
import by.radioegor146.cobfuscator.ast.StructRef;
import by.radioegor146.cobfuscator.ast.TernaryOp;
import by.radioegor146.cobfuscator.ast.TypeDecl;
import by.radioegor146.cobfuscator.ast.Typedef;
import by.radioegor146.cobfuscator.ast.Typename;
import by.radioegor146.cobfuscator.ast.UnaryOp;
import by.radioegor146.cobfuscator.ast.Union;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bottom-up structural type inference over expressions, with a flag telling whether an
 * expression may have side effects. Consumers use it to restrict generated code to
 * non-mutating integer operands.
 * <p>
 * One instance analyses one tree; call {@link #reset()} before reusing it.
 */
public class ExpressionAnalyzer extends NodeVisitor {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionAnalyzer.class);

    private static final Set<String> INT_WORDS = new HashSet<>(Arrays.asList(
            "int", "char", "short", "long", "signed", "unsigned", "_Bool"));
    private static final Set<String> INT_NAMES = new HashSet<>(Arrays.asList(
            "int8_t", "uint8_t", "int16_t", "uint16_t", "int32_t", "uint32_t", "int64_t", "uint64_t"));
    private static final Set<String> REAL_WORDS = new HashSet<>(Arrays.asList("float", "double"));

    private final NodeArena arena;

    private NodeTable<ExprType> types;
    private NodeTable<Boolean> mutating;
    private NodeTable<Map<String, ExprType>> scopeVariables;
    private NodeTable<Node> scopeParents;

    private final List<Map<String, ExprType>> typeAliases = new ArrayList<>();
    private final List<Map<String, Aggregate>> aggregates = new ArrayList<>();
    private final List<Map<String, ExprType>> variables = new ArrayList<>();
    private final List<Node> scopes = new ArrayList<>();
    private final Map<String, ExprType> functions = new HashMap<>();

    private ParamList functionParams;
    private Map<String, ExprType> paramTarget;
    private Map<String, ExprType> pendingParams;
    private boolean processed;

    public ExpressionAnalyzer() {
        this(new NodeArena());
    }

    /**
     * Creates an analyzer recording into a shared arena, so another analyzer of the same run can
     * key its own tables by the same node indices.
     */
    public ExpressionAnalyzer(NodeArena arena) {
        this.arena = arena;
        reset();
    }

    public void reset() {
        types = new NodeTable<>(arena);
        mutating = new NodeTable<>(arena);
        scopeVariables = new NodeTable<>(arena);
        scopeParents = new NodeTable<>(arena);
        typeAliases.clear();
        aggregates.clear();
        variables.clear();
        scopes.clear();
        functions.clear();
        functionParams = null;
        paramTarget = null;
        pendingParams = null;
        processed = false;
    }

    public void process(FileAST tree) {
        if (processed) {
            reset();
        }
        visit(tree);
        processed = true;
    }

    public boolean isProcessed() {
        return processed;
    }

    /**
     * Returns the inferred type of a node, or null when the node was not analysed.
     */
    public ExprType getType(Node expr) {
        return types.get(expr);
    }

    /**
     * Whether evaluating the node may have side effects. Nodes the analyzer has not seen are
     * assumed to mutate.
     */
    public boolean isMutating(Node expr) {
        if (expr == null) {
            return false;
        }
        Boolean value = mutating.get(expr);
        return value == null || value;
    }

    /**
     * Looks a variable up in the given scope (a {@code Compound} or the translation unit) and
     * its enclosing scopes. Names declared anywhere in a scope are visible from all of it.
     */
    public ExprType getVariableType(Node scope, String name) {
        Node current = scope;
        while (current != null) {
            Map<String, ExprType> vars = scopeVariables.get(current);
            if (vars != null && vars.containsKey(name)) {
                return vars.get(name);
            }
            current = scopeParents.get(current);
        }
        return null;
    }

    public ExprType getFunctionType(String name) {
        ExprType type = functions.get(name);
        return type == null ? ExprType.OTHER : type;
    }

    /**
     * The declared type of a field of the given struct or union, or null when it has no such field.
     */
    public ExprType getFieldType(Aggregate aggregate, String field) {
        if (aggregate.decls == null) {
            return null;
        }
        for (Decl decl : aggregate.decls) {
            if (field.equals(decl.name) && decl.type != null) {
                ExprType type = types.get(decl);
                return type != null ? type : convertType(decl.type);
            }
        }
        return null;
    }

    /**
     * Applies the usual arithmetic coalescing: any OTHER gives OTHER, then any REAL gives REAL,
     * then arrays and pointers propagate their element types, and INT otherwise.
     */
    public static ExprType coalesce(List<ExprType> operands) {
        boolean allArrays = !operands.isEmpty();
        boolean anyPointer = false;
        for (ExprType t : operands) {
            if (t == null || t.getKind() == ExprType.Kind.OTHER) {
                return ExprType.OTHER;
            }
        }
        for (ExprType t : operands) {
            if (t.isReal()) {
                return ExprType.REAL;
            }
            allArrays &= t.getKind() == ExprType.Kind.ARRAY;
            anyPointer |= t.isIndirect();
        }
        if (allArrays) {
            List<ExprType> elements = new ArrayList<>();
            for (ExprType t : operands) {
                elements.add(t.getElement());
            }
            return ExprType.arrayOf(coalesce(elements));
        }
        if (anyPointer) {
            List<ExprType> elements = new ArrayList<>();
            for (ExprType t : operands) {
                elements.add(t.isIndirect() ? t.getElement() : t);
            }
            return ExprType.pointerTo(coalesce(elements));
        }
        return ExprType.INT;
    }

    /**
     * Converts a declarator chain or type specifier into the simplified type lattice, resolving
     * typedef aliases and struct tags visible at the current traversal point.
     */
    public ExprType convertType(Node node) {
        if (node instanceof PtrDecl) {
            return ExprType.pointerTo(convertType(((PtrDecl) node).type));
        } else if (node instanceof ArrayDecl) {
            return ExprType.arrayOf(convertType(((ArrayDecl) node).type));
        } else if (node instanceof TypeDecl) {
            return convertType(((TypeDecl) node).type);
        } else if (node instanceof Typename) {
            return convertType(((Typename) node).type);
        } else if (node instanceof IdentifierType) {
            return convertTypeNames(((IdentifierType) node).names);
        } else if (node instanceof Aggregate) {
            Aggregate aggregate = (Aggregate) node;
            if (aggregate.decls != null) {
                return ExprType.aggregate(aggregate);
            }
            if (aggregate.name == null) {
                return ExprType.OTHER;
            }
            Aggregate definition = lookup(aggregates, aggregate.name);
            return definition == null ? ExprType.OTHER : ExprType.aggregate(definition);
        } else if (node instanceof EnumType) {
            return ExprType.INT;
        }
        return ExprType.OTHER;
    }

    private ExprType convertTypeNames(List<String> names) {
        if (names == null || names.isEmpty()) {
            return ExprType.OTHER;
        }
        boolean allInt = true;
        for (String name : names) {
            if (REAL_WORDS.contains(name)) {
                return ExprType.REAL;
            }
            allInt &= INT_WORDS.contains(name) || INT_NAMES.contains(name);
        }
        if (allInt) {
            return ExprType.INT;
        }
        ExprType alias = lookup(typeAliases, names.get(names.size() - 1));
        return alias == null ? ExprType.OTHER : alias;
    }

    private ExprType convertLiteral(String type) {
        if (type == null || "string".equals(type)) {
            return ExprType.OTHER;
        }
        return convertTypeNames(Arrays.asList(type.split(" ")));
    }

    private static <V> V lookup(List<Map<String, V>> frames, String name) {
        for (int i = frames.size() - 1; i >= 0; i--) {
            V value = frames.get(i).get(name);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private ExprType typeOf(Node node) {
        if (node == null) {
            return ExprType.OTHER;
        }
        ExprType type = types.get(node);
        return type == null ? ExprType.OTHER : type;
    }

    private boolean mutates(Node node) {
        return node != null && isMutating(node);
    }

    private void record(Node node, ExprType type, boolean mutates) {
        types.put(node, type);
        mutating.put(node, mutates);
    }

    private void pushScope(Node scope, Map<String, ExprType> vars) {
        scopeParents.put(scope, scopes.isEmpty() ? null : scopes.get(scopes.size() - 1));
        scopeVariables.put(scope, vars);
        scopes.add(scope);
        typeAliases.add(new HashMap<>());
        aggregates.add(new HashMap<>());
        variables.add(vars);
    }

    private void popScope() {
        scopes.remove(scopes.size() - 1);
        typeAliases.remove(typeAliases.size() - 1);
        aggregates.remove(aggregates.size() - 1);
        variables.remove(variables.size() - 1);
    }

    @Override
    public void visitFileAST(FileAST node) {
        arena.register(node);
        pushScope(node, new HashMap<>());
        genericVisit(node);
        popScope();
    }

    @Override
    public void visitCompound(Compound node) {
        arena.register(node);
        Map<String, ExprType> vars = pendingParams != null ? pendingParams : new HashMap<>();
        pendingParams = null;
        pushScope(node, vars);
        genericVisit(node);
        popScope();
        mutating.put(node, true);
    }

    @Override
    public void visitFuncDef(FuncDef node) {
        FuncDecl funcDecl = node.getFuncDecl();
        if (node.getName() != null && funcDecl != null && funcDecl.type != null) {
            functions.put(node.getName(), convertType(funcDecl.type));
        }
        ParamList prevParams = functionParams;
        functionParams = funcDecl == null ? null : funcDecl.args;
        pendingParams = new HashMap<>();
        visit(node.decl);
        functionParams = prevParams;
        visit(node.body);
        pendingParams = null;
        mutating.put(node, true);
    }

    @Override
    public void visitParamList(ParamList node) {
        Map<String, ExprType> prevTarget = paramTarget;
        paramTarget = node == functionParams && pendingParams != null ? pendingParams : new HashMap<>();
        genericVisit(node);
        paramTarget = prevTarget;
    }

    @Override
    public void visitTypedef(Typedef node) {
        if (node.name != null && node.type != null) {
            typeAliases.get(typeAliases.size() - 1).put(node.name, convertType(node.type));
        }
        genericVisit(node);
        mutating.put(node, true);
    }

    @Override
    public void visitDecl(Decl node) {
        ExprType type = ExprType.OTHER;
        if (node.name != null && node.type != null) {
            type = convertType(node.type);
            if (node.type instanceof FuncDecl && ((FuncDecl) node.type).type != null) {
                functions.putIfAbsent(node.name, convertType(((FuncDecl) node.type).type));
            }
            if (paramTarget != null) {
                paramTarget.put(node.name, type);
            } else {
                variables.get(variables.size() - 1).put(node.name, type);
            }
        }
        record(node, type, true);
        Map<String, ExprType> prevTarget = paramTarget;
        paramTarget = null;
        genericVisit(node);
        paramTarget = prevTarget;
    }

    @Override
    public void visitStruct(Struct node) {
        visitAggregate(node);
    }

    @Override
    public void visitUnion(Union node) {
        visitAggregate(node);
    }

    private void visitAggregate(Aggregate node) {
        if (node.decls == null) {
            record(node, convertType(node), false);
            return;
        }
        if (node.name != null) {
            aggregates.get(aggregates.size() - 1).put(node.name, node);
        }
        record(node, ExprType.aggregate(node), true);
        // Fields are not variables of the enclosing scope.
        variables.add(new HashMap<>());
        genericVisit(node);
        variables.remove(variables.size() - 1);
    }

    @Override
    public void visitEnumType(EnumType node) {
        genericVisit(node);
        record(node, ExprType.INT, false);
    }

    @Override
    public void visitEnumerator(Enumerator node) {
        genericVisit(node);
        if (node.name != null) {
            variables.get(variables.size() - 1).put(node.name, ExprType.INT);
        }
        record(node, ExprType.INT, mutates(node.value));
    }

    @Override
    public void visitUnaryOp(UnaryOp node) {
        genericVisit(node);
        if (node.op == null || node.expr == null) {
            return;
        }
        ExprType operand = typeOf(node.expr);
        switch (node.op) {
            case "++":
            case "--":
            case "p++":
            case "p--":
                record(node, operand, true);
                break;
            case "-":
            case "+":
            case "~":
                record(node, operand, mutates(node.expr));
                break;
            case "!":
                record(node, ExprType.INT, mutates(node.expr));
                break;
            case "sizeof":
            case "_Alignof":
                record(node, ExprType.INT, false);
                break;
            case "&":
                // The address may be written through later.
                record(node, ExprType.pointerTo(operand), true);
                break;
            case "*":
                record(node, operand.isIndirect() ? operand.getElement() : operand, mutates(node.expr));
                break;
            default:
                logger.debug("Unknown unary operator {}", node.op);
                record(node, ExprType.OTHER, true);
                break;
        }
    }

    @Override
    public void visitBinaryOp(BinaryOp node) {
        genericVisit(node);
        if (node.op == null || node.left == null || node.right == null) {
            return;
        }
        boolean mutates = mutates(node.left) || mutates(node.right);
        switch (node.op) {
            case "+":
            case "-":
            case "*":
            case "/":
                record(node, coalesce(Arrays.asList(typeOf(node.left), typeOf(node.right))), mutates);
                break;
            case "%":
            case "<<":
            case ">>":
            case "<":
            case "<=":
            case ">":
            case ">=":
            case "==":
            case "!=":
            case "&&":
            case "||":
            case "&":
            case "|":
            case "^":
                record(node, ExprType.INT, mutates);
                break;
            default:
                logger.debug("Unknown binary operator {}", node.op);
                record(node, ExprType.OTHER, true);
                break;
        }
    }

    @Override
    public void visitTernaryOp(TernaryOp node) {
        genericVisit(node);
        Node typed = node.iftrue != null ? node.iftrue : node.iffalse;
        record(node, typeOf(typed), mutates(node.cond) || mutates(node.iftrue) || mutates(node.iffalse));
    }

    @Override
    public void visitTypename(Typename node) {
        genericVisit(node);
        record(node, node.type == null ? ExprType.OTHER : convertType(node.type), false);
    }

    @Override
    public void visitCast(Cast node) {
        genericVisit(node);
        record(node, typeOf(node.toType), mutates(node.expr));
    }

    @Override
    public void visitArrayRef(ArrayRef node) {
        genericVisit(node);
        ExprType nameType = typeOf(node.name);
        ExprType subscriptType = typeOf(node.subscript);
        ExprType type;
        if (nameType.isIndirect() == subscriptType.isIndirect()) {
            type = ExprType.OTHER;
        } else if (nameType.isIndirect()) {
            type = nameType.getElement();
        } else {
            type = subscriptType.getElement();
        }
        record(node, type, mutates(node.name) || mutates(node.subscript));
    }

    @Override
    public void visitAssignment(Assignment node) {
        genericVisit(node);
        record(node, typeOf(node.lvalue), true);
    }

    @Override
    public void visitFuncCall(FuncCall node) {
        genericVisit(node);
        ExprType type = ExprType.OTHER;
        if (node.name instanceof ID && ((ID) node.name).name != null) {
            type = getFunctionType(((ID) node.name).name);
        }
        record(node, type, true);
    }

    @Override
    public void visitStructRef(StructRef node) {
        genericVisit(node);
        ExprType type = ExprType.OTHER;
        if (node.name != null && node.field != null && node.field.name != null) {
            ExprType owner = typeOf(node.name);
            if ("->".equals(node.type) && owner.isIndirect()) {
                owner = owner.getElement();
            }
            if (owner.getKind() == ExprType.Kind.AGGREGATE) {
                ExprType field = getFieldType(owner.getAggregate(), node.field.name);
                type = field == null ? ExprType.OTHER : field;
            }
        }
        record(node, type, mutates(node.name));
    }

    @Override
    public void visitConstant(Constant node) {
        record(node, convertLiteral(node.type), false);
    }

    @Override
    public void visitID(ID node) {
        ExprType type = node.name == null ? null : lookup(variables, node.name);
        record(node, type == null ? ExprType.OTHER : type, false);
    }

    @Override
    public void visitInitList(InitList node) {
        genericVisit(node);
        boolean mutates = false;
        for (Node expr : node.exprs) {
            mutates |= mutates(expr);
        }
        mutating.put(node, mutates);
    }

    @Override
    public void visitExprList(ExprList node) {
        genericVisit(node);
        boolean mutates = false;
        for (Node expr : node.exprs) {
            mutates |= mutates(expr);
        }
        Node last = node.exprs.isEmpty() ? null : node.exprs.get(node.exprs.size() - 1);
        record(node, typeOf(last), mutates);
    }

    @Override
    public void visitCompoundLiteral(CompoundLiteral node) {
        genericVisit(node);
        record(node, node.type == null ? ExprType.OTHER : convertType(node.type), mutates(node.init));
    }

    @Override
    public void visitNamedInitializer(NamedInitializer node) {
        genericVisit(node);
        record(node, typeOf(node.expr), true);
    }
}
