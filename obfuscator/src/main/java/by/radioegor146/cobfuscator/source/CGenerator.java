package by.radioegor146.cobfuscator.source;

import by.radioegor146.cobfuscator.ast.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Regenerates C source from a syntax tree. Operands are parenthesized by precedence, so the
 * output only keeps the parentheses the tree structure needs.
 */
public class CGenerator {

    private static final Map<String, Integer> PRECEDENCE = new HashMap<>();

    static {
        PRECEDENCE.put("||", 0);
        PRECEDENCE.put("&&", 1);
        PRECEDENCE.put("|", 2);
        PRECEDENCE.put("^", 3);
        PRECEDENCE.put("&", 4);
        PRECEDENCE.put("==", 5);
        PRECEDENCE.put("!=", 5);
        PRECEDENCE.put(">", 6);
        PRECEDENCE.put(">=", 6);
        PRECEDENCE.put("<", 6);
        PRECEDENCE.put("<=", 6);
        PRECEDENCE.put(">>", 7);
        PRECEDENCE.put("<<", 7);
        PRECEDENCE.put("+", 8);
        PRECEDENCE.put("-", 8);
        PRECEDENCE.put("*", 9);
        PRECEDENCE.put("/", 9);
        PRECEDENCE.put("%", 9);
    }

    private int indentLevel;

    public static String generateSource(Node node) {
        return new CGenerator().generate(node);
    }

    public String generate(Node node) {
        if (node == null) {
            return "";
        }
        switch (node.kind()) {
            case FILE_AST:
                return generateFile((FileAST) node);
            case DIRECTIVE:
                return ((Directive) node).text;
            case FUNC_DEF:
                return generateFuncDef((FuncDef) node);
            case DECL:
                return generateDecl((Decl) node, false);
            case DECL_LIST:
                return generateDeclList((DeclList) node);
            case TYPEDEF:
                return generateTypedef((Typedef) node);
            case TYPE_DECL:
            case PTR_DECL:
            case ARRAY_DECL:
            case FUNC_DECL:
                return generateType(node, true);
            case TYPENAME:
                return generateType(((Typename) node).type, false);
            case PARAM_LIST:
                return generateParams((ParamList) node);
            case ELLIPSIS_PARAM:
                return "...";
            case IDENTIFIER_TYPE:
                return String.join(" ", ((IdentifierType) node).names);
            case STRUCT:
            case UNION:
                return generateAggregate((Aggregate) node);
            case ENUM:
                return generateEnum((EnumType) node);
            case ENUMERATOR_LIST:
            case ENUMERATOR:
                throw new IllegalStateException("Enumerators are generated with their enum");
            case COMPOUND:
                return generateCompound((Compound) node);
            case IF:
                return generateIf((If) node);
            case WHILE: {
                While loop = (While) node;
                return "while (" + generate(loop.cond) + ")\n" + generateStmt(loop.stmt, true);
            }
            case DO_WHILE: {
                DoWhile loop = (DoWhile) node;
                return "do\n" + generateStmt(loop.stmt, true) + indent() + "while (" + generate(loop.cond) + ");";
            }
            case FOR:
                return generateFor((For) node);
            case SWITCH: {
                Switch sw = (Switch) node;
                return "switch (" + generate(sw.cond) + ")\n" + generateStmt(sw.stmt, true);
            }
            case CASE: {
                Case c = (Case) node;
                return "case " + generate(c.expr) + ":\n" + generateStmts(c.stmts);
            }
            case DEFAULT:
                return "default:\n" + generateStmts(((Default) node).stmts);
            case LABEL: {
                Label label = (Label) node;
                return label.name + ":\n" + generateStmt(label.stmt, false);
            }
            case GOTO:
                return "goto " + ((Goto) node).name + ";";
            case BREAK:
                return "break;";
            case CONTINUE:
                return "continue;";
            case RETURN: {
                Return ret = (Return) node;
                return ret.expr == null ? "return;" : "return " + generate(ret.expr) + ";";
            }
            case EMPTY_STATEMENT:
                return ";";
            case ID:
                return ((ID) node).name;
            case CONSTANT:
                return ((Constant) node).value;
            case UNARY_OP:
                return generateUnary((UnaryOp) node);
            case BINARY_OP:
                return generateBinary((BinaryOp) node);
            case TERNARY_OP: {
                TernaryOp ternary = (TernaryOp) node;
                return parenthesizeUnlessSimple(ternary.cond) + " ? " + parenthesizeUnlessSimple(ternary.iftrue)
                        + " : " + parenthesizeUnlessSimple(ternary.iffalse);
            }
            case ASSIGNMENT:
                return generateAssignment((Assignment) node);
            case FUNC_CALL: {
                FuncCall call = (FuncCall) node;
                return parenthesizeUnlessSimple(call.name) + "(" + (call.args == null ? "" : generate(call.args)) + ")";
            }
            case ARRAY_REF: {
                ArrayRef ref = (ArrayRef) node;
                return parenthesizeUnlessSimple(ref.name) + "[" + generate(ref.subscript) + "]";
            }
            case STRUCT_REF: {
                StructRef ref = (StructRef) node;
                return parenthesizeUnlessSimple(ref.name) + ref.type + generate(ref.field);
            }
            case CAST: {
                Cast cast = (Cast) node;
                return "(" + generate(cast.toType) + ") " + parenthesizeUnlessSimple(cast.expr);
            }
            case COMPOUND_LITERAL: {
                CompoundLiteral literal = (CompoundLiteral) node;
                return "(" + generate(literal.type) + "){" + generate(literal.init) + "}";
            }
            case INIT_LIST:
                return joinExprs(((InitList) node).exprs);
            case NAMED_INITIALIZER:
                return generateNamedInitializer((NamedInitializer) node);
            case EXPR_LIST:
                return joinExprs(((ExprList) node).exprs);
            default:
                throw new IllegalStateException("Unhandled node kind " + node.kind());
        }
    }

    private String generateFile(FileAST file) {
        StringBuilder out = new StringBuilder();
        for (Node ext : file.ext) {
            if (ext instanceof FuncDef) {
                out.append(generate(ext)).append('\n');
            } else if (ext instanceof Directive) {
                out.append(generate(ext)).append('\n');
            } else {
                out.append(generate(ext)).append(";\n");
            }
        }
        return out.toString();
    }

    private String generateFuncDef(FuncDef def) {
        return generate(def.decl) + "\n" + generateCompound(def.body);
    }

    // ------------------------------------------------------------------ declarations

    private String generateDecl(Decl decl, boolean declaratorOnly) {
        StringBuilder out = new StringBuilder();
        if (!declaratorOnly) {
            for (String word : decl.funcspec) {
                out.append(word).append(' ');
            }
            for (String word : decl.storage) {
                out.append(word).append(' ');
            }
            out.append(generateType(decl.type, true));
        } else {
            out.append(generateDeclarator(decl.type, true));
        }
        if (decl.bitsize != null) {
            out.append(" : ").append(generate(decl.bitsize));
        }
        if (decl.init != null) {
            out.append(" = ");
            if (decl.init instanceof InitList) {
                out.append('{').append(generate(decl.init)).append('}');
            } else {
                out.append(generate(decl.init));
            }
        }
        return out.toString();
    }

    private String generateDeclList(DeclList list) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < list.decls.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            out.append(generateDecl(list.decls.get(i), i > 0));
        }
        return out.toString();
    }

    private String generateTypedef(Typedef typedef) {
        StringBuilder out = new StringBuilder();
        for (String word : typedef.storage) {
            out.append(word).append(' ');
        }
        return out.append(generateType(typedef.type, true)).toString();
    }

    /**
     * Generates a full type: base specifiers followed by the declarator.
     */
    public String generateType(Node type, boolean emitDeclname) {
        Node base = type;
        while (base instanceof PtrDecl || base instanceof ArrayDecl || base instanceof FuncDecl) {
            base = declaratorChild(base);
        }
        String declarator = generateDeclarator(type, emitDeclname);
        if (!(base instanceof TypeDecl)) {
            String text = generate(base);
            return declarator.isEmpty() ? text : text + " " + declarator;
        }
        TypeDecl typeDecl = (TypeDecl) base;
        StringBuilder out = new StringBuilder();
        for (String qual : typeDecl.quals) {
            out.append(qual).append(' ');
        }
        out.append(generate(typeDecl.type));
        if (!declarator.isEmpty()) {
            out.append(' ').append(declarator);
        }
        return out.toString();
    }

    private String generateDeclarator(Node type, boolean emitDeclname) {
        List<Node> modifiers = new ArrayList<>();
        Node current = type;
        while (current instanceof PtrDecl || current instanceof ArrayDecl || current instanceof FuncDecl) {
            modifiers.add(current);
            current = declaratorChild(current);
        }
        String result = "";
        if (emitDeclname && current instanceof TypeDecl && ((TypeDecl) current).declname != null) {
            result = ((TypeDecl) current).declname;
        }
        for (int i = 0; i < modifiers.size(); i++) {
            Node modifier = modifiers.get(i);
            boolean afterPointer = i != 0 && modifiers.get(i - 1) instanceof PtrDecl;
            if (modifier instanceof ArrayDecl) {
                ArrayDecl array = (ArrayDecl) modifier;
                if (afterPointer) {
                    result = "(" + result + ")";
                }
                String quals = array.dimQuals.isEmpty() ? "" : String.join(" ", array.dimQuals) + " ";
                result += "[" + quals + generate(array.dim) + "]";
            } else if (modifier instanceof FuncDecl) {
                if (afterPointer) {
                    result = "(" + result + ")";
                }
                result += "(" + generate(((FuncDecl) modifier).args) + ")";
            } else {
                PtrDecl ptr = (PtrDecl) modifier;
                if (ptr.quals.isEmpty()) {
                    result = "*" + result;
                } else {
                    result = "* " + String.join(" ", ptr.quals) + (result.isEmpty() ? "" : " " + result);
                }
            }
        }
        return result;
    }

    private static Node declaratorChild(Node node) {
        if (node instanceof PtrDecl) {
            return ((PtrDecl) node).type;
        } else if (node instanceof ArrayDecl) {
            return ((ArrayDecl) node).type;
        }
        return ((FuncDecl) node).type;
    }

    private String generateParams(ParamList params) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < params.params.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            out.append(generate(params.params.get(i)));
        }
        return out.toString();
    }

    private String generateAggregate(Aggregate aggregate) {
        StringBuilder out = new StringBuilder(aggregate.keyword());
        if (aggregate.name != null) {
            out.append(' ').append(aggregate.name);
        }
        if (aggregate.decls != null) {
            out.append('\n').append(indent()).append("{\n");
            indentLevel += 2;
            for (Decl decl : aggregate.decls) {
                out.append(indent()).append(generateDecl(decl, false)).append(";\n");
            }
            indentLevel -= 2;
            out.append(indent()).append('}');
        }
        return out.toString();
    }

    private String generateEnum(EnumType enumType) {
        StringBuilder out = new StringBuilder("enum");
        if (enumType.name != null) {
            out.append(' ').append(enumType.name);
        }
        if (enumType.values != null) {
            out.append(" {");
            List<Enumerator> enumerators = enumType.values.enumerators;
            for (int i = 0; i < enumerators.size(); i++) {
                Enumerator enumerator = enumerators.get(i);
                out.append(i == 0 ? "" : ", ").append(enumerator.name);
                if (enumerator.value != null) {
                    out.append(" = ").append(generate(enumerator.value));
                }
            }
            out.append('}');
        }
        return out.toString();
    }

    // ------------------------------------------------------------------ statements

    private String indent() {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < indentLevel; i++) {
            out.append(' ');
        }
        return out.toString();
    }

    private String generateStmt(Node stmt, boolean addIndent) {
        if (addIndent) {
            indentLevel += 2;
        }
        String indent = indent();
        String result;
        switch (stmt.kind()) {
            case DECL:
            case ASSIGNMENT:
            case CAST:
            case UNARY_OP:
            case BINARY_OP:
            case TERNARY_OP:
            case FUNC_CALL:
            case ARRAY_REF:
            case STRUCT_REF:
            case CONSTANT:
            case ID:
            case TYPEDEF:
            case EXPR_LIST:
            case COMPOUND_LITERAL:
                result = indent + generate(stmt) + ";\n";
                break;
            case COMPOUND:
                result = generate(stmt);
                break;
            case DIRECTIVE:
                result = generate(stmt) + "\n";
                break;
            default: {
                String text = generate(stmt);
                result = indent + text + (text.endsWith("\n") ? "" : "\n");
                break;
            }
        }
        if (addIndent) {
            indentLevel -= 2;
        }
        return result;
    }

    private String generateStmts(List<Node> stmts) {
        StringBuilder out = new StringBuilder();
        for (Node stmt : stmts) {
            out.append(generateStmt(stmt, true));
        }
        return out.toString();
    }

    private String generateCompound(Compound compound) {
        String indent = indent();
        StringBuilder out = new StringBuilder(indent).append("{\n");
        indentLevel += 2;
        for (Node item : compound.blockItems) {
            out.append(generateStmt(item, false));
        }
        indentLevel -= 2;
        return out.append(indent).append("}\n").toString();
    }

    private String generateIf(If node) {
        StringBuilder out = new StringBuilder("if (").append(generate(node.cond)).append(")\n");
        out.append(generateStmt(node.iftrue, true));
        if (node.iffalse != null) {
            out.append(indent()).append("else\n").append(generateStmt(node.iffalse, true));
        }
        return out.toString();
    }

    private String generateFor(For node) {
        StringBuilder out = new StringBuilder("for (");
        out.append(generate(node.init)).append(';');
        if (node.cond != null) {
            out.append(' ').append(generate(node.cond));
        }
        out.append(';');
        if (node.next != null) {
            out.append(' ').append(generate(node.next));
        }
        return out.append(")\n").append(generateStmt(node.stmt, true)).toString();
    }

    // ------------------------------------------------------------------ expressions

    private static boolean isSimple(Node node) {
        return node instanceof Constant || node instanceof ID || node instanceof ArrayRef
                || node instanceof StructRef || node instanceof FuncCall;
    }

    private String parenthesizeUnlessSimple(Node node) {
        String text = generate(node);
        return isSimple(node) ? text : "(" + text + ")";
    }

    private String generateUnary(UnaryOp node) {
        switch (node.op) {
            case "sizeof":
                return "sizeof(" + generate(node.expr) + ")";
            case "p++":
                return parenthesizeUnlessSimple(node.expr) + "++";
            case "p--":
                return parenthesizeUnlessSimple(node.expr) + "--";
            default: {
                String operand = parenthesizeUnlessSimple(node.expr);
                if (operand.startsWith("-") || operand.startsWith("+") || operand.startsWith("&")) {
                    operand = "(" + operand + ")";
                }
                return node.op + operand;
            }
        }
    }

    private String generateBinary(BinaryOp node) {
        int precedence = PRECEDENCE.getOrDefault(node.op, -1);
        String left = generate(node.left);
        if (!isSimple(node.left) && !(node.left instanceof BinaryOp
                && PRECEDENCE.getOrDefault(((BinaryOp) node.left).op, -1) >= precedence)) {
            left = "(" + left + ")";
        }
        String right = generate(node.right);
        if (!isSimple(node.right) && !(node.right instanceof BinaryOp
                && PRECEDENCE.getOrDefault(((BinaryOp) node.right).op, -1) > precedence)) {
            right = "(" + right + ")";
        }
        return left + " " + node.op + " " + right;
    }

    private String generateAssignment(Assignment node) {
        String rvalue = generate(node.rvalue);
        if (node.rvalue instanceof Assignment || node.rvalue instanceof ExprList) {
            rvalue = "(" + rvalue + ")";
        }
        return generate(node.lvalue) + " " + node.op + " " + rvalue;
    }

    private String generateNamedInitializer(NamedInitializer node) {
        StringBuilder out = new StringBuilder();
        for (Node name : node.name) {
            if (name instanceof ID) {
                out.append('.').append(((ID) name).name);
            } else {
                out.append('[').append(generate(name)).append(']');
            }
        }
        out.append(" = ");
        if (node.expr instanceof InitList) {
            out.append('{').append(generate(node.expr)).append('}');
        } else {
            out.append(generate(node.expr));
        }
        return out.toString();
    }

    private String joinExprs(List<Node> exprs) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            Node expr = exprs.get(i);
            if (expr instanceof InitList) {
                out.append('{').append(generate(expr)).append('}');
            } else if (expr instanceof ExprList) {
                out.append('(').append(generate(expr)).append(')');
            } else {
                out.append(generate(expr));
            }
        }
        return out.toString();
    }
}
