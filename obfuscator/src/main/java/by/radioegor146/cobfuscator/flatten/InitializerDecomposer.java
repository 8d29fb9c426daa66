package by.radioegor146.cobfuscator.flatten;

import by.radioegor146.cobfuscator.ObfuscationException;
import by.radioegor146.cobfuscator.analysis.ExprType;
import by.radioegor146.cobfuscator.analysis.ExpressionAnalyzer;
import by.radioegor146.cobfuscator.ast.Aggregate;
import by.radioegor146.cobfuscator.ast.ArrayDecl;
import by.radioegor146.cobfuscator.ast.ArrayRef;
import by.radioegor146.cobfuscator.ast.Assignment;
import by.radioegor146.cobfuscator.ast.BinaryOp;
import by.radioegor146.cobfuscator.ast.Constant;
import by.radioegor146.cobfuscator.ast.Decl;
import by.radioegor146.cobfuscator.ast.ExprList;
import by.radioegor146.cobfuscator.ast.FuncCall;
import by.radioegor146.cobfuscator.ast.ID;
import by.radioegor146.cobfuscator.ast.InitList;
import by.radioegor146.cobfuscator.ast.NamedInitializer;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.PtrDecl;
import by.radioegor146.cobfuscator.ast.StructRef;
import by.radioegor146.cobfuscator.ast.TypeDecl;
import by.radioegor146.cobfuscator.ast.UnaryOp;
import by.radioegor146.cobfuscator.ast.Union;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns the initializer of a local declaration into plain assignments, so the declaration can
 * move to the top of its function while the initialization stays where it was.
 * <p>
 * Brace lists are followed member by member and index by index, honouring designators. A flat
 * list for a multi-dimensional array with constant dimensions is unravelled in row-major order.
 * When the assignments do not provably cover the whole object, the object is zeroed with
 * {@code memset} first, as the implicit zero-initialization of the omitted parts requires.
 */
final class InitializerDecomposer {

    private final ExpressionAnalyzer expressions;
    private boolean usesMemset;

    InitializerDecomposer(ExpressionAnalyzer expressions) {
        this.expressions = expressions;
    }

    /**
     * @param name      the name the declared object will have once renaming is applied
     * @param outerSize the inferred size of an unsized outer array, or null
     */
    List<Node> decompose(Decl decl, String name, Long outerSize) {
        List<Node> out = new ArrayList<>();
        ExprType type = expressions.getType(decl);
        boolean complete = assign(new ID(name), decl.type, type, decl.init, outerSize, out);
        if (!complete) {
            out.add(0, zeroFill(name));
            usesMemset = true;
        }
        return out;
    }

    boolean usesMemset() {
        return usesMemset;
    }

    /**
     * The number of elements an initializer gives an array declared without an outer size.
     */
    long inferLength(ArrayDecl array, ExprType type, Node init) {
        if (isPlainString(init)) {
            return splitCharacters((Constant) init).size() + 1;
        }
        if (isBracedString(array, init)) {
            return splitCharacters((Constant) ((InitList) init).exprs.get(0)).size() + 1;
        }
        if (!(init instanceof InitList)) {
            throw ObfuscationException.unsupported("array initialized from an expression");
        }
        List<Node> items = ((InitList) init).exprs;
        ExprType element = elementOf(type);
        if (isElided(items, array.type, element)) {
            long stride = product(innerDimensions(array.type));
            return (items.size() + stride - 1) / stride;
        }
        long index = 0;
        long length = 0;
        for (Node item : items) {
            if (item instanceof NamedInitializer) {
                index = designatorIndex(((NamedInitializer) item).name.get(0));
            }
            index++;
            length = Math.max(length, index);
        }
        return length;
    }

    private boolean assign(Node target, Node chain, ExprType type, Node init, Long outerSize, List<Node> out) {
        if (isBracedString(chain, init)) {
            return assignString(target, (ArrayDecl) chain, (Constant) ((InitList) init).exprs.get(0), outerSize, out);
        }
        if (init instanceof InitList) {
            List<Node> items = ((InitList) init).exprs;
            if (chain instanceof ArrayDecl) {
                return assignArray(target, (ArrayDecl) chain, type, items, outerSize, out);
            }
            if (type != null && type.getKind() == ExprType.Kind.AGGREGATE && !(chain instanceof PtrDecl)) {
                return assignAggregate(target, type.getAggregate(), items, out);
            }
            if (type != null && type.getKind() == ExprType.Kind.ARRAY) {
                throw ObfuscationException.unsupported("brace initializer of an array typedef");
            }
            if (items.isEmpty()) {
                return false;
            }
            if (items.get(0) instanceof NamedInitializer) {
                throw ObfuscationException.unsupported("designator in a scalar initializer");
            }
            return assign(target, chain, type, items.get(0), outerSize, out);
        }
        if (chain instanceof ArrayDecl) {
            if (!isPlainString(init)) {
                throw ObfuscationException.unsupported("array initialized from " + init.kind());
            }
            return assignString(target, (ArrayDecl) chain, (Constant) init, outerSize, out);
        }
        out.add(new Assignment("=", target, init));
        return true;
    }

    private boolean assignArray(Node target, ArrayDecl array, ExprType type, List<Node> items, Long outerSize,
                                List<Node> out) {
        Long size = outerSize != null ? outerSize : evaluate(array.dim);
        ExprType element = elementOf(type);
        if (isElided(items, array.type, element)) {
            return unravel(target, array, items, size, out);
        }
        Set<Long> covered = new HashSet<>();
        boolean complete = true;
        long index = 0;
        for (Node item : items) {
            Node value = item;
            if (item instanceof NamedInitializer) {
                NamedInitializer named = (NamedInitializer) item;
                index = designatorIndex(named.name.get(0));
                value = rest(named);
                complete &= named.name.size() == 1;
            }
            Node elementTarget = new ArrayRef(target.copy(), Constant.ofInt(index));
            complete &= assign(elementTarget, array.type, element, value, null, out);
            covered.add(index);
            index++;
        }
        return complete && size != null && covered.size() == size && index <= size;
    }

    private boolean unravel(Node target, ArrayDecl array, List<Node> items, Long size, List<Node> out) {
        for (Node item : items) {
            if (item instanceof NamedInitializer || item instanceof InitList) {
                throw ObfuscationException.unsupported("partially braced array initializer");
            }
        }
        List<Long> dimensions = innerDimensions(array.type);
        long stride = product(dimensions);
        for (int i = 0; i < items.size(); i++) {
            Node element = new ArrayRef(target.copy(), Constant.ofInt(i / stride));
            long offset = i % stride;
            long remaining = stride;
            for (long dimension : dimensions) {
                remaining /= dimension;
                element = new ArrayRef(element, Constant.ofInt(offset / remaining));
                offset %= remaining;
            }
            out.add(new Assignment("=", element, items.get(i)));
        }
        return size != null && items.size() == size * stride;
    }

    private boolean assignAggregate(Node target, Aggregate aggregate, List<Node> items, List<Node> out) {
        if (aggregate.decls == null) {
            throw ObfuscationException.unsupported("initializer of an incomplete aggregate");
        }
        List<Decl> members = new ArrayList<>();
        for (Decl member : aggregate.decls) {
            // Unnamed bit-fields take no initializer.
            if (member.name != null || member.bitsize == null) {
                members.add(member);
            }
        }
        boolean union = aggregate instanceof Union;
        if (union && items.size() > 1) {
            throw ObfuscationException.unsupported("union initializer with several values");
        }
        Set<String> covered = new HashSet<>();
        boolean complete = !union;
        int position = 0;
        for (Node item : items) {
            Node value = item;
            if (item instanceof NamedInitializer) {
                NamedInitializer named = (NamedInitializer) item;
                Node designator = named.name.get(0);
                if (!(designator instanceof ID)) {
                    throw ObfuscationException.unsupported("index designator in a struct initializer");
                }
                position = memberIndex(members, ((ID) designator).name);
                value = rest(named);
                complete &= named.name.size() == 1;
            }
            if (position >= members.size()) {
                throw ObfuscationException.unsupported("excess elements in a struct initializer");
            }
            Decl member = members.get(position);
            if (member.name == null) {
                throw ObfuscationException.unsupported("initializer of an anonymous member");
            }
            if (isConstObject(member.type)) {
                throw ObfuscationException.unsupported("initializer of const member " + member.name);
            }
            ExprType memberType = expressions.getFieldType(aggregate, member.name);
            if (!(value instanceof InitList) && !matchesElement(value, member.type, memberType)) {
                throw ObfuscationException.unsupported("brace elision in a struct initializer");
            }
            Node memberTarget = new StructRef(target.copy(), ".", new ID(member.name));
            complete &= assign(memberTarget, member.type, memberType, value, null, out);
            covered.add(member.name);
            position++;
        }
        for (Decl member : members) {
            complete &= member.name != null && covered.contains(member.name);
        }
        return complete;
    }

    private boolean assignString(Node target, ArrayDecl array, Constant literal, Long outerSize, List<Node> out) {
        Long size = outerSize != null ? outerSize : evaluate(array.dim);
        List<String> characters = splitCharacters(literal);
        for (int i = 0; i < characters.size(); i++) {
            out.add(new Assignment("=", new ArrayRef(target.copy(), Constant.ofInt(i)),
                    new Constant("char", "'" + characters.get(i) + "'")));
        }
        if (size == null) {
            return false;
        }
        if (characters.size() < size) {
            out.add(new Assignment("=", new ArrayRef(target.copy(), Constant.ofInt(characters.size())),
                    new Constant("char", "'\\0'")));
        }
        return characters.size() + 1 >= size;
    }

    /**
     * Whether a list leaves out the braces of its sub-aggregates, i.e. holds a plain value where
     * an element needs a brace list of its own.
     */
    private boolean isElided(List<Node> items, Node elementChain, ExprType element) {
        if (!needsBraces(elementChain, element)) {
            return false;
        }
        for (Node item : items) {
            Node value = item instanceof NamedInitializer ? ((NamedInitializer) item).expr : item;
            if (!(value instanceof InitList) && !matchesElement(value, elementChain, element)) {
                if (item instanceof NamedInitializer && ((NamedInitializer) item).name.size() == 1) {
                    throw ObfuscationException.unsupported("brace elision after a designator");
                }
                if (!(item instanceof NamedInitializer)) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean needsBraces(Node chain, ExprType type) {
        if (chain instanceof ArrayDecl) {
            return true;
        }
        return !(chain instanceof PtrDecl) && type != null
                && (type.getKind() == ExprType.Kind.AGGREGATE || type.getKind() == ExprType.Kind.ARRAY);
    }

    /**
     * Whether a plain value initializes a whole element: a string for a character array, or a
     * struct-typed expression for a struct.
     */
    private boolean matchesElement(Node value, Node chain, ExprType type) {
        if (!needsBraces(chain, type)) {
            return true;
        }
        if (chain instanceof ArrayDecl) {
            return isPlainString(value);
        }
        ExprType valueType = expressions.getType(value);
        return valueType != null && valueType.getKind() == ExprType.Kind.AGGREGATE;
    }

    private List<Long> innerDimensions(Node chain) {
        List<Long> dimensions = new ArrayList<>();
        Node current = chain;
        while (current instanceof ArrayDecl) {
            Long dimension = evaluate(((ArrayDecl) current).dim);
            if (dimension == null || dimension <= 0) {
                throw ObfuscationException.unsupported("brace elision over an array of unknown size");
            }
            dimensions.add(dimension);
            current = ((ArrayDecl) current).type;
        }
        if (!(current instanceof TypeDecl) || dimensions.isEmpty()) {
            throw ObfuscationException.unsupported("brace elision over structures");
        }
        return dimensions;
    }

    private static long product(List<Long> values) {
        long result = 1;
        for (long value : values) {
            result *= value;
        }
        return result;
    }

    private static ExprType elementOf(ExprType type) {
        return type != null && type.getKind() == ExprType.Kind.ARRAY ? type.getElement() : ExprType.OTHER;
    }

    private static Node rest(NamedInitializer named) {
        if (named.name.size() == 1) {
            return named.expr;
        }
        List<Node> tail = new ArrayList<>(named.name.subList(1, named.name.size()));
        return new InitList(new ArrayList<>(Arrays.asList(new NamedInitializer(tail, named.expr))));
    }

    private static int memberIndex(List<Decl> members, String name) {
        for (int i = 0; i < members.size(); i++) {
            if (name.equals(members.get(i).name)) {
                return i;
            }
        }
        throw ObfuscationException.unsupported("designator names no member " + name);
    }

    private static long designatorIndex(Node designator) {
        Long index = designator instanceof ID ? null : evaluate(designator);
        if (index == null || index < 0) {
            throw ObfuscationException.unsupported("non-constant array designator");
        }
        return index;
    }

    static boolean isConstObject(Node chain) {
        Node current = chain;
        while (current instanceof ArrayDecl) {
            current = ((ArrayDecl) current).type;
        }
        if (current instanceof PtrDecl) {
            return ((PtrDecl) current).quals.contains("const");
        }
        return current instanceof TypeDecl && ((TypeDecl) current).quals.contains("const");
    }

    /**
     * {@code char s[] = {"text"}}: a single string in braces initializing a character array.
     */
    private static boolean isBracedString(Node chain, Node init) {
        return chain instanceof ArrayDecl && ((ArrayDecl) chain).type instanceof TypeDecl
                && init instanceof InitList && ((InitList) init).exprs.size() == 1
                && isPlainString(((InitList) init).exprs.get(0));
    }

    private static boolean isPlainString(Node node) {
        return node instanceof Constant && "string".equals(((Constant) node).type);
    }

    /**
     * Splits a string literal into the spellings of its characters, each usable between single
     * quotes.
     */
    static List<String> splitCharacters(Constant literal) {
        String text = literal.value;
        if (!text.startsWith("\"") || !text.endsWith("\"") || text.length() < 2) {
            throw ObfuscationException.unsupported("prefixed string literal " + text);
        }
        String body = text.substring(1, text.length() - 1);
        List<String> characters = new ArrayList<>();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\') {
                characters.add(c == '\'' ? "\\'" : String.valueOf(c));
                i++;
                continue;
            }
            int end = i + 2;
            char kind = i + 1 < body.length() ? body.charAt(i + 1) : '\\';
            if (kind >= '0' && kind <= '7') {
                while (end < body.length() && end < i + 4 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
                    end++;
                }
            } else if (kind == 'x') {
                while (end < body.length() && Character.digit(body.charAt(end), 16) >= 0) {
                    end++;
                }
            }
            characters.add(body.substring(i, Math.min(end, body.length())));
            i = end;
        }
        return characters;
    }

    /**
     * Folds an integer constant expression, or returns null when it is not one.
     */
    static Long evaluate(Node node) {
        if (node instanceof Constant) {
            Constant constant = (Constant) node;
            if (constant.isInteger()) {
                return Constant.parseInteger(constant.value);
            }
            if ("char".equals(constant.type) && constant.value.length() == 3) {
                return (long) constant.value.charAt(1);
            }
            return null;
        }
        if (node instanceof ExprList && ((ExprList) node).exprs.size() == 1) {
            return evaluate(((ExprList) node).exprs.get(0));
        }
        if (node instanceof UnaryOp) {
            UnaryOp unary = (UnaryOp) node;
            Long value = evaluate(unary.expr);
            if (value == null) {
                return null;
            }
            switch (unary.op) {
                case "-":
                    return -value;
                case "+":
                    return value;
                case "~":
                    return ~value;
                case "!":
                    return value == 0 ? 1L : 0L;
                default:
                    return null;
            }
        }
        if (node instanceof BinaryOp) {
            BinaryOp binary = (BinaryOp) node;
            Long left = evaluate(binary.left);
            Long right = evaluate(binary.right);
            if (left == null || right == null) {
                return null;
            }
            switch (binary.op) {
                case "+":
                    return left + right;
                case "-":
                    return left - right;
                case "*":
                    return left * right;
                case "/":
                    return right == 0 ? null : left / right;
                case "%":
                    return right == 0 ? null : left % right;
                case "<<":
                    return left << right;
                case ">>":
                    return left >> right;
                case "&":
                    return left & right;
                case "|":
                    return left | right;
                case "^":
                    return left ^ right;
                default:
                    return null;
            }
        }
        return null;
    }

    private static FuncCall zeroFill(String name) {
        List<Node> args = new ArrayList<>();
        args.add(new UnaryOp("&", new ID(name)));
        args.add(Constant.ofInt(0));
        args.add(new UnaryOp("sizeof", new ID(name)));
        return new FuncCall(new ID("memset"), new ExprList(args));
    }
}
