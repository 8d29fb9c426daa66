package by.radioegor146.cobfuscator.encode;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.analysis.ExprType;
import by.radioegor146.cobfuscator.analysis.ExpressionAnalyzer;
import by.radioegor146.cobfuscator.ast.ArrayDecl;
import by.radioegor146.cobfuscator.ast.BinaryOp;
import by.radioegor146.cobfuscator.ast.Case;
import by.radioegor146.cobfuscator.ast.Child;
import by.radioegor146.cobfuscator.ast.Constant;
import by.radioegor146.cobfuscator.ast.Decl;
import by.radioegor146.cobfuscator.ast.Enumerator;
import by.radioegor146.cobfuscator.ast.FileAST;
import by.radioegor146.cobfuscator.ast.NamedInitializer;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.UnaryOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Rewrites integer arithmetic with equivalent mixed boolean-arithmetic expressions, e.g.
 * {@code x + y} becomes {@code (x ^ y) + ((x & y) << 1)}.
 * <p>
 * Only side-effect free expressions whose operands are all integers are rewritten, since the
 * identities duplicate operands and only hold in two's complement integer arithmetic. Each
 * expression is rewritten up to {@code depth} times, the outermost operator of the previous
 * rewrite being the one rewritten next.
 */
public class ArithmeticEncoder {

    private static final Logger logger = LoggerFactory.getLogger(ArithmeticEncoder.class);

    private static final Map<String, List<Function<UnaryOp, Node>>> UNARY_IDENTITIES = new HashMap<>();
    private static final Map<String, List<Function<BinaryOp, Node>>> BINARY_IDENTITIES = new HashMap<>();

    static {
        UNARY_IDENTITIES.put("-", Arrays.asList(
                // -x = ~x + 1
                n -> new BinaryOp("+", not(n.expr), one()),
                // -x = ~(x - 1)
                n -> new UnaryOp("~", new BinaryOp("-", copy(n.expr), one()))
        ));
        UNARY_IDENTITIES.put("~", Arrays.asList(
                // ~x = -x - 1
                n -> new BinaryOp("-", new UnaryOp("-", copy(n.expr)), one())
        ));
        BINARY_IDENTITIES.put("+", Arrays.asList(
                // x + y = x - ~y - 1
                n -> new BinaryOp("-", new BinaryOp("-", copy(n.left), not(n.right)), one()),
                // x + y = (x ^ y) + 2 * (x & y)
                n -> new BinaryOp("+", op("^", n), twice(op("&", n))),
                // x + y = (x | y) + (x & y)
                n -> new BinaryOp("+", op("|", n), op("&", n)),
                // x + y = 2 * (x | y) - (x ^ y)
                n -> new BinaryOp("-", twice(op("|", n)), op("^", n))
        ));
        BINARY_IDENTITIES.put("-", Arrays.asList(
                // x - y = x + ~y + 1
                n -> new BinaryOp("+", new BinaryOp("+", copy(n.left), not(n.right)), one()),
                // x - y = (x ^ y) - 2 * (~x & y)
                n -> new BinaryOp("-", op("^", n), twice(new BinaryOp("&", not(n.left), copy(n.right)))),
                // x - y = (x & ~y) - (~x & y)
                n -> new BinaryOp("-", new BinaryOp("&", copy(n.left), not(n.right)),
                        new BinaryOp("&", not(n.left), copy(n.right))),
                // x - y = 2 * (x & ~y) - (x ^ y)
                n -> new BinaryOp("-", twice(new BinaryOp("&", copy(n.left), not(n.right))), op("^", n))
        ));
        BINARY_IDENTITIES.put("^", Arrays.asList(
                // x ^ y = (x | y) - (x & y)
                n -> new BinaryOp("-", op("|", n), op("&", n))
        ));
        BINARY_IDENTITIES.put("|", Arrays.asList(
                // x | y = (x & ~y) + y
                n -> new BinaryOp("+", new BinaryOp("&", copy(n.left), not(n.right)), copy(n.right))
        ));
        BINARY_IDENTITIES.put("&", Arrays.asList(
                // x & y = (~x | y) - ~x
                n -> new BinaryOp("-", new BinaryOp("|", not(n.left), copy(n.right)), not(n.left))
        ));
    }

    private final int depth;

    private ExpressionAnalyzer types;
    private Set<Node> encodable;
    private int encoded;

    public ArithmeticEncoder(int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("Encoding depth must not be negative");
        }
        this.depth = depth;
    }

    public int getDepth() {
        return depth;
    }

    /**
     * Encodes the tree in place.
     *
     * @return how many expressions were rewritten
     */
    public int process(FileAST tree) {
        encoded = 0;
        if (depth == 0) {
            return 0;
        }
        types = new ExpressionAnalyzer();
        types.process(tree);
        encodable = Collections.newSetFromMap(new IdentityHashMap<>());
        mark(tree, false);
        types = null;
        encode(tree);
        encodable = null;
        logger.debug("Encoded {} integer expressions", encoded);
        return encoded;
    }

    /**
     * Records what may be rewritten before anything changes, since rewritten subtrees are
     * unknown to the analyzer. Constant expressions the compiler must fold are skipped.
     */
    private void mark(Node node, boolean constant) {
        if (!constant && isEncodable(node)) {
            encodable.add(node);
        }
        for (Child child : node.children()) {
            boolean constantChild = constant
                    || node instanceof Case && "expr".equals(child.getField())
                    || node instanceof ArrayDecl && "dim".equals(child.getField())
                    || node instanceof Decl && "bitsize".equals(child.getField())
                    || node instanceof NamedInitializer && "name".equals(child.getField())
                    || node instanceof Enumerator;
            mark(child.getNode(), constantChild);
        }
    }

    private void encode(Node node) {
        List<Child> children = node.children();
        for (Child child : children) {
            encode(child.getNode());
        }
        for (Child child : children) {
            Node current = child.getNode();
            if (!encodable.contains(current)) {
                continue;
            }
            for (int applied = 0; applied < depth; applied++) {
                Node next = substitute(current);
                if (next == null) {
                    break;
                }
                current = next;
            }
            if (current != child.getNode()) {
                child.replace(current);
                encoded++;
            }
        }
    }

    private boolean isEncodable(Node node) {
        if (node instanceof UnaryOp) {
            UnaryOp unary = (UnaryOp) node;
            return UNARY_IDENTITIES.containsKey(unary.op) && isPlainInteger(node) && isPlainInteger(unary.expr);
        }
        if (node instanceof BinaryOp) {
            BinaryOp binary = (BinaryOp) node;
            return BINARY_IDENTITIES.containsKey(binary.op) && isPlainInteger(node)
                    && isPlainInteger(binary.left) && isPlainInteger(binary.right);
        }
        return false;
    }

    private boolean isPlainInteger(Node expr) {
        ExprType type = types.getType(expr);
        return type != null && type.isInt() && !types.isMutating(expr);
    }

    private static Node substitute(Node node) {
        if (node instanceof UnaryOp) {
            List<Function<UnaryOp, Node>> options = UNARY_IDENTITIES.get(((UnaryOp) node).op);
            return options == null ? null : FastRandom.choice(options).apply((UnaryOp) node);
        }
        if (node instanceof BinaryOp) {
            List<Function<BinaryOp, Node>> options = BINARY_IDENTITIES.get(((BinaryOp) node).op);
            return options == null ? null : FastRandom.choice(options).apply((BinaryOp) node);
        }
        return null;
    }

    private static Node copy(Node node) {
        return Node.copyOf(node);
    }

    private static Node not(Node node) {
        return new UnaryOp("~", copy(node));
    }

    private static Node op(String op, BinaryOp operands) {
        return new BinaryOp(op, copy(operands.left), copy(operands.right));
    }

    private static Node twice(Node node) {
        return new BinaryOp("<<", node, one());
    }

    private static Node one() {
        return Constant.ofInt(1);
    }
}
