package by.radioegor146.cobfuscator.opaque;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.ast.BinaryOp;
import by.radioegor146.cobfuscator.ast.Constant;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.UnaryOp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Library of opaque predicates.
 * <p>
 * TRUE predicates are number-theoretic identities that hold for every operand value. Each
 * identity only holds while its arithmetic cannot overflow a 32-bit {@code int}, so it is
 * prefixed with a range check: {@code (x > B || x < -B) || identity}, where {@code B} is the
 * largest magnitude for which the identity is exact. Outside that range the check itself makes
 * the predicate true, and short-circuit evaluation keeps the overflowing arithmetic from running.
 * For unsigned operands {@code x < -B} compares against a huge value and is always true.
 * <p>
 * EITHER predicates are plain comparisons whose truth value depends on runtime data.
 */
public final class OpaquePredicates {

    public static final List<String> COMPARISON_OPS = Collections.unmodifiableList(
            Arrays.asList(">", ">=", "<", "<=", "==", "!="));
    public static final List<String> ARITHMETIC_OPS = Collections.unmodifiableList(
            Arrays.asList("+", "-", "*"));

    private static final Map<String, String> FLIPPED = new HashMap<>();

    static {
        FLIPPED.put("==", "!=");
        FLIPPED.put("!=", "==");
        FLIPPED.put("<", ">=");
        FLIPPED.put(">=", "<");
        FLIPPED.put(">", "<=");
        FLIPPED.put("<=", ">");
    }

    // Largest |x| with x * x representable.
    private static final long SQUARE_BOUND = 46340;
    // Largest |x| with x * (x + 1) + 7 representable.
    private static final long PRONIC_BOUND = 46339;
    // Largest |x| with 7 * x * x + 1 representable.
    private static final long SEVEN_SQUARE_BOUND = 17515;
    // Largest |x| with x * (x + 1) * (x + 2) representable, rounded down.
    private static final long CUBIC_BOUND = 1280;

    public static final List<PredicateTemplate> TRUE_PREDICATES;
    public static final List<PredicateTemplate> EITHER_PREDICATES;

    static {
        List<PredicateTemplate> truths = new ArrayList<>();
        truths.add(new PredicateTemplate("x*x >= 0", 1, o -> guarded(o, bounds(SQUARE_BOUND),
                bin(">=", bin("*", x(o), x(o)), lit(0)))));
        truths.add(new PredicateTemplate("x*-x <= 0", 1, o -> guarded(o, bounds(SQUARE_BOUND),
                bin("<=", bin("*", x(o), new UnaryOp("-", x(o))), lit(0)))));
        truths.add(new PredicateTemplate("7*(y*y) != x*x+1", 2, o -> guarded(o, bounds(SQUARE_BOUND, SEVEN_SQUARE_BOUND),
                bin("!=", bin("*", lit(7), bin("*", y(o), y(o))), bin("+", bin("*", x(o), x(o)), lit(1))))));
        truths.add(new PredicateTemplate("7*(y*y)-1 != x*x", 2, o -> guarded(o, bounds(SQUARE_BOUND, SEVEN_SQUARE_BOUND),
                bin("!=", bin("-", bin("*", lit(7), bin("*", y(o), y(o))), lit(1)), bin("*", x(o), x(o))))));
        truths.add(new PredicateTemplate("(x*(x+1))%2 == 0", 1, o -> guarded(o, bounds(PRONIC_BOUND),
                bin("==", bin("%", bin("*", x(o), bin("+", x(o), lit(1))), lit(2)), lit(0)))));
        truths.add(new PredicateTemplate("(x*(1+x))%2 != 1", 1, o -> guarded(o, bounds(PRONIC_BOUND),
                bin("!=", bin("%", bin("*", x(o), bin("+", lit(1), x(o))), lit(2)), lit(1)))));
        truths.add(new PredicateTemplate("(x*((x+1)*(x+2)))%3 == 0", 1, o -> guarded(o, bounds(CUBIC_BOUND),
                bin("==", bin("%", bin("*", x(o), bin("*", bin("+", x(o), lit(1)), bin("+", x(o), lit(2)))),
                        lit(3)), lit(0)))));
        truths.add(new PredicateTemplate("((x+1)*(x*(x+2)))%3 != 1", 1, o -> guarded(o, bounds(CUBIC_BOUND),
                bin("!=", bin("%", bin("*", bin("+", x(o), lit(1)), bin("*", x(o), bin("+", x(o), lit(2)))),
                        lit(3)), lit(1)))));
        truths.add(new PredicateTemplate("((x+2)*((x+1)*x))%3 != 2", 1, o -> guarded(o, bounds(CUBIC_BOUND),
                bin("!=", bin("%", bin("*", bin("+", x(o), lit(2)), bin("*", bin("+", x(o), lit(1)), x(o))),
                        lit(3)), lit(2)))));
        truths.add(new PredicateTemplate("((7*x)*x+1)%7 != 0", 1, o -> guarded(o, bounds(SEVEN_SQUARE_BOUND),
                bin("!=", bin("%", bin("+", bin("*", bin("*", lit(7), x(o)), x(o)), lit(1)), lit(7)), lit(0)))));
        truths.add(new PredicateTemplate("((x*x+x)+7)%81 != 0", 1, o -> guarded(o, bounds(PRONIC_BOUND),
                bin("!=", bin("%", bin("+", bin("+", bin("*", x(o), x(o)), x(o)), lit(7)), lit(81)), lit(0)))));
        truths.add(new PredicateTemplate("(((x+1)*x)+7)%81 != 0", 1, o -> guarded(o, bounds(PRONIC_BOUND),
                bin("!=", bin("%", bin("+", bin("*", bin("+", x(o), lit(1)), x(o)), lit(7)), lit(81)), lit(0)))));
        TRUE_PREDICATES = Collections.unmodifiableList(truths);

        List<PredicateTemplate> either = new ArrayList<>();
        either.add(new PredicateTemplate("x", 1, OpaquePredicates::x));
        either.add(new PredicateTemplate("!x", 1, o -> new UnaryOp("!", x(o))));
        either.add(new PredicateTemplate("x op 0", 1, o -> bin(comparison(), x(o), lit(0))));
        either.add(new PredicateTemplate("x op c", 1, o -> bin(comparison(), x(o),
                lit(FastRandom.nextIntInclusive(-25, 25)))));
        either.add(new PredicateTemplate("x op y", 2, o -> bin(comparison(), x(o), y(o))));
        either.add(new PredicateTemplate("(x op y) && (y op z)", 3, o -> bin("&&",
                bin(comparison(), x(o), y(o)), bin(comparison(), y(o), z(o)))));
        either.add(new PredicateTemplate("(x op y) || (y op z)", 3, o -> bin("||",
                bin(comparison(), x(o), y(o)), bin(comparison(), y(o), z(o)))));
        either.add(new PredicateTemplate("(x arith y) op z", 3, o -> bin(comparison(),
                bin(FastRandom.choice(ARITHMETIC_OPS), x(o), y(o)), z(o))));
        EITHER_PREDICATES = Collections.unmodifiableList(either);
    }

    private OpaquePredicates() {
    }

    public static PredicateTemplate randomTrue() {
        return FastRandom.choice(TRUE_PREDICATES);
    }

    public static PredicateTemplate randomEither() {
        return FastRandom.choice(EITHER_PREDICATES);
    }

    /**
     * Logical negation by rewriting: comparisons are flipped, {@code &&} and {@code ||} are pushed
     * through with De Morgan's laws, {@code !e} becomes {@code e}, anything else is wrapped in
     * {@code !}. The result may share operand subtrees with the argument.
     */
    public static Node negate(Node expr) {
        if (expr instanceof BinaryOp) {
            BinaryOp op = (BinaryOp) expr;
            String flipped = FLIPPED.get(op.op);
            if (flipped != null) {
                return new BinaryOp(flipped, op.left, op.right);
            }
            if ("&&".equals(op.op)) {
                return new BinaryOp("||", negate(op.left), negate(op.right));
            }
            if ("||".equals(op.op)) {
                return new BinaryOp("&&", negate(op.left), negate(op.right));
            }
        } else if (expr instanceof UnaryOp && "!".equals(((UnaryOp) expr).op)) {
            return ((UnaryOp) expr).expr;
        }
        return new UnaryOp("!", expr);
    }

    private static long[] bounds(long... values) {
        return values;
    }

    private static Node guarded(List<Operand> operands, long[] bounds, Node identity) {
        Node guard = null;
        for (int i = 0; i < operands.size(); i++) {
            long bound = bounds[Math.min(i, bounds.length - 1)];
            Node above = bin(">", operands.get(i).toExpression(), lit(bound));
            Node below = bin("<", operands.get(i).toExpression(), lit(-bound));
            Node check = bin("||", above, below);
            guard = guard == null ? check : bin("||", guard, check);
        }
        return bin("||", guard, identity);
    }

    private static String comparison() {
        return FastRandom.choice(COMPARISON_OPS);
    }

    private static Node x(List<Operand> operands) {
        return operands.get(0).toExpression();
    }

    private static Node y(List<Operand> operands) {
        return operands.get(1).toExpression();
    }

    private static Node z(List<Operand> operands) {
        return operands.get(2).toExpression();
    }

    private static BinaryOp bin(String op, Node left, Node right) {
        return new BinaryOp(op, left, right);
    }

    static Node lit(long value) {
        if (value < 0) {
            return new UnaryOp("-", Constant.ofInt(-value));
        }
        return Constant.ofInt(value);
    }
}
