package by.radioegor146.cobfuscator.opaque;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.ast.BinaryOp;
import by.radioegor146.cobfuscator.ast.ID;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.UnaryOp;
import by.radioegor146.cobfuscator.source.CGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OpaquePredicatesTest {

    private static final List<String> NAMES = Arrays.asList("x", "y", "z");

    private static final int[] EDGES = {0, 1, -1, 2, -2, 1280, -1280, 1281, -1281, 17515, -17515, 17516, -17516,
            46339, -46339, 46340, -46340, 46341, -46341, Integer.MAX_VALUE, Integer.MIN_VALUE,
            Integer.MAX_VALUE - 1, Integer.MIN_VALUE + 1};

    @BeforeEach
    public void setUp() {
        FastRandom.setSeed(4242);
    }

    private static List<Operand> operands(int arity) {
        List<Operand> operands = new ArrayList<>();
        for (int i = 0; i < arity; i++) {
            operands.add(new Operand(NAMES.get(i), false));
        }
        return operands;
    }

    private static List<int[]> samples(int count) {
        List<int[]> samples = new ArrayList<>();
        for (int a : EDGES) {
            for (int b : EDGES) {
                samples.add(new int[]{a, b, a});
            }
        }
        Random random = new Random(1337);
        for (int i = 0; i < count; i++) {
            int bits = 1 + random.nextInt(32);
            samples.add(new int[]{random.nextInt() >> (32 - bits), random.nextInt() >> (32 - bits), random.nextInt()});
        }
        return samples;
    }

    private static Map<String, Integer> bind(int[] sample) {
        Map<String, Integer> variables = new HashMap<>();
        for (int i = 0; i < NAMES.size(); i++) {
            variables.put(NAMES.get(i), sample[i]);
        }
        return variables;
    }

    @Test
    public void testTruePredicatesHoldWithoutOverflow() {
        List<int[]> samples = samples(10_000);
        for (PredicateTemplate template : OpaquePredicates.TRUE_PREDICATES) {
            Node predicate = template.instantiate(operands(template.getArity()));
            for (int[] sample : samples) {
                assertTrue(new CExpressionEvaluator(bind(sample)).isTrue(predicate),
                        template + " is false for " + Arrays.toString(sample));
            }
        }
    }

    @Test
    public void testEitherPredicatesTakeBothValues() {
        List<int[]> samples = samples(200);
        for (PredicateTemplate template : OpaquePredicates.EITHER_PREDICATES) {
            Set<Boolean> outcomes = new HashSet<>();
            for (int round = 0; round < 30; round++) {
                Node predicate = template.instantiate(operands(template.getArity()));
                for (int[] sample : samples) {
                    int[] small = {sample[0] % 1000, sample[1] % 1000, sample[2] % 1000};
                    outcomes.add(new CExpressionEvaluator(bind(small)).isTrue(predicate));
                }
            }
            assertEquals(2, outcomes.size(), template.toString());
        }
    }

    @Test
    public void testNegationInvertsTruth() {
        for (Node expression : compoundExpressions()) {
            Node negated = OpaquePredicates.negate(expression);
            for (int[] sample : samples(500)) {
                CExpressionEvaluator evaluator = new CExpressionEvaluator(bind(new int[]{sample[0] % 3, sample[1] % 3, sample[2] % 3}));
                assertEquals(!evaluator.isTrue(expression), evaluator.isTrue(negated), CGenerator.generateSource(expression));
            }
        }
    }

    private static List<Node> compoundExpressions() {
        return Arrays.asList(
                new BinaryOp("<", new ID("x"), new ID("y")),
                new BinaryOp("&&", new BinaryOp("==", new ID("x"), new ID("y")),
                        new BinaryOp(">=", new ID("y"), new ID("z"))),
                new BinaryOp("||", new UnaryOp("!", new ID("x")), new BinaryOp("!=", new ID("z"), new ID("y"))),
                new ID("x"));
    }

    @Test
    public void testNegatedTruePredicatesNeverHold() {
        List<int[]> samples = samples(10_000);
        for (PredicateTemplate template : OpaquePredicates.TRUE_PREDICATES) {
            Node negated = OpaquePredicates.negate(template.instantiate(operands(template.getArity())));
            for (int[] sample : samples) {
                assertFalse(new CExpressionEvaluator(bind(sample)).isTrue(negated),
                        CGenerator.generateSource(negated) + " holds for " + Arrays.toString(sample));
            }
        }
    }

    @Test
    public void testDoubleNegationKeepsTruth() {
        List<Node> expressions = new ArrayList<>(compoundExpressions());
        for (PredicateTemplate template : OpaquePredicates.TRUE_PREDICATES) {
            expressions.add(template.instantiate(operands(template.getArity())));
        }
        List<int[]> samples = samples(10_000);
        for (Node expression : expressions) {
            Node twice = OpaquePredicates.negate(OpaquePredicates.negate(expression));
            for (int[] sample : samples) {
                CExpressionEvaluator evaluator = new CExpressionEvaluator(bind(sample));
                assertEquals(evaluator.isTrue(expression), evaluator.isTrue(twice),
                        CGenerator.generateSource(expression) + " for " + Arrays.toString(sample));
            }
        }
    }

    @Test
    public void testGuardPrecedesIdentity() {
        Node predicate = OpaquePredicates.TRUE_PREDICATES.get(0).instantiate(operands(1));
        assertEquals("x > 46340 || x < (-46340) || x * x >= 0", CGenerator.generateSource(predicate));
    }

    @Test
    public void testRealOperandsAreCast() {
        Operand real = new Operand("ratio", true);
        assertEquals("(int) ratio", CGenerator.generateSource(real.toExpression()));
        assertEquals("ratio", CGenerator.generateSource(new Operand("ratio", false).toExpression()));
    }

    @Test
    public void testArityIsChecked() {
        PredicateTemplate binary = OpaquePredicates.TRUE_PREDICATES.get(2);
        assertEquals(2, binary.getArity());
        assertThrows(IllegalArgumentException.class, () -> binary.instantiate(Collections.singletonList(new Operand("x", false))));
    }
}
