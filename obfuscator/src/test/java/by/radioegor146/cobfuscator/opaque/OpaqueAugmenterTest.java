package by.radioegor146.cobfuscator.opaque;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.ast.BinaryOp;
import by.radioegor146.cobfuscator.ast.Child;
import by.radioegor146.cobfuscator.ast.FileAST;
import by.radioegor146.cobfuscator.ast.FuncDef;
import by.radioegor146.cobfuscator.ast.ID;
import by.radioegor146.cobfuscator.ast.If;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.While;
import by.radioegor146.cobfuscator.source.CFrontend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OpaqueAugmenterTest {

    private static final String SOURCE = "int f(int a, int b) {\n"
            + "  if (a > b) return 1;\n"
            + "  while (a < 0) a++;\n"
            + "  for (;;) break;\n"
            + "  return 0;\n"
            + "}\n";

    @BeforeEach
    public void setUp() {
        FastRandom.setSeed(99);
    }

    private static boolean contains(Node root, Node target) {
        if (root == target) {
            return true;
        }
        for (Child child : root.children()) {
            if (contains(child.getNode(), target)) {
                return true;
            }
        }
        return false;
    }

    @Test
    public void testEveryConditionIsAugmented() {
        FileAST tree = CFrontend.parse(SOURCE);
        FuncDef function = (FuncDef) tree.ext.get(0);
        If branch = (If) function.body.blockItems.get(0);
        While loop = (While) function.body.blockItems.get(1);
        Node originalIf = branch.cond;
        Node originalWhile = loop.cond;

        IdentifierAnalyzer analyzer = new IdentifierAnalyzer();
        analyzer.process(tree);
        int added = new OpaqueAugmenter(Collections.singletonList(OperandStyle.INPUT), 1.0, 2,
                OperandSourceConfig.createDefault()).process(analyzer);

        assertEquals(4, added);
        assertNotSame(originalIf, branch.cond);
        assertTrue(contains(branch.cond, originalIf));
        assertTrue(contains(loop.cond, originalWhile));
    }

    @Test
    public void testZeroProbabilityChangesNothing() {
        FileAST tree = CFrontend.parse(SOURCE);
        If branch = (If) ((FuncDef) tree.ext.get(0)).body.blockItems.get(0);
        Node original = branch.cond;
        IdentifierAnalyzer analyzer = new IdentifierAnalyzer();
        analyzer.process(tree);
        int added = new OpaqueAugmenter(Arrays.asList(OperandStyle.values()), 0.0, 3,
                OperandSourceConfig.createDefault()).process(analyzer);
        assertEquals(0, added);
        assertSame(original, branch.cond);
    }

    @Test
    public void testFunctionsWithoutOperandsAreSkipped() {
        FileAST tree = CFrontend.parse("int g;\nint f(void) { if (g) return 1; return 0; }\n");
        IdentifierAnalyzer analyzer = new IdentifierAnalyzer();
        analyzer.process(tree);
        int added = new OpaqueAugmenter(Collections.singletonList(OperandStyle.INPUT), 1.0, 1,
                OperandSourceConfig.createDefault()).process(analyzer);
        assertEquals(0, added);
    }

    @Test
    public void testCombineKeepsTheConditionValue() {
        Node cond = new BinaryOp("<", new ID("x"), new ID("y"));
        for (int round = 0; round < 50; round++) {
            PredicateTemplate template = OpaquePredicates.randomTrue();
            List<Operand> operands = new ArrayList<>();
            for (int i = 0; i < template.getArity(); i++) {
                operands.add(new Operand(i == 0 ? "z" : "w", false));
            }
            Node combined = OpaqueAugmenter.combine(cond, template.instantiate(operands));
            for (int x = -3; x <= 3; x++) {
                for (int z : new int[]{-100000, -7, 0, 5, 99999}) {
                    Map<String, Integer> variables = new HashMap<>();
                    variables.put("x", x);
                    variables.put("y", 0);
                    variables.put("z", z);
                    variables.put("w", 3 - z);
                    CExpressionEvaluator evaluator = new CExpressionEvaluator(variables);
                    assertEquals(evaluator.isTrue(cond), evaluator.isTrue(combined), template.getDescription());
                }
            }
        }
    }
}
