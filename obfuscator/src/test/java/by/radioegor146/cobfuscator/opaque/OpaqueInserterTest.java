package by.radioegor146.cobfuscator.opaque;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.ast.Child;
import by.radioegor146.cobfuscator.ast.Compound;
import by.radioegor146.cobfuscator.ast.DoWhile;
import by.radioegor146.cobfuscator.ast.FileAST;
import by.radioegor146.cobfuscator.ast.For;
import by.radioegor146.cobfuscator.ast.FuncCall;
import by.radioegor146.cobfuscator.ast.FuncDef;
import by.radioegor146.cobfuscator.ast.If;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.While;
import by.radioegor146.cobfuscator.source.CFrontend;
import by.radioegor146.cobfuscator.source.CGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OpaqueInserterTest {

    @BeforeEach
    public void setUp() {
        FastRandom.setSeed(2024);
    }

    private static OpaqueInserter inserter(List<OperandStyle> styles, List<Granularity> granularities,
                                           List<InsertionKind> kinds, int number) {
        return new OpaqueInserter(styles, granularities, kinds, number, OperandSourceConfig.createDefault());
    }

    @Test
    public void testDistributionFollowsWeights() {
        Map<Granularity, Integer> amounts = inserter(Arrays.asList(OperandStyle.values()),
                Arrays.asList(Granularity.values()), Arrays.asList(InsertionKind.values()), 10).distribute();
        assertEquals(1, amounts.get(Granularity.PROCEDURAL));
        assertEquals(7, amounts.get(Granularity.BLOCK));
        assertEquals(2, amounts.get(Granularity.STMT));

        Map<Granularity, Integer> rounded = inserter(Arrays.asList(OperandStyle.values()),
                Arrays.asList(Granularity.PROCEDURAL, Granularity.STMT), Arrays.asList(InsertionKind.values()), 3).distribute();
        assertEquals(3, rounded.getOrDefault(Granularity.PROCEDURAL, 0) + rounded.getOrDefault(Granularity.STMT, 0));
    }

    @Test
    public void testBlocksStopAtDeclarationsAndLabels() {
        FileAST tree = CFrontend.parse("void f(int a) { int b; a++; a--; int c; a = 1; l: a = 2; a = 3; }\n");
        List<Node> items = ((FuncDef) tree.ext.get(0)).body.blockItems;
        List<int[]> blocks = OpaqueInserter.findBlocks(items);
        assertEquals(3, blocks.size());
        assertArrayEquals(new int[]{1, 3}, blocks.get(0));
        assertArrayEquals(new int[]{4, 5}, blocks.get(1));
        assertArrayEquals(new int[]{6, 7}, blocks.get(2));
    }

    @Test
    public void testLooseJumps() {
        FileAST tree = CFrontend.parse("void f(int n) {\n"
                + "  while (n) { n--; if (n == 3) break; }\n"
                + "  for (;;) { switch (n) { case 1: continue; } break; }\n"
                + "}\n");
        List<Node> items = ((FuncDef) tree.ext.get(0)).body.blockItems;
        assertFalse(OpaqueInserter.containsLooseJump(items.get(0), false, false));
        Node loopBody = ((While) items.get(0)).stmt;
        assertTrue(OpaqueInserter.containsLooseJump(loopBody, false, false));
        Node forBody = ((For) items.get(1)).stmt;
        Node innerSwitch = ((Compound) forBody).blockItems.get(0);
        assertTrue(OpaqueInserter.containsLooseJump(innerSwitch, false, false));
        assertFalse(OpaqueInserter.containsLooseJump(innerSwitch, true, false));
    }

    @Test
    public void testProceduralCheckWrapsTheBody() {
        FileAST tree = CFrontend.parse("int f(int a) { a = a + 1; return a; }\n");
        IdentifierAnalyzer analyzer = new IdentifierAnalyzer();
        analyzer.process(tree);
        int inserted = inserter(Collections.singletonList(OperandStyle.INPUT),
                Collections.singletonList(Granularity.PROCEDURAL),
                Collections.singletonList(InsertionKind.CHECK), 1).process(analyzer);
        assertEquals(1, inserted);
        List<Node> body = ((FuncDef) tree.ext.get(0)).body.blockItems;
        assertEquals(1, body.size());
        If check = (If) body.get(0);
        assertTrue(CGenerator.generateSource(check.cond).contains("a"));
        assertEquals(2, ((Compound) check.iftrue).blockItems.size());
    }

    @Test
    public void testDoWhileNeverCapturesALooseBreak() {
        FileAST tree = CFrontend.parse("int f(int a) { while (a) { a--; break; } return a; }\n");
        IdentifierAnalyzer analyzer = new IdentifierAnalyzer();
        analyzer.process(tree);
        int inserted = inserter(Collections.singletonList(OperandStyle.INPUT),
                Collections.singletonList(Granularity.STMT),
                Arrays.asList(InsertionKind.DO_WHILE, InsertionKind.CHECK), 6).process(analyzer);
        assertEquals(6, inserted);
        List<DoWhile> loops = new ArrayList<>();
        collectDoWhiles(tree, loops);
        for (DoWhile loop : loops) {
            assertFalse(OpaqueInserter.containsLooseJump(loop.stmt, false, false), CGenerator.generateSource(loop));
        }
    }

    private static void collectDoWhiles(Node node, List<DoWhile> out) {
        if (node instanceof DoWhile) {
            out.add((DoWhile) node);
        }
        for (Child child : node.children()) {
            collectDoWhiles(child.getNode(), out);
        }
    }

    @Test
    public void testNoOperandsMeansNoInsertion() {
        FileAST tree = CFrontend.parse("int f(void) { return 1; }\n");
        IdentifierAnalyzer analyzer = new IdentifierAnalyzer();
        analyzer.process(tree);
        String before = CGenerator.generateSource(tree);
        int inserted = inserter(Collections.singletonList(OperandStyle.INPUT),
                Arrays.asList(Granularity.values()), Arrays.asList(InsertionKind.values()), 5).process(analyzer);
        assertEquals(0, inserted);
        assertEquals(before, CGenerator.generateSource(tree));
    }

    @Test
    public void testEntropyVariablesAreSeededInMain() {
        FileAST tree = CFrontend.parse("#include <stdio.h>\n"
                + "int f(void) { return 4; }\n"
                + "int main(void) { printf(\"%d\\n\", f()); return 0; }\n");
        IdentifierAnalyzer analyzer = new IdentifierAnalyzer();
        analyzer.process(tree);
        int inserted = inserter(Collections.singletonList(OperandStyle.ENTROPY),
                Collections.singletonList(Granularity.PROCEDURAL),
                Collections.singletonList(InsertionKind.IF_ELSE), 1).process(analyzer);
        assertEquals(1, inserted);
        String text = CGenerator.generateSource(tree);
        assertTrue(text.contains("#include <time.h>"), text);
        assertTrue(text.contains("#include <stdlib.h>"), text);
        assertTrue(text.contains("srand(time(0));"), text);
        assertTrue(text.contains(" = rand();"), text);

        FuncDef main = (FuncDef) tree.ext.get(tree.ext.size() - 1);
        assertInstanceOf(FuncCall.class, main.body.blockItems.get(0));
        FuncDef f = (FuncDef) tree.ext.get(tree.ext.size() - 2);
        assertInstanceOf(If.class, f.body.blockItems.get(0));
        assertTrue(((If) f.body.blockItems.get(0)).iffalse != null);
    }
}
