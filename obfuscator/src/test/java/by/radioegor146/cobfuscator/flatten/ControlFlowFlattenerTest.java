package by.radioegor146.cobfuscator.flatten;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.ast.Case;
import by.radioegor146.cobfuscator.ast.Child;
import by.radioegor146.cobfuscator.ast.Compound;
import by.radioegor146.cobfuscator.ast.Decl;
import by.radioegor146.cobfuscator.ast.EnumType;
import by.radioegor146.cobfuscator.ast.FileAST;
import by.radioegor146.cobfuscator.ast.FuncDef;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.Switch;
import by.radioegor146.cobfuscator.ast.While;
import by.radioegor146.cobfuscator.source.CFrontend;
import by.radioegor146.cobfuscator.source.CGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ControlFlowFlattenerTest {

    private static final String BRANCHY = "int f(int a) {\n"
            + "  int b = a * 2;\n"
            + "  if (b > 3) {\n"
            + "    int c = b;\n"
            + "    b = c + 1;\n"
            + "  }\n"
            + "  while (b < 100) b = b * 2;\n"
            + "  return b;\n"
            + "}\n";

    @BeforeEach
    public void setUp() {
        FastRandom.setSeed(5);
    }

    private static FileAST flatten(String source, CaseIdStyle style, boolean randomise, int expected) {
        FileAST tree = CFrontend.parse(source);
        IdentifierAnalyzer analyzer = new IdentifierAnalyzer();
        analyzer.process(tree);
        assertEquals(expected, new ControlFlowFlattener(style, randomise).process(analyzer));
        return tree;
    }

    private static FuncDef function(FileAST tree, String name) {
        for (Node ext : tree.ext) {
            if (ext instanceof FuncDef && name.equals(((FuncDef) ext).getName())) {
                return (FuncDef) ext;
            }
        }
        throw new AssertionError("No function " + name);
    }

    private static <T extends Node> void collect(Node node, Class<T> type, List<T> out) {
        if (type.isInstance(node)) {
            out.add(type.cast(node));
        }
        for (Child child : node.children()) {
            collect(child.getNode(), type, out);
        }
    }

    private static While dispatchLoop(FuncDef function) {
        for (Node item : function.body.blockItems) {
            if (item instanceof While) {
                return (While) item;
            }
        }
        throw new AssertionError("No dispatch loop in " + function.getName());
    }

    @Test
    public void testDeclarationsPrecedeTheDispatchLoop() {
        FileAST tree = flatten(BRANCHY, CaseIdStyle.SEQUENTIAL, false, 1);
        List<Node> body = function(tree, "f").body.blockItems;
        assertInstanceOf(While.class, body.get(body.size() - 1));
        for (int i = 0; i < body.size() - 1; i++) {
            assertInstanceOf(Decl.class, body.get(i), CGenerator.generateSource(tree));
        }
        List<Decl> nested = new ArrayList<>();
        collect(body.get(body.size() - 1), Decl.class, nested);
        assertTrue(nested.isEmpty(), CGenerator.generateSource(tree));
    }

    @Test
    public void testSingleDispatchLevel() {
        FileAST tree = flatten(BRANCHY, CaseIdStyle.SEQUENTIAL, false, 1);
        While loop = dispatchLoop(function(tree, "f"));
        List<While> loops = new ArrayList<>();
        collect(loop, While.class, loops);
        assertEquals(1, loops.size());
        Switch dispatch = (Switch) ((Compound) loop.stmt).blockItems.get(0);
        List<Case> cases = new ArrayList<>();
        collect(dispatch, Case.class, cases);
        assertTrue(cases.size() >= 4, CGenerator.generateSource(tree));
    }

    @Test
    public void testSequentialIdsStartAtEntryAndStopAtExit() {
        FileAST tree = flatten(BRANCHY, CaseIdStyle.SEQUENTIAL, false, 1);
        FuncDef f = function(tree, "f");
        While loop = dispatchLoop(f);
        String source = CGenerator.generateSource(f);
        String dispatch = CGenerator.generateSource(((Switch) ((Compound) loop.stmt).blockItems.get(0)).cond);
        assertTrue(source.contains("int " + dispatch + " = 0;"), source);
        assertEquals(dispatch + " != 1", CGenerator.generateSource(loop.cond));
    }

    @Test
    public void testClashingBlockNamesAreRenamed() {
        FileAST tree = flatten("int f(int a) {\n"
                + "  int r = 0;\n"
                + "  { int x = a; r += x; }\n"
                + "  { int x = a * 2; r += x; }\n"
                + "  return r;\n"
                + "}\n", CaseIdStyle.SEQUENTIAL, false, 1);
        Set<String> names = new HashSet<>();
        for (Node item : function(tree, "f").body.blockItems) {
            if (item instanceof Decl) {
                assertTrue(names.add(((Decl) item).name), CGenerator.generateSource(tree));
            }
        }
        assertEquals(4, names.size());
    }

    @Test
    public void testRandomIdsAreDistinct() {
        FileAST tree = flatten(BRANCHY, CaseIdStyle.RANDOM_INT, true, 1);
        List<Case> cases = new ArrayList<>();
        collect(dispatchLoop(function(tree, "f")), Case.class, cases);
        Set<String> labels = new HashSet<>();
        for (Case c : cases) {
            assertTrue(labels.add(CGenerator.generateSource(c.expr)));
        }
    }

    @Test
    public void testEnumeratorStyleDeclaresAnEnum() {
        FileAST tree = flatten(BRANCHY, CaseIdStyle.ENUMERATOR, false, 1);
        int index = tree.ext.indexOf(function(tree, "f"));
        Node declaration = tree.ext.get(index - 1);
        assertInstanceOf(Decl.class, declaration);
        assertInstanceOf(EnumType.class, ((Decl) declaration).type);
    }

    @Test
    public void testCaseLabelInsideLoopIsRejected() {
        String duff = "void copy(char *to, char *from, int count) {\n"
                + "  int n = (count + 7) / 8;\n"
                + "  switch (count % 8) {\n"
                + "    case 0: do { *to++ = *from++;\n"
                + "    case 1: *to++ = *from++;\n"
                + "    } while (--n > 0);\n"
                + "  }\n"
                + "}\n";
        String before = CGenerator.generateSource(CFrontend.parse(duff));
        FileAST tree = flatten(duff, CaseIdStyle.SEQUENTIAL, false, 0);
        assertEquals(before, CGenerator.generateSource(tree));
    }

    @Test
    public void testStrayBreakIsRejected() {
        FileAST tree = flatten("int f(int a) { if (a) break; return a; }\nint g(int b) { return b; }\n",
                CaseIdStyle.SEQUENTIAL, false, 1);
        List<While> loops = new ArrayList<>();
        collect(function(tree, "f"), While.class, loops);
        assertTrue(loops.isEmpty());
        assertFalse(function(tree, "g").body.blockItems.isEmpty());
    }

    @Test
    public void testHeapArraysAreReleased() {
        FileAST tree = flatten("int f(int n) {\n"
                + "  int total = 0;\n"
                + "  int values[n];\n"
                + "  values[0] = n;\n"
                + "  total = values[0];\n"
                + "  return total;\n"
                + "}\n", CaseIdStyle.SEQUENTIAL, false, 1);
        String source = CGenerator.generateSource(tree);
        assertTrue(source.contains("#include <stdlib.h>"), source);
        assertTrue(source.contains("malloc("), source);
        assertTrue(source.contains("free("), source);
    }

    @Test
    public void testHeapArraySizeUsesSavedLength() {
        FileAST tree = flatten("int f(int n) {\n"
                + "  int a[n];\n"
                + "  n = 0;\n"
                + "  return (int) sizeof(a) + (int) sizeof a;\n"
                + "}\n", CaseIdStyle.SEQUENTIAL, false, 1);
        String source = CGenerator.generateSource(tree);
        assertFalse(source.contains("sizeof(a)"), source);
        // Allocation and both measurements.
        assertEquals(4, source.split("sizeof\\(\\*a\\)", -1).length, source);
        assertTrue(source.contains("malloc("), source);
    }
}
