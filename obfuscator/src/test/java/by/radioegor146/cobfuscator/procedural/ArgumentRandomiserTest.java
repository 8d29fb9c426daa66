package by.radioegor146.cobfuscator.procedural;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.ast.Child;
import by.radioegor146.cobfuscator.ast.Constant;
import by.radioegor146.cobfuscator.ast.Decl;
import by.radioegor146.cobfuscator.ast.FileAST;
import by.radioegor146.cobfuscator.ast.FuncCall;
import by.radioegor146.cobfuscator.ast.FuncDecl;
import by.radioegor146.cobfuscator.ast.FuncDef;
import by.radioegor146.cobfuscator.ast.ID;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.Return;
import by.radioegor146.cobfuscator.source.CFrontend;
import by.radioegor146.cobfuscator.source.CGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ArgumentRandomiserTest {

    private static final String PROGRAM = "#include <stdio.h>\n"
            + "int scale = 3;\n"
            + "int mix(int a, double b, char c);\n"
            + "static int helper(void) { return scale; }\n"
            + "int twice(int v) { return v * 2; }\n"
            + "int apply(int (*op)(int), int v) { return op(v); }\n"
            + "int first(int count, ...) { return count; }\n"
            + "int mix(int a, double b, char c) { return a + (int) b + c; }\n"
            + "int main(void) {\n"
            + "  printf(\"%d\\n\", mix(1, 2.5, 'a'));\n"
            + "  printf(\"%d\\n\", helper());\n"
            + "  printf(\"%d\\n\", apply(twice, 4));\n"
            + "  printf(\"%d\\n\", first(2, 1, 2));\n"
            + "  return 0;\n"
            + "}\n";

    @BeforeEach
    public void setUp() {
        FastRandom.setSeed(91);
    }

    private static int randomise(FileAST tree, int extra, double probability, boolean shuffle) {
        IdentifierAnalyzer analyzer = new IdentifierAnalyzer();
        analyzer.process(tree);
        return new ArgumentRandomiser(extra, probability, shuffle).process(analyzer);
    }

    private static FuncDef function(FileAST tree, String name) {
        for (Node ext : tree.ext) {
            if (ext instanceof FuncDef && name.equals(((FuncDef) ext).getName())) {
                return (FuncDef) ext;
            }
        }
        throw new AssertionError("No function " + name);
    }

    private static List<String> parameterNames(FuncDecl funcDecl) {
        List<String> names = new ArrayList<>();
        if (funcDecl.args != null) {
            for (Node param : funcDecl.args.params) {
                names.add(param instanceof Decl ? ((Decl) param).name : null);
            }
        }
        return names;
    }

    private static void collectCalls(Node node, String name, List<FuncCall> out) {
        if (node == null) {
            return;
        }
        if (node instanceof FuncCall && ((FuncCall) node).name instanceof ID
                && name.equals(((ID) ((FuncCall) node).name).name)) {
            out.add((FuncCall) node);
        }
        for (Child child : node.children()) {
            collectCalls(child.getNode(), name, out);
        }
    }

    private static FuncCall onlyCall(FileAST tree, String name) {
        List<FuncCall> calls = new ArrayList<>();
        collectCalls(tree, name, calls);
        assertEquals(1, calls.size(), name);
        return calls.get(0);
    }

    @Test
    public void testOnlyDirectlyCalledFunctionsChange() {
        FileAST tree = CFrontend.parse(PROGRAM);
        assertEquals(3, randomise(tree, 2, 0.0, true));

        assertEquals(5, parameterNames(function(tree, "mix").getFuncDecl()).size());
        assertEquals(2, parameterNames(function(tree, "helper").getFuncDecl()).size());
        assertEquals(4, parameterNames(function(tree, "apply").getFuncDecl()).size());
        assertEquals(Arrays.asList("v"), parameterNames(function(tree, "twice").getFuncDecl()));
        assertEquals(2, function(tree, "first").getFuncDecl().args.params.size());
        assertEquals(1, function(tree, "main").getFuncDecl().args.params.size());

        assertEquals(5, onlyCall(tree, "mix").args.exprs.size());
        assertEquals(2, onlyCall(tree, "helper").args.exprs.size());
        assertEquals(3, onlyCall(tree, "first").args.exprs.size());
    }

    @Test
    public void testPrototypesFollowDefinitions() {
        FileAST tree = CFrontend.parse(PROGRAM);
        randomise(tree, 2, 0.0, true);
        Decl prototype = (Decl) tree.ext.get(2);
        assertEquals("mix", prototype.name);
        assertEquals(parameterNames(function(tree, "mix").getFuncDecl()), parameterNames((FuncDecl) prototype.type));
    }

    @Test
    public void testArgumentsFollowTheirParameters() {
        for (long seed = 0; seed < 20; seed++) {
            FastRandom.setSeed(seed);
            FileAST tree = CFrontend.parse(PROGRAM);
            randomise(tree, 3, 0.0, true);
            List<String> names = parameterNames(function(tree, "mix").getFuncDecl());
            List<Node> arguments = onlyCall(tree, "mix").args.exprs;
            assertEquals("1", ((Constant) arguments.get(names.indexOf("a"))).value);
            assertEquals("2.5", ((Constant) arguments.get(names.indexOf("b"))).value);
            assertEquals("'a'", ((Constant) arguments.get(names.indexOf("c"))).value);
        }
    }

    @Test
    public void testOrderIsKeptWithoutShuffling() {
        FileAST tree = CFrontend.parse(PROGRAM);
        randomise(tree, 2, 0.0, false);
        List<String> names = parameterNames(function(tree, "mix").getFuncDecl());
        assertEquals(Arrays.asList("a", "b", "c"), names.subList(0, 3));
        String source = CGenerator.generateSource(tree);
        assertTrue(source.contains("mix(1, 2.5, 'a', "), source);
    }

    @Test
    public void testCallsWithSideEffectsKeepTheirOrder() {
        String program = "int tick(void);\n"
                + "int pair(int x, int y) { return x * 10 + y; }\n"
                + "int run(void) { return pair(tick(), tick()); }\n";
        for (long seed = 0; seed < 20; seed++) {
            FastRandom.setSeed(seed);
            FileAST tree = CFrontend.parse(program);
            randomise(tree, 3, 0.0, true);
            List<String> names = parameterNames(function(tree, "pair").getFuncDecl());
            assertEquals(5, names.size());
            assertTrue(names.indexOf("x") < names.indexOf("y"), names.toString());
        }
    }

    @Test
    public void testNewNamesAvoidExistingOnes() {
        String program = "int total = 0;\n"
                + "int keep(int a) { int b = a + total; { int c = b; b = c; } return b; }\n"
                + "int main(void) { return keep(2); }\n";
        FileAST tree = CFrontend.parse(program);
        randomise(tree, 4, 0.0, true);
        List<String> names = parameterNames(function(tree, "keep").getFuncDecl());
        assertEquals(5, names.size());
        assertEquals(5, new HashSet<>(names).size());
        names.remove("a");
        assertFalse(names.contains("b"), names.toString());
        assertFalse(names.contains("total"), names.toString());
        // The body still reads the same parameter.
        Return last = (Return) function(tree, "keep").body.blockItems.get(2);
        assertEquals("b", ((ID) last.expr).name);
    }

    @Test
    public void testVariablesUsedAreInitialised() {
        String program = "int total = 1;\n"
                + "int sink(int a) { return a; }\n"
                + "int feed(int p) { int local; local = p; return sink(p) + local; }\n";
        Set<String> used = new HashSet<>();
        for (long seed = 0; seed < 30; seed++) {
            FastRandom.setSeed(seed);
            FileAST tree = CFrontend.parse(program);
            randomise(tree, 4, 1.0, true);
            List<String> names = parameterNames(function(tree, "sink").getFuncDecl());
            List<Node> arguments = onlyCall(tree, "sink").args.exprs;
            for (int i = 0; i < arguments.size(); i++) {
                if (i != names.indexOf("a") && arguments.get(i) instanceof ID) {
                    used.add(((ID) arguments.get(i)).name);
                }
            }
        }
        assertFalse(used.isEmpty());
        assertTrue(Arrays.asList("p", "total").containsAll(used), used.toString());
    }

    @Test
    public void testAddressTakenFunctionIsKept() {
        FileAST tree = CFrontend.parse("int f(int a) { return a; }\n"
                + "int (*pointer)(int) = f;\n"
                + "int main(void) { return f(1) + pointer(2); }\n");
        assertEquals(0, randomise(tree, 2, 0.0, true));
        assertEquals(Arrays.asList("a"), parameterNames(function(tree, "f").getFuncDecl()));
    }

    @Test
    public void testInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new ArgumentRandomiser(-1, 0.5, true));
        assertThrows(IllegalArgumentException.class, () -> new ArgumentRandomiser(1, 1.5, true));
    }

    @Test
    public void testSpuriousTypesMatchDeclarations() {
        FileAST tree = CFrontend.parse("void f(char *s, const char *t, long long n, int x, _Bool flag);\n");
        List<Node> params = ((FuncDecl) ((Decl) tree.ext.get(0)).type).args.params;
        assertTrue(SpuriousType.STRING.matches((Decl) params.get(0)));
        assertFalse(SpuriousType.STRING.matches((Decl) params.get(1)));
        assertFalse(SpuriousType.CHAR.matches((Decl) params.get(0)));
        assertTrue(SpuriousType.LONG_LONG.matches((Decl) params.get(2)));
        assertFalse(SpuriousType.LONG.matches((Decl) params.get(2)));
        assertTrue(SpuriousType.INT.matches((Decl) params.get(3)));
        assertTrue(SpuriousType.BOOL.matches((Decl) params.get(4)));
        for (SpuriousType type : SpuriousType.values()) {
            assertTrue(type.matches(type.declare("value")), type.name());
            assertFalse(CGenerator.generateSource(type.randomValue()).isEmpty(), type.name());
        }
    }
}
