package by.radioegor146.cobfuscator.flatten;

import by.radioegor146.cobfuscator.ObfuscationException;
import by.radioegor146.cobfuscator.analysis.ExpressionAnalyzer;
import by.radioegor146.cobfuscator.ast.Constant;
import by.radioegor146.cobfuscator.ast.Decl;
import by.radioegor146.cobfuscator.ast.FileAST;
import by.radioegor146.cobfuscator.ast.FuncDef;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.source.CFrontend;
import by.radioegor146.cobfuscator.source.CGenerator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InitializerDecomposerTest {

    private static List<String> decompose(String declaration) {
        FileAST tree = CFrontend.parse("struct point { int x; int y; };\nvoid f(int seed) { " + declaration + " }\n");
        ExpressionAnalyzer expressions = new ExpressionAnalyzer();
        expressions.process(tree);
        Decl decl = (Decl) ((FuncDef) tree.ext.get(1)).body.blockItems.get(0);
        List<String> out = new ArrayList<>();
        for (Node node : new InitializerDecomposer(expressions).decompose(decl, decl.name, null)) {
            out.add(CGenerator.generateSource(node));
        }
        return out;
    }

    @Test
    public void testScalar() {
        assertEquals(Arrays.asList("v = seed + 1"), decompose("int v = seed + 1;"));
    }

    @Test
    public void testCompleteArrayNeedsNoZeroFill() {
        assertEquals(Arrays.asList("a[0] = 1", "a[1] = 2"), decompose("int a[2] = {1, 2};"));
    }

    @Test
    public void testPartialArrayIsZeroedFirst() {
        List<String> out = decompose("int a[3] = {1, 2};");
        assertEquals(3, out.size());
        assertEquals("memset(&a, 0, sizeof(a))", out.get(0));
        assertEquals("a[1] = 2", out.get(2));
    }

    @Test
    public void testDesignatorsAndStructs() {
        List<String> out = decompose("struct point p = {.y = seed, .x = 2};");
        assertTrue(out.contains("p.y = seed"), out.toString());
        assertTrue(out.contains("p.x = 2"), out.toString());
        assertEquals(2, out.size());
    }

    @Test
    public void testFlatListForNestedArray() {
        List<String> out = decompose("int g[2][2] = {1, 2, 3, 4};");
        assertEquals(Arrays.asList("g[0][0] = 1", "g[0][1] = 2", "g[1][0] = 3", "g[1][1] = 4"), out);
    }

    @Test
    public void testStringsAreSplitPerCharacter() {
        List<String> out = decompose("char s[4] = \"hi\";");
        assertTrue(out.contains("s[0] = 'h'"), out.toString());
        assertTrue(out.contains("s[1] = 'i'"), out.toString());
        assertTrue(out.contains("s[2] = '\\0'") || out.get(0).startsWith("memset"), out.toString());
    }

    @Test
    public void testSplitCharacters() {
        assertEquals(Arrays.asList("a", "\\n", "\\'", "\\x41", "\\012", "b"),
                InitializerDecomposer.splitCharacters(new Constant("string", "\"a\\n'\\x41\\012b\"")));
        assertThrows(ObfuscationException.class,
                () -> InitializerDecomposer.splitCharacters(new Constant("string", "L\"wide\"")));
    }

    @Test
    public void testConstantFolding() {
        FileAST tree = CFrontend.parse("int x = (3 + 4) * 2 - (1 << 3);\nint y = 5 / 0;\n");
        assertEquals(6L, InitializerDecomposer.evaluate(((Decl) tree.ext.get(0)).init));
        assertNull(InitializerDecomposer.evaluate(((Decl) tree.ext.get(1)).init));
    }
}
