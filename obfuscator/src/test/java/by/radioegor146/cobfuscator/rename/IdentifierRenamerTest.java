package by.radioegor146.cobfuscator.rename;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.ast.Decl;
import by.radioegor146.cobfuscator.ast.FileAST;
import by.radioegor146.cobfuscator.ast.FuncDef;
import by.radioegor146.cobfuscator.ast.ParamList;
import by.radioegor146.cobfuscator.source.CFrontend;
import by.radioegor146.cobfuscator.source.CGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class IdentifierRenamerTest {

    private static final String PROGRAM = "#include <stdio.h>\n"
            + "#define SCALE factor\n"
            + "int puts(const char *text);\n"
            + "extern int errno_like;\n"
            + "int factor = 3;\n"
            + "struct counter { int count; int step; };\n"
            + "static int advance(struct counter *counter_ptr, int times) {\n"
            + "  int done;\n"
            + "  for (done = 0; done < times; done++) counter_ptr->count += counter_ptr->step * SCALE;\n"
            + "  return counter_ptr->count;\n"
            + "}\n"
            + "int main(void) {\n"
            + "  struct counter c = {0, 2};\n"
            + "  printf(\"%d\\n\", advance(&c, 4));\n"
            + "  puts(\"finished\");\n"
            + "  return errno_like;\n"
            + "}\n";

    @BeforeEach
    public void setUp() {
        FastRandom.setSeed(77);
    }

    private static String rename(FileAST tree, RenameStyle style, boolean minimise) {
        IdentifierAnalyzer analyzer = new IdentifierAnalyzer();
        analyzer.process(tree);
        assertTrue(new IdentifierRenamer(style, minimise).process(analyzer) > 0);
        return CGenerator.generateSource(tree);
    }

    @Test
    public void testKeptNames() {
        IdentifierAnalyzer analyzer = new IdentifierAnalyzer();
        analyzer.process(CFrontend.parse(PROGRAM));
        Set<String> kept = IdentifierRenamer.collectKeptNames(analyzer);
        assertTrue(kept.contains("main"));
        assertTrue(kept.contains("factor"));
        assertTrue(kept.contains("SCALE"));
        assertTrue(kept.contains("puts"));
        assertTrue(kept.contains("errno_like"));
        assertFalse(kept.contains("advance"));
        assertFalse(kept.contains("stdio"));
    }

    @Test
    public void testDirectRenaming() {
        for (RenameStyle style : RenameStyle.values()) {
            String source = rename(CFrontend.parse(PROGRAM), style, false);
            for (String gone : new String[]{"advance", "counter", "count", "step", "done", "times"}) {
                assertFalse(source.matches("(?s).*\\b" + gone + "\\b.*"), style + ": " + gone + "\n" + source);
            }
            for (String kept : new String[]{"main", "printf", "puts", "errno_like", "factor", "SCALE"}) {
                assertTrue(source.contains(kept), style + ": " + kept + "\n" + source);
            }
            CFrontend.parse(source);
        }
    }

    @Test
    public void testDirectRenamingKeepsShadowing() {
        FileAST tree = CFrontend.parse("int value;\n"
                + "int f(int input) { int value = input; { int value = 3; input += value; } return value + input; }\n");
        rename(tree, RenameStyle.MINIMAL_LENGTH, false);
        String global = ((Decl) tree.ext.get(0)).name;
        String source = CGenerator.generateSource(tree.ext.get(1));
        assertEquals(3, source.split("int " + global + " = ", -1).length, source);
    }

    @Test
    public void testMinimisedNamesStayDistinctWhileLive() {
        FileAST tree = CFrontend.parse("int total;\n"
                + "int f(int a, int b) { int c = a * b; return a + b + c + total; }\n"
                + "int main(void) { total = 1; return f(2, 3); }\n");
        rename(tree, RenameStyle.MINIMAL_LENGTH, true);
        FuncDef f = (FuncDef) tree.ext.get(1);
        ParamList params = f.getFuncDecl().args;
        String a = ((Decl) params.params.get(0)).name;
        String b = ((Decl) params.params.get(1)).name;
        String c = ((Decl) f.body.blockItems.get(0)).name;
        String total = ((Decl) tree.ext.get(0)).name;
        assertNotEquals(a, b);
        assertNotEquals(a, c);
        assertNotEquals(b, c);
        assertNotEquals(total, a);
        assertNotEquals(total, b);
        assertNotEquals(total, c);
        assertNotEquals(total, f.getName());
        assertTrue(a.length() <= 2 && b.length() <= 2 && c.length() <= 2, CGenerator.generateSource(tree));
    }

    @Test
    public void testMinimisedNamesAvoidFreeIdentifiers() {
        FileAST tree = CFrontend.parse("int main(void) { int x = 1; int y = 2; a(x); b(y); return x + y; }\n");
        String source = rename(tree, RenameStyle.MINIMAL_LENGTH, true);
        FuncDef main = (FuncDef) tree.ext.get(0);
        String x = ((Decl) main.body.blockItems.get(0)).name;
        String y = ((Decl) main.body.blockItems.get(1)).name;
        assertFalse(x.equals("a") || x.equals("b"), source);
        assertFalse(y.equals("a") || y.equals("b"), source);
        assertNotEquals(x, y, source);
    }
}
