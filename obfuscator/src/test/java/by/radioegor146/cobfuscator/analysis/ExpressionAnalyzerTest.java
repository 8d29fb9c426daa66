package by.radioegor146.cobfuscator.analysis;

import by.radioegor146.cobfuscator.ast.FileAST;
import by.radioegor146.cobfuscator.ast.FuncDef;
import by.radioegor146.cobfuscator.ast.ID;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.source.CFrontend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ExpressionAnalyzerTest {

    private static final String SOURCE = "typedef double real;\n"
            + "struct pair { int first; real second; };\n"
            + "int g(int v);\n"
            + "void f(int a, double d, int *p, struct pair s, real r) {\n"
            + "  a + 1;\n"
            + "  d * a;\n"
            + "  p + 1;\n"
            + "  *p;\n"
            + "  a++;\n"
            + "  a = 2;\n"
            + "  g(a);\n"
            + "  s.first - a;\n"
            + "  s.second;\n"
            + "  r + 1;\n"
            + "  a < d;\n"
            + "  -(a * 3);\n"
            + "}\n";

    private ExpressionAnalyzer analyzer;
    private List<Node> statements;

    @BeforeEach
    public void setUp() {
        FileAST tree = CFrontend.parse(SOURCE);
        analyzer = new ExpressionAnalyzer();
        analyzer.process(tree);
        statements = ((FuncDef) tree.ext.get(tree.ext.size() - 1)).body.blockItems;
    }

    @Test
    public void testArithmeticTypes() {
        assertEquals(ExprType.INT, analyzer.getType(statements.get(0)));
        assertEquals(ExprType.REAL, analyzer.getType(statements.get(1)));
        assertTrue(analyzer.getType(statements.get(2)).isIndirect());
        assertEquals(ExprType.INT, analyzer.getType(statements.get(3)));
        assertEquals(ExprType.INT, analyzer.getType(statements.get(10)));
        assertEquals(ExprType.INT, analyzer.getType(statements.get(11)));
    }

    @Test
    public void testMembersAndTypedefs() {
        assertEquals(ExprType.INT, analyzer.getType(statements.get(7)));
        assertEquals(ExprType.REAL, analyzer.getType(statements.get(8)));
        assertEquals(ExprType.REAL, analyzer.getType(statements.get(9)));
    }

    @Test
    public void testMutation() {
        assertFalse(analyzer.isMutating(statements.get(0)));
        assertTrue(analyzer.isMutating(statements.get(4)));
        assertTrue(analyzer.isMutating(statements.get(5)));
        assertTrue(analyzer.isMutating(statements.get(6)));
        assertFalse(analyzer.isMutating(statements.get(11)));
    }

    @Test
    public void testAddressOfCountsAsMutating() {
        FileAST tree = CFrontend.parse("int h(int *q);\n"
                + "int k(int a) {\n"
                + "  &a;\n"
                + "  h(&a) + a;\n"
                + "  a + 1;\n"
                + "  return a;\n"
                + "}\n");
        ExpressionAnalyzer local = new ExpressionAnalyzer();
        local.process(tree);
        List<Node> body = ((FuncDef) tree.ext.get(tree.ext.size() - 1)).body.blockItems;
        assertTrue(local.getType(body.get(0)).isIndirect());
        assertTrue(local.isMutating(body.get(0)));
        assertTrue(local.isMutating(body.get(1)));
        assertFalse(local.isMutating(body.get(2)));
    }

    @Test
    public void testUnknownNodesCountAsMutating() {
        assertTrue(analyzer.isMutating(new ID("a")));
    }

    @Test
    public void testCoalesce() {
        assertEquals(ExprType.REAL, ExpressionAnalyzer.coalesce(Arrays.asList(ExprType.INT, ExprType.REAL)));
        assertEquals(ExprType.OTHER, ExpressionAnalyzer.coalesce(Arrays.asList(ExprType.REAL, ExprType.OTHER)));
        assertEquals(ExprType.INT, ExpressionAnalyzer.coalesce(Arrays.asList(ExprType.INT, ExprType.INT)));
    }
}
