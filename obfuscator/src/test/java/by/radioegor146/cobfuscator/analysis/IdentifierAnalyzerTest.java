package by.radioegor146.cobfuscator.analysis;

import by.radioegor146.cobfuscator.ast.Compound;
import by.radioegor146.cobfuscator.ast.FileAST;
import by.radioegor146.cobfuscator.ast.FuncDef;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.source.CFrontend;
import by.radioegor146.cobfuscator.source.CGenerator;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class IdentifierAnalyzerTest {

    private static final String SHADOWING = "int g;\n"
            + "int f(int a) {\n"
            + "  int b = a;\n"
            + "  {\n"
            + "    int a = 2;\n"
            + "    b += a;\n"
            + "  }\n"
            + "  return b + g;\n"
            + "}\n";

    private static IdentifierAnalyzer analyse(FileAST tree) {
        IdentifierAnalyzer analyzer = new IdentifierAnalyzer();
        analyzer.process(tree);
        return analyzer;
    }

    private static List<DefinitionKey> definitionsOf(IdentifierAnalyzer analyzer, String name, NameSpace namespace) {
        List<DefinitionKey> keys = new ArrayList<>();
        for (DefinitionKey key : analyzer.getDefinitions()) {
            if (key.getIdentifier().getName().equals(name) && key.getIdentifier().getNamespace() == namespace) {
                keys.add(key);
            }
        }
        return keys;
    }

    @Test
    public void testDefinitionsInTraversalOrder() {
        IdentifierAnalyzer analyzer = analyse(CFrontend.parse(SHADOWING));
        assertEquals(1, definitionsOf(analyzer, "g", NameSpace.ORDINARY).size());
        assertEquals(1, definitionsOf(analyzer, "f", NameSpace.ORDINARY).size());
        assertEquals(2, definitionsOf(analyzer, "a", NameSpace.ORDINARY).size());
        assertEquals(1, definitionsOf(analyzer, "b", NameSpace.ORDINARY).size());
        assertEquals("g", analyzer.getDefinitions().get(0).getIdentifier().getName());
        assertTrue(analyzer.getFunctions().contains("f"));
    }

    @Test
    public void testRenamingFollowsScopes() {
        FileAST tree = CFrontend.parse(SHADOWING);
        IdentifierAnalyzer analyzer = analyse(tree);
        DefinitionKey inner = definitionsOf(analyzer, "a", NameSpace.ORDINARY).get(1);
        assertTrue(analyzer.changeIdent(inner, "z"));

        String source = CGenerator.generateSource(tree);
        assertTrue(source.contains("int z = 2;"), source);
        assertTrue(source.contains("b += z;"), source);
        assertTrue(source.contains("int b = a;"), source);
        assertTrue(source.contains("int f(int a)"), source);
        assertEquals(1, definitionsOf(analyzer, "z", NameSpace.ORDINARY).size());
        assertTrue(analyzer.getIdentifiers().contains("z"));
    }

    @Test
    public void testRenamedKeyMovesToTheEnd() {
        IdentifierAnalyzer analyzer = analyse(CFrontend.parse(SHADOWING));
        DefinitionKey global = definitionsOf(analyzer, "g", NameSpace.ORDINARY).get(0);
        analyzer.changeIdent(global, "renamed");
        List<DefinitionKey> definitions = analyzer.getDefinitions();
        assertEquals("renamed", definitions.get(definitions.size() - 1).getIdentifier().getName());
    }

    @Test
    public void testRequiredIdentifiers() {
        FileAST tree = CFrontend.parse(SHADOWING);
        IdentifierAnalyzer analyzer = analyse(tree);
        Compound body = ((FuncDef) tree.ext.get(1)).body;
        Node declB = body.blockItems.get(0);
        Set<String> required = analyzer.getRequiredIdentifiers(declB, NameSpace.ORDINARY);
        assertTrue(required.contains("a"), required.toString());
        assertTrue(required.contains("b"), required.toString());
        assertTrue(required.contains("g"), required.toString());
        assertFalse(required.contains("f"), required.toString());
    }

    @Test
    public void testMembersAreRenamedThroughAccesses() {
        FileAST tree = CFrontend.parse("struct point { int x; int y; };\n"
                + "int sum(struct point *p, struct point q) { return p->x + q.x + p->y; }\n");
        IdentifierAnalyzer analyzer = analyse(tree);
        List<DefinitionKey> members = definitionsOf(analyzer, "x", NameSpace.MEMBER);
        assertEquals(1, members.size());
        assertNotNull(members.get(0).getIdentifier().getOwner());
        assertTrue(analyzer.changeIdent(members.get(0), "horizontal"));

        String source = CGenerator.generateSource(tree);
        assertTrue(source.contains("p->horizontal + q.horizontal + p->y"), source);
        assertTrue(source.contains("int horizontal;"), source);
    }

    @Test
    public void testNamespacesAreSeparate() {
        IdentifierAnalyzer analyzer = analyse(CFrontend.parse("struct tag { int tag; };\n"
                + "int f(void) { struct tag tag; tag.tag = 1; goto tag; tag: return tag.tag; }\n"));
        assertEquals(1, definitionsOf(analyzer, "tag", NameSpace.TAG).size());
        assertEquals(1, definitionsOf(analyzer, "tag", NameSpace.MEMBER).size());
        assertEquals(1, definitionsOf(analyzer, "tag", NameSpace.ORDINARY).size());
        assertEquals(1, definitionsOf(analyzer, "tag", NameSpace.LABEL).size());
    }

    @Test
    public void testForwardDeclarationsFollowTheDefinition() {
        FileAST tree = CFrontend.parse("int twice(int value);\n"
                + "int main(void) { return twice(2); }\n"
                + "int twice(int n) { return n * 2; }\n");
        IdentifierAnalyzer analyzer = analyse(tree);
        for (DefinitionKey key : analyzer.getDefinitions()) {
            if (key.getIdentifier().getName().equals("twice")) {
                analyzer.changeIdent(key, "doubled");
            }
        }
        analyzer.updateFunctionSpecs();
        String source = CGenerator.generateSource(tree);
        assertFalse(source.contains("twice"), source);
        assertTrue(source.contains("int doubled(int n);"), source);
    }

    @Test
    public void testUniqueIdentifierIsUnused() {
        IdentifierAnalyzer analyzer = analyse(CFrontend.parse("int a, b, c;\nint main(void) { return a + b + c; }\n"));
        String fresh = analyzer.getUniqueIdentifier(null);
        assertFalse(fresh.equals("a") || fresh.equals("b") || fresh.equals("c") || fresh.equals("main"), fresh);
        assertTrue(analyzer.getIdentifiers().contains(fresh));
        assertTrue(analyzer.getUniqueIdentifier(null).length() > 0);
        assertFalse(CKeywords.isKeyword(IdentifierAnalyzer.findNewIdentifier(new HashSet<>())));
    }
}
