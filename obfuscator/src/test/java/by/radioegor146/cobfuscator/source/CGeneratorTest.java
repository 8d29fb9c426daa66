package by.radioegor146.cobfuscator.source;

import by.radioegor146.cobfuscator.ast.BinaryOp;
import by.radioegor146.cobfuscator.ast.Constant;
import by.radioegor146.cobfuscator.ast.ID;
import by.radioegor146.cobfuscator.ast.UnaryOp;
import by.radioegor146.cobfuscator.helpers.CCompiler;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

public class CGeneratorTest {

    @Test
    public void testOnlyNeededParenthesesAreEmitted() {
        assertEquals("(a + b) * 2", CGenerator.generateSource(
                new BinaryOp("*", new BinaryOp("+", new ID("a"), new ID("b")), Constant.ofInt(2))));
        assertEquals("a + b * 2", CGenerator.generateSource(
                new BinaryOp("+", new ID("a"), new BinaryOp("*", new ID("b"), Constant.ofInt(2)))));
        assertEquals("a - (b - c)", CGenerator.generateSource(
                new BinaryOp("-", new ID("a"), new BinaryOp("-", new ID("b"), new ID("c")))));
        assertEquals("a - b - c", CGenerator.generateSource(
                new BinaryOp("-", new BinaryOp("-", new ID("a"), new ID("b")), new ID("c"))));
    }

    @Test
    public void testUnaryOperandsKeepTheirMeaning() {
        String negated = CGenerator.generateSource(new UnaryOp("-", new UnaryOp("-", new ID("x"))));
        assertFalse(negated.contains("--"), negated);
    }

    @Test
    public void testRegenerationIsStable() {
        for (String name : new String[]{"control_flow.c", "initializers.c", "scoping.c", "vla.c", "arithmetic.c"}) {
            String once = CGenerator.generateSource(CFrontend.parse(CCompiler.readResource(name)));
            String twice = CGenerator.generateSource(CFrontend.parse(once));
            assertEquals(once, twice, name);
        }
    }
}
