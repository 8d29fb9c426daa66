package by.radioegor146.cobfuscator.flatten;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.ast.ID;
import by.radioegor146.cobfuscator.source.CFrontend;
import by.radioegor146.cobfuscator.source.CGenerator;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CaseIdPoolTest {

    @Test
    public void testSequentialIds() {
        CaseIdPool pool = new CaseIdPool(CaseIdStyle.SEQUENTIAL, null);
        for (int i = 0; i < 5; i++) {
            assertEquals(Integer.toString(i), CGenerator.generateSource(pool.next().toExpression()));
        }
    }

    @Test
    public void testRandomIdsAreDistinctAndGrowWithCount() {
        FastRandom.setSeed(31337);
        CaseIdPool pool = new CaseIdPool(CaseIdStyle.RANDOM_INT, null);
        Set<String> seen = new HashSet<>();
        for (int n = 1; n <= 500; n++) {
            CaseIdPool.CaseId id = pool.next();
            assertTrue(seen.add(id.toString()), "duplicate " + id);
            long value = Long.parseLong(id.toString());
            long range = 1L << (63 - Long.numberOfLeadingZeros(n) + 3);
            assertTrue(value >= -range && value < range, value + " outside of " + range);
        }
    }

    @Test
    public void testEnumeratorIdsAreFreshNames() {
        IdentifierAnalyzer analyzer = new IdentifierAnalyzer();
        analyzer.process(CFrontend.parse("int a, b;\nint main(void) { return a + b; }\n"));
        CaseIdPool pool = new CaseIdPool(CaseIdStyle.ENUMERATOR, analyzer);
        Set<String> names = new HashSet<>();
        for (int i = 0; i < 10; i++) {
            CaseIdPool.CaseId id = pool.next();
            assertInstanceOf(ID.class, id.toExpression());
            assertTrue(names.add(id.toString()));
        }
        assertFalse(names.contains("a") || names.contains("b") || names.contains("main"));
        assertEquals(10, pool.getEnumerators().size());
        assertEquals(CaseIdStyle.ENUMERATOR, pool.getStyle());
    }
}
