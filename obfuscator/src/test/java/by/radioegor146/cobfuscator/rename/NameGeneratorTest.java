package by.radioegor146.cobfuscator.rename;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.analysis.CKeywords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NameGeneratorTest {

    @BeforeEach
    public void setUp() {
        FastRandom.setSeed(12);
    }

    @Test
    public void testMinimalNamesCountThroughIdentifiers() {
        assertEquals("a", NameGenerator.minimalName(0));
        assertEquals("Z", NameGenerator.minimalName(51));
        assertEquals("_", NameGenerator.minimalName(52));
        assertEquals("aa", NameGenerator.minimalName(53));
        assertEquals("ba", NameGenerator.minimalName(54));
        assertEquals("ab", NameGenerator.minimalName(106));
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 20_000; i++) {
            String name = NameGenerator.minimalName(i);
            assertTrue(seen.add(name), name);
            assertFalse(Character.isDigit(name.charAt(0)), name);
        }
    }

    @Test
    public void testBannedNamesAndKeywordsAreSkipped() {
        NameGenerator generator = new NameGenerator(RenameStyle.MINIMAL_LENGTH);
        generator.ban("a");
        assertEquals("b", generator.next());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 5_000; i++) {
            String name = generator.next();
            assertFalse(CKeywords.isKeyword(name), name);
            assertTrue(seen.add(name), name);
        }
        assertFalse(seen.contains("a"));
        assertEquals(5_001, generator.getGenerated().size());
    }

    @Test
    public void testUnderscores() {
        NameGenerator generator = new NameGenerator(RenameStyle.ONLY_UNDERSCORES);
        assertEquals("_", generator.next());
        assertEquals("__", generator.next());
        assertEquals("___", generator.next());
    }

    @Test
    public void testIAndLNames() {
        NameGenerator generator = new NameGenerator(RenameStyle.I_AND_L);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 1_000; i++) {
            String name = generator.next();
            assertTrue(name.matches("[lI]{8,}"), name);
            assertTrue(seen.add(name), name);
        }
    }

    @Test
    public void testRandomNames() {
        NameGenerator generator = new NameGenerator(RenameStyle.COMPLETE_RANDOM);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 1_000; i++) {
            String name = generator.next();
            assertTrue(name.matches("[A-Za-z][A-Za-z0-9_]{4,19}"), name);
            assertTrue(seen.add(name), name);
        }
    }
}
