package by.radioegor146.cobfuscator;

import by.radioegor146.cobfuscator.flatten.CaseIdStyle;
import by.radioegor146.cobfuscator.helpers.CCompiler;
import by.radioegor146.cobfuscator.opaque.Granularity;
import by.radioegor146.cobfuscator.opaque.InsertionKind;
import by.radioegor146.cobfuscator.opaque.OperandStyle;
import by.radioegor146.cobfuscator.rename.RenameStyle;
import by.radioegor146.cobfuscator.transform.ArithmeticEncodeUnit;
import by.radioegor146.cobfuscator.transform.AugmentOpaqueUnit;
import by.radioegor146.cobfuscator.transform.CSource;
import by.radioegor146.cobfuscator.transform.ControlFlowFlattenUnit;
import by.radioegor146.cobfuscator.transform.FuncArgumentRandomiseUnit;
import by.radioegor146.cobfuscator.transform.IdentifierRenameUnit;
import by.radioegor146.cobfuscator.transform.InsertOpaqueUnit;
import by.radioegor146.cobfuscator.transform.ObfuscationUnit;
import by.radioegor146.cobfuscator.transform.Pipeline;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Compiles every fixture before and after obfuscation and compares what the programs print.
 */
public class CObfuscatorTest {

    private static final List<String> FIXTURES = Arrays.asList(
            "control_flow.c", "initializers.c", "scoping.c", "vla.c", "arithmetic.c");

    private static final List<String> CALL_FIXTURES = Arrays.asList("functions.c", "control_flow.c", "scoping.c");

    private static final List<OperandStyle> ALL_OPERANDS = Arrays.asList(OperandStyle.INPUT, OperandStyle.ENTROPY);

    @TempDir
    Path dir;

    @BeforeAll
    public static void checkCompiler() {
        assumeTrue(CCompiler.isAvailable(), "No C compiler, differential tests skipped");
    }

    private void assertSameBehaviour(String label, long seed, ObfuscationUnit... units) throws Exception {
        assertSameBehaviour(FIXTURES, label, seed, units);
    }

    private void assertSameBehaviour(List<String> fixtures, String label, long seed, ObfuscationUnit... units)
            throws Exception {
        for (String fixture : fixtures) {
            String original = CCompiler.readResource(fixture);
            String name = fixture.substring(0, fixture.length() - 2);
            String expected = CCompiler.compileAndRun(dir, name + "_original", original);

            CSource result = new Pipeline(seed, Arrays.asList(units)).process(new CSource(null, original));
            String actual = CCompiler.compileAndRun(dir, name + "_" + label, result.getContents());
            assertEquals(expected, actual, label + " changed the behaviour of " + fixture + ":\n" + result.getContents());
        }
    }

    @Test
    public void testFlattenEveryStyle() throws Exception {
        for (CaseIdStyle style : CaseIdStyle.values()) {
            assertSameBehaviour("flatten_" + style.name().toLowerCase(), 11,
                    new ControlFlowFlattenUnit(false, style));
            assertSameBehaviour("flatten_random_" + style.name().toLowerCase(), 12,
                    new ControlFlowFlattenUnit(true, style));
        }
    }

    @Test
    public void testFlattenedBranchReturnsSameValues() throws Exception {
        String program = "#include <stdio.h>\n"
                + "int f(int a){ if(a>0){ return 1; } return 0; }\n"
                + "int main(void) { int in[] = {-5, 0, 1, 100}; int i;\n"
                + "  for (i = 0; i < 4; i++) printf(\"%d\\n\", f(in[i]));\n"
                + "  return 0; }\n";
        CSource result = new Pipeline(1L, Collections.singletonList(
                new ControlFlowFlattenUnit(false, CaseIdStyle.SEQUENTIAL))).process(new CSource(null, program));
        assertTrue(result.getContents().contains("switch"), result.getContents());
        assertEquals("0\n0\n1\n1\n", CCompiler.compileAndRun(dir, "branch", result.getContents()));
    }

    @Test
    public void testFlattenedHeapArrayKeepsItsSize() throws Exception {
        String program = "#include <stdio.h>\n"
                + "int f(int n){ int a[n]; return (int) sizeof(a); }\n"
                + "int main(void) { printf(\"%d %d\\n\", f(5), f(1)); return 0; }\n";
        String expected = CCompiler.compileAndRun(dir, "sized_original", program);
        assertEquals(5 * Integer.BYTES + " " + Integer.BYTES + "\n", expected);
        for (CaseIdStyle style : CaseIdStyle.values()) {
            CSource result = new Pipeline(3L, Collections.singletonList(
                    new ControlFlowFlattenUnit(false, style))).process(new CSource(null, program));
            assertTrue(result.getContents().contains("malloc("), result.getContents());
            assertEquals(expected, CCompiler.compileAndRun(dir, "sized_" + style.name().toLowerCase(),
                    result.getContents()), result.getContents());
        }
    }

    @Test
    public void testInsertion() throws Exception {
        for (long seed = 1; seed <= 3; seed++) {
            assertSameBehaviour("insert" + seed, seed, new InsertOpaqueUnit(ALL_OPERANDS,
                    Arrays.asList(Granularity.values()), Arrays.asList(InsertionKind.values()), 6));
        }
    }

    @Test
    public void testAugmentation() throws Exception {
        for (long seed = 1; seed <= 3; seed++) {
            assertSameBehaviour("augment" + seed, seed, new AugmentOpaqueUnit(ALL_OPERANDS, 1.0, 3));
        }
    }

    @Test
    public void testArithmeticEncoding() throws Exception {
        assertSameBehaviour("encode", 5, new ArithmeticEncodeUnit(3));
    }

    @Test
    public void testFunctionInterfaceRandomisation() throws Exception {
        for (long seed = 1; seed <= 4; seed++) {
            assertSameBehaviour(CALL_FIXTURES, "arguments" + seed, seed, new FuncArgumentRandomiseUnit(3, 0.5, true));
        }
        assertSameBehaviour(CALL_FIXTURES, "arguments_shuffled", 9, new FuncArgumentRandomiseUnit(0, 0.0, true));
        assertSameBehaviour(CALL_FIXTURES, "arguments_variables", 10, new FuncArgumentRandomiseUnit(4, 1.0, false));
    }

    @Test
    public void testRandomisedInterfacesSurviveLaterUnits() throws Exception {
        assertSameBehaviour(CALL_FIXTURES, "arguments_full", 31,
                new IdentifierRenameUnit(RenameStyle.MINIMAL_LENGTH, true),
                new FuncArgumentRandomiseUnit(2, 0.5, true),
                new ArithmeticEncodeUnit(2),
                new InsertOpaqueUnit(ALL_OPERANDS, Arrays.asList(Granularity.values()),
                        Arrays.asList(InsertionKind.values()), 3),
                new ControlFlowFlattenUnit(true, CaseIdStyle.SEQUENTIAL));
    }

    @Test
    public void testRenameEveryStyle() throws Exception {
        for (RenameStyle style : RenameStyle.values()) {
            assertSameBehaviour("rename_" + style.name().toLowerCase(), 21, new IdentifierRenameUnit(style, false));
            assertSameBehaviour("rename_min_" + style.name().toLowerCase(), 22, new IdentifierRenameUnit(style, true));
        }
    }

    @Test
    public void testFullPipeline() throws Exception {
        for (long seed = 100; seed < 103; seed++) {
            assertSameBehaviour("full" + seed, seed,
                    new IdentifierRenameUnit(RenameStyle.MINIMAL_LENGTH, true),
                    new ArithmeticEncodeUnit(2),
                    new InsertOpaqueUnit(ALL_OPERANDS, Arrays.asList(Granularity.values()),
                            Arrays.asList(InsertionKind.values()), 4),
                    new AugmentOpaqueUnit(ALL_OPERANDS, 0.5, 2),
                    new ControlFlowFlattenUnit(true, CaseIdStyle.RANDOM_INT));
        }
    }

    @Test
    public void testProcessWritesObfuscatedFile() throws Exception {
        Path input = dir.resolve("input.c");
        Path output = dir.resolve("output.c");
        Files.write(input, CCompiler.readResource("control_flow.c").getBytes(StandardCharsets.UTF_8));
        List<ObfuscationUnit> units = new ArrayList<>();
        units.add(new ControlFlowFlattenUnit(false, CaseIdStyle.ENUMERATOR));
        ObfuscatorConfig config = new ObfuscatorConfig(input, output, 8L, null, null, units);

        assertTrue(new CObfuscator().process(config));
        String written = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
        assertTrue(written.contains("enum"), written);
        assertEquals(CCompiler.compileAndRun(dir, "expected", CCompiler.readResource("control_flow.c")),
                CCompiler.compileAndRun(dir, "written", written));
    }

    @Test
    public void testProcessStopsOnFailedUnit() throws Exception {
        Path input = dir.resolve("input.c");
        Path output = dir.resolve("output.c");
        Files.write(input, CCompiler.readResource("scoping.c").getBytes(StandardCharsets.UTF_8));
        ObfuscationUnit failing = new ControlFlowFlattenUnit(false, CaseIdStyle.SEQUENTIAL) {
            @Override
            public CSource transform(CSource source) {
                return null;
            }
        };
        ObfuscatorConfig config = new ObfuscatorConfig(input, output, null, null, null,
                Collections.singletonList(failing));
        assertFalse(new CObfuscator().process(config));
        assertFalse(Files.exists(output));
    }
}
