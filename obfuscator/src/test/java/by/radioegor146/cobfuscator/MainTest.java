package by.radioegor146.cobfuscator;

import by.radioegor146.cobfuscator.flatten.CaseIdStyle;
import by.radioegor146.cobfuscator.opaque.InsertionKind;
import by.radioegor146.cobfuscator.rename.RenameStyle;
import by.radioegor146.cobfuscator.transform.ArithmeticEncodeUnit;
import by.radioegor146.cobfuscator.transform.AugmentOpaqueUnit;
import by.radioegor146.cobfuscator.transform.ControlFlowFlattenUnit;
import by.radioegor146.cobfuscator.transform.FuncArgumentRandomiseUnit;
import by.radioegor146.cobfuscator.transform.IdentifierRenameUnit;
import by.radioegor146.cobfuscator.transform.InsertOpaqueUnit;
import by.radioegor146.cobfuscator.transform.ObfuscationUnit;
import by.radioegor146.cobfuscator.transform.Pipeline;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MainTest {

    private static final String PROGRAM = "#include <stdio.h>\n"
            + "int main(void) {\n"
            + "  int i, total = 0;\n"
            + "  for (i = 0; i < 5; i++) total += i * i;\n"
            + "  printf(\"%d\\n\", total);\n"
            + "  return 0;\n"
            + "}\n";

    private static ObfuscatorConfig parse(String... args) {
        CommandLine commandLine = Main.createCommandLine();
        commandLine.parseArgs(args);
        Main.CObfuscatorRunner runner = commandLine.getCommand();
        return runner.buildConfig();
    }

    @Test
    public void testUnitsRunInFixedOrder() {
        ObfuscatorConfig config = parse("in.c", "out.c", "--flatten", "--flatten-style", "random_int",
                "--augment", "2", "--insert", "3", "--insert-kinds", "CHECK,ELSE", "--encode-arithmetic", "2",
                "--rename", "I_AND_L", "--minimise-idents", "--seed", "17", "--randomise-args", "--spurious-args", "2");
        List<ObfuscationUnit> units = config.getUnits();
        assertEquals(6, units.size());
        assertInstanceOf(IdentifierRenameUnit.class, units.get(0));
        assertInstanceOf(FuncArgumentRandomiseUnit.class, units.get(1));
        assertInstanceOf(ArithmeticEncodeUnit.class, units.get(2));
        assertInstanceOf(InsertOpaqueUnit.class, units.get(3));
        assertInstanceOf(AugmentOpaqueUnit.class, units.get(4));
        assertInstanceOf(ControlFlowFlattenUnit.class, units.get(5));
        assertEquals(RenameStyle.I_AND_L, ((IdentifierRenameUnit) units.get(0)).getStyle());
        assertTrue(((IdentifierRenameUnit) units.get(0)).isMinimiseIdents());
        FuncArgumentRandomiseUnit randomise = (FuncArgumentRandomiseUnit) units.get(1);
        assertEquals(2, randomise.getExtraArgs());
        assertTrue(randomise.isRandomise());
        assertEquals(0.5, randomise.getProbability());
        assertEquals(Arrays.asList(InsertionKind.CHECK, InsertionKind.ELSE), ((InsertOpaqueUnit) units.get(3)).getKinds());
        assertEquals(1.0, ((AugmentOpaqueUnit) units.get(4)).getProbability());
        assertEquals(CaseIdStyle.RANDOM_INT, ((ControlFlowFlattenUnit) units.get(5)).getStyle());
        assertEquals(Long.valueOf(17L), config.getSeed());
    }

    @Test
    public void testNoFlagsMeansNoUnits() {
        ObfuscatorConfig config = parse("in.c", "out.c");
        assertTrue(config.getUnits().isEmpty());
        assertNull(config.getSeed());
    }

    @Test
    public void testRunWritesOutputAndPipeline(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("in.c");
        Path output = dir.resolve("out.c");
        Path saved = dir.resolve("pipeline.json");
        Files.write(input, PROGRAM.getBytes(StandardCharsets.UTF_8));

        int exitCode = Main.createCommandLine().execute(input.toString(), output.toString(), "--seed", "3",
                "--rename", "MINIMAL_LENGTH", "--flatten", "--save-pipeline", saved.toString());
        assertEquals(0, exitCode);
        String result = new String(Files.readAllBytes(output), StandardCharsets.UTF_8);
        assertTrue(result.contains("main("), result);
        assertTrue(result.contains("switch"), result);

        Pipeline pipeline = Pipeline.fromJson(new String(Files.readAllBytes(saved), StandardCharsets.UTF_8));
        assertEquals(Long.valueOf(3L), pipeline.getSeed());
        assertEquals(2, pipeline.getUnits().size());

        Path replayed = dir.resolve("replayed.c");
        assertEquals(0, Main.createCommandLine().execute(input.toString(), replayed.toString(),
                "--pipeline", saved.toString()));
        assertEquals(result, new String(Files.readAllBytes(replayed), StandardCharsets.UTF_8));
    }

    @Test
    public void testBadOptionsAndPipelines(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("in.c");
        Path output = dir.resolve("out.c");
        Files.write(input, PROGRAM.getBytes(StandardCharsets.UTF_8));

        assertEquals(2, Main.createCommandLine().execute(input.toString(), output.toString(),
                "--augment", "1", "--augment-probability", "1.5"));
        assertEquals(2, Main.createCommandLine().execute(input.toString(), output.toString(),
                "--insert", "1", "--new-entropy-probability", "-1"));
        assertEquals(2, Main.createCommandLine().execute(input.toString(), output.toString(),
                "--spurious-args", "1", "--spurious-arg-probability", "2"));

        Path broken = dir.resolve("broken.json");
        Files.write(broken, "{\"version\": \"v0.0.1\"}".getBytes(StandardCharsets.UTF_8));
        assertEquals(1, Main.createCommandLine().execute(input.toString(), output.toString(),
                "--pipeline", broken.toString()));

        Path invalidSource = dir.resolve("invalid.c");
        Files.write(invalidSource, "int main( { return 0; }\n".getBytes(StandardCharsets.UTF_8));
        assertEquals(1, Main.createCommandLine().execute(invalidSource.toString(), output.toString()));
        assertFalse(Files.exists(output));
    }
}
