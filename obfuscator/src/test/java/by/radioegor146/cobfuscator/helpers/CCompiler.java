package by.radioegor146.cobfuscator.helpers;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Compiles and runs C programs with the system compiler, for differential tests that compare
 * an obfuscated program's output with the original's.
 */
public final class CCompiler {

    private static final String COMPILER = System.getProperty("cobfuscator.cc", "cc");

    private static Boolean available;

    private CCompiler() {
    }

    public static synchronized boolean isAvailable() {
        if (available == null) {
            available = ProcessHelper.isAvailable(COMPILER);
        }
        return available;
    }

    /**
     * Compiles {@code source} as {@code name.c} inside {@code dir}, runs it and returns its standard output.
     */
    public static String compileAndRun(Path dir, String name, String source) throws IOException, InterruptedException {
        Path file = dir.resolve(name + ".c");
        Files.write(file, source.getBytes(StandardCharsets.UTF_8));
        Path binary = dir.resolve(name);
        ProcessHelper.run(dir, 60_000, Arrays.asList(COMPILER, "-w", "-o", binary.toString(), file.toString()))
                .check(COMPILER + " " + name);
        return ProcessHelper.run(dir, 30_000, Arrays.asList(binary.toString())).check(name).stdout;
    }

    public static String readResource(String name) {
        try (InputStream in = CCompiler.class.getResourceAsStream("/c/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No test program " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
