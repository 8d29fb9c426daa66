package by.radioegor146.cobfuscator.transform;

import by.radioegor146.cobfuscator.ast.FileAST;
import by.radioegor146.cobfuscator.source.CFrontend;
import by.radioegor146.cobfuscator.source.CGenerator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A C translation unit: where it came from, its text and its syntax tree.
 * <p>
 * Units mutate the tree in place and then call {@link #regenerate()}, so the text always follows
 * the tree at the end of each unit.
 */
public final class CSource {

    private final Path path;
    private final String contents;
    private final FileAST tree;

    public CSource(Path path, String contents, FileAST tree) {
        this.path = path;
        this.contents = contents;
        this.tree = tree;
    }

    /**
     * Parses the given text.
     *
     * @throws by.radioegor146.cobfuscator.ObfuscationException on a syntax error
     */
    public CSource(Path path, String contents) {
        this(path, contents, CFrontend.parse(contents));
    }

    public static CSource read(Path path) throws IOException {
        return new CSource(path, new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
    }

    public Path getPath() {
        return path;
    }

    public String getContents() {
        return contents;
    }

    public FileAST getTree() {
        return tree;
    }

    /**
     * A short name for log messages.
     */
    public String getName() {
        return path == null ? "<memory>" : String.valueOf(path.getFileName());
    }

    public CSource regenerate() {
        return new CSource(path, CGenerator.generateSource(tree), tree);
    }

    public void write(Path target) throws IOException {
        Files.write(target, contents.getBytes(StandardCharsets.UTF_8));
    }
}
