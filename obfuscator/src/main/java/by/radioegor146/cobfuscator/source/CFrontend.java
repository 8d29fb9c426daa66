package by.radioegor146.cobfuscator.source;

import by.radioegor146.cobfuscator.ObfuscationException;
import by.radioegor146.cobfuscator.ast.FileAST;
import by.radioegor146.cobfuscator.source.grammar.CLexer;
import by.radioegor146.cobfuscator.source.grammar.CParser;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * Parses C source text into a {@link FileAST}.
 */
public final class CFrontend {

    private static final BaseErrorListener THROWING_LISTENER = new BaseErrorListener() {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
                                String msg, RecognitionException e) {
            throw ObfuscationException.syntax(line, charPositionInLine, msg);
        }
    };

    private CFrontend() {
    }

    public static FileAST parse(String code) {
        return parse(CharStreams.fromString(code));
    }

    public static FileAST parse(Path path) throws IOException {
        return parse(CharStreams.fromPath(path, StandardCharsets.UTF_8));
    }

    private static FileAST parse(CharStream input) {
        CLexer lexer = new CLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(THROWING_LISTENER);
        CParser parser = new CParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(THROWING_LISTENER);
        return new AstBuilder().buildFile(parser.compilationUnit());
    }
}
