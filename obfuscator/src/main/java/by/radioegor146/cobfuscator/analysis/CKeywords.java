package by.radioegor146.cobfuscator.analysis;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

public final class CKeywords {

    private static final Set<String> KEYWORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "auto", "break", "case", "char", "const", "continue", "default", "do", "double", "else",
            "enum", "extern", "float", "for", "goto", "if", "inline", "int", "long", "register",
            "offsetof", "restrict", "return", "short", "signed", "sizeof", "static", "struct", "switch",
            "typedef", "union", "unsigned", "void", "volatile", "while", "__int128", "_bool", "_complex",
            "_noreturn", "_thread_local", "_static_assert", "_atomic", "_alignof", "_alignas", "_pragma"
    )));

    private CKeywords() {
    }

    /**
     * Keywords are matched case-insensitively so generated names never shadow {@code _Bool} and friends.
     */
    public static boolean isKeyword(String name) {
        return KEYWORDS.contains(name.toLowerCase(Locale.ROOT));
    }
}
