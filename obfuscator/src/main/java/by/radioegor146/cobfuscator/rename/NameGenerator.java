package by.radioegor146.cobfuscator.rename;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.analysis.CKeywords;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Produces a stream of distinct identifiers in one {@link RenameStyle}. Names handed out are
 * never repeated and never collide with keywords or with anything passed to {@link #ban}.
 */
public class NameGenerator {

    private static final String LETTERS = "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final String DIGITS = "0123456789";
    // Underscores are weighted up in random names.
    private static final String RANDOM_CHARS = LETTERS + DIGITS + "______";

    private final RenameStyle style;
    private final Set<String> banned = new HashSet<>();
    private final List<String> generated = new ArrayList<>();
    private final int randomSource;
    private int attempts;

    public NameGenerator(RenameStyle style) {
        this.style = style;
        this.randomSource = FastRandom.nextInt(1 << 16);
    }

    public void ban(Collection<String> names) {
        banned.addAll(names);
    }

    public void ban(String name) {
        banned.add(name);
    }

    /**
     * Names generated so far, oldest first.
     */
    public List<String> getGenerated() {
        return Collections.unmodifiableList(generated);
    }

    public String next() {
        String name;
        do {
            name = candidate(attempts);
            attempts++;
        } while (banned.contains(name) || CKeywords.isKeyword(name));
        banned.add(name);
        generated.add(name);
        return name;
    }

    private String candidate(int index) {
        switch (style) {
            case COMPLETE_RANDOM:
                return randomName();
            case ONLY_UNDERSCORES:
                return underscores(index + 1);
            case MINIMAL_LENGTH:
                return minimalName(index);
            case I_AND_L:
                return iAndLName(index);
            default:
                throw new IllegalStateException("Unknown rename style " + style);
        }
    }

    private static String randomName() {
        int length = FastRandom.nextIntInclusive(4, 19);
        StringBuilder sb = new StringBuilder();
        sb.append(LETTERS.charAt(FastRandom.nextInt(LETTERS.length())));
        for (int i = 0; i < length; i++) {
            sb.append(RANDOM_CHARS.charAt(FastRandom.nextInt(RANDOM_CHARS.length())));
        }
        return sb.toString();
    }

    private static String underscores(int count) {
        StringBuilder sb = new StringBuilder(count);
        for (int i = 0; i < count; i++) {
            sb.append('_');
        }
        return sb.toString();
    }

    /**
     * Counts through every identifier in order of length: the first character is a letter or an
     * underscore, later ones may also be digits.
     */
    static String minimalName(int index) {
        String first = LETTERS + "_";
        String rest = first + DIGITS;
        StringBuilder sb = new StringBuilder();
        long current = index;
        sb.append(first.charAt((int) (current % first.length())));
        current /= first.length();
        while (current > 0) {
            current--;
            sb.append(rest.charAt((int) (current % rest.length())));
            current /= rest.length();
        }
        return sb.toString();
    }

    /**
     * Spells a hashed value in binary using {@code l} and {@code I}. The block widens as more
     * names are needed so that collisions stay rare.
     */
    private String iAndLName(int index) {
        int bits = 8;
        long values = 1L << bits;
        while ((long) index * 4 > values) {
            bits++;
            values <<= 1;
        }
        long hash = Math.floorMod(Integer.toString(index).hashCode() * 0x9E3779B1L + randomSource, values);
        StringBuilder sb = new StringBuilder(bits);
        for (int bit = bits - 1; bit >= 0; bit--) {
            sb.append(((hash >>> bit) & 1L) != 0 ? 'l' : 'I');
        }
        return sb.toString();
    }
}
