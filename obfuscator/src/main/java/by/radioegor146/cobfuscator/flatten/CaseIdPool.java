package by.radioegor146.cobfuscator.flatten;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.ast.Constant;
import by.radioegor146.cobfuscator.ast.ID;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.UnaryOp;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Hands out the dispatch values of one flattened function, never the same one twice.
 * <p>
 * Random integers are drawn from {@code [-2^p, 2^p)} with {@code p = floor(log2(n)) + 3} for the
 * n-th value, so the range keeps growing with the number of values handed out and sampling
 * never runs dry. Enumerator ids are fresh names from the analyzer.
 */
public class CaseIdPool {

    private final CaseIdStyle style;
    private final IdentifierAnalyzer analyzer;
    private final Set<Long> usedStates = new HashSet<>();
    private final List<String> enumerators = new ArrayList<>();
    private long count;

    public CaseIdPool(CaseIdStyle style, IdentifierAnalyzer analyzer) {
        this.style = style;
        this.analyzer = analyzer;
    }

    public CaseId next() {
        count++;
        switch (style) {
            case SEQUENTIAL:
                return new CaseId(count - 1);
            case RANDOM_INT:
                return new CaseId(generateKey());
            case ENUMERATOR: {
                String name = analyzer.getUniqueIdentifier(enumerators);
                enumerators.add(name);
                return new CaseId(name);
            }
            default:
                throw new IllegalStateException("Unknown case id style " + style);
        }
    }

    private long generateKey() {
        int power = 63 - Long.numberOfLeadingZeros(count) + 3;
        long range = 1L << power;
        long key;
        do {
            key = FastRandom.nextLong(-range, range);
        } while (usedStates.contains(key));
        usedStates.add(key);
        return key;
    }

    public CaseIdStyle getStyle() {
        return style;
    }

    /**
     * Enumerator names handed out so far, in allocation order.
     */
    public List<String> getEnumerators() {
        return Collections.unmodifiableList(enumerators);
    }

    /**
     * A dispatch value: an integer or an enumerator name.
     */
    public static final class CaseId {
        private final long value;
        private final String enumerator;

        CaseId(long value) {
            this.value = value;
            this.enumerator = null;
        }

        CaseId(String enumerator) {
            this.value = 0;
            this.enumerator = enumerator;
        }

        public Node toExpression() {
            if (enumerator != null) {
                return new ID(enumerator);
            }
            return value < 0 ? new UnaryOp("-", Constant.ofInt(-value)) : Constant.ofInt(value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof CaseId)) {
                return false;
            }
            CaseId other = (CaseId) o;
            return enumerator == null ? other.enumerator == null && value == other.value
                    : enumerator.equals(other.enumerator);
        }

        @Override
        public int hashCode() {
            return enumerator == null ? Long.hashCode(value) : enumerator.hashCode();
        }

        @Override
        public String toString() {
            return enumerator == null ? Long.toString(value) : enumerator;
        }
    }
}
