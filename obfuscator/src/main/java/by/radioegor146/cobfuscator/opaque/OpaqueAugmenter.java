package by.radioegor146.cobfuscator.opaque;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.ast.BinaryOp;
import by.radioegor146.cobfuscator.ast.DoWhile;
import by.radioegor146.cobfuscator.ast.For;
import by.radioegor146.cobfuscator.ast.FuncDef;
import by.radioegor146.cobfuscator.ast.If;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.NodeVisitor;
import by.radioegor146.cobfuscator.ast.TernaryOp;
import by.radioegor146.cobfuscator.ast.While;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Folds opaque predicates into existing conditions.
 * <p>
 * A true predicate {@code P} is combined with a condition {@code C} either as {@code P && C}
 * or as {@code !P || C}, operands in random order. Both forms evaluate {@code C} exactly once
 * and have its truth value, so side effects in conditions are preserved.
 */
public class OpaqueAugmenter extends NodeVisitor {

    private static final Logger logger = LoggerFactory.getLogger(OpaqueAugmenter.class);

    private final List<OperandStyle> styles;
    private final double probability;
    private final int number;
    private final OperandSourceConfig config;

    private OperandSource source;
    private FuncDef currentFunction;
    private int augmented;

    public OpaqueAugmenter(Collection<OperandStyle> styles, double probability, int number,
                           OperandSourceConfig config) {
        this.styles = new ArrayList<>(styles);
        this.probability = probability;
        this.number = number;
        this.config = config;
    }

    /**
     * Augments the conditions of the analysed tree in place.
     *
     * @return how many predicates were added
     */
    public int process(IdentifierAnalyzer analyzer) {
        augmented = 0;
        if (styles.isEmpty() || number <= 0 || probability <= 0) {
            return 0;
        }
        source = new OperandSource(analyzer, styles, config);
        currentFunction = null;
        visit(analyzer.getTree());
        logger.debug("Added {} predicates to existing conditions", augmented);
        return augmented;
    }

    /**
     * Combines a condition with a true predicate without changing its value.
     */
    public static Node combine(Node cond, Node predicate) {
        if (FastRandom.nextBoolean()) {
            return FastRandom.nextBoolean()
                    ? new BinaryOp("&&", predicate, cond)
                    : new BinaryOp("&&", cond, predicate);
        }
        Node falsePredicate = OpaquePredicates.negate(predicate);
        return FastRandom.nextBoolean()
                ? new BinaryOp("||", falsePredicate, cond)
                : new BinaryOp("||", cond, falsePredicate);
    }

    private Node augment(Node cond, Node point) {
        if (cond == null || currentFunction == null || FastRandom.nextDouble() >= probability) {
            return cond;
        }
        Node result = cond;
        for (int i = 0; i < number; i++) {
            Node predicate = source.instantiate(OpaquePredicates.randomTrue(), point);
            if (predicate == null) {
                logger.debug("No operands for a predicate in {}", currentFunction.getName());
                break;
            }
            result = combine(result, predicate);
            augmented++;
        }
        return result;
    }

    @Override
    public void visitFuncDef(FuncDef node) {
        FuncDef prev = currentFunction;
        currentFunction = node;
        source.enterFunction(node);
        genericVisit(node);
        source.exitFunction();
        currentFunction = prev;
        if (prev != null) {
            source.enterFunction(prev);
        }
    }

    @Override
    public void visitIf(If node) {
        genericVisit(node);
        node.cond = augment(node.cond, node);
    }

    @Override
    public void visitWhile(While node) {
        genericVisit(node);
        node.cond = augment(node.cond, node);
    }

    @Override
    public void visitDoWhile(DoWhile node) {
        genericVisit(node);
        node.cond = augment(node.cond, node);
    }

    @Override
    public void visitFor(For node) {
        genericVisit(node);
        node.cond = augment(node.cond, node);
    }

    @Override
    public void visitTernaryOp(TernaryOp node) {
        genericVisit(node);
        node.cond = augment(node.cond, node);
    }
}
