package by.radioegor146.cobfuscator.opaque;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.ast.Break;
import by.radioegor146.cobfuscator.ast.Case;
import by.radioegor146.cobfuscator.ast.Child;
import by.radioegor146.cobfuscator.ast.Compound;
import by.radioegor146.cobfuscator.ast.Continue;
import by.radioegor146.cobfuscator.ast.Decl;
import by.radioegor146.cobfuscator.ast.Default;
import by.radioegor146.cobfuscator.ast.DoWhile;
import by.radioegor146.cobfuscator.ast.For;
import by.radioegor146.cobfuscator.ast.FuncDef;
import by.radioegor146.cobfuscator.ast.If;
import by.radioegor146.cobfuscator.ast.Label;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.NodeVisitor;
import by.radioegor146.cobfuscator.ast.Switch;
import by.radioegor146.cobfuscator.ast.Typedef;
import by.radioegor146.cobfuscator.ast.While;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Inserts new opaque-predicate constructs around existing code.
 * <p>
 * Each function receives {@code number} insertions, split between the enabled granularities by
 * their weights; the share of each is rounded down and the remainder is handed out at random.
 * Block and statement insertions that find no suitable code fall back to wrapping the whole body.
 */
public class OpaqueInserter extends NodeVisitor {

    private static final Logger logger = LoggerFactory.getLogger(OpaqueInserter.class);

    private final List<OperandStyle> styles;
    private final List<Granularity> granularities;
    private final List<InsertionKind> kinds;
    private final int number;
    private final OperandSourceConfig config;

    private IdentifierAnalyzer analyzer;
    private OperandSource source;
    private DecoyGenerator decoys;
    private Set<String> usedLabels;
    private int inserted;

    public OpaqueInserter(Collection<OperandStyle> styles, Collection<Granularity> granularities,
                          Collection<InsertionKind> kinds, int number, OperandSourceConfig config) {
        this.styles = new ArrayList<>(styles);
        this.granularities = new ArrayList<>(granularities);
        this.kinds = new ArrayList<>(kinds);
        this.number = number;
        this.config = config;
    }

    /**
     * Inserts predicates into every function of the analysed tree.
     *
     * @return how many constructs were inserted
     */
    public int process(IdentifierAnalyzer analyzer) {
        inserted = 0;
        if (styles.isEmpty() || granularities.isEmpty() || kinds.isEmpty() || number <= 0) {
            return 0;
        }
        this.analyzer = analyzer;
        this.source = new OperandSource(analyzer, styles, config);
        this.decoys = new DecoyGenerator(analyzer);
        visit(analyzer.getTree());
        logger.debug("Inserted {} opaque predicates", inserted);
        return inserted;
    }

    @Override
    public void visitFuncDef(FuncDef node) {
        if (node.body == null) {
            return;
        }
        source.enterFunction(node);
        usedLabels = new HashSet<>();
        for (Label label : analyzer.getFunctionLabels(node)) {
            usedLabels.add(label.name);
        }
        addOpaquePredicates(node);
        source.exitFunction();
    }

    Map<Granularity, Integer> distribute() {
        Map<Granularity, Integer> amounts = new EnumMap<>(Granularity.class);
        int totalWeight = 0;
        for (Granularity granularity : granularities) {
            totalWeight += config.getWeight(granularity);
        }
        int assigned = 0;
        for (Granularity granularity : granularities) {
            int amount = totalWeight == 0 ? 0
                    : (int) Math.floor((double) config.getWeight(granularity) / totalWeight * number);
            amounts.merge(granularity, amount, Integer::sum);
            assigned += amount;
        }
        while (assigned < number) {
            amounts.merge(FastRandom.choice(granularities), 1, Integer::sum);
            assigned++;
        }
        return amounts;
    }

    private void addOpaquePredicates(FuncDef function) {
        List<Node> compounds = analyzer.getCompoundsInSubtree(function.body);
        Map<Granularity, Integer> amounts = distribute();
        for (int i = 0; i < amounts.getOrDefault(Granularity.PROCEDURAL, 0); i++) {
            addProceduralPredicate(function);
        }
        for (int i = 0; i < amounts.getOrDefault(Granularity.BLOCK, 0); i++) {
            if (!addBlockPredicate(compounds)) {
                addProceduralPredicate(function);
            }
        }
        for (int i = 0; i < amounts.getOrDefault(Granularity.STMT, 0); i++) {
            if (!addStmtPredicate(compounds)) {
                addProceduralPredicate(function);
            }
        }
    }

    private void addProceduralPredicate(FuncDef function) {
        // The body object stays in place so compounds gathered before remain attached to the tree.
        Compound inner = new Compound(function.body.blockItems);
        List<Node> items = generateConstruct(inner, null, true);
        if (items != null) {
            function.body.blockItems = items;
        } else {
            function.body.blockItems = inner.blockItems;
            logger.debug("No predicate could be built for the body of {}", function.getName());
        }
    }

    private static boolean isBlockBoundary(Node item) {
        return item instanceof Decl || item instanceof Typedef || item instanceof Case
                || item instanceof Default || item instanceof Label;
    }

    private Compound chooseCompound(List<Node> compounds) {
        List<Node> available = new ArrayList<>(compounds);
        while (!available.isEmpty()) {
            Node chosen = available.remove(FastRandom.nextInt(available.size()));
            if (!(chosen instanceof Compound)) {
                continue;
            }
            for (Node item : ((Compound) chosen).blockItems) {
                if (!isBlockBoundary(item)) {
                    return (Compound) chosen;
                }
            }
        }
        return null;
    }

    /**
     * Maximal runs of consecutive statements between declarations and labels, as
     * {@code [from, to)} index pairs.
     */
    static List<int[]> findBlocks(List<Node> items) {
        List<int[]> blocks = new ArrayList<>();
        int start = -1;
        for (int i = 0; i < items.size(); i++) {
            if (isBlockBoundary(items.get(i))) {
                if (start >= 0) {
                    blocks.add(new int[]{start, i});
                    start = -1;
                }
            } else if (start < 0) {
                start = i;
            }
        }
        if (start >= 0) {
            blocks.add(new int[]{start, items.size()});
        }
        return blocks;
    }

    private boolean addBlockPredicate(List<Node> compounds) {
        Compound compound = chooseCompound(compounds);
        if (compound == null) {
            return false;
        }
        List<int[]> blocks = findBlocks(compound.blockItems);
        if (blocks.isEmpty()) {
            return false;
        }
        int[] range = FastRandom.choice(blocks);
        List<Node> items = compound.blockItems;
        Compound block = new Compound(new ArrayList<>(items.subList(range[0], range[1])));
        List<Node> replacement = generateConstruct(block, items.get(range[0]), true);
        if (replacement != null) {
            List<Node> result = new ArrayList<>(items.subList(0, range[0]));
            result.addAll(replacement);
            result.addAll(items.subList(range[1], items.size()));
            compound.blockItems = result;
        }
        return true;
    }

    private boolean addStmtPredicate(List<Node> compounds) {
        Compound compound = chooseCompound(compounds);
        if (compound == null) {
            return false;
        }
        List<Integer> candidates = new ArrayList<>();
        for (int i = 0; i < compound.blockItems.size(); i++) {
            if (!isBlockBoundary(compound.blockItems.get(i))) {
                candidates.add(i);
            }
        }
        if (candidates.isEmpty()) {
            return false;
        }
        int index = FastRandom.choice(candidates);
        Node stmt = compound.blockItems.get(index);
        boolean synthetic = !(stmt instanceof Compound);
        Compound target = synthetic ? new Compound(new ArrayList<>(List.of(stmt))) : (Compound) stmt;
        List<Node> replacement = generateConstruct(target, stmt, synthetic);
        if (replacement != null) {
            List<Node> result = new ArrayList<>(compound.blockItems.subList(0, index));
            result.addAll(replacement);
            result.addAll(compound.blockItems.subList(index + 1, compound.blockItems.size()));
            compound.blockItems = result;
        }
        return true;
    }

    /**
     * Builds the statements replacing {@code code}, or null when no kind applies or no predicate
     * operands are available.
     *
     * @param point     the statement the construct is placed at, or null for the start of the body
     * @param synthetic whether {@code code} is a wrapper made here, whose statements may be spliced
     *                  back into the enclosing block; a real block keeps its own scope
     */
    List<Node> generateConstruct(Compound code, Node point, boolean synthetic) {
        List<InsertionKind> candidates = new ArrayList<>(kinds);
        if (containsLooseJump(code, false, false)) {
            candidates.remove(InsertionKind.DO_WHILE);
        }
        if (containsStaticDecl(code)) {
            candidates.remove(InsertionKind.EITHER);
        }
        if (candidates.isEmpty()) {
            return null;
        }
        InsertionKind kind = FastRandom.choice(candidates);
        Node cond = source.instantiate(kind == InsertionKind.EITHER
                ? OpaquePredicates.randomEither() : OpaquePredicates.randomTrue(), point);
        if (cond == null) {
            return null;
        }
        List<Node> result = new ArrayList<>();
        switch (kind) {
            case CHECK:
                result.add(new If(cond, code, null));
                break;
            case FALSE:
                result.add(new If(OpaquePredicates.negate(cond), decoys.generate(code, usedLabels), null));
                appendCode(result, code, synthetic);
                break;
            case ELSE:
                result.add(new If(OpaquePredicates.negate(cond), decoys.generate(code, usedLabels), code));
                break;
            case IF_ELSE:
                result.add(new If(cond, code, decoys.generate(code, usedLabels)));
                break;
            case WHILE_FALSE:
                result.add(new While(OpaquePredicates.negate(cond), decoys.generate(code, usedLabels)));
                appendCode(result, code, synthetic);
                break;
            case DO_WHILE:
                result.add(new DoWhile(OpaquePredicates.negate(cond), code));
                break;
            case EITHER: {
                Compound copy = code.copy();
                DecoyGenerator.renameLabels(copy, usedLabels, analyzer);
                result.add(new If(cond, code, copy));
                break;
            }
            default:
                return null;
        }
        inserted++;
        return result;
    }

    private static void appendCode(List<Node> result, Compound code, boolean synthetic) {
        if (synthetic) {
            result.addAll(code.blockItems);
        } else {
            result.add(code);
        }
    }

    /**
     * Whether a {@code break} or {@code continue} in the subtree would bind to a loop or switch
     * outside of it.
     */
    static boolean containsLooseJump(Node node, boolean inLoop, boolean inSwitch) {
        if (node instanceof Break) {
            return !inLoop && !inSwitch;
        }
        if (node instanceof Continue) {
            return !inLoop;
        }
        boolean loop = inLoop || node instanceof While || node instanceof DoWhile || node instanceof For;
        boolean sw = inSwitch || node instanceof Switch;
        for (Child child : node.children()) {
            if (containsLooseJump(child.getNode(), loop, sw)) {
                return true;
            }
        }
        return false;
    }

    static boolean containsStaticDecl(Node node) {
        if (node instanceof Decl && ((Decl) node).storage.contains("static")) {
            return true;
        }
        for (Child child : node.children()) {
            if (containsStaticDecl(child.getNode())) {
                return true;
            }
        }
        return false;
    }
}
