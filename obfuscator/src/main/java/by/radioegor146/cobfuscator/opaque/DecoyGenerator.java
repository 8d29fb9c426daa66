package by.radioegor146.cobfuscator.opaque;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.analysis.ExprType;
import by.radioegor146.cobfuscator.analysis.ExpressionAnalyzer;
import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.ast.ArrayDecl;
import by.radioegor146.cobfuscator.ast.Assignment;
import by.radioegor146.cobfuscator.ast.BinaryOp;
import by.radioegor146.cobfuscator.ast.Case;
import by.radioegor146.cobfuscator.ast.Child;
import by.radioegor146.cobfuscator.ast.Compound;
import by.radioegor146.cobfuscator.ast.Constant;
import by.radioegor146.cobfuscator.ast.Decl;
import by.radioegor146.cobfuscator.ast.Enumerator;
import by.radioegor146.cobfuscator.ast.Goto;
import by.radioegor146.cobfuscator.ast.Label;
import by.radioegor146.cobfuscator.ast.NamedInitializer;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.UnaryOp;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Produces "buggy" copies of real code to sit on branches that never execute.
 * <p>
 * The copy gets operators swapped and constants nudged so that it no longer computes what the
 * original does. The first eligible change always happens; later ones are random. Constants
 * in {@code case} labels, array dimensions, bit-field widths and enumerator values are left
 * alone, since changing those can make the program ill-formed. Arithmetic operators are only
 * swapped between arithmetic operands, never in pointer arithmetic. Labels in the copy are
 * renamed so they do not clash with the original's.
 */
public class DecoyGenerator {

    private static final Map<String, List<String>> BINARY_SWAPS = new HashMap<>();
    private static final Map<String, String> UNARY_SWAPS = new HashMap<>();
    private static final Map<String, String> ASSIGNMENT_SWAPS = new HashMap<>();

    static {
        BINARY_SWAPS.put(">", Arrays.asList("<", "<=", "!=", "=="));
        BINARY_SWAPS.put(">=", Arrays.asList("<", "<=", "!=", "=="));
        BINARY_SWAPS.put("<", Arrays.asList(">", ">=", "!=", "=="));
        BINARY_SWAPS.put("<=", Arrays.asList(">", ">=", "!=", "=="));
        BINARY_SWAPS.put("==", Arrays.asList("!=", "<", ">"));
        BINARY_SWAPS.put("!=", Arrays.asList("==", "<", ">"));
        BINARY_SWAPS.put("+", Collections.singletonList("-"));
        BINARY_SWAPS.put("-", Collections.singletonList("+"));
        BINARY_SWAPS.put("*", Arrays.asList("+", "-"));
        BINARY_SWAPS.put("&&", Collections.singletonList("||"));
        BINARY_SWAPS.put("||", Collections.singletonList("&&"));
        UNARY_SWAPS.put("++", "--");
        UNARY_SWAPS.put("--", "++");
        UNARY_SWAPS.put("p++", "p--");
        UNARY_SWAPS.put("p--", "p++");
        ASSIGNMENT_SWAPS.put("+=", "-=");
        ASSIGNMENT_SWAPS.put("-=", "+=");
    }

    private static final List<Integer> CONSTANT_DELTAS = Arrays.asList(-3, -2, -1, 1, 2, 3);

    private final IdentifierAnalyzer analyzer;
    private final double replaceOpProbability;
    private final double changeConstantProbability;

    private boolean changed;

    public DecoyGenerator(IdentifierAnalyzer analyzer) {
        this(analyzer, 0.5, 0.4);
    }

    public DecoyGenerator(IdentifierAnalyzer analyzer, double replaceOpProbability, double changeConstantProbability) {
        this.analyzer = analyzer;
        this.replaceOpProbability = replaceOpProbability;
        this.changeConstantProbability = changeConstantProbability;
    }

    /**
     * Returns a mutated deep copy of the statement wrapped in a compound. The original is not touched.
     *
     * @param usedLabels label names already taken in the function; names given to the copy's
     *                   labels are added to it
     */
    public Compound generate(Node stmt, Collection<String> usedLabels) {
        Node copy = stmt.copy();
        changed = false;
        mutate(stmt, copy, false);
        renameLabels(copy, usedLabels, analyzer);
        if (copy instanceof Compound) {
            return (Compound) copy;
        }
        return new Compound(new ArrayList<>(Collections.singletonList(copy)));
    }

    public boolean isChanged() {
        return changed;
    }

    /**
     * Gives every label in the subtree a fresh name and retargets the gotos inside the subtree
     * that jumped to it.
     */
    public static void renameLabels(Node root, Collection<String> usedLabels, IdentifierAnalyzer analyzer) {
        List<Label> labels = new ArrayList<>();
        List<Goto> gotos = new ArrayList<>();
        collectJumps(root, labels, gotos);
        Map<String, String> renames = new HashMap<>();
        for (Label label : labels) {
            String name = analyzer.getUniqueIdentifier(usedLabels);
            usedLabels.add(name);
            renames.put(label.name, name);
            label.name = name;
        }
        for (Goto jump : gotos) {
            String name = renames.get(jump.name);
            if (name != null) {
                jump.name = name;
            }
        }
    }

    private static void collectJumps(Node node, List<Label> labels, List<Goto> gotos) {
        if (node instanceof Label) {
            labels.add((Label) node);
        } else if (node instanceof Goto) {
            gotos.add((Goto) node);
        }
        for (Child child : node.children()) {
            collectJumps(child.getNode(), labels, gotos);
        }
    }

    // The original subtree is walked alongside its copy so operand types can be looked up.
    private void mutate(Node original, Node copy, boolean frozen) {
        if (copy instanceof Case) {
            Case originalCase = (Case) original;
            Case copyCase = (Case) copy;
            for (int i = 0; i < copyCase.stmts.size(); i++) {
                mutate(originalCase.stmts.get(i), copyCase.stmts.get(i), frozen);
            }
            return;
        }
        if (!frozen) {
            if (copy instanceof BinaryOp) {
                mutateBinary((BinaryOp) original, (BinaryOp) copy);
            } else if (copy instanceof UnaryOp) {
                mutateUnary((UnaryOp) copy);
            } else if (copy instanceof Assignment) {
                mutateAssignment((Assignment) copy);
            } else if (copy instanceof Constant) {
                mutateConstant((Constant) copy);
            }
        }
        List<Child> originalChildren = original.children();
        List<Child> copyChildren = copy.children();
        for (int i = 0; i < copyChildren.size() && i < originalChildren.size(); i++) {
            Child child = copyChildren.get(i);
            boolean freezeChild = frozen
                    || (copy instanceof ArrayDecl && "dim".equals(child.getField()))
                    || (copy instanceof Decl && "bitsize".equals(child.getField()))
                    || (copy instanceof NamedInitializer && "name".equals(child.getField()))
                    || copy instanceof Enumerator;
            mutate(originalChildren.get(i).getNode(), child.getNode(), freezeChild);
        }
    }

    private boolean shouldChange(double probability) {
        return !changed || FastRandom.nextDouble() < probability;
    }

    private void mutateBinary(BinaryOp original, BinaryOp copy) {
        List<String> options = BINARY_SWAPS.get(copy.op);
        if (options == null || !shouldChange(replaceOpProbability)) {
            return;
        }
        if (isArithmetic(copy.op) && !(isNumeric(original.left) && isNumeric(original.right))) {
            return;
        }
        copy.op = FastRandom.choice(options);
        changed = true;
    }

    private static boolean isArithmetic(String op) {
        return "+".equals(op) || "-".equals(op) || "*".equals(op);
    }

    private boolean isNumeric(Node expr) {
        ExpressionAnalyzer expressions = analyzer.getExpressionAnalyzer();
        ExprType type = expressions.getType(expr);
        return type != null && (type.isInt() || type.isReal());
    }

    private void mutateUnary(UnaryOp copy) {
        String swapped = UNARY_SWAPS.get(copy.op);
        if (swapped != null && shouldChange(replaceOpProbability)) {
            copy.op = swapped;
            changed = true;
        }
    }

    private void mutateAssignment(Assignment copy) {
        String swapped = ASSIGNMENT_SWAPS.get(copy.op);
        if (swapped != null && shouldChange(replaceOpProbability)) {
            copy.op = swapped;
            changed = true;
        }
    }

    private void mutateConstant(Constant constant) {
        if (constant.value == null || constant.type == null || !shouldChange(changeConstantProbability)) {
            return;
        }
        String mutated;
        if ("char".equals(constant.type)) {
            mutated = shiftCharacter(constant.value);
        } else if ("float".equals(constant.type) || "double".equals(constant.type)
                || "long double".equals(constant.type)) {
            mutated = perturbReal(constant.value);
        } else if ("string".equals(constant.type)) {
            mutated = null;
        } else {
            mutated = perturbInteger(constant.value);
        }
        if (mutated != null) {
            constant.value = mutated;
            changed = true;
        }
    }

    private static String perturbInteger(String text) {
        int end = text.length();
        while (end > 0 && "uUlL".indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        Long value = Constant.parseInteger(text);
        if (value == null || value == 0) {
            return null;
        }
        return Math.max(1, value + FastRandom.choice(CONSTANT_DELTAS)) + text.substring(end);
    }

    private static String perturbReal(String text) {
        int end = text.length();
        while (end > 0 && "fFlL".indexOf(text.charAt(end - 1)) >= 0) {
            end--;
        }
        double value;
        try {
            value = Double.parseDouble(text.substring(0, end));
        } catch (NumberFormatException e) {
            return null;
        }
        if (value == 0.0 || Double.isInfinite(value)) {
            return null;
        }
        return (value + FastRandom.nextDouble()) + text.substring(end);
    }

    private static String shiftCharacter(String text) {
        if (text.length() != 3 || text.charAt(0) != '\'' || text.charAt(2) != '\'') {
            return null;
        }
        char c = (char) (text.charAt(1) + 1);
        if (c == '\'' || c == '\\') {
            c++;
        }
        if (c < 0x20 || c > 0x7e) {
            return null;
        }
        return "'" + c + "'";
    }
}
