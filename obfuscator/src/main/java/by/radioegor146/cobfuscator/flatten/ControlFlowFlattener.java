package by.radioegor146.cobfuscator.flatten;

import by.radioegor146.cobfuscator.FastRandom;
import by.radioegor146.cobfuscator.ObfuscationException;
import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.ast.Assignment;
import by.radioegor146.cobfuscator.ast.BinaryOp;
import by.radioegor146.cobfuscator.ast.Break;
import by.radioegor146.cobfuscator.ast.Case;
import by.radioegor146.cobfuscator.ast.Compound;
import by.radioegor146.cobfuscator.ast.Continue;
import by.radioegor146.cobfuscator.ast.Decl;
import by.radioegor146.cobfuscator.ast.Default;
import by.radioegor146.cobfuscator.ast.DoWhile;
import by.radioegor146.cobfuscator.ast.EmptyStatement;
import by.radioegor146.cobfuscator.ast.EnumType;
import by.radioegor146.cobfuscator.ast.Enumerator;
import by.radioegor146.cobfuscator.ast.EnumeratorList;
import by.radioegor146.cobfuscator.ast.FileAST;
import by.radioegor146.cobfuscator.ast.For;
import by.radioegor146.cobfuscator.ast.FuncDecl;
import by.radioegor146.cobfuscator.ast.FuncDef;
import by.radioegor146.cobfuscator.ast.Goto;
import by.radioegor146.cobfuscator.ast.ID;
import by.radioegor146.cobfuscator.ast.IdentifierType;
import by.radioegor146.cobfuscator.ast.If;
import by.radioegor146.cobfuscator.ast.Label;
import by.radioegor146.cobfuscator.ast.Node;
import by.radioegor146.cobfuscator.ast.Return;
import by.radioegor146.cobfuscator.ast.Switch;
import by.radioegor146.cobfuscator.ast.TypeDecl;
import by.radioegor146.cobfuscator.ast.While;
import by.radioegor146.cobfuscator.flatten.CaseIdPool.CaseId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens the control flow of every function into a single dispatch loop:
 * <pre>
 *   [hoisted declarations]
 *   int sw = ENTRY;
 *   while (sw != EXIT) {
 *     switch (sw) { case ...: ...; sw = NEXT; break; ... }
 *   }
 * </pre>
 * Straight-line runs of statements become one case each. Branches and loops become cases that
 * test their condition and pick the next case id. A {@code switch} is kept as a small switch of
 * {@code goto}s into the cases holding its bodies.
 * <p>
 * Every function gets exactly one dispatch level, so {@code break} and {@code continue} become
 * an assignment to the dispatch variable followed by a {@code break} out of the dispatch switch:
 * <ul>
 *     <li>{@code break} goes to the exit of the innermost enclosing loop or switch;</li>
 *     <li>{@code continue} goes to the condition of the innermost enclosing {@code while} or
 *     {@code do}, or to the increment of the innermost {@code for}.</li>
 * </ul>
 * Functions that cannot be flattened are logged and left unchanged.
 */
public class ControlFlowFlattener {

    private static final Logger logger = LoggerFactory.getLogger(ControlFlowFlattener.class);

    private final CaseIdStyle style;
    private final boolean randomiseCases;

    public ControlFlowFlattener(CaseIdStyle style, boolean randomiseCases) {
        this.style = style;
        this.randomiseCases = randomiseCases;
    }

    public CaseIdStyle getStyle() {
        return style;
    }

    public boolean isRandomiseCases() {
        return randomiseCases;
    }

    /**
     * Flattens every function of the analysed tree.
     *
     * @return the number of functions flattened
     */
    public int process(IdentifierAnalyzer analyzer) {
        FileAST tree = analyzer.getTree();
        int flattened = 0;
        for (Node ext : new ArrayList<>(tree.ext)) {
            if (!(ext instanceof FuncDef)) {
                continue;
            }
            FuncDef function = (FuncDef) ext;
            if (function.body == null || function.body.blockItems.isEmpty()) {
                continue;
            }
            try {
                flatten(analyzer, function);
                flattened++;
            } catch (ObfuscationException e) {
                logger.warn("Skipping flattening of function {}: {}", function.getName(), e.getMessage());
            }
        }
        return flattened;
    }

    private void flatten(IdentifierAnalyzer analyzer, FuncDef function) {
        checkStatement(function.body, 0, 0);
        DeclarationHoister.Result hoisted = new DeclarationHoister(analyzer, function).hoist();
        FileAST tree = analyzer.getTree();
        if (hoisted.needsStdlib()) {
            tree.ensureInclude("stdlib.h");
        }
        if (hoisted.needsString()) {
            tree.ensureInclude("string.h");
        }

        FunctionState state = new FunctionState(analyzer, hoisted);
        List<Node> head = new ArrayList<>(hoisted.getHead());
        if (!hoisted.getHeapArrays().isEmpty() && !returnsVoid(function)) {
            state.returnTemp = analyzer.getUniqueIdentifier(null);
            head.add(returnTempDecl(function, state.returnTemp));
        }

        CaseId entry = state.pool.next();
        CaseId exit = state.pool.next();
        state.lowerSequence(new ArrayList<>(function.body.blockItems), entry, exit);

        List<Node> cases = new ArrayList<>();
        for (Map.Entry<CaseId, List<Node>> block : state.cases.entrySet()) {
            cases.add(new Case(block.getKey().toExpression(), block.getValue()));
        }
        if (randomiseCases) {
            FastRandom.shuffle(cases);
        }

        Node dispatchType = new IdentifierType(new ArrayList<>(Collections.singletonList("int")));
        if (style == CaseIdStyle.ENUMERATOR) {
            String enumName = analyzer.getUniqueIdentifier(null);
            tree.ext.add(tree.ext.indexOf(function), enumDeclaration(enumName, state.pool.getEnumerators()));
            dispatchType = new EnumType(enumName, null);
        }
        String dispatch = state.dispatch;
        head.add(new Decl(dispatch, new TypeDecl(dispatch, null, dispatchType), entry.toExpression()));
        head.add(new While(new BinaryOp("!=", new ID(dispatch), exit.toExpression()),
                new Compound(new ArrayList<>(Collections.singletonList(
                        new Switch(new ID(dispatch), new Compound(cases)))))));
        head.addAll(hoisted.releaseStatements());

        function.body.blockItems.clear();
        function.body.blockItems.addAll(head);
        logger.debug("Flattened {} into {} cases", function.getName(), cases.size());
    }

    /**
     * Rejects what the lowering cannot express: {@code case} labels buried inside other
     * statements, and jumps with no enclosing target.
     */
    private static void checkStatement(Node node, int loops, int switches) {
        if (node == null) {
            return;
        }
        if (node instanceof Case || node instanceof Default) {
            throw ObfuscationException.unsupported("case label nested inside another statement");
        } else if (node instanceof Compound) {
            for (Node item : ((Compound) node).blockItems) {
                checkStatement(item, loops, switches);
            }
        } else if (node instanceof If) {
            checkStatement(((If) node).iftrue, loops, switches);
            checkStatement(((If) node).iffalse, loops, switches);
        } else if (node instanceof While) {
            checkStatement(((While) node).stmt, loops + 1, switches);
        } else if (node instanceof DoWhile) {
            checkStatement(((DoWhile) node).stmt, loops + 1, switches);
        } else if (node instanceof For) {
            checkStatement(((For) node).stmt, loops + 1, switches);
        } else if (node instanceof Switch) {
            for (Node item : switchItems((Switch) node)) {
                Node inner = unwrapLabels(item);
                if (inner instanceof Case) {
                    for (Node stmt : ((Case) inner).stmts) {
                        checkStatement(stmt, loops, switches + 1);
                    }
                } else if (inner instanceof Default) {
                    for (Node stmt : ((Default) inner).stmts) {
                        checkStatement(stmt, loops, switches + 1);
                    }
                } else {
                    checkStatement(item, loops, switches + 1);
                }
            }
        } else if (node instanceof Label) {
            checkStatement(((Label) node).stmt, loops, switches);
        } else if (node instanceof Break && loops + switches == 0) {
            throw ObfuscationException.unsupported("break outside of a loop or switch");
        } else if (node instanceof Continue && loops == 0) {
            throw ObfuscationException.unsupported("continue outside of a loop");
        }
    }

    private static List<Node> switchItems(Switch node) {
        if (node.stmt instanceof Compound) {
            return ((Compound) node.stmt).blockItems;
        }
        return node.stmt == null ? Collections.emptyList() : Collections.singletonList(node.stmt);
    }

    private static Node unwrapLabels(Node node) {
        Node current = node;
        while (current instanceof Label) {
            current = ((Label) current).stmt;
        }
        return current;
    }

    private static boolean returnsVoid(FuncDef function) {
        FuncDecl funcDecl = function.getFuncDecl();
        if (funcDecl == null || !(funcDecl.type instanceof TypeDecl)) {
            return false;
        }
        Node base = ((TypeDecl) funcDecl.type).type;
        return base instanceof IdentifierType && ((IdentifierType) base).names.equals(Collections.singletonList("void"));
    }

    private static Decl returnTempDecl(FuncDef function, String name) {
        Node type = Node.copyOf(function.getFuncDecl().type);
        TypeDecl typeDecl = IdentifierAnalyzer.getTypeDecl(type);
        if (typeDecl != null) {
            typeDecl.declname = name;
        }
        Decl decl = new Decl(name, type, null);
        DeclarationHoister.stripConst(decl);
        return decl;
    }

    private static Decl enumDeclaration(String name, List<String> enumerators) {
        List<Enumerator> values = new ArrayList<>();
        for (String enumerator : enumerators) {
            values.add(new Enumerator(enumerator, null));
        }
        FastRandom.shuffle(values);
        return new Decl(null, new EnumType(name, new EnumeratorList(values)), null);
    }

    /**
     * Lowering state of one function: the case id pool, the emitted cases and the targets of
     * {@code break} and {@code continue} at the current point.
     */
    private final class FunctionState {
        final IdentifierAnalyzer analyzer;
        final DeclarationHoister.Result hoisted;
        final CaseIdPool pool;
        final String dispatch;
        final Map<CaseId, List<Node>> cases = new LinkedHashMap<>();
        final Deque<CaseId> breakTargets = new ArrayDeque<>();
        final Deque<CaseId> continueTargets = new ArrayDeque<>();
        String returnTemp;

        FunctionState(IdentifierAnalyzer analyzer, DeclarationHoister.Result hoisted) {
            this.analyzer = analyzer;
            this.hoisted = hoisted;
            this.pool = new CaseIdPool(style, analyzer);
            this.dispatch = analyzer.getUniqueIdentifier(null);
        }

        void emit(CaseId id, List<Node> stmts) {
            if (cases.put(id, stmts) != null) {
                throw new IllegalStateException("Case " + id + " emitted twice");
            }
        }

        List<Node> jump(CaseId target) {
            List<Node> stmts = new ArrayList<>();
            stmts.add(new Assignment("=", new ID(dispatch), target.toExpression()));
            stmts.add(new Break());
            return stmts;
        }

        List<Node> branch(Node cond, CaseId ifTrue, CaseId ifFalse) {
            List<Node> stmts = new ArrayList<>();
            stmts.add(new If(cond, new Assignment("=", new ID(dispatch), ifTrue.toExpression()),
                    new Assignment("=", new ID(dispatch), ifFalse.toExpression())));
            stmts.add(new Break());
            return stmts;
        }

        void attachLabel(CaseId id, String name) {
            List<Node> stmts = cases.get(id);
            stmts.set(0, new Label(name, stmts.get(0)));
        }

        void lowerSequence(List<Node> items, CaseId entry, CaseId exit) {
            CaseId current = entry;
            List<Node> run = new ArrayList<>();
            for (int i = 0; i < items.size(); i++) {
                Node item = items.get(i);
                boolean last = i == items.size() - 1;
                if (item instanceof EmptyStatement) {
                    continue;
                }
                if (isJump(item)) {
                    run.addAll(leave(item));
                    emit(current, run);
                    if (last) {
                        return;
                    }
                    run = new ArrayList<>();
                    current = pool.next();
                } else if (isStructured(item)) {
                    if (!run.isEmpty()) {
                        CaseId next = pool.next();
                        run.addAll(jump(next));
                        emit(current, run);
                        run = new ArrayList<>();
                        current = next;
                    }
                    CaseId after = last ? exit : pool.next();
                    lower(item, current, after);
                    if (last) {
                        return;
                    }
                    current = after;
                } else {
                    run.add(item);
                }
            }
            run.addAll(jump(exit));
            emit(current, run);
        }

        void lower(Node node, CaseId entry, CaseId exit) {
            if (node == null || node instanceof EmptyStatement) {
                emit(entry, jump(exit));
            } else if (node instanceof Compound) {
                lowerSequence(new ArrayList<>(((Compound) node).blockItems), entry, exit);
            } else if (node instanceof If) {
                lowerIf((If) node, entry, exit);
            } else if (node instanceof While) {
                lowerWhile((While) node, entry, exit);
            } else if (node instanceof DoWhile) {
                lowerDoWhile((DoWhile) node, entry, exit);
            } else if (node instanceof For) {
                lowerFor((For) node, entry, exit);
            } else if (node instanceof Switch) {
                lowerSwitch((Switch) node, entry, exit);
            } else if (node instanceof Label) {
                Label label = (Label) node;
                lower(label.stmt, entry, exit);
                attachLabel(entry, label.name);
            } else if (isJump(node)) {
                emit(entry, leave(node));
            } else {
                List<Node> stmts = new ArrayList<>();
                stmts.add(node);
                stmts.addAll(jump(exit));
                emit(entry, stmts);
            }
        }

        private void lowerIf(If node, CaseId entry, CaseId exit) {
            CaseId ifTrue = pool.next();
            CaseId ifFalse = node.iffalse == null ? exit : pool.next();
            emit(entry, branch(node.cond, ifTrue, ifFalse));
            lower(node.iftrue, ifTrue, exit);
            if (node.iffalse != null) {
                lower(node.iffalse, ifFalse, exit);
            }
        }

        private void lowerWhile(While node, CaseId entry, CaseId exit) {
            CaseId body = pool.next();
            emit(entry, branch(node.cond, body, exit));
            breakTargets.push(exit);
            continueTargets.push(entry);
            lower(node.stmt, body, entry);
            continueTargets.pop();
            breakTargets.pop();
        }

        private void lowerDoWhile(DoWhile node, CaseId entry, CaseId exit) {
            CaseId test = pool.next();
            breakTargets.push(exit);
            continueTargets.push(test);
            lower(node.stmt, entry, test);
            continueTargets.pop();
            breakTargets.pop();
            emit(test, branch(node.cond, entry, exit));
        }

        private void lowerFor(For node, CaseId entry, CaseId exit) {
            CaseId test = entry;
            if (node.init != null) {
                test = pool.next();
                List<Node> stmts = new ArrayList<>();
                stmts.add(node.init);
                stmts.addAll(jump(test));
                emit(entry, stmts);
            }
            CaseId body = pool.next();
            CaseId increment = node.next == null ? test : pool.next();
            emit(test, node.cond == null ? jump(body) : branch(node.cond, body, exit));
            breakTargets.push(exit);
            continueTargets.push(increment);
            lower(node.stmt, body, increment);
            continueTargets.pop();
            breakTargets.pop();
            if (node.next != null) {
                List<Node> stmts = new ArrayList<>();
                stmts.add(node.next);
                stmts.addAll(jump(test));
                emit(increment, stmts);
            }
        }

        /**
         * Keeps the selection as a real {@code switch} whose cases only jump to labels placed
         * at the start of the lowered case bodies. Bodies fall through into each other in order.
         */
        private void lowerSwitch(Switch node, CaseId entry, CaseId exit) {
            List<Node> leading = new ArrayList<>();
            List<SwitchGroup> groups = new ArrayList<>();
            for (Node item : switchItems(node)) {
                List<String> labels = new ArrayList<>();
                Node inner = item;
                while (inner instanceof Label) {
                    labels.add(((Label) inner).name);
                    inner = ((Label) inner).stmt;
                }
                if (inner instanceof Case || inner instanceof Default) {
                    groups.add(new SwitchGroup(inner, labels));
                } else if (groups.isEmpty()) {
                    leading.add(item);
                } else {
                    groups.get(groups.size() - 1).stmts.add(item);
                }
            }

            List<Node> selection = new ArrayList<>();
            for (SwitchGroup group : groups) {
                group.id = pool.next();
                group.target = analyzer.getUniqueIdentifier(null);
                List<Node> jumpToBody = new ArrayList<>(Collections.singletonList(new Goto(group.target)));
                if (group.label instanceof Case) {
                    selection.add(new Case(((Case) group.label).expr, jumpToBody));
                } else {
                    selection.add(new Default(jumpToBody));
                }
            }
            List<Node> stmts = new ArrayList<>();
            stmts.add(new Switch(node.cond, new Compound(selection)));
            stmts.addAll(jump(exit));
            emit(entry, stmts);

            breakTargets.push(exit);
            for (int i = 0; i < groups.size(); i++) {
                SwitchGroup group = groups.get(i);
                CaseId next = i + 1 < groups.size() ? groups.get(i + 1).id : exit;
                lowerSequence(group.stmts, group.id, next);
                attachLabel(group.id, group.target);
                for (String label : group.userLabels) {
                    attachLabel(group.id, label);
                }
            }
            if (!leading.isEmpty()) {
                // Only reachable through labels inside it.
                lowerSequence(leading, pool.next(), exit);
            }
            breakTargets.pop();
        }

        private boolean isJump(Node node) {
            return node instanceof Break || node instanceof Continue || node instanceof Return || node instanceof Goto;
        }

        private boolean isStructured(Node node) {
            return node instanceof Compound || node instanceof If || node instanceof While
                    || node instanceof DoWhile || node instanceof For || node instanceof Switch
                    || node instanceof Label;
        }

        /**
         * The statements that replace a jump out of the current case.
         */
        private List<Node> leave(Node node) {
            if (node instanceof Break) {
                return jump(breakTargets.peek());
            }
            if (node instanceof Continue) {
                return jump(continueTargets.peek());
            }
            List<Node> stmts = new ArrayList<>();
            if (node instanceof Return && !hoisted.getHeapArrays().isEmpty()) {
                Return ret = (Return) node;
                if (ret.expr != null && returnTemp != null) {
                    stmts.add(new Assignment("=", new ID(returnTemp), ret.expr));
                    ret.expr = new ID(returnTemp);
                }
                stmts.addAll(hoisted.releaseStatements());
            }
            stmts.add(node);
            return stmts;
        }
    }

    private static final class SwitchGroup {
        final Node label;
        final List<String> userLabels;
        final List<Node> stmts;
        CaseId id;
        String target;

        SwitchGroup(Node label, List<String> userLabels) {
            this.label = label;
            this.userLabels = userLabels;
            this.stmts = new ArrayList<>(label instanceof Case ? ((Case) label).stmts : ((Default) label).stmts);
        }
    }
}
