package by.radioegor146.cobfuscator.rename;

import by.radioegor146.cobfuscator.analysis.DefinitionKey;
import by.radioegor146.cobfuscator.analysis.Identifier;
import by.radioegor146.cobfuscator.analysis.IdentifierAnalyzer;
import by.radioegor146.cobfuscator.analysis.NameSpace;
import by.radioegor146.cobfuscator.ast.Decl;
import by.radioegor146.cobfuscator.ast.Directive;
import by.radioegor146.cobfuscator.ast.FileAST;
import by.radioegor146.cobfuscator.ast.FuncDecl;
import by.radioegor146.cobfuscator.ast.FuncDef;
import by.radioegor146.cobfuscator.ast.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Gives every identifier defined in the translation unit a meaningless name.
 * <p>
 * Names are kept when renaming them would change what the program links against or what the
 * preprocessor expands: {@code main}, functions and {@code extern} objects that are declared
 * but never defined here, and any word that appears in a directive other than
 * {@code #include}. Identifiers the unit uses without defining are never touched.
 * <p>
 * In the direct mode each original spelling maps to one new spelling, so shadowing is kept as
 * it was. The minimised mode first moves everything to temporary names and then gives each
 * definition the oldest generated name that nothing live at that point still needs, which
 * makes unrelated entities share names.
 */
public class IdentifierRenamer {

    private static final Logger logger = LoggerFactory.getLogger(IdentifierRenamer.class);

    private static final Pattern WORD = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final String TEMP_PREFIX = "tmp_ident_";

    private final RenameStyle style;
    private final boolean minimise;

    public IdentifierRenamer(RenameStyle style, boolean minimise) {
        this.style = style;
        this.minimise = minimise;
    }

    public RenameStyle getStyle() {
        return style;
    }

    public boolean isMinimise() {
        return minimise;
    }

    /**
     * Renames the analysed tree in place and brings forward declarations in line with the
     * renamed definitions.
     *
     * @return how many definitions were renamed
     */
    public int process(IdentifierAnalyzer analyzer) {
        Set<String> kept = collectKeptNames(analyzer);
        NameGenerator names = new NameGenerator(style);
        names.ban(kept);
        int renamed = minimise ? renameMinimised(analyzer, names, kept) : renameDirect(analyzer, names, kept);
        analyzer.updateFunctionSpecs();
        logger.debug("Renamed {} definitions using {} names", renamed, names.getGenerated().size());
        return renamed;
    }

    private static int renameDirect(IdentifierAnalyzer analyzer, NameGenerator names, Set<String> kept) {
        // Original spellings stay reserved until the end; a new name must not capture one.
        names.ban(analyzer.getIdentifiers());
        Map<String, String> mapping = new HashMap<>();
        int renamed = 0;
        for (DefinitionKey key : analyzer.getDefinitions()) {
            String name = key.getIdentifier().getName();
            if (kept.contains(name)) {
                continue;
            }
            String newName = mapping.get(name);
            if (newName == null) {
                newName = names.next();
                mapping.put(name, newName);
            }
            if (analyzer.changeIdent(key, newName)) {
                renamed++;
            }
        }
        return renamed;
    }

    private static int renameMinimised(IdentifierAnalyzer analyzer, NameGenerator names, Set<String> kept) {
        Set<String> free = new HashSet<>(analyzer.getIdentifiers());
        for (DefinitionKey key : analyzer.getDefinitions()) {
            free.remove(key.getIdentifier().getName());
        }
        names.ban(free);

        Set<String> temporary = new HashSet<>();
        int index = 0;
        for (DefinitionKey key : analyzer.getDefinitions()) {
            if (kept.contains(key.getIdentifier().getName())) {
                continue;
            }
            String tempName = TEMP_PREFIX + index++;
            while (analyzer.getIdentifiers().contains(tempName)) {
                tempName = TEMP_PREFIX + index++;
            }
            temporary.add(tempName);
            analyzer.changeIdent(key, tempName);
        }
        names.ban(temporary);

        Map<Node, Set<String>> memberNames = new HashMap<>();
        int renamed = 0;
        for (DefinitionKey key : analyzer.getDefinitions()) {
            Identifier identifier = key.getIdentifier();
            if (!temporary.contains(identifier.getName())) {
                continue;
            }
            Node stmt = analyzer.getDefinitionStmt(key);
            NameSpace namespace = identifier.getNamespace();
            Node owner = namespace == NameSpace.MEMBER ? identifier.getOwner() : null;
            Set<String> required = new HashSet<>(analyzer.getRequiredIdentifiers(stmt, namespace, owner, false));
            required.remove(identifier.getName());
            if (owner != null && memberNames.containsKey(owner)) {
                required.addAll(memberNames.get(owner));
            }

            String newName = null;
            for (String candidate : names.getGenerated()) {
                if (!required.contains(candidate)) {
                    newName = candidate;
                    break;
                }
            }
            while (newName == null || required.contains(newName)) {
                newName = names.next();
            }
            if (owner != null) {
                memberNames.computeIfAbsent(owner, k -> new HashSet<>()).add(newName);
            }
            if (analyzer.changeIdent(key, newName)) {
                renamed++;
            }
        }
        return renamed;
    }

    /**
     * Names that must survive renaming.
     */
    static Set<String> collectKeptNames(IdentifierAnalyzer analyzer) {
        Set<String> kept = new LinkedHashSet<>();
        kept.add("main");
        FileAST tree = analyzer.getTree();
        Set<String> defined = definedAtFileLevel(tree);
        for (Node ext : tree.ext) {
            if (ext instanceof Directive && !((Directive) ext).text.trim().startsWith("#include")) {
                Matcher matcher = WORD.matcher(((Directive) ext).text);
                while (matcher.find()) {
                    kept.add(matcher.group());
                }
            }
        }
        for (DefinitionKey key : analyzer.getDefinitions()) {
            if (key.getIdentifier().getNamespace() != NameSpace.ORDINARY) {
                continue;
            }
            Node stmt = analyzer.getDefinitionStmt(key);
            if (stmt instanceof Decl && isExternal((Decl) stmt) && !defined.contains(((Decl) stmt).name)) {
                kept.add(((Decl) stmt).name);
            }
        }
        return kept;
    }

    private static boolean isExternal(Decl decl) {
        return decl.type instanceof FuncDecl || decl.storage.contains("extern");
    }

    private static Set<String> definedAtFileLevel(FileAST tree) {
        Set<String> defined = new HashSet<>();
        List<Node> ext = tree.ext;
        for (Node node : ext) {
            if (node instanceof FuncDef && ((FuncDef) node).body != null) {
                defined.add(((FuncDef) node).getName());
            } else if (node instanceof Decl && ((Decl) node).name != null && !isExternal((Decl) node)) {
                defined.add(((Decl) node).name);
            }
        }
        return defined;
    }
}
