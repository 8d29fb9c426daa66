package by.radioegor146.cobfuscator.source;

import by.radioegor146.cobfuscator.ast.*;
import by.radioegor146.cobfuscator.source.grammar.CBaseVisitor;
import by.radioegor146.cobfuscator.source.grammar.CParser;
import by.radioegor146.cobfuscator.source.grammar.CParser.*;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers the ANTLR parse tree of a translation unit into the syntax tree used by the
 * obfuscation passes.
 * <p>
 * Declarators are composed inside-out: the declared name is held by a {@link TypeDecl} that
 * wraps the base type, and each pointer, array or function declarator wraps what has been
 * built so far. {@code int *a[3]} therefore becomes {@code ArrayDecl(PtrDecl(TypeDecl))}.
 */
public class AstBuilder extends CBaseVisitor<Node> {

    private static final class Specifiers {
        final List<String> storage = new ArrayList<>();
        final List<String> quals = new ArrayList<>();
        final List<String> funcspec = new ArrayList<>();
        final List<String> names = new ArrayList<>();
        Node aggregate;

        Node baseType() {
            return aggregate != null ? aggregate : new IdentifierType(new ArrayList<>(names));
        }

        boolean isTypedef() {
            return storage.contains("typedef");
        }
    }

    public FileAST buildFile(CompilationUnitContext ctx) {
        List<Node> ext = new ArrayList<>();
        for (ExternalItemContext item : ctx.externalItem()) {
            if (item.functionDefinition() != null) {
                ext.add(buildFunction(item.functionDefinition()));
            } else if (item.declaration() != null) {
                ext.addAll(buildDeclaration(item.declaration()));
            } else if (item.Directive() != null) {
                ext.add(new Directive(item.Directive().getText().trim()));
            }
        }
        return new FileAST(ext);
    }

    // ------------------------------------------------------------------ declarations

    private FuncDef buildFunction(FunctionDefinitionContext ctx) {
        Specifiers spec = buildSpecifiers(ctx.declarationSpecifiers());
        Decl decl = buildDecl(spec, spec.baseType(), ctx.declarator(), null, null);
        return new FuncDef(decl, (Compound) visit(ctx.compoundStatement()));
    }

    private List<Node> buildDeclaration(DeclarationContext ctx) {
        return buildDeclarations(buildSpecifiers(ctx.declarationSpecifiers()), ctx.initDeclaratorList());
    }

    private List<Node> buildDeclarations(Specifiers spec, InitDeclaratorListContext declarators) {
        List<Node> result = new ArrayList<>();
        if (declarators == null) {
            result.add(new Decl(null, new ArrayList<>(spec.quals), new ArrayList<>(spec.storage),
                    new ArrayList<>(spec.funcspec), spec.baseType(), null, null));
            return result;
        }
        Node base = spec.baseType();
        boolean first = true;
        for (InitDeclaratorContext initDeclarator : declarators.initDeclarator()) {
            Node type = first ? base : referenceTo(base);
            first = false;
            if (spec.isTypedef()) {
                String name = CParser.declaratorName(initDeclarator.declarator());
                Node declType = applyDeclarator(initDeclarator.declarator(),
                        new TypeDecl(name, new ArrayList<>(spec.quals), type));
                result.add(new Typedef(name, new ArrayList<>(spec.quals), new ArrayList<>(spec.storage), declType));
            } else {
                Node init = initDeclarator.initializer() == null ? null : buildInitializer(initDeclarator.initializer());
                result.add(buildDecl(spec, type, initDeclarator.declarator(), init, null));
            }
        }
        return result;
    }

    /**
     * A second declarator sharing a specifier list refers to a tagged aggregate by name only,
     * so that its body is emitted once.
     */
    private static Node referenceTo(Node base) {
        if (base instanceof Aggregate) {
            Aggregate aggregate = (Aggregate) base;
            if (aggregate.name != null) {
                return aggregate instanceof Struct ? new Struct(aggregate.name, null) : new Union(aggregate.name, null);
            }
        } else if (base instanceof EnumType && ((EnumType) base).name != null) {
            return new EnumType(((EnumType) base).name, null);
        }
        return base.copy();
    }

    private Decl buildDecl(Specifiers spec, Node base, DeclaratorContext declarator, Node init, Node bitsize) {
        String name = declarator == null ? null : CParser.declaratorName(declarator);
        Node type = new TypeDecl(name, new ArrayList<>(spec.quals), base);
        if (declarator != null) {
            type = applyDeclarator(declarator, type);
        }
        return new Decl(name, new ArrayList<>(spec.quals), new ArrayList<>(spec.storage),
                new ArrayList<>(spec.funcspec), type, init, bitsize);
    }

    private Specifiers buildSpecifiers(DeclarationSpecifiersContext ctx) {
        Specifiers spec = new Specifiers();
        for (DeclarationSpecifierContext specifier : ctx.declarationSpecifier()) {
            if (specifier.storageClassSpecifier() != null) {
                spec.storage.add(specifier.getText());
            } else if (specifier.typeQualifier() != null) {
                spec.quals.add(specifier.getText());
            } else if (specifier.functionSpecifier() != null) {
                spec.funcspec.add(specifier.getText());
            } else {
                addTypeSpecifier(spec, specifier.typeSpecifier());
            }
        }
        return spec;
    }

    private Specifiers buildSpecifiers(SpecifierQualifierListContext ctx) {
        Specifiers spec = new Specifiers();
        for (int i = 0; i < ctx.getChildCount(); i++) {
            ParseTree child = ctx.getChild(i);
            if (child instanceof TypeQualifierContext) {
                spec.quals.add(child.getText());
            } else if (child instanceof TypeSpecifierContext) {
                addTypeSpecifier(spec, (TypeSpecifierContext) child);
            }
        }
        return spec;
    }

    private void addTypeSpecifier(Specifiers spec, TypeSpecifierContext ctx) {
        if (ctx.structOrUnionSpecifier() != null) {
            spec.aggregate = buildStructOrUnion(ctx.structOrUnionSpecifier());
        } else if (ctx.enumSpecifier() != null) {
            spec.aggregate = buildEnum(ctx.enumSpecifier());
        } else {
            spec.names.add(ctx.getText());
        }
    }

    private Node buildStructOrUnion(StructOrUnionSpecifierContext ctx) {
        String name = ctx.Identifier() == null ? null : ctx.Identifier().getText();
        List<Decl> decls = null;
        if (hasToken(ctx, "{")) {
            decls = new ArrayList<>();
            for (StructDeclarationContext member : ctx.structDeclaration()) {
                Specifiers spec = buildSpecifiers(member.specifierQualifierList());
                if (member.structDeclaratorList() == null) {
                    decls.add(new Decl(null, new ArrayList<>(spec.quals), null, null, spec.baseType(), null, null));
                    continue;
                }
                Node base = spec.baseType();
                boolean first = true;
                for (StructDeclaratorContext declarator : member.structDeclaratorList().structDeclarator()) {
                    Node type = first ? base : referenceTo(base);
                    first = false;
                    Node bitsize = declarator.constantExpression() == null ? null : visit(declarator.constantExpression());
                    decls.add(buildDecl(spec, type, declarator.declarator(), null, bitsize));
                }
            }
        }
        return "struct".equals(ctx.structOrUnion().getText()) ? new Struct(name, decls) : new Union(name, decls);
    }

    private EnumType buildEnum(EnumSpecifierContext ctx) {
        String name = ctx.Identifier() == null ? null : ctx.Identifier().getText();
        if (ctx.enumeratorList() == null) {
            return new EnumType(name, null);
        }
        List<Enumerator> enumerators = new ArrayList<>();
        for (EnumeratorContext enumerator : ctx.enumeratorList().enumerator()) {
            Node value = enumerator.constantExpression() == null ? null : visit(enumerator.constantExpression());
            enumerators.add(new Enumerator(enumerator.Identifier().getText(), value));
        }
        return new EnumType(name, new EnumeratorList(enumerators));
    }

    private Node applyDeclarator(DeclaratorContext ctx, Node inner) {
        if (ctx.pointer() != null) {
            inner = applyPointer(ctx.pointer(), inner);
        }
        return applyDirect(ctx.directDeclarator(), inner);
    }

    private Node applyPointer(PointerContext ctx, Node inner) {
        PointerContext current = ctx;
        while (current != null) {
            inner = new PtrDecl(texts(current.typeQualifier()), inner);
            current = current.pointer();
        }
        return inner;
    }

    private Node applyDirect(DirectDeclaratorContext ctx, Node inner) {
        if (ctx instanceof ParenDeclaratorContext) {
            return applyDeclarator(((ParenDeclaratorContext) ctx).declarator(), inner);
        } else if (ctx instanceof ArrayDeclaratorContext) {
            ArrayDeclaratorContext array = (ArrayDeclaratorContext) ctx;
            Node dim = array.assignmentExpression() == null ? null : visit(array.assignmentExpression());
            return applyDirect(array.directDeclarator(), new ArrayDecl(inner, dim, texts(array.typeQualifier())));
        } else if (ctx instanceof FunctionDeclaratorContext) {
            FunctionDeclaratorContext function = (FunctionDeclaratorContext) ctx;
            return applyDirect(function.directDeclarator(), new FuncDecl(buildParams(function.parameterTypeList()), inner));
        }
        return inner;
    }

    private Node applyAbstract(AbstractDeclaratorContext ctx, Node inner) {
        if (ctx.pointer() != null) {
            inner = applyPointer(ctx.pointer(), inner);
        }
        return ctx.directAbstractDeclarator() == null ? inner : applyDirectAbstract(ctx.directAbstractDeclarator(), inner);
    }

    private Node applyDirectAbstract(DirectAbstractDeclaratorContext ctx, Node inner) {
        if (ctx instanceof ParenAbstractDeclaratorContext) {
            return applyAbstract(((ParenAbstractDeclaratorContext) ctx).abstractDeclarator(), inner);
        } else if (ctx instanceof ArrayAbstractBaseContext) {
            ArrayAbstractBaseContext array = (ArrayAbstractBaseContext) ctx;
            return new ArrayDecl(inner, array.assignmentExpression() == null ? null : visit(array.assignmentExpression()), null);
        } else if (ctx instanceof FunctionAbstractBaseContext) {
            return new FuncDecl(buildParams(((FunctionAbstractBaseContext) ctx).parameterTypeList()), inner);
        } else if (ctx instanceof ArrayAbstractDeclaratorContext) {
            ArrayAbstractDeclaratorContext array = (ArrayAbstractDeclaratorContext) ctx;
            Node dim = array.assignmentExpression() == null ? null : visit(array.assignmentExpression());
            return applyDirectAbstract(array.directAbstractDeclarator(), new ArrayDecl(inner, dim, null));
        }
        FunctionAbstractDeclaratorContext function = (FunctionAbstractDeclaratorContext) ctx;
        return applyDirectAbstract(function.directAbstractDeclarator(),
                new FuncDecl(buildParams(function.parameterTypeList()), inner));
    }

    private ParamList buildParams(ParameterTypeListContext ctx) {
        if (ctx == null) {
            return null;
        }
        List<Node> params = new ArrayList<>();
        for (ParameterDeclarationContext param : ctx.parameterDeclaration()) {
            Specifiers spec = buildSpecifiers(param.declarationSpecifiers());
            if (param.declarator() != null) {
                params.add(buildDecl(spec, spec.baseType(), param.declarator(), null, null));
            } else {
                Node type = new TypeDecl(null, new ArrayList<>(spec.quals), spec.baseType());
                if (param.abstractDeclarator() != null) {
                    type = applyAbstract(param.abstractDeclarator(), type);
                }
                params.add(new Typename(null, new ArrayList<>(spec.quals), type));
            }
        }
        if (hasToken(ctx, "...")) {
            params.add(new EllipsisParam());
        }
        return new ParamList(params);
    }

    private Typename buildTypename(TypeNameContext ctx) {
        Specifiers spec = buildSpecifiers(ctx.specifierQualifierList());
        Node type = new TypeDecl(null, new ArrayList<>(spec.quals), spec.baseType());
        if (ctx.abstractDeclarator() != null) {
            type = applyAbstract(ctx.abstractDeclarator(), type);
        }
        return new Typename(null, new ArrayList<>(spec.quals), type);
    }

    private Node buildInitializer(InitializerContext ctx) {
        if (ctx.assignmentExpression() != null) {
            return visit(ctx.assignmentExpression());
        }
        return buildInitList(ctx.initializerList());
    }

    private InitList buildInitList(InitializerListContext ctx) {
        List<Node> exprs = new ArrayList<>();
        if (ctx == null) {
            return new InitList(exprs);
        }
        for (InitializerItemContext item : ctx.initializerItem()) {
            Node init = buildInitializer(item.initializer());
            if (item.designation() != null) {
                List<Node> names = new ArrayList<>();
                for (DesignatorContext designator : item.designation().designator()) {
                    if (designator.Identifier() != null) {
                        names.add(new ID(designator.Identifier().getText()));
                        continue;
                    }
                    Node index = visit(designator.constantExpression());
                    // A bare ID would read back as a field designator.
                    names.add(index instanceof ID ? new ExprList(new ArrayList<>(List.of(index))) : index);
                }
                init = new NamedInitializer(names, init);
            }
            exprs.add(init);
        }
        return new InitList(exprs);
    }

    // ------------------------------------------------------------------ statements

    @Override
    public Node visitCompoundStatement(CompoundStatementContext ctx) {
        List<Node> items = new ArrayList<>();
        for (BlockItemContext item : ctx.blockItem()) {
            if (item.declaration() != null) {
                items.addAll(buildDeclaration(item.declaration()));
            } else if (item.statement() != null) {
                items.add(visit(item.statement()));
            } else {
                items.add(new Directive(item.Directive().getText().trim()));
            }
        }
        return new Compound(items);
    }

    @Override
    public Node visitExpressionStatement(ExpressionStatementContext ctx) {
        return ctx.expression() == null ? new EmptyStatement() : visit(ctx.expression());
    }

    @Override
    public Node visitLabelStatement(LabelStatementContext ctx) {
        return new Label(ctx.Identifier().getText(), visit(ctx.statement()));
    }

    @Override
    public Node visitCaseStatement(CaseStatementContext ctx) {
        List<Node> stmts = new ArrayList<>();
        stmts.add(visit(ctx.statement()));
        return new Case(visit(ctx.constantExpression()), stmts);
    }

    @Override
    public Node visitDefaultStatement(DefaultStatementContext ctx) {
        List<Node> stmts = new ArrayList<>();
        stmts.add(visit(ctx.statement()));
        return new Default(stmts);
    }

    @Override
    public Node visitIfStatement(IfStatementContext ctx) {
        Node iffalse = ctx.statement().size() > 1 ? visit(ctx.statement(1)) : null;
        return new If(visit(ctx.expression()), visit(ctx.statement(0)), iffalse);
    }

    @Override
    public Node visitSwitchStatement(SwitchStatementContext ctx) {
        return new Switch(visit(ctx.expression()), groupCaseStatements(visit(ctx.statement())));
    }

    /**
     * Moves the statements that follow a case label into that label, and splits directly
     * nested labels ({@code case 1: case 2: x;}) into siblings.
     */
    private static Node groupCaseStatements(Node body) {
        if (!(body instanceof Compound)) {
            return body;
        }
        Compound compound = (Compound) body;
        List<Node> items = new ArrayList<>();
        List<Node> current = null;
        for (Node child : compound.blockItems) {
            if (child instanceof Case || child instanceof Default) {
                items.add(child);
                Node last = child;
                List<Node> stmts = labelStatements(last);
                while (stmts.size() == 1 && (stmts.get(0) instanceof Case || stmts.get(0) instanceof Default)) {
                    last = stmts.remove(0);
                    items.add(last);
                    stmts = labelStatements(last);
                }
                current = stmts;
            } else if (current != null) {
                current.add(child);
            } else {
                items.add(child);
            }
        }
        compound.blockItems = items;
        return compound;
    }

    private static List<Node> labelStatements(Node label) {
        return label instanceof Case ? ((Case) label).stmts : ((Default) label).stmts;
    }

    @Override
    public Node visitWhileStatement(WhileStatementContext ctx) {
        return new While(visit(ctx.expression()), visit(ctx.statement()));
    }

    @Override
    public Node visitDoWhileStatement(DoWhileStatementContext ctx) {
        return new DoWhile(visit(ctx.expression()), visit(ctx.statement()));
    }

    @Override
    public Node visitForStatement(ForStatementContext ctx) {
        Node init = null;
        ForInitContext forInit = ctx.forInit();
        if (forInit != null) {
            if (forInit.declarationSpecifiers() != null) {
                List<Decl> decls = new ArrayList<>();
                for (Node decl : buildDeclarations(buildSpecifiers(forInit.declarationSpecifiers()), forInit.initDeclaratorList())) {
                    decls.add((Decl) decl);
                }
                init = new DeclList(decls);
            } else {
                init = visit(forInit.expression());
            }
        }
        Node cond = ctx.forCondition == null ? null : visit(ctx.forCondition);
        Node next = ctx.forNext == null ? null : visit(ctx.forNext);
        return new For(init, cond, next, visit(ctx.statement()));
    }

    @Override
    public Node visitGotoStatement(GotoStatementContext ctx) {
        return new Goto(ctx.Identifier().getText());
    }

    @Override
    public Node visitContinueStatement(ContinueStatementContext ctx) {
        return new Continue();
    }

    @Override
    public Node visitBreakStatement(BreakStatementContext ctx) {
        return new Break();
    }

    @Override
    public Node visitReturnStatement(ReturnStatementContext ctx) {
        return new Return(ctx.expression() == null ? null : visit(ctx.expression()));
    }

    // ------------------------------------------------------------------ expressions

    @Override
    public Node visitExpression(ExpressionContext ctx) {
        if (ctx.assignmentExpression().size() == 1) {
            return visit(ctx.assignmentExpression(0));
        }
        List<Node> exprs = new ArrayList<>();
        for (AssignmentExpressionContext expr : ctx.assignmentExpression()) {
            exprs.add(visit(expr));
        }
        return new ExprList(exprs);
    }

    @Override
    public Node visitAssignmentExpression(AssignmentExpressionContext ctx) {
        if (ctx.assignmentOperator() == null) {
            return visit(ctx.conditionalExpression());
        }
        return new Assignment(ctx.assignmentOperator().getText(), visit(ctx.unaryExpression()),
                visit(ctx.assignmentExpression()));
    }

    @Override
    public Node visitConstantExpression(ConstantExpressionContext ctx) {
        return visit(ctx.conditionalExpression());
    }

    @Override
    public Node visitConditionalExpression(ConditionalExpressionContext ctx) {
        Node cond = visit(ctx.binaryExpression());
        if (ctx.expression() == null) {
            return cond;
        }
        return new TernaryOp(cond, visit(ctx.expression()), visit(ctx.conditionalExpression()));
    }

    @Override
    public Node visitBinaryExpression(BinaryExpressionContext ctx) {
        if (ctx.op == null) {
            return visit(ctx.castExpression());
        }
        return new BinaryOp(ctx.op.getText(), visit(ctx.binaryExpression(0)), visit(ctx.binaryExpression(1)));
    }

    @Override
    public Node visitCastExpression(CastExpressionContext ctx) {
        if (ctx.typeName() == null) {
            return visit(ctx.unaryExpression());
        }
        return new Cast(buildTypename(ctx.typeName()), visit(ctx.castExpression()));
    }

    @Override
    public Node visitUnaryExpression(UnaryExpressionContext ctx) {
        if (ctx.postfixExpression() != null) {
            return visit(ctx.postfixExpression());
        }
        if (ctx.sizeofOperand() != null) {
            SizeofOperandContext operand = ctx.sizeofOperand();
            Node expr = operand.typeName() != null ? buildTypename(operand.typeName()) : visit(operand.unaryExpression());
            return new UnaryOp("sizeof", expr);
        }
        Node operand = ctx.unaryExpression() != null ? visit(ctx.unaryExpression()) : visit(ctx.castExpression());
        return new UnaryOp(ctx.op.getText(), operand);
    }

    @Override
    public Node visitPostfixExpression(PostfixExpressionContext ctx) {
        Node node = visit(ctx.postfixPrimary());
        for (PostfixSuffixContext suffix : ctx.postfixSuffix()) {
            if (suffix instanceof SubscriptSuffixContext) {
                node = new ArrayRef(node, visit(((SubscriptSuffixContext) suffix).expression()));
            } else if (suffix instanceof CallSuffixContext) {
                ArgumentExpressionListContext args = ((CallSuffixContext) suffix).argumentExpressionList();
                ExprList argList = null;
                if (args != null) {
                    List<Node> exprs = new ArrayList<>();
                    for (AssignmentExpressionContext arg : args.assignmentExpression()) {
                        exprs.add(visit(arg));
                    }
                    argList = new ExprList(exprs);
                }
                node = new FuncCall(node, argList);
            } else if (suffix instanceof MemberSuffixContext) {
                MemberSuffixContext member = (MemberSuffixContext) suffix;
                node = new StructRef(node, member.op.getText(), new ID(member.Identifier().getText()));
            } else {
                node = new UnaryOp("p" + ((IncDecSuffixContext) suffix).op.getText(), node);
            }
        }
        return node;
    }

    @Override
    public Node visitPostfixPrimary(PostfixPrimaryContext ctx) {
        if (ctx.typeName() != null) {
            return new CompoundLiteral(buildTypename(ctx.typeName()), buildInitList(ctx.initializerList()));
        }
        return visit(ctx.primaryExpression());
    }

    @Override
    public Node visitIdentifierPrimary(IdentifierPrimaryContext ctx) {
        return new ID(ctx.Identifier().getText());
    }

    @Override
    public Node visitIntegerPrimary(IntegerPrimaryContext ctx) {
        String text = ctx.IntegerConstant().getText();
        return new Constant(integerType(text), text);
    }

    @Override
    public Node visitFloatingPrimary(FloatingPrimaryContext ctx) {
        String text = ctx.FloatingConstant().getText();
        char last = Character.toLowerCase(text.charAt(text.length() - 1));
        return new Constant(last == 'f' ? "float" : last == 'l' ? "long double" : "double", text);
    }

    @Override
    public Node visitCharacterPrimary(CharacterPrimaryContext ctx) {
        return new Constant("char", ctx.CharacterConstant().getText());
    }

    @Override
    public Node visitStringPrimary(StringPrimaryContext ctx) {
        StringBuilder value = new StringBuilder();
        for (TerminalNode literal : ctx.StringLiteral()) {
            String text = literal.getText();
            if (value.length() == 0) {
                value.append(text, 0, text.length() - 1);
            } else {
                value.append(text, text.indexOf('"') + 1, text.length() - 1);
            }
        }
        return new Constant("string", value.append('"').toString());
    }

    @Override
    public Node visitParenPrimary(ParenPrimaryContext ctx) {
        return visit(ctx.expression());
    }

    static String integerType(String literal) {
        String lower = literal.toLowerCase();
        if (lower.startsWith("0x")) {
            lower = lower.substring(2).replaceAll("[0-9a-f]", "");
        } else {
            lower = lower.replaceAll("[0-9]", "");
        }
        boolean unsigned = lower.contains("u");
        boolean isLong = lower.contains("l");
        if (unsigned && isLong) {
            return "unsigned long";
        } else if (unsigned) {
            return "unsigned int";
        } else if (isLong) {
            return "long";
        }
        return "int";
    }

    private static List<String> texts(List<? extends ParseTree> nodes) {
        List<String> result = new ArrayList<>();
        if (nodes != null) {
            for (ParseTree node : nodes) {
                result.add(node.getText());
            }
        }
        return result;
    }

    private static boolean hasToken(org.antlr.v4.runtime.ParserRuleContext ctx, String text) {
        for (int i = 0; i < ctx.getChildCount(); i++) {
            ParseTree child = ctx.getChild(i);
            if (child instanceof TerminalNode && text.equals(child.getText())) {
                return true;
            }
        }
        return false;
    }
}
