package by.radioegor146.cobfuscator.ast;

/**
 * Depth-first visitor over the C syntax tree.
 * <p>
 * {@link #visit(Node)} dispatches on {@link NodeKind} with one branch per kind, so every
 * kind a pass may meet is listed here. Each {@code visitX} method defaults to
 * {@link #genericVisit(Node)}, which visits the children in order.
 */
public abstract class NodeVisitor {

    public void visit(Node node) {
        if (node == null) {
            return;
        }
        switch (node.kind()) {
            case FILE_AST:
                visitFileAST((FileAST) node);
                break;
            case DIRECTIVE:
                visitDirective((Directive) node);
                break;
            case FUNC_DEF:
                visitFuncDef((FuncDef) node);
                break;
            case DECL:
                visitDecl((Decl) node);
                break;
            case DECL_LIST:
                visitDeclList((DeclList) node);
                break;
            case TYPEDEF:
                visitTypedef((Typedef) node);
                break;
            case TYPE_DECL:
                visitTypeDecl((TypeDecl) node);
                break;
            case PTR_DECL:
                visitPtrDecl((PtrDecl) node);
                break;
            case ARRAY_DECL:
                visitArrayDecl((ArrayDecl) node);
                break;
            case FUNC_DECL:
                visitFuncDecl((FuncDecl) node);
                break;
            case PARAM_LIST:
                visitParamList((ParamList) node);
                break;
            case ELLIPSIS_PARAM:
                visitEllipsisParam((EllipsisParam) node);
                break;
            case TYPENAME:
                visitTypename((Typename) node);
                break;
            case IDENTIFIER_TYPE:
                visitIdentifierType((IdentifierType) node);
                break;
            case STRUCT:
                visitStruct((Struct) node);
                break;
            case UNION:
                visitUnion((Union) node);
                break;
            case ENUM:
                visitEnumType((EnumType) node);
                break;
            case ENUMERATOR_LIST:
                visitEnumeratorList((EnumeratorList) node);
                break;
            case ENUMERATOR:
                visitEnumerator((Enumerator) node);
                break;
            case COMPOUND:
                visitCompound((Compound) node);
                break;
            case IF:
                visitIf((If) node);
                break;
            case WHILE:
                visitWhile((While) node);
                break;
            case DO_WHILE:
                visitDoWhile((DoWhile) node);
                break;
            case FOR:
                visitFor((For) node);
                break;
            case SWITCH:
                visitSwitch((Switch) node);
                break;
            case CASE:
                visitCase((Case) node);
                break;
            case DEFAULT:
                visitDefault((Default) node);
                break;
            case LABEL:
                visitLabel((Label) node);
                break;
            case GOTO:
                visitGoto((Goto) node);
                break;
            case BREAK:
                visitBreak((Break) node);
                break;
            case CONTINUE:
                visitContinue((Continue) node);
                break;
            case RETURN:
                visitReturn((Return) node);
                break;
            case EMPTY_STATEMENT:
                visitEmptyStatement((EmptyStatement) node);
                break;
            case ID:
                visitID((ID) node);
                break;
            case CONSTANT:
                visitConstant((Constant) node);
                break;
            case UNARY_OP:
                visitUnaryOp((UnaryOp) node);
                break;
            case BINARY_OP:
                visitBinaryOp((BinaryOp) node);
                break;
            case TERNARY_OP:
                visitTernaryOp((TernaryOp) node);
                break;
            case ASSIGNMENT:
                visitAssignment((Assignment) node);
                break;
            case FUNC_CALL:
                visitFuncCall((FuncCall) node);
                break;
            case ARRAY_REF:
                visitArrayRef((ArrayRef) node);
                break;
            case STRUCT_REF:
                visitStructRef((StructRef) node);
                break;
            case CAST:
                visitCast((Cast) node);
                break;
            case COMPOUND_LITERAL:
                visitCompoundLiteral((CompoundLiteral) node);
                break;
            case INIT_LIST:
                visitInitList((InitList) node);
                break;
            case NAMED_INITIALIZER:
                visitNamedInitializer((NamedInitializer) node);
                break;
            case EXPR_LIST:
                visitExprList((ExprList) node);
                break;
            default:
                throw new IllegalStateException("Unhandled node kind " + node.kind());
        }
    }

    public void genericVisit(Node node) {
        for (Child child : node.children()) {
            visit(child.getNode());
        }
    }

    public void visitFileAST(FileAST node) {
        genericVisit(node);
    }

    public void visitDirective(Directive node) {
        genericVisit(node);
    }

    public void visitFuncDef(FuncDef node) {
        genericVisit(node);
    }

    public void visitDecl(Decl node) {
        genericVisit(node);
    }

    public void visitDeclList(DeclList node) {
        genericVisit(node);
    }

    public void visitTypedef(Typedef node) {
        genericVisit(node);
    }

    public void visitTypeDecl(TypeDecl node) {
        genericVisit(node);
    }

    public void visitPtrDecl(PtrDecl node) {
        genericVisit(node);
    }

    public void visitArrayDecl(ArrayDecl node) {
        genericVisit(node);
    }

    public void visitFuncDecl(FuncDecl node) {
        genericVisit(node);
    }

    public void visitParamList(ParamList node) {
        genericVisit(node);
    }

    public void visitEllipsisParam(EllipsisParam node) {
        genericVisit(node);
    }

    public void visitTypename(Typename node) {
        genericVisit(node);
    }

    public void visitIdentifierType(IdentifierType node) {
        genericVisit(node);
    }

    public void visitStruct(Struct node) {
        genericVisit(node);
    }

    public void visitUnion(Union node) {
        genericVisit(node);
    }

    public void visitEnumType(EnumType node) {
        genericVisit(node);
    }

    public void visitEnumeratorList(EnumeratorList node) {
        genericVisit(node);
    }

    public void visitEnumerator(Enumerator node) {
        genericVisit(node);
    }

    public void visitCompound(Compound node) {
        genericVisit(node);
    }

    public void visitIf(If node) {
        genericVisit(node);
    }

    public void visitWhile(While node) {
        genericVisit(node);
    }

    public void visitDoWhile(DoWhile node) {
        genericVisit(node);
    }

    public void visitFor(For node) {
        genericVisit(node);
    }

    public void visitSwitch(Switch node) {
        genericVisit(node);
    }

    public void visitCase(Case node) {
        genericVisit(node);
    }

    public void visitDefault(Default node) {
        genericVisit(node);
    }

    public void visitLabel(Label node) {
        genericVisit(node);
    }

    public void visitGoto(Goto node) {
        genericVisit(node);
    }

    public void visitBreak(Break node) {
        genericVisit(node);
    }

    public void visitContinue(Continue node) {
        genericVisit(node);
    }

    public void visitReturn(Return node) {
        genericVisit(node);
    }

    public void visitEmptyStatement(EmptyStatement node) {
        genericVisit(node);
    }

    public void visitID(ID node) {
        genericVisit(node);
    }

    public void visitConstant(Constant node) {
        genericVisit(node);
    }

    public void visitUnaryOp(UnaryOp node) {
        genericVisit(node);
    }

    public void visitBinaryOp(BinaryOp node) {
        genericVisit(node);
    }

    public void visitTernaryOp(TernaryOp node) {
        genericVisit(node);
    }

    public void visitAssignment(Assignment node) {
        genericVisit(node);
    }

    public void visitFuncCall(FuncCall node) {
        genericVisit(node);
    }

    public void visitArrayRef(ArrayRef node) {
        genericVisit(node);
    }

    public void visitStructRef(StructRef node) {
        genericVisit(node);
    }

    public void visitCast(Cast node) {
        genericVisit(node);
    }

    public void visitCompoundLiteral(CompoundLiteral node) {
        genericVisit(node);
    }

    public void visitInitList(InitList node) {
        genericVisit(node);
    }

    public void visitNamedInitializer(NamedInitializer node) {
        genericVisit(node);
    }

    public void visitExprList(ExprList node) {
        genericVisit(node);
    }
}
