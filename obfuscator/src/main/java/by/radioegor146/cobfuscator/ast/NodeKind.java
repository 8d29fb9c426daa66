package by.radioegor146.cobfuscator.ast;

public enum NodeKind {
    FILE_AST,
    DIRECTIVE,
    FUNC_DEF,
    DECL,
    DECL_LIST,
    TYPEDEF,
    TYPE_DECL,
    PTR_DECL,
    ARRAY_DECL,
    FUNC_DECL,
    PARAM_LIST,
    ELLIPSIS_PARAM,
    TYPENAME,
    IDENTIFIER_TYPE,
    STRUCT,
    UNION,
    ENUM,
    ENUMERATOR_LIST,
    ENUMERATOR,
    COMPOUND,
    IF,
    WHILE,
    DO_WHILE,
    FOR,
    SWITCH,
    CASE,
    DEFAULT,
    LABEL,
    GOTO,
    BREAK,
    CONTINUE,
    RETURN,
    EMPTY_STATEMENT,
    ID,
    CONSTANT,
    UNARY_OP,
    BINARY_OP,
    TERNARY_OP,
    ASSIGNMENT,
    FUNC_CALL,
    ARRAY_REF,
    STRUCT_REF,
    CAST,
    COMPOUND_LITERAL,
    INIT_LIST,
    NAMED_INITIALIZER,
    EXPR_LIST
}
