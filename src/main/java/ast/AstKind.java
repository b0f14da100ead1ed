package ast;

/**
 * Closed set of construct kinds the language-neutral AST is made of.
 */
public enum AstKind {
    FUNCTION,
    PARAMETER,
    BLOCK,
    EXPRESSION_STATEMENT,
    EMPTY,
    LABELED,
    IF,
    WHILE,
    DO_WHILE,
    FOR,
    FOR_EACH,
    SWITCH,
    CASE,
    TRY,
    CATCH,
    FINALLY,
    SYNCHRONIZED,
    RETURN,
    BREAK,
    CONTINUE,
    THROW,
    VARIABLE_DECLARATION,
    ASSIGNMENT,
    BINDING,
    NAME_REF,
    FIELD_REF,
    TYPE_REF,
    CALL,
    LITERAL,
    OPERATOR,
    LAMBDA,
    EXPRESSION;

    public boolean isLoop() {
        return this == WHILE || this == DO_WHILE || this == FOR || this == FOR_EACH;
    }

    /** Kinds that introduce a new definition of the variable they name. */
    public boolean isDefinition() {
        return this == PARAMETER || this == BINDING || this == VARIABLE_DECLARATION || this == ASSIGNMENT;
    }
}
