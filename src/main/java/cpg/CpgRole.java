package cpg;

import ast.AstKind;
import sanalysis.CFGNodeKind;
import sanalysis.DFGNodeKind;

/**
 * Structural role of a CPG node. AST-origin nodes take the role named after their construct kind.
 */
public enum CpgRole {
    // AST constructs
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
    EXPRESSION,
    // control flow
    FUNCTION_ENTRY,
    FUNCTION_EXIT,
    BASIC_BLOCK,
    DECISION,
    EXCEPTION_SOURCE,
    // data flow
    VARIABLE_DEFINITION,
    VARIABLE_USE,
    PHI_MERGE,
    // synthetic
    EXTERNAL_FUNCTION;

    public static CpgRole of(AstKind kind) {
        return valueOf(kind.name());
    }

    public static CpgRole of(CFGNodeKind kind) {
        switch (kind) {
            case ENTRY:
                return FUNCTION_ENTRY;
            case EXIT:
                return FUNCTION_EXIT;
            case DECISION:
                return DECISION;
            case EXCEPTION_EDGE_SOURCE:
                return EXCEPTION_SOURCE;
            default:
                return BASIC_BLOCK;
        }
    }

    public static CpgRole of(DFGNodeKind kind) {
        switch (kind) {
            case DEFINITION:
                return VARIABLE_DEFINITION;
            case USE:
                return VARIABLE_USE;
            default:
                return PHI_MERGE;
        }
    }
}
