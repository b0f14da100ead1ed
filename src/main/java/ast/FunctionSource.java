package ast;

import java.util.Objects;

/**
 * Unit of work for the pipeline: one function's AST plus the names it is known by.
 */
public final class FunctionSource {

    private final String qualifiedName;
    private final String owner;
    private final AstNode ast;

    public FunctionSource(String qualifiedName, String owner, AstNode ast) {
        this.qualifiedName = Objects.requireNonNull(qualifiedName, "qualifiedName");
        this.owner = owner;
        this.ast = Objects.requireNonNull(ast, "ast");
    }

    public String getQualifiedName() { return qualifiedName; }
    public String getOwner() { return owner; }
    public AstNode getAst() { return ast; }

    public String getSimpleName() {
        return ast.getName();
    }

    public int getArity() {
        return (int) ast.getChildren().stream().filter(c -> c.is(AstKind.PARAMETER)).count();
    }

    @Override
    public String toString() {
        return qualifiedName;
    }
}
