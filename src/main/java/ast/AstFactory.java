package ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates {@link AstNode}s with freshly registered source position ids.
 *
 * The shape helpers ({@link #ifStmt}, {@link #forStmt}, ...) are the single place where the child
 * layout of each kind is spelled out; the Java front end and hand-written fixtures both go
 * through them.
 */
public class AstFactory {

    private final SourcePositionRegistry registry;
    private final String path;
    // Range given to nodes built without an explicit one; set by front ends before each helper call.
    private int[] cursor;

    public AstFactory(SourcePositionRegistry registry, String path) {
        this.registry = registry;
        this.path = path;
    }

    public SourcePositionRegistry getRegistry() {
        return registry;
    }

    public AstFactory at(int beginLine, int beginColumn, int endLine, int endColumn) {
        cursor = new int[]{beginLine, beginColumn, endLine, endColumn};
        return this;
    }

    public AstFactory clearPosition() {
        cursor = null;
        return this;
    }

    public Builder create(AstKind kind) {
        return new Builder(kind);
    }

    public class Builder {
        private final AstKind kind;
        private String name;
        private String text;
        private int beginLine;
        private int beginColumn;
        private int endLine;
        private int endColumn;
        private boolean ranged;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private final List<AstNode> children = new ArrayList<>();

        private Builder(AstKind kind) {
            this.kind = kind;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder range(int beginLine, int beginColumn, int endLine, int endColumn) {
            this.beginLine = beginLine;
            this.beginColumn = beginColumn;
            this.endLine = endLine;
            this.endColumn = endColumn;
            this.ranged = true;
            return this;
        }

        public Builder lines(int beginLine, int endLine) {
            return range(beginLine, 0, endLine, 0);
        }

        public Builder attribute(String key, String value) {
            if (value != null) {
                attributes.put(key, value);
            }
            return this;
        }

        public Builder flag(String key, boolean value) {
            if (value) {
                attributes.put(key, "true");
            }
            return this;
        }

        public Builder child(AstNode child) {
            if (child != null) {
                children.add(child);
            }
            return this;
        }

        public Builder children(List<AstNode> nodes) {
            for (AstNode node : nodes) {
                child(node);
            }
            return this;
        }

        public AstNode build() {
            if (!ranged && cursor != null) {
                range(cursor[0], cursor[1], cursor[2], cursor[3]);
            }
            String description = name == null ? kind.name() : kind.name() + " " + name;
            SourcePositionId id = registry.register(
                    new SourcePosition(path, beginLine, beginColumn, endLine, endColumn, description));
            return new AstNode(id, kind, name, text, beginLine, endLine, attributes, children);
        }
    }

    // Shape helpers

    public AstNode function(String owner, String name, List<AstNode> parameters, AstNode body) {
        return create(AstKind.FUNCTION).name(name).attribute("owner", owner)
                .children(parameters).child(body).build();
    }

    public AstNode parameter(String name) {
        return create(AstKind.PARAMETER).name(name).text(name).build();
    }

    public AstNode block(AstNode... statements) {
        return create(AstKind.BLOCK).children(Arrays.asList(statements)).build();
    }

    public AstNode stmt(AstNode expression) {
        return create(AstKind.EXPRESSION_STATEMENT).text(expression.getLabel()).child(expression).build();
    }

    public AstNode local(String name, AstNode initializer) {
        AstNode declaration = create(AstKind.VARIABLE_DECLARATION).name(name)
                .text(initializer == null ? name : name + " = " + initializer.getLabel())
                .child(initializer).build();
        return stmt(declaration);
    }

    public AstNode assign(String name, AstNode value) {
        return stmt(assignment(name, "=", value));
    }

    public AstNode assignment(String name, String operator, AstNode value) {
        String text = value == null ? name + operator : name + " " + operator + " " + value.getLabel();
        return create(AstKind.ASSIGNMENT).name(name).attribute("operator", operator).text(text)
                .child(value).build();
    }

    public AstNode ref(String name) {
        return create(AstKind.NAME_REF).name(name).text(name).build();
    }

    public AstNode field(String name) {
        return create(AstKind.FIELD_REF).name(name).text(name).build();
    }

    public AstNode literal(String text) {
        return create(AstKind.LITERAL).text(text).build();
    }

    public AstNode op(String operator, AstNode... operands) {
        StringBuilder text = new StringBuilder();
        if (operands.length == 1) {
            text.append(operator).append(operands[0].getLabel());
        } else {
            for (int i = 0; i < operands.length; i++) {
                if (i > 0) text.append(' ').append(operator).append(' ');
                text.append(operands[i].getLabel());
            }
        }
        return create(AstKind.OPERATOR).attribute("operator", operator).text(text.toString())
                .children(Arrays.asList(operands)).build();
    }

    /**
     * @param receiver the receiver expression, {@code null} for an unqualified call
     */
    public AstNode call(String name, AstNode receiver, AstNode... arguments) {
        StringBuilder text = new StringBuilder();
        if (receiver != null) text.append(receiver.getLabel()).append('.');
        text.append(name).append('(');
        for (int i = 0; i < arguments.length; i++) {
            if (i > 0) text.append(", ");
            text.append(arguments[i].getLabel());
        }
        text.append(')');
        return create(AstKind.CALL).name(name)
                .attribute("arity", Integer.toString(arguments.length))
                .attribute("receiver", receiver == null ? null : receiver.getLabel())
                .text(text.toString())
                .child(receiver).children(Arrays.asList(arguments)).build();
    }

    public AstNode ifStmt(AstNode condition, AstNode thenBranch, AstNode elseBranch) {
        return create(AstKind.IF).text("if (" + condition.getLabel() + ")")
                .child(condition).child(thenBranch).child(elseBranch).build();
    }

    public AstNode whileStmt(AstNode condition, AstNode body) {
        return create(AstKind.WHILE).text("while (" + condition.getLabel() + ")")
                .child(condition).child(body).build();
    }

    public AstNode doWhile(AstNode body, AstNode condition) {
        return create(AstKind.DO_WHILE).text("do-while (" + condition.getLabel() + ")")
                .child(body).child(condition).build();
    }

    /**
     * @param condition {@code null} for a loop without condition
     */
    public AstNode forStmt(AstNode init, AstNode condition, AstNode update, AstNode body) {
        AstNode compare = condition == null ? create(AstKind.EMPTY).build() : condition;
        return create(AstKind.FOR).text("for (" + (condition == null ? "" : condition.getLabel()) + ")")
                .child(init == null ? block() : init).child(compare)
                .child(update == null ? block() : update).child(body).build();
    }

    public AstNode forEach(String variable, AstNode iterable, AstNode body) {
        AstNode binding = create(AstKind.BINDING).name(variable).text(variable).build();
        return create(AstKind.FOR_EACH).text("for (" + variable + " : " + iterable.getLabel() + ")")
                .child(binding).child(iterable).child(body).build();
    }

    public AstNode switchStmt(AstNode selector, AstNode... cases) {
        return create(AstKind.SWITCH).text("switch (" + selector.getLabel() + ")")
                .child(selector).children(Arrays.asList(cases)).build();
    }

    public AstNode caseClause(String labels, boolean arrow, AstNode... statements) {
        return create(AstKind.CASE).text("case " + labels).attribute("labels", labels).flag("arrow", arrow)
                .children(Arrays.asList(statements)).build();
    }

    public AstNode defaultClause(boolean arrow, AstNode... statements) {
        return create(AstKind.CASE).text("default").flag("default", true).flag("arrow", arrow)
                .children(Arrays.asList(statements)).build();
    }

    public AstNode tryStmt(AstNode body, List<AstNode> catches, AstNode finallyBlock) {
        Builder builder = create(AstKind.TRY).text("try").child(body).children(catches);
        if (finallyBlock != null) {
            builder.child(create(AstKind.FINALLY).text("finally").child(finallyBlock).build());
        }
        return builder.build();
    }

    public AstNode catchClause(String parameter, String type, AstNode body) {
        AstNode binding = create(AstKind.BINDING).name(parameter).text(type + " " + parameter)
                .attribute("type", type).build();
        return create(AstKind.CATCH).text("catch (" + type + " " + parameter + ")")
                .child(binding).child(body).build();
    }

    public AstNode returnStmt(AstNode value) {
        return create(AstKind.RETURN).text(value == null ? "return" : "return " + value.getLabel())
                .child(value).build();
    }

    public AstNode throwStmt(AstNode value) {
        return create(AstKind.THROW).text("throw " + value.getLabel()).child(value).build();
    }

    public AstNode breakStmt(String label) {
        return create(AstKind.BREAK).name(label).text(label == null ? "break" : "break " + label).build();
    }

    public AstNode continueStmt(String label) {
        return create(AstKind.CONTINUE).name(label).text(label == null ? "continue" : "continue " + label).build();
    }

    public AstNode labeled(String label, AstNode statement) {
        return create(AstKind.LABELED).name(label).text(label + ":").child(statement).build();
    }
}
