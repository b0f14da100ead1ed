package ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One construct of a function's abstract syntax tree.
 *
 * Nodes are immutable once built. The child layout each {@link AstKind} expects is fixed, e.g. an
 * {@code IF} holds condition, then branch and an optional else branch, in that order; see
 * {@link AstFactory} for the shapes the builders produce.
 */
public final class AstNode {

    private final SourcePositionId id;
    private final AstKind kind;
    private final String name;
    private final String text;
    private final int startLine;
    private final int endLine;
    private final Map<String, String> attributes;
    private final List<AstNode> children;

    public AstNode(SourcePositionId id, AstKind kind, String name, String text, int startLine, int endLine,
                   Map<String, String> attributes, List<AstNode> children) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = name;
        this.text = text == null ? null : text.replace("\n", " ").trim();
        this.startLine = startLine;
        this.endLine = endLine;
        this.attributes = attributes == null ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.children = children == null ? Collections.emptyList() : List.copyOf(children);
    }

    public SourcePositionId getId() { return id; }
    public AstKind getKind() { return kind; }
    public String getName() { return name; }
    public String getText() { return text; }
    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }
    public Map<String, String> getAttributes() { return attributes; }
    public List<AstNode> getChildren() { return children; }

    public AstNode getChild(int index) {
        return children.get(index);
    }

    public int getChildCount() {
        return children.size();
    }

    public String getAttribute(String key) {
        return attributes.get(key);
    }

    public boolean hasFlag(String key) {
        return "true".equals(attributes.get(key));
    }

    public boolean is(AstKind expected) {
        return kind == expected;
    }

    /** Display text: the source text when known, otherwise kind and name. */
    public String getLabel() {
        if (text != null && !text.isEmpty()) {
            return text;
        }
        return name == null ? kind.name().toLowerCase() : kind.name().toLowerCase() + " " + name;
    }

    /**
     * @return this node and all its descendants in pre-order.
     */
    public List<AstNode> preorder() {
        List<AstNode> result = new ArrayList<>();
        Deque<AstNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            AstNode current = stack.pop();
            result.add(current);
            List<AstNode> kids = current.getChildren();
            for (int i = kids.size() - 1; i >= 0; i--) {
                stack.push(kids.get(i));
            }
        }
        return result;
    }

    public List<AstNode> findAll(AstKind wanted) {
        List<AstNode> found = new ArrayList<>();
        for (AstNode node : preorder()) {
            if (node.kind == wanted) {
                found.add(node);
            }
        }
        return found;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AstNode)) return false;
        AstNode other = (AstNode) obj;
        return startLine == other.startLine && endLine == other.endLine
                && id.equals(other.id) && kind == other.kind
                && Objects.equals(name, other.name) && Objects.equals(text, other.text)
                && Objects.equals(attributes, other.attributes)
                && Objects.equals(children, other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, name);
    }

    @Override
    public String toString() {
        return id + ":" + kind + (name == null ? "" : "(" + name + ")");
    }
}
