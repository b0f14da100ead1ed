package sanalysis;

import ast.SourcePositionId;

import java.util.List;
import java.util.Objects;

/**
 * A basic block, decision, or the entry/exit of one function's control flow graph.
 *
 * The node id is its index in {@link ControlFlowGraph#getNodes()}.
 */
public final class CFGNode {

    private final int id;
    private final CFGNodeKind kind;
    private final SourcePositionId sourcePosition;
    private final List<SourcePositionId> containedStatementIds;
    private final String label;

    public CFGNode(int id, CFGNodeKind kind, SourcePositionId sourcePosition,
                   List<SourcePositionId> containedStatementIds, String label) {
        this.id = id;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.sourcePosition = sourcePosition;
        this.containedStatementIds = containedStatementIds == null ? List.of() : List.copyOf(containedStatementIds);
        this.label = label == null ? "" : label.replace("\n", " ").trim();
    }

    public int getId() { return id; }
    public CFGNodeKind getKind() { return kind; }

    /** Originating construct, {@code null} for synthetic nodes such as merge blocks. */
    public SourcePositionId getSourcePosition() { return sourcePosition; }

    public List<SourcePositionId> getContainedStatementIds() { return containedStatementIds; }
    public String getLabel() { return label; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CFGNode)) return false;
        CFGNode other = (CFGNode) obj;
        return id == other.id && kind == other.kind
                && Objects.equals(sourcePosition, other.sourcePosition)
                && Objects.equals(containedStatementIds, other.containedStatementIds)
                && Objects.equals(label, other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, sourcePosition);
    }

    @Override
    public String toString() {
        return "cfg" + id + "[" + kind + "] " + label;
    }
}
