package cpg;

import ast.SourcePositionId;

import java.util.Objects;

/**
 * A node of the unified graph. Structure is fixed at construction; only the property bag grows.
 */
public final class CPGNode {

    private final String id;
    private final CpgOrigin origin;
    private final CpgRole role;
    private final SourcePositionId sourcePosition;
    private final String label;
    private final Span span;
    private final PropertyBag properties;

    public CPGNode(String id, CpgOrigin origin, CpgRole role, SourcePositionId sourcePosition,
                   String label, Span span) {
        this.id = Objects.requireNonNull(id, "id");
        this.origin = Objects.requireNonNull(origin, "origin");
        this.role = Objects.requireNonNull(role, "role");
        this.sourcePosition = sourcePosition;
        this.label = label;
        this.span = span;
        this.properties = new PropertyBag(id);
    }

    public String getId() { return id; }
    public CpgOrigin getOrigin() { return origin; }
    public CpgRole getRole() { return role; }

    /** May be {@code null} for synthetic nodes and phis. */
    public SourcePositionId getSourcePosition() { return sourcePosition; }

    public String getLabel() { return label; }
    public Span getSpan() { return span; }
    public PropertyBag getProperties() { return properties; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CPGNode)) return false;
        CPGNode other = (CPGNode) obj;
        return id.equals(other.id) && origin == other.origin && role == other.role
                && Objects.equals(sourcePosition, other.sourcePosition)
                && Objects.equals(label, other.label) && Objects.equals(span, other.span)
                && properties.equals(other.properties);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id + "[" + role + "]";
    }
}
