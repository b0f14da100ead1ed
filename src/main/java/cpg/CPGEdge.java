package cpg;

import java.util.Objects;

public final class CPGEdge {

    private final String id;
    private final String from;
    private final String to;
    private final CpgEdgeKind kind;
    private final String label;
    private final PropertyBag properties;

    public CPGEdge(String id, String from, String to, CpgEdgeKind kind, String label) {
        this.id = Objects.requireNonNull(id, "id");
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.label = label;
        this.properties = new PropertyBag(id);
    }

    public String getId() { return id; }
    public String getFrom() { return from; }
    public String getTo() { return to; }
    public CpgEdgeKind getKind() { return kind; }
    public String getLabel() { return label; }
    public PropertyBag getProperties() { return properties; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CPGEdge)) return false;
        CPGEdge other = (CPGEdge) obj;
        return id.equals(other.id) && from.equals(other.from) && to.equals(other.to) && kind == other.kind
                && Objects.equals(label, other.label) && properties.equals(other.properties);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return from + " -" + kind + "-> " + to;
    }
}
