package sanalysis;

import java.util.Objects;

public final class DFGEdge {

    private final int id;
    private final int from;
    private final int to;
    private final DFGEdgeKind kind;

    public DFGEdge(int id, int from, int to, DFGEdgeKind kind) {
        this.id = id;
        this.from = from;
        this.to = to;
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public int getId() { return id; }
    public int getFrom() { return from; }
    public int getTo() { return to; }
    public DFGEdgeKind getKind() { return kind; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DFGEdge)) return false;
        DFGEdge other = (DFGEdge) obj;
        return id == other.id && from == other.from && to == other.to && kind == other.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, from, to, kind);
    }

    @Override
    public String toString() {
        return from + " -" + kind + "-> " + to;
    }
}
