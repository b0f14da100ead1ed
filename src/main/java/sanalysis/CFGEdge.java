package sanalysis;

import java.util.Objects;

public final class CFGEdge {

    private final int id;
    private final int from;
    private final int to;
    private final CFGEdgeKind kind;

    public CFGEdge(int id, int from, int to, CFGEdgeKind kind) {
        this.id = id;
        this.from = from;
        this.to = to;
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public int getId() { return id; }
    public int getFrom() { return from; }
    public int getTo() { return to; }
    public CFGEdgeKind getKind() { return kind; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CFGEdge)) return false;
        CFGEdge other = (CFGEdge) obj;
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
