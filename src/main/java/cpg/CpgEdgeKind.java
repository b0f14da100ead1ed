package cpg;

public enum CpgEdgeKind {
    PARENT_CHILD,
    CONTAINS,
    CONTROL_SUCCESSOR,
    DATA_REACHES,
    DATA_DEPENDS,
    CALLS;

    /** Kinds that place the target inside the source; each node has at most one such parent. */
    public boolean isContainment() {
        return this == PARENT_CHILD || this == CONTAINS;
    }
}
