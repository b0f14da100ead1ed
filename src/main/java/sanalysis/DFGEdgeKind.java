package sanalysis;

public enum DFGEdgeKind {
    /** From a definition or phi to a use or phi that reads the version it writes. */
    REACHES,
    /** From a definition to each value its assignment or initializer reads. */
    DEPENDS_ON
}
