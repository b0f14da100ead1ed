package sanalysis;

public enum CFGEdgeKind {
    SEQUENTIAL,
    BRANCH_TRUE,
    BRANCH_FALSE,
    EXCEPTION,
    LOOP_BACK
}
