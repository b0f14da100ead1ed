package sanalysis;

public enum CFGNodeKind {
    ENTRY,
    EXIT,
    BLOCK,
    DECISION,
    EXCEPTION_EDGE_SOURCE
}
