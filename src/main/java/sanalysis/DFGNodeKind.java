package sanalysis;

public enum DFGNodeKind {
    DEFINITION,
    USE,
    PHI
}
