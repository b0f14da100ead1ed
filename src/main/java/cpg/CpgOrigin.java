package cpg;

public enum CpgOrigin {
    AST,
    CFG,
    DFG,
    SYNTHETIC
}
