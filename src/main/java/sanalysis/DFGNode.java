package sanalysis;

import ast.SourcePositionId;

import java.util.Objects;

/**
 * Wraps exactly one of a {@link Definition}, a {@link Use} or a {@link PhiNode}. The id is the
 * node's index in {@link DataFlowGraph#getNodes()}.
 */
public final class DFGNode {

    private final int id;
    private final DFGNodeKind kind;
    private final Definition definition;
    private final Use use;
    private final PhiNode phi;

    private DFGNode(int id, DFGNodeKind kind, Definition definition, Use use, PhiNode phi) {
        this.id = id;
        this.kind = kind;
        this.definition = definition;
        this.use = use;
        this.phi = phi;
    }

    public static DFGNode of(int id, Definition definition) {
        return new DFGNode(id, DFGNodeKind.DEFINITION, definition, null, null);
    }

    public static DFGNode of(int id, Use use) {
        return new DFGNode(id, DFGNodeKind.USE, null, use, null);
    }

    public static DFGNode of(PhiNode phi) {
        return new DFGNode(phi.getId(), DFGNodeKind.PHI, null, null, phi);
    }

    public int getId() { return id; }
    public DFGNodeKind getKind() { return kind; }
    public Definition getDefinition() { return definition; }
    public Use getUse() { return use; }
    public PhiNode getPhi() { return phi; }

    /** Originating AST construct; {@code null} for phis. */
    public SourcePositionId getSourcePosition() {
        switch (kind) {
            case DEFINITION:
                return definition.getNodeId();
            case USE:
                return use.getNodeId();
            default:
                return null;
        }
    }

    public String getVariableName() {
        switch (kind) {
            case DEFINITION:
                return definition.getVersion().getVariableName();
            case USE:
                return use.getVersion().getVariableName();
            default:
                return phi.getVariableName();
        }
    }

    public int getVersionNumber() {
        switch (kind) {
            case DEFINITION:
                return definition.getVersion().getVersionNumber();
            case USE:
                return use.getVersion().getVersionNumber();
            default:
                return phi.getResultingVersion();
        }
    }

    public int getCfgNodeId() {
        switch (kind) {
            case DEFINITION:
                return definition.getCfgNodeId();
            case USE:
                return use.getCfgNodeId();
            default:
                return phi.getCfgNodeId();
        }
    }

    public String getLabel() {
        String version = getVariableName() + "_" + getVersionNumber();
        switch (kind) {
            case DEFINITION:
                return "def " + version;
            case USE:
                return "use " + version;
            default:
                return phi.toString();
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DFGNode)) return false;
        DFGNode other = (DFGNode) obj;
        return id == other.id && kind == other.kind && Objects.equals(definition, other.definition)
                && Objects.equals(use, other.use) && Objects.equals(phi, other.phi);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind);
    }

    @Override
    public String toString() {
        return "dfg" + id + "[" + getLabel() + "]";
    }
}
