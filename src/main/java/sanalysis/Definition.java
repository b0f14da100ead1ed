package sanalysis;

import ast.SourcePositionId;

import java.util.Objects;

/**
 * A write of one variable version by a parameter, binding, initialized declaration or assignment.
 */
public final class Definition {

    private final VariableVersion version;
    private final SourcePositionId nodeId;
    private final int cfgNodeId;

    public Definition(VariableVersion version, SourcePositionId nodeId, int cfgNodeId) {
        this.version = Objects.requireNonNull(version, "version");
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        this.cfgNodeId = cfgNodeId;
    }

    public VariableVersion getVersion() { return version; }
    public SourcePositionId getNodeId() { return nodeId; }
    public int getCfgNodeId() { return cfgNodeId; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Definition)) return false;
        Definition other = (Definition) obj;
        return cfgNodeId == other.cfgNodeId && version.equals(other.version) && nodeId.equals(other.nodeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, nodeId);
    }
}
