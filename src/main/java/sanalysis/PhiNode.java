package sanalysis;

import java.util.List;
import java.util.Objects;

/**
 * Merge of the versions of one variable at a CFG join. Incoming values are listed in the order of
 * the join's incoming CFG edges, one per edge.
 */
public final class PhiNode {

    private final int id;
    private final String variableName;
    private final int resultingVersion;
    private final int cfgNodeId;
    private final List<PhiIncoming> incoming;

    public PhiNode(int id, String variableName, int resultingVersion, int cfgNodeId, List<PhiIncoming> incoming) {
        this.id = id;
        this.variableName = Objects.requireNonNull(variableName, "variableName");
        this.resultingVersion = resultingVersion;
        this.cfgNodeId = cfgNodeId;
        this.incoming = List.copyOf(incoming);
    }

    public int getId() { return id; }
    public String getVariableName() { return variableName; }
    public int getResultingVersion() { return resultingVersion; }
    public int getCfgNodeId() { return cfgNodeId; }
    public List<PhiIncoming> getIncoming() { return incoming; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PhiNode)) return false;
        PhiNode other = (PhiNode) obj;
        return id == other.id && resultingVersion == other.resultingVersion && cfgNodeId == other.cfgNodeId
                && variableName.equals(other.variableName) && incoming.equals(other.incoming);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, variableName, resultingVersion);
    }

    @Override
    public String toString() {
        return variableName + "_" + resultingVersion + " = phi" + incoming;
    }
}
