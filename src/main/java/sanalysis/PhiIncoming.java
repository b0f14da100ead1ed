package sanalysis;

import java.util.Objects;

/** Value a phi takes when control arrives over one incoming CFG edge. */
public final class PhiIncoming {

    private final int predecessorCfgNodeId;
    private final int cfgEdgeId;
    private final int sourceVersion;

    public PhiIncoming(int predecessorCfgNodeId, int cfgEdgeId, int sourceVersion) {
        this.predecessorCfgNodeId = predecessorCfgNodeId;
        this.cfgEdgeId = cfgEdgeId;
        this.sourceVersion = sourceVersion;
    }

    public int getPredecessorCfgNodeId() { return predecessorCfgNodeId; }
    public int getCfgEdgeId() { return cfgEdgeId; }
    public int getSourceVersion() { return sourceVersion; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PhiIncoming)) return false;
        PhiIncoming other = (PhiIncoming) obj;
        return predecessorCfgNodeId == other.predecessorCfgNodeId && cfgEdgeId == other.cfgEdgeId
                && sourceVersion == other.sourceVersion;
    }

    @Override
    public int hashCode() {
        return Objects.hash(predecessorCfgNodeId, cfgEdgeId, sourceVersion);
    }

    @Override
    public String toString() {
        return "cfg" + predecessorCfgNodeId + ":v" + sourceVersion;
    }
}
