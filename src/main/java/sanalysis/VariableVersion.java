package sanalysis;

import java.util.Objects;

/**
 * One SSA version of a local variable. Version 0 stands for "no definition on this path" and only
 * ever appears as a phi incoming value.
 */
public final class VariableVersion {

    private final String variableName;
    private final int versionNumber;
    // DFG node id of the definition or phi that writes this version; null for version 0.
    private final Integer definingNodeId;

    public VariableVersion(String variableName, int versionNumber, Integer definingNodeId) {
        this.variableName = Objects.requireNonNull(variableName, "variableName");
        this.versionNumber = versionNumber;
        this.definingNodeId = definingNodeId;
    }

    public String getVariableName() { return variableName; }
    public int getVersionNumber() { return versionNumber; }
    public Integer getDefiningNodeId() { return definingNodeId; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof VariableVersion)) return false;
        VariableVersion other = (VariableVersion) obj;
        return versionNumber == other.versionNumber && variableName.equals(other.variableName)
                && Objects.equals(definingNodeId, other.definingNodeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variableName, versionNumber);
    }

    @Override
    public String toString() {
        return variableName + "_" + versionNumber;
    }
}
