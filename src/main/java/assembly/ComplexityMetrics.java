package assembly;

import java.util.Objects;

/**
 * Per-function scores derived from the CFG, AST and DFG. Cyclomatic complexity always equals
 * {@code edges - nodes + 2} of the function's CFG.
 */
public final class ComplexityMetrics {

    private final int cyclomatic;
    private final int cognitive;
    private final int maxNestingDepth;
    private final int decisionCount;
    private final int statementCount;
    private final int parameterCount;
    private final int ssaVariableCount;
    private final int phiCount;

    public ComplexityMetrics(int cyclomatic, int cognitive, int maxNestingDepth, int decisionCount,
                             int statementCount, int parameterCount, int ssaVariableCount, int phiCount) {
        this.cyclomatic = cyclomatic;
        this.cognitive = cognitive;
        this.maxNestingDepth = maxNestingDepth;
        this.decisionCount = decisionCount;
        this.statementCount = statementCount;
        this.parameterCount = parameterCount;
        this.ssaVariableCount = ssaVariableCount;
        this.phiCount = phiCount;
    }

    public int getCyclomatic() { return cyclomatic; }
    public int getCognitive() { return cognitive; }
    public int getMaxNestingDepth() { return maxNestingDepth; }
    public int getDecisionCount() { return decisionCount; }
    public int getStatementCount() { return statementCount; }
    public int getParameterCount() { return parameterCount; }
    public int getSsaVariableCount() { return ssaVariableCount; }
    public int getPhiCount() { return phiCount; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ComplexityMetrics)) return false;
        ComplexityMetrics other = (ComplexityMetrics) obj;
        return cyclomatic == other.cyclomatic && cognitive == other.cognitive
                && maxNestingDepth == other.maxNestingDepth && decisionCount == other.decisionCount
                && statementCount == other.statementCount && parameterCount == other.parameterCount
                && ssaVariableCount == other.ssaVariableCount && phiCount == other.phiCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(cyclomatic, cognitive, maxNestingDepth, decisionCount, statementCount,
                parameterCount, ssaVariableCount, phiCount);
    }

    @Override
    public String toString() {
        return "cyclomatic=" + cyclomatic + ", cognitive=" + cognitive + ", nesting=" + maxNestingDepth
                + ", decisions=" + decisionCount + ", statements=" + statementCount + ", params=" + parameterCount
                + ", ssaVars=" + ssaVariableCount + ", phis=" + phiCount;
    }
}
