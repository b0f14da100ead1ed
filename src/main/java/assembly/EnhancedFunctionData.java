package assembly;

import ast.AstNode;
import cpg.CodePropertyGraph;
import cpg.NodeMappings;
import cpg.PropertyBag;
import sanalysis.ControlFlowGraph;
import sanalysis.DataFlowGraph;

import java.util.Objects;

/**
 * Everything built for one function. Read-only for consumers except {@link #getAnalysisResults()},
 * which analyses extend by attaching new keys.
 */
public final class EnhancedFunctionData {

    private final String qualifiedName;
    private final AstNode rawAst;
    private final ControlFlowGraph cfg;
    private final DataFlowGraph dfg;
    private final CodePropertyGraph cpg;
    private final NodeMappings mappings;
    private final ComplexityMetrics complexityMetrics;
    private final PropertyBag analysisResults;

    EnhancedFunctionData(String qualifiedName, AstNode rawAst, ControlFlowGraph cfg, DataFlowGraph dfg,
                         CodePropertyGraph cpg, NodeMappings mappings, ComplexityMetrics complexityMetrics) {
        this.qualifiedName = qualifiedName;
        this.rawAst = rawAst;
        this.cfg = cfg;
        this.dfg = dfg;
        this.cpg = cpg;
        this.mappings = mappings;
        this.complexityMetrics = complexityMetrics;
        this.analysisResults = new PropertyBag(qualifiedName);
    }

    public String getQualifiedName() { return qualifiedName; }
    public AstNode getRawAst() { return rawAst; }
    public ControlFlowGraph getCfg() { return cfg; }
    public DataFlowGraph getDfg() { return dfg; }
    public CodePropertyGraph getCpg() { return cpg; }
    public NodeMappings getMappings() { return mappings; }
    public ComplexityMetrics getComplexityMetrics() { return complexityMetrics; }
    public PropertyBag getAnalysisResults() { return analysisResults; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof EnhancedFunctionData)) return false;
        EnhancedFunctionData other = (EnhancedFunctionData) obj;
        return qualifiedName.equals(other.qualifiedName) && rawAst.equals(other.rawAst)
                && cfg.equals(other.cfg) && dfg.equals(other.dfg) && cpg.equals(other.cpg)
                && mappings.equals(other.mappings) && complexityMetrics.equals(other.complexityMetrics)
                && analysisResults.equals(other.analysisResults);
    }

    @Override
    public int hashCode() {
        return Objects.hash(qualifiedName);
    }

    @Override
    public String toString() {
        return qualifiedName + " {" + complexityMetrics + "}";
    }
}
