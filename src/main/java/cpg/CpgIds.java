package cpg;

import sanalysis.ControlFlowGraph;

/**
 * Identifier scheme of the unified graph. Node ids carry the facet they come from
 * ({@code a} for AST, {@code c} for CFG, {@code d} for DFG) so they stay unique inside a module.
 */
public final class CpgIds {

    private CpgIds() {
    }

    public static String astNode(String function, int preorderIndex) {
        return function + "#a" + preorderIndex;
    }

    public static String cfgNode(String function, int cfgNodeId) {
        return function + "#c" + cfgNodeId;
    }

    public static String dfgNode(String function, int dfgNodeId) {
        return function + "#d" + dfgNodeId;
    }

    public static String edge(String function, int index) {
        return function + "#e" + index;
    }

    /** Id of a function's CFG entry node, known before the function is unified. */
    public static String entry(String function) {
        return cfgNode(function, ControlFlowGraph.ENTRY_ID);
    }

    public static String functionOf(String id) {
        int hash = id.lastIndexOf('#');
        return hash < 0 ? id : id.substring(0, hash);
    }
}
