package sanalysis;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * SSA-form data flow graph of one function.
 */
public final class DataFlowGraph {

    private final String functionName;
    private final List<DFGNode> nodes;
    private final List<DFGEdge> edges;

    public DataFlowGraph(String functionName, List<DFGNode> nodes, List<DFGEdge> edges) {
        this.functionName = functionName;
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
    }

    public String getFunctionName() { return functionName; }
    public List<DFGNode> getNodes() { return nodes; }
    public List<DFGEdge> getEdges() { return edges; }

    public DFGNode getNode(int id) {
        return nodes.get(id);
    }

    public List<Definition> getDefinitions() {
        return nodes.stream().filter(n -> n.getKind() == DFGNodeKind.DEFINITION)
                .map(DFGNode::getDefinition).collect(Collectors.toList());
    }

    public List<Use> getUses() {
        return nodes.stream().filter(n -> n.getKind() == DFGNodeKind.USE)
                .map(DFGNode::getUse).collect(Collectors.toList());
    }

    public List<PhiNode> getPhiNodes() {
        return nodes.stream().filter(n -> n.getKind() == DFGNodeKind.PHI)
                .map(DFGNode::getPhi).collect(Collectors.toList());
    }

    /** Every version written by a definition or phi, as "name_version". */
    public Set<String> getVariableVersions() {
        Set<String> versions = new LinkedHashSet<>();
        for (DFGNode node : nodes) {
            if (node.getKind() != DFGNodeKind.USE) {
                versions.add(node.getVariableName() + "_" + node.getVersionNumber());
            }
        }
        return versions;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DataFlowGraph)) return false;
        DataFlowGraph other = (DataFlowGraph) obj;
        return Objects.equals(functionName, other.functionName)
                && nodes.equals(other.nodes) && edges.equals(other.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, nodes.size(), edges.size());
    }
}
