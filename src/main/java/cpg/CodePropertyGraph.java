package cpg;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Unified AST/CFG/DFG graph of one function, or the union of a module's function graphs.
 * Nodes and edges live in flat lists and refer to each other by id only.
 */
public final class CodePropertyGraph {

    private final String name;
    private final List<CPGNode> nodes;
    private final List<CPGEdge> edges;

    private transient volatile Map<String, CPGNode> nodesById;

    public CodePropertyGraph(String name, List<CPGNode> nodes, List<CPGEdge> edges) {
        this.name = name;
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
    }

    public String getName() { return name; }
    public List<CPGNode> getNodes() { return nodes; }
    public List<CPGEdge> getEdges() { return edges; }

    /** @return the node, or {@code null} when the graph has no node with that id */
    public CPGNode getNode(String id) {
        return index().get(id);
    }

    public boolean containsNode(String id) {
        return index().containsKey(id);
    }

    public List<CPGEdge> getOutgoing(String nodeId, CpgEdgeKind kind) {
        return edges.stream().filter(e -> e.getFrom().equals(nodeId) && e.getKind() == kind)
                .collect(Collectors.toList());
    }

    public List<CPGEdge> getEdges(CpgEdgeKind kind) {
        return edges.stream().filter(e -> e.getKind() == kind).collect(Collectors.toList());
    }

    public List<CPGNode> getNodes(CpgRole role) {
        return nodes.stream().filter(n -> n.getRole() == role).collect(Collectors.toList());
    }

    private Map<String, CPGNode> index() {
        Map<String, CPGNode> result = nodesById;
        if (result == null) {
            result = new HashMap<>();
            for (CPGNode node : nodes) {
                result.put(node.getId(), node);
            }
            result = Collections.unmodifiableMap(result);
            nodesById = result;
        }
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CodePropertyGraph)) return false;
        CodePropertyGraph other = (CodePropertyGraph) obj;
        return Objects.equals(name, other.name) && nodes.equals(other.nodes) && edges.equals(other.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, nodes.size(), edges.size());
    }
}
