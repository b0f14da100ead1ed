package sanalysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Control flow graph of one function. Node 0 is the entry, node 1 the exit.
 */
public final class ControlFlowGraph {

    public static final int ENTRY_ID = 0;
    public static final int EXIT_ID = 1;

    private final String functionName;
    private final List<CFGNode> nodes;
    private final List<CFGEdge> edges;

    private transient volatile Map<Integer, List<CFGEdge>> outgoing;
    private transient volatile Map<Integer, List<CFGEdge>> incoming;

    public ControlFlowGraph(String functionName, List<CFGNode> nodes, List<CFGEdge> edges) {
        this.functionName = functionName;
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
    }

    public String getFunctionName() { return functionName; }
    public List<CFGNode> getNodes() { return nodes; }
    public List<CFGEdge> getEdges() { return edges; }

    public CFGNode getNode(int id) {
        return nodes.get(id);
    }

    public CFGNode getEntry() {
        return nodes.get(ENTRY_ID);
    }

    public List<CFGNode> getExitNodes() {
        return nodes.stream().filter(n -> n.getKind() == CFGNodeKind.EXIT).collect(Collectors.toList());
    }

    /** Outgoing edges of {@code nodeId}, in edge id order. */
    public List<CFGEdge> getSuccessorEdges(int nodeId) {
        return outgoing().getOrDefault(nodeId, Collections.emptyList());
    }

    /** Incoming edges of {@code nodeId}, in edge id order. */
    public List<CFGEdge> getPredecessorEdges(int nodeId) {
        return incoming().getOrDefault(nodeId, Collections.emptyList());
    }

    private Map<Integer, List<CFGEdge>> outgoing() {
        Map<Integer, List<CFGEdge>> result = outgoing;
        if (result == null) {
            result = new HashMap<>();
            for (CFGEdge edge : edges) {
                result.computeIfAbsent(edge.getFrom(), k -> new ArrayList<>()).add(edge);
            }
            outgoing = result;
        }
        return result;
    }

    private Map<Integer, List<CFGEdge>> incoming() {
        Map<Integer, List<CFGEdge>> result = incoming;
        if (result == null) {
            result = new HashMap<>();
            for (CFGEdge edge : edges) {
                result.computeIfAbsent(edge.getTo(), k -> new ArrayList<>()).add(edge);
            }
            incoming = result;
        }
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ControlFlowGraph)) return false;
        ControlFlowGraph other = (ControlFlowGraph) obj;
        return Objects.equals(functionName, other.functionName)
                && Objects.equals(nodes, other.nodes) && Objects.equals(edges, other.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, nodes.size(), edges.size());
    }
}
