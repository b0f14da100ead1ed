package sanalysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * DominatorTreeGenerator computes immediate dominators for every reachable node of a function's
 * CFG, then builds the dominator tree and the dominance frontiers.
 *
 * Immediate dominators use the iterative algorithm of Cooper, Harvey and Kennedy: nodes are
 * visited in reverse postorder and each idom is refined by intersecting the idoms of the already
 * processed predecessors, until a fixed point is reached. Unreachable nodes get no idom.
 */
public class DominatorTreeGenerator {
    private static final Logger logger = LoggerFactory.getLogger(DominatorTreeGenerator.class);

    public static final int UNDEFINED = -1;

    public static DominatorTree generate(ControlFlowGraph cfg) {
        int[] order = reversePostorder(cfg);
        int[] idom = computeImmediateDominators(cfg, order);
        Map<Integer, List<Integer>> children = generateDominatorTree(idom);
        Map<Integer, Set<Integer>> frontiers = computeDominanceFrontiers(cfg, idom);
        logger.debug("Dominator tree for {}: {} reachable of {} nodes",
                cfg.getFunctionName(), order.length, cfg.getNodes().size());
        return new DominatorTree(idom, order, children, frontiers);
    }

    /**
     * Depth-first postorder from the entry, reversed. Successors are followed in edge id order so the
     * result is deterministic.
     */
    public static int[] reversePostorder(ControlFlowGraph cfg) {
        int n = cfg.getNodes().size();
        boolean[] visited = new boolean[n];
        List<Integer> postorder = new ArrayList<>();
        Deque<int[]> stack = new ArrayDeque<>();
        stack.push(new int[]{ControlFlowGraph.ENTRY_ID, 0});
        visited[ControlFlowGraph.ENTRY_ID] = true;
        while (!stack.isEmpty()) {
            int[] frame = stack.peek();
            List<CFGEdge> out = cfg.getSuccessorEdges(frame[0]);
            if (frame[1] < out.size()) {
                int next = out.get(frame[1]++).getTo();
                if (!visited[next]) {
                    visited[next] = true;
                    stack.push(new int[]{next, 0});
                }
            } else {
                postorder.add(frame[0]);
                stack.pop();
            }
        }
        int[] order = new int[postorder.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = postorder.get(order.length - 1 - i);
        }
        return order;
    }

    /**
     * @return idom per node id; the entry maps to itself, unreachable nodes to {@link #UNDEFINED}.
     */
    public static int[] computeImmediateDominators(ControlFlowGraph cfg, int[] order) {
        int n = cfg.getNodes().size();
        int[] rpoIndex = new int[n];
        Arrays.fill(rpoIndex, UNDEFINED);
        for (int i = 0; i < order.length; i++) {
            rpoIndex[order[i]] = i;
        }

        int[] idom = new int[n];
        Arrays.fill(idom, UNDEFINED);
        idom[ControlFlowGraph.ENTRY_ID] = ControlFlowGraph.ENTRY_ID;

        boolean changed = true;
        while (changed) {
            changed = false;
            for (int i = 1; i < order.length; i++) {
                int node = order[i];
                int newIdom = UNDEFINED;
                for (CFGEdge edge : cfg.getPredecessorEdges(node)) {
                    int pred = edge.getFrom();
                    if (idom[pred] == UNDEFINED) {
                        continue;
                    }
                    newIdom = newIdom == UNDEFINED ? pred : intersect(pred, newIdom, idom, rpoIndex);
                }
                if (idom[node] != newIdom) {
                    idom[node] = newIdom;
                    changed = true;
                }
            }
        }
        return idom;
    }

    private static int intersect(int a, int b, int[] idom, int[] rpoIndex) {
        while (a != b) {
            while (rpoIndex[a] > rpoIndex[b]) {
                a = idom[a];
            }
            while (rpoIndex[b] > rpoIndex[a]) {
                b = idom[b];
            }
        }
        return a;
    }

    /**
     * Each edge in the tree points from an immediate dominator to the node it dominates. Children
     * are listed by ascending node id.
     */
    public static Map<Integer, List<Integer>> generateDominatorTree(int[] idom) {
        Map<Integer, List<Integer>> children = new TreeMap<>();
        for (int node = 0; node < idom.length; node++) {
            if (idom[node] == UNDEFINED || node == ControlFlowGraph.ENTRY_ID) {
                continue;
            }
            children.computeIfAbsent(idom[node], k -> new ArrayList<>()).add(node);
        }
        return children;
    }

    /**
     * Dominance frontiers: for each join node, walk up from every reachable predecessor until the
     * join's idom is reached, adding the join to the frontier of every node passed.
     */
    public static Map<Integer, Set<Integer>> computeDominanceFrontiers(ControlFlowGraph cfg, int[] idom) {
        Map<Integer, Set<Integer>> frontiers = new TreeMap<>();
        for (int node = 0; node < idom.length; node++) {
            if (idom[node] == UNDEFINED) {
                continue;
            }
            List<CFGEdge> preds = cfg.getPredecessorEdges(node);
            if (preds.size() < 2) {
                continue;
            }
            for (CFGEdge edge : preds) {
                int runner = edge.getFrom();
                if (idom[runner] == UNDEFINED) {
                    continue;
                }
                while (runner != idom[node]) {
                    frontiers.computeIfAbsent(runner, k -> new TreeSet<>()).add(node);
                    if (runner == ControlFlowGraph.ENTRY_ID) {
                        break;
                    }
                    runner = idom[runner];
                }
            }
        }
        return frontiers;
    }

    /**
     * Result of {@link #generate(ControlFlowGraph)}.
     */
    public static final class DominatorTree {
        private final int[] idom;
        private final int[] reversePostorder;
        private final Map<Integer, List<Integer>> children;
        private final Map<Integer, Set<Integer>> frontiers;

        DominatorTree(int[] idom, int[] reversePostorder, Map<Integer, List<Integer>> children,
                      Map<Integer, Set<Integer>> frontiers) {
            this.idom = idom;
            this.reversePostorder = reversePostorder;
            this.children = children;
            this.frontiers = frontiers;
        }

        /** Immediate dominator of {@code node}, or {@link #UNDEFINED} for the entry and unreachable nodes. */
        public int getImmediateDominator(int node) {
            return node == ControlFlowGraph.ENTRY_ID ? UNDEFINED : idom[node];
        }

        public boolean isReachable(int node) {
            return idom[node] != UNDEFINED;
        }

        public List<Integer> getChildren(int node) {
            return Collections.unmodifiableList(children.getOrDefault(node, Collections.emptyList()));
        }

        public Set<Integer> getFrontier(int node) {
            return Collections.unmodifiableSet(frontiers.getOrDefault(node, Collections.emptySet()));
        }

        public int[] getReversePostorder() {
            return reversePostorder.clone();
        }

        public boolean dominates(int a, int b) {
            if (!isReachable(a) || !isReachable(b)) {
                return false;
            }
            int current = b;
            while (current != a) {
                if (current == ControlFlowGraph.ENTRY_ID) {
                    return false;
                }
                current = idom[current];
            }
            return true;
        }

        /** Reachable nodes in dominator tree pre-order, children by ascending id. */
        public List<Integer> preorder() {
            List<Integer> result = new ArrayList<>();
            Deque<Integer> stack = new ArrayDeque<>();
            stack.push(ControlFlowGraph.ENTRY_ID);
            while (!stack.isEmpty()) {
                int node = stack.pop();
                result.add(node);
                List<Integer> kids = children.getOrDefault(node, Collections.emptyList());
                for (int i = kids.size() - 1; i >= 0; i--) {
                    stack.push(kids.get(i));
                }
            }
            return result;
        }
    }
}
