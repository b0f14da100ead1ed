package sanalysis;

import ast.AstKind;
import ast.AstNode;
import ast.FunctionSource;
import ast.SourcePositionId;
import errors.UnresolvedVariableReferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds the SSA-form data flow graph of one function from its AST and CFG.
 *
 * Steps:
 *   1. Reject reads of names the function never defines.
 *   2. Collect, per variable, the CFG nodes that define it (parameters at the entry).
 *   3. Place candidate phis at the iterated dominance frontier of those nodes.
 *   4. Rename in a pre-order walk of the dominator tree, keeping one version stack per variable.
 *   5. Keep only the phis that merge at least two distinct versions, then rename again with them.
 *
 * A dropped phi leaves its join to whatever definition dominates it, so a read that is defined on
 * some paths only has nothing on its version stack and fails. Version numbers start at 1 per
 * variable, so parameters always get version 1. An incoming phi value of 0 means the variable has
 * no definition along that edge.
 */
public class DFGGenerator {
    private static final Logger logger = LoggerFactory.getLogger(DFGGenerator.class);

    private static final int UNDEFINED = -1;

    public DataFlowGraph generate(FunctionSource function, ControlFlowGraph cfg) throws UnresolvedVariableReferenceException {
        return generate(function.getAst(), cfg, function.getQualifiedName());
    }

    public DataFlowGraph generate(AstNode function, ControlFlowGraph cfg, String qualifiedName)
            throws UnresolvedVariableReferenceException {
        checkNamesDefined(function, qualifiedName);

        Map<SourcePositionId, AstNode> astById = new HashMap<>();
        for (AstNode node : function.preorder()) {
            astById.put(node.getId(), node);
        }
        DominatorTreeGenerator.DominatorTree domTree = DominatorTreeGenerator.generate(cfg);

        Renaming candidates = new Renaming(qualifiedName, cfg, domTree, astById);
        candidates.placePhis(null);
        candidates.rename(ControlFlowGraph.ENTRY_ID);

        Renaming renaming = new Renaming(qualifiedName, cfg, domTree, astById);
        renaming.placePhis(candidates.mergingPhis());
        renaming.rename(ControlFlowGraph.ENTRY_ID);
        DataFlowGraph dfg = renaming.build();
        logger.debug("DFG for {}: {} nodes ({} phis), {} edges", qualifiedName,
                dfg.getNodes().size(), dfg.getPhiNodes().size(), dfg.getEdges().size());
        return dfg;
    }

    /**
     * Every NAME_REF, reachable or not, must name something the function defines somewhere.
     */
    static void checkNamesDefined(AstNode function, String qualifiedName) throws UnresolvedVariableReferenceException {
        Set<String> known = new HashSet<>();
        for (AstNode node : function.preorder()) {
            if (node.getKind().isDefinition() && node.getName() != null) {
                known.add(node.getName());
            }
        }
        for (AstNode node : function.preorder()) {
            if (node.is(AstKind.NAME_REF) && !known.contains(node.getName())) {
                throw new UnresolvedVariableReferenceException(qualifiedName, node.getName(),
                        qualifiedName + ": '" + node.getName() + "' is never defined (line " + node.getStartLine() + ")");
            }
        }
    }

    private static final class Renaming {
        private final String function;
        private final ControlFlowGraph cfg;
        private final DominatorTreeGenerator.DominatorTree domTree;
        private final Map<SourcePositionId, AstNode> astById;

        // cfg node -> variable -> phi under construction
        private final Map<Integer, TreeMap<String, PhiDraft>> phis = new TreeMap<>();
        private final List<DFGNode> nodes = new ArrayList<>();
        private final List<DFGEdge> edges = new ArrayList<>();
        private final Set<String> phiFeeds = new HashSet<>();
        private final Map<String, Deque<int[]>> stacks = new HashMap<>();
        private final Map<String, Integer> counters = new HashMap<>();
        // Uses read while evaluating the value of the innermost pending definition.
        private final Deque<List<Integer>> readFrames = new ArrayDeque<>();
        private int phiCount;

        Renaming(String function, ControlFlowGraph cfg, DominatorTreeGenerator.DominatorTree domTree,
                 Map<SourcePositionId, AstNode> astById) {
            this.function = function;
            this.cfg = cfg;
            this.domTree = domTree;
            this.astById = astById;
        }

        /**
         * @param keep {@code "<cfg node>:<variable>"} keys of the phis to place, or null for every
         *             candidate on the iterated dominance frontier
         */
        void placePhis(Set<String> keep) {
            Map<String, Set<Integer>> defSites = new TreeMap<>();
            for (CFGNode node : cfg.getNodes()) {
                if (!domTree.isReachable(node.getId())) {
                    continue;
                }
                for (AstNode stmt : contained(node)) {
                    for (AstNode def : definitionsIn(stmt)) {
                        defSites.computeIfAbsent(def.getName(), k -> new TreeSet<>()).add(node.getId());
                    }
                }
            }

            for (Map.Entry<String, Set<Integer>> entry : defSites.entrySet()) {
                String variable = entry.getKey();
                Set<Integer> hasPhi = new HashSet<>();
                Deque<Integer> worklist = new ArrayDeque<>(entry.getValue());
                Set<Integer> queued = new HashSet<>(entry.getValue());
                while (!worklist.isEmpty()) {
                    int site = worklist.poll();
                    for (int join : domTree.getFrontier(site)) {
                        if (hasPhi.add(join)) {
                            if (keep == null || keep.contains(PhiDraft.key(join, variable))) {
                                phis.computeIfAbsent(join, k -> new TreeMap<>())
                                        .put(variable, new PhiDraft(variable, join, cfg.getPredecessorEdges(join).size()));
                            }
                            if (queued.add(join)) {
                                worklist.add(join);
                            }
                        }
                    }
                }
            }

            // Phi ids come first, ordered by CFG node then variable name.
            for (TreeMap<String, PhiDraft> atNode : phis.values()) {
                for (PhiDraft phi : atNode.values()) {
                    phi.id = phiCount++;
                    nodes.add(null);
                }
            }
        }

        void rename(int cfgNodeId) throws UnresolvedVariableReferenceException {
            List<String> pushed = new ArrayList<>();

            TreeMap<String, PhiDraft> here = phis.get(cfgNodeId);
            if (here != null) {
                for (PhiDraft phi : here.values()) {
                    phi.version = nextVersion(phi.variable);
                    push(phi.variable, phi.version, phi.id);
                    pushed.add(phi.variable);
                }
            }

            for (AstNode stmt : contained(cfg.getNode(cfgNodeId))) {
                scan(stmt, cfgNodeId, pushed);
            }

            List<CFGEdge> successors = cfg.getSuccessorEdges(cfgNodeId);
            for (CFGEdge edge : successors) {
                TreeMap<String, PhiDraft> atTarget = phis.get(edge.getTo());
                if (atTarget == null) {
                    continue;
                }
                int slot = cfg.getPredecessorEdges(edge.getTo()).indexOf(edge);
                for (PhiDraft phi : atTarget.values()) {
                    int[] top = top(phi.variable);
                    phi.incoming[slot] = new PhiIncoming(cfgNodeId, edge.getId(), top == null ? 0 : top[0]);
                    phi.sources[slot] = top == null ? UNDEFINED : top[1];
                    if (top != null && phiFeeds.add(top[1] + ">" + phi.id)) {
                        edge(top[1], phi.id, DFGEdgeKind.REACHES);
                    }
                }
            }

            for (int child : domTree.getChildren(cfgNodeId)) {
                rename(child);
            }

            for (String variable : pushed) {
                stacks.get(variable).pop();
            }
        }

        /** Emits uses and definitions of {@code node}'s subtree in evaluation order. */
        private void scan(AstNode node, int cfgNodeId, List<String> pushed) throws UnresolvedVariableReferenceException {
            switch (node.getKind()) {
                case NAME_REF:
                    use(node, cfgNodeId);
                    return;
                case PARAMETER:
                case BINDING:
                    define(node, cfgNodeId, pushed, new ArrayList<>());
                    return;
                case VARIABLE_DECLARATION:
                    if (node.getChildCount() == 0) {
                        return;
                    }
                    readFrames.push(new ArrayList<>());
                    scanChildren(node, cfgNodeId, pushed);
                    define(node, cfgNodeId, pushed, readFrames.pop());
                    return;
                case ASSIGNMENT:
                    readFrames.push(new ArrayList<>());
                    if (readsTarget(node)) {
                        use(node, cfgNodeId);
                    }
                    scanChildren(node, cfgNodeId, pushed);
                    define(node, cfgNodeId, pushed, readFrames.pop());
                    return;
                default:
                    scanChildren(node, cfgNodeId, pushed);
            }
        }

        private void scanChildren(AstNode node, int cfgNodeId, List<String> pushed) throws UnresolvedVariableReferenceException {
            for (AstNode child : node.getChildren()) {
                scan(child, cfgNodeId, pushed);
            }
        }

        private void use(AstNode node, int cfgNodeId) throws UnresolvedVariableReferenceException {
            int[] top = top(node.getName());
            if (top == null) {
                throw new UnresolvedVariableReferenceException(function, node.getName(),
                        function + ": '" + node.getName() + "' is read before any definition (line "
                                + node.getStartLine() + ")");
            }
            int id = nodes.size();
            VariableVersion version = new VariableVersion(node.getName(), top[0], top[1]);
            nodes.add(DFGNode.of(id, new Use(version, node.getId(), cfgNodeId)));
            edge(top[1], id, DFGEdgeKind.REACHES);
            if (!readFrames.isEmpty()) {
                readFrames.peek().add(id);
            }
        }

        private void define(AstNode node, int cfgNodeId, List<String> pushed, List<Integer> reads) {
            String variable = node.getName();
            int number = nextVersion(variable);
            int id = nodes.size();
            nodes.add(DFGNode.of(id, new Definition(new VariableVersion(variable, number, id), node.getId(), cfgNodeId)));
            for (int read : reads) {
                edge(id, read, DFGEdgeKind.DEPENDS_ON);
            }
            push(variable, number, id);
            pushed.add(variable);
        }

        private int nextVersion(String variable) {
            return counters.merge(variable, 1, Integer::sum);
        }

        private void push(String variable, int version, int dfgNodeId) {
            stacks.computeIfAbsent(variable, k -> new ArrayDeque<>()).push(new int[]{version, dfgNodeId});
        }

        private int[] top(String variable) {
            Deque<int[]> stack = stacks.get(variable);
            return stack == null || stack.isEmpty() ? null : stack.peek();
        }

        private void edge(int from, int to, DFGEdgeKind kind) {
            edges.add(new DFGEdge(edges.size(), from, to, kind));
        }

        private List<AstNode> contained(CFGNode node) {
            List<AstNode> result = new ArrayList<>();
            for (SourcePositionId id : node.getContainedStatementIds()) {
                AstNode stmt = astById.get(id);
                if (stmt != null) {
                    result.add(stmt);
                }
            }
            return result;
        }

        /**
         * Repeatedly folds away phis whose incoming values, ignoring undefined edges and the phi
         * itself, are fewer than two distinct definitions.
         */
        Set<String> mergingPhis() {
            Map<Integer, Integer> replaced = new HashMap<>();
            boolean changed = true;
            while (changed) {
                changed = false;
                for (TreeMap<String, PhiDraft> atNode : phis.values()) {
                    for (PhiDraft phi : atNode.values()) {
                        if (replaced.containsKey(phi.id)) {
                            continue;
                        }
                        Set<Integer> values = new TreeSet<>();
                        for (int source : phi.sources) {
                            int value = resolve(source, replaced);
                            if (value != UNDEFINED && value != phi.id) {
                                values.add(value);
                            }
                        }
                        if (values.size() < 2) {
                            replaced.put(phi.id, values.isEmpty() ? UNDEFINED : values.iterator().next());
                            changed = true;
                        }
                    }
                }
            }

            Set<String> keep = new HashSet<>();
            for (TreeMap<String, PhiDraft> atNode : phis.values()) {
                for (PhiDraft phi : atNode.values()) {
                    if (!replaced.containsKey(phi.id)) {
                        keep.add(PhiDraft.key(phi.cfgNodeId, phi.variable));
                    }
                }
            }
            logger.debug("{}: {} of {} candidate phis merge distinct versions", function, keep.size(), phiCount);
            return keep;
        }

        private static int resolve(int value, Map<Integer, Integer> replaced) {
            Integer next = replaced.get(value);
            while (next != null) {
                value = next;
                next = replaced.get(value);
            }
            return value;
        }

        DataFlowGraph build() {
            for (TreeMap<String, PhiDraft> atNode : phis.values()) {
                for (PhiDraft phi : atNode.values()) {
                    nodes.set(phi.id, DFGNode.of(phi.freeze()));
                }
            }
            return new DataFlowGraph(function, nodes, edges);
        }
    }

    private static final class PhiDraft {
        final String variable;
        final int cfgNodeId;
        final PhiIncoming[] incoming;
        // DFG node feeding each incoming slot, UNDEFINED where nothing is defined or the edge is never walked
        final int[] sources;
        int id;
        int version;

        PhiDraft(String variable, int cfgNodeId, int predecessors) {
            this.variable = variable;
            this.cfgNodeId = cfgNodeId;
            this.incoming = new PhiIncoming[predecessors];
            this.sources = new int[predecessors];
            Arrays.fill(sources, UNDEFINED);
        }

        static String key(int cfgNodeId, String variable) {
            return cfgNodeId + ":" + variable;
        }

        PhiNode freeze() {
            List<PhiIncoming> list = new ArrayList<>();
            for (PhiIncoming in : incoming) {
                if (in != null) {
                    list.add(in);
                }
            }
            return new PhiNode(id, variable, version, cfgNodeId, list);
        }
    }

    /** Definitions in {@code stmt}'s subtree, in evaluation order. */
    static List<AstNode> definitionsIn(AstNode stmt) {
        Set<AstNode> defs = new LinkedHashSet<>();
        collectDefinitions(stmt, defs);
        return new ArrayList<>(defs);
    }

    private static void collectDefinitions(AstNode node, Set<AstNode> out) {
        for (AstNode child : node.getChildren()) {
            collectDefinitions(child, out);
        }
        if (node.is(AstKind.PARAMETER) || node.is(AstKind.BINDING) || node.is(AstKind.ASSIGNMENT)
                || (node.is(AstKind.VARIABLE_DECLARATION) && node.getChildCount() > 0)) {
            out.add(node);
        }
    }

    // Compound operators and increments read the variable before writing it.
    static boolean readsTarget(AstNode assignment) {
        String operator = assignment.getAttribute("operator");
        return operator != null && !"=".equals(operator);
    }
}
