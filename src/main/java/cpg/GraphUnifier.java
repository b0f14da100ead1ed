package cpg;

import ast.AstKind;
import ast.AstNode;
import ast.FunctionSource;
import ast.SourcePositionId;
import errors.InconsistentGraphMergeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sanalysis.CFGEdge;
import sanalysis.CFGNode;
import sanalysis.ControlFlowGraph;
import sanalysis.DFGEdge;
import sanalysis.DFGEdgeKind;
import sanalysis.DFGNode;
import sanalysis.DataFlowGraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Merges a function's AST, CFG and DFG into one {@link CodePropertyGraph}.
 *
 * Steps:
 *   1. One AST-origin node per construct, in pre-order, linked by PARENT_CHILD edges.
 *   2. One CFG-origin node per CFG node, CONTAINS from its construct when it wraps statements,
 *      CONTROL_SUCCESSOR edges labelled with the CFG edge kind.
 *   3. One DFG-origin node per DFG node, CONTAINS from its construct (phis have none),
 *      DATA_REACHES and DATA_DEPENDS edges.
 *   4. CALLS edges for calls the symbol table resolves, pointing at a stub of the callee's entry.
 *
 * The three facets meet only at nodes that share a source position id.
 */
public class GraphUnifier {
    private static final Logger logger = LoggerFactory.getLogger(GraphUnifier.class);

    public CodePropertyGraph unify(FunctionSource function, ControlFlowGraph cfg, DataFlowGraph dfg, SymbolTable symbols)
            throws InconsistentGraphMergeException {
        String qn = function.getQualifiedName();
        List<CPGNode> nodes = new ArrayList<>();
        List<CPGEdge> edges = new ArrayList<>();
        int[] edgeCounter = {0};

        // 1. AST
        Map<SourcePositionId, CPGNode> astNodes = new HashMap<>();
        List<AstNode> preorder = function.getAst().preorder();
        for (int i = 0; i < preorder.size(); i++) {
            AstNode ast = preorder.get(i);
            CPGNode node = new CPGNode(CpgIds.astNode(qn, i), CpgOrigin.AST, CpgRole.of(ast.getKind()),
                    ast.getId(), ast.getLabel(), new Span(ast.getStartLine(), ast.getEndLine()));
            nodes.add(node);
            astNodes.put(ast.getId(), node);
        }
        for (AstNode ast : preorder) {
            String parent = astNodes.get(ast.getId()).getId();
            for (AstNode child : ast.getChildren()) {
                addEdge(edges, edgeCounter, qn, parent, astNodes.get(child.getId()).getId(), CpgEdgeKind.PARENT_CHILD, null);
            }
        }

        // 2. CFG
        for (CFGNode block : cfg.getNodes()) {
            for (SourcePositionId contained : block.getContainedStatementIds()) {
                requireKnown(qn, astNodes, contained, block.toString());
            }
            CPGNode origin = block.getSourcePosition() == null ? null
                    : requireKnown(qn, astNodes, block.getSourcePosition(), block.toString());
            CPGNode node = new CPGNode(CpgIds.cfgNode(qn, block.getId()), CpgOrigin.CFG, CpgRole.of(block.getKind()),
                    block.getSourcePosition(), block.getLabel(), origin == null ? null : origin.getSpan());
            nodes.add(node);
            if (origin != null && !block.getContainedStatementIds().isEmpty()) {
                addEdge(edges, edgeCounter, qn, origin.getId(), node.getId(), CpgEdgeKind.CONTAINS, null);
            }
        }
        for (CFGEdge edge : cfg.getEdges()) {
            addEdge(edges, edgeCounter, qn, CpgIds.cfgNode(qn, edge.getFrom()), CpgIds.cfgNode(qn, edge.getTo()),
                    CpgEdgeKind.CONTROL_SUCCESSOR, edge.getKind().name());
        }

        // 3. DFG
        for (DFGNode value : dfg.getNodes()) {
            SourcePositionId position = value.getSourcePosition();
            CPGNode origin = position == null ? null : requireKnown(qn, astNodes, position, value.toString());
            CPGNode node = new CPGNode(CpgIds.dfgNode(qn, value.getId()), CpgOrigin.DFG, CpgRole.of(value.getKind()),
                    position, value.getLabel(), origin == null ? null : origin.getSpan());
            nodes.add(node);
            if (origin != null) {
                addEdge(edges, edgeCounter, qn, origin.getId(), node.getId(), CpgEdgeKind.CONTAINS, null);
            }
        }
        for (DFGEdge edge : dfg.getEdges()) {
            CpgEdgeKind kind = edge.getKind() == DFGEdgeKind.REACHES ? CpgEdgeKind.DATA_REACHES : CpgEdgeKind.DATA_DEPENDS;
            addEdge(edges, edgeCounter, qn, CpgIds.dfgNode(qn, edge.getFrom()), CpgIds.dfgNode(qn, edge.getTo()), kind, null);
        }

        // 4. Calls
        Map<String, CPGNode> stubs = new LinkedHashMap<>();
        int unresolved = 0;
        for (AstNode call : preorder) {
            if (!call.is(AstKind.CALL)) {
                continue;
            }
            Optional<String> callee = symbols.resolve(function.getOwner(), call);
            Optional<String> entryId = callee.flatMap(symbols::entryIdOf);
            if (!entryId.isPresent()) {
                unresolved++;
                continue;
            }
            String target = entryId.get();
            if (!callee.get().equals(qn) && !stubs.containsKey(target)) {
                stubs.put(target, new CPGNode(target, CpgOrigin.SYNTHETIC, CpgRole.EXTERNAL_FUNCTION,
                        null, callee.get(), null));
            }
            addEdge(edges, edgeCounter, qn, astNodes.get(call.getId()).getId(), target, CpgEdgeKind.CALLS, callee.get());
        }
        nodes.addAll(stubs.values());

        logger.debug("CPG for {}: {} nodes, {} edges, {} unresolved call(s)", qn, nodes.size(), edges.size(), unresolved);
        return new CodePropertyGraph(qn, nodes, edges);
    }

    private static CPGNode requireKnown(String qn, Map<SourcePositionId, CPGNode> astNodes, SourcePositionId position,
                                        String claimant) throws InconsistentGraphMergeException {
        CPGNode node = astNodes.get(position);
        if (node == null) {
            throw new InconsistentGraphMergeException(qn,
                    qn + ": " + claimant + " refers to " + position + ", which is not part of the function's AST");
        }
        return node;
    }

    private static void addEdge(List<CPGEdge> edges, int[] counter, String qn, String from, String to,
                                CpgEdgeKind kind, String label) {
        edges.add(new CPGEdge(CpgIds.edge(qn, counter[0]++), from, to, kind, label));
    }
}
