package assembly;

import ast.FunctionSource;
import cpg.CPGEdge;
import cpg.CPGNode;
import cpg.CodePropertyGraph;
import cpg.CpgOrigin;
import cpg.NodeMappings;
import errors.DuplicateFunctionNameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sanalysis.ControlFlowGraph;
import sanalysis.DataFlowGraph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sole writer of {@link EnhancedFunctionData} and {@link EnhancedModuleData}.
 */
public class AggregateAssembler {
    private static final Logger logger = LoggerFactory.getLogger(AggregateAssembler.class);

    private final ComplexityCalculator calculator = new ComplexityCalculator();

    public EnhancedFunctionData assembleFunction(FunctionSource function, ControlFlowGraph cfg, DataFlowGraph dfg,
                                                 CodePropertyGraph cpg, NodeMappings mappings) {
        ComplexityMetrics metrics = calculator.calculate(function.getAst(), cfg, dfg);
        logger.debug("Assembled {}: {}", function.getQualifiedName(), metrics);
        return new EnhancedFunctionData(function.getQualifiedName(), function.getAst(), cfg, dfg, cpg, mappings, metrics);
    }

    /**
     * @param buildModuleGraph whether to also build the union of the function graphs
     */
    public EnhancedModuleData assembleModule(String moduleName, List<EnhancedFunctionData> functions,
                                             boolean buildModuleGraph) throws DuplicateFunctionNameException {
        List<String> names = new ArrayList<>();
        for (EnhancedFunctionData function : functions) {
            names.add(function.getQualifiedName());
        }
        requireUniqueNames(moduleName, names);

        Map<String, EnhancedFunctionData> byName = new LinkedHashMap<>();
        for (EnhancedFunctionData function : functions) {
            byName.put(function.getQualifiedName(), function);
        }
        CodePropertyGraph union = buildModuleGraph ? union(moduleName, functions) : null;
        logger.info("Assembled module {} with {} function(s)", moduleName, byName.size());
        return new EnhancedModuleData(moduleName, byName, union);
    }

    public static void requireUniqueNames(String moduleName, List<String> qualifiedNames)
            throws DuplicateFunctionNameException {
        Set<String> seen = new HashSet<>();
        for (String name : qualifiedNames) {
            if (!seen.add(name)) {
                throw new DuplicateFunctionNameException(moduleName, name);
            }
        }
    }

    /**
     * Union of the function graphs. A callee stub is replaced by the callee's real entry when that
     * function is part of the module; stubs of callees outside the module are kept once.
     */
    static CodePropertyGraph union(String moduleName, List<EnhancedFunctionData> functions) {
        Set<String> realIds = new HashSet<>();
        for (EnhancedFunctionData function : functions) {
            for (CPGNode node : function.getCpg().getNodes()) {
                if (node.getOrigin() != CpgOrigin.SYNTHETIC) {
                    realIds.add(node.getId());
                }
            }
        }
        List<CPGNode> nodes = new ArrayList<>();
        List<CPGEdge> edges = new ArrayList<>();
        Set<String> added = new HashSet<>();
        for (EnhancedFunctionData function : functions) {
            for (CPGNode node : function.getCpg().getNodes()) {
                boolean stub = node.getOrigin() == CpgOrigin.SYNTHETIC;
                if (stub && realIds.contains(node.getId())) {
                    continue;
                }
                if (added.add(node.getId())) {
                    nodes.add(node);
                }
            }
            edges.addAll(function.getCpg().getEdges());
        }
        return new CodePropertyGraph(moduleName, nodes, edges);
    }
}
