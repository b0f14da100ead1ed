package cpg;

import ast.FunctionSource;
import ast.JavaAstAdapter;
import ast.SourcePositionRegistry;
import errors.InconsistentGraphMergeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sanalysis.CFGGenerator;
import sanalysis.ControlFlowGraph;
import sanalysis.DFGGenerator;
import sanalysis.DataFlowGraph;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class GraphUnifierTest {

    private static final String CODE =
            "class Calc {\n" +
            "    int helper(int v) { return v * 2; }\n" +
            "    int run(int x) {\n" +
            "        int y = helper(x);\n" +
            "        if (y > 3) {\n" +
            "            y = run(y - 1);\n" +
            "        }\n" +
            "        return y;\n" +
            "    }\n" +
            "    double total(Shape s) { return s.area() + Calc.scale(2); }\n" +
            "    static double scale(double f) { return f; }\n" +
            "}\n" +
            "class Shape {\n" +
            "    double area() { return 0; }\n" +
            "}";

    private JavaAstAdapter adapter;
    private List<FunctionSource> functions;
    private SymbolTable symbols;

    @BeforeEach
    void setUp() {
        adapter = new JavaAstAdapter(new SourcePositionRegistry());
        functions = adapter.parse(CODE, "Calc.java");
        SymbolTable.Builder builder = SymbolTable.builder();
        for (FunctionSource function : functions) {
            builder.add(function);
        }
        symbols = builder.build();
    }

    @Test
    @DisplayName("Every AST, CFG and DFG node appears once and no edge dangles")
    void testFacetsAreComplete() throws Exception {
        // Arrange
        FunctionSource run = function("Calc.run(int)");
        ControlFlowGraph cfg = new CFGGenerator().generate(run);
        DataFlowGraph dfg = new DFGGenerator().generate(run, cfg);

        // Act
        CodePropertyGraph cpg = new GraphUnifier().unify(run, cfg, dfg, symbols);

        // Assert
        assertEquals(run.getAst().preorder().size(), count(cpg, CpgOrigin.AST));
        assertEquals(cfg.getNodes().size(), count(cpg, CpgOrigin.CFG));
        assertEquals(dfg.getNodes().size(), count(cpg, CpgOrigin.DFG));
        for (CPGEdge edge : cpg.getEdges()) {
            assertTrue(cpg.containsNode(edge.getFrom()), "dangling source: " + edge);
            assertTrue(cpg.containsNode(edge.getTo()), "dangling target: " + edge);
        }
        assertEquals(cfg.getEdges().size(), cpg.getEdges(CpgEdgeKind.CONTROL_SUCCESSOR).size());
        assertEquals("Calc.run(int)#c0", CpgIds.entry(run.getQualifiedName()));
        assertEquals(CpgRole.FUNCTION_ENTRY, cpg.getNode("Calc.run(int)#c0").getRole());
    }

    @Test
    @DisplayName("Phis have no containing construct, other DFG nodes exactly one")
    void testDataFlowContainment() throws Exception {
        // Arrange
        FunctionSource run = function("Calc.run(int)");
        ControlFlowGraph cfg = new CFGGenerator().generate(run);
        DataFlowGraph dfg = new DFGGenerator().generate(run, cfg);

        // Act
        CodePropertyGraph cpg = new GraphUnifier().unify(run, cfg, dfg, symbols);
        NodeMappings mappings = new IndexBuilder().build(cpg);

        // Assert
        List<CPGNode> phis = cpg.getNodes(CpgRole.PHI_MERGE);
        assertEquals(1, phis.size());
        assertFalse(mappings.parentOf(phis.get(0).getId()).isPresent());
        for (CPGNode node : cpg.getNodes()) {
            if (node.getOrigin() == CpgOrigin.DFG && node.getRole() != CpgRole.PHI_MERGE) {
                String parent = mappings.parentOf(node.getId()).orElseThrow();
                assertEquals(node.getSourcePosition(), cpg.getNode(parent).getSourcePosition());
            }
        }
    }

    @Test
    @DisplayName("Resolved calls point at a stub of the callee entry; recursion at the real entry")
    void testCallEdges() throws Exception {
        // Arrange
        FunctionSource run = function("Calc.run(int)");
        ControlFlowGraph cfg = new CFGGenerator().generate(run);
        DataFlowGraph dfg = new DFGGenerator().generate(run, cfg);

        // Act
        CodePropertyGraph cpg = new GraphUnifier().unify(run, cfg, dfg, symbols);

        // Assert
        List<String> targets = cpg.getEdges(CpgEdgeKind.CALLS).stream().map(CPGEdge::getTo).collect(Collectors.toList());
        assertEquals(List.of("Calc.helper(int)#c0", "Calc.run(int)#c0"), targets);

        CPGNode stub = cpg.getNode("Calc.helper(int)#c0");
        assertEquals(CpgOrigin.SYNTHETIC, stub.getOrigin());
        assertEquals(CpgRole.EXTERNAL_FUNCTION, stub.getRole());
        assertEquals(CpgOrigin.CFG, cpg.getNode("Calc.run(int)#c0").getOrigin());
        for (CPGEdge call : cpg.getEdges(CpgEdgeKind.CALLS)) {
            assertEquals(CpgRole.CALL, cpg.getNode(call.getFrom()).getRole());
        }
    }

    @Test
    @DisplayName("Calls through a variable receiver stay unresolved")
    void testDynamicDispatchIsNotResolved() throws Exception {
        // Arrange
        FunctionSource total = function("Calc.total(Shape)");
        ControlFlowGraph cfg = new CFGGenerator().generate(total);
        DataFlowGraph dfg = new DFGGenerator().generate(total, cfg);

        // Act
        CodePropertyGraph cpg = new GraphUnifier().unify(total, cfg, dfg, symbols);

        // Assert: s.area() has no edge, Calc.scale(2) resolves through its owner type
        List<CPGEdge> calls = cpg.getEdges(CpgEdgeKind.CALLS);
        assertEquals(1, calls.size());
        assertEquals("Calc.scale(double)#c0", calls.get(0).getTo());
        assertEquals("Calc.scale(double)", calls.get(0).getLabel());
    }

    @Test
    @DisplayName("Without a symbol table no call edges are produced")
    void testEmptySymbolTable() throws Exception {
        FunctionSource run = function("Calc.run(int)");
        ControlFlowGraph cfg = new CFGGenerator().generate(run);
        DataFlowGraph dfg = new DFGGenerator().generate(run, cfg);

        CodePropertyGraph cpg = new GraphUnifier().unify(run, cfg, dfg, SymbolTable.EMPTY);

        assertTrue(cpg.getEdges(CpgEdgeKind.CALLS).isEmpty());
        assertTrue(cpg.getNodes(CpgRole.EXTERNAL_FUNCTION).isEmpty());
    }

    @Test
    @DisplayName("A CFG built from another AST is rejected")
    void testInconsistentMerge() throws Exception {
        // Arrange: a second parse of the same code gets fresh source positions
        FunctionSource run = function("Calc.run(int)");
        FunctionSource other = adapter.parse(CODE, "Calc.java").get(1);
        ControlFlowGraph foreignCfg = new CFGGenerator().generate(other);
        DataFlowGraph foreignDfg = new DFGGenerator().generate(other, foreignCfg);

        // Act
        InconsistentGraphMergeException error = assertThrows(InconsistentGraphMergeException.class,
                () -> new GraphUnifier().unify(run, foreignCfg, foreignDfg, symbols));

        // Assert
        assertEquals("Calc.run(int)", error.getSubject());
    }

    @Test
    void testUnificationIsDeterministic() throws Exception {
        FunctionSource run = function("Calc.run(int)");
        ControlFlowGraph cfg = new CFGGenerator().generate(run);
        DataFlowGraph dfg = new DFGGenerator().generate(run, cfg);

        assertEquals(new GraphUnifier().unify(run, cfg, dfg, symbols), new GraphUnifier().unify(run, cfg, dfg, symbols));
    }

    private FunctionSource function(String qualifiedName) {
        return functions.stream().filter(fs -> fs.getQualifiedName().equals(qualifiedName)).findFirst().orElseThrow();
    }

    private static long count(CodePropertyGraph cpg, CpgOrigin origin) {
        return cpg.getNodes().stream().filter(n -> n.getOrigin() == origin).count();
    }
}
