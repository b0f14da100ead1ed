package assembly;

import ast.AstFactory;
import ast.FunctionSource;
import ast.JavaAstAdapter;
import ast.SourcePositionRegistry;
import cpg.CPGEdge;
import cpg.CPGNode;
import cpg.CodePropertyGraph;
import cpg.CpgEdgeKind;
import cpg.CpgOrigin;
import cpg.SymbolTable;
import errors.DuplicateFunctionNameException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pipeline.ModulePipeline;
import pipeline.PipelineConfig;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AggregateAssemblerTest {

    private static final String CODE =
            "class Chain {\n" +
            "    int first(int a) { return second(a) + 1; }\n" +
            "    int second(int b) { return b * 2; }\n" +
            "    int third(int c) { return Math.abs(c); }\n" +
            "}";

    private AggregateAssembler assembler;
    private ModulePipeline pipeline;

    @BeforeEach
    void setUp() {
        assembler = new AggregateAssembler();
        pipeline = new ModulePipeline(new PipelineConfig(1, true, true, false));
    }

    @Test
    @DisplayName("Two functions with the same qualified name abort the module")
    void testDuplicateQualifiedName() throws Exception {
        // Arrange
        AstFactory f = new AstFactory(new SourcePositionRegistry(), "Worker.java");
        FunctionSource one = new FunctionSource("Worker.process(int)", "Worker",
                f.function("Worker", "process", List.of(f.parameter("n")), f.block(f.returnStmt(f.ref("n")))));
        FunctionSource two = new FunctionSource("Worker.process(int)", "Worker",
                f.function("Worker", "process", List.of(f.parameter("m")), f.block(f.returnStmt(f.literal("0")))));
        List<EnhancedFunctionData> built = new ArrayList<>();
        built.add(pipeline.buildFunction(one, SymbolTable.EMPTY));
        built.add(pipeline.buildFunction(two, SymbolTable.EMPTY));

        // Act
        DuplicateFunctionNameException error = assertThrows(DuplicateFunctionNameException.class,
                () -> assembler.assembleModule("Worker", built, true));

        // Assert
        assertEquals("Worker", error.getSubject());
        assertTrue(error.getMessage().contains("Worker.process(int)"));
    }

    @Test
    @DisplayName("Module record keeps functions in input order")
    void testModuleRecord() throws Exception {
        // Arrange
        List<EnhancedFunctionData> built = buildAll();

        // Act
        EnhancedModuleData module = assembler.assembleModule("Chain", built, false);

        // Assert
        assertEquals("Chain", module.getModuleName());
        assertEquals(List.of("Chain.first(int)", "Chain.second(int)", "Chain.third(int)"),
                new ArrayList<>(module.getFunctions().keySet()));
        assertTrue(module.getFunction("Chain.second(int)").isPresent());
        assertFalse(module.getFunction("Chain.missing()").isPresent());
        assertFalse(module.getModuleLevelCpg().isPresent());
        assertTrue(module.getFunction("Chain.first(int)").orElseThrow().getAnalysisResults().isEmpty());
    }

    @Test
    @DisplayName("Module graph replaces callee stubs with the real entry nodes")
    void testModuleLevelUnion() throws Exception {
        // Arrange
        List<EnhancedFunctionData> built = buildAll();
        CodePropertyGraph firstCpg = built.get(0).getCpg();
        assertEquals(CpgOrigin.SYNTHETIC, firstCpg.getNode("Chain.second(int)#c0").getOrigin());

        // Act
        CodePropertyGraph union = assembler.assembleModule("Chain", built, true).getModuleLevelCpg().orElseThrow();

        // Assert
        CPGNode entry = union.getNode("Chain.second(int)#c0");
        assertEquals(CpgOrigin.CFG, entry.getOrigin());
        int expectedNodes = 0;
        int expectedEdges = 0;
        for (EnhancedFunctionData function : built) {
            expectedNodes += function.getCpg().getNodes().size();
            expectedEdges += function.getCpg().getEdges().size();
        }
        assertEquals(expectedNodes - 1, union.getNodes().size());
        assertEquals(expectedEdges, union.getEdges().size());

        Set<String> ids = new HashSet<>();
        for (CPGNode node : union.getNodes()) {
            assertTrue(ids.add(node.getId()), "duplicate node " + node.getId());
        }
        for (CPGEdge edge : union.getEdges()) {
            assertTrue(union.containsNode(edge.getFrom()) && union.containsNode(edge.getTo()), edge.toString());
        }
        assertEquals(1, union.getEdges(CpgEdgeKind.CALLS).size());
    }

    @Test
    @DisplayName("Function record carries all facets and metrics")
    void testFunctionRecord() throws Exception {
        EnhancedFunctionData second = buildAll().get(1);

        assertEquals("Chain.second(int)", second.getQualifiedName());
        assertEquals(second.getCpg().getName(), second.getQualifiedName());
        assertEquals(1, second.getComplexityMetrics().getCyclomatic());
        assertEquals(1, second.getComplexityMetrics().getParameterCount());
        assertFalse(second.getMappings().getContainment().isEmpty());
        assertNotNull(second.getRawAst());
    }

    private List<EnhancedFunctionData> buildAll() throws Exception {
        List<FunctionSource> functions = new JavaAstAdapter(new SourcePositionRegistry()).parse(CODE, "Chain.java");
        SymbolTable.Builder symbols = SymbolTable.builder();
        for (FunctionSource function : functions) {
            symbols.add(function);
        }
        SymbolTable table = symbols.build();
        List<EnhancedFunctionData> built = new ArrayList<>();
        for (FunctionSource function : functions) {
            built.add(pipeline.buildFunction(function, table));
        }
        return built;
    }
}
