package pipeline;

import assembly.EnhancedModuleData;
import assembly.FunctionFailure;
import assembly.ModuleAssemblyResult;
import ast.AstFactory;
import ast.AstKind;
import ast.FunctionSource;
import ast.JavaAstAdapter;
import ast.SourcePositionRegistry;
import cpg.CpgEdgeKind;
import cpg.SymbolTable;
import errors.DuplicateFunctionNameException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModulePipelineTest {

    private static final String CODE =
            "class Orders {\n" +
            "    private int count;\n" +
            "    int total(int[] prices) {\n" +
            "        int sum = 0;\n" +
            "        for (int p : prices) {\n" +
            "            if (p < 0) continue;\n" +
            "            sum += discount(p);\n" +
            "        }\n" +
            "        return sum;\n" +
            "    }\n" +
            "    int discount(int price) {\n" +
            "        switch (price / 100) {\n" +
            "            case 0: return price;\n" +
            "            case 1: return price - 5;\n" +
            "            default: return price * 9 / 10;\n" +
            "        }\n" +
            "    }\n" +
            "    void record(String id) {\n" +
            "        try {\n" +
            "            count++;\n" +
            "            store(id);\n" +
            "        } catch (IllegalStateException e) {\n" +
            "            count = 0;\n" +
            "        } finally {\n" +
            "            flush();\n" +
            "        }\n" +
            "    }\n" +
            "    void store(String id) { }\n" +
            "    void flush() { }\n" +
            "}";

    private List<FunctionSource> functions;

    @BeforeEach
    void setUp() {
        functions = new JavaAstAdapter(new SourcePositionRegistry()).parse(CODE, "Orders.java");
    }

    @Test
    @DisplayName("All functions of a well-formed module are assembled")
    void testWholeModule() throws Exception {
        // Act
        ModuleAssemblyResult result = new ModulePipeline(new PipelineConfig(2, true, true, false)).run("Orders", functions);

        // Assert
        assertFalse(result.hasFailures());
        EnhancedModuleData module = result.getModule();
        assertEquals(5, module.getFunctions().size());
        assertTrue(module.getModuleLevelCpg().isPresent());
        assertEquals(3, module.getModuleLevelCpg().get().getEdges(CpgEdgeKind.CALLS).size());
    }

    @Test
    @DisplayName("A failing function is reported while its siblings are still built")
    void testFailureIsolation() throws Exception {
        // Arrange: g reads a name it never defines
        AstFactory f = new AstFactory(new SourcePositionRegistry(), "Mixed.java");
        List<FunctionSource> mixed = new ArrayList<>();
        mixed.add(new FunctionSource("Mixed.f(a)", "Mixed",
                f.function("Mixed", "f", List.of(f.parameter("a")), f.block(f.returnStmt(f.ref("a"))))));
        mixed.add(new FunctionSource("Mixed.g()", "Mixed",
                f.function("Mixed", "g", List.of(), f.block(f.returnStmt(f.ref("ghost"))))));

        // Act
        ModuleAssemblyResult result = new ModulePipeline(new PipelineConfig(2, true, true, false)).run("Mixed", mixed);

        // Assert
        assertEquals(1, result.getModule().getFunctions().size());
        assertTrue(result.getModule().getFunction("Mixed.f(a)").isPresent());
        assertEquals(1, result.getFailures().size());
        FunctionFailure failure = result.getFailures().get(0);
        assertEquals("Mixed.g()", failure.getQualifiedName());
        assertEquals("UnresolvedVariableReference", failure.getCategory());
    }

    @Test
    @DisplayName("The result does not depend on the number of workers")
    void testParallelEqualsSequential() throws Exception {
        ModuleAssemblyResult sequential = new ModulePipeline(new PipelineConfig(1, true, true, false)).run("Orders", functions);
        ModuleAssemblyResult parallel = new ModulePipeline(new PipelineConfig(4, true, true, false)).run("Orders", functions);

        assertEquals(sequential.getModule(), parallel.getModule());
    }

    @Test
    @DisplayName("Running twice on the same input gives equal records")
    void testIdempotent() throws Exception {
        ModulePipeline pipeline = new ModulePipeline(PipelineConfig.defaults());

        assertEquals(pipeline.run("Orders", functions).getModule(), pipeline.run("Orders", functions).getModule());
    }

    @Test
    @DisplayName("Duplicate qualified names are rejected before anything is built")
    void testDuplicateNames() {
        List<FunctionSource> twice = new ArrayList<>(functions);
        twice.add(functions.get(0));

        assertThrows(DuplicateFunctionNameException.class,
                () -> new ModulePipeline(PipelineConfig.defaults()).run("Orders", twice));
    }

    @Test
    @DisplayName("Settings switch off call resolution and the module graph")
    void testSettings() throws Exception {
        ModuleAssemblyResult result = new ModulePipeline(new PipelineConfig(1, false, false, false)).run("Orders", functions);

        assertFalse(result.getModule().getModuleLevelCpg().isPresent());
        result.getModule().getFunctions().values().forEach(fn ->
                assertTrue(fn.getCpg().getEdges(CpgEdgeKind.CALLS).isEmpty(), fn.getQualifiedName()));
    }

    @Test
    @DisplayName("Calls may resolve to functions of another module")
    void testExternalSymbols() throws Exception {
        // Arrange
        AstFactory f = new AstFactory(new SourcePositionRegistry(), "Client.java");
        FunctionSource client = new FunctionSource("Client.use()", "Client",
                f.function("Client", "use", List.of(), f.block(f.stmt(
                        f.call("flush", f.create(AstKind.TYPE_REF).name("Orders").text("Orders").build())))));
        SymbolTable external = SymbolTable.builder().add("Orders.flush()", "Orders", "flush", 0).build();

        // Act
        ModuleAssemblyResult result = new ModulePipeline(new PipelineConfig(1, true, true, false))
                .run("Client", List.of(client), external);

        // Assert
        assertEquals("Orders.flush()#c0", result.getModule().getFunction("Client.use()").orElseThrow()
                .getCpg().getEdges(CpgEdgeKind.CALLS).get(0).getTo());
    }
}
