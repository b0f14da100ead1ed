package ast;

import com.github.javaparser.ParseProblemException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import sanalysis.CFGGenerator;
import sanalysis.ControlFlowGraph;
import sanalysis.DFGGenerator;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class JavaAstAdapterTest {

    private SourcePositionRegistry registry;
    private JavaAstAdapter adapter;

    @BeforeEach
    void setUp() {
        registry = new SourcePositionRegistry();
        adapter = new JavaAstAdapter(registry);
    }

    @Test
    @DisplayName("Methods and constructors get owner-qualified names with parameter types")
    void testQualifiedNames(@TempDir Path tempDir) throws Exception {
        // Arrange
        String code =
                "public class Outer {\n" +
                "    Outer(int seed) { }\n" +
                "    int add(int a, int b) { return a + b; }\n" +
                "    abstract static class Shape { abstract double area(); }\n" +
                "    static class Inner {\n" +
                "        void log(String... parts) { }\n" +
                "    }\n" +
                "}";
        Path file = tempDir.resolve("Outer.java");
        Files.writeString(file, code);

        // Act
        List<FunctionSource> functions = adapter.parse(file);

        // Assert
        List<String> names = functions.stream().map(FunctionSource::getQualifiedName).collect(Collectors.toList());
        assertEquals(List.of("Outer.<init>(int)", "Outer.add(int,int)", "Outer.Inner.log(String...)"), names);
        FunctionSource add = functions.get(1);
        assertEquals("Outer", add.getOwner());
        assertEquals("add", add.getSimpleName());
        assertEquals(2, add.getArity());
        assertEquals("Outer.Inner", functions.get(2).getOwner());
    }

    @Test
    @DisplayName("Locals become NAME_REFs, other simple names fields or types")
    void testNameClassification() {
        // Arrange
        String code =
                "class Counter {\n" +
                "    int count;\n" +
                "    int bump(int by) {\n" +
                "        int before = count;\n" +
                "        count = before + by;\n" +
                "        return Math.max(count, before);\n" +
                "    }\n" +
                "}";

        // Act
        AstNode fn = adapter.parse(code, "Counter.java").get(0).getAst();

        // Assert
        List<String> refs = fn.findAll(AstKind.NAME_REF).stream().map(AstNode::getName).collect(Collectors.toList());
        assertEquals(List.of("before", "by", "before"), refs);
        assertTrue(fn.findAll(AstKind.FIELD_REF).size() >= 2);
        assertEquals("Math", fn.findAll(AstKind.TYPE_REF).get(0).getName());
        // Assigning a field is not a variable definition
        assertTrue(fn.findAll(AstKind.ASSIGNMENT).isEmpty());
        assertEquals(1, fn.findAll(AstKind.VARIABLE_DECLARATION).size());
    }

    @Test
    @DisplayName("A local only shadows a field from its declaration to the end of its block")
    void testLocalsFollowLexicalScope() throws Exception {
        // Arrange
        String code =
                "class P {\n" +
                "    int value;\n" +
                "    int f() {\n" +
                "        int r = value;\n" +
                "        {\n" +
                "            int value = 2;\n" +
                "            r += value;\n" +
                "        }\n" +
                "        value = r;\n" +
                "        return r;\n" +
                "    }\n" +
                "}";

        // Act
        FunctionSource function = adapter.parse(code, "P.java").get(0);
        AstNode fn = function.getAst();

        // Assert
        List<String> refs = fn.findAll(AstKind.NAME_REF).stream().map(AstNode::getName).collect(Collectors.toList());
        assertEquals(List.of("value", "r", "r"), refs);
        List<Integer> fieldLines = fn.findAll(AstKind.FIELD_REF).stream()
                .filter(n -> "value".equals(n.getName())).map(AstNode::getStartLine).collect(Collectors.toList());
        assertEquals(List.of(4, 9), fieldLines);
        assertEquals(1, fn.findAll(AstKind.ASSIGNMENT).size());
        ControlFlowGraph cfg = new CFGGenerator().generate(function);
        assertDoesNotThrow(() -> new DFGGenerator().generate(function, cfg));
    }

    @Test
    @DisplayName("Increments and compound assignments of locals are assignments")
    void testAssignmentsOfLocals() {
        String code = "class L { void m() { int i = 0; i++; i += 2; --i; } }";

        AstNode fn = adapter.parse(code, "L.java").get(0).getAst();

        List<String> operators = fn.findAll(AstKind.ASSIGNMENT).stream()
                .map(a -> a.getAttribute("operator")).collect(Collectors.toList());
        assertEquals(3, operators.size());
        assertEquals("+=", operators.get(1));
    }

    @Test
    @DisplayName("Lambdas become one node holding the locals they capture")
    void testLambdaCapture() {
        // Arrange
        String code =
                "import java.util.function.Supplier;\n" +
                "class Lazy {\n" +
                "    Supplier<Integer> make(int base) {\n" +
                "        int offset = 2;\n" +
                "        return () -> { int local = 1; return base + offset + local; };\n" +
                "    }\n" +
                "}";

        // Act
        AstNode fn = adapter.parse(code, "Lazy.java").get(0).getAst();

        // Assert
        List<AstNode> lambdas = fn.findAll(AstKind.LAMBDA);
        assertEquals(1, lambdas.size());
        List<String> captured = lambdas.get(0).getChildren().stream().map(AstNode::getName).collect(Collectors.toList());
        assertEquals(List.of("base", "offset"), captured);
    }

    @Test
    @DisplayName("Members of anonymous classes and bodiless methods are skipped")
    void testSkippedCallables() {
        String code =
                "interface Task { void run(); }\n" +
                "class Host {\n" +
                "    Task make() {\n" +
                "        return new Task() { public void run() { } };\n" +
                "    }\n" +
                "}";

        List<FunctionSource> functions = adapter.parse(code, "Host.java");

        assertEquals(1, functions.size());
        assertEquals("Host.make()", functions.get(0).getQualifiedName());
    }

    @Test
    @DisplayName("Control structures map onto the language-neutral kinds")
    void testStatementLowering() {
        // Arrange
        String code =
                "class S {\n" +
                "    int m(int x) throws Exception {\n" +
                "        outer:\n" +
                "        for (int i = 0; i < x; i++) {\n" +
                "            switch (i) {\n" +
                "                case 1: continue outer;\n" +
                "                case 2: x++;\n" +
                "                default: break;\n" +
                "            }\n" +
                "        }\n" +
                "        try (java.io.StringReader r = new java.io.StringReader(\"a\")) {\n" +
                "            x = r.read();\n" +
                "        }\n" +
                "        do { x--; } while (x > 10);\n" +
                "        return x;\n" +
                "    }\n" +
                "}";

        // Act
        AstNode fn = adapter.parse(code, "S.java").get(0).getAst();

        // Assert
        assertEquals(1, fn.findAll(AstKind.LABELED).size());
        assertEquals(1, fn.findAll(AstKind.FOR).size());
        assertEquals(3, fn.findAll(AstKind.CASE).size());
        assertEquals(1, fn.findAll(AstKind.DO_WHILE).size());
        assertTrue(fn.findAll(AstKind.TRY).isEmpty(), "try-with-resources without handlers is a plain block");
        assertEquals("outer", fn.findAll(AstKind.CONTINUE).get(0).getName());
    }

    @Test
    @DisplayName("Every lowered node has a live, distinct source position")
    void testSourcePositions() {
        String code = "class P {\n  int m(int a) {\n    return a * 2;\n  }\n}";

        AstNode fn = adapter.parse(code, "P.java").get(0).getAst();

        List<AstNode> all = fn.preorder();
        assertEquals(all.size(), all.stream().map(AstNode::getId).distinct().count());
        for (AstNode node : all) {
            assertTrue(registry.isLive(node.getId()));
        }
        AstNode ret = fn.findAll(AstKind.RETURN).get(0);
        SourcePosition position = registry.resolve(ret.getId()).orElseThrow();
        assertEquals("P.java", position.getPath());
        assertEquals(3, position.getBeginLine());
    }

    @Test
    void testParseErrorIsReported() {
        assertThrows(ParseProblemException.class, () -> adapter.parse("class Broken { void m( { }", "Broken.java"));
    }
}
