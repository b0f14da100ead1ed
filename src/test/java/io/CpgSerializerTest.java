package io;

import assembly.EnhancedModuleData;
import ast.FunctionSource;
import ast.JavaAstAdapter;
import ast.SourcePositionRegistry;
import errors.CpgIoException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import pipeline.ModulePipeline;
import pipeline.PipelineConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CpgSerializerTest {

    private static final String CODE =
            "class Stack {\n" +
            "    int[] items = new int[8];\n" +
            "    int size;\n" +
            "    int drain(int limit) {\n" +
            "        int popped = 0;\n" +
            "        while (size > 0 && popped < limit) {\n" +
            "            pop();\n" +
            "            popped++;\n" +
            "        }\n" +
            "        return popped;\n" +
            "    }\n" +
            "    int pop() { size--; return items[size]; }\n" +
            "}";

    private CpgSerializer serializer;
    private EnhancedModuleData module;

    @BeforeEach
    void setUp() throws Exception {
        serializer = new CpgSerializer();
        List<FunctionSource> functions = new JavaAstAdapter(new SourcePositionRegistry()).parse(CODE, "Stack.java");
        module = new ModulePipeline(new PipelineConfig(1, true, true, false)).run("Stack", functions).getModule();
        module.getFunction("Stack.pop()").orElseThrow().getAnalysisResults().attach("taint", "none");
    }

    @Test
    @DisplayName("Writing then reading gives back an equal module record")
    void testFileRoundTrip(@TempDir Path tempDir) {
        // Arrange
        Path file = tempDir.resolve("nested").resolve("Stack.cpg.json");

        // Act
        serializer.write(module, file);
        EnhancedModuleData read = serializer.read(file);

        // Assert
        assertEquals(module, read);
        assertEquals("none", read.getFunction("Stack.pop()").orElseThrow()
                .getAnalysisResults().get("taint").orElseThrow().getAsString());
    }

    @Test
    @DisplayName("JSON uses snake_case names and textual position ids")
    void testJsonShape() {
        String json = new CpgSerializer(false).toJson(module);

        assertTrue(json.contains("\"module_name\":\"Stack\""));
        assertTrue(json.contains("\"qualified_name\":\"Stack.drain(int)\""));
        assertTrue(json.contains("\"source_position\":\"sp"));
        assertTrue(json.contains("\"module_level_cpg\":{"));
        assertEquals(module, serializer.fromJson(json));
    }

    @Test
    @DisplayName("Malformed input is reported as an I/O failure")
    void testMalformedJson(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "{\"module_name\": [1, 2");

        assertThrows(CpgIoException.class, () -> serializer.read(file));
        assertThrows(CpgIoException.class, () -> serializer.read(tempDir.resolve("missing.json")));
    }
}
