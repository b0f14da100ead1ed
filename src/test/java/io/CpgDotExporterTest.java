package io;

import ast.SourcePositionId;
import cpg.CPGEdge;
import cpg.CPGNode;
import cpg.CodePropertyGraph;
import cpg.CpgEdgeKind;
import cpg.CpgOrigin;
import cpg.CpgRole;
import cpg.Span;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CpgDotExporterTest {

    private final CodePropertyGraph cpg = new CodePropertyGraph("A.f()", List.of(
            new CPGNode("A.f()#a0", CpgOrigin.AST, CpgRole.CALL, new SourcePositionId(1), "say(\"hi\")", new Span(2, 2)),
            new CPGNode("A.f()#c0", CpgOrigin.CFG, CpgRole.FUNCTION_ENTRY, new SourcePositionId(2), "entry: f", new Span(1, 3)),
            new CPGNode("A.say(String)#c0", CpgOrigin.SYNTHETIC, CpgRole.EXTERNAL_FUNCTION, null, "A.say(String)", null)),
            List.of(
                    new CPGEdge("A.f()#e0", "A.f()#a0", "A.say(String)#c0", CpgEdgeKind.CALLS, "A.say(String)"),
                    new CPGEdge("A.f()#e1", "A.f()#c0", "A.f()#c0", CpgEdgeKind.CONTROL_SUCCESSOR, "LOOP_BACK")));

    @Test
    void rendersNodesAndEdgesByKind() {
        // Act
        String dot = new CpgDotExporter().toDot(cpg);

        // Assert
        assertTrue(dot.startsWith("digraph \"A.f()\" {"));
        assertTrue(dot.contains("\"A.f()#a0\" [label=\"CALL\\nsay(\\\"hi\\\")\", shape=plaintext];"));
        assertTrue(dot.contains("shape=box"));
        assertTrue(dot.contains("shape=doubleoctagon"));
        assertTrue(dot.contains("\"A.f()#a0\" -> \"A.say(String)#c0\" [color=red, style=bold, label=\"A.say(String)\"];"));
        assertTrue(dot.contains("[label=\"LOOP_BACK\"]"));
        assertTrue(dot.trim().endsWith("}"));
    }

    @Test
    void writesFileCreatingParents(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("dot").resolve("A.f.dot");

        new CpgDotExporter().write(cpg, file);

        assertEquals(new CpgDotExporter().toDot(cpg), Files.readString(file));
    }
}
