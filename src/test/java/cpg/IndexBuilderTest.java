package cpg;

import ast.SourcePositionId;
import errors.AmbiguousContainmentException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class IndexBuilderTest {

    private static final SourcePositionId CALL = new SourcePositionId(7);
    private static final SourcePositionId STMT = new SourcePositionId(8);

    @Test
    void indexesByPositionRoleAndContainment() throws Exception {
        // Arrange
        CodePropertyGraph cpg = new CodePropertyGraph("A.f()", List.of(
                node("A.f()#a0", CpgOrigin.AST, CpgRole.EXPRESSION_STATEMENT, STMT),
                node("A.f()#a1", CpgOrigin.AST, CpgRole.CALL, CALL),
                node("A.f()#c2", CpgOrigin.CFG, CpgRole.BASIC_BLOCK, STMT),
                node("A.f()#d0", CpgOrigin.DFG, CpgRole.VARIABLE_USE, CALL)),
                List.of(
                        new CPGEdge("A.f()#e0", "A.f()#a0", "A.f()#a1", CpgEdgeKind.PARENT_CHILD, null),
                        new CPGEdge("A.f()#e1", "A.f()#a0", "A.f()#c2", CpgEdgeKind.CONTAINS, null),
                        new CPGEdge("A.f()#e2", "A.f()#a1", "A.f()#d0", CpgEdgeKind.CONTAINS, null),
                        new CPGEdge("A.f()#e3", "A.f()#c2", "A.f()#c2", CpgEdgeKind.CONTROL_SUCCESSOR, "LOOP_BACK")));

        // Act
        NodeMappings mappings = new IndexBuilder().build(cpg);

        // Assert
        assertEquals(List.of("A.f()#a0", "A.f()#c2"), mappings.nodesAt(STMT));
        assertEquals(List.of("A.f()#a1", "A.f()#d0"), mappings.nodesAt(CALL));
        assertTrue(mappings.nodesAt(new SourcePositionId(99)).isEmpty());
        assertEquals(Set.of("A.f()#c2"), mappings.nodesWithRole(CpgRole.BASIC_BLOCK));
        assertTrue(mappings.nodesWithRole(CpgRole.PHI_MERGE).isEmpty());
        assertEquals("A.f()#a0", mappings.parentOf("A.f()#c2").orElseThrow());
        assertEquals("A.f()#a1", mappings.parentOf("A.f()#d0").orElseThrow());
        assertFalse(mappings.parentOf("A.f()#a0").isPresent());
        assertEquals(3, mappings.getContainment().size());
    }

    @Test
    void rejectsNodeWithTwoContainers() {
        // Arrange
        CodePropertyGraph cpg = new CodePropertyGraph("A.g()", List.of(
                node("A.g()#a0", CpgOrigin.AST, CpgRole.BLOCK, STMT),
                node("A.g()#a1", CpgOrigin.AST, CpgRole.CALL, CALL),
                node("A.g()#d0", CpgOrigin.DFG, CpgRole.VARIABLE_USE, CALL)),
                List.of(
                        new CPGEdge("A.g()#e0", "A.g()#a0", "A.g()#d0", CpgEdgeKind.CONTAINS, null),
                        new CPGEdge("A.g()#e1", "A.g()#a1", "A.g()#d0", CpgEdgeKind.CONTAINS, null)));

        // Act
        AmbiguousContainmentException error = assertThrows(AmbiguousContainmentException.class,
                () -> new IndexBuilder().build(cpg));

        // Assert
        assertEquals("A.g()#d0", error.getNodeId());
        assertEquals("A.g()", error.getSubject());
    }

    @Test
    void equalGraphsGiveEqualMappings() throws Exception {
        CodePropertyGraph cpg = new CodePropertyGraph("A.h()", List.of(
                node("A.h()#a0", CpgOrigin.AST, CpgRole.BLOCK, STMT)), List.of());

        assertEquals(new IndexBuilder().build(cpg), new IndexBuilder().build(cpg));
    }

    private static CPGNode node(String id, CpgOrigin origin, CpgRole role, SourcePositionId position) {
        return new CPGNode(id, origin, role, position, id, new Span(1, 1));
    }
}
