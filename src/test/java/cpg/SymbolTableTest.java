package cpg;

import ast.AstFactory;
import ast.AstKind;
import ast.AstNode;
import ast.SourcePositionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SymbolTableTest {

    private AstFactory f;
    private SymbolTable table;

    @BeforeEach
    void setUp() {
        f = new AstFactory(new SourcePositionRegistry(), "T.java");
        table = SymbolTable.builder()
                .add("Base.describe()", "Base", "describe", 0)
                .add("Child.describe()", "Child", "describe", 0)
                .add("Child.size(int)", "Child", "size", 1)
                .add("Child.size(String)", "Child", "size", 1)
                .add("Util.clamp(int,int,int)", "Util", "clamp", 3)
                .add("Outer.Inner.step(int)", "Outer.Inner", "step", 1)
                .build();
    }

    @Test
    void unqualifiedAndThisCallsResolveInCallerOwner() {
        AstNode plain = f.call("describe", null);
        AstNode onThis = f.call("describe", f.create(AstKind.EXPRESSION).text("this").build());

        assertEquals(Optional.of("Child.describe()"), table.resolve("Child", plain));
        assertEquals(Optional.of("Child.describe()"), table.resolve("Child", onThis));
        assertEquals(Optional.of("Base.describe()"), table.resolve("Base", plain));
    }

    @Test
    void superCallsResolveOutsideCallerOwner() {
        AstNode onSuper = f.call("describe", f.create(AstKind.EXPRESSION).text("super").build());

        assertEquals(Optional.of("Base.describe()"), table.resolve("Child", onSuper));
    }

    @Test
    void typeReceiverResolvesInThatOwner() {
        AstNode util = f.create(AstKind.TYPE_REF).name("Util").text("Util").build();
        AstNode call = f.call("clamp", util, f.literal("1"), f.literal("0"), f.literal("9"));
        AstNode inner = f.call("step", f.create(AstKind.TYPE_REF).name("Inner").text("Inner").build(), f.literal("1"));

        assertEquals(Optional.of("Util.clamp(int,int,int)"), table.resolve("Child", call));
        assertEquals(Optional.of("Outer.Inner.step(int)"), table.resolve("Child", inner));
    }

    @Test
    void ambiguousOverloadsAndVariableReceiversStayUnresolved() {
        AstNode overloaded = f.call("size", null, f.ref("n"));
        AstNode dynamic = f.call("describe", f.ref("other"));
        AstNode wrongArity = f.call("describe", null, f.literal("1"));

        assertFalse(table.resolve("Child", overloaded).isPresent());
        assertFalse(table.resolve("Child", dynamic).isPresent());
        assertFalse(table.resolve("Child", wrongArity).isPresent());
        assertFalse(SymbolTable.EMPTY.resolve("Child", f.call("describe", null)).isPresent());
    }

    @Test
    void entryIdsFollowTheIdScheme() {
        assertEquals(Optional.of("Child.size(int)#c0"), table.entryIdOf("Child.size(int)"));
        assertFalse(table.entryIdOf("Missing.m()").isPresent());
        assertEquals(6, table.size());
        assertTrue(table.contains("Base.describe()"));

        SymbolTable merged = SymbolTable.builder().addAll(table).add("Extra.run()", "Extra", "run", 0).build();
        assertEquals(7, merged.asMap().size());
        assertEquals(6, table.size());
    }
}
