package work.mcps.codegen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ScopeStackTest {

    @Test
    void childFramesSeeParentNamesButNotTheOtherWay() {
        var scope = new ScopeStack(List.of("print"));
        assertTrue(scope.declare("x"));

        scope.push();
        assertTrue(scope.isDeclared("x"));
        assertTrue(scope.declare("y"));
        assertFalse(scope.declare("x"));
        scope.pop();

        assertFalse(scope.isDeclared("y"));
        assertEquals(List.of("x"), scope.globalDeclarations());
    }

    @Test
    void seedNamesAreNotExported() {
        var scope = new ScopeStack(List.of("print"));

        assertFalse(scope.declare("print"));
        assertEquals(List.of(), scope.globalDeclarations());
    }

    @Test
    void globalFrameCannotBePopped() {
        var scope = new ScopeStack(List.of());

        assertThrows(IllegalStateException.class, scope::pop);
        assertEquals(1, scope.depth());
    }
}
