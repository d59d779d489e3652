package co.fanki.blueprintmcp.analysis.domain;

import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.VariableGetExpression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ScopeManager}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ScopeManagerTest {

    private ScopeManager scopes;

    @BeforeEach
    void setUp() {
        scopes = new ScopeManager();
    }

    private static Expression variable(final String name) {
        return new VariableGetExpression(name, false, null);
    }

    @Test
    void whenCreated_shouldHoldOnlyRootScope() {
        assertEquals(1, scopes.depth());
        assertTrue(scopes.lookupVariable("G:P").isEmpty());
    }

    @Test
    void whenLookingUp_givenBindingInOuterScope_shouldFindIt() {
        scopes.registerVariable("G:P", variable("outer"));
        scopes.enterScope();

        assertEquals(Optional.of(variable("outer")),
                scopes.lookupVariable("G:P"));
    }

    @Test
    void whenLookingUp_givenInnerBinding_shouldShadowOuter() {
        scopes.registerVariable("G:P", variable("outer"));
        scopes.enterScope();
        scopes.registerVariable("G:P", variable("inner"));

        assertEquals(variable("inner"),
                scopes.lookupVariable("G:P").orElseThrow());
    }

    @Test
    void whenLeavingScope_shouldDropItsBindings() {
        scopes.registerVariable("G:P", variable("outer"));
        scopes.enterScope();
        scopes.registerVariable("G:P", variable("inner"));
        scopes.registerVariable("G:Q", variable("element"));

        assertTrue(scopes.leaveScope());

        assertEquals(1, scopes.depth());
        assertEquals(variable("outer"),
                scopes.lookupVariable("G:P").orElseThrow());
        assertTrue(scopes.lookupVariable("G:Q").isEmpty());
    }

    @Test
    void whenLeavingScope_givenRootScope_shouldRefuse() {
        assertFalse(scopes.leaveScope());
        assertEquals(1, scopes.depth());
    }

    @Test
    void whenRegisteringAtDepth_shouldOutliveInnerScope() {
        scopes.enterScope();
        scopes.enterScope();
        scopes.registerVariable("G:P", variable("temp"), 2);

        assertEquals(2, scopes.depthOf("G:P"));
        scopes.leaveScope();
        assertEquals(variable("temp"),
                scopes.lookupVariable("G:P").orElseThrow());
        scopes.leaveScope();
        assertTrue(scopes.lookupVariable("G:P").isEmpty());
        assertEquals(0, scopes.depthOf("G:P"));
    }

    @Test
    void whenRegisteringAtDepth_givenClosedScope_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> scopes.registerVariable("G:P", variable("temp"), 2));
    }

    @Test
    void whenRegistering_givenNullExpression_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> scopes.registerVariable("G:P", null));
    }

}
