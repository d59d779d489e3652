package co.fanki.blueprintmcp.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for Preconditions utility.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PreconditionsTest {

    @Test
    void whenRequireNonNull_givenNonNullValue_shouldReturnValue() {
        final String value = "test";

        final String result = Preconditions.requireNonNull(value, "message");

        assertEquals(value, result);
    }

    @Test
    void whenRequireNonNull_givenNullValue_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonNull(null, "Value is null"));
    }

    @Test
    void whenRequireNonBlank_givenBlankString_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank("  ", "String is blank"));
    }

    @Test
    void whenRequireNonBlank_givenNullString_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requireNonBlank(null, "String is null"));
    }

    @Test
    void whenRequire_givenTrueCondition_shouldNotThrow() {
        Preconditions.require(true, "Should not throw");
    }

    @Test
    void whenRequire_givenFalseCondition_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.require(false, "Condition is false"));
    }

    @Test
    void whenRequireInput_givenFalseCondition_shouldCarryErrorCode() {
        final DomainException ex = assertThrows(DomainException.class,
                () -> Preconditions.requireInput(false, "Bad dump",
                        DomainException.INVALID_INPUT));

        assertEquals("Bad dump", ex.getMessage());
        assertEquals(DomainException.INVALID_INPUT, ex.getErrorCode());
    }

    @Test
    void whenRequireInput_givenTrueCondition_shouldNotThrow() {
        Preconditions.requireInput(true, "Bad dump",
                DomainException.INVALID_INPUT);
    }

    @Test
    void whenRequirePositive_givenPositiveValue_shouldReturnValue() {
        final int result = Preconditions.requirePositive(5, "message");

        assertEquals(5, result);
    }

    @Test
    void whenRequirePositive_givenZero_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> Preconditions.requirePositive(0, "Not positive"));
    }

}
