package co.fanki.blueprintmcp.rendering.domain;

import co.fanki.blueprintmcp.shared.DomainException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for RenderStyle.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RenderStyleTest {

    @Test
    void whenParsing_givenAnyCase_shouldMatchStyle() {
        assertEquals(RenderStyle.VERBOSE, RenderStyle.fromText("Verbose"));
        assertEquals(RenderStyle.CONCISE, RenderStyle.fromText(" concise"));
    }

    @Test
    void whenParsing_givenUnknownStyle_shouldThrowDomainException() {
        assertThrows(DomainException.class,
                () -> RenderStyle.fromText("fancy"));
        assertThrows(DomainException.class,
                () -> RenderStyle.fromText(null));
    }

    @Test
    void whenReadingStyle_shouldExposeIndentAndDetail() {
        assertEquals("  ", RenderStyle.CONCISE.indent());
        assertFalse(RenderStyle.CONCISE.detailed());
        assertEquals("    ", RenderStyle.VERBOSE.indent());
        assertTrue(RenderStyle.VERBOSE.detailed());
    }

}
