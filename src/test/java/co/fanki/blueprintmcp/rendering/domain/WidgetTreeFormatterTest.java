package co.fanki.blueprintmcp.rendering.domain;

import co.fanki.blueprintmcp.Fixtures;
import co.fanki.blueprintmcp.parsing.domain.RawObjectParser;
import co.fanki.blueprintmcp.widget.domain.WidgetNode;
import co.fanki.blueprintmcp.widget.domain.WidgetTreeBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link WidgetTreeFormatter}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class WidgetTreeFormatterTest {

    @Test
    void whenFormatting_givenMenuLayout_shouldRenderNestedList() {
        final List<WidgetNode> roots = new WidgetTreeBuilder().build(
                new RawObjectParser().parse(
                        Fixtures.load("main_menu_widgets.txt")));

        assertEquals("""
                # Widget Hierarchy

                - **RootCanvas** (CanvasPanel)
                  - **TitleText** (TextBlock)
                    - Text: `Door Simulator`
                  - **PlayButton** (Button)
                    - **PlayLabel** (TextBlock)
                      - Text: `Play`
                """, new WidgetTreeFormatter(RenderStyle.CONCISE, true)
                .format(roots));
    }

    @Test
    void whenFormatting_givenPropertiesDisabled_shouldOnlyListWidgets() {
        final WidgetNode label = new WidgetNode("Label", "TextBlock",
                Map.of("Text", "INVTEXT(\"Hi\")"), List.of());

        assertEquals("""
                # Widget Hierarchy

                - **Label** (TextBlock)
                """, new WidgetTreeFormatter(RenderStyle.CONCISE, false)
                .format(List.of(label)));
    }

    @Test
    void whenFormatting_givenUnreadableLocalizedText_shouldUsePlaceholder() {
        final WidgetNode label = new WidgetNode("Label", "TextBlock",
                Map.of("Text", "NSLOCTEXT(broken"), List.of());

        final String markdown = new WidgetTreeFormatter(RenderStyle.CONCISE,
                true).format(List.of(label));

        assertTrue(markdown.contains("  - Text: `[Localized Text]`"));
    }

    @Test
    void whenFormatting_givenVerboseStyle_shouldUseWiderIndent() {
        final WidgetNode child = new WidgetNode("Child", "Image", Map.of(),
                List.of());
        final WidgetNode root = new WidgetNode("Root", "Overlay", Map.of(),
                List.of(child));

        final String markdown = new WidgetTreeFormatter(RenderStyle.VERBOSE,
                true).format(List.of(root));

        assertTrue(markdown.contains("\n    - **Child** (Image)\n"));
        assertFalse(markdown.contains("Text:"));
    }

    @Test
    void whenFormatting_givenNoWidgets_shouldRenderPlaceholder() {
        assertEquals("""
                # Widget Hierarchy

                _No widgets found in this layout._
                """, new WidgetTreeFormatter(RenderStyle.CONCISE, true)
                .format(List.of()));
    }

}
