package co.fanki.blueprintmcp.rendering.domain;

import co.fanki.blueprintmcp.shared.Preconditions;
import co.fanki.blueprintmcp.widget.domain.WidgetNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a widget forest as a nested markdown list.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class WidgetTreeFormatter {

    /** Properties worth showing next to a widget, in display order. */
    private static final List<String> SHOWN_PROPERTIES = List.of(
            "Text", "Size", "SizeBoxWidth", "SizeBoxHeight", "ButtonText",
            "TextBorderPadding");

    private static final String UNREADABLE_TEXT = "[Localized Text]";

    private final RenderStyle style;
    private final boolean showProperties;

    /**
     * Creates a formatter.
     *
     * @param theStyle the render style, drives the indent
     * @param withProperties whether to list the shown properties
     */
    public WidgetTreeFormatter(final RenderStyle theStyle,
            final boolean withProperties) {
        style = Preconditions.requireNonNull(theStyle,
                "The render style cannot be null");
        showProperties = withProperties;
    }

    /**
     * Renders the hierarchy.
     *
     * @param roots the root widgets
     * @return the markdown text
     */
    public String format(final List<WidgetNode> roots) {
        final List<String> lines = new ArrayList<>();
        lines.add("# Widget Hierarchy");
        lines.add("");
        if (roots.isEmpty()) {
            lines.add("_No widgets found in this layout._");
        }
        for (final WidgetNode root : roots) {
            append(root, 0, lines);
        }
        return String.join("\n", lines) + "\n";
    }

    private void append(final WidgetNode node, final int depth,
            final List<String> lines) {
        final String indent = style.indent().repeat(depth);
        lines.add(indent + "- **" + node.name() + "** (" + node.type() + ")");
        if (showProperties) {
            for (final String key : SHOWN_PROPERTIES) {
                final String value = clean(node.properties().get(key));
                if (value != null && !value.isBlank()) {
                    lines.add(indent + style.indent() + "- " + key + ": `"
                            + value + "`");
                }
            }
        }
        for (final WidgetNode child : node.children()) {
            append(child, depth + 1, lines);
        }
    }

    private static String clean(final String value) {
        if (value == null || !LocalizedText.isLocalized(value)) {
            return value;
        }
        final String extracted = LocalizedText.extract(value);
        return extracted != null && !extracted.isBlank() ? extracted
                : UNREADABLE_TEXT;
    }

}
