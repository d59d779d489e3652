package co.fanki.blueprintmcp.widget.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One element of a UI layout.
 *
 * @param name the widget name, e.g. {@code Button_Play}
 * @param type the short class name, e.g. {@code Button}
 * @param properties the raw property text by key
 * @param children the nested widgets in slot order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record WidgetNode(String name, String type,
        Map<String, String> properties, List<WidgetNode> children) {

    public WidgetNode {
        properties = Collections.unmodifiableMap(
                new LinkedHashMap<>(properties));
        children = List.copyOf(children);
    }

    /**
     * Counts this widget and all of its descendants.
     *
     * @return the size of the subtree
     */
    public int size() {
        int size = 1;
        for (final WidgetNode child : children) {
            size += child.size();
        }
        return size;
    }

}
