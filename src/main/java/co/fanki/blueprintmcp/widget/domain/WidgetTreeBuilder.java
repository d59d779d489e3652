package co.fanki.blueprintmcp.widget.domain;

import co.fanki.blueprintmcp.parsing.domain.ObjectPath;
import co.fanki.blueprintmcp.parsing.domain.PropertyValue;
import co.fanki.blueprintmcp.parsing.domain.RawObject;
import co.fanki.blueprintmcp.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the widget hierarchy of a UI layout dump.
 *
 * <p>Widgets never reference their children directly: every parent to
 * child edge is a slot object whose {@code Parent} and {@code Content}
 * properties point at the two widgets. Roots are the widgets that are
 * no slot's content.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class WidgetTreeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(
            WidgetTreeBuilder.class);

    private static final String UMG_PACKAGE = "/Script/UMG.";

    /**
     * Builds the widget forest.
     *
     * @param roots the parsed root objects
     * @return the root widgets in text order
     */
    public List<WidgetNode> build(final List<RawObject> roots) {
        Preconditions.requireNonNull(roots, "The objects cannot be null");

        final List<RawObject> objects = RawObject.flatten(roots);
        final List<String[]> edges = new ArrayList<>();
        final Set<String> referenced = new HashSet<>();
        for (final RawObject object : objects) {
            if (!isSlot(object)) {
                continue;
            }
            final String parent = ObjectPath.objectName(
                    object.text("Parent"));
            final String content = ObjectPath.objectName(
                    object.text("Content"));
            if (parent != null && content != null) {
                edges.add(new String[] {parent, content, object.name()});
                referenced.add(parent);
                referenced.add(content);
            }
        }

        final Map<String, RawObject> widgets = new LinkedHashMap<>();
        for (final RawObject object : objects) {
            if (!isSlot(object) && isWidget(object, referenced)) {
                widgets.putIfAbsent(object.name(), object);
            }
        }

        edges.sort(Comparator.comparingInt(edge -> slotIndex(
                widgets.get(edge[0]), edge[2])));

        final Map<String, List<String>> children = new HashMap<>();
        final Set<String> hasParent = new HashSet<>();
        for (final String[] edge : edges) {
            if (!widgets.containsKey(edge[0])
                    || !widgets.containsKey(edge[1])) {
                LOG.debug("Slot {} -> {} points outside the layout", edge[0],
                        edge[1]);
                continue;
            }
            if (!hasParent.add(edge[1])) {
                LOG.warn("Widget '{}' has more than one parent, keeping the"
                        + " first", edge[1]);
                continue;
            }
            children.computeIfAbsent(edge[0], k -> new ArrayList<>())
                    .add(edge[1]);
        }

        final List<WidgetNode> forest = new ArrayList<>();
        for (final String name : widgets.keySet()) {
            if (!hasParent.contains(name)) {
                forest.add(node(name, widgets, children, new HashSet<>()));
            }
        }

        LOG.info("Built {} root widgets out of {} widgets", forest.size(),
                widgets.size());
        return forest;
    }

    private WidgetNode node(final String name,
            final Map<String, RawObject> widgets,
            final Map<String, List<String>> children,
            final Set<String> path) {
        path.add(name);
        final RawObject object = widgets.get(name);
        final List<WidgetNode> nested = new ArrayList<>();
        for (final String child : children.getOrDefault(name, List.of())) {
            if (path.contains(child)) {
                LOG.warn("Widget '{}' contains itself through '{}', cutting"
                        + " the cycle", child, name);
                continue;
            }
            nested.add(node(child, widgets, children, path));
        }
        path.remove(name);

        final Map<String, String> properties = new LinkedHashMap<>();
        for (final Map.Entry<String, PropertyValue> property
                : object.properties().entrySet()) {
            properties.put(property.getKey(), property.getValue().text());
        }
        return new WidgetNode(name, type(object), properties, nested);
    }

    /**
     * Returns the position of a slot in the {@code Slots(i)} list of its
     * parent; slots the parent does not list keep their text order after
     * the listed ones.
     */
    private static int slotIndex(final RawObject parent,
            final String slotName) {
        if (parent == null) {
            return Integer.MAX_VALUE;
        }
        final List<PropertyValue> slots = parent.indexed("Slots");
        for (int i = 0; i < slots.size(); i++) {
            if (slotName.equals(ObjectPath.objectName(slots.get(i).text()))) {
                return i;
            }
        }
        return Integer.MAX_VALUE;
    }

    private static String type(final RawObject object) {
        final String type = object.shortClassName();
        if (!type.isEmpty()) {
            return type;
        }
        return "Unknown";
    }

    private static boolean isSlot(final RawObject object) {
        final String type = object.classType();
        return type.contains("Slot") || type.contains("WidgetSlotPair");
    }

    private static boolean isWidget(final RawObject object,
            final Set<String> referenced) {
        if ("WidgetTree".equals(object.shortClassName())) {
            return false;
        }
        return referenced.contains(object.name())
                || object.classType().startsWith(UMG_PACKAGE);
    }

}
