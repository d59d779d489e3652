package co.fanki.blueprintmcp.graph.domain;

import co.fanki.blueprintmcp.parsing.domain.ObjectPath;
import co.fanki.blueprintmcp.parsing.domain.PropertyValue;
import co.fanki.blueprintmcp.parsing.domain.RawObject;
import co.fanki.blueprintmcp.shared.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the generic object tree into a {@link BlueprintGraph}.
 *
 * <p>Building happens in two passes. The first indexes every graph node
 * by name and reads its pins; the second resolves {@code LinkedTo}
 * references through that index, so links only ever point at pins that
 * exist. Unresolvable links are dropped and flagged on their pin, links
 * joining two pins of the same direction are dropped and recorded as a
 * diagnostic on both nodes. The resulting links are symmetric.</p>
 *
 * <p>On duplicate node names the first occurrence wins.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphBuilder.class);

    /** Default name when no asset path is found in the dump. */
    public static final String DEFAULT_GRAPH_NAME = "EventGraph";

    /** Captures the asset name of the first {@code /Game/} path. */
    private static final Pattern ASSET_PATH = Pattern.compile(
            "/Game/(?:[^'\"\\s,()]*/)?([^/.'\"\\s,()]+)\\.");

    private static final Set<String> TEXT_CATEGORIES = Set.of(
            "string", "name", "text");

    /**
     * Builds the graph.
     *
     * @param roots the parsed root objects
     * @return the graph, never null
     */
    public BlueprintGraph build(final List<RawObject> roots) {
        Preconditions.requireNonNull(roots, "The objects cannot be null");

        final List<RawObject> objects = RawObject.flatten(roots);
        final Map<String, NodeDraft> drafts = index(objects);
        resolveLinks(drafts);

        final List<GraphNode> nodes = new ArrayList<>();
        for (final NodeDraft draft : drafts.values()) {
            nodes.add(draft.toNode());
        }

        final String graphName = graphName(objects);
        final List<GraphNode> entries = entryNodes(nodes);
        LOG.info("Built graph '{}' with {} nodes and {} entry nodes",
                graphName, nodes.size(), entries.size());
        return new BlueprintGraph(graphName, nodes, entries);
    }

    // -- First pass: nodes and pins ---------------------------------------

    private Map<String, NodeDraft> index(final List<RawObject> objects) {
        final Map<String, NodeDraft> byName = new LinkedHashMap<>();
        final Set<String> guids = new HashSet<>();
        int generated = 0;

        for (final RawObject object : objects) {
            if (!NodeKinds.isGraphNode(object.shortClassName())) {
                continue;
            }
            if (byName.containsKey(object.name())) {
                LOG.warn("Duplicate node name '{}', keeping the first"
                        + " occurrence", object.name());
                continue;
            }

            String guid = object.text("NodeGuid");
            if (guid == null || guid.isBlank()) {
                generated++;
                guid = String.format("TEMP-%08x", generated);
            }
            if (!guids.add(guid)) {
                LOG.warn("Duplicate node guid {} on '{}', keeping the first"
                        + " occurrence", guid, object.name());
                continue;
            }

            byName.put(object.name(), readNode(object, guid));
        }
        return byName;
    }

    private NodeDraft readNode(final RawObject object, final String guid) {
        final NodeDraft draft = new NodeDraft(guid, object);
        int unnamed = 0;
        for (final RawObject child : object.children()) {
            if (!child.shortClassName().contains("Pin")) {
                continue;
            }
            String pinId = child.text("PinId");
            if (pinId == null || pinId.isBlank()) {
                unnamed++;
                pinId = guid + "-PIN-" + unnamed;
            }
            draft.pins.put(pinId, readPin(child, pinId));
        }
        return draft;
    }

    private PinDraft readPin(final RawObject pin, final String pinId) {
        final String category = pin.text("PinType.PinCategory");
        final PinDraft draft = new PinDraft(new GraphPin(
                pinId,
                pin.text("PinName") != null ? pin.text("PinName")
                        : pin.name(),
                pin.text("PinFriendlyName"),
                PinDirection.fromText(pin.text("Direction")),
                category,
                blankToNull(pin.text("PinType.PinSubCategory")),
                ObjectPath.objectName(pin.text("PinType.PinSubCategoryObject")),
                blankToNull(pin.text("PinType.ContainerType")),
                "True".equalsIgnoreCase(pin.text("bHidden")),
                defaultValue(pin, category),
                List.of(),
                false));

        final PropertyValue linkedTo = pin.property("LinkedTo");
        if (linkedTo != null) {
            for (final PropertyValue link : linkedTo.items()) {
                final String[] parts = link.text().trim().split("\\s+");
                if (parts.length == 2) {
                    draft.declared.add(new String[] {parts[0], parts[1]});
                } else {
                    draft.dangling = true;
                    LOG.warn("Unreadable link '{}' on pin {}", link.text(),
                            pinId);
                }
            }
        }
        return draft;
    }

    private static String defaultValue(final RawObject pin,
            final String category) {
        final String object = ObjectPath.unwrap(pin.text("DefaultObject"));
        if (object != null) {
            return object;
        }
        final String value = pin.text("DefaultValue");
        if (value != null && (!value.isEmpty()
                || TEXT_CATEGORIES.contains(category))) {
            return value;
        }
        final String text = pin.text("DefaultTextValue");
        return text == null || text.isEmpty() ? null : text;
    }

    // -- Second pass: links -----------------------------------------------

    private void resolveLinks(final Map<String, NodeDraft> drafts) {
        final List<PinReference[]> accepted = new ArrayList<>();

        for (final NodeDraft node : drafts.values()) {
            for (final PinDraft pin : node.pins.values()) {
                for (final String[] declared : pin.declared) {
                    final NodeDraft remote = drafts.get(declared[0]);
                    final PinDraft remotePin = remote == null ? null
                            : remote.pins.get(declared[1]);
                    if (remotePin == null) {
                        pin.dangling = true;
                        LOG.warn("Dangling link from {}.{} to {} {}",
                                node.name(), pin.pin.pinName(), declared[0],
                                declared[1]);
                        continue;
                    }
                    if (remotePin.pin.direction() == pin.pin.direction()) {
                        final String local = node.name() + "."
                                + pin.pin.pinName();
                        final String other = remote.name() + "."
                                + remotePin.pin.pinName();
                        final boolean ordered = local.compareTo(other) <= 0;
                        final String diagnostic = String.format(
                                "link %s -> %s ignored: both pins are %ss",
                                ordered ? local : other,
                                ordered ? other : local,
                                pin.pin.direction().name()
                                        .toLowerCase(Locale.ROOT));
                        node.diagnostics.add(diagnostic);
                        remote.diagnostics.add(diagnostic);
                        LOG.warn("Contradictory link: {}", diagnostic);
                        continue;
                    }
                    final PinReference target = new PinReference(
                            remote.guid, declared[1]);
                    pin.links.add(target);
                    accepted.add(new PinReference[] {
                        target, new PinReference(node.guid, pin.pin.pinId())
                    });
                }
            }
        }

        // Mirror after all declared links so declared order is kept.
        final Map<String, NodeDraft> byGuid = new HashMap<>();
        for (final NodeDraft draft : drafts.values()) {
            byGuid.put(draft.guid, draft);
        }
        for (final PinReference[] link : accepted) {
            byGuid.get(link[0].nodeGuid()).pins.get(link[0].pinId())
                    .links.add(link[1]);
        }
    }

    // -- Graph level ------------------------------------------------------

    private static List<GraphNode> entryNodes(final List<GraphNode> nodes) {
        final List<GraphNode> events = new ArrayList<>();
        final List<GraphNode> chainRoots = new ArrayList<>();

        for (final GraphNode node : nodes) {
            final boolean inbound = node.execInputs().stream()
                    .anyMatch(GraphPin::linked);
            if (inbound) {
                continue;
            }
            if (NodeKinds.isEntryKind(node.kind())) {
                events.add(node);
            } else if (node.execOutputs().stream()
                    .anyMatch(GraphPin::linked)) {
                chainRoots.add(node);
            }
        }

        if (events.isEmpty() && !chainRoots.isEmpty()) {
            LOG.info("No event nodes found, using {} chain roots as entries",
                    chainRoots.size());
            return chainRoots;
        }
        return events;
    }

    private static String graphName(final List<RawObject> objects) {
        for (final RawObject object : objects) {
            for (final PropertyValue value : object.properties().values()) {
                final Matcher matcher = ASSET_PATH.matcher(value.raw());
                if (matcher.find()) {
                    return matcher.group(1) + " " + DEFAULT_GRAPH_NAME;
                }
            }
        }
        return DEFAULT_GRAPH_NAME;
    }

    private static String blankToNull(final String text) {
        return text == null || text.isBlank() ? null : text;
    }

    /** A node being assembled. */
    private static final class NodeDraft {

        private final String guid;
        private final RawObject source;
        private final Map<String, PinDraft> pins = new LinkedHashMap<>();
        private final Set<String> diagnostics = new LinkedHashSet<>();

        NodeDraft(final String theGuid, final RawObject theSource) {
            guid = theGuid;
            source = theSource;
        }

        String name() {
            return source.name();
        }

        GraphNode toNode() {
            final Map<String, PropertyValue> properties =
                    new LinkedHashMap<>(source.properties());
            final List<GraphPin> built = new ArrayList<>();
            for (final PinDraft pin : pins.values()) {
                built.add(pin.pin.withLinks(new ArrayList<>(pin.links),
                        pin.dangling && pin.links.isEmpty()));
            }
            return new GraphNode(guid, source.name(), source.classType(),
                    properties, built, new ArrayList<>(diagnostics));
        }
    }

    /** A pin being assembled. */
    private static final class PinDraft {

        private final GraphPin pin;
        private final List<String[]> declared = new ArrayList<>();
        private final Set<PinReference> links = new LinkedHashSet<>();
        private boolean dangling;

        PinDraft(final GraphPin thePin) {
            pin = thePin;
        }
    }

}
