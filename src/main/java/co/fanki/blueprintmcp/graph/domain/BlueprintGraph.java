package co.fanki.blueprintmcp.graph.domain;

import co.fanki.blueprintmcp.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The typed graph of one blueprint: nodes in text order, their pins and
 * the resolved links between them.
 *
 * <p>Immutable and read only during analysis, so one graph may be
 * analyzed by several threads at once.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class BlueprintGraph {

    private final String graphName;
    private final Map<String, GraphNode> nodes;
    private final List<GraphNode> entryNodes;

    /**
     * Creates a graph.
     *
     * @param theGraphName the graph name
     * @param theNodes the nodes in text order
     * @param theEntryNodes the nodes starting an execution chain
     */
    public BlueprintGraph(final String theGraphName,
            final List<GraphNode> theNodes,
            final List<GraphNode> theEntryNodes) {
        graphName = Preconditions.requireNonBlank(theGraphName,
                "The graph name cannot be blank");
        final Map<String, GraphNode> index = new LinkedHashMap<>();
        for (final GraphNode node : theNodes) {
            index.put(node.guid(), node);
        }
        nodes = Collections.unmodifiableMap(index);
        entryNodes = List.copyOf(theEntryNodes);
    }

    public String graphName() {
        return graphName;
    }

    /** Nodes in text order. */
    public List<GraphNode> nodes() {
        return new ArrayList<>(nodes.values());
    }

    public List<GraphNode> entryNodes() {
        return entryNodes;
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Finds a node by guid.
     *
     * @param guid the node guid
     * @return the node, if present
     */
    public Optional<GraphNode> node(final String guid) {
        return Optional.ofNullable(nodes.get(guid));
    }

    /**
     * Resolves the pins linked to the given one, in link order.
     *
     * @param pin the pin
     * @return the remote node and pin of every link
     */
    public List<Connection> connections(final GraphPin pin) {
        final List<Connection> connections = new ArrayList<>();
        for (final PinReference link : pin.linkedTo()) {
            final GraphNode remote = nodes.get(link.nodeGuid());
            if (remote == null) {
                continue;
            }
            remote.pin(link.pinId()).ifPresent(remotePin ->
                    connections.add(new Connection(remote, remotePin)));
        }
        return connections;
    }

    /**
     * One end of a link.
     *
     * @param node the node owning the pin
     * @param pin the pin
     */
    public record Connection(GraphNode node, GraphPin pin) {

        /**
         * Returns the key identifying this pin across the graph.
         *
         * @return {@code nodeGuid:pinId}
         */
        public String key() {
            return node.guid() + ":" + pin.pinId();
        }
    }

}
