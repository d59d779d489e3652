package co.fanki.blueprintmcp.analysis.domain;

import co.fanki.blueprintmcp.graph.domain.GraphNode;

/**
 * A processor selected by the shape of a node rather than its kind.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface PatternProcessor extends NodeProcessor {

    /**
     * Tells whether this processor recognizes the node.
     *
     * @param node the node
     * @return true when the node matches the pattern
     */
    boolean matches(GraphNode node);

}
