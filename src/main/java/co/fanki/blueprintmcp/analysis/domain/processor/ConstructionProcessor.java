package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.graph.domain.GraphNode;

/**
 * Nodes creating or fetching an object: spawning actors, creating
 * widgets, constructing objects and getting subsystems. The call is
 * named after the node kind, the class to create is an argument.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ConstructionProcessor extends AbstractCallProcessor {

    @Override
    protected String functionName(final GraphNode node) {
        return node.kind().replace("K2Node_", "");
    }

}
