package co.fanki.blueprintmcp.analysis.domain;

import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.UnsupportedExpression;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;

/**
 * Turns one graph node into tree nodes.
 *
 * <p>A processor is invoked either in control flow context, where it
 * must produce a statement, or in data context, where it must produce
 * the value of one output pin. A processor that cannot honor a context
 * answers with the defaults below: a fallback statement, or an explicit
 * {@link UnsupportedExpression}. Returning null is a contract violation.
 * Processors hold no state; everything mutable lives in the
 * {@link AnalysisContext} they receive.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface NodeProcessor {

    /**
     * Processes a node reached through control flow.
     *
     * @param analyzer the analyzer, for resolving inputs and sub-chains
     * @param context the traversal state
     * @param node the node
     * @return the statement and how traversal continues, never null
     */
    default NodeProcessingResult processStatement(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        return analyzer.fallbackStatement(context, node);
    }

    /**
     * Produces the value of one output pin of a node.
     *
     * @param analyzer the analyzer, for resolving inputs
     * @param context the traversal state
     * @param node the node
     * @param output the output pin being read
     * @return the value, never null
     */
    default Expression processExpression(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node,
            final GraphPin output) {
        return new UnsupportedExpression("'" + output.pinName() + "' of "
                + node.kind() + " cannot be used as a value", node.kind(),
                context.locationOf(node));
    }

}
