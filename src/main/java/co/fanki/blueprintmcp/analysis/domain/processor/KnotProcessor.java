package co.fanki.blueprintmcp.analysis.domain.processor;

import co.fanki.blueprintmcp.analysis.domain.AnalysisContext;
import co.fanki.blueprintmcp.analysis.domain.GraphAnalyzer;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessingResult;
import co.fanki.blueprintmcp.analysis.domain.NodeProcessor;
import co.fanki.blueprintmcp.analysis.domain.ast.Expression;
import co.fanki.blueprintmcp.analysis.domain.ast.UnsupportedExpression;
import co.fanki.blueprintmcp.graph.domain.GraphNode;
import co.fanki.blueprintmcp.graph.domain.GraphPin;

import java.util.List;

/**
 * Reroute nodes: both flow and data go straight through.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class KnotProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult processStatement(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node) {
        final List<GraphPin> outputs = node.execOutputs();
        return NodeProcessingResult.passThrough(
                outputs.isEmpty() ? null : outputs.get(0));
    }

    @Override
    public Expression processExpression(final GraphAnalyzer analyzer,
            final AnalysisContext context, final GraphNode node,
            final GraphPin output) {
        final List<GraphPin> inputs = node.dataInputs();
        if (inputs.isEmpty()) {
            return new UnsupportedExpression("reroute node without input",
                    node.kind(), context.locationOf(node));
        }
        return analyzer.resolveInput(context, node, inputs.get(0));
    }

}
